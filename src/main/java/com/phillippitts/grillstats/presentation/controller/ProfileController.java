package com.phillippitts.grillstats.presentation.controller;

import com.phillippitts.grillstats.service.profile.CookingProfile;
import com.phillippitts.grillstats.service.profile.ProfileLibrary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Read-only view of the cooking profile catalogue. */
@RestController
@RequestMapping("/api/profiles")
class ProfileController {

    private final ProfileLibrary profiles;

    ProfileController(ProfileLibrary profiles) {
        this.profiles = profiles;
    }

    @GetMapping
    List<CookingProfile> list() {
        return profiles.profiles();
    }

    @GetMapping("/{profileId}")
    CookingProfile get(@PathVariable String profileId) {
        return profiles.get(profileId);
    }
}
