package com.phillippitts.grillstats.service.profile;

import com.phillippitts.grillstats.domain.ProbeType;
import com.phillippitts.grillstats.exception.ProfileNotFoundException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup over the profile catalogue, including matching a profile to a probe by name.
 */
@Component
public class ProfileLibrary {

    // Order matters: more specific phrases first.
    private static final Map<String, CookingProfile> FOOD_KEYWORDS = new LinkedHashMap<>();
    private static final List<String> AMBIENT_WORDS = List.of("ambient", "pit", "grill", "smoker", "air", "oven");

    static {
        FOOD_KEYWORDS.put("brisket", CookingProfiles.BRISKET_SMOKING);
        FOOD_KEYWORDS.put("steak", CookingProfiles.STEAK_GRILLING);
        FOOD_KEYWORDS.put("pork shoulder", CookingProfiles.PORK_SHOULDER_SMOKING);
        FOOD_KEYWORDS.put("pulled pork", CookingProfiles.PORK_SHOULDER_SMOKING);
        FOOD_KEYWORDS.put("butt", CookingProfiles.PORK_SHOULDER_SMOKING);
        FOOD_KEYWORDS.put("ribs", CookingProfiles.PORK_RIBS_SMOKING);
        FOOD_KEYWORDS.put("chicken breast", CookingProfiles.CHICKEN_BREAST_GRILLING);
        FOOD_KEYWORDS.put("whole chicken", CookingProfiles.CHICKEN_WHOLE_ROASTING);
        FOOD_KEYWORDS.put("chicken whole", CookingProfiles.CHICKEN_WHOLE_ROASTING);
        FOOD_KEYWORDS.put("fish", CookingProfiles.FISH_GRILLING);
        FOOD_KEYWORDS.put("salmon", CookingProfiles.FISH_GRILLING);
        FOOD_KEYWORDS.put("turkey", CookingProfiles.TURKEY_WHOLE_ROASTING);
    }

    private final Map<String, CookingProfile> byId = new LinkedHashMap<>();

    public ProfileLibrary() {
        for (CookingProfile profile : CookingProfiles.ALL) {
            byId.put(profile.id(), profile);
        }
    }

    public List<CookingProfile> profiles() {
        return List.copyOf(byId.values());
    }

    /**
     * Looks a profile up by id.
     *
     * @throws ProfileNotFoundException if no profile has that id
     */
    public CookingProfile get(String profileId) {
        CookingProfile profile = profileId == null ? null : byId.get(profileId);
        if (profile == null) {
            throw new ProfileNotFoundException(profileId);
        }
        return profile;
    }

    /**
     * Picks a profile for a probe from its display name and type.
     *
     * <p>Food probes match meat keywords ("Brisket Internal" selects brisket), then fall back
     * on generic words (beef, pork, chicken, food, meat). Ambient and surface probes, and food
     * probes named like a pit, select the pit profile implied by the name: "smoker" selects the smoker
     * pit, "grill" the grill pit, "oven" the oven; anything else the smoker pit.
     *
     * @param probeName probe display name
     * @param probeType probe type
     * @return the matching profile, empty when the name gives nothing to go on
     */
    public Optional<CookingProfile> matchByProbeName(String probeName, ProbeType probeType) {
        String name = probeName == null ? "" : probeName.toLowerCase(Locale.ROOT);
        if (probeType != ProbeType.FOOD) {
            return Optional.of(pitFor(name));
        }
        Optional<CookingProfile> food = matchFood(name);
        if (food.isPresent()) {
            return food;
        }
        return AMBIENT_WORDS.stream().anyMatch(name::contains) ? Optional.of(pitFor(name)) : Optional.empty();
    }

    private static Optional<CookingProfile> matchFood(String name) {
        for (Map.Entry<String, CookingProfile> e : FOOD_KEYWORDS.entrySet()) {
            if (name.contains(e.getKey())) {
                return Optional.of(e.getValue());
            }
        }
        if (name.contains("beef")) {
            return Optional.of(name.contains("roast") ? CookingProfiles.BRISKET_SMOKING : CookingProfiles.STEAK_GRILLING);
        }
        if (name.contains("pork")) {
            return Optional.of(CookingProfiles.PORK_SHOULDER_SMOKING);
        }
        if (name.contains("chicken")) {
            return Optional.of(CookingProfiles.CHICKEN_BREAST_GRILLING);
        }
        if (name.contains("food") || name.contains("meat")) {
            return Optional.of(CookingProfiles.STEAK_GRILLING);
        }
        return Optional.empty();
    }

    private static CookingProfile pitFor(String name) {
        if (name.contains("oven")) {
            return CookingProfiles.OVEN;
        }
        if (name.contains("grill") && !name.contains("smoker")) {
            return CookingProfiles.GRILL_PIT;
        }
        return CookingProfiles.SMOKER_PIT;
    }
}
