package com.phillippitts.grillstats.exception;

/**
 * Thrown when a cooking session references a profile the library does not know.
 * This is a configuration error raised at session creation, never at advance time.
 */
public class ProfileNotFoundException extends GrillStatsException {

    private final String profileId;

    public ProfileNotFoundException(String profileId) {
        super("Unknown cooking profile: " + profileId);
        this.profileId = profileId;
    }

    public String getProfileId() {
        return profileId;
    }
}
