package com.phillippitts.grillstats.service.profile;

import com.phillippitts.grillstats.domain.ProbeType;

import java.util.List;
import java.util.Objects;

/**
 * Immutable template of cooking behavior for one meat and method, or for a pit.
 *
 * @param id stable identifier, for example {@code beef_brisket_smoking}
 * @param description human readable summary
 * @param method cooking method
 * @param probeType kind of probe the profile is meant for
 * @param phases ordered phases, at least one
 */
public record CookingProfile(
        String id,
        String description,
        CookingMethod method,
        ProbeType probeType,
        List<Phase> phases
) {

    public CookingProfile {
        Objects.requireNonNull(id, "Profile id must not be null");
        Objects.requireNonNull(method, "Cooking method must not be null");
        Objects.requireNonNull(probeType, "Probe type must not be null");
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("Profile " + id + " must have at least one phase");
        }
        phases = List.copyOf(phases);
    }

    public Phase phase(int index) {
        return phases.get(index);
    }

    public int phaseCount() {
        return phases.size();
    }
}
