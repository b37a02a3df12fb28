package com.phillippitts.grillstats.service.session;

import com.phillippitts.grillstats.exception.InvalidEventException;

import java.time.Duration;
import java.util.Random;
import java.util.Set;

/**
 * A queued perturbation. It activates on the first tick whose phase is in {@code phases}
 * (any phase when empty) and then contributes {@code sign * magnitude} to the reading,
 * decaying linearly to zero over {@code decay}.
 *
 * @param type event type
 * @param magnitude peak effect in degrees F, positive
 * @param decay time for the effect to fade out
 * @param phases phase names the event may start in; empty for any
 */
public record CookingEvent(EventType type, double magnitude, Duration decay, Set<String> phases) {

    public CookingEvent {
        if (type == null) {
            throw new InvalidEventException("Event type must not be null");
        }
        if (!(magnitude > 0) || Double.isInfinite(magnitude)) {
            throw new InvalidEventException("Event magnitude must be positive, got: " + magnitude);
        }
        if (decay == null || decay.isZero() || decay.isNegative()) {
            throw new InvalidEventException("Event decay must be positive");
        }
        phases = phases == null ? Set.of() : Set.copyOf(phases);
    }

    public boolean allowedIn(String phaseName) {
        return phases.isEmpty() || phases.contains(phaseName);
    }

    /**
     * Draws an event of the given type with magnitude and decay inside the type's default ranges.
     */
    public static CookingEvent random(EventType type, Random random) {
        double magnitude = type.minMagnitude() + random.nextDouble() * (type.maxMagnitude() - type.minMagnitude());
        long minMs = type.minDecay().toMillis();
        long maxMs = type.maxDecay().toMillis();
        long decayMs = minMs + (long) (random.nextDouble() * (maxMs - minMs));
        return new CookingEvent(type, magnitude, Duration.ofMillis(Math.max(1, decayMs)), Set.of());
    }
}
