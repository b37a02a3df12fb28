package com.phillippitts.grillstats.service.profile;

import java.time.Duration;
import java.util.Objects;

/**
 * One segment of a cooking profile.
 *
 * <p>The session moves its base temperature toward {@code targetTemperature} at a rate drawn
 * once from {@code [minRate, maxRate]} (degrees F per minute) when the phase starts. The phase
 * ends once it has run for at least {@code minDuration} and either the base temperature is
 * within epsilon of the target ({@code exitOnTarget} only) or {@code maxDuration} has passed.
 *
 * @param name phase name, for example {@code stall}
 * @param targetTemperature temperature the phase approaches, degrees F
 * @param minRate lower bound of the approach rate, degrees F per minute
 * @param maxRate upper bound of the approach rate, degrees F per minute
 * @param minDuration shortest time spent in the phase
 * @param maxDuration longest time spent in the phase
 * @param noiseAmplitude half-width of the uniform per-tick noise, degrees F
 * @param exitOnTarget whether reaching the target ends the phase early
 * @param stall whether the phase models an evaporative plateau
 */
public record Phase(
        String name,
        double targetTemperature,
        double minRate,
        double maxRate,
        Duration minDuration,
        Duration maxDuration,
        double noiseAmplitude,
        boolean exitOnTarget,
        boolean stall
) {

    public Phase {
        Objects.requireNonNull(name, "Phase name must not be null");
        Objects.requireNonNull(minDuration, "Min duration must not be null");
        Objects.requireNonNull(maxDuration, "Max duration must not be null");
        if (minRate < 0 || maxRate < minRate) {
            throw new IllegalArgumentException("Invalid rate bounds for phase " + name + ": " + minRate + ".." + maxRate);
        }
        if (minDuration.isNegative() || maxDuration.compareTo(minDuration) < 0) {
            throw new IllegalArgumentException("Invalid duration bounds for phase " + name);
        }
        if (noiseAmplitude < 0) {
            throw new IllegalArgumentException("Noise amplitude must not be negative for phase " + name);
        }
    }

    static Phase rise(String name, double target, double minRate, double maxRate,
                      int minMinutes, int maxMinutes, double noise) {
        return new Phase(name, target, minRate, maxRate,
                Duration.ofMinutes(minMinutes), Duration.ofMinutes(maxMinutes), noise, true, false);
    }

    static Phase stall(String name, double plateau, double minRate, double maxRate,
                       int minMinutes, int maxMinutes, double noise) {
        return new Phase(name, plateau, minRate, maxRate,
                Duration.ofMinutes(minMinutes), Duration.ofMinutes(maxMinutes), noise, true, true);
    }

    static Phase hold(String name, double target, double minRate, double maxRate,
                      int minMinutes, int maxMinutes, double noise) {
        return new Phase(name, target, minRate, maxRate,
                Duration.ofMinutes(minMinutes), Duration.ofMinutes(maxMinutes), noise, false, false);
    }
}
