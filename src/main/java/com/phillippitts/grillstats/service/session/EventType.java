package com.phillippitts.grillstats.service.session;

import com.phillippitts.grillstats.domain.ProbeType;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of one-shot perturbation a cooking session can experience.
 *
 * <p>Each type carries the direction of its effect, the probe types it can reach and default
 * ranges for magnitude (degrees F) and decay time, used when an event is injected at random or
 * without explicit values.
 */
public enum EventType {
    LID_OPEN(-1, EnumSet.allOf(ProbeType.class), 5.0, 25.0, Duration.ofMinutes(2), Duration.ofMinutes(6)),
    FUEL_ADD(1, EnumSet.of(ProbeType.AMBIENT, ProbeType.SURFACE), 5.0, 15.0, Duration.ofMinutes(5), Duration.ofMinutes(15)),
    PROBE_FLIP(-1, EnumSet.of(ProbeType.FOOD), 1.0, 4.0, Duration.ofSeconds(30), Duration.ofMinutes(2)),
    BASTING(-1, EnumSet.of(ProbeType.FOOD), 2.0, 5.0, Duration.ofMinutes(1), Duration.ofMinutes(3));

    private final int sign;
    private final Set<ProbeType> probeTypes;
    private final double minMagnitude;
    private final double maxMagnitude;
    private final Duration minDecay;
    private final Duration maxDecay;

    EventType(int sign, Set<ProbeType> probeTypes, double minMagnitude, double maxMagnitude,
              Duration minDecay, Duration maxDecay) {
        this.sign = sign;
        this.probeTypes = probeTypes;
        this.minMagnitude = minMagnitude;
        this.maxMagnitude = maxMagnitude;
        this.minDecay = minDecay;
        this.maxDecay = maxDecay;
    }

    /** +1 when the event raises the reading, -1 when it lowers it. */
    public int sign() {
        return sign;
    }

    public boolean appliesTo(ProbeType probeType) {
        return probeTypes.contains(probeType);
    }

    public double minMagnitude() {
        return minMagnitude;
    }

    public double maxMagnitude() {
        return maxMagnitude;
    }

    public Duration minDecay() {
        return minDecay;
    }

    public Duration maxDecay() {
        return maxDecay;
    }
}
