package com.phillippitts.grillstats.domain;

/**
 * Condition an alert rule watches.
 *
 * <p>Temperature kinds are evaluated against readings:
 * <ul>
 *   <li>{@code HIGH}: above the threshold</li>
 *   <li>{@code LOW}: below the threshold</li>
 *   <li>{@code TARGET}: at or above the threshold</li>
 *   <li>{@code RANGE}: outside {@code [threshold, upperThreshold]}</li>
 *   <li>{@code RISING}/{@code FALLING}: changed by at least the threshold since the channel's
 *       previous reading</li>
 * </ul>
 * {@code DISCONNECT} and {@code BATTERY} are evaluated against device status.
 */
public enum AlertKind {
    HIGH(false),
    LOW(false),
    TARGET(false),
    RANGE(false),
    RISING(false),
    FALLING(false),
    DISCONNECT(true),
    BATTERY(true);

    private final boolean statusBased;

    AlertKind(boolean statusBased) {
        this.statusBased = statusBased;
    }

    public boolean isStatusBased() {
        return statusBased;
    }

    /** True for kinds that compare a reading against the channel's previous reading. */
    public boolean isRateBased() {
        return this == RISING || this == FALLING;
    }
}
