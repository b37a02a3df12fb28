package com.phillippitts.grillstats.domain;

/**
 * Lifecycle of an alert instance. Only {@code FIRING} and {@code RESOLVED} are ever emitted to
 * subscribers and notification channels.
 */
public enum AlertState {
    PENDING,
    FIRING,
    RESOLVED
}
