package com.phillippitts.grillstats.domain;

/**
 * Connectivity of a device as seen by the dashboard.
 *
 * <p>{@code DEGRADED} means the source could not be polled (timeout, malformed payload) and the
 * last known values are being served; {@code OFFLINE} means the device itself reported no link.
 */
public enum ConnectionStatus {
    ONLINE,
    DEGRADED,
    OFFLINE
}
