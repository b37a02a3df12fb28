package com.phillippitts.grillstats.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Battery, signal and connectivity snapshot of a device.
 *
 * @param deviceId         device the status belongs to
 * @param batteryPercent   battery level 0..100, or {@code null} when unknown
 * @param signalPercent    signal quality 0..100, or {@code null} when unknown
 * @param connectionStatus connectivity for the tick that produced this status
 * @param lastSeen         last instant the device answered a poll, or {@code null} if never
 */
public record DeviceStatus(
        String deviceId,
        Integer batteryPercent,
        Integer signalPercent,
        ConnectionStatus connectionStatus,
        Instant lastSeen
) {

    public DeviceStatus {
        Objects.requireNonNull(deviceId, "Device id must not be null");
        Objects.requireNonNull(connectionStatus, "Connection status must not be null");
        if (batteryPercent != null && (batteryPercent < 0 || batteryPercent > 100)) {
            throw new IllegalArgumentException("Battery percent must be between 0 and 100, got: " + batteryPercent);
        }
        if (signalPercent != null && (signalPercent < 0 || signalPercent > 100)) {
            throw new IllegalArgumentException("Signal percent must be between 0 and 100, got: " + signalPercent);
        }
    }

    /** Status used when nothing is known about a device yet. */
    public static DeviceStatus unknown(String deviceId, ConnectionStatus connectionStatus) {
        return new DeviceStatus(deviceId, null, null, connectionStatus, null);
    }

    public DeviceStatus withConnectionStatus(ConnectionStatus status) {
        return new DeviceStatus(deviceId, batteryPercent, signalPercent, status, lastSeen);
    }

    public boolean isOnline() {
        return connectionStatus == ConnectionStatus.ONLINE;
    }
}
