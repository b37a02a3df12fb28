package com.phillippitts.grillstats.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Current cached state of one device as pushed to dashboard clients.
 *
 * <p>Serialized as {@code {deviceId, timestamp, channels:[{channelId, temperature, unit,
 * connected}], status:{battery, signal, connectionStatus}, alerts:[...]}}.
 */
public record DeviceSnapshot(
        String deviceId,
        Instant timestamp,
        List<ChannelSnapshot> channels,
        StatusSnapshot status,
        List<AlertTransition> alerts
) {

    public DeviceSnapshot {
        Objects.requireNonNull(deviceId, "Device id must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        channels = channels == null ? List.of() : List.copyOf(channels);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        Objects.requireNonNull(status, "Status must not be null");
    }

    /**
     * @param channelId   channel identifier
     * @param temperature latest live temperature, {@code null} when no live reading is cached
     * @param unit        unit symbol of the channel
     * @param connected   whether a live reading exists and the device is online
     * @param readingAt   timestamp of the live reading, {@code null} when absent
     */
    public record ChannelSnapshot(
            String channelId,
            Double temperature,
            String unit,
            boolean connected,
            Instant readingAt
    ) {}

    /**
     * @param battery          battery percent or {@code null}
     * @param signal           signal percent or {@code null}
     * @param connectionStatus connectivity as last observed
     */
    public record StatusSnapshot(Integer battery, Integer signal, ConnectionStatus connectionStatus) {}
}
