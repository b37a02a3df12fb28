package com.phillippitts.grillstats.service.stream;

import java.time.Instant;
import java.util.Objects;

/**
 * One message queued for a subscriber.
 *
 * @param sequence per-device sequence number, increasing in production order
 * @param type message kind
 * @param deviceId device the update belongs to
 * @param timestamp when the update was produced
 * @param payload JSON-serializable body, null for heartbeats
 */
public record StreamUpdate(long sequence, UpdateType type, String deviceId, Instant timestamp, Object payload) {

    public StreamUpdate {
        Objects.requireNonNull(type, "Update type must not be null");
        Objects.requireNonNull(deviceId, "Device id must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
    }
}
