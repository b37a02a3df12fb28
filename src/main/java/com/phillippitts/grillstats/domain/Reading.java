package com.phillippitts.grillstats.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable temperature sample; the unit of data flowing through the pipeline.
 *
 * @param deviceId    device that produced the sample
 * @param channelId   channel within the device
 * @param timestamp   production time of the sample
 * @param temperature temperature expressed in {@code unit}
 * @param unit        unit of {@code temperature}
 */
public record Reading(
        String deviceId,
        String channelId,
        Instant timestamp,
        double temperature,
        TemperatureUnit unit
) {

    public Reading {
        Objects.requireNonNull(deviceId, "Device id must not be null");
        Objects.requireNonNull(channelId, "Channel id must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(unit, "Unit must not be null");
        if (Double.isNaN(temperature) || Double.isInfinite(temperature)) {
            throw new IllegalArgumentException("Temperature must be finite, got: " + temperature);
        }
    }

    /** Cache key shared by every namespace keyed per channel. */
    public String channelKey() {
        return channelKey(deviceId, channelId);
    }

    public static String channelKey(String deviceId, String channelId) {
        return deviceId + ":" + channelId;
    }
}
