package com.phillippitts.grillstats.domain;

import java.time.Instant;

/**
 * Aggregate over the recent readings of one channel.
 */
public record Rollup(
        String deviceId,
        String channelId,
        double min,
        double max,
        double average,
        int count,
        TemperatureUnit unit,
        Instant windowStart,
        Instant windowEnd
) {}
