package com.phillippitts.grillstats.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Window and cadence of min/max/avg rollups.
 */
@Validated
@ConfigurationProperties(prefix = "grill.rollup")
public class RollupProperties {

    /** Readings older than this are excluded from a rollup. */
    @NotNull
    private Duration window = Duration.ofMinutes(10);

    /** Rollup refresh period in milliseconds; slower than the poll cadence. */
    @Positive(message = "Refresh interval must be positive")
    private long refreshIntervalMs = 30_000;

    /** Hard cap on samples kept per channel regardless of the window. */
    @Positive(message = "Max samples must be positive")
    private int maxSamplesPerChannel = 1_000;

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public long getRefreshIntervalMs() {
        return refreshIntervalMs;
    }

    public void setRefreshIntervalMs(long refreshIntervalMs) {
        this.refreshIntervalMs = refreshIntervalMs;
    }

    public int getMaxSamplesPerChannel() {
        return maxSamplesPerChannel;
    }

    public void setMaxSamplesPerChannel(int maxSamplesPerChannel) {
        this.maxSamplesPerChannel = maxSamplesPerChannel;
    }
}
