package com.phillippitts.grillstats.config.properties;

import com.phillippitts.grillstats.service.cache.CacheNamespace;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * TTL and capacity for each cache namespace.
 *
 * <p>Every namespace is configured independently under {@code grill.cache.<namespace>.*}:
 * <pre>
 * grill.cache.live-readings.ttl=30s
 * grill.cache.live-readings.max-entries=10000
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "grill.cache")
public class CacheProperties {

    /** Period of the background sweep that evicts expired entries, in milliseconds. */
    @Positive(message = "Sweep interval must be positive")
    private long sweepIntervalMs = 5_000;

    @Valid
    private NamespaceProperties sessionTokens = new NamespaceProperties(Duration.ofHours(8), 10_000);
    @Valid
    private NamespaceProperties liveReadings = new NamespaceProperties(Duration.ofSeconds(30), 10_000);
    @Valid
    private NamespaceProperties deviceStatus = new NamespaceProperties(Duration.ofMinutes(1), 1_000);
    @Valid
    private NamespaceProperties deviceMetadata = new NamespaceProperties(Duration.ofMinutes(10), 1_000);
    @Valid
    private NamespaceProperties rollups = new NamespaceProperties(Duration.ofMinutes(5), 10_000);
    @Valid
    private NamespaceProperties rateLimits = new NamespaceProperties(Duration.ofMinutes(1), 50_000);
    @Valid
    private NamespaceProperties subscribers = new NamespaceProperties(Duration.ofMinutes(2), 10_000);

    /**
     * Returns the settings of one namespace.
     *
     * @param namespace cache namespace
     * @return TTL and capacity of that namespace
     */
    public NamespaceProperties forNamespace(CacheNamespace namespace) {
        return switch (namespace) {
            case SESSION_TOKENS -> sessionTokens;
            case LIVE_READINGS -> liveReadings;
            case DEVICE_STATUS -> deviceStatus;
            case DEVICE_METADATA -> deviceMetadata;
            case ROLLUPS -> rollups;
            case RATE_LIMITS -> rateLimits;
            case SUBSCRIBERS -> subscribers;
        };
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public NamespaceProperties getSessionTokens() {
        return sessionTokens;
    }

    public void setSessionTokens(NamespaceProperties sessionTokens) {
        this.sessionTokens = sessionTokens;
    }

    public NamespaceProperties getLiveReadings() {
        return liveReadings;
    }

    public void setLiveReadings(NamespaceProperties liveReadings) {
        this.liveReadings = liveReadings;
    }

    public NamespaceProperties getDeviceStatus() {
        return deviceStatus;
    }

    public void setDeviceStatus(NamespaceProperties deviceStatus) {
        this.deviceStatus = deviceStatus;
    }

    public NamespaceProperties getDeviceMetadata() {
        return deviceMetadata;
    }

    public void setDeviceMetadata(NamespaceProperties deviceMetadata) {
        this.deviceMetadata = deviceMetadata;
    }

    public NamespaceProperties getRollups() {
        return rollups;
    }

    public void setRollups(NamespaceProperties rollups) {
        this.rollups = rollups;
    }

    public NamespaceProperties getRateLimits() {
        return rateLimits;
    }

    public void setRateLimits(NamespaceProperties rateLimits) {
        this.rateLimits = rateLimits;
    }

    public NamespaceProperties getSubscribers() {
        return subscribers;
    }

    public void setSubscribers(NamespaceProperties subscribers) {
        this.subscribers = subscribers;
    }

    /**
     * Settings of a single namespace.
     */
    public static class NamespaceProperties {

        /** Time to live of an entry, measured from its last write. */
        @NotNull
        private Duration ttl;

        /** Upper bound on entries; Caffeine's size policy evicts on overflow. */
        @Positive(message = "Max entries must be positive")
        private int maxEntries;

        public NamespaceProperties() {
            this(Duration.ofMinutes(1), 1_000);
        }

        public NamespaceProperties(Duration ttl, int maxEntries) {
            this.ttl = ttl;
            this.maxEntries = maxEntries;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }
}
