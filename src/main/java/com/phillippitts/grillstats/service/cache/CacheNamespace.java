package com.phillippitts.grillstats.service.cache;

/**
 * Isolated key spaces of the {@link TieredCache}. Each namespace has its own TTL and capacity,
 * configured under {@code grill.cache.<key>}.
 */
public enum CacheNamespace {
    /** Validated bearer tokens, long lived, removed explicitly on logout. */
    SESSION_TOKENS("session-tokens"),
    /** Most recent reading per channel, refreshed on every poll. */
    LIVE_READINGS("live-readings"),
    /** Battery, signal and connectivity per device. */
    DEVICE_STATUS("device-status"),
    /** Read-through copy of device registry entries. */
    DEVICE_METADATA("device-metadata"),
    /** Recent min/max/avg per channel. */
    ROLLUPS("rollups"),
    /** Fixed-window counters; the TTL is the window. */
    RATE_LIMITS("rate-limits"),
    /** One entry per live stream subscription, refreshed by every successful send. */
    SUBSCRIBERS("subscribers");

    private final String key;

    CacheNamespace(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
