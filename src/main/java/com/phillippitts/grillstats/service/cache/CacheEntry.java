package com.phillippitts.grillstats.service.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * A value held in one cache namespace until {@code expiresAt}.
 *
 * <p>An entry read at or after {@code expiresAt} is a miss.
 */
public record CacheEntry(CacheNamespace namespace, String key, Object value, Instant expiresAt) {

    public CacheEntry {
        Objects.requireNonNull(namespace, "Namespace must not be null");
        Objects.requireNonNull(key, "Key must not be null");
        Objects.requireNonNull(value, "Value must not be null");
        Objects.requireNonNull(expiresAt, "Expiry must not be null");
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
