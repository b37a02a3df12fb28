package com.phillippitts.grillstats.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Caffeine-backed store for a single namespace with a fixed TTL and an upper bound on entries.
 *
 * <p>Each value carries its own {@code expiresAt}; the {@link Expiry} reads it, so a plain write
 * restarts the TTL while a counter update keeps the window opened by its first increment.
 * Time comes from the injected {@link Clock} through a {@link Ticker}.
 */
final class TtlMap {

    private final CacheNamespace namespace;
    private final Duration ttl;
    private final Clock clock;
    private final Cache<String, CacheEntry> entries;

    TtlMap(CacheNamespace namespace, Duration ttl, int maxEntries, Clock clock) {
        this.namespace = namespace;
        this.ttl = ttl;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry())
                .ticker(() -> epochNanos(clock.instant()))
                // maintenance runs on the calling thread
                .executor(Runnable::run)
                .build();
    }

    Duration ttl() {
        return ttl;
    }

    void put(String key, Object value) {
        entries.put(key, new CacheEntry(namespace, key, value, clock.instant().plus(ttl)));
    }

    Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    boolean remove(String key) {
        CacheEntry removed = entries.asMap().remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    /**
     * Increments a counter that lives for one TTL from its first increment. Later increments
     * keep the original expiry, so the window is fixed.
     */
    long increment(String key) {
        Instant now = clock.instant();
        CacheEntry updated = entries.asMap().compute(key, (k, current) -> {
            if (current == null || current.isExpired(now) || !(current.value() instanceof Long count)) {
                return new CacheEntry(namespace, k, 1L, now.plus(ttl));
            }
            return new CacheEntry(namespace, k, count + 1, current.expiresAt());
        });
        return (Long) updated.value();
    }

    /**
     * Runs pending Caffeine maintenance, which drops expired entries.
     *
     * @return number of entries removed
     */
    int sweep() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        return (int) Math.max(0, before - entries.estimatedSize());
    }

    int size() {
        return (int) entries.estimatedSize();
    }

    void clear() {
        entries.invalidateAll();
        entries.cleanUp();
    }

    private static long epochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long remaining(CacheEntry entry, long currentTime) {
            return Math.max(0L, epochNanos(entry.expiresAt()) - currentTime);
        }
    }
}
