package com.phillippitts.grillstats.service.cache;

import com.phillippitts.grillstats.config.properties.CacheProperties;
import com.phillippitts.grillstats.exception.CacheUnavailableException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The single shared store for "current" values of the telemetry pipeline.
 *
 * <p>Each {@link CacheNamespace} is backed by its own Caffeine cache (see {@link TtlMap}), so TTL,
 * capacity and eviction in one namespace never touch another. Every write sets the expiry to
 * {@code now + ttl}. Expired entries are misses on read and are removed by a periodic
 * {@code cleanUp()}, which bounds staleness to one sweep interval even for keys nobody reads.
 *
 * <p>After {@link #close()} every operation throws {@link CacheUnavailableException}; callers
 * treat that as "no live data" for the current tick.
 */
@Component
public class TieredCache {

    private static final Logger LOG = LogManager.getLogger(TieredCache.class);

    private final Map<CacheNamespace, TtlMap> namespaces = new EnumMap<>(CacheNamespace.class);
    private volatile boolean closed;

    public TieredCache(CacheProperties properties, Clock clock) {
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(clock, "clock");
        for (CacheNamespace ns : CacheNamespace.values()) {
            CacheProperties.NamespaceProperties p = properties.forNamespace(ns);
            namespaces.put(ns, new TtlMap(ns, p.getTtl(), p.getMaxEntries(), clock));
            LOG.debug("Cache namespace {} ttl={} maxEntries={}", ns.key(), p.getTtl(), p.getMaxEntries());
        }
    }

    /**
     * Stores a value, replacing any previous value and restarting its TTL.
     *
     * @param namespace target namespace
     * @param key key within the namespace
     * @param value value to store, never null
     * @throws CacheUnavailableException if the cache is closed
     */
    public void set(CacheNamespace namespace, String key, Object value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        map(namespace).put(key, value);
    }

    /**
     * Reads a live value.
     *
     * @return the value, or empty when absent, expired or of another type
     * @throws CacheUnavailableException if the cache is closed
     */
    public <T> Optional<T> get(CacheNamespace namespace, String key, Class<T> type) {
        return map(namespace).get(key)
                .map(CacheEntry::value)
                .filter(type::isInstance)
                .map(type::cast);
    }

    /** Returns the full entry, including its expiry. */
    public Optional<CacheEntry> entry(CacheNamespace namespace, String key) {
        return map(namespace).get(key);
    }

    public boolean contains(CacheNamespace namespace, String key) {
        return map(namespace).get(key).isPresent();
    }

    /**
     * Removes a key.
     *
     * @return true if a live entry was removed
     */
    public boolean invalidate(CacheNamespace namespace, String key) {
        return map(namespace).remove(key);
    }

    /**
     * Increments a fixed-window counter. The first increment creates the counter with value 1
     * and the namespace TTL; the whole counter expires at once when the window ends.
     *
     * @return the counter value after incrementing
     */
    public long increment(CacheNamespace namespace, String key) {
        Objects.requireNonNull(key, "key");
        return map(namespace).increment(key);
    }

    public Duration ttl(CacheNamespace namespace) {
        return map(namespace).ttl();
    }

    /** Estimated number of entries held, including expired ones not yet swept. */
    public int size(CacheNamespace namespace) {
        return map(namespace).size();
    }

    /**
     * Evicts expired entries in every namespace.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedDelayString = "${grill.cache.sweep-interval-ms:5000}")
    public int sweep() {
        if (closed) {
            return 0;
        }
        int total = 0;
        for (Map.Entry<CacheNamespace, TtlMap> e : namespaces.entrySet()) {
            int removed = e.getValue().sweep();
            if (removed > 0) {
                LOG.debug("Swept {} expired entries from {}", removed, e.getKey().key());
            }
            total += removed;
        }
        return total;
    }

    public boolean isAvailable() {
        return !closed;
    }

    @PreDestroy
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        namespaces.values().forEach(TtlMap::clear);
        LOG.info("Tiered cache closed");
    }

    private TtlMap map(CacheNamespace namespace) {
        Objects.requireNonNull(namespace, "namespace");
        if (closed) {
            throw new CacheUnavailableException(namespace, "Cache is closed");
        }
        return namespaces.get(namespace);
    }
}
