package com.phillippitts.grillstats.service.auth;

import com.phillippitts.grillstats.exception.RateLimitExceededException;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Fixed-window rate limiter over {@link CacheNamespace#RATE_LIMITS}. The window length is the
 * namespace TTL; the counter expires as a whole when the window ends.
 */
@Component
public class RateLimiter {

    private static final Logger LOG = LogManager.getLogger(RateLimiter.class);

    private final TieredCache cache;

    public RateLimiter(TieredCache cache) {
        this.cache = cache;
    }

    /**
     * Counts one attempt against {@code key}.
     *
     * @throws RateLimitExceededException once more than {@code limit} attempts fall in the window
     */
    public void acquire(String key, int limit) {
        long count = cache.increment(CacheNamespace.RATE_LIMITS, key);
        if (count > limit) {
            LOG.warn("Rate limit hit for {} ({} > {})", key, count, limit);
            throw new RateLimitExceededException(key, limit);
        }
    }
}
