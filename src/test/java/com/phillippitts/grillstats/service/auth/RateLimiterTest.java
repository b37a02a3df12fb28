package com.phillippitts.grillstats.service.auth;

import com.phillippitts.grillstats.config.properties.CacheProperties;
import com.phillippitts.grillstats.exception.RateLimitExceededException;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T12:00:00Z");
        limiter = new RateLimiter(new TieredCache(new CacheProperties(), clock));
    }

    @Test
    void allowsUpToLimitWithinWindow() {
        for (int i = 0; i < 3; i++) {
            limiter.acquire("subscribe:alice", 3);
        }

        assertThatThrownBy(() -> limiter.acquire("subscribe:alice", 3))
                .isInstanceOf(RateLimitExceededException.class);
    }

    @Test
    void keysAreCountedSeparately() {
        limiter.acquire("subscribe:alice", 1);

        assertThatCode(() -> limiter.acquire("subscribe:bob", 1)).doesNotThrowAnyException();
    }

    @Test
    void windowResetsAfterTtl() {
        limiter.acquire("subscribe:alice", 1);
        assertThatThrownBy(() -> limiter.acquire("subscribe:alice", 1))
                .isInstanceOf(RateLimitExceededException.class);

        clock.advance(Duration.ofMinutes(1).plusSeconds(1));

        assertThatCode(() -> limiter.acquire("subscribe:alice", 1)).doesNotThrowAnyException();
    }
}
