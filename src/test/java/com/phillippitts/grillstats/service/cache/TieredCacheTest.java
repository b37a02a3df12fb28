package com.phillippitts.grillstats.service.cache;

import com.phillippitts.grillstats.config.properties.CacheProperties;
import com.phillippitts.grillstats.exception.CacheUnavailableException;
import com.phillippitts.grillstats.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TieredCacheTest {

    private MutableClock clock;
    private CacheProperties props;
    private TieredCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T12:00:00Z");
        props = new CacheProperties();
        props.getLiveReadings().setTtl(Duration.ofSeconds(30));
        props.getDeviceStatus().setTtl(Duration.ofMinutes(5));
        props.getRateLimits().setTtl(Duration.ofMinutes(1));
        cache = new TieredCache(props, clock);
    }

    @Test
    void returnsValueWithinTtl() {
        cache.set(CacheNamespace.LIVE_READINGS, "smoker-1:probe-1", "value");
        clock.advance(Duration.ofSeconds(29));

        assertThat(cache.get(CacheNamespace.LIVE_READINGS, "smoker-1:probe-1", String.class)).hasValue("value");
    }

    @Test
    void expiredEntryIsMissAtExactlyTtl() {
        cache.set(CacheNamespace.LIVE_READINGS, "smoker-1:probe-1", "value");
        clock.advance(Duration.ofSeconds(30));

        assertThat(cache.get(CacheNamespace.LIVE_READINGS, "smoker-1:probe-1", String.class)).isEmpty();
    }

    @Test
    void rewriteRestartsTtl() {
        cache.set(CacheNamespace.LIVE_READINGS, "k", "v1");
        clock.advance(Duration.ofSeconds(20));
        cache.set(CacheNamespace.LIVE_READINGS, "k", "v2");
        clock.advance(Duration.ofSeconds(20));

        assertThat(cache.get(CacheNamespace.LIVE_READINGS, "k", String.class)).hasValue("v2");
    }

    @Test
    void namespacesAreIsolated() {
        cache.set(CacheNamespace.LIVE_READINGS, "smoker-1", "reading");
        cache.set(CacheNamespace.DEVICE_STATUS, "smoker-1", "status");

        cache.invalidate(CacheNamespace.LIVE_READINGS, "smoker-1");
        clock.advance(Duration.ofMinutes(1));

        assertThat(cache.get(CacheNamespace.LIVE_READINGS, "smoker-1", String.class)).isEmpty();
        assertThat(cache.get(CacheNamespace.DEVICE_STATUS, "smoker-1", String.class)).hasValue("status");
    }

    @Test
    void wrongTypeIsMiss() {
        cache.set(CacheNamespace.DEVICE_STATUS, "smoker-1", "status");

        assertThat(cache.get(CacheNamespace.DEVICE_STATUS, "smoker-1", Integer.class)).isEmpty();
    }

    @Test
    void sweepRemovesExpiredEntriesNobodyReads() {
        cache.set(CacheNamespace.LIVE_READINGS, "a", "1");
        cache.set(CacheNamespace.LIVE_READINGS, "b", "2");
        cache.set(CacheNamespace.DEVICE_STATUS, "c", "3");
        clock.advance(Duration.ofSeconds(40));

        assertThat(cache.sweep()).isEqualTo(2);
        assertThat(cache.size(CacheNamespace.LIVE_READINGS)).isZero();
        assertThat(cache.size(CacheNamespace.DEVICE_STATUS)).isEqualTo(1);
    }

    @Test
    void incrementUsesFixedWindow() {
        assertThat(cache.increment(CacheNamespace.RATE_LIMITS, "subscribe:alice")).isEqualTo(1);
        clock.advance(Duration.ofSeconds(40));
        assertThat(cache.increment(CacheNamespace.RATE_LIMITS, "subscribe:alice")).isEqualTo(2);
        clock.advance(Duration.ofSeconds(20));

        // Window opened by the first increment has ended
        assertThat(cache.increment(CacheNamespace.RATE_LIMITS, "subscribe:alice")).isEqualTo(1);
    }

    @Test
    void overflowKeepsNamespaceWithinMaxEntries() {
        props.getSubscribers().setMaxEntries(2);
        TieredCache small = new TieredCache(props, clock);
        small.set(CacheNamespace.SUBSCRIBERS, "first", "1");
        small.set(CacheNamespace.SUBSCRIBERS, "second", "2");
        small.set(CacheNamespace.SUBSCRIBERS, "third", "3");
        small.sweep();

        assertThat(small.size(CacheNamespace.SUBSCRIBERS)).isEqualTo(2);
        assertThat(small.size(CacheNamespace.LIVE_READINGS)).isZero();
    }

    @Test
    void counterUpdatesDoNotExtendWindowButPlainWritesDo() {
        cache.increment(CacheNamespace.RATE_LIMITS, "subscribe:bob");
        cache.set(CacheNamespace.RATE_LIMITS, "marker", "x");
        clock.advance(Duration.ofSeconds(50));
        cache.increment(CacheNamespace.RATE_LIMITS, "subscribe:bob");
        cache.set(CacheNamespace.RATE_LIMITS, "marker", "y");
        clock.advance(Duration.ofSeconds(10));

        assertThat(cache.contains(CacheNamespace.RATE_LIMITS, "subscribe:bob")).isFalse();
        assertThat(cache.get(CacheNamespace.RATE_LIMITS, "marker", String.class)).hasValue("y");
    }

    @Test
    void expiredEntryIsNotReportedAsInvalidated() {
        cache.set(CacheNamespace.SESSION_TOKENS, "token", "alice");
        clock.advance(props.getSessionTokens().getTtl());

        assertThat(cache.invalidate(CacheNamespace.SESSION_TOKENS, "token")).isFalse();
    }

    @Test
    void invalidateReportsWhetherLiveEntryExisted() {
        cache.set(CacheNamespace.SESSION_TOKENS, "token", "alice");

        assertThat(cache.invalidate(CacheNamespace.SESSION_TOKENS, "token")).isTrue();
        assertThat(cache.invalidate(CacheNamespace.SESSION_TOKENS, "token")).isFalse();
    }

    @Test
    void closedCacheFailsEveryOperation() {
        cache.set(CacheNamespace.LIVE_READINGS, "k", "v");

        cache.close();

        assertThat(cache.isAvailable()).isFalse();
        assertThatThrownBy(() -> cache.get(CacheNamespace.LIVE_READINGS, "k", String.class))
                .isInstanceOf(CacheUnavailableException.class)
                .hasMessageContaining("live-readings");
        assertThatThrownBy(() -> cache.set(CacheNamespace.LIVE_READINGS, "k", "v"))
                .isInstanceOf(CacheUnavailableException.class);
        assertThat(cache.sweep()).isZero();
    }
}
