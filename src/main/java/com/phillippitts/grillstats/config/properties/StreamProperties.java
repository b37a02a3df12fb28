package com.phillippitts.grillstats.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the dashboard stream dispatcher.
 */
@Validated
@ConfigurationProperties(prefix = "grill.stream")
public class StreamProperties {

    /** Updates buffered per subscriber before the oldest is dropped. */
    @Positive(message = "Buffer capacity must be positive")
    private int bufferCapacity = 64;

    /** Period of heartbeats sent to every subscriber, in milliseconds. */
    @Positive(message = "Heartbeat interval must be positive")
    private long heartbeatIntervalMs = 15_000;

    /** Period of the stale-subscription reaper, in milliseconds. */
    @Positive(message = "Reap interval must be positive")
    private long reapIntervalMs = 30_000;

    /** Lifetime of an SSE connection before the client must reconnect. */
    @NotNull
    private Duration emitterTimeout = Duration.ofMinutes(30);

    /** Subscribe attempts allowed per client within one rate-limit window. */
    @Positive(message = "Subscribe limit must be positive")
    private int subscribeLimit = 20;

    /** When true, subscribers must present a bearer token known to the session-token store. */
    private boolean requireAuth = false;

    public int getBufferCapacity() {
        return bufferCapacity;
    }

    public void setBufferCapacity(int bufferCapacity) {
        this.bufferCapacity = bufferCapacity;
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public long getReapIntervalMs() {
        return reapIntervalMs;
    }

    public void setReapIntervalMs(long reapIntervalMs) {
        this.reapIntervalMs = reapIntervalMs;
    }

    public Duration getEmitterTimeout() {
        return emitterTimeout;
    }

    public void setEmitterTimeout(Duration emitterTimeout) {
        this.emitterTimeout = emitterTimeout;
    }

    public int getSubscribeLimit() {
        return subscribeLimit;
    }

    public void setSubscribeLimit(int subscribeLimit) {
        this.subscribeLimit = subscribeLimit;
    }

    public boolean isRequireAuth() {
        return requireAuth;
    }

    public void setRequireAuth(boolean requireAuth) {
        this.requireAuth = requireAuth;
    }
}
