package com.phillippitts.grillstats.service.orchestration;

import com.phillippitts.grillstats.domain.ConnectionStatus;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.exception.CacheUnavailableException;
import com.phillippitts.grillstats.service.alert.AlertEvaluator;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.service.device.DevicePoll;
import com.phillippitts.grillstats.service.history.HistoryForwarder;
import com.phillippitts.grillstats.service.metrics.TelemetryMetrics;
import com.phillippitts.grillstats.service.rollup.RollupService;
import com.phillippitts.grillstats.service.stream.StreamDispatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies poll results: cache write-through first, then alerts, stream fan-out, rollups and the
 * history hand-off.
 *
 * <p>Everything for one device runs under its {@link PollGuard} lock, so a device's updates reach
 * the dispatcher in production order and a cancelled poll is either fully applied before the
 * cancellation or not at all. A closed cache aborts the rest of the tick; the next tick retries.
 */
@Component
public class TelemetryPipeline {

    private static final Logger LOG = LogManager.getLogger(TelemetryPipeline.class);

    private final TieredCache cache;
    private final AlertEvaluator alerts;
    private final StreamDispatcher dispatcher;
    private final RollupService rollups;
    private final HistoryForwarder history;
    private final PollGuard pollGuard;
    private final TelemetryMetrics metrics;
    private final Clock clock;

    public TelemetryPipeline(TieredCache cache,
                             AlertEvaluator alerts,
                             StreamDispatcher dispatcher,
                             RollupService rollups,
                             HistoryForwarder history,
                             PollGuard pollGuard,
                             TelemetryMetrics metrics,
                             Clock clock) {
        this.cache = cache;
        this.alerts = alerts;
        this.dispatcher = dispatcher;
        this.rollups = rollups;
        this.history = history;
        this.pollGuard = pollGuard;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Applies a poll result if nothing it depends on was cancelled since {@code epoch}.
     *
     * @return true if applied, false if discarded as stale or aborted by the cache
     */
    public boolean apply(DevicePoll poll, long epoch) {
        boolean[] applied = new boolean[1];
        boolean current = pollGuard.applyIfCurrent(poll.deviceId(), epoch, () -> applied[0] = applyLocked(poll));
        if (!current) {
            metrics.incrementStaleDiscarded();
            LOG.debug("Discarded stale poll of {} ({} reading(s))", poll.deviceId(), poll.readings().size());
        }
        return current && applied[0];
    }

    /**
     * Marks a device degraded after a failed poll. Cached readings are kept as last known good.
     */
    public void markDegraded(String deviceId, String reason) {
        setConnection(deviceId, ConnectionStatus.DEGRADED, reason);
    }

    /** Marks a device offline, for example after it was disconnected. */
    public void markOffline(String deviceId, String reason) {
        setConnection(deviceId, ConnectionStatus.OFFLINE, reason);
    }

    /**
     * Resolves temperature alerts on channels whose live reading has expired, for example after
     * the session ended or the device stopped reporting.
     */
    @Scheduled(fixedDelayString = "${grill.alerts.silence-check-interval-ms:5000}")
    public void checkSilentChannels() {
        alerts.channelsWithAlertState().forEach((deviceId, channelIds) ->
                pollGuard.withLock(deviceId, () -> {
                    try {
                        Instant now = clock.instant();
                        for (String channelId : channelIds) {
                            if (!cache.contains(CacheNamespace.LIVE_READINGS, Reading.channelKey(deviceId, channelId))) {
                                alerts.onChannelSilent(deviceId, channelId, now);
                            }
                        }
                        return true;
                    } catch (CacheUnavailableException e) {
                        LOG.warn("Cache unavailable while checking silent channels of {}: {}", deviceId, e.getMessage());
                        return false;
                    }
                }));
    }

    private boolean applyLocked(DevicePoll poll) {
        try {
            for (Reading reading : poll.readings()) {
                // Last write wins by arrival
                cache.set(CacheNamespace.LIVE_READINGS, reading.channelKey(), reading);
                alerts.onReading(reading);
                dispatcher.publishReading(reading);
                rollups.record(reading);
                history.forward(reading);
            }
            applyStatus(poll.status());
            metrics.incrementReadingsApplied(poll.readings().size());
            return true;
        } catch (CacheUnavailableException e) {
            LOG.error("Cache unavailable while applying poll of {}; skipping tick: {}", poll.deviceId(), e.getMessage());
            return false;
        }
    }

    private void applyStatus(DeviceStatus status) {
        DeviceStatus previous = cache.get(CacheNamespace.DEVICE_STATUS, status.deviceId(), DeviceStatus.class)
                .orElse(null);
        cache.set(CacheNamespace.DEVICE_STATUS, status.deviceId(), status);
        if (previous != null && previous.connectionStatus() != status.connectionStatus()) {
            LOG.info("Device {} is now {} (was {})", status.deviceId(), status.connectionStatus(),
                    previous.connectionStatus());
        }
        alerts.onStatus(status, clock.instant());
        dispatcher.publishStatus(status);
    }

    private void setConnection(String deviceId, ConnectionStatus connection, String reason) {
        pollGuard.withLock(deviceId, () -> {
            try {
                DeviceStatus status = cache.get(CacheNamespace.DEVICE_STATUS, deviceId, DeviceStatus.class)
                        .map(s -> s.withConnectionStatus(connection))
                        .orElse(DeviceStatus.unknown(deviceId, connection));
                if (connection == ConnectionStatus.DEGRADED) {
                    LOG.warn("Device {} degraded: {}", deviceId, reason);
                } else {
                    LOG.info("Device {} {}: {}", deviceId, connection, reason);
                }
                applyStatus(status);
                return true;
            } catch (CacheUnavailableException e) {
                LOG.error("Cache unavailable while marking {} {}: {}", deviceId, connection, e.getMessage());
                return false;
            }
        });
    }
}
