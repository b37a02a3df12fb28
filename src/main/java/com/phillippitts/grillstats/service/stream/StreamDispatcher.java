package com.phillippitts.grillstats.service.stream;

import com.phillippitts.grillstats.config.properties.StreamProperties;
import com.phillippitts.grillstats.domain.DeviceSnapshot;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.exception.CacheUnavailableException;
import com.phillippitts.grillstats.service.alert.AlertTransitionEvent;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.service.metrics.TelemetryMetrics;
import com.phillippitts.grillstats.service.orchestration.PollGuard;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fans device updates out to live dashboard subscriptions.
 *
 * <p>Ordering: updates of one device are sequenced and enqueued under that device's group lock,
 * and each subscription has a single drain task, so a client sees one device's updates in
 * production order. Nothing is promised across devices.
 *
 * <p>Backpressure: each subscription has a bounded {@link UpdateBuffer}. Producers only enqueue,
 * never send; when a buffer is full the oldest update is dropped. Sends run on the dispatch
 * executor, and a failing send tears down that subscription alone.
 *
 * <p>Liveness: every successful send refreshes the subscription's entry in
 * {@link CacheNamespace#SUBSCRIBERS}. Heartbeats keep idle but healthy connections sending; a
 * subscription whose entry has expired is reaped.
 */
@Component
public class StreamDispatcher {

    private static final Logger LOG = LogManager.getLogger(StreamDispatcher.class);

    private final ConcurrentMap<String, DeviceGroup> groups = new ConcurrentHashMap<>();
    private final SnapshotAssembler snapshots;
    private final TieredCache cache;
    private final PollGuard pollGuard;
    private final Executor dispatchExecutor;
    private final TelemetryMetrics metrics;
    private final StreamProperties props;
    private final Clock clock;

    public StreamDispatcher(SnapshotAssembler snapshots,
                            TieredCache cache,
                            PollGuard pollGuard,
                            @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                            TelemetryMetrics metrics,
                            StreamProperties props,
                            Clock clock) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.pollGuard = Objects.requireNonNull(pollGuard, "pollGuard");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Subscribes a client to a device. The current snapshot is the first update the connection
     * receives; every later update of the device follows it.
     *
     * @throws com.phillippitts.grillstats.exception.UnknownDeviceException if the device is unknown
     * @throws CacheUnavailableException if the cache is closed
     */
    public SubscriptionHandle subscribe(String clientId, String deviceId, ClientConnection connection) {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(connection, "connection");
        SubscriptionHandle handle = new SubscriptionHandle(UUID.randomUUID().toString(), clientId, deviceId);
        Subscription subscription = new Subscription(handle, connection, props.getBufferCapacity());

        // Under the poll lock the snapshot and the following updates cannot interleave with a tick
        pollGuard.withLock(deviceId, () -> {
            DeviceSnapshot snapshot = snapshots.assemble(deviceId);
            DeviceGroup group = group(deviceId);
            group.lock.lock();
            try {
                subscription.buffer().offer(group.next(UpdateType.SNAPSHOT, deviceId, snapshot, clock));
                group.subscriptions.put(subscription.id(), subscription);
            } finally {
                group.lock.unlock();
            }
            cache.set(CacheNamespace.SUBSCRIBERS, subscription.id(), handle);
            return true;
        });
        LOG.info("Client {} subscribed to {} (subscription={})", clientId, deviceId, handle.subscriptionId());
        scheduleDrain(subscription);
        return handle;
    }

    /**
     * Releases a subscription. Idempotent; the bookkeeping entry is left to expire.
     *
     * @return true if this call released it
     */
    public boolean unsubscribe(SubscriptionHandle handle) {
        DeviceGroup group = groups.get(handle.deviceId());
        if (group == null) {
            return false;
        }
        Subscription subscription;
        group.lock.lock();
        try {
            subscription = group.subscriptions.remove(handle.subscriptionId());
        } finally {
            group.lock.unlock();
        }
        if (subscription == null || !subscription.markClosed()) {
            return false;
        }
        subscription.buffer().clear();
        subscription.connection().close();
        LOG.info("Client {} unsubscribed from {} (subscription={})",
                handle.clientId(), handle.deviceId(), handle.subscriptionId());
        return true;
    }

    public void publishReading(Reading reading) {
        publish(reading.deviceId(), UpdateType.READING, SnapshotAssembler.channelSnapshot(reading));
    }

    public void publishStatus(DeviceStatus status) {
        publish(status.deviceId(), UpdateType.STATUS, SnapshotAssembler.statusSnapshot(status));
    }

    @EventListener
    public void onAlertTransition(AlertTransitionEvent event) {
        publish(event.transition().deviceId(), UpdateType.ALERT, event.transition());
    }

    /**
     * Enqueues an update for every subscriber of the device and schedules their drains.
     * Never blocks on a client.
     */
    public void publish(String deviceId, UpdateType type, Object payload) {
        DeviceGroup group = groups.get(deviceId);
        if (group == null) {
            return;
        }
        List<Subscription> targets;
        group.lock.lock();
        try {
            if (group.subscriptions.isEmpty()) {
                return;
            }
            StreamUpdate update = group.next(type, deviceId, payload, clock);
            targets = new ArrayList<>(group.subscriptions.values());
            for (Subscription subscription : targets) {
                StreamUpdate dropped = subscription.buffer().offer(update);
                if (dropped != null) {
                    metrics.incrementDroppedUpdate();
                    LOG.debug("Dropped {} #{} for slow subscription {}",
                            dropped.type(), dropped.sequence(), subscription.id());
                }
            }
        } finally {
            group.lock.unlock();
        }
        targets.forEach(this::scheduleDrain);
    }

    @Scheduled(fixedDelayString = "${grill.stream.heartbeat-interval-ms:15000}")
    public void sendHeartbeats() {
        for (String deviceId : groups.keySet()) {
            publish(deviceId, UpdateType.HEARTBEAT, null);
        }
    }

    /**
     * Tears down subscriptions whose bookkeeping entry has expired.
     *
     * @return number of subscriptions reaped
     */
    @Scheduled(fixedDelayString = "${grill.stream.reap-interval-ms:30000}")
    public int reapIdle() {
        int reaped = 0;
        try {
            for (Subscription subscription : allSubscriptions()) {
                if (!cache.contains(CacheNamespace.SUBSCRIBERS, subscription.id())) {
                    teardown(subscription, "idle");
                    reaped++;
                }
            }
        } catch (CacheUnavailableException e) {
            LOG.warn("Skipping subscriber reap: {}", e.getMessage());
        }
        return reaped;
    }

    public int subscriptionCount() {
        return groups.values().stream().mapToInt(g -> g.subscriptions.size()).sum();
    }

    public int subscriptionCount(String deviceId) {
        DeviceGroup group = groups.get(deviceId);
        return group == null ? 0 : group.subscriptions.size();
    }

    @PreDestroy
    public void shutdown() {
        List<Subscription> all = allSubscriptions();
        all.forEach(s -> unsubscribe(s.handle()));
        LOG.info("Stream dispatcher closed {} subscription(s)", all.size());
    }

    private void scheduleDrain(Subscription subscription) {
        if (subscription.isClosed() || subscription.buffer().isEmpty() || !subscription.tryStartDrain()) {
            return;
        }
        try {
            dispatchExecutor.execute(() -> drain(subscription));
        } catch (RejectedExecutionException e) {
            // Updates stay buffered; the next publish or heartbeat retries the drain
            subscription.endDrain();
            LOG.warn("Dispatch pool saturated; deferring sends to {}", subscription.id());
        }
    }

    private void drain(Subscription subscription) {
        ThreadContext.put("clientId", subscription.handle().clientId());
        ThreadContext.put("deviceId", subscription.handle().deviceId());
        try {
            while (true) {
                StreamUpdate update;
                while ((update = subscription.buffer().poll()) != null) {
                    if (subscription.isClosed() || !send(subscription, update)) {
                        return;
                    }
                }
                subscription.endDrain();
                if (subscription.buffer().isEmpty() || !subscription.tryStartDrain()) {
                    return;
                }
            }
        } finally {
            ThreadContext.remove("clientId");
            ThreadContext.remove("deviceId");
        }
    }

    private boolean send(Subscription subscription, StreamUpdate update) {
        try {
            subscription.connection().send(update);
        } catch (IOException | RuntimeException e) {
            teardown(subscription, "send failed: " + e.getMessage());
            return false;
        }
        subscription.acknowledge(update.sequence());
        try {
            cache.set(CacheNamespace.SUBSCRIBERS, subscription.id(), subscription.handle());
        } catch (CacheUnavailableException e) {
            LOG.debug("Subscriber bookkeeping not refreshed: {}", e.getMessage());
        }
        return true;
    }

    private void teardown(Subscription subscription, String reason) {
        if (unsubscribe(subscription.handle())) {
            LOG.warn("Tore down subscription {} of client {} ({})",
                    subscription.id(), subscription.handle().clientId(), reason);
        }
    }

    private List<Subscription> allSubscriptions() {
        List<Subscription> all = new ArrayList<>();
        for (DeviceGroup group : groups.values()) {
            group.lock.lock();
            try {
                all.addAll(group.subscriptions.values());
            } finally {
                group.lock.unlock();
            }
        }
        return all;
    }

    private DeviceGroup group(String deviceId) {
        return groups.computeIfAbsent(deviceId, id -> new DeviceGroup());
    }

    private static final class DeviceGroup {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
        private long sequence;

        private StreamUpdate next(UpdateType type, String deviceId, Object payload, Clock clock) {
            return new StreamUpdate(++sequence, type, deviceId, clock.instant(), payload);
        }
    }
}
