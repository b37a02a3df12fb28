package com.phillippitts.grillstats.service.orchestration;

import com.phillippitts.grillstats.config.properties.PollingProperties;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.exception.UnknownDeviceException;
import com.phillippitts.grillstats.service.device.DeviceAdapter;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import com.phillippitts.grillstats.service.device.DevicePoll;
import com.phillippitts.grillstats.service.metrics.TelemetryMetrics;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one independent poll loop per device.
 *
 * <p><b>Thread model:</b> the poll scheduler fires a tick per device every
 * {@code grill.polling.interval} (fixed delay). A tick hands the adapter call to the bounded
 * poll executor and returns, so a stalled device never holds a scheduler thread. While a poll of
 * a device is still running, further ticks of that device are skipped.
 *
 * <p><b>Timeouts:</b> each poll is awaited for at most {@code grill.polling.timeout}. On timeout
 * or adapter failure the device is marked DEGRADED and its cached readings stay as last known
 * good. The abandoned call is left to finish; its result is never applied.
 *
 * <p><b>Cancellation:</b> the poll's {@link PollGuard} epoch is captured before the call and
 * checked again when the result is applied.
 */
@Component
public class DevicePollingOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DevicePollingOrchestrator.class);

    private final ConcurrentMap<String, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicBoolean> inFlight = new ConcurrentHashMap<>();

    private final DeviceDirectory directory;
    private final DeviceAdapter adapter;
    private final TelemetryPipeline pipeline;
    private final PollGuard pollGuard;
    private final TaskScheduler scheduler;
    private final Executor pollExecutor;
    private final PollingProperties props;
    private final TelemetryMetrics metrics;

    public DevicePollingOrchestrator(DeviceDirectory directory,
                                     DeviceAdapter adapter,
                                     TelemetryPipeline pipeline,
                                     PollGuard pollGuard,
                                     @Qualifier("pollScheduler") TaskScheduler scheduler,
                                     @Qualifier("pollExecutor") Executor pollExecutor,
                                     PollingProperties props,
                                     TelemetryMetrics metrics) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.pollGuard = Objects.requireNonNull(pollGuard, "pollGuard");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.pollExecutor = Objects.requireNonNull(pollExecutor, "pollExecutor");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startAll() {
        LOG.info("Starting {} poll loop(s) every {} (source={}, timeout={})",
                directory.devices().size(), props.getInterval(), adapter.sourceName(), props.getTimeout());
        for (Device device : directory.devices()) {
            connect(device.id());
        }
    }

    /**
     * Starts polling a device. Idempotent.
     *
     * @return true if polling was started by this call
     * @throws UnknownDeviceException if the device is unknown
     */
    public boolean connect(String deviceId) {
        directory.getDevice(deviceId);
        boolean[] started = new boolean[1];
        schedules.computeIfAbsent(deviceId, id -> {
            started[0] = true;
            return scheduler.scheduleWithFixedDelay(() -> tick(id), props.getInterval());
        });
        if (started[0]) {
            LOG.info("Polling {} every {}", deviceId, props.getInterval());
        }
        return started[0];
    }

    /**
     * Stops polling a device and marks it OFFLINE. An in-flight poll completes but its result is
     * discarded. Idempotent.
     *
     * @return true if polling was stopped by this call
     * @throws UnknownDeviceException if the device is unknown
     */
    public boolean disconnect(String deviceId) {
        directory.getDevice(deviceId);
        ScheduledFuture<?> schedule = schedules.remove(deviceId);
        if (schedule == null) {
            return false;
        }
        schedule.cancel(false);
        pollGuard.invalidate(deviceId);
        pipeline.markOffline(deviceId, "disconnected");
        return true;
    }

    public boolean isPolling(String deviceId) {
        return schedules.containsKey(deviceId);
    }

    /**
     * Runs one poll of a device.
     *
     * @return completes with true once a result was applied, false when the tick was skipped,
     *         failed, timed out or was discarded
     */
    CompletableFuture<Boolean> tick(String deviceId) {
        AtomicBoolean running = inFlight.computeIfAbsent(deviceId, id -> new AtomicBoolean());
        if (!running.compareAndSet(false, true)) {
            metrics.incrementPollSkipped();
            LOG.debug("Previous poll of {} still running; skipping tick", deviceId);
            return CompletableFuture.completedFuture(false);
        }
        ThreadContext.put("deviceId", deviceId);
        try {
            Device device;
            try {
                device = directory.getDevice(deviceId);
            } catch (UnknownDeviceException e) {
                running.set(false);
                LOG.warn("Skipping poll of unknown device {}", deviceId);
                return CompletableFuture.completedFuture(false);
            }
            long epoch = pollGuard.currentEpoch(deviceId);
            long startNanos = System.nanoTime();

            CompletableFuture<DevicePoll> poll;
            try {
                poll = CompletableFuture.supplyAsync(() -> adapter.poll(device), pollExecutor);
            } catch (RejectedExecutionException e) {
                running.set(false);
                fail(deviceId, epoch, "rejected", "poll pool saturated");
                return CompletableFuture.completedFuture(false);
            }
            // Only the real call frees the slot, not the timeout
            poll.whenComplete((result, error) -> running.set(false));

            return poll.copy()
                    .orTimeout(props.getTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .handle((result, error) -> {
                        if (error == null) {
                            metrics.recordPollLatency(adapter.sourceName(), System.nanoTime() - startNanos);
                            return pipeline.apply(result, epoch);
                        }
                        Throwable cause = unwrap(error);
                        if (cause instanceof TimeoutException) {
                            fail(deviceId, epoch, "timeout", "no response within " + props.getTimeout());
                        } else {
                            fail(deviceId, epoch, "error", cause.getMessage());
                        }
                        return false;
                    });
        } finally {
            ThreadContext.remove("deviceId");
        }
    }

    @PreDestroy
    public void stopAll() {
        schedules.values().forEach(s -> s.cancel(false));
        schedules.clear();
        LOG.info("Poll loops stopped");
    }

    private void fail(String deviceId, long epoch, String reason, String detail) {
        metrics.incrementPollFailure(adapter.sourceName(), reason);
        if (pollGuard.currentEpoch(deviceId) != epoch) {
            LOG.debug("Ignoring {} of cancelled poll of {}", reason, deviceId);
            return;
        }
        pipeline.markDegraded(deviceId, reason + " (" + detail + ")");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** Devices with an active poll loop. */
    public Set<String> polledDevices() {
        return Set.copyOf(schedules.keySet());
    }
}
