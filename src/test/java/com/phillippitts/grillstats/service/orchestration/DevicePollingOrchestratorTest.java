package com.phillippitts.grillstats.service.orchestration;

import com.phillippitts.grillstats.config.properties.CacheProperties;
import com.phillippitts.grillstats.config.properties.PollingProperties;
import com.phillippitts.grillstats.domain.ConnectionStatus;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.exception.DeviceSourceException;
import com.phillippitts.grillstats.exception.UnknownDeviceException;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.service.device.DeviceAdapter;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import com.phillippitts.grillstats.service.device.DevicePoll;
import com.phillippitts.grillstats.service.metrics.TelemetryMetrics;
import com.phillippitts.grillstats.testutil.MutableClock;
import com.phillippitts.grillstats.testutil.TestDevices;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.grillstats.testutil.TestDevices.SMOKER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DevicePollingOrchestratorTest {

    private ExecutorService pool;
    private TaskScheduler scheduler;
    private ScheduledFuture<?> schedule;
    private TelemetryPipeline pipeline;
    private PollGuard pollGuard;
    private PollingProperties props;
    private SimpleMeterRegistry meterRegistry;
    private FakeAdapter adapter;
    private DevicePollingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        scheduler = mock(TaskScheduler.class);
        schedule = mock(ScheduledFuture.class);
        doReturn(schedule).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        pipeline = mock(TelemetryPipeline.class);
        when(pipeline.apply(any(DevicePoll.class), anyLong())).thenReturn(true);
        pollGuard = new PollGuard();
        props = new PollingProperties();
        props.setTimeout(Duration.ofMillis(200));
        meterRegistry = new SimpleMeterRegistry();
        adapter = new FakeAdapter();

        TieredCache cache = new TieredCache(new CacheProperties(), MutableClock.startingAt("2025-06-01T12:00:00Z"));
        DeviceDirectory directory = new DeviceDirectory(TestDevices.registry(TestDevices.SMOKER, TestDevices.GRILL),
                cache);
        orchestrator = new DevicePollingOrchestrator(directory, adapter, pipeline, pollGuard, scheduler, pool,
                props, new TelemetryMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        adapter.release.countDown();
        pool.shutdownNow();
    }

    @Test
    void successfulPollIsAppliedWithCapturedEpoch() throws Exception {
        adapter.release.countDown();

        assertThat(orchestrator.tick(SMOKER_ID).get(2, TimeUnit.SECONDS)).isTrue();

        verify(pipeline).apply(any(DevicePoll.class), eq(0L));
        assertThat(meterRegistry.get("grillstats.poll.latency").timer().count()).isEqualTo(1);
    }

    @Test
    void slowDeviceTimesOutAndIsMarkedDegraded() throws Exception {
        assertThat(orchestrator.tick(SMOKER_ID).get(2, TimeUnit.SECONDS)).isFalse();

        verify(pipeline).markDegraded(eq(SMOKER_ID), contains("timeout"));
        verify(pipeline, never()).apply(any(), anyLong());
        assertThat(meterRegistry.get("grillstats.poll.failure").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void ticksAreSkippedWhilePreviousPollIsRunning() throws Exception {
        orchestrator.tick(SMOKER_ID).get(2, TimeUnit.SECONDS);

        assertThat(orchestrator.tick(SMOKER_ID).get(2, TimeUnit.SECONDS)).isFalse();
        assertThat(meterRegistry.get("grillstats.poll.skipped").counter().count()).isEqualTo(1.0);
        assertThat(adapter.calls.get()).isEqualTo(1);

        adapter.release.countDown();
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> orchestrator.tick(SMOKER_ID).get(2, TimeUnit.SECONDS));
    }

    @Test
    void stalledDeviceDoesNotBlockOtherDevices() throws Exception {
        adapter.blockOnly = SMOKER_ID;
        orchestrator.tick(SMOKER_ID);

        assertThat(orchestrator.tick("grill-1").get(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void adapterFailureMarksDeviceDegraded() throws Exception {
        adapter.failure = new DeviceSourceException(SMOKER_ID, "HTTP 502");

        assertThat(orchestrator.tick(SMOKER_ID).get(2, TimeUnit.SECONDS)).isFalse();

        verify(pipeline).markDegraded(eq(SMOKER_ID), contains("HTTP 502"));
        assertThat(meterRegistry.get("grillstats.poll.failure").tag("reason", "error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void saturatedPoolCountsAsFailure() throws Exception {
        DevicePollingOrchestrator rejecting = new DevicePollingOrchestrator(
                new DeviceDirectory(TestDevices.registry(TestDevices.SMOKER),
                        new TieredCache(new CacheProperties(), MutableClock.startingAt("2025-06-01T12:00:00Z"))),
                adapter, pipeline, pollGuard, scheduler, task -> {
                    throw new RejectedExecutionException("full");
                }, props, new TelemetryMetrics(meterRegistry));

        assertThat(rejecting.tick(SMOKER_ID).get(2, TimeUnit.SECONDS)).isFalse();

        verify(pipeline).markDegraded(eq(SMOKER_ID), contains("rejected"));
    }

    @Test
    void timeoutAfterDisconnectDoesNotMarkDegraded() throws Exception {
        orchestrator.connect(SMOKER_ID);
        var pending = orchestrator.tick(SMOKER_ID);

        assertThat(orchestrator.disconnect(SMOKER_ID)).isTrue();

        assertThat(pending.get(2, TimeUnit.SECONDS)).isFalse();
        verify(pipeline).markOffline(SMOKER_ID, "disconnected");
        verify(pipeline, never()).markDegraded(any(), any());
        assertThat(pollGuard.currentEpoch(SMOKER_ID)).isEqualTo(1);
    }

    @Test
    void connectAndDisconnectAreIdempotent() {
        assertThat(orchestrator.connect(SMOKER_ID)).isTrue();
        assertThat(orchestrator.connect(SMOKER_ID)).isFalse();
        assertThat(orchestrator.isPolling(SMOKER_ID)).isTrue();
        verify(scheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), eq(props.getInterval()));

        assertThat(orchestrator.disconnect(SMOKER_ID)).isTrue();
        assertThat(orchestrator.disconnect(SMOKER_ID)).isFalse();
        assertThat(orchestrator.isPolling(SMOKER_ID)).isFalse();
        verify(schedule).cancel(false);
        verify(pipeline, times(1)).markOffline(SMOKER_ID, "disconnected");
    }

    @Test
    void startAllPollsEveryRegisteredDevice() {
        orchestrator.startAll();

        assertThat(orchestrator.polledDevices()).containsExactlyInAnyOrder(SMOKER_ID, "grill-1");

        orchestrator.stopAll();
        assertThat(orchestrator.polledDevices()).isEmpty();
    }

    @Test
    void unknownDeviceIsRejected() {
        assertThatThrownBy(() -> orchestrator.connect("smoker-9")).isInstanceOf(UnknownDeviceException.class);
        assertThatThrownBy(() -> orchestrator.disconnect("smoker-9")).isInstanceOf(UnknownDeviceException.class);
    }

    /** Adapter that blocks until released, or fails when told to. */
    private static final class FakeAdapter implements DeviceAdapter {
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger calls = new AtomicInteger();
        volatile String blockOnly;
        volatile RuntimeException failure;

        @Override
        public DevicePoll poll(Device device) {
            calls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            if (blockOnly == null || blockOnly.equals(device.id())) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DeviceSourceException(device.id(), "interrupted", e);
                }
            }
            return new DevicePoll(device.id(), List.of(),
                    new DeviceStatus(device.id(), 90, 80, ConnectionStatus.ONLINE, null));
        }

        @Override
        public String sourceName() {
            return "fake";
        }
    }
}
