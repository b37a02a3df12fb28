package com.phillippitts.grillstats.service.stream;

import com.phillippitts.grillstats.config.properties.AlertProperties;
import com.phillippitts.grillstats.config.properties.CacheProperties;
import com.phillippitts.grillstats.config.properties.StreamProperties;
import com.phillippitts.grillstats.domain.AlertKind;
import com.phillippitts.grillstats.domain.AlertState;
import com.phillippitts.grillstats.domain.AlertTransition;
import com.phillippitts.grillstats.domain.ConnectionStatus;
import com.phillippitts.grillstats.domain.DeviceSnapshot;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.domain.TemperatureUnit;
import com.phillippitts.grillstats.exception.CacheUnavailableException;
import com.phillippitts.grillstats.exception.UnknownDeviceException;
import com.phillippitts.grillstats.service.alert.AlertEvaluator;
import com.phillippitts.grillstats.service.alert.AlertRuleRegistry;
import com.phillippitts.grillstats.service.alert.AlertTransitionEvent;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import com.phillippitts.grillstats.service.metrics.TelemetryMetrics;
import com.phillippitts.grillstats.service.orchestration.PollGuard;
import com.phillippitts.grillstats.testutil.EventCapturingPublisher;
import com.phillippitts.grillstats.testutil.MutableClock;
import com.phillippitts.grillstats.testutil.RecordingConnection;
import com.phillippitts.grillstats.testutil.SyncExecutor;
import com.phillippitts.grillstats.testutil.TestDevices;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static com.phillippitts.grillstats.testutil.TestDevices.FOOD_CHANNEL;
import static com.phillippitts.grillstats.testutil.TestDevices.SMOKER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamDispatcherTest {

    private MutableClock clock;
    private TieredCache cache;
    private SnapshotAssembler snapshots;
    private StreamProperties props;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T12:00:00Z");
        cache = new TieredCache(new CacheProperties(), clock);
        DeviceDirectory directory = new DeviceDirectory(TestDevices.registry(TestDevices.SMOKER), cache);
        AlertEvaluator alerts = new AlertEvaluator(new AlertRuleRegistry(new AlertProperties(), directory),
                new EventCapturingPublisher(), new TelemetryMetrics(new SimpleMeterRegistry()));
        snapshots = new SnapshotAssembler(cache, directory, alerts, clock);
        props = new StreamProperties();
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void snapshotIsFirstUpdateAndSequencesIncrease() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());
        cache.set(CacheNamespace.LIVE_READINGS, Reading.channelKey(SMOKER_ID, FOOD_CHANNEL), reading(150.0));
        cache.set(CacheNamespace.DEVICE_STATUS, SMOKER_ID,
                new DeviceStatus(SMOKER_ID, 95, 80, ConnectionStatus.ONLINE, clock.instant()));
        RecordingConnection connection = new RecordingConnection();

        dispatcher.subscribe("alice", SMOKER_ID, connection);
        dispatcher.publishReading(reading(151.0));
        dispatcher.publishStatus(new DeviceStatus(SMOKER_ID, 90, 80, ConnectionStatus.ONLINE, clock.instant()));

        assertThat(connection.types()).containsExactly(UpdateType.SNAPSHOT, UpdateType.READING, UpdateType.STATUS);
        assertThat(connection.sequences()).containsExactly(1L, 2L, 3L);
        DeviceSnapshot snapshot = (DeviceSnapshot) connection.received.get(0).payload();
        assertThat(snapshot.channels()).first().satisfies(c -> {
            assertThat(c.temperature()).isEqualTo(150.0);
            assertThat(c.connected()).isTrue();
        });
        assertThat(snapshot.status().connectionStatus()).isEqualTo(ConnectionStatus.ONLINE);
    }

    @Test
    void snapshotChannelIsDisconnectedWhileDeviceIsOffline() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());
        cache.set(CacheNamespace.LIVE_READINGS, Reading.channelKey(SMOKER_ID, FOOD_CHANNEL), reading(150.0));
        cache.set(CacheNamespace.DEVICE_STATUS, SMOKER_ID,
                new DeviceStatus(SMOKER_ID, 95, 10, ConnectionStatus.OFFLINE, clock.instant()));
        RecordingConnection connection = new RecordingConnection();

        dispatcher.subscribe("alice", SMOKER_ID, connection);

        DeviceSnapshot snapshot = (DeviceSnapshot) connection.received.get(0).payload();
        assertThat(snapshot.channels()).first().satisfies(c -> {
            assertThat(c.temperature()).isEqualTo(150.0);
            assertThat(c.connected()).isFalse();
        });
        assertThat(snapshot.status().connectionStatus()).isEqualTo(ConnectionStatus.OFFLINE);
    }

    @Test
    void updatesOfOtherDevicesAreNotDelivered() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());
        RecordingConnection connection = new RecordingConnection();
        dispatcher.subscribe("alice", SMOKER_ID, connection);

        dispatcher.publishReading(new Reading("grill-1", FOOD_CHANNEL, clock.instant(), 50.0, TemperatureUnit.CELSIUS));

        assertThat(connection.types()).containsExactly(UpdateType.SNAPSHOT);
    }

    @Test
    void slowSubscriberLosesOldestUpdatesWithoutBlockingPublisher() {
        props.setBufferCapacity(3);
        ManualExecutor executor = new ManualExecutor();
        StreamDispatcher dispatcher = dispatcher(executor);
        RecordingConnection connection = new RecordingConnection();
        dispatcher.subscribe("alice", SMOKER_ID, connection);

        for (int i = 0; i < 5; i++) {
            dispatcher.publishReading(reading(150.0 + i));
        }
        executor.runAll();

        assertThat(connection.sequences()).containsExactly(4L, 5L, 6L);
        assertThat(meterRegistry.get("grillstats.stream.dropped").counter().count()).isEqualTo(3.0);
    }

    @Test
    void failingClientIsTornDownWithoutAffectingOthers() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());
        RecordingConnection healthy = new RecordingConnection();
        RecordingConnection broken = new RecordingConnection();
        dispatcher.subscribe("alice", SMOKER_ID, healthy);
        dispatcher.subscribe("bob", SMOKER_ID, broken);
        broken.failSends = true;

        dispatcher.publishReading(reading(160.0));
        dispatcher.publishReading(reading(161.0));

        assertThat(broken.closed).isTrue();
        assertThat(dispatcher.subscriptionCount(SMOKER_ID)).isEqualTo(1);
        assertThat(healthy.types()).containsExactly(UpdateType.SNAPSHOT, UpdateType.READING, UpdateType.READING);
    }

    @Test
    void alertTransitionsAreForwarded() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());
        RecordingConnection connection = new RecordingConnection();
        dispatcher.subscribe("alice", SMOKER_ID, connection);
        AlertTransition transition = new AlertTransition("done", SMOKER_ID, FOOD_CHANNEL, AlertKind.HIGH,
                AlertState.FIRING, clock.instant(), 205.0);

        dispatcher.onAlertTransition(new AlertTransitionEvent(transition));

        assertThat(connection.received).last().satisfies(u -> {
            assertThat(u.type()).isEqualTo(UpdateType.ALERT);
            assertThat(u.payload()).isEqualTo(transition);
        });
    }

    @Test
    void heartbeatsKeepSubscriptionAliveAndIdleOnesAreReaped() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());
        RecordingConnection active = new RecordingConnection();
        dispatcher.subscribe("alice", SMOKER_ID, active);

        clock.advance(Duration.ofMinutes(1));
        dispatcher.sendHeartbeats();
        clock.advance(Duration.ofMinutes(1).plusSeconds(30));

        assertThat(dispatcher.reapIdle()).isZero();
        assertThat(active.types()).contains(UpdateType.HEARTBEAT);

        clock.advance(Duration.ofMinutes(3));

        assertThat(dispatcher.reapIdle()).isEqualTo(1);
        assertThat(active.closed).isTrue();
        assertThat(dispatcher.subscriptionCount()).isZero();
    }

    @Test
    void unsubscribeIsIdempotent() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());
        RecordingConnection connection = new RecordingConnection();
        SubscriptionHandle handle = dispatcher.subscribe("alice", SMOKER_ID, connection);

        assertThat(dispatcher.unsubscribe(handle)).isTrue();
        assertThat(dispatcher.unsubscribe(handle)).isFalse();
        assertThat(connection.closed).isTrue();

        dispatcher.publishReading(reading(170.0));
        assertThat(connection.types()).containsExactly(UpdateType.SNAPSHOT);
    }

    @Test
    void subscribingToUnknownDeviceFails() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());

        assertThatThrownBy(() -> dispatcher.subscribe("alice", "smoker-9", new RecordingConnection()))
                .isInstanceOf(UnknownDeviceException.class);
        assertThat(dispatcher.subscriptionCount()).isZero();
    }

    @Test
    void subscribingWithClosedCacheFails() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());
        cache.close();

        assertThatThrownBy(() -> dispatcher.subscribe("alice", SMOKER_ID, new RecordingConnection()))
                .isInstanceOf(CacheUnavailableException.class);
    }

    @Test
    void shutdownClosesEveryConnection() {
        StreamDispatcher dispatcher = dispatcher(new SyncExecutor());
        RecordingConnection a = new RecordingConnection();
        RecordingConnection b = new RecordingConnection();
        dispatcher.subscribe("alice", SMOKER_ID, a);
        dispatcher.subscribe("bob", SMOKER_ID, b);

        dispatcher.shutdown();

        assertThat(a.closed).isTrue();
        assertThat(b.closed).isTrue();
    }

    private StreamDispatcher dispatcher(Executor executor) {
        return new StreamDispatcher(snapshots, cache, new PollGuard(), executor,
                new TelemetryMetrics(meterRegistry), props, clock);
    }

    private Reading reading(double temperature) {
        return new Reading(SMOKER_ID, FOOD_CHANNEL, clock.instant(), temperature, TemperatureUnit.FAHRENHEIT);
    }

    /** Holds tasks until the test runs them. */
    private static final class ManualExecutor implements Executor {
        private final List<Runnable> tasks = new ArrayList<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        void runAll() {
            while (!tasks.isEmpty()) {
                tasks.remove(0).run();
            }
        }
    }
}
