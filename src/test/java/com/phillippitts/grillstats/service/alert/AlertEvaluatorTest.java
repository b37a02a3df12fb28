package com.phillippitts.grillstats.service.alert;

import com.phillippitts.grillstats.config.properties.AlertProperties;
import com.phillippitts.grillstats.config.properties.CacheProperties;
import com.phillippitts.grillstats.domain.AlertKind;
import com.phillippitts.grillstats.domain.AlertRule;
import com.phillippitts.grillstats.domain.AlertState;
import com.phillippitts.grillstats.domain.AlertTransition;
import com.phillippitts.grillstats.domain.ConnectionStatus;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.domain.TemperatureUnit;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import com.phillippitts.grillstats.service.metrics.TelemetryMetrics;
import com.phillippitts.grillstats.testutil.EventCapturingPublisher;
import com.phillippitts.grillstats.testutil.MutableClock;
import com.phillippitts.grillstats.testutil.TestDevices;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.phillippitts.grillstats.testutil.TestDevices.FOOD_CHANNEL;
import static com.phillippitts.grillstats.testutil.TestDevices.PIT_CHANNEL;
import static com.phillippitts.grillstats.testutil.TestDevices.SMOKER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class AlertEvaluatorTest {

    private static final Instant T0 = Instant.parse("2025-06-01T12:00:00Z");

    private AlertRuleRegistry rules;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private AlertEvaluator evaluator;

    @BeforeEach
    void setUp() {
        TieredCache cache = new TieredCache(new CacheProperties(), new MutableClock(T0));
        rules = new AlertRuleRegistry(new AlertProperties(),
                new DeviceDirectory(TestDevices.registry(TestDevices.SMOKER), cache));
        rules.register(new AlertRule("done", SMOKER_ID, FOOD_CHANNEL, AlertKind.HIGH, 200, Duration.ofSeconds(30)));
        rules.register(new AlertRule("pit-cold", SMOKER_ID, PIT_CHANNEL, AlertKind.LOW, 225, Duration.ofSeconds(30)));
        rules.register(new AlertRule("offline", SMOKER_ID, null, AlertKind.DISCONNECT, 0, Duration.ofSeconds(30)));
        rules.register(new AlertRule("battery", SMOKER_ID, null, AlertKind.BATTERY, 20, Duration.ZERO));
        publisher = new EventCapturingPublisher();
        meterRegistry = new SimpleMeterRegistry();
        evaluator = new AlertEvaluator(rules, publisher, new TelemetryMetrics(meterRegistry));
    }

    @Test
    void firesOnlyAfterConditionHoldsForDebounceWindow() {
        assertThat(evaluator.onReading(food(201, 0))).isEmpty();
        assertThat(evaluator.onReading(food(202, 10))).isEmpty();
        assertThat(evaluator.instance("done", SMOKER_ID, FOOD_CHANNEL))
                .hasValueSatisfying(i -> assertThat(i.state()).isEqualTo(AlertState.PENDING));

        List<AlertTransition> emitted = evaluator.onReading(food(203, 30));

        assertThat(emitted).singleElement().satisfies(t -> {
            assertThat(t.state()).isEqualTo(AlertState.FIRING);
            assertThat(t.ruleId()).isEqualTo("done");
            assertThat(t.channelId()).isEqualTo(FOOD_CHANNEL);
            assertThat(t.observedValue()).isEqualTo(203.0);
            assertThat(t.timestamp()).isEqualTo(T0.plusSeconds(30));
        });
        assertThat(publisher.eventsOfType(AlertTransitionEvent.class)).hasSize(1);
    }

    @Test
    void spikeShorterThanDebounceNeverFires() {
        evaluator.onReading(food(230, 0));
        evaluator.onReading(food(231, 20));
        evaluator.onReading(food(150, 25));
        evaluator.onReading(food(232, 40));

        assertThat(evaluator.onReading(food(233, 60))).isEmpty();
        assertThat(publisher.eventsOfType(AlertTransitionEvent.class)).isEmpty();
    }

    @Test
    void firingAlertIsNotRepeated() {
        for (int s = 0; s <= 300; s += 10) {
            evaluator.onReading(food(210, s));
        }

        assertThat(publisher.eventsOfType(AlertTransitionEvent.class)).hasSize(1);
        assertThat(evaluator.firingAlerts(SMOKER_ID)).singleElement()
                .satisfies(t -> assertThat(t.timestamp()).isEqualTo(T0));
    }

    @Test
    void resolvesOnlyAfterConditionClearedForDebounceWindow() {
        fire();

        assertThat(evaluator.onReading(food(190, 40))).isEmpty();
        assertThat(evaluator.onReading(food(189, 50))).isEmpty();
        List<AlertTransition> resolved = evaluator.onReading(food(188, 60));

        assertThat(resolved).singleElement().satisfies(t -> {
            assertThat(t.state()).isEqualTo(AlertState.RESOLVED);
            assertThat(t.observedValue()).isEqualTo(188.0);
        });
        assertThat(evaluator.instance("done", SMOKER_ID, FOOD_CHANNEL)).isEmpty();
        assertThat(meterRegistry.get("grillstats.alert.transition").tag("state", "resolved").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void flappingAroundThresholdDoesNotResolve() {
        fire();

        evaluator.onReading(food(195, 40));
        evaluator.onReading(food(205, 50));
        evaluator.onReading(food(195, 60));
        evaluator.onReading(food(195, 75));

        assertThat(publisher.eventsOfType(AlertTransitionEvent.class))
                .extracting(e -> e.transition().state())
                .containsExactly(AlertState.FIRING);
    }

    @Test
    void lowRuleComparesBelowThreshold() {
        evaluator.onReading(pit(210, 0));
        List<AlertTransition> emitted = evaluator.onReading(pit(200, 30));

        assertThat(emitted).singleElement().satisfies(t -> assertThat(t.ruleKind()).isEqualTo(AlertKind.LOW));
    }

    @Test
    void transientOfflineDoesNotFireDisconnect() {
        evaluator.onStatus(status(ConnectionStatus.OFFLINE, 80), T0);
        evaluator.onStatus(status(ConnectionStatus.ONLINE, 80), T0.plusSeconds(10));
        evaluator.onStatus(status(ConnectionStatus.ONLINE, 80), T0.plusSeconds(60));

        assertThat(publisher.eventsOfType(AlertTransitionEvent.class)).isEmpty();
    }

    @Test
    void sustainedDegradedStatusFiresDisconnect() {
        evaluator.onStatus(status(ConnectionStatus.DEGRADED, 80), T0);
        List<AlertTransition> emitted = evaluator.onStatus(status(ConnectionStatus.OFFLINE, 80), T0.plusSeconds(30));

        assertThat(emitted).singleElement().satisfies(t -> {
            assertThat(t.ruleKind()).isEqualTo(AlertKind.DISCONNECT);
            assertThat(t.channelId()).isNull();
        });
    }

    @Test
    void batteryRuleWithZeroDebounceFiresImmediatelyAndIgnoresUnknownLevel() {
        assertThat(evaluator.onStatus(DeviceStatus.unknown(SMOKER_ID, ConnectionStatus.ONLINE), T0)).isEmpty();

        List<AlertTransition> emitted = evaluator.onStatus(status(ConnectionStatus.ONLINE, 12), T0.plusSeconds(1));

        assertThat(emitted).singleElement().satisfies(t -> {
            assertThat(t.ruleKind()).isEqualTo(AlertKind.BATTERY);
            assertThat(t.observedValue()).isEqualTo(12.0);
        });
    }

    @Test
    void readingsOfOtherChannelsAreIgnored() {
        evaluator.onReading(new Reading(SMOKER_ID, "probe-9", T0, 500, TemperatureUnit.FAHRENHEIT));
        evaluator.onReading(new Reading(SMOKER_ID, "probe-9", T0.plusSeconds(60), 500, TemperatureUnit.FAHRENHEIT));

        assertThat(publisher.eventsOfType(AlertTransitionEvent.class)).isEmpty();
    }

    @Test
    void forgetRuleDropsItsState() {
        fire();

        evaluator.forgetRule("done");

        assertThat(evaluator.firingAlerts(SMOKER_ID)).isEmpty();
    }

    @Test
    void silentChannelResolvesFiringAlertAfterDebounceWindow() {
        fire();

        assertThat(evaluator.onChannelSilent(SMOKER_ID, FOOD_CHANNEL, T0.plusSeconds(45))).isEmpty();
        assertThat(evaluator.firingAlerts(SMOKER_ID)).hasSize(1);

        List<AlertTransition> emitted = evaluator.onChannelSilent(SMOKER_ID, FOOD_CHANNEL, T0.plusSeconds(60));

        assertThat(emitted).singleElement().satisfies(t -> {
            assertThat(t.state()).isEqualTo(AlertState.RESOLVED);
            assertThat(t.ruleId()).isEqualTo("done");
            assertThat(t.observedValue()).isNull();
        });
        assertThat(evaluator.firingAlerts(SMOKER_ID)).isEmpty();
        assertThat(evaluator.channelsWithAlertState()).isEmpty();
    }

    @Test
    void silentChannelDropsPendingAlertAndLeavesOtherChannels() {
        evaluator.onReading(food(205, 0));
        evaluator.onReading(pit(200, 0));
        assertThat(evaluator.channelsWithAlertState())
                .containsEntry(SMOKER_ID, Set.of(FOOD_CHANNEL, PIT_CHANNEL));

        evaluator.onChannelSilent(SMOKER_ID, FOOD_CHANNEL, T0.plusSeconds(5));

        assertThat(evaluator.instance("done", SMOKER_ID, FOOD_CHANNEL)).isEmpty();
        assertThat(evaluator.instance("pit-cold", SMOKER_ID, PIT_CHANNEL)).isPresent();
        assertThat(publisher.eventsOfType(AlertTransitionEvent.class)).isEmpty();
    }

    @Test
    void targetRuleFiresAtExactThreshold() {
        rules.register(new AlertRule("target", SMOKER_ID, FOOD_CHANNEL, AlertKind.TARGET, 203, Duration.ZERO));

        assertThat(evaluator.onReading(food(202.9, 0))).isEmpty();
        assertThat(evaluator.onReading(food(203, 10)))
                .extracting(AlertTransition::ruleId, AlertTransition::state)
                .containsExactly(tuple("target", AlertState.FIRING));
    }

    @Test
    void rangeRuleHoldsOutsideEitherBound() {
        rules.register(new AlertRule("pit-band", SMOKER_ID, PIT_CHANNEL, AlertKind.RANGE, 200, Duration.ZERO, 275.0));

        assertThat(evaluator.onReading(pit(250, 0))).isEmpty();
        assertThat(evaluator.onReading(pit(280, 10))).singleElement().satisfies(t -> {
            assertThat(t.ruleKind()).isEqualTo(AlertKind.RANGE);
            assertThat(t.state()).isEqualTo(AlertState.FIRING);
        });
        assertThat(evaluator.onReading(pit(190, 20))).isEmpty();
        assertThat(evaluator.onReading(pit(240, 30)))
                .filteredOn(t -> t.ruleId().equals("pit-band"))
                .singleElement()
                .satisfies(t -> assertThat(t.state()).isEqualTo(AlertState.RESOLVED));
    }

    @Test
    void risingRuleComparesWithPreviousReadingOfSameChannel() {
        rules.register(new AlertRule("spike", SMOKER_ID, FOOD_CHANNEL, AlertKind.RISING, 5, Duration.ZERO));

        assertThat(evaluator.onReading(food(150, 0))).isEmpty();
        evaluator.onReading(pit(300, 5));
        assertThat(evaluator.onReading(food(153, 10))).isEmpty();
        assertThat(evaluator.onReading(food(160, 20))).singleElement().satisfies(t -> {
            assertThat(t.ruleId()).isEqualTo("spike");
            assertThat(t.state()).isEqualTo(AlertState.FIRING);
            assertThat(t.observedValue()).isEqualTo(160.0);
        });
        assertThat(evaluator.onReading(food(161, 30))).singleElement()
                .satisfies(t -> assertThat(t.state()).isEqualTo(AlertState.RESOLVED));
    }

    @Test
    void fallingRuleDetectsDrop() {
        rules.register(new AlertRule("lid-open", SMOKER_ID, PIT_CHANNEL, AlertKind.FALLING, 20, Duration.ZERO));

        evaluator.onReading(pit(260, 0));
        assertThat(evaluator.onReading(pit(250, 10))).isEmpty();

        assertThat(evaluator.onReading(pit(228, 20)))
                .extracting(AlertTransition::ruleId)
                .containsExactly("lid-open");
    }

    @Test
    void silenceForgetsPreviousReadingForRateRules() {
        rules.register(new AlertRule("spike", SMOKER_ID, FOOD_CHANNEL, AlertKind.RISING, 5, Duration.ZERO));
        evaluator.onReading(food(150, 0));

        evaluator.onChannelSilent(SMOKER_ID, FOOD_CHANNEL, T0.plusSeconds(60));

        assertThat(evaluator.onReading(food(170, 120))).isEmpty();
    }

    private void fire() {
        evaluator.onReading(food(210, 0));
        evaluator.onReading(food(210, 30));
        assertThat(evaluator.firingAlerts(SMOKER_ID)).hasSize(1);
    }

    private static Reading food(double temperature, long seconds) {
        return new Reading(SMOKER_ID, FOOD_CHANNEL, T0.plusSeconds(seconds), temperature, TemperatureUnit.FAHRENHEIT);
    }

    private static Reading pit(double temperature, long seconds) {
        return new Reading(SMOKER_ID, PIT_CHANNEL, T0.plusSeconds(seconds), temperature, TemperatureUnit.FAHRENHEIT);
    }

    private static DeviceStatus status(ConnectionStatus connection, int battery) {
        return new DeviceStatus(SMOKER_ID, battery, 80, connection, T0);
    }
}
