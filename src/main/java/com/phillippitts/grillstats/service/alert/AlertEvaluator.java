package com.phillippitts.grillstats.service.alert;

import com.phillippitts.grillstats.domain.AlertKind;
import com.phillippitts.grillstats.domain.AlertRule;
import com.phillippitts.grillstats.domain.AlertState;
import com.phillippitts.grillstats.domain.AlertTransition;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.service.metrics.TelemetryMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Debounced threshold alerts.
 *
 * <p>State machine per (rule, channel):
 * <ul>
 *   <li>none → PENDING as soon as the condition holds</li>
 *   <li>PENDING → FIRING once it has held continuously for the debounce window; back to none
 *       if it stops holding first</li>
 *   <li>FIRING → RESOLVED → none once it has not held for the debounce window</li>
 * </ul>
 * Only FIRING and RESOLVED are published, as {@link AlertTransitionEvent}s. Temperature rules
 * compare readings against thresholds in the channel's unit; RISING and FALLING compare against the
 * channel's previous reading. DISCONNECT holds while the device is not ONLINE and BATTERY while the
 * battery percentage is below the threshold.
 *
 * <p>A channel that stops reporting counts as "condition not holding" once
 * {@link #onChannelSilent} is called for it, so its alerts resolve after the debounce window.
 */
@Component
public class AlertEvaluator {

    private static final Logger LOG = LogManager.getLogger(AlertEvaluator.class);

    private final ConcurrentMap<String, AlertInstance> instances = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Double> previousTemperatures = new ConcurrentHashMap<>();
    private final AlertRuleRegistry rules;
    private final ApplicationEventPublisher publisher;
    private final TelemetryMetrics metrics;

    public AlertEvaluator(AlertRuleRegistry rules, ApplicationEventPublisher publisher, TelemetryMetrics metrics) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Evaluates every temperature rule that covers the reading's channel.
     *
     * @return transitions emitted by this reading
     */
    public List<AlertTransition> onReading(Reading reading) {
        List<AlertTransition> emitted = new ArrayList<>();
        Double previous = previousTemperatures.put(reading.channelKey(), reading.temperature());
        for (AlertRule rule : rules.rulesFor(reading.deviceId())) {
            if (rule.kind().isStatusBased() || !rule.appliesTo(reading.deviceId(), reading.channelId())) {
                continue;
            }
            boolean holds = holds(rule, reading.temperature(), previous);
            evaluate(rule, reading.deviceId(), reading.channelId(), holds, reading.temperature(), reading.timestamp())
                    .ifPresent(emitted::add);
        }
        return emitted;
    }

    /**
     * Evaluates the device's DISCONNECT and BATTERY rules.
     *
     * @return transitions emitted by this status
     */
    public List<AlertTransition> onStatus(DeviceStatus status, Instant now) {
        List<AlertTransition> emitted = new ArrayList<>();
        for (AlertRule rule : rules.rulesFor(status.deviceId())) {
            if (!rule.kind().isStatusBased()) {
                continue;
            }
            boolean holds;
            Double value;
            if (rule.kind() == AlertKind.DISCONNECT) {
                holds = !status.isOnline();
                value = null;
            } else {
                holds = status.batteryPercent() != null && status.batteryPercent() < rule.threshold();
                value = status.batteryPercent() == null ? null : status.batteryPercent().doubleValue();
            }
            evaluate(rule, status.deviceId(), null, holds, value, now).ifPresent(emitted::add);
        }
        return emitted;
    }

    /**
     * Re-evaluates the channel's temperature rules as not holding, because it has no live reading.
     * Pending alerts are dropped; firing ones resolve once the debounce window has passed since the
     * condition was last observed. The previous reading used by rate rules is forgotten.
     *
     * @return transitions emitted
     */
    public List<AlertTransition> onChannelSilent(String deviceId, String channelId, Instant now) {
        previousTemperatures.remove(Reading.channelKey(deviceId, channelId));
        List<AlertTransition> emitted = new ArrayList<>();
        for (AlertRule rule : rules.rulesFor(deviceId)) {
            if (rule.kind().isStatusBased() || !rule.appliesTo(deviceId, channelId)) {
                continue;
            }
            evaluate(rule, deviceId, channelId, false, null, now).ifPresent(emitted::add);
        }
        return emitted;
    }

    /** Channels with temperature-alert state, grouped by device. */
    public Map<String, Set<String>> channelsWithAlertState() {
        Map<String, Set<String>> channels = new HashMap<>();
        for (AlertInstance instance : instances.values()) {
            if (instance.channelId() != null) {
                channels.computeIfAbsent(instance.deviceId(), d -> new HashSet<>()).add(instance.channelId());
            }
        }
        return channels;
    }

    /** Alerts currently firing on a device, oldest first. */
    public List<AlertTransition> firingAlerts(String deviceId) {
        return instances.values().stream()
                .filter(i -> i.deviceId().equals(deviceId) && i.state() == AlertState.FIRING)
                .sorted(Comparator.comparing(AlertInstance::firstObservedAt))
                .map(i -> toTransition(i, AlertState.FIRING, i.firstObservedAt()))
                .toList();
    }

    public Optional<AlertInstance> instance(String ruleId, String deviceId, String channelId) {
        return Optional.ofNullable(instances.get(key(ruleId, deviceId, channelId)));
    }

    /** Drops all state of a rule, for example after it was removed. */
    public void forgetRule(String ruleId) {
        instances.values().removeIf(i -> i.rule().id().equals(ruleId));
    }

    static boolean holds(AlertRule rule, double temperature, Double previous) {
        return switch (rule.kind()) {
            case HIGH -> temperature > rule.threshold();
            case LOW -> temperature < rule.threshold();
            case TARGET -> temperature >= rule.threshold();
            case RANGE -> temperature < rule.threshold() || temperature > rule.upperThreshold();
            case RISING -> previous != null && temperature - previous >= rule.threshold();
            case FALLING -> previous != null && previous - temperature >= rule.threshold();
            case DISCONNECT, BATTERY -> throw new IllegalArgumentException(
                    "Rule " + rule.id() + " of kind " + rule.kind() + " is not evaluated against readings");
        };
    }

    private Optional<AlertTransition> evaluate(AlertRule rule, String deviceId, String channelId,
                                               boolean holds, Double value, Instant now) {
        AlertTransition[] emitted = new AlertTransition[1];
        instances.compute(key(rule.id(), deviceId, channelId), (k, current) -> {
            if (current == null || !current.rule().equals(rule)) {
                if (!holds) {
                    return null;
                }
                AlertInstance pending = new AlertInstance(rule, deviceId, channelId, AlertState.PENDING, now, now, value);
                return promoteIfDue(pending, now, value, emitted);
            }
            if (current.state() == AlertState.PENDING) {
                return holds ? promoteIfDue(current.observed(now, value), now, value, emitted) : null;
            }
            if (holds) {
                return current.observed(now, value);
            }
            if (!Duration.between(current.lastObservedAt(), now).minus(rule.debounce()).isNegative()) {
                emitted[0] = new AlertTransition(rule.id(), deviceId, channelId, rule.kind(),
                        AlertState.RESOLVED, now, value);
                return null;
            }
            return current;
        });
        if (emitted[0] != null) {
            publish(emitted[0]);
        }
        return Optional.ofNullable(emitted[0]);
    }

    private AlertInstance promoteIfDue(AlertInstance pending, Instant now, Double value, AlertTransition[] emitted) {
        Duration held = Duration.between(pending.firstObservedAt(), now);
        if (held.compareTo(pending.rule().debounce()) >= 0) {
            AlertInstance firing = pending.firing(now, value);
            emitted[0] = toTransition(firing, AlertState.FIRING, now);
            return firing;
        }
        return pending;
    }

    private void publish(AlertTransition transition) {
        metrics.incrementAlertTransition(transition.ruleKind(), transition.state());
        LOG.info("Alert {} {}: rule={} device={} channel={} value={}", transition.ruleKind(), transition.state(),
                transition.ruleId(), transition.deviceId(), transition.channelId(), transition.observedValue());
        publisher.publishEvent(new AlertTransitionEvent(transition));
    }

    private static AlertTransition toTransition(AlertInstance instance, AlertState state, Instant at) {
        return new AlertTransition(instance.rule().id(), instance.deviceId(), instance.channelId(),
                instance.rule().kind(), state, at, instance.lastValue());
    }

    private static String key(String ruleId, String deviceId, String channelId) {
        return ruleId + '|' + deviceId + '|' + (channelId == null ? "*" : channelId);
    }
}
