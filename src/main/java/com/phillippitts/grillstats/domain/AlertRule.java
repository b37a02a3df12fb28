package com.phillippitts.grillstats.domain;

import com.phillippitts.grillstats.exception.InvalidAlertRuleException;

import java.time.Duration;

/**
 * Threshold rule evaluated by the alert evaluator.
 *
 * <p>Temperature rules may name a channel, or leave it {@code null} to watch every channel of the
 * device. Status rules ({@code DISCONNECT}/{@code BATTERY}) are device scoped and must not name a
 * channel. The thresholds of a temperature rule are interpreted in the unit of the channel they are
 * compared against; a battery threshold is a percentage. {@code RANGE} rules use {@code threshold}
 * as the lower and {@code upperThreshold} as the upper bound; {@code RISING}/{@code FALLING} use a
 * positive {@code threshold} as the minimum change between consecutive readings.
 *
 * @param id             rule identifier
 * @param deviceId       device the rule applies to
 * @param channelId      channel the rule applies to, or {@code null}
 * @param kind           condition kind
 * @param threshold      comparison threshold (ignored for {@code DISCONNECT})
 * @param debounce       how long the condition must hold (or stop holding) before a transition
 * @param upperThreshold upper bound of a {@code RANGE} rule, {@code null} for every other kind
 */
public record AlertRule(
        String id,
        String deviceId,
        String channelId,
        AlertKind kind,
        double threshold,
        Duration debounce,
        Double upperThreshold
) {

    public AlertRule {
        if (id == null || id.isBlank()) {
            throw new InvalidAlertRuleException("Alert rule id must not be blank");
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new InvalidAlertRuleException("Alert rule '" + id + "' must name a device");
        }
        if (kind == null) {
            throw new InvalidAlertRuleException("Alert rule '" + id + "' must declare a kind");
        }
        if (debounce == null || debounce.isNegative()) {
            throw new InvalidAlertRuleException("Alert rule '" + id + "' needs a non-negative debounce window");
        }
        if (kind.isStatusBased() && channelId != null) {
            throw new InvalidAlertRuleException(
                    "Alert rule '" + id + "' of kind " + kind + " is device scoped and must not name a channel");
        }
        if (kind == AlertKind.BATTERY && (threshold < 0 || threshold > 100)) {
            throw new InvalidAlertRuleException(
                    "Battery threshold of rule '" + id + "' must be between 0 and 100, got: " + threshold);
        }
        if (Double.isNaN(threshold) || Double.isInfinite(threshold)) {
            throw new InvalidAlertRuleException("Alert rule '" + id + "' threshold must be finite");
        }
        if (kind == AlertKind.RANGE) {
            if (upperThreshold == null || upperThreshold.isNaN() || upperThreshold.isInfinite()) {
                throw new InvalidAlertRuleException("Range rule '" + id + "' needs a finite upper threshold");
            }
            if (upperThreshold <= threshold) {
                throw new InvalidAlertRuleException("Range rule '" + id + "' upper threshold " + upperThreshold
                        + " must be above its lower threshold " + threshold);
            }
        } else if (upperThreshold != null) {
            throw new InvalidAlertRuleException("Only range rules take an upper threshold, rule '" + id
                    + "' is " + kind);
        }
        if (kind.isRateBased() && threshold <= 0) {
            throw new InvalidAlertRuleException(
                    "Rate rule '" + id + "' needs a positive change threshold, got: " + threshold);
        }
    }

    public AlertRule(String id, String deviceId, String channelId, AlertKind kind, double threshold,
                     Duration debounce) {
        this(id, deviceId, channelId, kind, threshold, debounce, null);
    }

    public boolean appliesTo(String deviceId, String channelId) {
        if (!this.deviceId.equals(deviceId)) {
            return false;
        }
        return this.channelId == null || this.channelId.equals(channelId);
    }
}
