package com.phillippitts.grillstats.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Externally visible change of an alert instance, emitted to stream subscribers and to the
 * notification collaborator.
 *
 * @param ruleId        rule that produced the transition
 * @param deviceId      device the alert belongs to
 * @param channelId     channel for temperature alerts, {@code null} for device alerts
 * @param ruleKind      kind of the rule
 * @param state         {@link AlertState#FIRING} or {@link AlertState#RESOLVED}
 * @param timestamp     when the transition was honoured
 * @param observedValue the value that drove the transition (temperature, battery, signal)
 */
public record AlertTransition(
        String ruleId,
        String deviceId,
        String channelId,
        AlertKind ruleKind,
        AlertState state,
        Instant timestamp,
        Double observedValue
) {

    public AlertTransition {
        Objects.requireNonNull(ruleId, "Rule id must not be null");
        Objects.requireNonNull(deviceId, "Device id must not be null");
        Objects.requireNonNull(ruleKind, "Rule kind must not be null");
        Objects.requireNonNull(state, "State must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        if (state == AlertState.PENDING) {
            throw new IllegalArgumentException("Pending alerts are internal and never emitted");
        }
    }
}
