package com.phillippitts.grillstats.service.alert;

import com.phillippitts.grillstats.domain.AlertRule;
import com.phillippitts.grillstats.domain.AlertState;

import java.time.Instant;

/**
 * State of one rule for one channel (or one device, for status rules).
 *
 * <p>{@code firstObservedAt} is when the condition started holding. {@code lastObservedAt} is
 * the last time it was seen holding; a firing instance resolves once the condition has not held
 * for a full debounce window since then. RESOLVED is emitted but never stored: the instance is
 * dropped, which is the "none" state.
 */
public record AlertInstance(
        AlertRule rule,
        String deviceId,
        String channelId,
        AlertState state,
        Instant firstObservedAt,
        Instant lastObservedAt,
        Double lastValue
) {

    AlertInstance observed(Instant at, Double value) {
        return new AlertInstance(rule, deviceId, channelId, state, firstObservedAt, at, value);
    }

    AlertInstance firing(Instant at, Double value) {
        return new AlertInstance(rule, deviceId, channelId, AlertState.FIRING, firstObservedAt, at, value);
    }
}
