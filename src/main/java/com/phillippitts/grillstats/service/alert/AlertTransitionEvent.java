package com.phillippitts.grillstats.service.alert;

import com.phillippitts.grillstats.domain.AlertTransition;

import java.util.Objects;

/**
 * Published when an alert fires or resolves.
 */
public record AlertTransitionEvent(AlertTransition transition) {

    public AlertTransitionEvent {
        Objects.requireNonNull(transition, "transition");
    }
}
