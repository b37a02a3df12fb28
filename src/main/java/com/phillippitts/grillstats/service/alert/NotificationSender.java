package com.phillippitts.grillstats.service.alert;

import com.phillippitts.grillstats.domain.AlertTransition;

/**
 * Outbound channel for alert transitions (push, mail, chat, ...).
 */
public interface NotificationSender {

    /**
     * Delivers one transition. Implementations may throw; failures are logged by the caller and
     * never affect the pipeline.
     */
    void send(AlertTransition transition);

    String name();
}
