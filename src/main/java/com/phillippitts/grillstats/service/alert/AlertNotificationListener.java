package com.phillippitts.grillstats.service.alert;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Hands every firing/resolved transition to the notification senders. A failing sender is
 * logged and skipped.
 */
@Component
class AlertNotificationListener {
    private static final Logger LOG = LogManager.getLogger(AlertNotificationListener.class);

    private final List<NotificationSender> senders;

    AlertNotificationListener(List<NotificationSender> senders) {
        this.senders = List.copyOf(senders);
    }

    @EventListener
    void onTransition(AlertTransitionEvent event) {
        for (NotificationSender sender : senders) {
            try {
                sender.send(event.transition());
            } catch (RuntimeException e) {
                LOG.warn("Notification sender {} failed for rule {}: {}",
                        sender.name(), event.transition().ruleId(), e.toString());
            }
        }
    }
}
