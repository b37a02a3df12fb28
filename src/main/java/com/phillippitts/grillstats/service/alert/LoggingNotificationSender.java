package com.phillippitts.grillstats.service.alert;

import com.phillippitts.grillstats.domain.AlertTransition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Log-only notification sender. */
@Component
class LoggingNotificationSender implements NotificationSender {
    private static final Logger LOG = LogManager.getLogger(LoggingNotificationSender.class);

    @Override
    public void send(AlertTransition t) {
        LOG.info("NOTIFY {} {} on {}{} at {} (value={})", t.ruleKind(), t.state(), t.deviceId(),
                t.channelId() == null ? "" : ":" + t.channelId(), t.timestamp(), t.observedValue());
    }

    @Override
    public String name() {
        return "log";
    }
}
