package com.phillippitts.grillstats.service.alert;

import com.phillippitts.grillstats.config.properties.AlertProperties;
import com.phillippitts.grillstats.domain.AlertRule;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.exception.InvalidAlertRuleException;
import com.phillippitts.grillstats.exception.UnknownDeviceException;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Alert rules in force. Configured rules are loaded at startup; rules added at runtime go through
 * the same validation. A malformed rule is rejected where it is introduced.
 */
@Component
public class AlertRuleRegistry {

    private static final Logger LOG = LogManager.getLogger(AlertRuleRegistry.class);

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final DeviceDirectory directory;

    public AlertRuleRegistry(AlertProperties properties, DeviceDirectory directory) {
        this.directory = directory;
        for (AlertProperties.RuleDefinition definition : properties.getRules()) {
            AlertRule rule = definition.toRule();
            validate(rule);
            if (rules.putIfAbsent(rule.id(), rule) != null) {
                throw new InvalidAlertRuleException("Duplicate alert rule id: " + rule.id());
            }
        }
        LOG.info("Loaded {} alert rule(s)", rules.size());
    }

    /**
     * Adds or replaces a rule.
     *
     * @return the rule it replaced, if any
     * @throws InvalidAlertRuleException if the rule targets an unknown device or channel
     */
    public Optional<AlertRule> register(AlertRule rule) {
        validate(rule);
        AlertRule previous = rules.put(rule.id(), rule);
        LOG.info("Registered alert rule {} ({} {} on {}{})", rule.id(), rule.kind(), rule.threshold(),
                rule.deviceId(), rule.channelId() == null ? "" : ":" + rule.channelId());
        return Optional.ofNullable(previous);
    }

    public Optional<AlertRule> remove(String ruleId) {
        AlertRule removed = rules.remove(ruleId);
        if (removed != null) {
            LOG.info("Removed alert rule {}", ruleId);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<AlertRule> rule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public Collection<AlertRule> rules() {
        return List.copyOf(rules.values());
    }

    public List<AlertRule> rulesFor(String deviceId) {
        return rules.values().stream().filter(r -> r.deviceId().equals(deviceId)).toList();
    }

    private void validate(AlertRule rule) {
        Device device;
        try {
            device = directory.getDevice(rule.deviceId());
        } catch (UnknownDeviceException e) {
            throw new InvalidAlertRuleException("Alert rule '" + rule.id() + "' targets unknown device " + rule.deviceId());
        }
        if (rule.channelId() != null && device.channel(rule.channelId()).isEmpty()) {
            throw new InvalidAlertRuleException("Alert rule '" + rule.id() + "' targets unknown channel "
                    + rule.channelId() + " on " + rule.deviceId());
        }
    }
}
