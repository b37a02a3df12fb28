package com.phillippitts.grillstats.config.properties;

import com.phillippitts.grillstats.domain.AlertKind;
import com.phillippitts.grillstats.domain.AlertRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Alert rules supplied through configuration.
 *
 * <pre>
 * grill.alerts.rules[0].id=brisket-done
 * grill.alerts.rules[0].device-id=smoker-1
 * grill.alerts.rules[0].channel-id=probe-1
 * grill.alerts.rules[0].kind=HIGH
 * grill.alerts.rules[0].threshold=203
 * grill.alerts.rules[0].debounce=30s
 * </pre>
 *
 * <p>A {@code RANGE} rule also sets {@code upper-threshold}. Rules are validated when the rule registry is built, so a malformed rule stops startup.
 */
@ConfigurationProperties(prefix = "grill.alerts")
public class AlertProperties {

    private List<RuleDefinition> rules = new ArrayList<>();

    /** How often channels without a live reading are checked for alerts to resolve. */
    private long silenceCheckIntervalMs = 5_000;

    public long getSilenceCheckIntervalMs() {
        return silenceCheckIntervalMs;
    }

    public void setSilenceCheckIntervalMs(long silenceCheckIntervalMs) {
        this.silenceCheckIntervalMs = silenceCheckIntervalMs;
    }

    public List<RuleDefinition> getRules() {
        return rules;
    }

    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules;
    }

    /**
     * Bindable form of an {@link AlertRule}.
     */
    public static class RuleDefinition {
        private String id;
        private String deviceId;
        private String channelId;
        private AlertKind kind;
        private double threshold;
        private Double upperThreshold;
        private Duration debounce = Duration.ofSeconds(30);

        public AlertRule toRule() {
            return new AlertRule(id, deviceId, channelId, kind, threshold, debounce, upperThreshold);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getDeviceId() {
            return deviceId;
        }

        public void setDeviceId(String deviceId) {
            this.deviceId = deviceId;
        }

        public String getChannelId() {
            return channelId;
        }

        public void setChannelId(String channelId) {
            this.channelId = channelId;
        }

        public AlertKind getKind() {
            return kind;
        }

        public void setKind(AlertKind kind) {
            this.kind = kind;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public Double getUpperThreshold() {
            return upperThreshold;
        }

        public void setUpperThreshold(Double upperThreshold) {
            this.upperThreshold = upperThreshold;
        }

        public Duration getDebounce() {
            return debounce;
        }

        public void setDebounce(Duration debounce) {
            this.debounce = debounce;
        }
    }
}
