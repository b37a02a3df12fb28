package com.phillippitts.grillstats.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Device poll cadence and timeout.
 */
@Validated
@ConfigurationProperties(prefix = "grill.polling")
public class PollingProperties {

    /** Data source for every device: {@code simulated} or {@code remote}. */
    @NotNull
    private String source = "simulated";

    /** Delay between the end of one poll tick and the start of the next, per device. */
    @NotNull
    private Duration interval = Duration.ofSeconds(5);

    /** A poll that has not answered within this time marks its device degraded. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(3);

    /** Threads of the scheduler that triggers poll ticks. */
    @Positive(message = "Scheduler pool size must be positive")
    private int schedulerPoolSize = 2;

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getSchedulerPoolSize() {
        return schedulerPoolSize;
    }

    public void setSchedulerPoolSize(int schedulerPoolSize) {
        this.schedulerPoolSize = schedulerPoolSize;
    }
}
