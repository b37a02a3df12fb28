package com.phillippitts.grillstats.service.metrics;

import com.phillippitts.grillstats.domain.AlertKind;
import com.phillippitts.grillstats.domain.AlertState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the telemetry pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Poll latency and failures per device source (simulated, remote)</li>
 *   <li>Readings applied and stale poll results discarded</li>
 *   <li>Stream updates dropped for slow subscribers</li>
 *   <li>Alert transitions by kind and state</li>
 *   <li>Readings the historical store did not accept</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TelemetryMetrics {

    private static final String METRIC_PREFIX = "grillstats";

    private final MeterRegistry registry;

    public TelemetryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a device poll took.
     *
     * @param source device source (simulated, remote)
     * @param durationNanos duration in nanoseconds
     */
    public void recordPollLatency(String source, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".poll.latency")
                .description("Time taken to poll a device")
                .tag("source", source)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param source device source (simulated, remote)
     * @param reason failure reason (timeout, error, rejected)
     */
    public void incrementPollFailure(String source, String reason) {
        Counter.builder(METRIC_PREFIX + ".poll.failure")
                .description("Number of failed device polls")
                .tag("source", source)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementPollSkipped() {
        Counter.builder(METRIC_PREFIX + ".poll.skipped")
                .description("Poll ticks skipped because the previous poll was still running")
                .register(registry)
                .increment();
    }

    public void incrementStaleDiscarded() {
        Counter.builder(METRIC_PREFIX + ".poll.discarded")
                .description("Poll results discarded after a session or device was cancelled")
                .register(registry)
                .increment();
    }

    public void incrementReadingsApplied(int count) {
        Counter.builder(METRIC_PREFIX + ".readings.applied")
                .description("Readings written to the live cache")
                .register(registry)
                .increment(count);
    }

    public void incrementDroppedUpdate() {
        Counter.builder(METRIC_PREFIX + ".stream.dropped")
                .description("Stream updates dropped from full subscriber buffers")
                .register(registry)
                .increment();
    }

    public void incrementAlertTransition(AlertKind kind, AlertState state) {
        Counter.builder(METRIC_PREFIX + ".alert.transition")
                .description("Alert transitions emitted")
                .tag("kind", kind.name().toLowerCase())
                .tag("state", state.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * @param reason why forwarding failed (rejected, error)
     */
    public void incrementHistoryFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".history.failure")
                .description("Readings not forwarded to the historical store")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
