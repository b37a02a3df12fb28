package com.phillippitts.grillstats.service.history;

import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.service.metrics.TelemetryMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget copy of every reading to the {@link HistoricalStore}.
 *
 * <p>Runs on the history executor. A full queue or a failing store drops the reading, counts
 * it and logs; the caller never waits and never sees an error.
 */
@Component
public class HistoryForwarder {

    private static final Logger LOG = LogManager.getLogger(HistoryForwarder.class);

    private final HistoricalStore store;
    private final Executor historyExecutor;
    private final TelemetryMetrics metrics;

    public HistoryForwarder(HistoricalStore store,
                            @Qualifier("historyExecutor") Executor historyExecutor,
                            TelemetryMetrics metrics) {
        this.store = store;
        this.historyExecutor = historyExecutor;
        this.metrics = metrics;
    }

    public void forward(Reading reading) {
        try {
            historyExecutor.execute(() -> storeQuietly(reading));
        } catch (RejectedExecutionException e) {
            metrics.incrementHistoryFailure("rejected");
            LOG.warn("History queue full; dropped reading for {}", reading.channelKey());
        }
    }

    private void storeQuietly(Reading reading) {
        try {
            store.store(reading);
        } catch (RuntimeException e) {
            metrics.incrementHistoryFailure("error");
            LOG.warn("Historical store rejected reading for {}: {}", reading.channelKey(), e.toString());
        }
    }
}
