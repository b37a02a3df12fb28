package com.phillippitts.grillstats.service.history;

import com.phillippitts.grillstats.domain.Reading;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Store that only logs, used until a time-series backend is wired in. */
@Component
class LoggingHistoricalStore implements HistoricalStore {
    private static final Logger LOG = LogManager.getLogger(LoggingHistoricalStore.class);

    @Override
    public void store(Reading reading) {
        LOG.debug("history {} {}{} @ {}", reading.channelKey(), reading.temperature(),
                reading.unit().symbol(), reading.timestamp());
    }
}
