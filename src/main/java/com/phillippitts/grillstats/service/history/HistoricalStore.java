package com.phillippitts.grillstats.service.history;

import com.phillippitts.grillstats.domain.Reading;

/**
 * Long-term storage of readings (time-series database). Called off the live path.
 */
public interface HistoricalStore {

    /**
     * Stores one reading. May block or throw; the forwarder absorbs both.
     */
    void store(Reading reading);
}
