package com.phillippitts.grillstats.service.session;

import com.phillippitts.grillstats.domain.Reading;

/**
 * Outcome of advancing a session once: a reading, or the terminal marker when the profile has
 * no phases left.
 *
 * @param reading produced reading, null when terminal
 * @param phaseName phase the reading belongs to, null when terminal
 * @param terminal whether the session has finished its profile
 */
public record SessionTick(Reading reading, String phaseName, boolean terminal) {

    private static final SessionTick TERMINAL = new SessionTick(null, null, true);

    public static SessionTick of(Reading reading, String phaseName) {
        return new SessionTick(reading, phaseName, false);
    }

    public static SessionTick terminalTick() {
        return TERMINAL;
    }
}
