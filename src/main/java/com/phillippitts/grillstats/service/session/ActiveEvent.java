package com.phillippitts.grillstats.service.session;

import java.time.Duration;
import java.time.Instant;

/**
 * An event that has started affecting a session.
 */
record ActiveEvent(CookingEvent event, Instant startedAt) {

    /** Signed contribution at {@code now}; zero once the decay window has passed. */
    double offsetAt(Instant now) {
        long elapsed = Duration.between(startedAt, now).toMillis();
        long decay = event.decay().toMillis();
        if (elapsed >= decay) {
            return 0.0;
        }
        double remaining = 1.0 - Math.max(0, elapsed) / (double) decay;
        return event.type().sign() * event.magnitude() * remaining;
    }

    boolean isFinished(Instant now) {
        return !now.isBefore(startedAt.plus(event.decay()));
    }
}
