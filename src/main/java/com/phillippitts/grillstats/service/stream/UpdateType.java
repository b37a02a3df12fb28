package com.phillippitts.grillstats.service.stream;

/**
 * Kind of message pushed to a dashboard client. The lower-case name is the SSE event name.
 */
public enum UpdateType {
    /** Full device state, sent first on every (re)subscribe. */
    SNAPSHOT,
    /** One channel's new reading. */
    READING,
    /** Battery, signal and connectivity. */
    STATUS,
    /** An alert fired or resolved. */
    ALERT,
    /** Keep-alive with no payload. */
    HEARTBEAT;

    public String eventName() {
        return name().toLowerCase();
    }
}
