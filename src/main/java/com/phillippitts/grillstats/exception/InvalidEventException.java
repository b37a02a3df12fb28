package com.phillippitts.grillstats.exception;

/**
 * Thrown when a cooking event cannot be injected (no session on the channel, or the event type
 * does not apply to the channel's probe type).
 */
public class InvalidEventException extends GrillStatsException {

    public InvalidEventException(String message) {
        super(message);
    }
}
