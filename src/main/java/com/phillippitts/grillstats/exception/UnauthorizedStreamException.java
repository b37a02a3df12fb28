package com.phillippitts.grillstats.exception;

/**
 * Thrown when a stream subscription presents no token, or a token that was revoked or expired.
 */
public class UnauthorizedStreamException extends GrillStatsException {

    public UnauthorizedStreamException(String message) {
        super(message);
    }
}
