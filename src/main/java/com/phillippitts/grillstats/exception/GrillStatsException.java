package com.phillippitts.grillstats.exception;

/**
 * Base exception for all grill-stats telemetry errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class GrillStatsException extends RuntimeException {

    public GrillStatsException(String message) {
        super(message);
    }

    public GrillStatsException(String message, Throwable cause) {
        super(message, cause);
    }

    public GrillStatsException(Throwable cause) {
        super(cause);
    }
}
