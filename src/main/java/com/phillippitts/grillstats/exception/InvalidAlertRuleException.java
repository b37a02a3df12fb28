package com.phillippitts.grillstats.exception;

/**
 * Thrown when an alert rule is malformed. Rules are rejected when they are created, whether
 * from configuration at startup or through the API.
 */
public class InvalidAlertRuleException extends GrillStatsException {

    public InvalidAlertRuleException(String message) {
        super(message);
    }
}
