package com.phillippitts.grillstats.exception;

/**
 * Thrown when a client exceeds its allowance within the current rate-limit window.
 */
public class RateLimitExceededException extends GrillStatsException {

    private final String limitKey;

    public RateLimitExceededException(String limitKey, long limit) {
        super("Rate limit of " + limit + " exceeded for " + limitKey);
        this.limitKey = limitKey;
    }

    public String getLimitKey() {
        return limitKey;
    }
}
