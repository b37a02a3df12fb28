package com.phillippitts.grillstats.service.stream;

/**
 * Returned by {@link StreamDispatcher#subscribe}; pass it back to unsubscribe.
 */
public record SubscriptionHandle(String subscriptionId, String clientId, String deviceId) {
}
