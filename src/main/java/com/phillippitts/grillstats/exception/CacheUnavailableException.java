package com.phillippitts.grillstats.exception;

import com.phillippitts.grillstats.service.cache.CacheNamespace;

/**
 * Thrown when a cache namespace cannot serve reads or writes. Callers treat the namespace as
 * unavailable for the current tick and retry on the next one.
 */
public class CacheUnavailableException extends GrillStatsException {

    private final CacheNamespace namespace;

    public CacheUnavailableException(CacheNamespace namespace, String message) {
        super(message + " (namespace: " + namespace.key() + ")");
        this.namespace = namespace;
    }

    public CacheNamespace getNamespace() {
        return namespace;
    }
}
