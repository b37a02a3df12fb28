/**
 * Namespaced TTL cache that holds every "current" value of the pipeline.
 */
package com.phillippitts.grillstats.service.cache;
