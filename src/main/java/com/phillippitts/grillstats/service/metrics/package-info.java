/**
 * Micrometer counters and timers for polling, alerting and streaming.
 */
package com.phillippitts.grillstats.service.metrics;
