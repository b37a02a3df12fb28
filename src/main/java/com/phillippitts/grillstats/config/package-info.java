/**
 * Spring configuration: typed properties, thread pools, clock and HTTP client beans.
 *
 * <p>All tunables (cache TTLs, poll cadence, event probabilities, alert rules, stream buffer
 * sizes) are bound from {@code application.properties} through the classes in
 * {@code config.properties}; nothing in the pipeline hard-codes them.
 *
 * @since 1.0
 */
package com.phillippitts.grillstats.config;
