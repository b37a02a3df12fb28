/**
 * Logging infrastructure: request-scoped ThreadContext population for Log4j2 patterns.
 */
package com.phillippitts.grillstats.config.logging;
