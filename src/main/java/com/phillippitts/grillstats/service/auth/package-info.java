/**
 * Session tokens and rate limits for the dashboard-facing endpoints, both kept in the tiered cache.
 */
package com.phillippitts.grillstats.service.auth;
