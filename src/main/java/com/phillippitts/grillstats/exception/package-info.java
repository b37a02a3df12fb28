/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.grillstats.exception.GrillStatsException} - Base exception</li>
 *   <li>{@link com.phillippitts.grillstats.exception.ProfileNotFoundException},
 *       {@link com.phillippitts.grillstats.exception.InvalidAlertRuleException},
 *       {@link com.phillippitts.grillstats.exception.InvalidEventException},
 *       {@link com.phillippitts.grillstats.exception.UnknownDeviceException} - configuration and
 *       request errors, rejected at the point of creation</li>
 *   <li>{@link com.phillippitts.grillstats.exception.DeviceSourceException} - transient source
 *       errors, recovered locally by the polling orchestrator</li>
 *   <li>{@link com.phillippitts.grillstats.exception.CacheUnavailableException} - cache backend
 *       errors, fatal for the affected namespace for one tick</li>
 *   <li>{@link com.phillippitts.grillstats.exception.RateLimitExceededException},
 *       {@link com.phillippitts.grillstats.exception.UnauthorizedStreamException} - subscriber
 *       admission errors</li>
 * </ul>
 *
 * <p>All exceptions map to HTTP responses in {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.grillstats.exception;
