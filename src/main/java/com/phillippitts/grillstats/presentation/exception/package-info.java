/**
 * Exception-to-HTTP mapping.
 *
 * <p>Mapping:
 * <ul>
 *   <li>{@code UnknownDeviceException}, {@code ProfileNotFoundException} → 404</li>
 *   <li>{@code InvalidAlertRuleException}, {@code InvalidEventException}, bean validation → 400</li>
 *   <li>{@code UnauthorizedStreamException} → 401</li>
 *   <li>{@code RateLimitExceededException} → 429</li>
 *   <li>{@code CacheUnavailableException}, {@code DeviceSourceException} → 503</li>
 *   <li>{@code Exception} (catch-all) → 500</li>
 * </ul>
 *
 * <p>Response body:
 * <pre>
 * {
 *   "errorCode": "UnknownDeviceException",
 *   "message": "Resource not found",
 *   "details": "Unknown device: smoker-9",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.grillstats.presentation.exception;
