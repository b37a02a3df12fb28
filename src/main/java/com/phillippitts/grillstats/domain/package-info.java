/**
 * Immutable domain model shared by every stage of the telemetry pipeline.
 *
 * <p>Records validate themselves in their compact constructors. Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.grillstats.domain.Device} and
 *       {@link com.phillippitts.grillstats.domain.Channel} - registry metadata</li>
 *   <li>{@link com.phillippitts.grillstats.domain.Reading} - one temperature sample</li>
 *   <li>{@link com.phillippitts.grillstats.domain.DeviceStatus} - battery/signal/connectivity</li>
 *   <li>{@link com.phillippitts.grillstats.domain.AlertRule} and
 *       {@link com.phillippitts.grillstats.domain.AlertTransition} - alerting</li>
 *   <li>{@link com.phillippitts.grillstats.domain.DeviceSnapshot} - payload pushed to dashboards</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.grillstats.domain;
