/**
 * Poll loops, the pipeline that applies their results, and the per-device cancellation guard.
 *
 * <p>Flow per tick: {@code DevicePollingOrchestrator} → {@code DeviceAdapter} (poll executor,
 * with timeout) → {@code TelemetryPipeline} under the device's {@code PollGuard} lock → tiered
 * cache, alert evaluator, stream dispatcher, rollups, history.
 */
package com.phillippitts.grillstats.service.orchestration;
