/**
 * Device metadata and the adapters that read devices.
 *
 * <p>{@link com.phillippitts.grillstats.service.device.DeviceAdapter} has two implementations,
 * simulated and remote, selected by {@code grill.polling.source}. Nothing downstream of the
 * adapter knows which one produced a reading.
 */
package com.phillippitts.grillstats.service.device;
