package com.phillippitts.grillstats.service.device;

import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.exception.DeviceSourceException;

/**
 * Uniform source of readings for a device, whether simulated or polled from real hardware.
 *
 * <p>Exactly one implementation is active, selected by {@code grill.polling.source}.
 * Implementations may block; callers run them on the poll executor with a timeout.
 */
public interface DeviceAdapter {

    /**
     * Reads the current state of a device.
     *
     * @param device device to poll
     * @return readings of every channel that produced one, and the device status
     * @throws DeviceSourceException when the source cannot be read or returns garbage
     */
    DevicePoll poll(Device device);

    /**
     * Short name of the data source, used in logs and metrics.
     */
    String sourceName();
}
