package com.phillippitts.grillstats.service.device;

import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Reading;

import java.util.List;
import java.util.Objects;

/**
 * Everything one poll of a device produced.
 *
 * @param deviceId polled device
 * @param readings new readings, possibly empty
 * @param status connectivity and power at poll time
 */
public record DevicePoll(String deviceId, List<Reading> readings, DeviceStatus status) {

    public DevicePoll {
        Objects.requireNonNull(deviceId, "Device id must not be null");
        Objects.requireNonNull(status, "Status must not be null");
        readings = readings == null ? List.of() : List.copyOf(readings);
    }
}
