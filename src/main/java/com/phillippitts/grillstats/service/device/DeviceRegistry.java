package com.phillippitts.grillstats.service.device;

import com.phillippitts.grillstats.domain.Device;

import java.util.List;
import java.util.Optional;

/**
 * Source of device and channel metadata. Read-mostly; callers go through
 * {@link DeviceDirectory}, which caches lookups.
 */
public interface DeviceRegistry {

    Optional<Device> findDevice(String deviceId);

    List<Device> devices();
}
