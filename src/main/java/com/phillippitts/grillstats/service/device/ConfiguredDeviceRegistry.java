package com.phillippitts.grillstats.service.device;

import com.phillippitts.grillstats.config.properties.DeviceRegistryProperties;
import com.phillippitts.grillstats.domain.Device;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry backed by the devices listed under {@code grill.registry.devices}.
 */
@Component
public class ConfiguredDeviceRegistry implements DeviceRegistry {

    private static final Logger LOG = LogManager.getLogger(ConfiguredDeviceRegistry.class);

    private final Map<String, Device> devices = new LinkedHashMap<>();

    public ConfiguredDeviceRegistry(DeviceRegistryProperties properties) {
        for (DeviceRegistryProperties.DeviceDefinition definition : properties.getDevices()) {
            Device device = definition.toDevice();
            if (devices.putIfAbsent(device.id(), device) != null) {
                throw new IllegalStateException("Duplicate device id in configuration: " + device.id());
            }
        }
        LOG.info("Device registry loaded {} device(s): {}", devices.size(), devices.keySet());
    }

    @Override
    public Optional<Device> findDevice(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    @Override
    public List<Device> devices() {
        return List.copyOf(devices.values());
    }
}
