package com.phillippitts.grillstats.service.device;

import com.phillippitts.grillstats.domain.Channel;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.exception.CacheUnavailableException;
import com.phillippitts.grillstats.exception.UnknownDeviceException;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Read-through view of the {@link DeviceRegistry}, cached in
 * {@link CacheNamespace#DEVICE_METADATA}.
 */
@Component
public class DeviceDirectory {

    private static final Logger LOG = LogManager.getLogger(DeviceDirectory.class);

    private final DeviceRegistry registry;
    private final TieredCache cache;

    public DeviceDirectory(DeviceRegistry registry, TieredCache cache) {
        this.registry = registry;
        this.cache = cache;
    }

    /**
     * Returns a device, loading it from the registry on a cache miss.
     *
     * @throws UnknownDeviceException if the registry does not know the device
     */
    public Device getDevice(String deviceId) {
        Optional<Device> cached = cachedDevice(deviceId);
        if (cached.isPresent()) {
            return cached.get();
        }
        Device device = registry.findDevice(deviceId).orElseThrow(() -> new UnknownDeviceException(deviceId));
        try {
            cache.set(CacheNamespace.DEVICE_METADATA, deviceId, device);
        } catch (CacheUnavailableException e) {
            LOG.debug("Device metadata not cached: {}", e.getMessage());
        }
        return device;
    }

    /**
     * @throws UnknownDeviceException if the device or the channel is unknown
     */
    public Channel getChannel(String deviceId, String channelId) {
        return getDevice(deviceId).channel(channelId)
                .orElseThrow(() -> new UnknownDeviceException(deviceId, channelId));
    }

    public boolean exists(String deviceId) {
        return cachedDevice(deviceId).isPresent() || registry.findDevice(deviceId).isPresent();
    }

    public List<Device> devices() {
        return registry.devices();
    }

    private Optional<Device> cachedDevice(String deviceId) {
        if (deviceId == null) {
            throw new UnknownDeviceException(null);
        }
        try {
            return cache.get(CacheNamespace.DEVICE_METADATA, deviceId, Device.class);
        } catch (CacheUnavailableException e) {
            return Optional.empty();
        }
    }
}
