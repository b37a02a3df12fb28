package com.phillippitts.grillstats.service.health;

import com.phillippitts.grillstats.domain.ConnectionStatus;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for device connectivity.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every registered device is ONLINE</li>
 *   <li>DEGRADED: at least one device is ONLINE</li>
 *   <li>DOWN: no device is ONLINE, or the cache is closed</li>
 * </ul>
 *
 * <p>Devices not yet polled count as not online. Exposed via /actuator/health.
 */
@Component
public class DevicePollingHealthIndicator implements HealthIndicator {

    private final DeviceDirectory directory;
    private final TieredCache cache;

    public DevicePollingHealthIndicator(DeviceDirectory directory, TieredCache cache) {
        this.directory = directory;
        this.cache = cache;
    }

    @Override
    public Health health() {
        if (!cache.isAvailable()) {
            return Health.down().withDetail("status", "Telemetry cache closed").build();
        }
        List<Device> devices = directory.devices();
        Map<String, String> perDevice = new LinkedHashMap<>();
        int online = 0;
        for (Device device : devices) {
            ConnectionStatus connection = cache.get(CacheNamespace.DEVICE_STATUS, device.id(), DeviceStatus.class)
                    .map(DeviceStatus::connectionStatus)
                    .orElse(null);
            if (connection == ConnectionStatus.ONLINE) {
                online++;
            }
            perDevice.put(device.id(), connection == null ? "unknown" : connection.name().toLowerCase());
        }

        Health.Builder builder = new Health.Builder();
        if (!devices.isEmpty() && online == devices.size()) {
            builder.up().withDetail("status", "All devices online");
        } else if (online > 0) {
            builder.status("DEGRADED").withDetail("status", online + " of " + devices.size() + " devices online");
        } else {
            builder.down().withDetail("status", "No devices online");
        }
        return builder.withDetail("devices", perDevice).build();
    }
}
