package com.phillippitts.grillstats.service.stream;

import com.phillippitts.grillstats.domain.Channel;
import com.phillippitts.grillstats.domain.ConnectionStatus;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.domain.DeviceSnapshot;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.service.alert.AlertEvaluator;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the current state of a device from the cache: live readings, status and firing alerts.
 *
 * <p>A channel whose live reading has expired is reported with no temperature and
 * {@code connected=false}, and its temperature alerts are re-evaluated as not holding before the
 * firing alerts are listed. A channel is {@code connected} only while the device is ONLINE. A device
 * without a cached status is reported OFFLINE.
 */
@Component
public class SnapshotAssembler {

    private final TieredCache cache;
    private final DeviceDirectory directory;
    private final AlertEvaluator alerts;
    private final Clock clock;

    public SnapshotAssembler(TieredCache cache, DeviceDirectory directory, AlertEvaluator alerts, Clock clock) {
        this.cache = cache;
        this.directory = directory;
        this.alerts = alerts;
        this.clock = clock;
    }

    /**
     * @throws com.phillippitts.grillstats.exception.UnknownDeviceException if the device is unknown
     * @throws com.phillippitts.grillstats.exception.CacheUnavailableException if the cache is closed
     */
    public DeviceSnapshot assemble(String deviceId) {
        Device device = directory.getDevice(deviceId);
        DeviceStatus status = cache.get(CacheNamespace.DEVICE_STATUS, deviceId, DeviceStatus.class)
                .orElse(DeviceStatus.unknown(deviceId, ConnectionStatus.OFFLINE));
        Instant now = clock.instant();
        List<DeviceSnapshot.ChannelSnapshot> channels = new ArrayList<>();
        for (Channel channel : device.channels()) {
            Optional<Reading> reading = cache.get(CacheNamespace.LIVE_READINGS,
                    Reading.channelKey(deviceId, channel.id()), Reading.class);
            if (reading.isEmpty()) {
                alerts.onChannelSilent(deviceId, channel.id(), now);
            }
            channels.add(channelSnapshot(channel, reading, status.isOnline()));
        }
        return new DeviceSnapshot(deviceId, now, channels, statusSnapshot(status),
                alerts.firingAlerts(deviceId));
    }

    static DeviceSnapshot.ChannelSnapshot channelSnapshot(Channel channel, Optional<Reading> reading,
                                                          boolean deviceOnline) {
        return reading
                .map(r -> new DeviceSnapshot.ChannelSnapshot(channel.id(), r.temperature(), r.unit().symbol(),
                        deviceOnline, r.timestamp()))
                .orElseGet(() -> new DeviceSnapshot.ChannelSnapshot(channel.id(), null, channel.unit().symbol(),
                        false, null));
    }

    static DeviceSnapshot.ChannelSnapshot channelSnapshot(Reading reading) {
        return new DeviceSnapshot.ChannelSnapshot(reading.channelId(), reading.temperature(),
                reading.unit().symbol(), true, reading.timestamp());
    }

    static DeviceSnapshot.StatusSnapshot statusSnapshot(DeviceStatus status) {
        return new DeviceSnapshot.StatusSnapshot(status.batteryPercent(), status.signalPercent(),
                status.connectionStatus());
    }
}
