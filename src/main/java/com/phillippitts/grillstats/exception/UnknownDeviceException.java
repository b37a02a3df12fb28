package com.phillippitts.grillstats.exception;

/**
 * Thrown when a device or channel is not known to the device registry.
 */
public class UnknownDeviceException extends GrillStatsException {

    private final String deviceId;
    private final String channelId;

    public UnknownDeviceException(String deviceId) {
        super("Unknown device: " + deviceId);
        this.deviceId = deviceId;
        this.channelId = null;
    }

    public UnknownDeviceException(String deviceId, String channelId) {
        super("Unknown channel " + channelId + " on device " + deviceId);
        this.deviceId = deviceId;
        this.channelId = channelId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getChannelId() {
        return channelId;
    }
}
