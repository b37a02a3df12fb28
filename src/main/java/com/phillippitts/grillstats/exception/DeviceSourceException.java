package com.phillippitts.grillstats.exception;

/**
 * Thrown by a device adapter when the data source cannot be read (timeout, transport error,
 * malformed payload). Recovered locally by keeping the last cached values and marking the
 * device degraded; never surfaced to dashboard clients.
 */
public class DeviceSourceException extends GrillStatsException {

    private final String deviceId;

    public DeviceSourceException(String deviceId, String message) {
        super(message + " (device: " + deviceId + ")");
        this.deviceId = deviceId;
    }

    public DeviceSourceException(String deviceId, String message, Throwable cause) {
        super(message + " (device: " + deviceId + ")", cause);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
