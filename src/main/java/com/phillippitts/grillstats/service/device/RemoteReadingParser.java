package com.phillippitts.grillstats.service.device;

import com.phillippitts.grillstats.domain.Channel;
import com.phillippitts.grillstats.domain.ConnectionStatus;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.domain.TemperatureUnit;
import com.phillippitts.grillstats.exception.DeviceSourceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the real device API's temperature payload into a {@link DevicePoll}.
 *
 * <p>Expected shape:
 * <pre>
 * {"device_id": "...", "is_online": true, "battery_level": 87, "signal_strength": -58,
 *  "probes": [{"probe_id": "1", "temperature": 151.2, "unit": "F", "timestamp": "..."}]}
 * </pre>
 *
 * <p>Signal strength arrives in dBm and is mapped linearly onto 0-100 percent
 * (-100 dBm and below is 0, -50 dBm and above is 100). Probes the registry does not know and
 * probes without a temperature are skipped. Temperatures are converted from the probe's
 * reported unit (the channel's unit when absent) into the channel's unit. Anything structurally wrong is a
 * {@link DeviceSourceException}.
 *
 * <p>Thread-safe: stateless.
 */
final class RemoteReadingParser {

    private static final Logger LOG = LogManager.getLogger(RemoteReadingParser.class);

    /** Cap on payload size accepted from the device API (1MB). */
    static final int MAX_PAYLOAD_SIZE = 1_048_576;

    static final int DBM_FLOOR = -100;
    static final int DBM_CEILING = -50;

    private RemoteReadingParser() {
        // Utility class - prevent instantiation
    }

    static DevicePoll parse(Device device, String body, Instant receivedAt) {
        if (body == null || body.isBlank()) {
            throw new DeviceSourceException(device.id(), "Empty response from device API");
        }
        if (body.length() > MAX_PAYLOAD_SIZE) {
            throw new DeviceSourceException(device.id(), "Device API response exceeds " + MAX_PAYLOAD_SIZE + "B");
        }
        try {
            JSONObject obj = new JSONObject(body);
            if (obj.has("error") && !obj.optBoolean("is_online", true)) {
                DeviceStatus offline = new DeviceStatus(device.id(), optPercent(obj, "battery_level"),
                        null, ConnectionStatus.OFFLINE, null);
                return new DevicePoll(device.id(), List.of(), offline);
            }
            String reportedId = obj.optString("device_id", device.id());
            if (!device.id().equals(reportedId)) {
                throw new DeviceSourceException(device.id(), "Response is for device " + reportedId);
            }

            boolean online = obj.optBoolean("is_online", true);
            Integer battery = optPercent(obj, "battery_level");
            Integer signal = obj.has("signal_strength") ? signalPercent(obj.getInt("signal_strength")) : null;
            DeviceStatus status = new DeviceStatus(device.id(), battery, signal,
                    online ? ConnectionStatus.ONLINE : ConnectionStatus.OFFLINE,
                    online ? receivedAt : null);

            List<Reading> readings = new ArrayList<>();
            JSONArray probes = obj.optJSONArray("probes");
            if (online && probes != null) {
                for (int i = 0; i < probes.length(); i++) {
                    JSONObject probe = probes.getJSONObject(i);
                    String channelId = probe.optString("probe_id", null);
                    Channel channel = channelId == null ? null : device.channel(channelId).orElse(null);
                    if (channel == null) {
                        LOG.debug("Skipping unknown probe {} on {}", channelId, device.id());
                        continue;
                    }
                    if (probe.isNull("temperature") || !probe.has("temperature")) {
                        continue;
                    }
                    TemperatureUnit reported = probe.has("unit")
                            ? TemperatureUnit.fromSymbol(probe.getString("unit"))
                            : channel.unit();
                    double temperature = reported.convertTo(probe.getDouble("temperature"), channel.unit());
                    readings.add(new Reading(device.id(), channelId,
                            timestamp(probe.optString("timestamp", null), receivedAt), temperature, channel.unit()));
                }
            }
            return new DevicePoll(device.id(), readings, status);
        } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
            throw new DeviceSourceException(device.id(), "Malformed device API response: " + e.getMessage(), e);
        }
    }

    /**
     * Maps a dBm value to 0-100 percent.
     */
    static int signalPercent(int dbm) {
        if (dbm <= DBM_FLOOR) {
            return 0;
        }
        if (dbm >= DBM_CEILING) {
            return 100;
        }
        return (int) Math.round(100.0 * (dbm - DBM_FLOOR) / (DBM_CEILING - DBM_FLOOR));
    }

    private static Integer optPercent(JSONObject obj, String field) {
        if (!obj.has(field) || obj.isNull(field)) {
            return null;
        }
        return Math.max(0, Math.min(100, obj.getInt(field)));
    }

    private static Instant timestamp(String text, Instant fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        if (text.endsWith("Z") || text.contains("+")) {
            return Instant.parse(text);
        }
        // Naive ISO timestamps from the device API are UTC
        return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    }
}
