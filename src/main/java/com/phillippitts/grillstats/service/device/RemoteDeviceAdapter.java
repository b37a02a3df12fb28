package com.phillippitts.grillstats.service.device;

import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.exception.DeviceSourceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Polls real devices over the device vendor's HTTP API.
 *
 * <p>Every failure (transport, HTTP status, malformed body) becomes a
 * {@link DeviceSourceException}; the orchestrator turns it into a degraded status and keeps the
 * last cached readings.
 */
@Component
@ConditionalOnProperty(prefix = "grill.polling", name = "source", havingValue = "remote")
public class RemoteDeviceAdapter implements DeviceAdapter {

    private static final Logger LOG = LogManager.getLogger(RemoteDeviceAdapter.class);
    static final String TEMPERATURE_PATH = "/devices/{deviceId}/temperature";

    private final RestTemplate restTemplate;
    private final Clock clock;

    public RemoteDeviceAdapter(@Qualifier("remoteDeviceRestTemplate") RestTemplate restTemplate, Clock clock) {
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    @Override
    public DevicePoll poll(Device device) {
        String body;
        try {
            body = restTemplate.getForObject(TEMPERATURE_PATH, String.class, device.id());
        } catch (RestClientException e) {
            throw new DeviceSourceException(device.id(), "Device API call failed: " + e.getMessage(), e);
        }
        DevicePoll poll = RemoteReadingParser.parse(device, body, clock.instant());
        LOG.debug("Polled {}: {} reading(s), status={}", device.id(), poll.readings().size(),
                poll.status().connectionStatus());
        return poll;
    }

    @Override
    public String sourceName() {
        return "remote";
    }
}
