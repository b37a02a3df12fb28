package com.phillippitts.grillstats.service.device;

import com.phillippitts.grillstats.config.properties.SimulationProperties;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.domain.DeviceStatus;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.service.session.CookingSession;
import com.phillippitts.grillstats.service.session.DeviceStatusSimulator;
import com.phillippitts.grillstats.service.session.SessionEngine;
import com.phillippitts.grillstats.service.session.SessionManager;
import com.phillippitts.grillstats.service.session.SessionTick;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Device adapter backed by the session engine.
 *
 * <p>Each poll advances the session of every channel that has one; channels without a session
 * produce nothing. Sessions that run out of phases are ended here. On a tick where the simulated
 * signal drops below the connectivity threshold the device is reported OFFLINE and no readings
 * are returned; the sessions catch up on the next online tick.
 */
@Component
@ConditionalOnProperty(prefix = "grill.polling", name = "source", havingValue = "simulated", matchIfMissing = true)
public class SimulatedDeviceAdapter implements DeviceAdapter {

    private static final Logger LOG = LogManager.getLogger(SimulatedDeviceAdapter.class);

    private final SessionManager sessionManager;
    private final SessionEngine engine;
    private final DeviceStatusSimulator statusSimulator;
    private final DeviceDirectory directory;
    private final SimulationProperties props;
    private final Clock clock;

    public SimulatedDeviceAdapter(SessionManager sessionManager,
                                  SessionEngine engine,
                                  DeviceStatusSimulator statusSimulator,
                                  DeviceDirectory directory,
                                  SimulationProperties props,
                                  Clock clock) {
        this.sessionManager = sessionManager;
        this.engine = engine;
        this.statusSimulator = statusSimulator;
        this.directory = directory;
        this.props = props;
        this.clock = clock;
    }

    @PostConstruct
    void assignProfiles() {
        if (!props.isAutoAssign()) {
            LOG.info("Profile auto-assign disabled; sessions start through the API");
            return;
        }
        int started = sessionManager.autoAssign(directory.devices());
        LOG.info("Auto-assigned profiles to {} channel(s)", started);
    }

    @Override
    public DevicePoll poll(Device device) {
        Instant now = clock.instant();
        DeviceStatus status = statusSimulator.next(device.id(), now);
        if (!status.isOnline()) {
            LOG.debug("{} reported {} this tick (signal={}%)", device.id(), status.connectionStatus(),
                    status.signalPercent());
            return new DevicePoll(device.id(), List.of(), status);
        }
        List<Reading> readings = new ArrayList<>();
        for (CookingSession session : sessionManager.sessions(device.id())) {
            SessionTick tick = engine.advance(session, now);
            if (tick.terminal()) {
                sessionManager.complete(session);
            } else {
                readings.add(tick.reading());
            }
        }
        return new DevicePoll(device.id(), readings, status);
    }

    @Override
    public String sourceName() {
        return "simulated";
    }
}
