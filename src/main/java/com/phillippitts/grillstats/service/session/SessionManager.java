package com.phillippitts.grillstats.service.session;

import com.phillippitts.grillstats.config.properties.SimulationProperties;
import com.phillippitts.grillstats.domain.Channel;
import com.phillippitts.grillstats.domain.Device;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.exception.InvalidEventException;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import com.phillippitts.grillstats.service.orchestration.PollGuard;
import com.phillippitts.grillstats.service.profile.CookingProfile;
import com.phillippitts.grillstats.service.profile.ProfileLibrary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Owns the active cooking sessions, at most one per channel.
 *
 * <p>Starting, stopping and reassigning a session invalidate the device's in-flight polls via
 * {@link PollGuard}, so a reading computed from a session that no longer exists is never
 * applied. Profile and channel references are validated here, at creation, never at tick time.
 */
@Component
public class SessionManager {

    private static final Logger LOG = LogManager.getLogger(SessionManager.class);

    private final ConcurrentMap<String, CookingSession> sessions = new ConcurrentHashMap<>();
    private final SessionEngine engine;
    private final ProfileLibrary profiles;
    private final DeviceDirectory directory;
    private final PollGuard pollGuard;
    private final SimulationProperties props;
    private final Clock clock;

    public SessionManager(SessionEngine engine,
                          ProfileLibrary profiles,
                          DeviceDirectory directory,
                          PollGuard pollGuard,
                          SimulationProperties props,
                          Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.profiles = Objects.requireNonNull(profiles, "profiles");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.pollGuard = Objects.requireNonNull(pollGuard, "pollGuard");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts a session, replacing any session already running on the channel.
     *
     * @param startTemperature starting temperature in degrees F, or null for the configured default
     * @throws com.phillippitts.grillstats.exception.UnknownDeviceException if the channel is unknown
     * @throws com.phillippitts.grillstats.exception.ProfileNotFoundException if the profile is unknown
     */
    public CookingSession startSession(String deviceId, String channelId, String profileId, Double startTemperature) {
        Channel channel = directory.getChannel(deviceId, channelId);
        CookingProfile profile = profiles.get(profileId);
        return start(deviceId, channel, profile, startTemperature);
    }

    /**
     * Stops the session on a channel. Stopping a channel without a session is a no-op.
     *
     * @return true if a session was stopped
     */
    public boolean stopSession(String deviceId, String channelId) {
        String key = Reading.channelKey(deviceId, channelId);
        CookingSession[] removed = new CookingSession[1];
        pollGuard.invalidate(deviceId, () -> removed[0] = sessions.remove(key));
        if (removed[0] != null) {
            LOG.info("Stopped session on {} (profile={})", key, removed[0].profile().id());
            return true;
        }
        return false;
    }

    /**
     * Removes a session that ran out of phases. Completion does not invalidate in-flight polls:
     * the final reading is still valid.
     */
    public void complete(CookingSession session) {
        if (sessions.remove(session.channelKey(), session)) {
            LOG.info("Session on {} completed profile {}", session.channelKey(), session.profile().id());
        }
    }

    /**
     * Queues an event on the session of a channel. Magnitude and decay default to a random
     * draw from the event type's ranges.
     *
     * @throws InvalidEventException if the channel has no session or the event does not apply
     */
    public CookingEvent injectEvent(String deviceId, String channelId, EventType type,
                                    Double magnitude, Duration decay, Set<String> phases) {
        directory.getChannel(deviceId, channelId);
        CookingSession session = session(deviceId, channelId).orElseThrow(() ->
                new InvalidEventException("No active session on " + Reading.channelKey(deviceId, channelId)));
        CookingEvent drawn = CookingEvent.random(type, ThreadLocalRandom.current());
        CookingEvent event = new CookingEvent(type,
                magnitude != null ? magnitude : drawn.magnitude(),
                decay != null ? decay : drawn.decay(),
                phases);
        engine.inject(session, event);
        LOG.info("Injected {} on {} (magnitude={}, decay={})",
                type, session.channelKey(), String.format("%.1f", event.magnitude()), event.decay());
        return event;
    }

    /**
     * Starts a session on every channel of the given devices that has none yet, picking the
     * profile from the probe name. Channels whose name matches no profile are left idle.
     *
     * @return number of sessions started
     */
    public int autoAssign(Collection<Device> devices) {
        int started = 0;
        for (Device device : devices) {
            for (Channel channel : device.channels()) {
                if (sessions.containsKey(Reading.channelKey(device.id(), channel.id()))) {
                    continue;
                }
                Optional<CookingProfile> profile = profiles.matchByProbeName(channel.name(), channel.type());
                if (profile.isPresent()) {
                    start(device.id(), channel, profile.get(), null);
                    started++;
                } else {
                    LOG.debug("No profile matches probe '{}' on {}", channel.name(), device.id());
                }
            }
        }
        return started;
    }

    public Optional<CookingSession> session(String deviceId, String channelId) {
        return Optional.ofNullable(sessions.get(Reading.channelKey(deviceId, channelId)));
    }

    public List<CookingSession> sessions(String deviceId) {
        return sessions.values().stream()
                .filter(s -> s.deviceId().equals(deviceId))
                .toList();
    }

    public List<CookingSession> allSessions() {
        return List.copyOf(sessions.values());
    }

    private CookingSession start(String deviceId, Channel channel, CookingProfile profile, Double startTemperature) {
        String key = Reading.channelKey(deviceId, channel.id());
        double start = startTemperature != null ? startTemperature : props.getStartingTemperature();
        CookingSession session = engine.start(deviceId, channel, profile, start, clock.instant(), newRandom(key));
        CookingSession[] replaced = new CookingSession[1];
        pollGuard.invalidate(deviceId, () -> replaced[0] = sessions.put(key, session));
        if (replaced[0] != null) {
            LOG.info("Reassigned {} from {} to {}", key, replaced[0].profile().id(), profile.id());
        } else {
            LOG.info("Started session on {} with profile {} at {}F", key, profile.id(), start);
        }
        return session;
    }

    private Random newRandom(String key) {
        Long seed = props.getSeed();
        return seed == null ? new Random() : new Random(seed * 31 + key.hashCode());
    }
}
