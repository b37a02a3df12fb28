package com.phillippitts.grillstats.service.session;

import com.phillippitts.grillstats.config.properties.SimulationProperties;
import com.phillippitts.grillstats.domain.Channel;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.domain.TemperatureUnit;
import com.phillippitts.grillstats.exception.InvalidEventException;
import com.phillippitts.grillstats.service.profile.CookingProfile;
import com.phillippitts.grillstats.service.profile.Phase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Objects;
import java.util.Random;

/**
 * Produces readings by walking a {@link CookingSession} through its profile.
 *
 * <p>Per tick the noise-free base temperature moves toward the phase target at the phase rate
 * (rolled once when the phase starts) without overshooting it. The reading is the base plus a
 * bounded uniform noise plus the sum of active event offsets, clamped to
 * {@code [ambientFloor, hardCeiling]} and converted to the channel unit.
 *
 * <p>A phase ends once it has lasted its minimum duration and either the base is within
 * {@code phaseEpsilon} of the target (for phases that exit on target) or the maximum duration
 * has passed. After the last phase the session is complete and further ticks are terminal.
 */
@Component
public class SessionEngine {

    private static final Logger LOG = LogManager.getLogger(SessionEngine.class);
    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final SimulationProperties props;

    public SessionEngine(SimulationProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Creates a session positioned at the start of the first phase.
     *
     * @param startTemperature starting temperature, degrees F
     */
    public CookingSession start(String deviceId, Channel channel, CookingProfile profile,
                                double startTemperature, Instant now, Random random) {
        CookingSession session = new CookingSession(deviceId, channel, profile, startTemperature, now, random);
        session.enterPhase(0, now, rollRate(profile.phase(0), random));
        return session;
    }

    /**
     * Queues an event on a session.
     *
     * @throws InvalidEventException if the event type cannot affect the session's probe type
     */
    public void inject(CookingSession session, CookingEvent event) {
        if (!event.type().appliesTo(session.channel().type())) {
            throw new InvalidEventException("Event " + event.type() + " does not apply to "
                    + session.channel().type() + " probe " + session.channelKey());
        }
        session.pendingEvents().add(event);
        LOG.debug("Queued {} on {} (magnitude={}, decay={})",
                event.type(), session.channelKey(), event.magnitude(), event.decay());
    }

    /**
     * Advances a session to {@code now}.
     *
     * @return the next reading, or the terminal tick when no phases remain
     */
    public SessionTick advance(CookingSession session, Instant now) {
        synchronized (session) {
            if (session.isComplete()) {
                return SessionTick.terminalTick();
            }
            Phase phase = session.profile().phase(session.phaseIndex());
            long dtMillis = Math.max(0, Duration.between(session.lastAdvanceAt(), now).toMillis());
            double dtMinutes = dtMillis / MILLIS_PER_MINUTE;

            moveBase(session, phase, dtMinutes);
            rollRandomEvents(session, dtMinutes);
            activatePending(session, phase, now);
            double offset = sumEventOffsets(session, now);
            double noise = phase.noiseAmplitude() * (2.0 * session.random().nextDouble() - 1.0);
            double fahrenheit = clamp(session.baseTemperature() + noise + offset);

            Instant timestamp = nextTimestamp(session, now);
            session.setLastAdvanceAt(now);
            session.setLastTimestamp(timestamp);

            if (phaseFinished(session, phase, now)) {
                nextPhase(session, now);
            }

            TemperatureUnit unit = session.channel().unit();
            Reading reading = new Reading(session.deviceId(), session.channel().id(), timestamp,
                    round(unit.fromFahrenheit(fahrenheit)), unit);
            return SessionTick.of(reading, phase.name());
        }
    }

    private void moveBase(CookingSession session, Phase phase, double dtMinutes) {
        double base = session.baseTemperature();
        double distance = phase.targetTemperature() - base;
        double step = Math.min(Math.abs(distance), session.phaseRate() * dtMinutes);
        session.setBaseTemperature(base + Math.signum(distance) * step);
    }

    private void rollRandomEvents(CookingSession session, double dtMinutes) {
        if (dtMinutes <= 0) {
            return;
        }
        for (EventType type : EventType.values()) {
            if (!type.appliesTo(session.channel().type())) {
                continue;
            }
            double perMinute = props.getEvents().forType(type);
            if (perMinute <= 0) {
                continue;
            }
            double chance = 1.0 - Math.pow(1.0 - perMinute, dtMinutes);
            if (session.random().nextDouble() < chance) {
                session.pendingEvents().add(CookingEvent.random(type, session.random()));
                LOG.debug("Random {} on {}", type, session.channelKey());
            }
        }
    }

    private static void activatePending(CookingSession session, Phase phase, Instant now) {
        Iterator<CookingEvent> it = session.pendingEvents().iterator();
        while (it.hasNext()) {
            CookingEvent event = it.next();
            if (event.allowedIn(phase.name())) {
                it.remove();
                session.activeEvents().add(new ActiveEvent(event, now));
            }
        }
    }

    private static double sumEventOffsets(CookingSession session, Instant now) {
        double offset = 0.0;
        Iterator<ActiveEvent> it = session.activeEvents().iterator();
        while (it.hasNext()) {
            ActiveEvent active = it.next();
            if (active.isFinished(now)) {
                it.remove();
            } else {
                offset += active.offsetAt(now);
            }
        }
        return offset;
    }

    private boolean phaseFinished(CookingSession session, Phase phase, Instant now) {
        Duration inPhase = Duration.between(session.phaseStartedAt(), now);
        if (inPhase.compareTo(phase.minDuration()) < 0) {
            return false;
        }
        if (inPhase.compareTo(phase.maxDuration()) >= 0) {
            return true;
        }
        return phase.exitOnTarget()
                && Math.abs(session.baseTemperature() - phase.targetTemperature()) <= props.getPhaseEpsilon();
    }

    private void nextPhase(CookingSession session, Instant now) {
        int next = session.phaseIndex() + 1;
        if (next >= session.profile().phaseCount()) {
            session.markComplete();
            LOG.info("Session {} finished profile {}", session.channelKey(), session.profile().id());
            return;
        }
        Phase phase = session.profile().phase(next);
        session.enterPhase(next, now, rollRate(phase, session.random()));
        LOG.debug("Session {} entered phase {} (rate={})", session.channelKey(), phase.name(), session.phaseRate());
    }

    private static double rollRate(Phase phase, Random random) {
        return phase.minRate() + random.nextDouble() * (phase.maxRate() - phase.minRate());
    }

    private static Instant nextTimestamp(CookingSession session, Instant now) {
        Instant last = session.lastTimestamp();
        if (last != null && !now.isAfter(last)) {
            return last.plusMillis(1);
        }
        return now;
    }

    private double clamp(double value) {
        return Math.max(props.getAmbientFloor(), Math.min(props.getHardCeiling(), value));
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
