package com.phillippitts.grillstats.service.session;

import com.phillippitts.grillstats.config.properties.SimulationProperties;
import com.phillippitts.grillstats.domain.ConnectionStatus;
import com.phillippitts.grillstats.domain.DeviceStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Battery and signal of simulated devices.
 *
 * <p>Both move on a slow clock of {@code statusInterval}: the battery drains by a slightly random
 * amount each interval and is occasionally reset to 100 (recharge or swap); the baseline signal
 * random-walks inside {@code [signalMin, signalMax]}. Independently, every poll has a small
 * chance of a transient signal drop below the connectivity threshold, which is reported as
 * OFFLINE for that poll only.
 */
@Component
public class DeviceStatusSimulator {

    private static final Logger LOG = LogManager.getLogger(DeviceStatusSimulator.class);
    private static final int MAX_CATCH_UP_STEPS = 10_000;

    private final SimulationProperties props;
    private final Random random;
    private final Map<String, State> states = new ConcurrentHashMap<>();

    public DeviceStatusSimulator(SimulationProperties props) {
        this.props = Objects.requireNonNull(props, "props");
        this.random = props.getSeed() == null ? new Random() : new Random(props.getSeed());
    }

    /**
     * Returns the status of a device at {@code now}, advancing its slow clock as needed.
     */
    public DeviceStatus next(String deviceId, Instant now) {
        State state = states.computeIfAbsent(deviceId, id -> new State(initialSignal(), now));
        synchronized (state) {
            stepSlowClock(state, now);
            int reported = state.signal;
            double dropChance = props.getTransientDropProbability();
            if (dropChance > 0 && random.nextDouble() < dropChance) {
                reported = random.nextInt(Math.max(1, props.getConnectivityThreshold()));
                LOG.debug("Transient signal drop on {}: {}%", deviceId, reported);
            }
            boolean online = reported >= props.getConnectivityThreshold();
            if (online) {
                state.lastSeen = now;
            }
            return new DeviceStatus(deviceId, (int) Math.round(state.battery), reported,
                    online ? ConnectionStatus.ONLINE : ConnectionStatus.OFFLINE, state.lastSeen);
        }
    }

    /** Forgets a device so its next status starts fresh. */
    public void reset(String deviceId) {
        states.remove(deviceId);
    }

    private void stepSlowClock(State state, Instant now) {
        Duration interval = props.getStatusInterval();
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        long steps = Duration.between(state.lastStep, now).toMillis() / interval.toMillis();
        if (steps <= 0) {
            return;
        }
        for (long i = 0; i < Math.min(steps, MAX_CATCH_UP_STEPS); i++) {
            if (random.nextDouble() < props.getBatteryResetProbability()) {
                state.battery = 100.0;
            } else {
                double drain = props.getBatteryDrainPerInterval() * (0.5 + random.nextDouble());
                state.battery = Math.max(0.0, state.battery - drain);
            }
            int delta = props.getSignalStep() == 0 ? 0 : random.nextInt(2 * props.getSignalStep() + 1) - props.getSignalStep();
            state.signal = Math.max(props.getSignalMin(), Math.min(props.getSignalMax(), state.signal + delta));
        }
        state.lastStep = state.lastStep.plus(interval.multipliedBy(steps));
    }

    private int initialSignal() {
        return (props.getSignalMin() + props.getSignalMax()) / 2;
    }

    private static final class State {
        private double battery = 100.0;
        private int signal;
        private Instant lastStep;
        private Instant lastSeen;

        private State(int signal, Instant now) {
            this.signal = signal;
            this.lastStep = now;
        }
    }
}
