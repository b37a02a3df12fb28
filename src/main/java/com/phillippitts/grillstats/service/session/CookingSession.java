package com.phillippitts.grillstats.service.session;

import com.phillippitts.grillstats.domain.Channel;
import com.phillippitts.grillstats.domain.Reading;
import com.phillippitts.grillstats.service.profile.CookingProfile;
import com.phillippitts.grillstats.service.profile.Phase;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * A live run of one profile on one channel.
 *
 * <p>State is only changed by {@link SessionEngine} while holding the session's monitor.
 * {@code baseTemperature} is the noise-free trajectory in degrees F; readings are derived from
 * it by adding noise and event offsets, so perturbations never accumulate into the trajectory.
 */
public final class CookingSession {

    private final String id = UUID.randomUUID().toString();
    private final String deviceId;
    private final Channel channel;
    private final CookingProfile profile;
    private final Instant startedAt;
    private final Random random;
    private final Queue<CookingEvent> pendingEvents = new ConcurrentLinkedQueue<>();
    private final List<ActiveEvent> activeEvents = new ArrayList<>();

    private int phaseIndex;
    private Instant phaseStartedAt;
    private double phaseRate;
    private double baseTemperature;
    private Instant lastAdvanceAt;
    private Instant lastTimestamp;
    private boolean complete;

    CookingSession(String deviceId, Channel channel, CookingProfile profile,
                   double startTemperature, Instant startedAt, Random random) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.random = Objects.requireNonNull(random, "random");
        this.baseTemperature = startTemperature;
        this.phaseStartedAt = startedAt;
        this.lastAdvanceAt = startedAt;
    }

    public String id() {
        return id;
    }

    public String deviceId() {
        return deviceId;
    }

    public Channel channel() {
        return channel;
    }

    public String channelKey() {
        return Reading.channelKey(deviceId, channel.id());
    }

    public CookingProfile profile() {
        return profile;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized int phaseIndex() {
        return phaseIndex;
    }

    public synchronized Optional<Phase> currentPhase() {
        return complete ? Optional.empty() : Optional.of(profile.phase(phaseIndex));
    }

    public synchronized double baseTemperature() {
        return baseTemperature;
    }

    public synchronized double phaseRate() {
        return phaseRate;
    }

    public synchronized boolean isComplete() {
        return complete;
    }

    public int pendingEventCount() {
        return pendingEvents.size();
    }

    public synchronized int activeEventCount() {
        return activeEvents.size();
    }

    Random random() {
        return random;
    }

    Queue<CookingEvent> pendingEvents() {
        return pendingEvents;
    }

    List<ActiveEvent> activeEvents() {
        return activeEvents;
    }

    Instant phaseStartedAt() {
        return phaseStartedAt;
    }

    Instant lastAdvanceAt() {
        return lastAdvanceAt;
    }

    Instant lastTimestamp() {
        return lastTimestamp;
    }

    void setBaseTemperature(double baseTemperature) {
        this.baseTemperature = baseTemperature;
    }

    void setLastAdvanceAt(Instant lastAdvanceAt) {
        this.lastAdvanceAt = lastAdvanceAt;
    }

    void setLastTimestamp(Instant lastTimestamp) {
        this.lastTimestamp = lastTimestamp;
    }

    void enterPhase(int index, Instant at, double rate) {
        this.phaseIndex = index;
        this.phaseStartedAt = at;
        this.phaseRate = rate;
    }

    void markComplete() {
        this.complete = true;
    }

    @Override
    public String toString() {
        return "CookingSession{" + channelKey() + ", profile=" + profile.id() + ", phase=" + phaseIndex + '}';
    }
}
