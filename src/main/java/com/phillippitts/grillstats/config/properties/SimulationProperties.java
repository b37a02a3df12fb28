package com.phillippitts.grillstats.config.properties;

import com.phillippitts.grillstats.service.session.EventType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Knobs of the cooking-session simulator and the simulated device status clock.
 *
 * <p>Temperatures are in degrees Fahrenheit. Rates and noise live in the profile catalogue;
 * the values here bound and perturb what the profiles produce.
 */
@Validated
@ConfigurationProperties(prefix = "grill.simulation")
public class SimulationProperties {

    /** Fixed seed for reproducible runs; random when unset. */
    private Long seed;

    /** A phase with a target exits once its base temperature is within this distance of it. */
    @Positive(message = "Phase epsilon must be positive")
    private double phaseEpsilon = 1.0;

    /** Lowest temperature a reading may report. */
    private double ambientFloor = 32.0;

    /** Highest temperature a reading may report. */
    private double hardCeiling = 572.0;

    /** Starting temperature of a session when the caller does not supply one. */
    private double startingTemperature = 40.0;

    /** Start a session for every configured channel at startup, matching profiles by probe name. */
    private boolean autoAssign = true;

    /** Period of the slow clock that advances battery and baseline signal. */
    @NotNull
    private Duration statusInterval = Duration.ofMinutes(1);

    /** Mean battery percentage lost per status interval. */
    @DecimalMin("0.0")
    private double batteryDrainPerInterval = 0.15;

    /** Chance per status interval that the battery is recharged or swapped. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double batteryResetProbability = 0.002;

    @Min(0)
    @Max(100)
    private int signalMin = 45;

    @Min(0)
    @Max(100)
    private int signalMax = 100;

    /** Largest baseline signal change per status interval. */
    @Min(0)
    private int signalStep = 5;

    /** Signal below this percentage is reported as offline for the tick. */
    @Min(0)
    @Max(100)
    private int connectivityThreshold = 20;

    /** Chance per poll tick of a transient signal drop below the connectivity threshold. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double transientDropProbability = 0.005;

    @Valid
    private EventProbabilities events = new EventProbabilities();

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public double getPhaseEpsilon() {
        return phaseEpsilon;
    }

    public void setPhaseEpsilon(double phaseEpsilon) {
        this.phaseEpsilon = phaseEpsilon;
    }

    public double getAmbientFloor() {
        return ambientFloor;
    }

    public void setAmbientFloor(double ambientFloor) {
        this.ambientFloor = ambientFloor;
    }

    public double getHardCeiling() {
        return hardCeiling;
    }

    public void setHardCeiling(double hardCeiling) {
        this.hardCeiling = hardCeiling;
    }

    public double getStartingTemperature() {
        return startingTemperature;
    }

    public void setStartingTemperature(double startingTemperature) {
        this.startingTemperature = startingTemperature;
    }

    public boolean isAutoAssign() {
        return autoAssign;
    }

    public void setAutoAssign(boolean autoAssign) {
        this.autoAssign = autoAssign;
    }

    public Duration getStatusInterval() {
        return statusInterval;
    }

    public void setStatusInterval(Duration statusInterval) {
        this.statusInterval = statusInterval;
    }

    public double getBatteryDrainPerInterval() {
        return batteryDrainPerInterval;
    }

    public void setBatteryDrainPerInterval(double batteryDrainPerInterval) {
        this.batteryDrainPerInterval = batteryDrainPerInterval;
    }

    public double getBatteryResetProbability() {
        return batteryResetProbability;
    }

    public void setBatteryResetProbability(double batteryResetProbability) {
        this.batteryResetProbability = batteryResetProbability;
    }

    public int getSignalMin() {
        return signalMin;
    }

    public void setSignalMin(int signalMin) {
        this.signalMin = signalMin;
    }

    public int getSignalMax() {
        return signalMax;
    }

    public void setSignalMax(int signalMax) {
        this.signalMax = signalMax;
    }

    public int getSignalStep() {
        return signalStep;
    }

    public void setSignalStep(int signalStep) {
        this.signalStep = signalStep;
    }

    public int getConnectivityThreshold() {
        return connectivityThreshold;
    }

    public void setConnectivityThreshold(int connectivityThreshold) {
        this.connectivityThreshold = connectivityThreshold;
    }

    public double getTransientDropProbability() {
        return transientDropProbability;
    }

    public void setTransientDropProbability(double transientDropProbability) {
        this.transientDropProbability = transientDropProbability;
    }

    public EventProbabilities getEvents() {
        return events;
    }

    public void setEvents(EventProbabilities events) {
        this.events = events;
    }

    /**
     * Probability per simulated minute that a random event of each type is injected.
     * Zero disables random injection of that type; explicit injection still works.
     */
    public static class EventProbabilities {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double lidOpen = 0.01;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fuelAdd = 0.005;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double probeFlip = 0.005;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double basting = 0.005;

        public double forType(EventType type) {
            return switch (type) {
                case LID_OPEN -> lidOpen;
                case FUEL_ADD -> fuelAdd;
                case PROBE_FLIP -> probeFlip;
                case BASTING -> basting;
            };
        }

        /** Sets every probability to zero. */
        public void disableAll() {
            lidOpen = 0;
            fuelAdd = 0;
            probeFlip = 0;
            basting = 0;
        }

        public double getLidOpen() {
            return lidOpen;
        }

        public void setLidOpen(double lidOpen) {
            this.lidOpen = lidOpen;
        }

        public double getFuelAdd() {
            return fuelAdd;
        }

        public void setFuelAdd(double fuelAdd) {
            this.fuelAdd = fuelAdd;
        }

        public double getProbeFlip() {
            return probeFlip;
        }

        public void setProbeFlip(double probeFlip) {
            this.probeFlip = probeFlip;
        }

        public double getBasting() {
            return basting;
        }

        public void setBasting(double basting) {
            this.basting = basting;
        }
    }
}
