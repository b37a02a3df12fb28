package com.phillippitts.grillstats.service.orchestration;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Per-device epoch and lock that keep stale poll results out of the pipeline.
 *
 * <p>A poll records the epoch when it starts. Stopping or reassigning a session and
 * disconnecting a device bump the epoch under the device lock; results are applied under the
 * same lock and only if their epoch is still current. An in-flight poll therefore always
 * finishes, but its result is dropped once anything it was computed from has been cancelled.
 */
@Component
public class PollGuard {

    private final ConcurrentMap<String, DeviceGuard> guards = new ConcurrentHashMap<>();

    public long currentEpoch(String deviceId) {
        return guard(deviceId).epoch;
    }

    /**
     * Bumps the device epoch after running {@code change} under the device lock.
     * Idempotent from the caller's point of view: repeating it only discards more stale work.
     */
    public void invalidate(String deviceId, Runnable change) {
        DeviceGuard guard = guard(deviceId);
        guard.lock.lock();
        try {
            change.run();
            guard.epoch++;
        } finally {
            guard.lock.unlock();
        }
    }

    public void invalidate(String deviceId) {
        invalidate(deviceId, () -> { });
    }

    /**
     * Runs {@code apply} under the device lock if {@code epoch} is still current.
     *
     * @return false if the epoch was stale and nothing ran
     */
    public boolean applyIfCurrent(String deviceId, long epoch, Runnable apply) {
        return withLock(deviceId, () -> {
            if (guard(deviceId).epoch != epoch) {
                return false;
            }
            apply.run();
            return true;
        });
    }

    /** Runs {@code action} under the device lock regardless of epoch. */
    public boolean withLock(String deviceId, BooleanSupplier action) {
        DeviceGuard guard = guard(deviceId);
        guard.lock.lock();
        try {
            return action.getAsBoolean();
        } finally {
            guard.lock.unlock();
        }
    }

    private DeviceGuard guard(String deviceId) {
        return guards.computeIfAbsent(deviceId, id -> new DeviceGuard());
    }

    private static final class DeviceGuard {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile long epoch;
    }
}
