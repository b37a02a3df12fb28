package com.phillippitts.grillstats.service.stream;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One client's live view of one device.
 */
final class Subscription {

    private final SubscriptionHandle handle;
    private final ClientConnection connection;
    private final UpdateBuffer buffer;
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile long lastSentSequence = -1;

    Subscription(SubscriptionHandle handle, ClientConnection connection, int bufferCapacity) {
        this.handle = handle;
        this.connection = connection;
        this.buffer = new UpdateBuffer(bufferCapacity);
    }

    SubscriptionHandle handle() {
        return handle;
    }

    String id() {
        return handle.subscriptionId();
    }

    ClientConnection connection() {
        return connection;
    }

    UpdateBuffer buffer() {
        return buffer;
    }

    /** Claims the single drain slot. */
    boolean tryStartDrain() {
        return draining.compareAndSet(false, true);
    }

    void endDrain() {
        draining.set(false);
    }

    /** @return true for the caller that actually closed it */
    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    boolean isClosed() {
        return closed.get();
    }

    long lastSentSequence() {
        return lastSentSequence;
    }

    void acknowledge(long sequence) {
        this.lastSentSequence = sequence;
    }
}
