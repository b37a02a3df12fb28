package com.phillippitts.grillstats.service.stream;

import java.util.Arrays;

/**
 * Bounded FIFO of updates for one subscriber. When full, offering a new update drops the oldest
 * one, so a slow consumer loses history instead of blocking the producer. Thread-safe for one
 * producer at a time (the device group lock) and one consumer (the drain task).
 */
final class UpdateBuffer {

    private final StreamUpdate[] buffer;
    private int writePos = 0;
    private int size = 0;

    UpdateBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive, got: " + capacity);
        }
        this.buffer = new StreamUpdate[capacity];
    }

    int capacity() {
        return buffer.length;
    }

    /**
     * Appends an update.
     *
     * @return the update dropped to make room, or null
     */
    synchronized StreamUpdate offer(StreamUpdate update) {
        StreamUpdate dropped = null;
        if (size == buffer.length) {
            // writePos is the oldest slot when full
            dropped = buffer[writePos];
            size--;
        }
        buffer[writePos] = update;
        writePos = (writePos + 1) % buffer.length;
        size++;
        return dropped;
    }

    /** Removes and returns the oldest update, or null when empty. */
    synchronized StreamUpdate poll() {
        if (size == 0) {
            return null;
        }
        int start = (writePos - size + buffer.length) % buffer.length;
        StreamUpdate head = buffer[start];
        buffer[start] = null;
        size--;
        return head;
    }

    synchronized int size() {
        return size;
    }

    synchronized boolean isEmpty() {
        return size == 0;
    }

    synchronized void clear() {
        Arrays.fill(buffer, null);
        writePos = 0;
        size = 0;
    }
}
