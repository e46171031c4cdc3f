package com.trading.hedge.progress;

/**
 * Bounded FIFO ring of timestamps (nanoseconds).
 *
 * The backing array starts small and doubles as samples arrive, never beyond
 * the capacity. Adding to a full window overwrites the oldest sample. Not
 * thread-safe; the owning {@link ProgressTracker} serialises access.
 */
final class TimestampWindow {
    static final int INITIAL_ALLOCATION = 16;

    private final int capacity;
    private long[] samples;
    private int head = 0; // next write position
    private int count = 0;

    TimestampWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be >= 1: " + capacity);
        }
        this.capacity = capacity;
        this.samples = new long[Math.min(capacity, INITIAL_ALLOCATION)];
    }

    /** @return true if the oldest sample was evicted to make room. */
    boolean add(long timestampNanos) {
        if (count == samples.length && samples.length < capacity) {
            grow();
        }
        boolean evicted = count == samples.length;
        if (!evicted) {
            count++;
        }

        samples[head] = timestampNanos;
        head++;
        if (head >= samples.length) {
            head = 0;
        }
        return evicted;
    }

    // Only called when the array is full, so the oldest sample sits at head.
    private void grow() {
        int length = samples.length;
        int newLength = (int) Math.min(capacity, 2L * length);
        long[] grown = new long[newLength];
        System.arraycopy(samples, head, grown, 0, length - head);
        System.arraycopy(samples, 0, grown, length - head, head);
        samples = grown;
        head = count;
    }

    long oldest() {
        if (count == 0) {
            throw new IllegalStateException("Window is empty");
        }
        return samples[(head + samples.length - count) % samples.length];
    }

    long newest() {
        if (count == 0) {
            throw new IllegalStateException("Window is empty");
        }
        return samples[(head + samples.length - 1) % samples.length];
    }

    int size() {
        return count;
    }

    int capacity() {
        return capacity;
    }

    /** Length of the backing array currently allocated. */
    int allocated() {
        return samples.length;
    }
}
