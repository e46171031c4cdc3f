package com.trading.hedge.progress;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import com.trading.hedge.api.NotificationListener;
import com.trading.hedge.api.NotificationStream;
import com.trading.hedge.api.NotificationType;
import com.trading.hedge.api.Subscription;
import com.trading.hedge.api.ValuationNotification;
import com.trading.hedge.model.ProgressSnapshot;

import lombok.extern.log4j.Log4j2;

/**
 * Turns unit-of-work notifications into percentage, rate and ETA.
 *
 * <p>
 * The rate is the throughput over a sliding window of the most recent
 * completion timestamps, so it follows changes in load rather than averaging
 * over the whole run:
 *
 * <pre>
 * rate = (samples - 1) / (newest - oldest)
 * eta  = (totalCost - completed) / rate
 * </pre>
 *
 * Until the window holds two distinct timestamps the configured fallback rate
 * is used. The ETA is a best-effort estimate.
 *
 * <p>
 * Thread-safety: {@link #onUnitCompleted()} may be called concurrently from
 * any number of producer threads. Append, evict and count happen under a
 * single lock so the window and the completed count never diverge.
 *
 * <p>
 * A total cost of zero is a valid, already-complete run: percent is 100 and
 * rate and ETA are NaN.
 */
@Log4j2
public final class ProgressTracker implements NotificationListener, AutoCloseable {
    private static final double NANOS_PER_SECOND = 1e9;

    private final long totalCost;
    private final ProgressSettings settings;
    private final LongSupplier nanoClock;
    private final TimestampWindow window;
    private final ReentrantLock lock = new ReentrantLock();
    private final CompositeProgressListener listeners = new CompositeProgressListener();

    private long completed;
    private Subscription subscription;

    public ProgressTracker(long totalCost) {
        this(totalCost, ProgressSettings.defaults(), System::nanoTime);
    }

    public ProgressTracker(long totalCost, ProgressSettings settings, LongSupplier nanoClock) {
        if (totalCost < 0) {
            throw new IllegalArgumentException("Total cost must be >= 0: " + totalCost);
        }
        this.totalCost = totalCost;
        this.settings = settings;
        this.nanoClock = nanoClock;
        this.window = new TimestampWindow(settings.windowCapacity(totalCost));
    }

    public void addListener(ProgressListener listener) {
        listeners.add(listener);
    }

    /**
     * Subscribes to unit-of-work notifications on {@code stream}. The tracker
     * owns the subscription and releases it in {@link #close()}.
     */
    public synchronized Subscription attach(NotificationStream stream) {
        if (subscription != null && subscription.isActive()) {
            throw new IllegalStateException("Progress tracker is already attached");
        }
        subscription = stream.subscribe(n -> n.type() == NotificationType.UNIT_OF_WORK_COMPLETED, this);
        log.debug("Tracking progress of {} units (window capacity {})", totalCost, window.capacity());
        return subscription;
    }

    @Override
    public void onNotification(ValuationNotification notification) {
        onUnitCompleted();
    }

    /** Records one completed unit of work at the current clock time. */
    public void onUnitCompleted() {
        ProgressSnapshot snapshot;
        lock.lock();
        try {
            window.add(nanoClock.getAsLong());
            completed++;
            snapshot = snapshotLocked();
        } finally {
            lock.unlock();
        }
        listeners.onProgress(snapshot);
    }

    public ProgressSnapshot snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    private ProgressSnapshot snapshotLocked() {
        if (totalCost == 0) {
            return new ProgressSnapshot(completed, 0, 100.0, Double.NaN, Double.NaN);
        }

        double rate = settings.fallbackRate();
        if (window.size() >= 2) {
            long spanNanos = window.newest() - window.oldest();
            if (spanNanos > 0) {
                rate = (window.size() - 1) / (spanNanos / NANOS_PER_SECOND);
            }
        }
        double eta = (totalCost - completed) / rate;
        double percent = 100.0 * completed / totalCost;
        return new ProgressSnapshot(completed, totalCost, percent, rate, eta);
    }

    public long totalCost() {
        return totalCost;
    }

    public long completedCount() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    public int windowSize() {
        lock.lock();
        try {
            return window.size();
        } finally {
            lock.unlock();
        }
    }

    public int windowCapacity() {
        return window.capacity();
    }

    /** Releases the notification subscription, if any. */
    @Override
    public synchronized void close() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }
}
