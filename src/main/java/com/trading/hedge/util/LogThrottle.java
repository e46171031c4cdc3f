package com.trading.hedge.util;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import org.apache.logging.log4j.Logger;

/**
 * Limits how often a message is logged from a hot callback.
 * Useful when notifications arrive thousands of times per second and every
 * one of them would otherwise produce a log line.
 */
public class LogThrottle {
    private static final long NEVER = Long.MIN_VALUE;

    private final Logger logger;
    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private final AtomicLong lastLogTime = new AtomicLong(NEVER);

    public LogThrottle(Logger logger, long minIntervalMillis) {
        this(logger, minIntervalMillis, System::nanoTime);
    }

    public LogThrottle(Logger logger, long minIntervalMillis, LongSupplier nanoClock) {
        if (minIntervalMillis < 0) {
            throw new IllegalArgumentException("Interval must be >= 0: " + minIntervalMillis);
        }
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.nanoClock = nanoClock;
    }

    /**
     * @return true if the caller may log now; at most one caller per interval
     *         gets true, even under contention.
     */
    public boolean tryAcquire() {
        long now = nanoClock.getAsLong();
        long last = lastLogTime.get();
        if (last != NEVER && now - last < minIntervalNanos) {
            return false;
        }
        return lastLogTime.compareAndSet(last, now);
    }

    public void error(String message, Throwable t) {
        if (tryAcquire()) {
            logger.error(message + " (Throttled)", t);
        }
    }
}
