package com.trading.hedge.progress;

import java.util.Locale;
import java.util.function.LongSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.trading.hedge.model.ProgressSnapshot;
import com.trading.hedge.util.LogThrottle;

/**
 * Logs a progress line such as {@code 42.00% complete (420/1000) 12.50/s eta 46s}
 * at most once per interval. The final unit of a non-empty run is always
 * logged.
 */
public final class ProgressLogListener implements ProgressListener {
    private static final Logger log = LogManager.getLogger(ProgressLogListener.class);

    private final LogThrottle throttle;

    public ProgressLogListener(long intervalMillis) {
        this(intervalMillis, System::nanoTime);
    }

    public ProgressLogListener(long intervalMillis, LongSupplier nanoClock) {
        this.throttle = new LogThrottle(log, intervalMillis, nanoClock);
    }

    @Override
    public void onProgress(ProgressSnapshot s) {
        if (shouldLog(s)) {
            log.info(format(s));
        }
    }

    // A zero-cost run never counts as finished.
    boolean shouldLog(ProgressSnapshot s) {
        boolean finished = s.totalCost() > 0 && s.completed() == s.totalCost();
        return throttle.tryAcquire() || finished;
    }

    static String format(ProgressSnapshot s) {
        if (s.isDegenerate()) {
            return String.format(Locale.ROOT, "%.2f%% complete (%d/%d)", s.percent(), s.completed(), s.totalCost());
        }
        return String.format(Locale.ROOT, "%.2f%% complete (%d/%d) %.2f/s eta %.0fs",
                s.percent(), s.completed(), s.totalCost(), s.rate(), s.eta());
    }
}
