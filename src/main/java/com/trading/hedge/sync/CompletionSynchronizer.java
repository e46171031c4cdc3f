package com.trading.hedge.sync;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.trading.hedge.api.NotificationStream;
import com.trading.hedge.api.NotificationType;
import com.trading.hedge.api.ResultStore;
import com.trading.hedge.api.Subscription;
import com.trading.hedge.error.ValuationIncompleteException;
import com.trading.hedge.model.ValuationResult;

/**
 * Blocks the caller until the result of an asynchronous valuation is in the
 * result store.
 *
 * <p>
 * Algorithm:
 * <ol>
 * <li>Subscribe a filter that accepts only {@code RESULT_CREATED}
 * notifications for the target id; a match sets a {@link CompletionSignal}.</li>
 * <li>If the store already holds the target id, return it. This covers results
 * stored before the subscription existed.</li>
 * <li>Otherwise wait on the signal for at most one poll timeout, then go back to
 * step 2.</li>
 * </ol>
 * Store membership is the only condition for returning. The signal is a wake
 * hint: a lost or late notification costs at most one poll timeout, and an
 * unrelated notification can never cause a return.
 *
 * <p>
 * A poll timeout is a retry boundary, not an error. Only the optional total
 * budget ends the wait with {@link ValuationIncompleteException}. The
 * subscription is closed on every exit path.
 */
public final class CompletionSynchronizer {
    private static final Logger log = LogManager.getLogger(CompletionSynchronizer.class);

    private final LongSupplier nanoClock;

    public CompletionSynchronizer() {
        this(System::nanoTime);
    }

    CompletionSynchronizer(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    /** Waits without a total budget. */
    public ValuationResult waitFor(String targetId, ResultStore store, NotificationStream stream,
            Duration pollTimeout) {
        return waitFor(targetId, store, stream, pollTimeout, null);
    }

    /**
     * @param totalBudget maximum overall wait, or null to wait indefinitely.
     * @throws ValuationIncompleteException if the budget expires or the thread
     *                                      is interrupted.
     */
    public ValuationResult waitFor(String targetId, ResultStore store, NotificationStream stream,
            Duration pollTimeout, Duration totalBudget) {
        if (targetId == null) {
            throw new IllegalArgumentException("targetId is required");
        }
        if (pollTimeout == null || pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be positive: " + pollTimeout);
        }
        if (totalBudget != null && totalBudget.isNegative()) {
            throw new IllegalArgumentException("totalBudget must not be negative: " + totalBudget);
        }

        final long pollNanos = pollTimeout.toNanos();
        final long deadline = totalBudget == null ? 0 : nanoClock.getAsLong() + totalBudget.toNanos();
        final CompletionSignal signal = new CompletionSignal();

        try (Subscription ignored = stream.subscribe(
                n -> n.type() == NotificationType.RESULT_CREATED && targetId.equals(n.entityId()),
                n -> signal.set())) {
            int polls = 0;
            while (true) {
                if (store.contains(targetId)) {
                    ValuationResult result = store.get(targetId);
                    if (result != null) {
                        log.debug("Result {} available after {} polls", targetId, polls);
                        return result;
                    }
                }

                long waitNanos = pollNanos;
                if (totalBudget != null) {
                    long remaining = deadline - nanoClock.getAsLong();
                    if (remaining <= 0) {
                        throw new ValuationIncompleteException(targetId, totalBudget);
                    }
                    waitNanos = Math.min(waitNanos, remaining);
                }

                if (signal.isSet()) {
                    // Signalled but not yet visible in the store: the latch no longer
                    // blocks, so sleep out the poll instead of spinning.
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                } else if (!signal.await(waitNanos, TimeUnit.NANOSECONDS)) {
                    log.debug("Still waiting for result {} (poll {})", targetId, polls + 1);
                }
                polls++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ValuationIncompleteException(targetId, e);
        }
    }
}
