package com.trading.hedge.sync;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot readiness flag. Once set it stays set; setting it again is a
 * no-op. Safe to set from any thread.
 */
public final class CompletionSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void set() {
        latch.countDown();
    }

    public boolean isSet() {
        return latch.getCount() == 0;
    }

    /**
     * Blocks until the signal is set or the timeout elapses.
     *
     * @return true if the signal is set.
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }
}
