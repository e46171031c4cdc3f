package com.trading.hedge.api;

/**
 * Handle returned by {@link NotificationStream#subscribe}. Closing it stops
 * delivery to the associated listener. Closing more than once is a no-op.
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
