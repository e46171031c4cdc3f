package com.trading.hedge.api;

/**
 * Callback for notifications accepted by a subscription filter.
 *
 * Called on the stream's delivery thread. Implementations must be cheap and
 * must not block; every subscriber shares the same delivery thread.
 */
@FunctionalInterface
public interface NotificationListener {

    void onNotification(ValuationNotification notification);
}
