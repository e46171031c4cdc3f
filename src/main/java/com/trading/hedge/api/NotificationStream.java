package com.trading.hedge.api;

import java.util.function.Predicate;

/**
 * Subscribe side of the valuation engine's notification stream.
 *
 * Each subscriber owns its {@link Subscription} and disposes it when done, so
 * repeated runs never leak handlers into a discarded state.
 */
public interface NotificationStream {

    /**
     * Registers a listener that receives every notification accepted by
     * {@code filter}. Notifications published before this call are not
     * replayed.
     *
     * @param filter   evaluated on the delivery thread for each notification.
     * @param listener invoked for accepted notifications.
     * @return the handle that unregisters the listener when closed.
     */
    Subscription subscribe(Predicate<? super ValuationNotification> filter, NotificationListener listener);
}
