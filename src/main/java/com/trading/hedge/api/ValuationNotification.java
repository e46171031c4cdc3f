package com.trading.hedge.api;

/**
 * Read-only view of a notification delivered to subscribers.
 *
 * Instances may be reused by the delivering stream once the listener returns,
 * so listeners must copy whatever they need and must not retain the reference.
 */
public interface ValuationNotification {

    NotificationType type();

    /**
     * For {@link NotificationType#RESULT_CREATED} this is the call result id;
     * for {@link NotificationType#UNIT_OF_WORK_COMPLETED} it is the id of the
     * computed node.
     */
    String entityId();

    /** Delivery sequence, monotonic per stream. */
    long sequenceId();
}
