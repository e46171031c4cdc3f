package com.trading.hedge.wiring;

import com.trading.hedge.api.NotificationType;
import com.trading.hedge.api.ValuationNotification;

/**
 * Mutable notification slot of the ring buffer.
 *
 * Pattern: Flyweight / Mutable Event. Instances are pre-allocated when the ring
 * buffer is built and reused for every notification, so publishing allocates
 * nothing beyond the id string the engine already holds.
 */
public final class NotificationEvent implements ValuationNotification {
    private NotificationType type;
    private String entityId;
    private long sequenceId = -1;

    public void set(NotificationType type, String entityId, long sequenceId) {
        this.type = type;
        this.entityId = entityId;
        this.sequenceId = sequenceId;
    }

    @Override
    public NotificationType type() {
        return type;
    }

    @Override
    public String entityId() {
        return entityId;
    }

    @Override
    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        type = null;
        entityId = null;
        sequenceId = -1;
    }

    @Override
    public String toString() {
        return "NotificationEvent[" + type + " " + entityId + " #" + sequenceId + "]";
    }
}
