package com.trading.hedge.wiring;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.hedge.api.NotificationListener;
import com.trading.hedge.api.NotificationStream;
import com.trading.hedge.api.NotificationType;
import com.trading.hedge.api.Subscription;
import com.trading.hedge.api.ValuationNotification;
import com.trading.hedge.util.LogThrottle;

/**
 * Notification stream on an LMAX Disruptor ring buffer.
 *
 * <p>
 * Any number of engine worker threads publish notifications (multi-producer
 * ring). A single daemon consumer thread dispatches each one, in publication
 * order, to every active subscription whose filter accepts it. Subscribers
 * therefore always run on a different thread than the publisher and than a
 * caller blocked on completion.
 *
 * <p>
 * Subscriptions may be added and closed at any time; the registry is
 * copy-on-write so dispatch never locks. A listener that throws is logged
 * (throttled) and skipped; the consumer thread keeps running.
 */
public final class DisruptorNotificationBus implements NotificationStream, AutoCloseable {
    private static final Logger log = LogManager.getLogger(DisruptorNotificationBus.class);
    public static final int DEFAULT_RING_BUFFER_SIZE = 1024;

    private final Disruptor<NotificationEvent> disruptor;
    private final RingBuffer<NotificationEvent> ringBuffer;
    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();
    private final LogThrottle errorThrottle = new LogThrottle(log, 1000);
    private final AtomicLong delivered = new AtomicLong();
    private volatile boolean closed;

    public DisruptorNotificationBus() {
        this(DEFAULT_RING_BUFFER_SIZE);
    }

    /** @param ringBufferSize must be a power of 2. */
    public DisruptorNotificationBus(int ringBufferSize) {
        this.disruptor = new Disruptor<>(
                NotificationEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new Dispatcher());
        this.ringBuffer = disruptor.start();
    }

    /** Announces that one node value has been computed. */
    public void publishUnitCompleted(String nodeId) {
        publish(NotificationType.UNIT_OF_WORK_COMPLETED, nodeId);
    }

    /** Announces that a call result has been stored. */
    public void publishResultCreated(String callResultId) {
        publish(NotificationType.RESULT_CREATED, callResultId);
    }

    private void publish(NotificationType type, String entityId) {
        if (closed) {
            throw new IllegalStateException("Notification bus is closed");
        }
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(type, entityId, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    @Override
    public Subscription subscribe(Predicate<? super ValuationNotification> filter, NotificationListener listener) {
        if (filter == null || listener == null) {
            throw new IllegalArgumentException("filter and listener are required");
        }
        Registration registration = new Registration(filter, listener);
        registrations.add(registration);
        return registration;
    }

    public int subscriberCount() {
        return registrations.size();
    }

    /** Number of (notification, subscriber) deliveries made so far. */
    public long deliveredCount() {
        return delivered.get();
    }

    /**
     * Stops accepting notifications, drains those already published and stops
     * the consumer thread.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            disruptor.shutdown(5, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Notification backlog not drained within 5s, halting consumer", e);
            disruptor.halt();
        }
        registrations.clear();
    }

    private void dispatch(NotificationEvent event) {
        for (Registration r : registrations) {
            if (!r.active) {
                continue;
            }
            try {
                if (r.filter.test(event)) {
                    r.listener.onNotification(event);
                    delivered.incrementAndGet();
                }
            } catch (RuntimeException e) {
                // Keep the consumer thread alive for the other subscribers.
                errorThrottle.error("Subscriber failed on " + event, e);
            }
        }
    }

    private final class Dispatcher implements EventHandler<NotificationEvent> {
        @Override
        public void onEvent(NotificationEvent event, long sequence, boolean endOfBatch) {
            try {
                dispatch(event);
            } finally {
                event.clear();
            }
        }
    }

    private final class Registration implements Subscription {
        private final Predicate<? super ValuationNotification> filter;
        private final NotificationListener listener;
        private volatile boolean active = true;

        private Registration(Predicate<? super ValuationNotification> filter, NotificationListener listener) {
            this.filter = filter;
            this.listener = listener;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            if (active) {
                active = false;
                registrations.remove(this);
            }
        }
    }
}
