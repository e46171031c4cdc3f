package com.trading.hedge.wiring;

import com.trading.hedge.api.NotificationType;
import com.trading.hedge.api.Subscription;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class DisruptorNotificationBusTest {

    private DisruptorNotificationBus bus;

    @Before
    public void setUp() {
        bus = new DisruptorNotificationBus(16);
    }

    @After
    public void tearDown() {
        bus.close();
    }

    @Test
    public void testFilterSelectsNotifications() throws Exception {
        List<String> results = new CopyOnWriteArrayList<>();
        AtomicInteger units = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(1);

        bus.subscribe(n -> n.type() == NotificationType.UNIT_OF_WORK_COMPLETED, n -> units.incrementAndGet());
        bus.subscribe(n -> n.type() == NotificationType.RESULT_CREATED, n -> {
            results.add(n.entityId());
            done.countDown();
        });

        // More than the ring size, so the producer wraps the buffer.
        for (int i = 0; i < 100; i++) {
            bus.publishUnitCompleted("node-" + i);
        }
        bus.publishResultCreated("r1");

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(100, units.get());
        assertEquals(List.of("r1"), results);

        bus.close(); // drains the ring
        assertEquals(101, bus.deliveredCount());
    }

    @Test
    public void testDeliveryHappensOnConsumerThread() throws Exception {
        AtomicReference<Thread> deliveryThread = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        bus.subscribe(n -> true, n -> {
            deliveryThread.set(Thread.currentThread());
            done.countDown();
        });

        bus.publishUnitCompleted("a");
        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertNotSame(Thread.currentThread(), deliveryThread.get());
        assertTrue(deliveryThread.get().isDaemon());
    }

    @Test
    public void testClosedSubscriptionStopsDelivery() throws Exception {
        AtomicInteger closedCount = new AtomicInteger();
        Subscription sub = bus.subscribe(n -> true, n -> closedCount.incrementAndGet());
        sub.close();
        sub.close();
        assertFalse(sub.isActive());
        assertEquals(0, bus.subscriberCount());

        CountDownLatch marker = new CountDownLatch(1);
        bus.subscribe(n -> n.type() == NotificationType.RESULT_CREATED, n -> marker.countDown());
        bus.publishUnitCompleted("x");
        bus.publishResultCreated("done");

        assertTrue(marker.await(10, TimeUnit.SECONDS));
        assertEquals(0, closedCount.get());
    }

    @Test
    public void testFailingListenerDoesNotStopOthers() throws Exception {
        CountDownLatch received = new CountDownLatch(3);
        bus.subscribe(n -> true, n -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(n -> true, n -> received.countDown());

        bus.publishUnitCompleted("1");
        bus.publishUnitCompleted("2");
        bus.publishResultCreated("3");

        assertTrue("consumer thread must survive listener failures", received.await(10, TimeUnit.SECONDS));
    }

    @Test
    public void testPublishAfterCloseRejected() {
        bus.close();
        try {
            bus.publishUnitCompleted("late");
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("closed"));
        }
    }

    @Test
    public void testCloseDrainsBacklogOfSlowSubscriber() {
        AtomicInteger seen = new AtomicInteger();
        bus.subscribe(n -> true, n -> {
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            seen.incrementAndGet();
        });
        for (int i = 0; i < 12; i++) {
            bus.publishUnitCompleted("n" + i);
        }

        bus.close();

        assertEquals(12, seen.get());
        assertEquals(0, bus.subscriberCount());
        bus.close(); // second close is a no-op
    }

    @Test
    public void testEventSlotIsClearedAfterDispatch() {
        NotificationEvent event = new NotificationEvent();
        event.set(NotificationType.RESULT_CREATED, "r", 7);
        assertEquals("r", event.entityId());
        event.clear();
        assertNull(event.type());
        assertNull(event.entityId());
        assertEquals(-1, event.sequenceId());
    }
}
