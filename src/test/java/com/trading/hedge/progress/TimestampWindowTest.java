package com.trading.hedge.progress;

import org.junit.Test;

import static org.junit.Assert.*;

public class TimestampWindowTest {

    @Test
    public void testFifoEviction() {
        TimestampWindow w = new TimestampWindow(3);
        assertFalse(w.add(10));
        assertFalse(w.add(20));
        assertFalse(w.add(30));
        assertEquals(10, w.oldest());
        assertEquals(30, w.newest());

        assertTrue(w.add(40));
        assertEquals(3, w.size());
        assertEquals(20, w.oldest());
        assertEquals(40, w.newest());
    }

    @Test
    public void testCapacityOneKeepsOnlyNewest() {
        TimestampWindow w = new TimestampWindow(1);
        w.add(5);
        w.add(6);
        assertEquals(1, w.size());
        assertEquals(6, w.oldest());
        assertEquals(6, w.newest());
    }

    @Test
    public void testGrowsLazilyAndKeepsOrderAcrossGrowth() {
        TimestampWindow w = new TimestampWindow(100);
        assertEquals(TimestampWindow.INITIAL_ALLOCATION, w.allocated());

        for (int i = 1; i <= 40; i++) {
            assertFalse(w.add(i));
        }
        assertEquals(40, w.size());
        assertEquals(64, w.allocated());
        assertEquals(1, w.oldest());
        assertEquals(40, w.newest());

        for (int i = 41; i <= 130; i++) {
            w.add(i);
        }
        assertEquals(100, w.allocated());
        assertEquals(100, w.size());
        assertEquals(31, w.oldest());
        assertEquals(130, w.newest());
    }

    @Test
    public void testHugeCapacityIsNotAllocatedUpFront() {
        TimestampWindow w = new TimestampWindow(Integer.MAX_VALUE - 8);
        w.add(1);
        w.add(2);
        assertEquals(TimestampWindow.INITIAL_ALLOCATION, w.allocated());
        assertEquals(1, w.oldest());
        assertEquals(2, w.newest());
    }

    @Test(expected = IllegalStateException.class)
    public void testEmptyWindowHasNoOldest() {
        new TimestampWindow(2).oldest();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroCapacityRejected() {
        new TimestampWindow(0);
    }
}
