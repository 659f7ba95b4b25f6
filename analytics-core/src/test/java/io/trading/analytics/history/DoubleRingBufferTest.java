package io.trading.analytics.history;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DoubleRingBufferTest {

    @Test
    void testEvictsOldestFirst() {
        DoubleRingBuffer buffer = new DoubleRingBuffer(3);
        for (int i = 1; i <= 5; i++) {
            buffer.add(i);
            assertTrue(buffer.size() <= 3);
        }

        assertEquals(3, buffer.size());
        assertEquals(3.0, buffer.get(0));
        assertEquals(5.0, buffer.last());
        assertArrayEquals(new double[]{3, 4, 5}, buffer.toArray());
        assertArrayEquals(new double[]{4, 5}, buffer.toArray(2));
        assertArrayEquals(new double[]{3, 4, 5}, buffer.toArray(10));
    }

    @Test
    void testEmpty() {
        DoubleRingBuffer buffer = new DoubleRingBuffer(4);

        assertTrue(buffer.isEmpty());
        assertEquals(0, buffer.toArray().length);
        assertEquals(4, buffer.capacity());
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new DoubleRingBuffer(0));
    }
}
