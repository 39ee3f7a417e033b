/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RingBufferTest {

    @Test
    void evictsOldestWhenFull() {
        RingBuffer<String> buffer = new RingBuffer<>(3);
        assertNull(buffer.add("a"));
        assertNull(buffer.add("b"));
        assertNull(buffer.add("c"));
        assertEquals("a", buffer.add("d"));
        assertEquals(List.of("b", "c", "d"), buffer.toList());
        assertEquals("b", buffer.first());
        assertEquals("d", buffer.last());
        assertEquals(3, buffer.size());
    }

    @Test
    void positionalAccessFollowsWrapAround() {
        RingBuffer<Integer> buffer = new RingBuffer<>(4);
        for (int i = 0; i < 10; i++) buffer.add(i);
        assertEquals(List.of(6, 7, 8, 9), buffer.toList());
        assertEquals(6, buffer.get(0));
        assertEquals(9, buffer.get(3));
        assertThrows(IndexOutOfBoundsException.class, () -> buffer.get(4));
    }

    @Test
    void growsPastInitialStorageUpToCapacity() {
        RingBuffer<Integer> buffer = new RingBuffer<>(40);
        for (int i = 0; i < 100; i++) buffer.add(i);
        assertEquals(40, buffer.size());
        assertEquals(60, buffer.first());
        assertEquals(99, buffer.last());
    }

    @Test
    void zeroCapacityIsUnbounded() {
        RingBuffer<Integer> buffer = new RingBuffer<>(0);
        for (int i = 0; i < 1000; i++) assertNull(buffer.add(i));
        assertFalse(buffer.isBounded());
        assertEquals(1000, buffer.size());
        assertEquals(0, buffer.first());
        assertEquals(999, buffer.last());
    }

    @Test
    void clearEmptiesAndAcceptsNewElements() {
        RingBuffer<String> buffer = new RingBuffer<>(2);
        buffer.add("x");
        buffer.add("y");
        buffer.add("z");
        buffer.clear();
        assertTrue(buffer.isEmpty());
        buffer.add("n");
        assertEquals(List.of("n"), buffer.toList());
    }

    @Test
    void iteratesOldestFirst() {
        RingBuffer<String> buffer = new RingBuffer<>(2);
        buffer.add("1");
        buffer.add("2");
        buffer.add("3");
        List<String> seen = new ArrayList<>();
        for (String s : buffer) seen.add(s);
        assertEquals(List.of("2", "3"), seen);
    }

    @Test
    void rejectsNegativeCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RingBuffer<>(-1));
    }
}
