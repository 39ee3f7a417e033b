/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Array-backed FIFO ring buffer with O(1) append, eviction and positional access.
 *
 * <p>A buffer created with a positive capacity holds at most that many elements;
 * appending to a full buffer overwrites (evicts) the oldest one. A capacity of
 * {@code 0} makes the buffer unbounded. Storage grows on demand in both modes, so a
 * large bounded capacity costs nothing until it is used.</p>
 *
 * <p>Not thread-safe. Callers sharing a buffer must guard it externally.</p>
 *
 * @param <T> element type
 */
public class RingBuffer<T> implements Iterable<T> {

    private static final int INITIAL_SLOTS = 16;

    private final int capacity;
    private Object[] slots;
    private int head;
    private int size;

    public RingBuffer(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
        this.slots = new Object[capacity > 0 ? Math.min(capacity, INITIAL_SLOTS) : INITIAL_SLOTS];
    }

    /**
     * Append an element at the newest end.
     *
     * @return the evicted oldest element, or {@code null} if nothing was evicted
     */
    @SuppressWarnings("unchecked")
    public T add(T item) {
        if (isBounded() && size == capacity) {
            T evicted = (T) slots[head];
            slots[head] = item;
            head = (head + 1) % slots.length;
            return evicted;
        }
        if (size == slots.length) {
            grow();
        }
        slots[(head + size) % slots.length] = item;
        size++;
        return null;
    }

    /**
     * Element at a logical position, {@code 0} being the oldest.
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " outside [0, " + size + ")");
        }
        return (T) slots[(head + index) % slots.length];
    }

    public T first() {
        if (size == 0) throw new NoSuchElementException("buffer is empty");
        return get(0);
    }

    public T last() {
        if (size == 0) throw new NoSuchElementException("buffer is empty");
        return get(size - 1);
    }

    public int size() { return size; }

    public boolean isEmpty() { return size == 0; }

    /** Configured capacity; {@code 0} when unbounded. */
    public int capacity() { return capacity; }

    public boolean isBounded() { return capacity > 0; }

    public void clear() {
        slots = new Object[capacity > 0 ? Math.min(capacity, INITIAL_SLOTS) : INITIAL_SLOTS];
        head = 0;
        size = 0;
    }

    /** Copy of the contents, oldest first. */
    public List<T> toList() {
        List<T> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(get(i));
        }
        return copy;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() { return next < size; }

            @Override
            public T next() {
                if (next >= size) throw new NoSuchElementException();
                return get(next++);
            }
        };
    }

    private void grow() {
        int newLength = slots.length * 2;
        if (isBounded()) {
            newLength = Math.min(capacity, newLength);
        }
        Object[] grown = new Object[newLength];
        for (int i = 0; i < size; i++) {
            grown[i] = slots[(head + i) % slots.length];
        }
        slots = grown;
        head = 0;
    }

    @Override
    public String toString() {
        return "RingBuffer{size=" + size + ", capacity=" + (isBounded() ? capacity : "unbounded") + "}";
    }
}
