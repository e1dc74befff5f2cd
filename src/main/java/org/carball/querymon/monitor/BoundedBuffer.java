package org.carball.querymon.monitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity FIFO that evicts its oldest element on overflow. Appends are O(1);
 * reads return copies so callers never observe concurrent modification.
 */
public class BoundedBuffer<T> {

    private final int capacity;
    private final Deque<T> elements;
    private long evicted;

    public BoundedBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void add(T element) {
        if (elements.size() == capacity) {
            elements.removeFirst();
            evicted++;
        }
        elements.addLast(element);
    }

    /**
     * All buffered elements, oldest first.
     */
    public synchronized List<T> snapshot() {
        return new ArrayList<>(elements);
    }

    /**
     * The newest {@code limit} elements, oldest first.
     */
    public synchronized List<T> latest(int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        List<T> all = new ArrayList<>(elements);
        return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized int size() {
        return elements.size();
    }

    public synchronized long getEvictedCount() {
        return evicted;
    }

    public synchronized void clear() {
        elements.clear();
        evicted = 0;
    }

    public int getCapacity() {
        return capacity;
    }
}
