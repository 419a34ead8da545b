/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Armada.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.armada.common;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Fixed capacity, insertion ordered buffer that evicts its oldest element when full.
 * <p>
 * Used both for message history and for rolling telemetry windows. Not thread-safe.
 *
 * @param <T> element type
 * @author hal.hildebrand
 */
public class BoundedHistory<T> {

    private final int       capacity;
    private final Deque<T>  elements;
    private       long      evicted;

    /**
     * @param capacity maximum number of retained elements, must be positive
     */
    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(capacity);
    }

    /**
     * Append an element, evicting the oldest one if the buffer is full.
     *
     * @param element element to append
     * @return the evicted element, or null if nothing was evicted
     */
    public T add(T element) {
        T removed = null;
        if (elements.size() == capacity) {
            removed = elements.pollFirst();
            evicted++;
        }
        elements.addLast(element);
        return removed;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * @return the most recently added element, or null when empty
     */
    public T newest() {
        return elements.peekLast();
    }

    /**
     * @return the oldest retained element, or null when empty
     */
    public T oldest() {
        return elements.peekFirst();
    }

    /**
     * Total number of elements evicted since creation or the last {@link #clear()}.
     */
    public long evictedCount() {
        return evicted;
    }

    /**
     * @return oldest-first copy of the retained elements
     */
    public List<T> snapshot() {
        return new ArrayList<>(elements);
    }

    /**
     * @return oldest-first copy of the retained elements matching the filter
     */
    public List<T> snapshot(Predicate<? super T> filter) {
        var results = new ArrayList<T>();
        for (var element : elements) {
            if (filter.test(element)) {
                results.add(element);
            }
        }
        return results;
    }

    public boolean contains(T element) {
        return elements.contains(element);
    }

    /**
     * Count retained elements matching the filter.
     */
    public int count(Predicate<? super T> filter) {
        int count = 0;
        for (var element : elements) {
            if (filter.test(element)) {
                count++;
            }
        }
        return count;
    }

    public void clear() {
        elements.clear();
        evicted = 0;
    }

    @Override
    public String toString() {
        return String.format("BoundedHistory{size=%d, capacity=%d, evicted=%d}", elements.size(), capacity, evicted);
    }
}
