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
package com.hellblazer.armada.world;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Capped inbound queue of {@link GameEvent}s. Producers may publish from any thread; the director drains once per
 * frame. When full, the oldest event is discarded.
 *
 * @author hal.hildebrand
 */
public class GameEventFeed {

    private static final Logger log = LoggerFactory.getLogger(GameEventFeed.class);

    private final int              capacity;
    private final Deque<GameEvent> events;
    private       long             dropped;

    public GameEventFeed(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    /**
     * Publish an event.
     *
     * @return false if an older event had to be dropped to make room
     */
    public synchronized boolean publish(GameEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        boolean room = true;
        if (events.size() == capacity) {
            var discarded = events.pollFirst();
            dropped++;
            room = false;
            log.warn("Event feed full ({}), dropped {}", capacity, discarded);
        }
        events.addLast(event);
        return room;
    }

    /**
     * Remove and return every pending event, oldest first.
     */
    public synchronized List<GameEvent> drain() {
        var drained = new ArrayList<>(events);
        events.clear();
        return drained;
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized long droppedCount() {
        return dropped;
    }

    public int capacity() {
        return capacity;
    }
}
