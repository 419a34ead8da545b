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
package com.hellblazer.armada.tactical;

import com.hellblazer.armada.common.BoundedHistory;

/**
 * Outcomes of executed tactics, the most recent {@value #CAPACITY} of them.
 *
 * @author hal.hildebrand
 */
public class TacticalMemory {

    public static final int   CAPACITY             = 100;
    public static final float DEFAULT_SUCCESS_RATE = 0.5f;

    private final BoundedHistory<Outcome> outcomes;

    public TacticalMemory() {
        this(CAPACITY);
    }

    public TacticalMemory(int capacity) {
        outcomes = new BoundedHistory<>(capacity);
    }

    public synchronized void record(TacticType type, boolean success, double time) {
        outcomes.add(new Outcome(type, success, time));
    }

    /**
     * Fraction of remembered executions of {@code type} that succeeded, or {@value #DEFAULT_SUCCESS_RATE} if none is
     * remembered.
     */
    public synchronized float successRate(TacticType type) {
        int tried = outcomes.count(o -> o.type() == type);
        if (tried == 0) {
            return DEFAULT_SUCCESS_RATE;
        }
        return (float) outcomes.count(o -> o.type() == type && o.success()) / tried;
    }

    public synchronized int size() {
        return outcomes.size();
    }

    public synchronized void clear() {
        outcomes.clear();
    }

    public record Outcome(TacticType type, boolean success, double time) {
    }
}
