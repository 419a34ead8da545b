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
package com.hellblazer.armada;

/**
 * Simulation time in seconds, advanced once per frame by the director.
 * <p>
 * Message timestamps, death times and threat sightings all read this clock instead of the wall clock so that a
 * replay of the same frame sequence produces the same decisions.
 *
 * @author hal.hildebrand
 */
public class SimulationClock {

    private double now;
    private long   frame;

    public SimulationClock() {
        this(0.0);
    }

    public SimulationClock(double start) {
        this.now = start;
    }

    /**
     * Advance by one frame.
     *
     * @param deltaTime frame duration in seconds, must not be negative
     * @return the new time
     */
    public double advance(float deltaTime) {
        if (deltaTime < 0.0f || Float.isNaN(deltaTime)) {
            throw new IllegalArgumentException("Delta time must be non-negative: " + deltaTime);
        }
        now += deltaTime;
        frame++;
        return now;
    }

    /**
     * @return seconds since the start of the simulation
     */
    public double now() {
        return now;
    }

    public long frame() {
        return frame;
    }

    @Override
    public String toString() {
        return String.format("SimulationClock{t=%.3f, frame=%d}", now, frame);
    }
}
