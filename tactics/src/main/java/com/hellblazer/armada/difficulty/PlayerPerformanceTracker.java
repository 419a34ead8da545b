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
package com.hellblazer.armada.difficulty;

import com.hellblazer.armada.SimulationClock;
import com.hellblazer.armada.common.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Player telemetry: a rolling window of recent lives and death times plus lifetime kill, shot and hit counters.
 * All times are simulation seconds from the shared clock.
 *
 * @author hal.hildebrand
 */
public class PlayerPerformanceTracker {

    public static final int   WINDOW        = 10;
    public static final float STREAK_WINDOW = 60.0f;

    private static final Logger log = LoggerFactory.getLogger(PlayerPerformanceTracker.class);

    private final SimulationClock        clock;
    private final BoundedHistory<Float>  survivalTimes = new BoundedHistory<>(WINDOW);
    private final BoundedHistory<Double> deathTimes    = new BoundedHistory<>(WINDOW);
    private       double                 trackingStart;
    private       double                 lastKill      = Double.NEGATIVE_INFINITY;
    private       int                    kills;
    private       int                    deaths;
    private       int                    shots;
    private       int                    hits;

    public PlayerPerformanceTracker(SimulationClock clock) {
        this.clock = clock;
        this.trackingStart = clock.now();
    }

    /**
     * @param survivalTime how long the life that just ended lasted
     */
    public synchronized void recordDeath(float survivalTime) {
        if (survivalTime < 0.0f || Float.isNaN(survivalTime)) {
            throw new IllegalArgumentException("Survival time must be non-negative: " + survivalTime);
        }
        survivalTimes.add(survivalTime);
        deathTimes.add(clock.now());
        deaths++;
        log.debug("Player death after {}s, {} deaths total", survivalTime, deaths);
    }

    public synchronized void recordKill() {
        kills++;
        lastKill = clock.now();
    }

    public synchronized void recordShot(boolean hit) {
        shots++;
        if (hit) {
            hits++;
        }
    }

    public synchronized PlayerPerformance performance() {
        double now = clock.now();
        Double lastDeath = deathTimes.newest();
        float currentSurvival = (float) (now - (lastDeath == null ? trackingStart : lastDeath));

        float averageSurvival;
        if (survivalTimes.isEmpty()) {
            averageSurvival = currentSurvival;
        } else {
            float sum = 0.0f;
            for (var time : survivalTimes.snapshot()) {
                sum += time;
            }
            averageSurvival = sum / survivalTimes.size();
        }

        float kdr;
        if (deaths > 0) {
            kdr = (float) kills / deaths;
        } else {
            kdr = kills > 0 ? 10.0f : 1.0f;
        }
        float accuracy = shots > 0 ? (float) hits / shots : 0.5f;
        double streakStart = Math.max(now - STREAK_WINDOW, lastKill);
        int streak = deathTimes.count(t -> t > streakStart);
        float sinceDeath = lastDeath == null ? Float.MAX_VALUE : (float) (now - lastDeath);
        return new PlayerPerformance(averageSurvival, kdr, accuracy, streak, sinceDeath, currentSurvival);
    }

    public synchronized int kills() {
        return kills;
    }

    public synchronized int deaths() {
        return deaths;
    }

    public synchronized void reset() {
        survivalTimes.clear();
        deathTimes.clear();
        kills = 0;
        deaths = 0;
        shots = 0;
        hits = 0;
        lastKill = Double.NEGATIVE_INFINITY;
        trackingStart = clock.now();
    }
}
