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
package com.hellblazer.armada.knowledge;

import com.hellblazer.armada.geometry.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared blackboard of threat levels keyed by quantized position.
 * <p>
 * Positions are bucketed into cubic cells so that repeated sightings of the same area accumulate into one entry.
 * Entries are last-write-wins; nothing expires unless {@link #prune(double, double)} is called.
 *
 * @author hal.hildebrand
 */
public class ThreatDatabase {

    private static final Logger log = LoggerFactory.getLogger(ThreatDatabase.class);

    private final float                  cellSize;
    private final Map<Cell, ThreatInfo>  threats = new ConcurrentHashMap<>();

    public ThreatDatabase(float cellSize) {
        if (!(cellSize > 0.0f) || !Float.isFinite(cellSize)) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellSize);
        }
        this.cellSize = cellSize;
    }

    /**
     * Record a sighting. The cell's level becomes the larger of its current level and the sighting confidence.
     *
     * @param position   where the threat was seen
     * @param confidence sighting confidence, clamped into [0, 1]
     * @param velocity   observed velocity, may be null
     * @param health     observed health, negative when unknown
     * @param now        simulation time
     * @return the updated entry
     */
    public ThreatInfo updateThreat(Tuple3f position, float confidence, Vector3f velocity, float health, double now) {
        float level = Vectors.clamp01(confidence);
        return threats.merge(cellOf(position), new ThreatInfo(new Point3f(position), level, now, velocity, health),
                             (previous, sighting) -> new ThreatInfo(sighting.position(),
                                                                    Math.max(previous.level(), sighting.level()),
                                                                    now, sighting.velocity(), sighting.health()));
    }

    /**
     * Raise the threat level of the cell containing {@code position} by {@code amount}, capped at 1.
     */
    public ThreatInfo increaseThreatLevel(Tuple3f position, float amount, double now) {
        var updated = threats.merge(cellOf(position),
                                    new ThreatInfo(new Point3f(position), Vectors.clamp01(amount), now, null, -1.0f),
                                    (previous, fresh) -> previous.withLevel(
                                    Vectors.clamp01(previous.level() + amount), now));
        log.debug("Threat near {} raised to {}", position, updated.level());
        return updated;
    }

    public Optional<ThreatInfo> threatAt(Tuple3f position) {
        return Optional.ofNullable(threats.get(cellOf(position)));
    }

    /**
     * Highest threat level recorded within {@code radius} of a position, zero if none.
     */
    public float threatLevelNear(Tuple3f position, float radius) {
        float radiusSquared = radius * radius;
        float highest = 0.0f;
        for (var info : threats.values()) {
            if (Vectors.distanceSquared(info.position(), position) <= radiusSquared) {
                highest = Math.max(highest, info.level());
            }
        }
        return highest;
    }

    public Optional<ThreatInfo> highestThreat() {
        return threats.values().stream().max(Comparator.comparingDouble(ThreatInfo::level));
    }

    /**
     * Remove entries not refreshed within {@code maxAge} seconds.
     *
     * @return number of entries removed
     */
    public int prune(double now, double maxAge) {
        int before = threats.size();
        threats.values().removeIf(info -> now - info.lastSeen() > maxAge);
        int removed = before - threats.size();
        if (removed > 0) {
            log.debug("Pruned {} stale threats", removed);
        }
        return removed;
    }

    public List<ThreatInfo> snapshot() {
        return new ArrayList<>(threats.values());
    }

    public int size() {
        return threats.size();
    }

    public void clear() {
        threats.clear();
    }

    private Cell cellOf(Tuple3f position) {
        return new Cell((int) Math.floor(position.x / cellSize), (int) Math.floor(position.y / cellSize),
                        (int) Math.floor(position.z / cellSize));
    }

    private record Cell(int x, int y, int z) {
    }
}
