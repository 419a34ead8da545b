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

import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared blackboard of the latest {@link AllyStatus} per agent.
 *
 * @author hal.hildebrand
 */
public class AllyTracker {

    private final Map<UUID, AllyStatus> statuses = new ConcurrentHashMap<>();

    /**
     * Store a report, replacing any previous one from the same agent.
     */
    public void update(AllyStatus status) {
        statuses.put(status.agentId(), status);
    }

    public Optional<AllyStatus> status(UUID agentId) {
        return Optional.ofNullable(statuses.get(agentId));
    }

    public void remove(UUID agentId) {
        statuses.remove(agentId);
    }

    /**
     * Allies whose last report said they were fighting, within {@code radius} of a position.
     */
    public List<AllyStatus> alliesInCombat(Tuple3f near, float radius) {
        float radiusSquared = radius * radius;
        var result = new ArrayList<AllyStatus>();
        for (var status : statuses.values()) {
            if (status.inCombat() && Vectors.distanceSquared(status.position(), near) <= radiusSquared) {
                result.add(status);
            }
        }
        return result;
    }

    /**
     * The ally with the lowest reported health ratio.
     */
    public Optional<AllyStatus> weakestAlly() {
        return statuses.values().stream().min(Comparator.comparingDouble(AllyStatus::healthRatio));
    }

    public List<AllyStatus> snapshot() {
        return new ArrayList<>(statuses.values());
    }

    public int size() {
        return statuses.size();
    }

    public void clear() {
        statuses.clear();
    }
}
