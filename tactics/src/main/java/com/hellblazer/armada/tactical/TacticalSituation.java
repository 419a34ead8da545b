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

import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.agent.ShipType;
import com.hellblazer.armada.geometry.Vectors;
import com.hellblazer.armada.world.Body;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A snapshot of one group facing one target, with the measures the tactic evaluations are built from.
 *
 * @param group              the ships assessed, in the order given
 * @param target             what the group is engaging, may be null
 * @param averageHealth      mean health ratio of the group
 * @param averageDistance    mean distance to the target, {@link Float#MAX_VALUE} without one
 * @param formationIntegrity how tightly the group is clustered around its centroid, in [0, 1]
 * @param threatLevel        blend of lost health and target proximity, in [0, 1]
 * @param shipTypes          every ship type present in the group
 * @author hal.hildebrand
 */
public record TacticalSituation(List<AgentShip> group, Body target, float averageHealth, float averageDistance,
                                float formationIntegrity, float threatLevel, Set<ShipType> shipTypes) {

    public static final float INTEGRITY_RADIUS = 100.0f;
    public static final float THREAT_RADIUS    = 200.0f;
    public static final float IDEAL_SPACING    = 40.0f;
    public static final float FORMATION_BONUS  = 0.2f;

    public TacticalSituation {
        group = Collections.unmodifiableList(new ArrayList<>(group));
        shipTypes = Collections.unmodifiableSet(shipTypes.isEmpty() ? EnumSet.noneOf(ShipType.class)
                                                                    : EnumSet.copyOf(shipTypes));
    }

    /**
     * @throws IllegalArgumentException if the group is empty
     */
    public static TacticalSituation assess(Collection<? extends AgentShip> group, Body target) {
        if (group.isEmpty()) {
            throw new IllegalArgumentException("Cannot assess an empty group");
        }
        var ships = new ArrayList<AgentShip>(group);
        var types = EnumSet.noneOf(ShipType.class);
        var positions = new ArrayList<Point3f>(ships.size());
        float health = 0.0f;
        float distance = 0.0f;
        for (var ship : ships) {
            types.add(ship.shipType());
            positions.add(ship.position());
            health += ship.healthRatio();
            if (target != null) {
                distance += ship.distanceTo(target.position());
            }
        }
        health /= ships.size();
        distance = target == null ? Float.MAX_VALUE : distance / ships.size();

        float integrity = 1.0f;
        if (ships.size() >= 2) {
            var centroid = Vectors.centroid(positions, new Point3f());
            float spread = 0.0f;
            for (var position : positions) {
                spread += Vectors.distance(position, centroid);
            }
            integrity = Math.max(0.0f, 1.0f - spread / ships.size() / INTEGRITY_RADIUS);
        }

        float threat = 0.0f;
        if (target != null) {
            threat = ((1.0f - health) + Math.max(0.0f, 1.0f - distance / THREAT_RADIUS)) / 2.0f;
        }
        return new TacticalSituation(ships, target, health, distance, integrity, threat, types);
    }

    public int allyCount() {
        return group.size();
    }

    public boolean hasTarget() {
        return target != null;
    }

    /**
     * Fraction of the group whose type is one of {@code types}.
     */
    public float fractionOf(ShipType... types) {
        var wanted = EnumSet.noneOf(ShipType.class);
        Collections.addAll(wanted, types);
        int count = 0;
        for (var ship : group) {
            if (wanted.contains(ship.shipType())) {
                count++;
            }
        }
        return (float) count / group.size();
    }

    /**
     * Fraction of the group below the given health ratio.
     */
    public float fractionBelowHealth(float ratio) {
        int count = 0;
        for (var ship : group) {
            if (ship.healthRatio() < ratio) {
                count++;
            }
        }
        return (float) count / group.size();
    }

    public float averageSpeed() {
        float sum = 0.0f;
        for (var ship : group) {
            sum += ship.speed();
        }
        return sum / group.size();
    }

    /**
     * Mean teamwork, raised when any member already flies in formation, capped at 1.
     */
    public float coordination() {
        float teamwork = 0.0f;
        boolean formed = false;
        for (var ship : group) {
            teamwork += ship.teamworkTendency();
            formed |= ship.formation().isPresent();
        }
        return Math.min(1.0f, teamwork / group.size() + (formed ? FORMATION_BONUS : 0.0f));
    }

    /**
     * How close the mean pairwise distance is to {@link #IDEAL_SPACING}, in [0, 1]. A lone ship is perfectly spaced.
     */
    public float spacing() {
        if (group.size() < 2) {
            return 1.0f;
        }
        float total = 0.0f;
        int pairs = 0;
        for (int i = 0; i < group.size(); i++) {
            for (int j = i + 1; j < group.size(); j++) {
                total += group.get(i).distanceTo(group.get(j).position());
                pairs++;
            }
        }
        float average = total / pairs;
        return Vectors.clamp01(1.0f - Math.abs(average - IDEAL_SPACING) / IDEAL_SPACING);
    }

    /**
     * How evenly the group surrounds the target in the horizontal plane: one minus the widest angular gap as a
     * fraction of a full turn. Zero without a target or with fewer than three ships.
     */
    public float encirclement() {
        if (target == null || group.size() < 3) {
            return 0.0f;
        }
        var angles = new ArrayList<Double>(group.size());
        for (var ship : group) {
            var offset = Vectors.subtract(ship.position(), target.position());
            angles.add(Math.atan2(offset.z, offset.x));
        }
        Collections.sort(angles);
        int last = angles.size() - 1;
        double widest = angles.get(0) + 2.0 * Math.PI - angles.get(last);
        for (int i = 0; i < last; i++) {
            widest = Math.max(widest, angles.get(i + 1) - angles.get(i));
        }
        return (float) (1.0 - widest / (2.0 * Math.PI));
    }
}
