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
package com.hellblazer.armada.ships;

import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.agent.ShipStats;
import com.hellblazer.armada.agent.ShipType;
import com.hellblazer.armada.comms.AgentMessage;
import com.hellblazer.armada.comms.MessagePayload.CoordinatedAttack;
import com.hellblazer.armada.comms.MessageType;
import com.hellblazer.armada.geometry.Vectors;
import com.hellblazer.armada.world.AttackIntent.ProjectileClass;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.UUID;

/**
 * Balanced line fighter. Fires three-round bursts, works the flanks and surrounds the target with its wingmen.
 *
 * @author hal.hildebrand
 */
public class FighterShip extends AgentShip {

    public static final int   BURST_LENGTH     = 3;
    public static final float BURST_SPACING    = 0.3f;
    public static final float FLANK_CLEARANCE  = 30.0f;
    public static final float IN_POSITION      = 20.0f;

    private int     burstShots;
    private boolean flankSignalled;

    public FighterShip(Tuple3f position, AgentContext context) {
        this(UUID.randomUUID(), position, context);
    }

    public FighterShip(UUID id, Tuple3f position, AgentContext context) {
        super(id, ShipStats.FIGHTER, position, context);
    }

    @Override
    public ShipType shipType() {
        return ShipType.FIGHTER;
    }

    @Override
    public float preferredEngagementRange() {
        return attackRange() * 0.7f;
    }

    /**
     * One round of the current burst. The last round of a burst starts the full cooldown.
     */
    @Override
    public void attack() {
        burstShots++;
        if (burstShots >= BURST_LENGTH) {
            burstShots = 0;
            fireAt(target(), ProjectileClass.MEDIUM, attackCooldown());
        } else {
            fireAt(target(), ProjectileClass.MEDIUM, reactionScaled(BURST_SPACING));
        }
    }

    public int burstShots() {
        return burstShots;
    }

    /**
     * Take the flank with fewer allies on it.
     */
    @Override
    public void performAttackManeuver(float deltaTime) {
        var target = target();
        if (target == null) {
            return;
        }
        var toTarget = Vectors.direction(position(), target.position());
        var flank = Vectors.normalizeOrZero(Vectors.cross(toTarget, up()));
        var right = Vectors.offset(target.position(), flank, preferredEngagementRange());
        var left = Vectors.offset(target.position(), flank, -preferredEngagementRange());
        navigator().setDestination(alliesNear(right) <= alliesNear(left) ? right : left);
    }

    /**
     * Spread around the target with the nearby allies; once on station signal that the flank is taken.
     */
    @Override
    public void coordinateAttack() {
        var target = target();
        if (target == null || nearbyAllies().isEmpty()) {
            return;
        }
        var station = ringStation(target.position());
        navigator().setDestination(station);
        if (distanceTo(station) < IN_POSITION && isInRange(target.position(), attackRange())) {
            if (!flankSignalled) {
                flankSignalled = true;
                endpoint().broadcast(AgentMessage.broadcast(MessageType.COORDINATED_ATTACK, id(), target.position(),
                                                            new CoordinatedAttack(
                                                            CoordinatedAttack.Phase.FLANKING_COMPLETE)));
            }
            if (canAttack()) {
                attack();
            }
        } else {
            flankSignalled = false;
        }
    }

    /**
     * This ship's slot on a ring around {@code center}, ordered by id among itself and its nearby allies.
     */
    Point3f ringStation(Tuple3f center) {
        var squad = new ArrayList<UUID>();
        squad.add(id());
        for (var ally : nearbyAllies()) {
            squad.add(ally.id());
        }
        squad.sort(Comparator.naturalOrder());
        double angle = 2.0 * Math.PI * squad.indexOf(id()) / squad.size();
        float radius = preferredEngagementRange();
        return new Point3f(center.x + (float) Math.cos(angle) * radius, center.y,
                           center.z + (float) Math.sin(angle) * radius);
    }

    private int alliesNear(Tuple3f point) {
        int count = 0;
        for (var ally : nearbyAllies()) {
            if (Vectors.distance(ally.position(), point) <= FLANK_CLEARANCE) {
                count++;
            }
        }
        return count;
    }
}
