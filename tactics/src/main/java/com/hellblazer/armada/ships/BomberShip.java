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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.UUID;

/**
 * Heavy bomber. Holds still to charge a heavy round, prefers to fire from behind its allies and falls back toward
 * them when hurt.
 *
 * @author hal.hildebrand
 */
public class BomberShip extends AgentShip {

    public static final float CHARGE_DURATION  = 2.0f;
    public static final float RECOIL           = 20.0f;
    public static final float COVER_OFFSET     = 30.0f;
    public static final float RETREAT_DISTANCE = 100.0f;

    private static final Logger log = LoggerFactory.getLogger(BomberShip.class);

    private boolean charging;
    private float   chargeTime;

    public BomberShip(Tuple3f position, AgentContext context) {
        this(UUID.randomUUID(), position, context);
    }

    public BomberShip(UUID id, Tuple3f position, AgentContext context) {
        super(id, ShipStats.BOMBER, position, context);
    }

    @Override
    public ShipType shipType() {
        return ShipType.BOMBER;
    }

    @Override
    public float preferredEngagementRange() {
        return attackRange() * 0.9f;
    }

    @Override
    public boolean canAttack() {
        return !charging && super.canAttack();
    }

    /**
     * Begin charging. The round is released from {@link #onUpdate(float)} once the charge completes.
     */
    @Override
    public void attack() {
        if (charging) {
            return;
        }
        charging = true;
        chargeTime = 0.0f;
        navigator().stop();
        log.trace("{} charging", id());
    }

    public boolean isCharging() {
        return charging;
    }

    @Override
    protected void onUpdate(float deltaTime) {
        if (!charging) {
            return;
        }
        stop();
        chargeTime += deltaTime;
        if (chargeTime < reactionScaled(CHARGE_DURATION)) {
            return;
        }
        charging = false;
        var target = target();
        if (target == null || !target.isAlive()) {
            return;
        }
        fireAt(target, ProjectileClass.HEAVY, attackCooldown());
        velocity().sub(Vectors.scale(Vectors.direction(position(), target.position()), RECOIL));
    }

    /**
     * Fire from behind an ally at a good range, or slide sideways and back if no ally offers cover.
     */
    @Override
    public void performAttackManeuver(float deltaTime) {
        if (charging) {
            return;
        }
        var target = target();
        if (target == null) {
            return;
        }
        navigator().setDestination(coverPosition(target.position()));
    }

    /**
     * A firing position behind a nearby ally at a good range from {@code threat}, or a sidestep when none offers
     * cover.
     */
    public Point3f coverPosition(Tuple3f threat) {
        for (var ally : nearbyAllies()) {
            var allyToThreat = Vectors.direction(ally.position(), threat);
            var behind = Vectors.offset(ally.position(), allyToThreat, -COVER_OFFSET);
            float range = Vectors.distance(behind, threat);
            if (range <= attackRange() * 1.1f && range >= attackRange() * 0.8f) {
                return behind;
            }
        }
        var toThreat = Vectors.direction(position(), threat);
        var side = Vectors.cross(toThreat, up());
        var cover = Vectors.offset(position(), side, 40.0f);
        return Vectors.offset(cover, toThreat, -20.0f);
    }

    /**
     * When every nearby bomber is loaded, announce the bombardment and fire together.
     */
    @Override
    public void coordinateAttack() {
        var target = target();
        if (target == null) {
            return;
        }
        boolean wingReady = false;
        for (var ally : nearbyAllies()) {
            if (ally instanceof BomberShip bomber) {
                if (!bomber.isWeaponReady() || bomber.isCharging()) {
                    return;
                }
                wingReady = true;
            }
        }
        if (wingReady && canAttack()) {
            endpoint().broadcast(AgentMessage.broadcast(MessageType.COORDINATED_ATTACK, id(), target.position(),
                                                        new CoordinatedAttack(
                                                        CoordinatedAttack.Phase.BOMBARDMENT_READY)));
            attack();
        }
    }

    /**
     * Emergency retreat: away from the threat, weighted toward the allies.
     */
    @Override
    public void performEvasion(float deltaTime) {
        charging = false;
        var retreat = Vectors.zero();
        var target = target();
        if (target != null) {
            retreat.add(Vectors.scale(Vectors.direction(target.position(), position()), 2.0f));
        }
        if (!nearbyAllies().isEmpty()) {
            retreat.add(Vectors.direction(position(), averageAllyPosition()));
        }
        retreat = Vectors.normalizeOrZero(retreat);
        if (Vectors.lengthSquared(retreat) > Vectors.EPSILON_SQUARED) {
            navigator().setDestination(Vectors.offset(position(), retreat, RETREAT_DISTANCE));
        }
    }
}
