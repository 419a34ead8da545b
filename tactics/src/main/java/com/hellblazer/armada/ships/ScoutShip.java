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
import com.hellblazer.armada.comms.MessagePayload.TargetSighting;
import com.hellblazer.armada.comms.MessageType;
import com.hellblazer.armada.geometry.Vectors;
import com.hellblazer.armada.world.AttackIntent.ProjectileClass;

import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.UUID;

/**
 * Fast, fragile reconnaissance craft. Harasses with hit-and-run passes, evades sideways when threatened and
 * keeps the squadron informed about its target.
 *
 * @author hal.hildebrand
 */
public class ScoutShip extends AgentShip {

    public static final float REPORT_INTERVAL    = 5.0f;
    public static final float REPORT_CONFIDENCE  = 0.9f;
    public static final float RETREAT_DISTANCE   = 50.0f;
    public static final float EVASION_DISTANCE   = 30.0f;
    public static final float EVASION_JITTER     = 0.5f;
    public static final float EVASION_SPEED      = 1.2f;

    private float   reportTimer;
    private boolean evading;

    public ScoutShip(Tuple3f position, AgentContext context) {
        this(UUID.randomUUID(), position, context);
    }

    public ScoutShip(UUID id, Tuple3f position, AgentContext context) {
        super(id, ShipStats.SCOUT, position, context);
    }

    @Override
    public ShipType shipType() {
        return ShipType.SCOUT;
    }

    @Override
    public float preferredEngagementRange() {
        return attackRange() * 0.8f;
    }

    @Override
    public void attack() {
        fireAt(target(), ProjectileClass.LIGHT, attackCooldown());
    }

    /**
     * Hit and run: close in, take the shot, fall back.
     */
    @Override
    public void performAttackManeuver(float deltaTime) {
        var target = target();
        if (target == null) {
            return;
        }
        if (distanceTo(target) < attackRange() * 1.2f) {
            if (canAttack()) {
                attack();
            }
            var away = Vectors.direction(target.position(), position());
            navigator().setDestination(Vectors.offset(position(), away, RETREAT_DISTANCE));
        } else {
            navigator().setDestination(target.position());
        }
    }

    /**
     * Break sideways from the threat with a little randomness, at a burst of speed.
     */
    @Override
    public void performEvasion(float deltaTime) {
        var target = target();
        if (target == null) {
            evading = false;
            return;
        }
        var toTarget = Vectors.direction(position(), target.position());
        var sideways = Vectors.cross(toTarget, up());
        var random = context.random();
        var jittered = Vectors.normalizeOrZero(
        new Vector3f(sideways.x + (random.nextFloat() - 0.5f) * EVASION_JITTER,
                     sideways.y + (random.nextFloat() - 0.5f) * EVASION_JITTER,
                     sideways.z + (random.nextFloat() - 0.5f) * EVASION_JITTER));
        navigator().setDestination(Vectors.offset(position(), jittered, EVASION_DISTANCE));
        evading = true;
    }

    @Override
    protected void onUpdate(float deltaTime) {
        if (evading) {
            velocity().scale(EVASION_SPEED);
            evading = false;
        }
        reportTimer += deltaTime;
        if (reportTimer >= REPORT_INTERVAL) {
            reportTimer = 0.0f;
            reportTarget();
        }
    }

    private void reportTarget() {
        var target = target();
        if (target == null) {
            return;
        }
        float threat = Math.max(0.5f, context.threats()
                                             .threatLevelNear(target.position(),
                                                              context.config().getThreatCellSize()));
        reportIntel(target, threat, REPORT_CONFIDENCE);
        endpoint().broadcast(AgentMessage.broadcast(MessageType.TARGET_SIGHTED, id(), target.position(),
                                                    new TargetSighting(target.id(), target.health(),
                                                                       target.velocity(), REPORT_CONFIDENCE)));
    }
}
