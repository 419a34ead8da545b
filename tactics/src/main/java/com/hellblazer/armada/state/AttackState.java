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
package com.hellblazer.armada.state;

import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.comms.AgentMessage;
import com.hellblazer.armada.comms.MessagePayload;
import com.hellblazer.armada.comms.MessageType;
import com.hellblazer.armada.geometry.Vectors;

/**
 * Engage the current target at the ship's preferred range.
 * <p>
 * Entering announces the engagement to nearby allies. Every {@value #TACTICAL_INTERVAL} seconds the ship either
 * calls for support, when short of company, or attempts its coordinated group tactic.
 *
 * @author hal.hildebrand
 */
public class AttackState extends AgentState {

    public static final float TACTICAL_INTERVAL     = 2.0f;
    public static final float FLEE_HEALTH_RATIO     = 0.25f;
    public static final float FLEE_CAUTION          = 0.6f;
    public static final float TARGET_LOST_AFTER     = 5.0f;
    public static final float ALLY_DISTRESS_RATIO   = 0.3f;
    public static final float SUPPORT_TEAMWORK      = 0.7f;
    public static final float REQUEST_TEAMWORK      = 0.5f;
    public static final float RETREAT_STEP          = 30.0f;

    private float tacticalTimer;
    private float engagementTime;

    @Override
    public String name() {
        return "Attack";
    }

    @Override
    public void onEnter(AgentShip ship) {
        var target = ship.target();
        if (target != null) {
            ship.endpoint()
                .broadcast(AgentMessage.broadcast(MessageType.ENGAGING_TARGET, ship.id(), target.position(),
                                                  new MessagePayload.Engagement(target.id())));
        }
    }

    @Override
    public void update(AgentShip ship, float deltaTime) {
        tacticalTimer += deltaTime;
        engagementTime += deltaTime;
        var target = ship.target();
        if (target == null) {
            return;
        }
        ship.lookAt(target.position(), deltaTime);

        float distance = ship.distanceTo(target);
        float preferred = ship.preferredEngagementRange();
        if (distance > preferred * 1.2f) {
            ship.navigator().setDestination(target.position());
        } else if (distance < preferred * 0.8f) {
            var away = Vectors.direction(target.position(), ship.position());
            ship.navigator().setDestination(Vectors.offset(ship.position(), away, RETREAT_STEP));
        } else {
            ship.performAttackManeuver(deltaTime);
        }
        if (ship.canAttack()) {
            ship.attack();
        }

        if (tacticalTimer >= TACTICAL_INTERVAL) {
            tacticalTimer = 0.0f;
            decideTactics(ship);
        }
    }

    @Override
    public AgentState checkTransitions(AgentShip ship) {
        if (ship.healthRatio() < FLEE_HEALTH_RATIO && ship.caution() > FLEE_CAUTION) {
            return new FleeState();
        }
        if (ship.target() == null || ship.timeSinceTargetSeen() > TARGET_LOST_AFTER) {
            return new PursueState();
        }
        if (ship.teamworkTendency() > SUPPORT_TEAMWORK) {
            for (var ally : ship.nearbyAllies()) {
                if (ally.healthRatio() < ALLY_DISTRESS_RATIO && ally.isAlive()) {
                    return new SupportState(ally.id(), ally.position());
                }
            }
        }
        return null;
    }

    public float engagementTime() {
        return engagementTime;
    }

    private void decideTactics(AgentShip ship) {
        int allies = ship.nearbyAllies().size();
        if (allies < 2 && ship.teamworkTendency() > REQUEST_TEAMWORK) {
            ship.endpoint()
                .broadcast(MessageType.REQUEST_SUPPORT, new MessagePayload.SupportRequest(ship.target().id()));
        }
        if (allies >= 2) {
            ship.coordinateAttack();
        }
    }
}
