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
import com.hellblazer.armada.comms.MessagePayload;
import com.hellblazer.armada.comms.MessageType;
import com.hellblazer.armada.geometry.Vectors;

/**
 * Retreat away from the target and toward allies, asking for an escort on entry.
 *
 * @author hal.hildebrand
 */
public class FleeState extends AgentState {

    public static final float MIN_FLEE_TIME       = 5.0f;
    public static final float RECOVERED_RATIO     = 0.6f;
    public static final float SAFE_DISTANCE_SCALE = 1.5f;
    public static final float SAFETY_DISTANCE     = 100.0f;

    private float fleeTime;

    @Override
    public String name() {
        return "Flee";
    }

    @Override
    public void onEnter(AgentShip ship) {
        fleeTime = 0.0f;
        var away = Vectors.zero();
        var target = ship.target();
        if (target != null) {
            away.add(Vectors.scale(Vectors.direction(target.position(), ship.position()), 2.0f));
        }
        if (!ship.nearbyAllies().isEmpty()) {
            away.add(Vectors.direction(ship.position(), ship.averageAllyPosition()));
        }
        var direction = Vectors.normalizeOrZero(away);
        if (Vectors.lengthSquared(direction) > Vectors.EPSILON_SQUARED) {
            ship.navigator().setDestination(Vectors.offset(ship.position(), direction, SAFETY_DISTANCE));
        }
        ship.endpoint().broadcast(MessageType.REQUEST_ESCORT, new MessagePayload.EscortRequest(ship.healthRatio()));
    }

    @Override
    public void update(AgentShip ship, float deltaTime) {
        fleeTime += deltaTime;
        ship.performEvasion(deltaTime);
    }

    @Override
    public AgentState checkTransitions(AgentShip ship) {
        if (fleeTime > MIN_FLEE_TIME && ship.healthRatio() > RECOVERED_RATIO && ship.nearbyAllies().size() >= 2) {
            return new AttackState();
        }
        var target = ship.target();
        if (target == null || ship.distanceTo(target) > ship.detectionRange() * SAFE_DISTANCE_SCALE) {
            return new PatrolState();
        }
        return null;
    }

    public float fleeTime() {
        return fleeTime;
    }
}
