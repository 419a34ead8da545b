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
import com.hellblazer.armada.geometry.Vectors;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.UUID;

/**
 * Cover an ally: hold station beside it, off the line to its target, and engage that target when in range.
 * <p>
 * Support ends when the ally is gone or healthy again and has been reached, or after {@value #MAX_SUPPORT_TIME}
 * seconds.
 *
 * @author hal.hildebrand
 */
public class SupportState extends AgentState {

    public static final float MAX_SUPPORT_TIME = 15.0f;
    public static final float HEALTHY_RATIO    = 0.7f;
    public static final float STATION_OFFSET   = 30.0f;
    public static final float STATION_REACHED  = 40.0f;

    private final UUID    allyId;
    private final Point3f rallyPoint;
    private       float   supportTime;

    /**
     * @param allyId     the ally to cover
     * @param rallyPoint where to go if the ally cannot be located
     */
    public SupportState(UUID allyId, Tuple3f rallyPoint) {
        this.allyId = allyId;
        this.rallyPoint = new Point3f(rallyPoint);
    }

    @Override
    public String name() {
        return "Support";
    }

    @Override
    public void onEnter(AgentShip ship) {
        supportTime = 0.0f;
        ship.navigator().setDestination(rallyPoint);
    }

    @Override
    public void update(AgentShip ship, float deltaTime) {
        supportTime += deltaTime;
        var ally = ship.context().hub().lookup(allyId);
        if (ally.isEmpty()) {
            return;
        }
        var station = stationFor(ally.get());
        ship.navigator().setDestination(station);
        var threat = ally.get().target();
        if (threat != null && threat.isAlive() && ship.isInRange(threat.position(), ship.attackRange())) {
            ship.setTarget(threat);
            if (ship.canAttack()) {
                ship.attack();
            }
        }
    }

    @Override
    public AgentState checkTransitions(AgentShip ship) {
        var ally = ship.context().hub().lookup(allyId);
        boolean done = supportTime > MAX_SUPPORT_TIME;
        if (ally.isEmpty()) {
            done |= ship.distanceTo(rallyPoint) <= STATION_REACHED;
        } else {
            done |= ally.get().healthRatio() > HEALTHY_RATIO
                    && ship.distanceTo(ally.get().position()) <= STATION_REACHED;
        }
        if (!done) {
            return null;
        }
        return ship.target() != null ? new AttackState() : new PatrolState();
    }

    public UUID allyId() {
        return allyId;
    }

    private Point3f stationFor(AgentShip ally) {
        var threat = ally.target();
        if (threat == null) {
            return new Point3f(ally.position());
        }
        var toThreat = Vectors.direction(ally.position(), threat.position());
        var side = Vectors.cross(toThreat, Vectors.unitY());
        return Vectors.offset(ally.position(), side, STATION_OFFSET);
    }
}
