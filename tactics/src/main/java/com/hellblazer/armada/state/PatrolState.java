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

import javax.vecmath.Point3f;

/**
 * Circuit of four randomized points around where the patrol began. Ships holding a formation slot leave movement
 * to the formation.
 *
 * @author hal.hildebrand
 */
public class PatrolState extends AgentState {

    public static final float PATROL_RADIUS    = 100.0f;
    public static final int   PATROL_POINTS    = 4;
    public static final float WAYPOINT_REACHED = 20.0f;

    private final Point3f[] route = new Point3f[PATROL_POINTS];
    private       int       index;

    @Override
    public String name() {
        return "Patrol";
    }

    @Override
    public void onEnter(AgentShip ship) {
        generateRoute(ship);
        index = 0;
        if (!followsFormation(ship)) {
            ship.navigator().setDestination(route[index]);
        }
    }

    @Override
    public void update(AgentShip ship, float deltaTime) {
        if (followsFormation(ship)) {
            return;
        }
        if (ship.distanceTo(route[index]) < WAYPOINT_REACHED || !ship.navigator().hasPath()) {
            index = (index + 1) % route.length;
            ship.navigator().setDestination(route[index]);
        }
    }

    @Override
    public AgentState checkTransitions(AgentShip ship) {
        var target = ship.target();
        if (target != null && target.isAlive() && ship.distanceTo(target) <= ship.detectionRange()) {
            return new AttackState();
        }
        return null;
    }

    /**
     * @return copy of the patrol circuit
     */
    public Point3f[] route() {
        var copy = new Point3f[route.length];
        for (int i = 0; i < route.length; i++) {
            copy[i] = new Point3f(route[i]);
        }
        return copy;
    }

    private boolean followsFormation(AgentShip ship) {
        return ship.formation().isPresent() && !ship.isFormationLeader();
    }

    private void generateRoute(AgentShip ship) {
        var random = ship.context().random();
        var center = ship.position();
        for (int i = 0; i < route.length; i++) {
            double angle = Math.toRadians(360.0 / route.length * i + (random.nextInt(60) - 30));
            float distance = PATROL_RADIUS * (0.7f + random.nextFloat() * 0.6f);
            route[i] = new Point3f((float) (center.x + Math.cos(angle) * distance),
                                   center.y + (random.nextFloat() - 0.5f) * 50.0f,
                                   (float) (center.z + Math.sin(angle) * distance));
            route[i] = ship.context().world().clamp(route[i]);
        }
    }
}
