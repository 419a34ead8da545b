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
 * Search around the last known target position with a widening random pattern, giving up after
 * {@value #MAX_SEARCH_TIME} seconds.
 *
 * @author hal.hildebrand
 */
public class PursueState extends AgentState {

    public static final float MAX_SEARCH_TIME      = 10.0f;
    public static final float INITIAL_RADIUS       = 80.0f;
    public static final float RADIUS_GROWTH        = 20.0f;
    public static final float SEARCH_POINT_REACHED = 15.0f;

    private Point3f searchCenter;
    private float   searchRadius = INITIAL_RADIUS;
    private float   searchTime;

    @Override
    public String name() {
        return "Pursue";
    }

    @Override
    public void onEnter(AgentShip ship) {
        searchCenter = ship.lastKnownPlayerPosition().orElseGet(() -> new Point3f(ship.position()));
        searchTime = 0.0f;
        ship.navigator().setDestination(searchCenter);
    }

    @Override
    public void update(AgentShip ship, float deltaTime) {
        searchTime += deltaTime;
        searchRadius += deltaTime * RADIUS_GROWTH;
        var navigator = ship.navigator();
        if (!navigator.hasPath() || navigator.distanceToDestination() < SEARCH_POINT_REACHED) {
            var random = ship.context().random();
            var point = new Point3f(searchCenter.x + (random.nextFloat() - 0.5f) * searchRadius,
                                    searchCenter.y + (random.nextFloat() - 0.5f) * searchRadius * 0.5f,
                                    searchCenter.z + (random.nextFloat() - 0.5f) * searchRadius);
            navigator.setDestination(ship.context().world().clamp(point));
        }
    }

    @Override
    public AgentState checkTransitions(AgentShip ship) {
        var target = ship.target();
        if (target != null && target.isAlive() && ship.canSee(target.position())) {
            return new AttackState();
        }
        if (searchTime > MAX_SEARCH_TIME) {
            return new PatrolState();
        }
        return null;
    }

    @Override
    public void onExit(AgentShip ship) {
        if (searchTime > MAX_SEARCH_TIME) {
            ship.setTarget(null);
        }
    }

    public float searchTime() {
        return searchTime;
    }
}
