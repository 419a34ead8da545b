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
package com.hellblazer.armada.navigation;

import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.geometry.Vectors;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Waypoint follower with local avoidance.
 * <p>
 * Each tick the ship is pointed at the current waypoint, then nine probe rays fanned around its heading are tested
 * against nearby allies and the cubic world boundary. Any hits produce an avoidance direction that is blended into
 * the velocity.
 *
 * @author hal.hildebrand
 */
public class Navigator {

    public static final float ARRIVAL_THRESHOLD  = 15.0f;
    public static final float AVOIDANCE_RADIUS   = 30.0f;
    public static final float BOUNDARY_RADIUS    = 10.0f;
    public static final float AVOIDANCE_BLEND    = 0.3f;
    public static final float AVOIDANCE_STRENGTH = 0.5f;

    private final AgentShip       ship;
    private final WaypointPlanner planner;
    private final float           worldRadius;
    private final List<Point3f>   path = new ArrayList<>();
    private       Point3f         destination;
    private       int             pathIndex;
    private       float           arrivalThreshold = ARRIVAL_THRESHOLD;

    public Navigator(AgentShip ship, float worldRadius) {
        this(ship, new WaypointPlanner(), worldRadius);
    }

    public Navigator(AgentShip ship, WaypointPlanner planner, float worldRadius) {
        this.ship = ship;
        this.planner = planner;
        this.worldRadius = worldRadius;
    }

    public void setDestination(Tuple3f newDestination) {
        destination = new Point3f(newDestination);
        path.clear();
        path.addAll(planner.plan(ship.position(), destination));
        pathIndex = 0;
    }

    /**
     * Forget the current route without touching the ship's velocity.
     */
    public void clear() {
        path.clear();
        pathIndex = 0;
    }

    /**
     * Forget the current route and halt the ship.
     */
    public void stop() {
        clear();
        ship.stop();
    }

    public void update(float deltaTime) {
        if (!hasPath()) {
            return;
        }
        followPath(deltaTime);
        var avoidance = avoidance();
        if (Vectors.lengthSquared(avoidance) > Vectors.EPSILON_SQUARED) {
            var force = Vectors.scale(avoidance, ship.speed() * AVOIDANCE_STRENGTH);
            ship.velocity().set(Vectors.lerp(ship.velocity(), force, AVOIDANCE_BLEND));
        }
    }

    public boolean hasPath() {
        return pathIndex < path.size();
    }

    public boolean hasReachedDestination() {
        return destination == null || Vectors.distance(ship.position(), destination) <= arrivalThreshold;
    }

    public Optional<Point3f> destination() {
        return Optional.ofNullable(destination).map(Point3f::new);
    }

    public Optional<Point3f> currentWaypoint() {
        return hasPath() ? Optional.of(new Point3f(path.get(pathIndex))) : Optional.empty();
    }

    public int remainingWaypoints() {
        return Math.max(0, path.size() - pathIndex);
    }

    public float distanceToDestination() {
        return destination == null ? 0.0f : Vectors.distance(ship.position(), destination);
    }

    public float estimatedTimeToDestination() {
        return ship.speed() <= 0.0f ? Float.MAX_VALUE : distanceToDestination() / ship.speed();
    }

    public void setArrivalThreshold(float threshold) {
        if (!(threshold > 0.0f)) {
            throw new IllegalArgumentException("Arrival threshold must be positive: " + threshold);
        }
        this.arrivalThreshold = threshold;
    }

    private void followPath(float deltaTime) {
        var waypoint = path.get(pathIndex);
        ship.moveToward(waypoint, 1.0f);
        ship.lookAt(waypoint, deltaTime);
        if (Vectors.distance(ship.position(), waypoint) <= arrivalThreshold) {
            pathIndex++;
            if (!hasPath()) {
                path.clear();
                pathIndex = 0;
                ship.stop();
            }
        }
    }

    /**
     * Unit avoidance direction, or zero when no probe hits anything close.
     */
    Vector3f avoidance() {
        var forward = ship.forward();
        var right = Vectors.normalizeOrZero(ship.right());
        var up = ship.up();
        float lookAhead = ship.speed() * 0.5f + 20.0f;
        var probes = new Vector3f[] { new Vector3f(forward), Vectors.add(forward, Vectors.scale(right, 0.5f)),
                                      Vectors.add(forward, Vectors.scale(right, -0.5f)),
                                      Vectors.add(forward, Vectors.scale(up, 0.3f)),
                                      Vectors.add(forward, Vectors.scale(up, -0.3f)), new Vector3f(right),
                                      Vectors.scale(right, -1.0f), new Vector3f(up), Vectors.scale(up, -1.0f) };
        var sum = Vectors.zero();
        for (var probe : probes) {
            var direction = Vectors.normalizeOrZero(probe);
            if (Vectors.lengthSquared(direction) < Vectors.EPSILON_SQUARED) {
                continue;
            }
            var end = Vectors.offset(ship.position(), direction, lookAhead);
            var hit = detect(ship.position(), end);
            if (hit == null) {
                continue;
            }
            var toObstacle = Vectors.subtract(hit.center, ship.position());
            float distance = Vectors.length(toObstacle);
            float reach = AVOIDANCE_RADIUS + hit.radius;
            if (distance < reach) {
                sum.add(Vectors.scale(sideStep(toObstacle), 1.0f - distance / reach));
            }
        }
        return Vectors.normalizeOrZero(sum);
    }

    private Vector3f sideStep(Vector3f toObstacle) {
        var side = Vectors.cross(toObstacle, ship.up());
        if (Vectors.lengthSquared(side) < 0.1f) {
            side = Vectors.cross(toObstacle, ship.right());
        }
        var left = Vectors.normalizeOrZero(side);
        var right = Vectors.scale(left, -1.0f);
        if (hasPath()) {
            var toWaypoint = Vectors.direction(ship.position(), path.get(pathIndex));
            return Vectors.dot(left, toWaypoint) >= Vectors.dot(right, toWaypoint) ? left : right;
        }
        return left;
    }

    private Obstacle detect(Point3f start, Point3f end) {
        for (var ally : ship.nearbyAllies()) {
            if (segmentIntersectsSphere(start, end, ally.position(), ally.size())) {
                return new Obstacle(new Point3f(ally.position()), ally.size());
            }
        }
        if (Math.abs(end.x) > worldRadius || Math.abs(end.y) > worldRadius || Math.abs(end.z) > worldRadius) {
            return new Obstacle(end, BOUNDARY_RADIUS);
        }
        return null;
    }

    static boolean segmentIntersectsSphere(Tuple3f start, Tuple3f end, Tuple3f center, float radius) {
        var direction = Vectors.direction(start, end);
        float length = Vectors.distance(start, end);
        float projection = Vectors.clamp(Vectors.dot(Vectors.subtract(center, start), direction), 0.0f, length);
        var closest = Vectors.offset(start, direction, projection);
        return Vectors.distance(closest, center) <= radius;
    }

    private record Obstacle(Point3f center, float radius) {
    }
}
