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
package com.hellblazer.armada.swarm;

import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.geometry.Vectors;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Boids style steering over the live ships: separation, alignment and cohesion among neighbors, plus avoidance of
 * the world boundary.
 * <p>
 * Each rule yields a unit direction (or zero). The weighted sum is scaled by the ship's cruise speed, capped at
 * {@value #FORCE_LIMIT} times that speed, and handed to the ship as its steering force until the next pass. Ships
 * holding a formation slot only separate and avoid, leaving alignment and cohesion to the formation.
 *
 * @author hal.hildebrand
 */
public class SwarmSteering {

    public static final float FORCE_LIMIT  = 2.0f;
    public static final float PROBE_LENGTH = 50.0f;

    private final EngineConfig config;

    public SwarmSteering(EngineConfig config) {
        this.config = config;
    }

    /**
     * Compute and hand out the steering force of every live ship.
     */
    public void apply(Collection<? extends AgentShip> ships) {
        var flock = new ArrayList<AgentShip>(ships.size());
        for (var ship : ships) {
            if (ship.isAlive()) {
                flock.add(ship);
            }
        }
        for (var ship : flock) {
            ship.setSteering(steeringFor(ship, flock));
        }
    }

    public Vector3f steeringFor(AgentShip ship, Collection<? extends AgentShip> flock) {
        var neighbors = neighbors(ship, flock, config.getCohesionRadius());
        var force = Vectors.scale(separation(ship, neighbors), config.getSeparationWeight());
        force.add(Vectors.scale(avoidance(ship), config.getAvoidanceWeight()));
        if (!holdsSlot(ship)) {
            force.add(Vectors.scale(alignment(ship, neighbors), config.getAlignmentWeight()));
            force.add(Vectors.scale(cohesion(ship, neighbors), config.getCohesionWeight()));
        }
        force.scale(ship.speed());
        float limit = ship.speed() * FORCE_LIMIT;
        float length = Vectors.length(force);
        if (length > limit) {
            force.scale(limit / length);
        }
        return force;
    }

    /**
     * Away from neighbors inside the separation radius, the closest weighing most.
     */
    public Vector3f separation(AgentShip ship, Collection<? extends AgentShip> neighbors) {
        var push = Vectors.zero();
        int count = 0;
        float radius = config.getSeparationRadius();
        for (var neighbor : neighbors) {
            float distance = ship.distanceTo(neighbor.position());
            if (distance > radius || distance * distance < Vectors.EPSILON_SQUARED) {
                continue;
            }
            push.add(Vectors.scale(Vectors.direction(neighbor.position(), ship.position()), 1.0f / distance));
            count++;
        }
        if (count == 0) {
            return push;
        }
        push.scale(1.0f / count);
        return Vectors.normalizeOrZero(push);
    }

    /**
     * Along the mean velocity of neighbors inside the alignment radius.
     */
    public Vector3f alignment(AgentShip ship, Collection<? extends AgentShip> neighbors) {
        var heading = Vectors.zero();
        float radius = config.getAlignmentRadius();
        for (var neighbor : neighbors) {
            if (ship.distanceTo(neighbor.position()) <= radius) {
                heading.add(neighbor.velocity());
            }
        }
        return Vectors.normalizeOrZero(heading);
    }

    /**
     * Toward the centroid of neighbors inside the cohesion radius.
     */
    public Vector3f cohesion(AgentShip ship, Collection<? extends AgentShip> neighbors) {
        var positions = new ArrayList<Point3f>();
        float radius = config.getCohesionRadius();
        for (var neighbor : neighbors) {
            if (ship.distanceTo(neighbor.position()) <= radius) {
                positions.add(neighbor.position());
            }
        }
        if (positions.isEmpty()) {
            return Vectors.zero();
        }
        return Vectors.direction(ship.position(), Vectors.centroid(positions, ship.position()));
    }

    /**
     * Away from the world boundary, judged by five probes fanned around the heading.
     */
    public Vector3f avoidance(AgentShip ship) {
        var forward = ship.forward();
        var right = Vectors.normalizeOrZero(ship.right());
        var up = ship.up();
        var probes = new Vector3f[] { new Vector3f(forward), Vectors.add(forward, Vectors.scale(right, 0.5f)),
                                      Vectors.add(forward, Vectors.scale(right, -0.5f)),
                                      Vectors.add(forward, Vectors.scale(up, 0.5f)),
                                      Vectors.add(forward, Vectors.scale(up, -0.5f)) };
        var away = Vectors.zero();
        for (var probe : probes) {
            var direction = Vectors.normalizeOrZero(probe);
            if (outOfBounds(Vectors.offset(ship.position(), direction, PROBE_LENGTH))) {
                away.sub(direction);
            }
        }
        return Vectors.normalizeOrZero(away);
    }

    private boolean outOfBounds(Point3f point) {
        float bound = config.getWorldRadius();
        return Math.abs(point.x) > bound || Math.abs(point.y) > bound || Math.abs(point.z) > bound;
    }

    private static boolean holdsSlot(AgentShip ship) {
        return ship.formation().isPresent() && !ship.isFormationLeader();
    }

    private static List<AgentShip> neighbors(AgentShip ship, Collection<? extends AgentShip> flock, float radius) {
        var neighbors = new ArrayList<AgentShip>();
        for (var other : flock) {
            if (other != ship && ship.distanceTo(other.position()) <= radius) {
                neighbors.add(other);
            }
        }
        return neighbors;
    }
}
