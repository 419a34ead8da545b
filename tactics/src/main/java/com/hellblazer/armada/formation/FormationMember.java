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
package com.hellblazer.armada.formation;

import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.agent.ShipType;
import com.hellblazer.armada.geometry.Vectors;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.UUID;

/**
 * Station keeping for one formation slot.
 * <p>
 * Inside the tolerance the ship eases toward the slot's own velocity; outside it the ship heads for the slot,
 * speeding up to {@code catchUp} times cruise speed when far behind.
 *
 * @author hal.hildebrand
 */
public class FormationMember {

    public static final float DEFAULT_TOLERANCE  = 15.0f;
    public static final float DEFAULT_CATCH_UP   = 1.5f;
    public static final float DEFAULT_SMOOTHING  = 0.1f;
    public static final float VELOCITY_BLEND     = 0.3f;

    private final UUID     agentId;
    private       float    tolerance = DEFAULT_TOLERANCE;
    private       float    catchUp   = DEFAULT_CATCH_UP;
    private       float    smoothing = DEFAULT_SMOOTHING;
    private       Point3f  lastSlot;
    private final Vector3f slotVelocity = new Vector3f();

    public FormationMember(UUID agentId) {
        this.agentId = agentId;
    }

    /**
     * How strongly a slot holder should prefer keeping station over independent action, in [0, 1].
     */
    public static float priority(int index, FormationType type, ShipType shipType) {
        float priority = 0.5f;
        if (index == 0) {
            priority += 0.3f;
        }
        switch (type) {
            case V_FORMATION -> priority += index <= 2 ? 0.2f : 0.0f;
            case DIAMOND -> priority += index <= 3 ? 0.2f : 0.0f;
            case SPHERE -> priority += 0.1f;
            default -> {
            }
        }
        switch (shipType) {
            case BOMBER -> priority += 0.2f;
            case SCOUT -> priority -= 0.1f;
            case INTERCEPTOR -> priority -= 0.2f;
            default -> {
            }
        }
        return Vectors.clamp01(priority);
    }

    /**
     * Leaders never break away, and neither does anyone in a formation of three or fewer.
     */
    public static boolean canBreakFormation(int index, int formationSize) {
        return index != 0 && formationSize > 3;
    }

    /**
     * Steer the ship toward its slot.
     *
     * @param ship      the slot holder
     * @param slot      world position of the slot this tick
     * @param heading   formation direction of travel
     * @param deltaTime frame duration
     */
    public void steer(AgentShip ship, Point3f slot, Tuple3f heading, float deltaTime) {
        if (lastSlot != null && deltaTime > 0.0f) {
            slotVelocity.set(Vectors.scale(Vectors.subtract(slot, lastSlot), 1.0f / deltaTime));
        }
        lastSlot = new Point3f(slot);

        float distance = Vectors.distance(ship.position(), slot);
        if (distance <= tolerance) {
            ship.velocity().set(Vectors.lerp(ship.velocity(), slotVelocity, smoothing));
            return;
        }
        float multiplier = 1.0f;
        if (distance > tolerance * 2.0f) {
            multiplier = Math.min(catchUp, distance / (tolerance * 2.0f));
        }
        var desired = Vectors.scale(Vectors.direction(ship.position(), slot), ship.speed() * multiplier);
        desired = Vectors.lerp(desired, slotVelocity, VELOCITY_BLEND);
        ship.velocity().set(Vectors.lerp(ship.velocity(), desired, smoothing));

        var forward = Vectors.normalizeOrZero(heading);
        if (Vectors.lengthSquared(forward) > Vectors.EPSILON_SQUARED) {
            var turned = Vectors.normalizeOrZero(Vectors.lerp(ship.forward(), forward, smoothing * 0.5f));
            if (Vectors.lengthSquared(turned) > Vectors.EPSILON_SQUARED) {
                ship.forward().set(turned);
            }
        }
    }

    /**
     * Place the ship exactly on its slot.
     */
    public void snap(AgentShip ship, Point3f slot) {
        ship.position().set(slot);
        ship.velocity().set(slotVelocity);
        lastSlot = new Point3f(slot);
    }

    public boolean isInPosition(AgentShip ship, Tuple3f slot) {
        return Vectors.distance(ship.position(), slot) <= tolerance;
    }

    public UUID agentId() {
        return agentId;
    }

    public float tolerance() {
        return tolerance;
    }

    public void setTolerance(float tolerance) {
        this.tolerance = tolerance;
    }

    public void setCatchUp(float multiplier) {
        this.catchUp = multiplier;
    }

    public void setSmoothing(float smoothing) {
        this.smoothing = Vectors.clamp(smoothing, 0.01f, 1.0f);
    }
}
