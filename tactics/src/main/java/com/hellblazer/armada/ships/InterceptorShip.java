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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.UUID;

/**
 * Fast attack craft with an afterburner. Runs down its target on an intercept course, circles it at close range
 * and strikes together with other interceptors.
 *
 * @author hal.hildebrand
 */
public class InterceptorShip extends AgentShip {

    public static final float BOOST_DURATION   = 3.0f;
    public static final float BOOST_COOLDOWN   = 8.0f;
    public static final float BOOST_MULTIPLIER = 2.0f;
    public static final float BOOST_DISTANCE   = 80.0f;
    public static final float TWIN_SPREAD      = 0.05f;
    public static final float SPIRAL_RATE      = 2.0f;
    public static final float STRIKE_RADIUS    = 100.0f;
    public static final float IN_POSITION      = 20.0f;

    private static final Logger log = LoggerFactory.getLogger(InterceptorShip.class);

    private float boostRemaining;
    private float boostCooldown;

    public InterceptorShip(Tuple3f position, AgentContext context) {
        this(UUID.randomUUID(), position, context);
    }

    public InterceptorShip(UUID id, Tuple3f position, AgentContext context) {
        super(id, ShipStats.INTERCEPTOR, position, context);
    }

    /**
     * Point at which a pursuer at {@code speed} meets a target moving at constant velocity, or the target's
     * current position if no such point exists.
     */
    public static Point3f interceptPoint(Tuple3f from, Tuple3f targetPosition, Tuple3f targetVelocity,
                                         float speed) {
        var toTarget = Vectors.subtract(targetPosition, from);
        float a = Vectors.dot(targetVelocity, targetVelocity) - speed * speed;
        float b = 2.0f * Vectors.dot(targetVelocity, toTarget);
        float c = Vectors.dot(toTarget, toTarget);
        float t;
        if (Math.abs(a) < 1.0e-6f) {
            t = Math.abs(b) < 1.0e-6f ? -1.0f : -c / b;
        } else {
            float discriminant = b * b - 4.0f * a * c;
            if (discriminant < 0.0f) {
                return new Point3f(targetPosition);
            }
            float root = (float) Math.sqrt(discriminant);
            float t1 = (-b + root) / (2.0f * a);
            float t2 = (-b - root) / (2.0f * a);
            if (t1 > 0.0f && t2 > 0.0f) {
                t = Math.min(t1, t2);
            } else {
                t = Math.max(t1, t2);
            }
        }
        if (t < 0.0f) {
            return new Point3f(targetPosition);
        }
        return Vectors.offset(targetPosition, targetVelocity, t);
    }

    @Override
    public ShipType shipType() {
        return ShipType.INTERCEPTOR;
    }

    @Override
    public float preferredEngagementRange() {
        return attackRange() * 0.6f;
    }

    /**
     * Twin fast rounds either side of the aim line.
     */
    @Override
    public void attack() {
        fireAt(target(), ProjectileClass.FAST, attackCooldown(), -TWIN_SPREAD);
        fireAt(target(), ProjectileClass.FAST, attackCooldown(), TWIN_SPREAD);
    }

    /**
     * Light the afterburner.
     *
     * @return false if already burning or still cooling down
     */
    public boolean activateBoost() {
        if (boostRemaining > 0.0f || boostCooldown > 0.0f) {
            return false;
        }
        boostRemaining = BOOST_DURATION;
        boostCooldown = BOOST_COOLDOWN;
        log.trace("{} boosting", id());
        return true;
    }

    public boolean isBoosting() {
        return boostRemaining > 0.0f;
    }

    @Override
    protected void onUpdate(float deltaTime) {
        if (boostRemaining > 0.0f) {
            boostRemaining = Math.max(0.0f, boostRemaining - deltaTime);
            var heading = Vectors.normalizeOrZero(velocity());
            if (Vectors.lengthSquared(heading) > Vectors.EPSILON_SQUARED) {
                velocity().set(Vectors.scale(heading, speed() * BOOST_MULTIPLIER));
            }
        } else if (boostCooldown > 0.0f) {
            boostCooldown = Math.max(0.0f, boostCooldown - deltaTime);
        }
    }

    /**
     * Close on a far target along an intercept course, then circle it.
     */
    @Override
    public void performAttackManeuver(float deltaTime) {
        var target = target();
        if (target == null) {
            return;
        }
        float optimal = preferredEngagementRange();
        if (distanceTo(target) > optimal * 1.5f) {
            intercept();
            return;
        }
        var toTarget = Vectors.direction(position(), target.position());
        var tangent = Vectors.normalizeOrZero(Vectors.cross(toTarget, up()));
        var binormal = Vectors.cross(tangent, toTarget);
        double phase = context.clock().now() * SPIRAL_RATE;
        var station = Vectors.offset(target.position(), tangent, (float) Math.cos(phase) * optimal);
        navigator().setDestination(Vectors.offset(station, binormal, (float) Math.sin(phase) * optimal));
    }

    /**
     * Set course for the intercept point, boosting if the target is far.
     */
    public void intercept() {
        var target = target();
        if (target == null) {
            return;
        }
        float pursuit = isBoosting() ? speed() * BOOST_MULTIPLIER : speed();
        navigator().setDestination(interceptPoint(position(), target.position(), target.velocity(), pursuit));
        if (distanceTo(target) > BOOST_DISTANCE) {
            activateBoost();
        }
    }

    /**
     * Surround the target with the other nearby interceptors and strike once all are on station.
     */
    @Override
    public void coordinateAttack() {
        var target = target();
        if (target == null) {
            return;
        }
        var wing = new ArrayList<AgentShip>();
        wing.add(this);
        for (var ally : nearbyAllies()) {
            if (ally instanceof InterceptorShip) {
                wing.add(ally);
            }
        }
        if (wing.size() < 2) {
            return;
        }
        wing.sort(Comparator.comparing(AgentShip::id));
        boolean allInPosition = true;
        Point3f mine = null;
        for (int i = 0; i < wing.size(); i++) {
            double angle = 2.0 * Math.PI * i / wing.size();
            var station = new Point3f(target.position().x + (float) Math.cos(angle) * STRIKE_RADIUS,
                                      target.position().y,
                                      target.position().z + (float) Math.sin(angle) * STRIKE_RADIUS);
            if (wing.get(i) == this) {
                mine = station;
            }
            if (wing.get(i).distanceTo(station) > IN_POSITION) {
                allInPosition = false;
            }
        }
        if (allInPosition) {
            endpoint().broadcast(AgentMessage.broadcast(MessageType.COORDINATED_ATTACK, id(), target.position(),
                                                        new CoordinatedAttack(
                                                        CoordinatedAttack.Phase.INTERCEPTOR_STRIKE)));
            intercept();
        } else {
            navigator().setDestination(mine);
        }
    }

    @Override
    public void onCoordinatedAttack(CoordinatedAttack.Phase phase, UUID coordinator) {
        if (phase == CoordinatedAttack.Phase.INTERCEPTOR_STRIKE) {
            intercept();
        }
        super.onCoordinatedAttack(phase, coordinator);
    }

    @Override
    public void performEvasion(float deltaTime) {
        super.performEvasion(deltaTime);
        activateBoost();
    }
}
