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
package com.hellblazer.armada.agent;

import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.comms.AgentMessage;
import com.hellblazer.armada.comms.CommunicationEndpoint;
import com.hellblazer.armada.comms.MessagePayload;
import com.hellblazer.armada.comms.MessagePayload.CoordinatedAttack;
import com.hellblazer.armada.comms.MessagePayload.TacticalOrder;
import com.hellblazer.armada.comms.MessageType;
import com.hellblazer.armada.formation.FormationController;
import com.hellblazer.armada.geometry.Vectors;
import com.hellblazer.armada.knowledge.AllyStatus;
import com.hellblazer.armada.knowledge.IntelReport;
import com.hellblazer.armada.navigation.Navigator;
import com.hellblazer.armada.state.AgentState;
import com.hellblazer.armada.state.FleeState;
import com.hellblazer.armada.state.PatrolState;
import com.hellblazer.armada.state.StateMachine;
import com.hellblazer.armada.state.SupportState;
import com.hellblazer.armada.world.AttackIntent;
import com.hellblazer.armada.world.AttackIntent.ProjectileClass;
import com.hellblazer.armada.world.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A hostile ship driven by the engine.
 * <p>
 * The agent owns its kinematic state, its combat stats, a {@link StateMachine}, a {@link Navigator} and a
 * {@link CommunicationEndpoint}. Formation membership lives in the shared
 * {@link com.hellblazer.armada.formation.FormationRegistry}, not here.
 * <p>
 * Stats are kept twice: the immutable {@link ShipStats} baseline and the effective values derived from it and the
 * {@link StatModifiers} in force. Applying new modifiers always starts again from the baseline.
 * <p>
 * Behavioral traits also carry the {@link Posture}s set by group level decisions, one per source.
 * <p>
 * Per-tick order: state machine, navigation, formation keeping, subtype hook, communication drain, status report,
 * swarm steering, position integration, world clamp.
 *
 * @author hal.hildebrand
 */
public abstract class AgentShip implements Body {

    public static final float BASE_ACCURACY          = 0.75f;
    public static final float FIELD_OF_VIEW_DOT      = 0.3f;
    public static final float FLEE_HEALTH_RATIO      = 0.3f;
    public static final float FLEE_CAUTION           = 0.5f;
    public static final float RETALIATION_THRESHOLD  = 0.7f;
    public static final float RETALIATION_BONUS      = 0.2f;
    public static final float ESCORT_HEALTH_RATIO    = 0.5f;
    public static final float PROJECTILE_SPEED       = 300.0f;

    private static final Logger log = LoggerFactory.getLogger(AgentShip.class);

    protected final AgentContext context;

    private final UUID                  id;
    private final ShipStats             baseline;
    private final Point3f               position;
    private final Vector3f              velocity = new Vector3f();
    private final Vector3f              forward  = Vectors.unitZ();
    private final Vector3f              up       = Vectors.unitY();
    private final StateMachine          stateMachine = new StateMachine();
    private final Navigator             navigator;
    private final CommunicationEndpoint endpoint;
    private final List<AgentShip>       nearbyAllies = new ArrayList<>();
    private final Vector3f              steering     = new Vector3f();
    private final Map<Posture.Source, Posture> postures = new EnumMap<>(Posture.Source.class);

    private StatModifiers modifiers = StatModifiers.IDENTITY;
    private float         health;
    private float         maxHealth;
    private float         speed;
    private float         rotationSpeed;
    private float         detectionRange;
    private float         aggressiveness;
    private float         aggressionBonus;
    private float         caution;
    private float         teamworkTendency;
    private float         accuracy;
    private float         attackCooldown;
    private float         cooldownRemaining;
    private float         statusTimer;
    private float         sightingTimer;
    private float         timeSinceTargetSeen;
    private Body          target;
    private Point3f       lastKnownPlayerPosition;
    private boolean       active;
    private boolean       destroyed;

    protected AgentShip(UUID id, ShipStats baseline, Tuple3f position, AgentContext context) {
        this.id = id;
        this.baseline = baseline;
        this.position = new Point3f(position);
        this.context = context;
        this.navigator = new Navigator(this, context.config().getWorldRadius());
        this.endpoint = new CommunicationEndpoint(this, context.hub(), context.reactions(), context.clock(),
                                                  context.config());
        recomputeStats();
        this.health = maxHealth;
        this.sightingTimer = context.config().getSightingReportInterval();
    }

    public abstract ShipType shipType();

    /**
     * Distance this ship tries to hold from its target while attacking.
     */
    public abstract float preferredEngagementRange();

    /**
     * Fire at the current target. Only called when {@link #canAttack()} holds.
     */
    public abstract void attack();

    /**
     * Ship-specific movement while at a good range from the target.
     */
    public abstract void performAttackManeuver(float deltaTime);

    /**
     * Group tactic attempted periodically while attacking alongside at least two allies.
     */
    public void coordinateAttack() {
    }

    /**
     * Movement while fleeing. The default runs directly away from the target.
     */
    public void performEvasion(float deltaTime) {
        if (target != null) {
            var away = Vectors.direction(target.position(), position);
            navigator.setDestination(Vectors.offset(position, away, 50.0f));
        }
    }

    /**
     * Register with the hub and enter the initial state. Calling twice has no effect.
     */
    public void activate() {
        if (active || destroyed) {
            return;
        }
        context.hub().register(this);
        active = true;
        stateMachine.initialize(initialState(), this);
        reportStatus();
        log.debug("Activated {} {}", shipType(), id);
    }

    protected AgentState initialState() {
        return new PatrolState();
    }

    public void update(float deltaTime) {
        if (!active || destroyed) {
            return;
        }
        cooldownRemaining = Math.max(0.0f, cooldownRemaining - deltaTime);
        sightingTimer += deltaTime;
        trackTarget(deltaTime);

        stateMachine.update(this, deltaTime);
        navigator.update(deltaTime);
        if (target == null && !stateMachine.isInState(FleeState.class)) {
            formation().ifPresent(f -> f.steer(this, deltaTime));
        }
        onUpdate(deltaTime);
        endpoint.update(deltaTime);

        statusTimer += deltaTime;
        if (statusTimer >= context.config().getStatusReportInterval()) {
            statusTimer = 0.0f;
            reportStatus();
        }

        applySteering(deltaTime);
        position.scaleAdd(deltaTime, velocity, position);
        var clamped = context.world().clamp(position);
        if (clamped != position) {
            position.set(clamped);
        }
    }

    /**
     * Per-tick hook for subtype timers, run after movement decisions and before the communication drain.
     */
    protected void onUpdate(float deltaTime) {
    }

    /**
     * Consider a body seen by the sensors this tick. Within detection range it becomes the target, and on the
     * sighting cadence its position is broadcast to nearby allies.
     */
    public void observe(Body candidate) {
        if (destroyed || candidate == null || !candidate.isAlive()) {
            return;
        }
        if (distanceTo(candidate.position()) > detectionRange) {
            return;
        }
        setTarget(candidate);
        if (sightingTimer >= context.config().getSightingReportInterval()) {
            sightingTimer = 0.0f;
            endpoint.broadcast(AgentMessage.broadcast(MessageType.TARGET_SIGHTED, id, candidate.position(),
                                                      new MessagePayload.TargetSighting(candidate.id(),
                                                                                        candidate.health(),
                                                                                        candidate.velocity(),
                                                                                        1.0f)));
        }
    }

    public void takeDamage(float amount) {
        if (destroyed || amount <= 0.0f) {
            return;
        }
        health = Math.max(0.0f, health - amount);
        log.trace("{} took {} damage, {} left", id, amount, health);
        if (health <= 0.0f) {
            destroy();
            return;
        }
        if (!stateMachine.isInState(FleeState.class)) {
            if (healthRatio() < FLEE_HEALTH_RATIO && caution() > FLEE_CAUTION) {
                stateMachine.changeState(new FleeState(), this);
            } else if (aggressiveness > RETALIATION_THRESHOLD) {
                nudgeAggressiveness(RETALIATION_BONUS);
            }
        }
    }

    /**
     * Tell peers in range, leave any formation, drop out of the ally tracker and unregister. Idempotent.
     */
    public void destroy() {
        if (destroyed) {
            return;
        }
        destroyed = true;
        health = 0.0f;
        if (active) {
            var notice = AgentMessage.broadcast(MessageType.ALLY_DESTROYED, id, position,
                                                new MessagePayload.LossReport(id)).stamped(context.clock().now());
            int notified = context.hub().broadcast(notice);
            log.debug("{} {} destroyed, notified {}", shipType(), id, notified);
        }
        context.formations().leave(id);
        context.allies().remove(id);
        context.hub().unregister(id);
        navigator.clear();
        stop();
        steering.set(0.0f, 0.0f, 0.0f);
        active = false;
    }

    public void setTarget(Body newTarget) {
        if (newTarget == target) {
            return;
        }
        target = newTarget;
        if (newTarget != null) {
            lastKnownPlayerPosition = new Point3f(newTarget.position());
            timeSinceTargetSeen = 0.0f;
        }
    }

    /**
     * Turn toward a point at no more than the rotation speed allows.
     */
    public void lookAt(Tuple3f point, float deltaTime) {
        var desired = Vectors.direction(position, point);
        if (Vectors.lengthSquared(desired) < Vectors.EPSILON_SQUARED) {
            return;
        }
        float t = Vectors.clamp01(rotationSpeed * deltaTime);
        var turned = Vectors.normalizeOrZero(Vectors.lerp(forward, desired, t));
        if (Vectors.lengthSquared(turned) < Vectors.EPSILON_SQUARED) {
            // directly behind
            turned = Vectors.normalizeOrZero(Vectors.lerp(forward, right(), 0.5f));
        }
        forward.set(turned);
        var right = Vectors.normalizeOrZero(Vectors.cross(forward, up));
        if (Vectors.lengthSquared(right) >= Vectors.EPSILON_SQUARED) {
            up.set(Vectors.normalizeOrZero(Vectors.cross(right, forward)));
        }
    }

    /**
     * Set velocity toward a point at {@code throttle} times cruise speed.
     */
    public void moveToward(Tuple3f destination, float throttle) {
        velocity.set(Vectors.scale(Vectors.direction(position, destination), speed * throttle));
    }

    public void stop() {
        velocity.set(0.0f, 0.0f, 0.0f);
    }

    public float distanceTo(Tuple3f point) {
        return Vectors.distance(position, point);
    }

    public float distanceTo(Body other) {
        return other == null ? Float.MAX_VALUE : distanceTo(other.position());
    }

    public boolean isInRange(Tuple3f point, float range) {
        return distanceTo(point) <= range;
    }

    /**
     * Within detection range and inside the forward field of view.
     */
    public boolean canSee(Tuple3f point) {
        if (distanceTo(point) > detectionRange) {
            return false;
        }
        var direction = Vectors.direction(position, point);
        if (Vectors.lengthSquared(direction) < Vectors.EPSILON_SQUARED) {
            return true;
        }
        return Vectors.dot(forward, direction) > FIELD_OF_VIEW_DOT;
    }

    public boolean isWeaponReady() {
        return cooldownRemaining <= 0.0f;
    }

    /**
     * Whether the current target can be fired on right now.
     */
    public boolean canAttack() {
        return target != null && target.isAlive() && isWeaponReady() && isInRange(target.position(),
                                                                                   attackRange())
        && canSee(target.position());
    }

    /**
     * Emit an attack intent at the target, leading it and scattering by inaccuracy, and start the cooldown.
     *
     * @param projectileClass what to fire
     * @param cooldown        seconds before the next shot, already scaled by reaction time
     */
    protected void fireAt(Body at, ProjectileClass projectileClass, float cooldown) {
        fireAt(at, projectileClass, cooldown, 0.0f);
    }

    /**
     * As {@link #fireAt(Body, ProjectileClass, float)}, with the aim shifted sideways along {@link #right()}.
     */
    protected void fireAt(Body at, ProjectileClass projectileClass, float cooldown, float lateral) {
        float flightTime = distanceTo(at) / PROJECTILE_SPEED;
        var aimPoint = Vectors.offset(at.position(), at.velocity(), flightTime);
        var direction = Vectors.direction(position, aimPoint);
        if (lateral != 0.0f) {
            direction = Vectors.normalizeOrZero(Vectors.add(direction, Vectors.scale(right(), lateral)));
        }
        float spread = (1.0f - accuracy) * 0.2f;
        if (spread > 0.0f) {
            var random = context.random();
            direction = Vectors.normalizeOrZero(
            new Vector3f(direction.x + (random.nextFloat() - 0.5f) * spread,
                         direction.y + (random.nextFloat() - 0.5f) * spread,
                         direction.z + (random.nextFloat() - 0.5f) * spread));
        }
        var muzzle = Vectors.offset(position, forward, size());
        context.intents().fire(new AttackIntent(id, at.id(), muzzle, direction, projectileClass));
        cooldownRemaining = cooldown;
    }

    /**
     * Scale a base duration by the reaction time modifier in force.
     */
    public float reactionScaled(float seconds) {
        return seconds * modifiers.reactionTime();
    }

    /**
     * Head for an ally that asked for support, unless already engaged.
     */
    public void respondToSupport(UUID requesterId, Tuple3f requestPosition) {
        if (target != null || destroyed) {
            return;
        }
        stateMachine.changeState(new SupportState(requesterId, new Point3f(requestPosition)), this);
    }

    public boolean isAvailableForEscort() {
        return active && !destroyed && !stateMachine.isInState(FleeState.class)
        && healthRatio() > ESCORT_HEALTH_RATIO;
    }

    /**
     * Move to cover a retreating ally.
     */
    public void escort(UUID allyId, Tuple3f allyPosition) {
        stateMachine.changeState(new SupportState(allyId, new Point3f(allyPosition)), this);
    }

    /**
     * React to a synchronized strike signal. The default fires if a shot is available.
     */
    public void onCoordinatedAttack(CoordinatedAttack.Phase phase, UUID coordinator) {
        if (canAttack()) {
            attack();
        }
    }

    /**
     * Carry out a group maneuver aimed at {@code point}.
     */
    public void executeTacticalOrder(TacticalOrder.Maneuver maneuver, Tuple3f point) {
        switch (maneuver) {
            case DIRECT_ASSAULT -> navigator.setDestination(new Point3f(point));
            case FLANKING_MANEUVER -> {
                float side = (id.getLeastSignificantBits() & 1L) == 0 ? 1.0f : -1.0f;
                var toPoint = Vectors.direction(position, point);
                var flank = Vectors.normalizeOrZero(Vectors.cross(toPoint, Vectors.unitY()));
                navigator.setDestination(Vectors.offset(point, flank, side * attackRange()));
            }
            case DEFENSIVE_FORMATION -> {
                var formation = formation();
                if (formation.isPresent()) {
                    formation.get().closeRanks(MessagePayload.FormationOrder.DEFAULT_SPACING_MULTIPLIER);
                } else if (!nearbyAllies.isEmpty()) {
                    navigator.setDestination(averageAllyPosition());
                }
            }
            case HIT_AND_RUN -> {
                var toPoint = Vectors.direction(position, point);
                navigator.setDestination(Vectors.offset(point, toPoint, preferredEngagementRange()));
            }
        }
    }

    /**
     * Broadcast an intel report about the given body to nearby allies.
     */
    public void reportIntel(Body subject, float threatLevel, float confidence) {
        var report = new IntelReport(id, subject.id(), subject.position(), subject.velocity(), threatLevel,
                                     confidence, context.clock().now());
        endpoint.broadcast(AgentMessage.broadcast(MessageType.INTEL_REPORT, id, subject.position(),
                                                  new MessagePayload.Intel(report)));
    }

    /**
     * Publish this agent's condition to the ally tracker and to peers in range.
     */
    public void reportStatus() {
        var status = new AllyStatus(id, healthRatio(), position, velocity, target != null, ammo(),
                                    context.clock().now());
        context.allies().update(status);
        endpoint.broadcast(MessageType.STATUS_UPDATE, new MessagePayload.Status(status));
    }

    /**
     * Remaining ammunition fraction. Unlimited unless a subtype says otherwise.
     */
    public float ammo() {
        return 1.0f;
    }

    /**
     * Rebuild the list of allies within {@code radius}.
     */
    public void updateNearbyAllies(Collection<? extends AgentShip> candidates, float radius) {
        nearbyAllies.clear();
        float radiusSquared = radius * radius;
        for (var candidate : candidates) {
            if (candidate != this && !candidate.isDestroyed()
            && Vectors.distanceSquared(candidate.position(), position) <= radiusSquared) {
                nearbyAllies.add(candidate);
            }
        }
    }

    public List<AgentShip> nearbyAllies() {
        return Collections.unmodifiableList(nearbyAllies);
    }

    /**
     * Mean position of nearby allies, or this ship's position when alone.
     */
    public Point3f averageAllyPosition() {
        var positions = new ArrayList<Point3f>(nearbyAllies.size());
        for (var ally : nearbyAllies) {
            positions.add(ally.position());
        }
        return Vectors.centroid(positions, position);
    }

    public Vector3f averageAllyVelocity() {
        if (nearbyAllies.isEmpty()) {
            return Vectors.zero();
        }
        var sum = Vectors.zero();
        for (var ally : nearbyAllies) {
            sum.add(ally.velocity());
        }
        sum.scale(1.0f / nearbyAllies.size());
        return sum;
    }

    /**
     * Replace the modifiers in force, recomputing every effective stat from the baseline. The health ratio is
     * preserved across the change.
     */
    public void applyModifiers(StatModifiers newModifiers) {
        float ratio = healthRatio();
        modifiers = newModifiers;
        recomputeStats();
        health = ratio * maxHealth;
    }

    /**
     * Raise aggressiveness by {@code amount}, capped at 1. The bonus survives later modifier changes.
     */
    public void nudgeAggressiveness(float amount) {
        aggressionBonus = Vectors.clamp(aggressionBonus + amount, 0.0f, 1.0f);
        recomputeTraits();
    }

    /**
     * Replace the posture held from {@code source}. {@link Posture#NEUTRAL} clears it.
     */
    public void setPosture(Posture.Source source, Posture posture) {
        if (posture == null || posture.isNeutral()) {
            postures.remove(source);
        } else {
            postures.put(source, posture);
        }
        recomputeTraits();
    }

    public Posture posture(Posture.Source source) {
        return postures.getOrDefault(source, Posture.NEUTRAL);
    }

    /**
     * Set the swarm steering force, held until replaced. It is added to the velocity on every update.
     */
    public void setSteering(Tuple3f force) {
        steering.set(force);
    }

    public Vector3f steering() {
        return new Vector3f(steering);
    }

    private void applySteering(float deltaTime) {
        if (Vectors.lengthSquared(steering) < Vectors.EPSILON_SQUARED) {
            return;
        }
        // a ship already above cruise speed keeps its speed
        float limit = Math.max(speed, Vectors.length(velocity));
        velocity.scaleAdd(deltaTime, steering, velocity);
        float length = Vectors.length(velocity);
        if (length > limit) {
            velocity.scale(limit / length);
        }
    }

    private void recomputeStats() {
        maxHealth = baseline.maxHealth() * modifiers.health();
        speed = baseline.speed() * modifiers.speed();
        rotationSpeed = baseline.rotationSpeed() * modifiers.accuracy();
        detectionRange = baseline.detectionRange() * modifiers.detection();
        accuracy = Vectors.clamp01(BASE_ACCURACY * modifiers.accuracy());
        attackCooldown = baseline.attackCooldown() * modifiers.reactionTime();
        recomputeTraits();
    }

    private void recomputeTraits() {
        float cautionShift = 0.0f;
        float aggressionShift = 0.0f;
        float teamworkShift = 0.0f;
        for (var posture : postures.values()) {
            cautionShift += posture.caution();
            aggressionShift += posture.aggression();
            teamworkShift += posture.teamwork();
        }
        caution = Vectors.clamp01(baseline.caution() + cautionShift);
        aggressiveness = Vectors.clamp01(
        baseline.aggressiveness() * modifiers.aggression() + aggressionBonus + aggressionShift);
        teamworkTendency = Vectors.clamp01(baseline.teamworkTendency() * modifiers.teamwork() + teamworkShift);
    }

    private void trackTarget(float deltaTime) {
        if (target == null) {
            return;
        }
        if (!target.isAlive()) {
            target = null;
            return;
        }
        if (distanceTo(target.position()) <= detectionRange) {
            lastKnownPlayerPosition = new Point3f(target.position());
            timeSinceTargetSeen = 0.0f;
        } else {
            timeSinceTargetSeen += deltaTime;
        }
    }

    public Optional<FormationController> formation() {
        return context.formations().formationOf(id);
    }

    public boolean isFormationLeader() {
        return formation().map(f -> id.equals(f.leaderId())).orElse(false);
    }

    @Override
    public UUID id() {
        return id;
    }

    /**
     * @return the live position
     */
    @Override
    public Point3f position() {
        return position;
    }

    @Override
    public Vector3f velocity() {
        return velocity;
    }

    public Vector3f forward() {
        return forward;
    }

    public Vector3f up() {
        return up;
    }

    public Vector3f right() {
        return Vectors.cross(forward, up);
    }

    @Override
    public float health() {
        return health;
    }

    public float maxHealth() {
        return maxHealth;
    }

    public float healthRatio() {
        return maxHealth <= 0.0f ? 0.0f : health / maxHealth;
    }

    public float speed() {
        return speed;
    }

    public float rotationSpeed() {
        return rotationSpeed;
    }

    public float detectionRange() {
        return detectionRange;
    }

    public float attackRange() {
        return baseline.attackRange();
    }

    public float size() {
        return baseline.size();
    }

    public float aggressiveness() {
        return aggressiveness;
    }

    public float caution() {
        return caution;
    }

    public float teamworkTendency() {
        return teamworkTendency;
    }

    public float accuracy() {
        return accuracy;
    }

    /**
     * Base attack cooldown after reaction time scaling.
     */
    public float attackCooldown() {
        return attackCooldown;
    }

    public Personality personality() {
        return baseline.personality();
    }

    public ShipStats baseline() {
        return baseline;
    }

    public StatModifiers modifiers() {
        return modifiers;
    }

    public Body target() {
        return target;
    }

    public Optional<Point3f> lastKnownPlayerPosition() {
        return Optional.ofNullable(lastKnownPlayerPosition).map(Point3f::new);
    }

    public float timeSinceTargetSeen() {
        return timeSinceTargetSeen;
    }

    public AgentContext context() {
        return context;
    }

    public StateMachine stateMachine() {
        return stateMachine;
    }

    public Navigator navigator() {
        return navigator;
    }

    public CommunicationEndpoint endpoint() {
        return endpoint;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public boolean isAlive() {
        return !destroyed && health > 0.0f;
    }

    @Override
    public String toString() {
        return String.format("%s[%s (%.1f, %.1f, %.1f) hp=%.0f/%.0f %s]", shipType(), id, position.x, position.y,
                             position.z, health, maxHealth, stateMachine.currentStateName());
    }
}
