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
package com.hellblazer.armada;

import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.comms.AgentMessage;
import com.hellblazer.armada.comms.MessagePayload.LossReport;
import com.hellblazer.armada.comms.MessageType;
import com.hellblazer.armada.difficulty.DifficultyLevel;
import com.hellblazer.armada.difficulty.DifficultyListener;
import com.hellblazer.armada.difficulty.DifficultyScaler;
import com.hellblazer.armada.difficulty.PlayerPerformanceTracker;
import com.hellblazer.armada.formation.FormationController;
import com.hellblazer.armada.formation.FormationType;
import com.hellblazer.armada.geometry.Vectors;
import com.hellblazer.armada.swarm.EmergentBehaviors;
import com.hellblazer.armada.swarm.SwarmSteering;
import com.hellblazer.armada.tactical.TacticalPlanner;
import com.hellblazer.armada.world.Body;
import com.hellblazer.armada.world.GameEvent;
import com.hellblazer.armada.world.GameEventFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The per-frame driver of the hostile population.
 * <p>
 * Each {@link #tick(float)} advances the shared clock, applies pending {@link GameEvent}s, steps the difficulty
 * controller, updates every live agent, refreshes ally lists and lets agents acquire the player. Then, each on its
 * own cadence, it plans group tactics, runs the swarm and emergent behavior pass and maintains formations. Destroyed
 * agents are retired last.
 * <p>
 * Tactics are planned once per formation and once for all the agents outside any formation. Agents whose group
 * found no tactic fall back to acting with whoever shares their target.
 *
 * @author hal.hildebrand
 */
public class AIDirector implements DifficultyListener {

    public static final float TARGET_TIMEOUT = 10.0f;

    private static final Logger log = LoggerFactory.getLogger(AIDirector.class);

    private final AgentContext             context;
    private final GameEventFeed            events;
    private final PlayerPerformanceTracker tracker;
    private final DifficultyScaler         scaler;
    private final TacticalPlanner          planner;
    private final SwarmSteering            swarm;
    private final EmergentBehaviors        emergent;
    private final Map<UUID, AgentShip>     agents = new LinkedHashMap<>();
    private       float                    formationTimer;
    private       float                    tacticalTimer;
    private       float                    swarmTimer;

    public AIDirector(AgentContext context) {
        this(context, new GameEventFeed(context.config().getEventFeedCapacity()));
    }

    public AIDirector(AgentContext context, GameEventFeed events) {
        this.context = context;
        this.events = events;
        this.tracker = new PlayerPerformanceTracker(context.clock());
        this.scaler = new DifficultyScaler(context.config(), tracker);
        scaler.addListener(this);
        this.planner = new TacticalPlanner(this);
        this.swarm = new SwarmSteering(context.config());
        this.emergent = new EmergentBehaviors(this);
    }

    /**
     * Formation geometry suited to a group of {@code count} ships at the given difficulty.
     */
    public static FormationType chooseFormationType(int count, DifficultyLevel level) {
        if (count <= 2) {
            return FormationType.LINE;
        }
        if (count == 3) {
            return FormationType.V_FORMATION;
        }
        if (count == 4) {
            return FormationType.DIAMOND;
        }
        return switch (level) {
            case VERY_EASY -> FormationType.LINE;
            case EASY -> FormationType.BOX;
            case MEDIUM -> FormationType.DIAMOND;
            case HARD -> FormationType.SPHERE;
            case VERY_HARD -> FormationType.HELIX;
        };
    }

    /**
     * Bring a new agent into play: activate it and apply the current difficulty to its baseline.
     *
     * @throws IllegalArgumentException if the agent was built against another engine context
     */
    public AgentShip spawn(AgentShip agent) {
        if (agent.context() != context) {
            throw new IllegalArgumentException("Agent " + agent.id() + " belongs to a different engine context");
        }
        agents.put(agent.id(), agent);
        agent.activate();
        scaler.applyTo(agent);
        log.debug("Spawned {}", agent);
        return agent;
    }

    /**
     * Whether another agent may be spawned under the current tier's cap.
     */
    public boolean hasCapacity() {
        return agents.size() < scaler.settings().maxSimultaneousEnemies();
    }

    /**
     * Advance the whole engine by one frame.
     */
    public void tick(float deltaTime) {
        context.clock().advance(deltaTime);
        for (var event : events.drain()) {
            apply(event);
        }
        scaler.update(deltaTime);

        var live = liveAgents();
        for (var agent : live) {
            agent.update(deltaTime);
        }
        float allyRadius = context.config().getAllySearchRadius();
        for (var agent : live) {
            agent.updateNearbyAllies(live, allyRadius);
        }
        context.world().player().filter(Body::isAlive).ifPresent(player -> acquire(live, player));

        var config = context.config();
        tacticalTimer += deltaTime;
        if (tacticalTimer >= config.getTacticalUpdateInterval()) {
            tacticalTimer = Math.min(tacticalTimer - config.getTacticalUpdateInterval(),
                                     config.getTacticalUpdateInterval());
            planTactics(live);
        }
        swarmTimer += deltaTime;
        if (swarmTimer >= config.getSwarmUpdateInterval()) {
            swarmTimer = Math.min(swarmTimer - config.getSwarmUpdateInterval(), config.getSwarmUpdateInterval());
            emergent.update(live);
            swarm.apply(live);
        }

        formationTimer += deltaTime;
        if (formationTimer >= context.config().getFormationUpdateInterval()) {
            for (var formation : context.formations().formations()) {
                formation.update(formationTimer);
            }
            context.formations().removeEmpty();
            formationTimer = 0.0f;
        }
        retireDestroyed();
    }

    /**
     * Put the given agents into a new formation centered on their mean position.
     */
    public FormationController formUp(FormationType type, Collection<? extends AgentShip> ships) {
        var positions = new ArrayList<Point3f>();
        for (var ship : ships) {
            positions.add(ship.position());
        }
        var formation = context.formations().create(type, Vectors.centroid(positions, new Point3f()));
        for (var ship : ships) {
            context.formations().join(formation.id(), ship.id());
        }
        scaler.applyTo(formation);
        log.debug("Formed {}", formation);
        return formation;
    }

    /**
     * {@link #formUp(FormationType, Collection)} with a geometry chosen for the group size and difficulty.
     */
    public FormationController formUp(Collection<? extends AgentShip> ships) {
        return formUp(chooseFormationType(ships.size(), scaler.level()), ships);
    }

    @Override
    public void onDifficultyChanged(DifficultyLevel previous, DifficultyLevel current) {
        for (var agent : liveAgents()) {
            scaler.applyTo(agent);
        }
        for (var formation : context.formations().formations()) {
            scaler.applyTo(formation);
        }
    }

    public Optional<AgentShip> agent(UUID id) {
        return Optional.ofNullable(agents.get(id));
    }

    public List<AgentShip> agents() {
        return new ArrayList<>(agents.values());
    }

    public List<AgentShip> agentsWithin(Tuple3f center, float radius) {
        var found = new ArrayList<AgentShip>();
        for (var agent : agents.values()) {
            if (agent.isInRange(center, radius)) {
                found.add(agent);
            }
        }
        return found;
    }

    public Optional<FormationController> largestFormation() {
        return context.formations().formations().stream().max(Comparator.comparingInt(FormationController::size));
    }

    /**
     * Destroy and forget every agent.
     */
    public void clear() {
        for (var agent : agents()) {
            agent.destroy();
        }
        agents.clear();
        planner.clearPending();
        context.formations().removeEmpty();
    }

    public AgentContext context() {
        return context;
    }

    public GameEventFeed events() {
        return events;
    }

    public DifficultyScaler scaler() {
        return scaler;
    }

    public PlayerPerformanceTracker performanceTracker() {
        return tracker;
    }

    public TacticalPlanner planner() {
        return planner;
    }

    public SwarmSteering swarm() {
        return swarm;
    }

    public EmergentBehaviors emergent() {
        return emergent;
    }

    private void planTactics(List<AgentShip> live) {
        planner.resolveOutcomes();
        var unplanned = new ArrayList<AgentShip>();
        for (var formation : context.formations().formations()) {
            var members = new ArrayList<AgentShip>();
            for (var id : formation.members()) {
                agent(id).filter(AgentShip::isAlive).ifPresent(members::add);
            }
            if (!members.isEmpty() && planner.plan(formation.id(), members).isEmpty()) {
                unplanned.addAll(members);
            }
        }
        var unformed = new ArrayList<AgentShip>();
        for (var agent : live) {
            if (agent.isAlive() && agent.formation().isEmpty()) {
                unformed.add(agent);
            }
        }
        if (!unformed.isEmpty() && planner.plan(TacticalPlanner.UNFORMED_GROUP, unformed).isEmpty()) {
            unplanned.addAll(unformed);
        }
        int acted = emergent.coordinateGroupActions(unplanned);
        log.trace("Tactical pass: {} agents without a plan, {} acted together", unplanned.size(), acted);
    }

    private void apply(GameEvent event) {
        if (event instanceof GameEvent.DamageTaken damage) {
            agent(damage.agentId()).ifPresentOrElse(a -> a.takeDamage(damage.amount()),
                                                    () -> log.debug("Damage to unknown agent {}", damage.agentId()));
        } else if (event instanceof GameEvent.AgentDestroyed destroyed) {
            agent(destroyed.agentId()).ifPresent(AgentShip::destroy);
        } else if (event instanceof GameEvent.AllyLost lost) {
            var notice = AgentMessage.broadcast(MessageType.ALLY_DESTROYED, lost.lostId(), lost.position(),
                                                new LossReport(lost.lostId())).stamped(context.clock().now());
            int notified = context.hub().deliverNear(lost.position(), context.hub().getCommunicationRange(), notice);
            log.debug("Ally {} lost, notified {}", lost.lostId(), notified);
        }
    }

    private void acquire(List<AgentShip> live, Body player) {
        for (var agent : live) {
            if (agent.isDestroyed()) {
                continue;
            }
            if (agent.canSee(player.position())) {
                agent.observe(player);
            } else if (agent.target() == player && agent.timeSinceTargetSeen() > TARGET_TIMEOUT) {
                agent.setTarget(null);
            }
        }
    }

    private List<AgentShip> liveAgents() {
        var live = new ArrayList<AgentShip>(agents.size());
        for (var agent : agents.values()) {
            if (!agent.isDestroyed()) {
                live.add(agent);
            }
        }
        return live;
    }

    private void retireDestroyed() {
        var iterator = agents.values().iterator();
        while (iterator.hasNext()) {
            var agent = iterator.next();
            if (agent.isDestroyed() || !agent.isAlive()) {
                agent.destroy();
                iterator.remove();
                log.debug("Retired {} {}", agent.shipType(), agent.id());
            }
        }
    }
}
