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
package com.hellblazer.armada.tactical;

import com.hellblazer.armada.AIDirector;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.agent.Posture;
import com.hellblazer.armada.agent.ShipType;
import com.hellblazer.armada.comms.AgentMessage;
import com.hellblazer.armada.comms.MessagePayload.TacticalOrder;
import com.hellblazer.armada.comms.MessageType;
import com.hellblazer.armada.formation.FormationType;
import com.hellblazer.armada.geometry.Vectors;
import com.hellblazer.armada.ships.BomberShip;
import com.hellblazer.armada.state.AttackState;
import com.hellblazer.armada.state.SupportState;
import com.hellblazer.armada.world.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Chooses and carries out a group tactic against the target a group is engaging.
 * <p>
 * A pass over a group assesses its {@link TacticalSituation}, rates every {@link TacticType} the group admits, and
 * executes the best by {@link TacticalOption#score()}. The outcome is judged at the start of the next pass: the
 * tactic succeeded if every ship of the group survived and the target lost health meanwhile. Outcomes feed the
 * {@link TacticalMemory}, so tactics that keep failing lose ground to the alternatives.
 *
 * @author hal.hildebrand
 */
public class TacticalPlanner {

    /** Key under which the ships outside any formation are planned for. */
    public static final UUID UNFORMED_GROUP = new UUID(0L, 0L);

    public static final float   REFERENCE_DAMAGE_RATE = 40.0f;
    public static final float   REFERENCE_SPEED       = 100.0f;
    public static final float   BOMBARDMENT_RANGE     = 80.0f;
    public static final float   FLANK_RADIUS          = 80.0f;
    public static final float   PINCER_DISTANCE       = 100.0f;
    public static final float   PINCER_LEAD_TIME      = 3.0f;
    public static final float   DAMAGED_RATIO         = 0.5f;
    public static final Posture DEFENSIVE_POSTURE     = new Posture(0.3f, -0.2f, 0.0f);

    private static final Logger log = LoggerFactory.getLogger(TacticalPlanner.class);

    private final AIDirector           director;
    private final TacticalMemory       memory;
    private final Map<UUID, Execution> pending = new LinkedHashMap<>();

    public TacticalPlanner(AIDirector director) {
        this(director, new TacticalMemory());
    }

    public TacticalPlanner(AIDirector director, TacticalMemory memory) {
        this.director = director;
        this.memory = memory;
    }

    /**
     * Sustained damage output of a ship type, used to rate a direct assault.
     */
    public static float damageRate(ShipType type) {
        return switch (type) {
            case SCOUT -> 15.0f;
            case FIGHTER -> 25.0f;
            case BOMBER -> 40.0f;
            case INTERCEPTOR, COMMANDER -> 20.0f;
        };
    }

    /**
     * How well {@code type} suits the situation, ignoring whether the group admits it. Every rating but the
     * defensive formation is zero without a target.
     */
    public static float effectiveness(TacticType type, TacticalSituation situation) {
        if (!situation.hasTarget() && type != TacticType.DEFENSIVE_FORMATION) {
            return 0.0f;
        }
        return switch (type) {
            case DIRECT_ASSAULT -> {
                float rate = 0.0f;
                for (var ship : situation.group()) {
                    rate += damageRate(ship.shipType());
                }
                rate /= situation.allyCount() * REFERENCE_DAMAGE_RATE;
                yield rate * situation.averageHealth() * (situation.allyCount() > 1 ? 1.2f : 0.8f);
            }
            case FLANKING_MANEUVER -> (situation.fractionOf(ShipType.INTERCEPTOR, ShipType.SCOUT) * 0.3f
                                       + situation.coordination() * 0.4f + situation.spacing() * 0.3f) * 0.8f;
            case PINCER_MOVEMENT -> situation.allyCount() < 4 ? 0.0f
                                                              : situation.coordination() * situation.encirclement()
                                                              * situation.averageHealth() * 0.9f;
            case DEFENSIVE_FORMATION -> (situation.fractionBelowHealth(DAMAGED_RATIO) * 0.4f
                                         + situation.formationIntegrity() * 0.3f
                                         + situation.fractionOf(ShipType.BOMBER, ShipType.FIGHTER) * 0.3f) * 0.6f;
            case HIT_AND_RUN -> (situation.fractionOf(ShipType.INTERCEPTOR, ShipType.SCOUT) * 0.5f
                                 + Math.min(1.0f, situation.averageSpeed() / REFERENCE_SPEED) * 0.3f
                                 + situation.averageHealth() * 0.2f) * 0.7f;
            case SUPPRESSION_BOMBARDMENT -> {
                float bombers = situation.fractionOf(ShipType.BOMBER);
                float range = Math.min(1.0f, situation.averageDistance() / BOMBARDMENT_RANGE);
                yield bombers * 0.5f + (1.0f - bombers) * 0.2f + range * 0.3f;
            }
        };
    }

    /**
     * The tactics the situation admits, best first.
     */
    public List<TacticalOption> options(TacticalSituation situation) {
        var options = new ArrayList<TacticalOption>();
        for (var type : TacticType.values()) {
            if (type.admits(situation)) {
                options.add(new TacticalOption(type, effectiveness(type, situation), memory.successRate(type)));
            }
        }
        options.sort(Comparator.comparingDouble(TacticalOption::score).reversed());
        return options;
    }

    /**
     * Plan for one group. Groups engaging no live target are left alone and lose any tactical posture.
     *
     * @param groupKey the formation id, or {@link #UNFORMED_GROUP}
     * @return the executed option, if any
     */
    public Optional<TacticalOption> plan(UUID groupKey, List<? extends AgentShip> group) {
        var ships = new ArrayList<AgentShip>();
        for (var ship : group) {
            if (ship.isAlive()) {
                ships.add(ship);
            }
        }
        if (ships.isEmpty()) {
            return Optional.empty();
        }
        for (var ship : ships) {
            ship.setPosture(Posture.Source.TACTICAL, Posture.NEUTRAL);
        }
        var target = engagedTarget(ships);
        if (target.isEmpty()) {
            return Optional.empty();
        }
        var situation = TacticalSituation.assess(ships, target.get());
        var options = options(situation);
        if (options.isEmpty()) {
            return Optional.empty();
        }
        var best = options.get(0);
        execute(best.type(), situation);
        pending.put(groupKey, new Execution(best.type(), ships, target.get(), target.get().health()));
        log.debug("Group {} of {} chose {} (effectiveness {}, success {})", groupKey, ships.size(), best.type(),
                  best.effectiveness(), best.successRate());
        return Optional.of(best);
    }

    /**
     * Judge every tactic executed since the last call and record the outcomes.
     *
     * @return the number of outcomes recorded
     */
    public int resolveOutcomes() {
        double now = director.context().clock().now();
        int resolved = 0;
        for (var execution : pending.values()) {
            boolean intact = execution.ships().stream().allMatch(AgentShip::isAlive);
            boolean damaged = execution.target().health() < execution.targetHealth();
            memory.record(execution.type(), intact && damaged, now);
            resolved++;
        }
        pending.clear();
        return resolved;
    }

    public void execute(TacticType type, TacticalSituation situation) {
        var target = situation.target();
        var group = situation.group();
        switch (type) {
            case DIRECT_ASSAULT -> directAssault(group, target);
            case FLANKING_MANEUVER -> flank(group, target);
            case PINCER_MOVEMENT -> pincer(group, target);
            case DEFENSIVE_FORMATION -> defend(situation);
            case HIT_AND_RUN -> hitAndRun(group, target);
            case SUPPRESSION_BOMBARDMENT -> bombard(group, target);
        }
    }

    /**
     * Forget executions awaiting judgement without recording them.
     */
    public void clearPending() {
        pending.clear();
    }

    public TacticalMemory memory() {
        return memory;
    }

    /**
     * Executions awaiting judgement, by group key.
     */
    public Map<UUID, TacticType> pending() {
        var pendingTypes = new LinkedHashMap<UUID, TacticType>();
        pending.forEach((key, execution) -> pendingTypes.put(key, execution.type()));
        return pendingTypes;
    }

    static Point3f[] pincerPoints(Body target) {
        var velocity = target.velocity();
        var predicted = Vectors.offset(target.position(), velocity, PINCER_LEAD_TIME);
        var perpendicular = Vectors.cross(Vectors.normalizeOrZero(velocity), Vectors.unitY());
        if (Vectors.lengthSquared(perpendicular) < 0.1f) {
            perpendicular = Vectors.unitX();
        } else {
            perpendicular = Vectors.normalizeOrZero(perpendicular);
        }
        return new Point3f[] { Vectors.offset(predicted, perpendicular, PINCER_DISTANCE),
                               Vectors.offset(predicted, perpendicular, -PINCER_DISTANCE) };
    }

    private Optional<Body> engagedTarget(List<AgentShip> ships) {
        for (var ship : ships) {
            var target = ship.target();
            if (target != null && target.isAlive()) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    private void directAssault(List<AgentShip> group, Body target) {
        for (var ship : group) {
            ship.setTarget(target);
            if (!ship.stateMachine().isInState(AttackState.class)) {
                ship.stateMachine().changeState(new AttackState(), ship);
            }
        }
        var caller = group.get(0);
        caller.endpoint()
              .broadcast(AgentMessage.broadcast(MessageType.TACTICAL_ORDER, caller.id(), target.position(),
                                                new TacticalOrder(TacticalOrder.Maneuver.DIRECT_ASSAULT)));
    }

    private void flank(List<AgentShip> group, Body target) {
        int flanker = 0;
        for (var ship : group) {
            ship.setTarget(target);
            if (isFast(ship)) {
                double angle = Math.toRadians(90.0 + 180.0 * (flanker++ % 2));
                ship.navigator()
                    .setDestination(new Point3f(target.position().x + (float) Math.cos(angle) * FLANK_RADIUS,
                                                target.position().y,
                                                target.position().z + (float) Math.sin(angle) * FLANK_RADIUS));
            } else {
                ship.navigator().setDestination(target.position());
            }
        }
    }

    private void pincer(List<AgentShip> group, Body target) {
        var points = pincerPoints(target);
        int half = group.size() / 2;
        for (int i = 0; i < group.size(); i++) {
            var ship = group.get(i);
            ship.setTarget(target);
            ship.navigator().setDestination(points[i < half ? 0 : 1]);
        }
    }

    private void defend(TacticalSituation situation) {
        var group = situation.group();
        var formation = group.get(0).formation();
        if (formation.isPresent()) {
            formation.get().changeFormation(FormationType.SPHERE);
        } else if (group.size() >= 2 && situation.formationIntegrity() > 0.0f) {
            // scattered ships only take the posture
            director.formUp(FormationType.SPHERE, group);
        }
        for (var ship : group) {
            ship.setPosture(Posture.Source.TACTICAL, DEFENSIVE_POSTURE);
        }
    }

    private void hitAndRun(List<AgentShip> group, Body target) {
        for (var ship : group) {
            ship.setTarget(target);
            if (isFast(ship)) {
                ship.executeTacticalOrder(TacticalOrder.Maneuver.HIT_AND_RUN, target.position());
            }
        }
    }

    private void bombard(List<AgentShip> group, Body target) {
        var bombers = new ArrayList<AgentShip>();
        for (var ship : group) {
            if (ship instanceof BomberShip bomber) {
                bomber.setTarget(target);
                bomber.navigator().setDestination(bomber.coverPosition(target.position()));
                bombers.add(bomber);
            }
        }
        for (var ship : group) {
            if (ship instanceof BomberShip) {
                continue;
            }
            var escorted = nearest(ship, bombers);
            ship.stateMachine().changeState(new SupportState(escorted.id(), escorted.position()), ship);
        }
    }

    private static boolean isFast(AgentShip ship) {
        return ship.shipType() == ShipType.SCOUT || ship.shipType() == ShipType.INTERCEPTOR;
    }

    private static AgentShip nearest(AgentShip from, List<AgentShip> candidates) {
        AgentShip nearest = candidates.get(0);
        for (var candidate : candidates) {
            if (from.distanceTo(candidate.position()) < from.distanceTo(nearest.position())) {
                nearest = candidate;
            }
        }
        return nearest;
    }

    private record Execution(TacticType type, List<AgentShip> ships, Body target, float targetHealth) {
    }
}
