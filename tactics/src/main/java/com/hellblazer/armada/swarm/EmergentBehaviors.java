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

import com.hellblazer.armada.AIDirector;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.agent.Posture;
import com.hellblazer.armada.agent.ShipType;
import com.hellblazer.armada.comms.MessagePayload.TacticalOrder;
import com.hellblazer.armada.formation.FormationController;
import com.hellblazer.armada.formation.FormationType;
import com.hellblazer.armada.ships.InterceptorShip;
import com.hellblazer.armada.state.FleeState;
import com.hellblazer.armada.world.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Group behavior that arises from local conditions rather than orders: unformed ships flocking into formations,
 * members displacing a weaker leader, formations adjusting their posture to their losses, and ships sharing a
 * target acting together by type.
 *
 * @author hal.hildebrand
 */
public class EmergentBehaviors {

    public static final int     MIN_FLOCK           = 3;
    public static final int     MAX_FLOCK           = 6;
    public static final float   LEADERSHIP_MARGIN   = 0.1f;
    public static final float   HIGH_THREAT         = 0.7f;
    public static final float   LOW_THREAT          = 0.3f;
    public static final Posture HIGH_THREAT_POSTURE = new Posture(0.2f, 0.0f, 0.3f);
    public static final Posture LOW_THREAT_POSTURE  = new Posture(0.0f, 0.1f, 0.0f);

    private static final Logger log = LoggerFactory.getLogger(EmergentBehaviors.class);

    private final AIDirector director;

    public EmergentBehaviors(AIDirector director) {
        this.director = director;
    }

    /**
     * How strongly {@code challenger} outranks {@code leader}: health, type aptitude and teamwork.
     */
    public static float leadershipAdvantage(AgentShip challenger, AgentShip leader) {
        return (challenger.healthRatio() - leader.healthRatio()) * 0.4f
        + (challenger.shipType().leadershipAptitude() - leader.shipType().leadershipAptitude()) * 0.4f
        + (challenger.teamworkTendency() - leader.teamworkTendency()) * 0.2f;
    }

    /**
     * Flocks, leadership and threat posture, in that order.
     */
    public void update(Collection<? extends AgentShip> ships) {
        formFlocks(ships);
        challengeLeadership();
        adaptToThreat(ships);
    }

    /**
     * Gather unformed ships into V formations. A ship with at least two free neighbors within the flock radius
     * founds a flock with up to {@value #MAX_FLOCK} ships, nearest first. Each ship joins at most one flock, and
     * fleeing ships join none.
     *
     * @return the formations created
     */
    public List<FormationController> formFlocks(Collection<? extends AgentShip> ships) {
        var free = new ArrayList<AgentShip>();
        for (var ship : ships) {
            if (ship.isAlive() && ship.formation().isEmpty() && !ship.stateMachine().isInState(FleeState.class)) {
                free.add(ship);
            }
        }
        var formed = new ArrayList<FormationController>();
        if (free.size() < MIN_FLOCK) {
            return formed;
        }
        float radius = director.context().config().getFlockRadius();
        Set<AgentShip> claimed = new HashSet<>();
        for (var founder : free) {
            if (claimed.contains(founder)) {
                continue;
            }
            var neighbors = new ArrayList<AgentShip>();
            for (var other : free) {
                if (other != founder && !claimed.contains(other) && founder.isInRange(other.position(), radius)) {
                    neighbors.add(other);
                }
            }
            if (neighbors.size() < MIN_FLOCK - 1) {
                continue;
            }
            neighbors.sort(Comparator.comparingDouble(n -> founder.distanceTo(n.position())));
            var flock = new ArrayList<AgentShip>();
            flock.add(founder);
            flock.addAll(neighbors.subList(0, Math.min(neighbors.size(), MAX_FLOCK - 1)));
            claimed.addAll(flock);
            formed.add(director.formUp(FormationType.V_FORMATION, flock));
            log.debug("{} ships flocked around {}", flock.size(), founder.id());
        }
        return formed;
    }

    /**
     * Let the strongest member of each formation replace its leader when it outranks it by more than
     * {@value #LEADERSHIP_MARGIN}.
     *
     * @return the number of leaders replaced
     */
    public int challengeLeadership() {
        int replaced = 0;
        for (var formation : director.context().formations().formations()) {
            var leaderId = formation.leaderId();
            if (leaderId == null) {
                continue;
            }
            var leader = director.agent(leaderId).filter(AgentShip::isAlive);
            if (leader.isEmpty()) {
                continue;
            }
            AgentShip challenger = null;
            float best = LEADERSHIP_MARGIN;
            for (var member : members(formation)) {
                if (member == leader.get()) {
                    continue;
                }
                float advantage = leadershipAdvantage(member, leader.get());
                if (advantage > best) {
                    best = advantage;
                    challenger = member;
                }
            }
            if (challenger != null) {
                formation.setLeader(challenger.id());
                replaced++;
            }
        }
        return replaced;
    }

    /**
     * Set each formation's posture from its losses, measured as one minus the mean health ratio. Ships outside a
     * formation hold no group posture.
     */
    public void adaptToThreat(Collection<? extends AgentShip> ships) {
        for (var ship : ships) {
            if (ship.formation().isEmpty()) {
                ship.setPosture(Posture.Source.GROUP_THREAT, Posture.NEUTRAL);
            }
        }
        for (var formation : director.context().formations().formations()) {
            var members = members(formation);
            if (members.isEmpty()) {
                continue;
            }
            float health = 0.0f;
            for (var member : members) {
                health += member.healthRatio();
            }
            float threat = 1.0f - health / members.size();
            var posture = threat > HIGH_THREAT ? HIGH_THREAT_POSTURE
                                               : threat < LOW_THREAT ? LOW_THREAT_POSTURE : Posture.NEUTRAL;
            for (var member : members) {
                member.setPosture(Posture.Source.GROUP_THREAT, posture);
            }
        }
    }

    /**
     * Ships engaging the same target in twos or more act by type: scouts hit and run, interceptors intercept, and
     * fighters and bombers attempt their coordinated attacks.
     *
     * @return the number of ships that acted
     */
    public int coordinateGroupActions(Collection<? extends AgentShip> ships) {
        Map<Body, List<AgentShip>> byTarget = new IdentityHashMap<>();
        for (var ship : ships) {
            var target = ship.target();
            if (ship.isAlive() && target != null && target.isAlive()) {
                byTarget.computeIfAbsent(target, t -> new ArrayList<>()).add(ship);
            }
        }
        int acted = 0;
        for (var entry : byTarget.entrySet()) {
            if (entry.getValue().size() < 2) {
                continue;
            }
            for (var ship : entry.getValue()) {
                if (ship.shipType() == ShipType.SCOUT) {
                    ship.executeTacticalOrder(TacticalOrder.Maneuver.HIT_AND_RUN, entry.getKey().position());
                } else if (ship instanceof InterceptorShip interceptor) {
                    interceptor.intercept();
                } else {
                    ship.coordinateAttack();
                }
                acted++;
            }
        }
        return acted;
    }

    private List<AgentShip> members(FormationController formation) {
        var members = new ArrayList<AgentShip>();
        for (var id : formation.members()) {
            director.agent(id).filter(AgentShip::isAlive).ifPresent(members::add);
        }
        return members;
    }
}
