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
import com.hellblazer.armada.common.BoundedHistory;
import com.hellblazer.armada.comms.AgentMessage;
import com.hellblazer.armada.comms.MessagePayload.FormationOrder;
import com.hellblazer.armada.geometry.Vectors;
import com.hellblazer.armada.world.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Geometry and leadership of one formation.
 * <p>
 * Members are an ordered list of agent ids; the list index is the slot and slot 0 is the leader. The leader flies
 * its own navigator and the formation frame follows it. Membership changes go through {@link FormationRegistry},
 * which guards the one-formation-per-agent invariant.
 * <p>
 * Effective scale is the base scale, set by difficulty and by spacing orders, times a spread factor that widens
 * in combat and relaxes back to one out of it.
 *
 * @author hal.hildebrand
 */
public class FormationController {

    public static final float COMBAT_SPREAD          = 1.5f;
    public static final float SPREAD_RELAXATION      = 0.1f;
    public static final float LEADER_MIN_HEALTH      = 0.3f;
    public static final int   APPLIED_ORDER_MEMORY   = 16;

    private static final Logger log = LoggerFactory.getLogger(FormationController.class);

    private final UUID                                 id;
    private final Function<UUID, Optional<AgentShip>>  directory;
    private final List<UUID>                           members   = new ArrayList<>();
    private final Map<UUID, FormationMember>           slots     = new HashMap<>();
    private final List<FormationListener>              listeners = new CopyOnWriteArrayList<>();
    private final Point3f                              center;
    private final Vector3f                             direction = Vectors.unitZ();
    private       FormationType                        type;
    private       float                                baseScale = 1.0f;
    private       float                                spread    = 1.0f;
    private       Point3f                              destination;
    private       int                                  peakSize;
    private       boolean                              dynamic   = true;
    private       List<Vector3f>                       offsets;
    private final BoundedHistory<AgentMessage>         appliedOrders = new BoundedHistory<>(APPLIED_ORDER_MEMORY);

    FormationController(UUID id, FormationType type, Tuple3f center,
                        Function<UUID, Optional<AgentShip>> directory) {
        this.id = id;
        this.type = type;
        this.center = new Point3f(center);
        this.directory = directory;
    }

    public UUID id() {
        return id;
    }

    public synchronized FormationType type() {
        return type;
    }

    /**
     * Effective scale: base scale times the combat spread factor.
     */
    public synchronized float scale() {
        return baseScale * spread;
    }

    public synchronized float baseScale() {
        return baseScale;
    }

    public synchronized float spreadFactor() {
        return spread;
    }

    public synchronized List<UUID> members() {
        return new ArrayList<>(members);
    }

    public synchronized int size() {
        return members.size();
    }

    public synchronized boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Largest membership this formation has had.
     */
    public synchronized int peakSize() {
        return peakSize;
    }

    public synchronized UUID leaderId() {
        return members.isEmpty() ? null : members.get(0);
    }

    public synchronized int indexOf(UUID agentId) {
        return members.indexOf(agentId);
    }

    public synchronized Point3f center() {
        return new Point3f(center);
    }

    public synchronized Vector3f direction() {
        return new Vector3f(direction);
    }

    public synchronized Optional<Point3f> destination() {
        return Optional.ofNullable(destination).map(Point3f::new);
    }

    public void addListener(FormationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(FormationListener listener) {
        listeners.remove(listener);
    }

    public synchronized void setDynamic(boolean dynamic) {
        this.dynamic = dynamic;
    }

    /**
     * Periodic maintenance: follow the leader, replace a lost leader and adapt spacing to combat.
     */
    public void update(float deltaTime) {
        FormationType changedFrom = null;
        synchronized (this) {
            refreshFrame();
            if (dynamic && !members.isEmpty()) {
                boolean inCombat = false;
                for (var member : members) {
                    var ship = directory.apply(member);
                    if (ship.isPresent() && ship.get().target() != null) {
                        inCombat = true;
                        break;
                    }
                }
                if (inCombat) {
                    spread = Math.max(spread, COMBAT_SPREAD);
                    if (members.size() * 2 < peakSize && type != FormationType.SPHERE) {
                        changedFrom = type;
                        type = FormationType.SPHERE;
                    }
                } else {
                    spread = Math.max(1.0f, spread - SPREAD_RELAXATION);
                }
                offsets = null;
            }
        }
        if (changedFrom != null) {
            log.debug("Formation {} lost more than half its ships, closing into a sphere", id);
            fireFormationChanged(changedFrom, FormationType.SPHERE);
        }
    }

    /**
     * Keep a member on station. The leader is left to its navigator.
     */
    public void steer(AgentShip ship, float deltaTime) {
        Point3f slot;
        Vector3f heading;
        FormationMember member;
        synchronized (this) {
            int index = members.indexOf(ship.id());
            if (index <= 0) {
                return;
            }
            refreshFrame();
            slot = slotPosition(index);
            heading = new Vector3f(direction);
            member = slots.get(ship.id());
        }
        member.steer(ship, slot, heading, deltaTime);
    }

    /**
     * World position of an agent's slot.
     */
    public synchronized Optional<Point3f> positionFor(UUID agentId) {
        int index = members.indexOf(agentId);
        if (index < 0) {
            return Optional.empty();
        }
        return Optional.of(slotPosition(index));
    }

    public synchronized Optional<FormationMember> memberSlot(UUID agentId) {
        return Optional.ofNullable(slots.get(agentId));
    }

    /**
     * Aim the formation at a point and send the leader there.
     */
    public void setDestination(Tuple3f point) {
        AgentShip leader;
        synchronized (this) {
            destination = new Point3f(point);
            var heading = Vectors.direction(center, point);
            if (Vectors.lengthSquared(heading) > Vectors.EPSILON_SQUARED) {
                direction.set(heading);
                offsets = null;
            }
            leader = leader().orElse(null);
        }
        if (leader != null) {
            leader.navigator().setDestination(point);
        }
    }

    /**
     * Set every member other than {@code except} on the given target.
     */
    public void retarget(Body target, UUID except) {
        for (var member : members()) {
            if (!member.equals(except)) {
                directory.apply(member).ifPresent(ship -> ship.setTarget(target));
            }
        }
    }

    public void changeFormation(FormationType newType) {
        FormationType previous;
        synchronized (this) {
            if (newType == type) {
                return;
            }
            previous = type;
            type = newType;
            offsets = null;
        }
        log.debug("Formation {} {} -> {}", id, previous, newType);
        fireFormationChanged(previous, newType);
    }

    public synchronized void setBaseScale(float scale) {
        if (!(scale > 0.0f)) {
            throw new IllegalArgumentException("Formation scale must be positive: " + scale);
        }
        baseScale = scale;
        offsets = null;
    }

    public synchronized void spreadOut(float multiplier) {
        setBaseScale(baseScale * multiplier);
    }

    public synchronized void closeRanks(float multiplier) {
        setBaseScale(baseScale / multiplier);
    }

    /**
     * Apply a formation order once, however many members relay the same message. The most recent
     * {@value #APPLIED_ORDER_MEMORY} applied orders are remembered, so several orders may be in flight at once.
     *
     * @return false if this exact message was already applied
     */
    public boolean applyOrder(AgentMessage message, FormationOrder order) {
        synchronized (this) {
            if (appliedOrders.contains(message)) {
                return false;
            }
            appliedOrders.add(message);
        }
        switch (order.order()) {
            case CHANGE_FORMATION -> changeFormation(order.formationType());
            case SPREAD_OUT -> spreadOut(order.spacingMultiplier());
            case CLOSE_RANKS -> closeRanks(order.spacingMultiplier());
            case BREAK_FORMATION -> {
                // individual members leave; nothing to do formation-wide
            }
        }
        return true;
    }

    /**
     * Make {@code agentId} the leader, moving it to slot 0.
     */
    public void setLeader(UUID agentId) {
        UUID previous;
        synchronized (this) {
            if (!members.contains(agentId) || agentId.equals(leaderId())) {
                return;
            }
            previous = leaderId();
            members.remove(agentId);
            members.add(0, agentId);
            offsets = null;
        }
        log.debug("Formation {} leader {} -> {}", id, previous, agentId);
        for (var listener : listeners) {
            listener.onLeaderChanged(this, previous, agentId);
        }
    }

    /**
     * Leadership score: health, ship type standing and teamwork.
     */
    public static float leadershipScore(AgentShip ship) {
        return ship.healthRatio() * 30.0f + ship.shipType().leadershipScore() + ship.teamworkTendency() * 10.0f;
    }

    void addMember(UUID agentId) {
        synchronized (this) {
            members.add(agentId);
            slots.put(agentId, new FormationMember(agentId));
            peakSize = Math.max(peakSize, members.size());
            offsets = null;
        }
        for (var listener : listeners) {
            listener.onMemberAdded(this, agentId);
        }
    }

    void removeMember(UUID agentId) {
        boolean wasLeader;
        synchronized (this) {
            int index = members.indexOf(agentId);
            if (index < 0) {
                return;
            }
            wasLeader = index == 0;
            members.remove(index);
            slots.remove(agentId);
            offsets = null;
        }
        for (var listener : listeners) {
            listener.onMemberRemoved(this, agentId);
        }
        if (wasLeader) {
            electLeader();
        }
    }

    /**
     * Choose the healthiest eligible member by leadership score; if none qualifies the first member leads.
     */
    void electLeader() {
        List<AgentShip> candidates = new ArrayList<>();
        for (var member : members()) {
            directory.apply(member).filter(s -> s.healthRatio() > LEADER_MIN_HEALTH).ifPresent(candidates::add);
        }
        var best = candidates.stream().max(Comparator.comparingDouble(FormationController::leadershipScore));
        if (best.isPresent()) {
            setLeader(best.get().id());
        } else {
            var first = leaderId();
            if (first != null) {
                for (var listener : listeners) {
                    listener.onLeaderChanged(this, null, first);
                }
            }
        }
    }

    private Optional<AgentShip> leader() {
        var leaderId = leaderId();
        return leaderId == null ? Optional.empty() : directory.apply(leaderId);
    }

    private void refreshFrame() {
        var leader = leader();
        if (leader.isEmpty()) {
            return;
        }
        center.set(leader.get().position());
        var heading = Vectors.normalizeOrZero(leader.get().forward());
        if (Vectors.lengthSquared(heading) > Vectors.EPSILON_SQUARED) {
            direction.set(heading);
        }
    }

    private Point3f slotPosition(int index) {
        if (offsets == null || offsets.size() != members.size()) {
            offsets = FormationGeometry.localOffsets(type, members.size(), baseScale * spread);
        }
        return FormationGeometry.toWorld(offsets.get(index), center, direction);
    }

    private void fireFormationChanged(FormationType previous, FormationType current) {
        for (var listener : listeners) {
            listener.onFormationChanged(this, previous, current);
        }
    }

    @Override
    public synchronized String toString() {
        return String.format("Formation[%s %s members=%d scale=%.2f]", id, type, members.size(), baseScale * spread);
    }
}
