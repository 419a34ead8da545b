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

import com.hellblazer.armada.comms.CommunicationHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Membership table: formation id to controller, and agent id to formation id.
 * <p>
 * An agent belongs to at most one formation. Joining a second one is a programming error and fails with
 * {@link IllegalStateException}.
 *
 * @author hal.hildebrand
 */
public class FormationRegistry {

    private static final Logger log = LoggerFactory.getLogger(FormationRegistry.class);

    private final CommunicationHub                directory;
    private final Map<UUID, FormationController>  formations  = new HashMap<>();
    private final Map<UUID, UUID>                 memberships = new HashMap<>();

    public FormationRegistry(CommunicationHub directory) {
        this.directory = directory;
    }

    public synchronized FormationController create(FormationType type, Tuple3f center) {
        var formation = new FormationController(UUID.randomUUID(), type, center, directory::lookup);
        formations.put(formation.id(), formation);
        log.debug("Created {} formation {}", type, formation.id());
        return formation;
    }

    /**
     * Add an agent to a formation. Rejoining the same formation is a no-op.
     *
     * @return true if the agent was added
     * @throws IllegalArgumentException if the formation is unknown
     * @throws IllegalStateException    if the agent already belongs to another formation
     */
    public boolean join(UUID formationId, UUID agentId) {
        FormationController formation;
        synchronized (this) {
            formation = formations.get(formationId);
            if (formation == null) {
                throw new IllegalArgumentException("Unknown formation: " + formationId);
            }
            var current = memberships.get(agentId);
            if (formationId.equals(current)) {
                return false;
            }
            if (current != null) {
                throw new IllegalStateException(
                "Agent " + agentId + " already belongs to formation " + current + ", cannot join " + formationId);
            }
            memberships.put(agentId, formationId);
        }
        formation.addMember(agentId);
        return true;
    }

    /**
     * Remove an agent from whatever formation it is in.
     *
     * @return false if the agent was in no formation
     */
    public boolean leave(UUID agentId) {
        FormationController formation;
        synchronized (this) {
            var formationId = memberships.remove(agentId);
            if (formationId == null) {
                return false;
            }
            formation = formations.get(formationId);
        }
        if (formation != null) {
            formation.removeMember(agentId);
        }
        return true;
    }

    public synchronized Optional<FormationController> formationOf(UUID agentId) {
        var formationId = memberships.get(agentId);
        return formationId == null ? Optional.empty() : Optional.ofNullable(formations.get(formationId));
    }

    public synchronized Optional<FormationController> formation(UUID formationId) {
        return Optional.ofNullable(formations.get(formationId));
    }

    public synchronized Collection<FormationController> formations() {
        return new ArrayList<>(formations.values());
    }

    /**
     * Release every member and forget the formation.
     */
    public void dissolve(UUID formationId) {
        FormationController formation;
        synchronized (this) {
            formation = formations.remove(formationId);
            if (formation == null) {
                return;
            }
            memberships.values().removeIf(formationId::equals);
        }
        for (var member : formation.members()) {
            formation.removeMember(member);
        }
        log.debug("Dissolved formation {}", formationId);
    }

    /**
     * Forget formations that no longer have members.
     *
     * @return number removed
     */
    public int removeEmpty() {
        int removed = 0;
        for (var formation : formations()) {
            if (formation.isEmpty()) {
                dissolve(formation.id());
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return formations.size();
    }
}
