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
package com.hellblazer.armada.comms;

import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.geometry.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live agents and router of their messages.
 * <p>
 * Broadcasts fan out to every other registered agent whose straight-line distance from the sender is within the
 * communication range (inclusive). Directed messages go to their target if it is registered and are otherwise
 * dropped without error. One hub exists per engine instance.
 *
 * @author hal.hildebrand
 */
public class CommunicationHub {

    private static final Logger log = LoggerFactory.getLogger(CommunicationHub.class);

    private final    Map<UUID, AgentShip> agents = new ConcurrentHashMap<>();
    private volatile float                communicationRange;

    public CommunicationHub(float communicationRange) {
        setCommunicationRange(communicationRange);
    }

    public void register(AgentShip agent) {
        var previous = agents.putIfAbsent(agent.id(), agent);
        if (previous != null && previous != agent) {
            throw new IllegalStateException("Agent id already registered: " + agent.id());
        }
        log.debug("Registered {}", agent.id());
    }

    public void unregister(UUID agentId) {
        if (agents.remove(agentId) != null) {
            log.debug("Unregistered {}", agentId);
        }
    }

    public boolean isRegistered(UUID agentId) {
        return agents.containsKey(agentId);
    }

    public Optional<AgentShip> lookup(UUID agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    public Collection<AgentShip> registered() {
        return new ArrayList<>(agents.values());
    }

    public int size() {
        return agents.size();
    }

    public float getCommunicationRange() {
        return communicationRange;
    }

    public void setCommunicationRange(float range) {
        if (!Float.isFinite(range) || range < 0.0f) {
            throw new IllegalArgumentException("Communication range must be non-negative: " + range);
        }
        this.communicationRange = range;
    }

    /**
     * Deliver to every registered agent in range of the sender, excluding the sender. The range is measured from
     * the sender's current position, or from the message position if the sender is no longer registered.
     *
     * @return number of recipients
     */
    public int broadcast(AgentMessage message) {
        var sender = agents.get(message.sender());
        Tuple3f origin = sender != null ? sender.position() : message.position();
        return deliverNear(origin, communicationRange, message);
    }

    /**
     * Deliver to every registered agent within {@code radius} of {@code origin}, other than the sender.
     *
     * @return number of recipients
     */
    public int deliverNear(Tuple3f origin, float radius, AgentMessage message) {
        var recipients = recipientsNear(origin, radius, message.sender());
        for (var recipient : recipients) {
            recipient.endpoint().receive(message);
        }
        log.trace("{} reached {} recipients", message, recipients.size());
        return recipients.size();
    }

    /**
     * Deliver a directed message.
     *
     * @return false if the target is not registered
     */
    public boolean send(AgentMessage message) {
        var recipient = message.target() == null ? null : agents.get(message.target());
        if (recipient == null) {
            log.debug("No recipient for {}", message);
            return false;
        }
        recipient.endpoint().receive(message);
        return true;
    }

    /**
     * Registered agents within {@code radius} of a point, optionally excluding one.
     */
    public List<AgentShip> recipientsNear(Tuple3f origin, float radius, UUID excluded) {
        var center = new Point3f(origin);
        float radiusSquared = radius * radius;
        var result = new ArrayList<AgentShip>();
        for (var agent : agents.values()) {
            if (agent.id().equals(excluded)) {
                continue;
            }
            if (Vectors.distanceSquared(agent.position(), center) <= radiusSquared) {
                result.add(agent);
            }
        }
        return result;
    }
}
