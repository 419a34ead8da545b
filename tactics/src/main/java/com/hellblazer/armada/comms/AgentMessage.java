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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable inter-agent message.
 * <p>
 * The payload must be the record bound to the message type; anything else is rejected at construction. Messages
 * are created unstamped and receive their timestamp when handed to a {@link CommunicationEndpoint}.
 *
 * @param type      message kind
 * @param sender    originating agent
 * @param target    recipient of a directed message, null when broadcast
 * @param position  position the message refers to
 * @param payload   typed body
 * @param timestamp simulation time the message was sent
 * @param broadcast whether the hub fans the message out by range
 * @param priority  relative importance in [0, 1]
 * @author hal.hildebrand
 */
public record AgentMessage(MessageType type, UUID sender, UUID target, Point3f position, MessagePayload payload,
                           double timestamp, boolean broadcast, float priority) {

    public static final float DEFAULT_PRIORITY = 0.5f;

    public AgentMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(position, "position");
        if (!type.accepts(payload)) {
            throw new IllegalArgumentException(
            "Message type " + type + " requires " + type.payloadType().getSimpleName() + " payload, got " + (
            payload == null ? "null" : payload.getClass().getSimpleName()));
        }
        position = new Point3f(position);
    }

    /**
     * A message to be broadcast from {@code sender} about {@code position}.
     */
    public static AgentMessage broadcast(MessageType type, UUID sender, Tuple3f position, MessagePayload payload) {
        return new AgentMessage(type, sender, null, new Point3f(position), payload, 0.0, true, DEFAULT_PRIORITY);
    }

    /**
     * A message addressed to a single recipient.
     */
    public static AgentMessage direct(MessageType type, UUID sender, UUID target, Tuple3f position,
                                      MessagePayload payload) {
        Objects.requireNonNull(target, "target");
        return new AgentMessage(type, sender, target, new Point3f(position), payload, 0.0, false, DEFAULT_PRIORITY);
    }

    @Override
    public Point3f position() {
        return new Point3f(position);
    }

    /**
     * The payload viewed as the expected record type.
     */
    public <T extends MessagePayload> Optional<T> payload(Class<T> expected) {
        return expected.isInstance(payload) ? Optional.of(expected.cast(payload)) : Optional.empty();
    }

    public AgentMessage stamped(double time) {
        return new AgentMessage(type, sender, target, position, payload, time, broadcast, priority);
    }

    public AgentMessage asBroadcast() {
        return new AgentMessage(type, sender, null, position, payload, timestamp, true, priority);
    }

    public AgentMessage withPriority(float newPriority) {
        return new AgentMessage(type, sender, target, position, payload, timestamp, broadcast, newPriority);
    }

    @Override
    public String toString() {
        return String.format("%s[from=%s%s t=%.2f]", type, sender, broadcast ? " broadcast" : " to=" + target,
                             timestamp);
    }
}
