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

import com.hellblazer.armada.formation.FormationType;
import com.hellblazer.armada.knowledge.AllyStatus;
import com.hellblazer.armada.knowledge.IntelReport;

import javax.vecmath.Vector3f;
import java.util.Objects;
import java.util.UUID;

/**
 * Closed set of message bodies. Every {@link MessageType} is bound to exactly one of these records.
 *
 * @author hal.hildebrand
 */
public sealed interface MessagePayload
permits MessagePayload.TargetSighting, MessagePayload.SupportRequest, MessagePayload.Acknowledgement,
        MessagePayload.Engagement, MessagePayload.LossReport, MessagePayload.FormationOrder,
        MessagePayload.TacticalOrder, MessagePayload.Status, MessagePayload.CoordinatedAttack,
        MessagePayload.EscortRequest, MessagePayload.Intel {

    /**
     * A hostile was seen at the message position.
     *
     * @param targetId       the sighted body
     * @param targetHealth   its observed health
     * @param targetVelocity its observed velocity
     * @param confidence     sighting confidence in [0, 1]
     */
    record TargetSighting(UUID targetId, float targetHealth, Vector3f targetVelocity, float confidence)
    implements MessagePayload {
        public TargetSighting {
            targetVelocity = targetVelocity == null ? new Vector3f() : new Vector3f(targetVelocity);
        }

        @Override
        public Vector3f targetVelocity() {
            return new Vector3f(targetVelocity);
        }
    }

    /**
     * The sender is engaging {@code targetId} and wants help.
     */
    record SupportRequest(UUID targetId) implements MessagePayload {
    }

    /**
     * Reply to a support or escort request.
     */
    record Acknowledgement(String note) implements MessagePayload {
        public Acknowledgement {
            Objects.requireNonNull(note, "note");
        }
    }

    /**
     * The sender has engaged {@code targetId}.
     */
    record Engagement(UUID targetId) implements MessagePayload {
    }

    /**
     * An allied craft was lost at the message position.
     */
    record LossReport(UUID lostAgentId) implements MessagePayload {
    }

    /**
     * Formation command.
     *
     * @param order             what to do
     * @param formationType     new geometry for {@link Order#CHANGE_FORMATION}, otherwise ignored
     * @param spacingMultiplier scale factor for {@link Order#SPREAD_OUT} and {@link Order#CLOSE_RANKS}
     */
    record FormationOrder(Order order, FormationType formationType, float spacingMultiplier)
    implements MessagePayload {
        public static final float DEFAULT_SPACING_MULTIPLIER = 1.25f;

        public FormationOrder {
            Objects.requireNonNull(order, "order");
            if (order == Order.CHANGE_FORMATION && formationType == null) {
                throw new IllegalArgumentException("Formation change requires a formation type");
            }
            if (!(spacingMultiplier > 0.0f)) {
                throw new IllegalArgumentException("Spacing multiplier must be positive: " + spacingMultiplier);
            }
        }

        public static FormationOrder change(FormationType type) {
            return new FormationOrder(Order.CHANGE_FORMATION, type, DEFAULT_SPACING_MULTIPLIER);
        }

        public static FormationOrder of(Order order) {
            return new FormationOrder(order, null, DEFAULT_SPACING_MULTIPLIER);
        }

        public enum Order {
            CHANGE_FORMATION, SPREAD_OUT, CLOSE_RANKS, BREAK_FORMATION
        }
    }

    /**
     * Group maneuver aimed at the message position.
     */
    record TacticalOrder(Maneuver maneuver) implements MessagePayload {
        public TacticalOrder {
            Objects.requireNonNull(maneuver, "maneuver");
        }

        public enum Maneuver {
            DIRECT_ASSAULT, FLANKING_MANEUVER, DEFENSIVE_FORMATION, HIT_AND_RUN
        }
    }

    record Status(AllyStatus status) implements MessagePayload {
        public Status {
            Objects.requireNonNull(status, "status");
        }
    }

    /**
     * Synchronization signal for a combined strike.
     */
    record CoordinatedAttack(Phase phase) implements MessagePayload {
        public CoordinatedAttack {
            Objects.requireNonNull(phase, "phase");
        }

        public enum Phase {
            BOMBARDMENT_READY, INTERCEPTOR_STRIKE, FLANKING_COMPLETE
        }
    }

    /**
     * The sender is retreating and asks for an escort.
     *
     * @param healthRatio sender's health at the time of the request
     */
    record EscortRequest(float healthRatio) implements MessagePayload {
    }

    record Intel(IntelReport report) implements MessagePayload {
        public Intel {
            Objects.requireNonNull(report, "report");
        }
    }
}
