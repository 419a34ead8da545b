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

/**
 * Kinds of inter-agent message, each bound to the payload record it carries.
 *
 * @author hal.hildebrand
 */
public enum MessageType {
    TARGET_SIGHTED(MessagePayload.TargetSighting.class),
    REQUEST_SUPPORT(MessagePayload.SupportRequest.class),
    SUPPORT_CONFIRMED(MessagePayload.Acknowledgement.class),
    ENGAGING_TARGET(MessagePayload.Engagement.class),
    ALLY_DESTROYED(MessagePayload.LossReport.class),
    FORMATION_ORDER(MessagePayload.FormationOrder.class),
    TACTICAL_ORDER(MessagePayload.TacticalOrder.class),
    STATUS_UPDATE(MessagePayload.Status.class),
    COORDINATED_ATTACK(MessagePayload.CoordinatedAttack.class),
    REQUEST_ESCORT(MessagePayload.EscortRequest.class),
    ESCORT_CONFIRMED(MessagePayload.Acknowledgement.class),
    INTEL_REPORT(MessagePayload.Intel.class);

    private final Class<? extends MessagePayload> payloadType;

    MessageType(Class<? extends MessagePayload> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends MessagePayload> payloadType() {
        return payloadType;
    }

    public boolean accepts(MessagePayload payload) {
        return payloadType.isInstance(payload);
    }
}
