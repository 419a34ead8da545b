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
import com.hellblazer.armada.agent.ShipType;
import com.hellblazer.armada.comms.MessagePayload.Acknowledgement;
import com.hellblazer.armada.comms.MessagePayload.CoordinatedAttack;
import com.hellblazer.armada.comms.MessagePayload.Engagement;
import com.hellblazer.armada.comms.MessagePayload.FormationOrder;
import com.hellblazer.armada.comms.MessagePayload.Intel;
import com.hellblazer.armada.comms.MessagePayload.Status;
import com.hellblazer.armada.comms.MessagePayload.TacticalOrder;
import com.hellblazer.armada.comms.MessagePayload.TargetSighting;
import com.hellblazer.armada.formation.FormationMember;
import com.hellblazer.armada.geometry.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Default reaction table, one branch per {@link MessageType}.
 * <p>
 * Reactions read and write the shared stores through the receiver's context. A message whose sender is no longer
 * registered, or whose payload does not fit, is ignored with a debug log.
 *
 * @author hal.hildebrand
 */
public class MessageReactions implements MessageHandler {

    public static final float SUPPORT_THRESHOLD     = 0.5f;
    public static final float SUPPORT_RANGE         = 200.0f;
    public static final float LOSS_THREAT_INCREASE  = 0.3f;
    public static final float LOSS_VICINITY         = 100.0f;
    public static final float LOSS_AGGRESSION_BONUS = 0.2f;
    public static final String EN_ROUTE             = "en_route";
    public static final String PROVIDING_ESCORT     = "providing_escort";

    private static final Logger log = LoggerFactory.getLogger(MessageReactions.class);

    /**
     * How strongly a receiver should answer a support request.
     *
     * @param requesterHealthRatio requester's health in [0, 1]
     * @param distance             receiver to requester
     * @param requesterType        requester's ship type
     * @return priority in [0, 1]
     */
    public static float supportPriority(float requesterHealthRatio, float distance, ShipType requesterType) {
        float urgency = 1.0f - Vectors.clamp01(requesterHealthRatio);
        float proximity = 1.0f - Math.min(1.0f, distance / SUPPORT_RANGE);
        return 0.4f * urgency + 0.3f * proximity + 0.3f * requesterType.supportPriority();
    }

    @Override
    public void handle(AgentShip receiver, AgentMessage message) {
        switch (message.type()) {
            case TARGET_SIGHTED -> onTargetSighted(receiver, message);
            case REQUEST_SUPPORT -> onSupportRequest(receiver, message);
            case ENGAGING_TARGET -> onEngagement(receiver, message);
            case ALLY_DESTROYED -> onAllyDestroyed(receiver, message);
            case FORMATION_ORDER -> onFormationOrder(receiver, message);
            case TACTICAL_ORDER -> message.payload(TacticalOrder.class)
                                          .ifPresent(o -> receiver.executeTacticalOrder(o.maneuver(),
                                                                                        message.position()));
            case STATUS_UPDATE -> message.payload(Status.class)
                                         .ifPresent(s -> receiver.context().allies().update(s.status()));
            case INTEL_REPORT -> message.payload(Intel.class)
                                        .ifPresent(i -> receiver.context().intel().process(i.report()));
            case COORDINATED_ATTACK -> message.payload(CoordinatedAttack.class)
                                              .ifPresent(c -> receiver.onCoordinatedAttack(c.phase(),
                                                                                           message.sender()));
            case REQUEST_ESCORT -> onEscortRequest(receiver, message);
            case SUPPORT_CONFIRMED, ESCORT_CONFIRMED -> log.trace("{} acknowledged by {}", receiver.id(),
                                                                  message.sender());
        }
    }

    private void onTargetSighted(AgentShip receiver, AgentMessage message) {
        var sighting = message.payload(TargetSighting.class);
        if (sighting.isEmpty()) {
            return;
        }
        var context = receiver.context();
        context.threats()
               .updateThreat(message.position(), sighting.get().confidence(), sighting.get().targetVelocity(),
                             sighting.get().targetHealth(), context.clock().now());
        context.formations().formationOf(message.sender()).ifPresent(f -> f.setDestination(message.position()));
    }

    private void onSupportRequest(AgentShip receiver, AgentMessage message) {
        var requester = sender(receiver, message);
        if (requester.isEmpty() || !canLeaveFormation(receiver)) {
            return;
        }
        float priority = supportPriority(requester.get().healthRatio(), receiver.distanceTo(requester.get()),
                                         requester.get().shipType());
        if (priority <= SUPPORT_THRESHOLD) {
            return;
        }
        log.debug("{} answering support request from {} ({})", receiver.id(), message.sender(), priority);
        receiver.endpoint()
                .send(AgentMessage.direct(MessageType.SUPPORT_CONFIRMED, receiver.id(), message.sender(),
                                          receiver.position(), new Acknowledgement(EN_ROUTE)));
        receiver.respondToSupport(message.sender(), message.position());
    }

    private void onEngagement(AgentShip receiver, AgentMessage message) {
        var engagement = message.payload(Engagement.class);
        var formation = receiver.context().formations().formationOf(message.sender());
        if (engagement.isEmpty() || formation.isEmpty()) {
            return;
        }
        formation.get().setDestination(message.position());
        var engager = sender(receiver, message);
        if (engager.isPresent() && engager.get().target() != null
        && engager.get().target().id().equals(engagement.get().targetId())) {
            formation.get().retarget(engager.get().target(), message.sender());
        }
    }

    private void onAllyDestroyed(AgentShip receiver, AgentMessage message) {
        var context = receiver.context();
        context.threats().increaseThreatLevel(message.position(), LOSS_THREAT_INCREASE, context.clock().now());
        if (receiver.isInRange(message.position(), LOSS_VICINITY)) {
            receiver.nudgeAggressiveness(LOSS_AGGRESSION_BONUS);
        }
    }

    private void onFormationOrder(AgentShip receiver, AgentMessage message) {
        var order = message.payload(FormationOrder.class);
        var formation = receiver.formation();
        if (order.isEmpty() || formation.isEmpty()) {
            return;
        }
        if (order.get().order() == FormationOrder.Order.BREAK_FORMATION) {
            receiver.context().formations().leave(receiver.id());
            return;
        }
        formation.get().applyOrder(message, order.get());
    }

    private void onEscortRequest(AgentShip receiver, AgentMessage message) {
        if (!receiver.isAvailableForEscort() || sender(receiver, message).isEmpty()) {
            return;
        }
        receiver.endpoint()
                .send(AgentMessage.direct(MessageType.ESCORT_CONFIRMED, receiver.id(), message.sender(),
                                          receiver.position(), new Acknowledgement(PROVIDING_ESCORT)));
        receiver.escort(message.sender(), message.position());
    }

    private Optional<AgentShip> sender(AgentShip receiver, AgentMessage message) {
        var sender = receiver.context().hub().lookup(message.sender());
        if (sender.isEmpty()) {
            log.debug("{} from unregistered sender {} ignored by {}", message.type(), message.sender(),
                      receiver.id());
        }
        return sender;
    }

    private boolean canLeaveFormation(AgentShip receiver) {
        var formation = receiver.formation();
        if (formation.isEmpty()) {
            return true;
        }
        var f = formation.get();
        return FormationMember.canBreakFormation(f.indexOf(receiver.id()), f.size());
    }
}
