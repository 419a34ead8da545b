package com.hellblazer.armada.comms;

import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.PlayerBody;
import com.hellblazer.armada.agent.ShipType;
import com.hellblazer.armada.comms.MessagePayload.EscortRequest;
import com.hellblazer.armada.comms.MessagePayload.FormationOrder;
import com.hellblazer.armada.comms.MessagePayload.LossReport;
import com.hellblazer.armada.comms.MessagePayload.SupportRequest;
import com.hellblazer.armada.comms.MessagePayload.TacticalOrder;
import com.hellblazer.armada.comms.MessagePayload.TargetSighting;
import com.hellblazer.armada.formation.FormationType;
import com.hellblazer.armada.knowledge.AllyStatus;
import com.hellblazer.armada.knowledge.IntelReport;
import com.hellblazer.armada.ships.BomberShip;
import com.hellblazer.armada.ships.FighterShip;
import com.hellblazer.armada.ships.InterceptorShip;
import com.hellblazer.armada.state.SupportState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
class MessageReactionsTest {

    private AgentContext     context;
    private MessageReactions reactions;

    @BeforeEach
    void setUp() {
        context = AgentContext.create(EngineConfig.builder().withCommunicationRange(500).build());
        reactions = new MessageReactions();
    }

    private FighterShip fighter(float x) {
        var ship = new FighterShip(new Point3f(x, 0, 0), context);
        context.hub().register(ship);
        return ship;
    }

    @Test
    void testSupportPriority() {
        assertEquals(0.77f, MessageReactions.supportPriority(0.2f, 100, ShipType.BOMBER), 1e-5f);
        assertEquals(0.12f, MessageReactions.supportPriority(1.0f, 400, ShipType.INTERCEPTOR), 1e-5f);
        assertEquals(0.45f, MessageReactions.supportPriority(1.0f, 0, ShipType.COMMANDER), 1e-5f);
    }

    @Test
    void testAllyLossRaisesThreatAndNearbyAggression() {
        var near = fighter(0);
        var far = fighter(300);
        var lossAt = new Point3f(50, 0, 0);
        var loss = AgentMessage.broadcast(MessageType.ALLY_DESTROYED, UUID.randomUUID(), lossAt,
                                          new LossReport(UUID.randomUUID()));

        reactions.handle(near, loss);
        assertEquals(0.3f, context.threats().threatAt(lossAt).orElseThrow().level(), 1e-6f);
        assertEquals(0.8f, near.aggressiveness(), 1e-6f);

        reactions.handle(far, loss);
        assertEquals(0.6f, context.threats().threatAt(lossAt).orElseThrow().level(), 1e-6f);
        assertEquals(0.6f, far.aggressiveness(), 1e-6f);
    }

    @Test
    void testTargetSightingUpdatesThreatsAndSenderFormation() {
        var leader = fighter(0);
        var receiver = fighter(50);
        var formation = context.formations().create(FormationType.V_FORMATION, new Point3f());
        context.formations().join(formation.id(), leader.id());

        var seen = new Point3f(0, 0, 300);
        var sighting = AgentMessage.broadcast(MessageType.TARGET_SIGHTED, leader.id(), seen,
                                              new TargetSighting(UUID.randomUUID(), 70, new Vector3f(1, 0, 0),
                                                                 0.9f));
        reactions.handle(receiver, sighting);

        var threat = context.threats().threatAt(seen).orElseThrow();
        assertEquals(0.9f, threat.level(), 1e-6f);
        assertEquals(70, threat.health(), 1e-6f);
        assertEquals(seen, formation.destination().orElseThrow());
        assertEquals(seen, leader.navigator().destination().orElseThrow());
    }

    @Test
    void testUrgentSupportRequestIsAnswered() {
        var requester = new BomberShip(new Point3f(100, 0, 0), context);
        context.hub().register(requester);
        requester.takeDamage(120);
        var receiver = fighter(0);

        var request = AgentMessage.broadcast(MessageType.REQUEST_SUPPORT, requester.id(), requester.position(),
                                             new SupportRequest(UUID.randomUUID()));
        reactions.handle(receiver, request);

        assertTrue(receiver.stateMachine().isInState(SupportState.class));
        assertEquals(1, receiver.endpoint().pendingOutbound());

        var listener = mock(MessageListener.class);
        receiver.endpoint().addListener(listener);
        receiver.endpoint().update(1.0f);
        verify(listener).onSent(argThat(m -> m.type() == MessageType.SUPPORT_CONFIRMED
                                             && requester.id().equals(m.target())
                                             && m.payload(MessagePayload.Acknowledgement.class)
                                                 .map(a -> a.note().equals(MessageReactions.EN_ROUTE))
                                                 .orElse(false)));
        assertEquals(1, requester.endpoint().pendingInbound());
    }

    @Test
    void testLowPrioritySupportRequestIsIgnored() {
        var requester = new InterceptorShip(new Point3f(400, 0, 0), context);
        context.hub().register(requester);
        var receiver = fighter(0);

        reactions.handle(receiver, AgentMessage.broadcast(MessageType.REQUEST_SUPPORT, requester.id(),
                                                          requester.position(),
                                                          new SupportRequest(UUID.randomUUID())));
        assertFalse(receiver.stateMachine().isInState(SupportState.class));
        assertEquals(0, receiver.endpoint().pendingOutbound());
    }

    @Test
    void testUnknownSenderIsIgnored() {
        var receiver = fighter(0);
        reactions.handle(receiver, AgentMessage.broadcast(MessageType.REQUEST_SUPPORT, UUID.randomUUID(),
                                                          new Point3f(10, 0, 0),
                                                          new SupportRequest(UUID.randomUUID())));
        reactions.handle(receiver, AgentMessage.broadcast(MessageType.REQUEST_ESCORT, UUID.randomUUID(),
                                                          new Point3f(10, 0, 0), new EscortRequest(0.1f)));
        assertEquals(0, receiver.endpoint().pendingOutbound());
        assertNull(receiver.stateMachine().currentState());
    }

    @Test
    void testFormationLeaderHoldsStation() {
        var requester = new BomberShip(new Point3f(50, 0, 0), context);
        context.hub().register(requester);
        requester.takeDamage(120);
        var leader = fighter(0);
        var formation = context.formations().create(FormationType.LINE, new Point3f());
        context.formations().join(formation.id(), leader.id());
        context.formations().join(formation.id(), fighter(20).id());

        reactions.handle(leader, AgentMessage.broadcast(MessageType.REQUEST_SUPPORT, requester.id(),
                                                        requester.position(), new SupportRequest(null)));
        assertEquals(0, leader.endpoint().pendingOutbound());
        assertFalse(leader.stateMachine().isInState(SupportState.class));
    }

    @Test
    void testFormationOrderAppliesOncePerMessage() {
        var ships = new FighterShip[] { fighter(0), fighter(20), fighter(40) };
        var formation = context.formations().create(FormationType.LINE, new Point3f());
        for (var ship : ships) {
            context.formations().join(formation.id(), ship.id());
        }
        var order = AgentMessage.broadcast(MessageType.FORMATION_ORDER, ships[0].id(), ships[0].position(),
                                           FormationOrder.of(FormationOrder.Order.CLOSE_RANKS));
        for (var ship : ships) {
            reactions.handle(ship, order);
        }
        assertEquals(0.8f, formation.baseScale(), 1e-6f);

        var change = AgentMessage.broadcast(MessageType.FORMATION_ORDER, ships[0].id(), ships[0].position(),
                                            FormationOrder.change(FormationType.DIAMOND));
        reactions.handle(ships[1], change);
        assertEquals(FormationType.DIAMOND, formation.type());
    }

    @Test
    void testInterleavedFormationOrdersApplyOnceEach() {
        var ships = new FighterShip[] { fighter(0), fighter(20), fighter(40) };
        var formation = context.formations().create(FormationType.LINE, new Point3f());
        for (var ship : ships) {
            context.formations().join(formation.id(), ship.id());
        }
        var first = AgentMessage.broadcast(MessageType.FORMATION_ORDER, ships[0].id(), ships[0].position(),
                                           FormationOrder.of(FormationOrder.Order.SPREAD_OUT)).stamped(1.0);
        var second = AgentMessage.broadcast(MessageType.FORMATION_ORDER, ships[0].id(), ships[0].position(),
                                            FormationOrder.of(FormationOrder.Order.SPREAD_OUT)).stamped(2.0);
        for (var ship : ships) {
            reactions.handle(ship, first);
            reactions.handle(ship, second);
        }
        assertEquals(1.25f * 1.25f, formation.baseScale(), 1e-5f);
    }

    @Test
    void testBreakFormationRemovesReceiver() {
        var leader = fighter(0);
        var wing = fighter(20);
        var formation = context.formations().create(FormationType.LINE, new Point3f());
        context.formations().join(formation.id(), leader.id());
        context.formations().join(formation.id(), wing.id());

        reactions.handle(wing, AgentMessage.broadcast(MessageType.FORMATION_ORDER, leader.id(), leader.position(),
                                                      FormationOrder.of(FormationOrder.Order.BREAK_FORMATION)));
        assertTrue(wing.formation().isEmpty());
        assertEquals(1, formation.size());
        assertTrue(leader.formation().isPresent());
    }

    @Test
    void testEngagementRetargetsFormation() {
        var player = new PlayerBody(0, 0, 120);
        var engager = fighter(0);
        var wing = fighter(20);
        var formation = context.formations().create(FormationType.LINE, new Point3f());
        context.formations().join(formation.id(), engager.id());
        context.formations().join(formation.id(), wing.id());
        engager.setTarget(player);

        reactions.handle(wing, AgentMessage.broadcast(MessageType.ENGAGING_TARGET, engager.id(), player.position(),
                                                      new MessagePayload.Engagement(player.id())));
        assertSame(player, wing.target());
        assertEquals(player.position(), formation.destination().orElseThrow());
    }

    @Test
    void testEscortRequest() {
        var retreating = fighter(60);
        var escort = fighter(0);
        escort.activate();

        reactions.handle(escort, AgentMessage.broadcast(MessageType.REQUEST_ESCORT, retreating.id(),
                                                        retreating.position(), new EscortRequest(0.2f)));
        assertTrue(escort.stateMachine().isInState(SupportState.class));

        var listener = mock(MessageListener.class);
        escort.endpoint().addListener(listener);
        escort.endpoint().update(1.0f);
        verify(listener).onSent(argThat(m -> m.type() == MessageType.ESCORT_CONFIRMED));
    }

    @Test
    void testStatusIntelAndTacticalOrders() {
        var receiver = fighter(0);
        var other = UUID.randomUUID();
        var status = new AllyStatus(other, 0.4f, new Point3f(10, 0, 0), new Vector3f(), true, 1.0f, 2.0);
        reactions.handle(receiver, AgentMessage.broadcast(MessageType.STATUS_UPDATE, other, status.position(),
                                                          new MessagePayload.Status(status)));
        assertEquals(0.4f, context.allies().status(other).orElseThrow().healthRatio(), 1e-6f);

        var report = new IntelReport(other, UUID.randomUUID(), new Point3f(0, 0, 200), new Vector3f(), 0.7f, 0.9f,
                                     2.0);
        reactions.handle(receiver, AgentMessage.broadcast(MessageType.INTEL_REPORT, other, report.position(),
                                                          new MessagePayload.Intel(report)));
        assertEquals(1, context.intel().size());

        var point = new Point3f(0, 0, 90);
        reactions.handle(receiver, AgentMessage.broadcast(MessageType.TACTICAL_ORDER, other, point,
                                                          new TacticalOrder(
                                                          TacticalOrder.Maneuver.DIRECT_ASSAULT)));
        assertEquals(point, receiver.navigator().destination().orElseThrow());
    }
}
