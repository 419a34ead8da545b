package com.hellblazer.armada.comms;

import com.hellblazer.armada.comms.MessagePayload.Acknowledgement;
import com.hellblazer.armada.comms.MessagePayload.LossReport;
import com.hellblazer.armada.comms.MessagePayload.SupportRequest;
import com.hellblazer.armada.formation.FormationType;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class AgentMessageTest {

    private final UUID sender = UUID.randomUUID();

    @Test
    void testPayloadMustMatchType() {
        var position = new Point3f();
        assertThrows(IllegalArgumentException.class,
                     () -> AgentMessage.broadcast(MessageType.ALLY_DESTROYED, sender, position,
                                                  new SupportRequest(null)));
        assertThrows(IllegalArgumentException.class,
                     () -> AgentMessage.broadcast(MessageType.STATUS_UPDATE, sender, position, null));
        assertDoesNotThrow(() -> AgentMessage.broadcast(MessageType.ALLY_DESTROYED, sender, position,
                                                        new LossReport(sender)));
    }

    @Test
    void testEveryTypeHasAPayloadBinding() {
        for (var type : MessageType.values()) {
            assertNotNull(type.payloadType(), type.name());
        }
        assertTrue(MessageType.SUPPORT_CONFIRMED.accepts(new Acknowledgement("en_route")));
        assertFalse(MessageType.SUPPORT_CONFIRMED.accepts(new LossReport(sender)));
    }

    @Test
    void testPositionIsDefensivelyCopied() {
        var position = new Point3f(1, 2, 3);
        var message = AgentMessage.broadcast(MessageType.ALLY_DESTROYED, sender, position, new LossReport(sender));
        position.set(9, 9, 9);
        assertEquals(new Point3f(1, 2, 3), message.position());
        message.position().set(7, 7, 7);
        assertEquals(new Point3f(1, 2, 3), message.position());
    }

    @Test
    void testWithers() {
        var target = UUID.randomUUID();
        var direct = AgentMessage.direct(MessageType.SUPPORT_CONFIRMED, sender, target, new Point3f(),
                                         new Acknowledgement("en_route"));
        assertFalse(direct.broadcast());
        assertEquals(AgentMessage.DEFAULT_PRIORITY, direct.priority());

        var stamped = direct.stamped(12.5);
        assertEquals(12.5, stamped.timestamp());
        assertEquals(0.0, direct.timestamp());
        assertTrue(direct.asBroadcast().broadcast());
        assertEquals(0.9f, direct.withPriority(0.9f).priority());
    }

    @Test
    void testTypedPayloadAccess() {
        var message = AgentMessage.broadcast(MessageType.FORMATION_ORDER, sender, new Point3f(),
                                             MessagePayload.FormationOrder.change(FormationType.SPHERE));
        assertTrue(message.payload(MessagePayload.FormationOrder.class).isPresent());
        assertTrue(message.payload(LossReport.class).isEmpty());
    }

    @Test
    void testFormationChangeNeedsType() {
        assertThrows(IllegalArgumentException.class,
                     () -> new MessagePayload.FormationOrder(MessagePayload.FormationOrder.Order.CHANGE_FORMATION,
                                                             null, 1.25f));
        assertThrows(IllegalArgumentException.class,
                     () -> new MessagePayload.FormationOrder(MessagePayload.FormationOrder.Order.SPREAD_OUT, null,
                                                             0.0f));
    }
}
