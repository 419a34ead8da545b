package com.hellblazer.armada.world;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class GameEventFeedTest {

    @Test
    void testDrainReturnsEventsInOrder() {
        var feed = new GameEventFeed(4);
        var first = new GameEvent.DamageTaken(UUID.randomUUID(), 5.0f);
        var second = new GameEvent.AgentDestroyed(UUID.randomUUID());
        assertTrue(feed.publish(first));
        assertTrue(feed.publish(second));

        assertEquals(List.of(first, second), feed.drain());
        assertEquals(0, feed.size());
        assertTrue(feed.drain().isEmpty());
    }

    @Test
    void testOldestDroppedWhenFull() {
        var feed = new GameEventFeed(2);
        var a = new GameEvent.AgentDestroyed(UUID.randomUUID());
        var b = new GameEvent.AgentDestroyed(UUID.randomUUID());
        var c = new GameEvent.AgentDestroyed(UUID.randomUUID());
        feed.publish(a);
        feed.publish(b);
        assertFalse(feed.publish(c));

        assertEquals(1, feed.droppedCount());
        assertEquals(List.of(b, c), feed.drain());
    }

    @Test
    void testRejectsNullAndBadCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new GameEventFeed(0));
        var feed = new GameEventFeed(1);
        assertThrows(IllegalArgumentException.class, () -> feed.publish(null));
    }
}
