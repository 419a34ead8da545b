package com.hellblazer.armada.knowledge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class AllyTrackerTest {

    private AllyTracker tracker;

    private static AllyStatus status(UUID id, float health, float x, boolean inCombat) {
        return new AllyStatus(id, health, new Point3f(x, 0, 0), new Vector3f(), inCombat, 1.0f, 0.0);
    }

    @BeforeEach
    void setUp() {
        tracker = new AllyTracker();
    }

    @Test
    void testLatestStatusWins() {
        var id = UUID.randomUUID();
        tracker.update(status(id, 1.0f, 0, false));
        tracker.update(status(id, 0.4f, 10, true));

        assertEquals(1, tracker.size());
        var latest = tracker.status(id).orElseThrow();
        assertEquals(0.4f, latest.healthRatio(), 1e-6f);
        assertTrue(latest.inCombat());
    }

    @Test
    void testStoredStatusCannotBeMutatedThroughAccessors() {
        var id = UUID.randomUUID();
        tracker.update(status(id, 1.0f, 10, false));
        tracker.status(id).orElseThrow().position().set(999, 999, 999);
        tracker.status(id).orElseThrow().velocity().set(5, 5, 5);

        var stored = tracker.status(id).orElseThrow();
        assertEquals(new Point3f(10, 0, 0), stored.position());
        assertEquals(new Vector3f(), stored.velocity());
    }

    @Test
    void testAlliesInCombat() {
        tracker.update(status(UUID.randomUUID(), 1.0f, 0, true));
        tracker.update(status(UUID.randomUUID(), 1.0f, 50, false));
        tracker.update(status(UUID.randomUUID(), 1.0f, 500, true));

        assertEquals(1, tracker.alliesInCombat(new Point3f(), 100).size());
        assertEquals(2, tracker.alliesInCombat(new Point3f(), 1000).size());
    }

    @Test
    void testWeakestAlly() {
        assertTrue(tracker.weakestAlly().isEmpty());
        var weak = UUID.randomUUID();
        tracker.update(status(UUID.randomUUID(), 0.9f, 0, false));
        tracker.update(status(weak, 0.1f, 0, false));
        tracker.update(status(UUID.randomUUID(), 0.5f, 0, false));

        assertEquals(weak, tracker.weakestAlly().orElseThrow().agentId());
    }

    @Test
    void testRemoveAndClear() {
        var id = UUID.randomUUID();
        tracker.update(status(id, 1.0f, 0, false));
        tracker.update(status(UUID.randomUUID(), 1.0f, 0, false));
        tracker.remove(id);
        assertTrue(tracker.status(id).isEmpty());
        assertEquals(1, tracker.snapshot().size());
        tracker.clear();
        assertEquals(0, tracker.size());
    }
}
