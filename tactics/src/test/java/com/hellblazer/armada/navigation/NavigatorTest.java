package com.hellblazer.armada.navigation;

import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.ships.FighterShip;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class NavigatorTest {

    private AgentContext context;
    private FighterShip  ship;

    @BeforeEach
    void setUp() {
        context = AgentContext.create(EngineConfig.defaultConfig());
        ship = new FighterShip(new Point3f(), context);
    }

    @Test
    void testSetDestinationPlansPath() {
        var navigator = ship.navigator();
        assertFalse(navigator.hasPath());
        assertTrue(navigator.hasReachedDestination());

        navigator.setDestination(new Point3f(0, 0, 240));
        assertTrue(navigator.hasPath());
        assertEquals(3, navigator.remainingWaypoints());
        assertEquals(new Point3f(0, 0, 80), navigator.currentWaypoint().orElseThrow());
        assertEquals(240, navigator.distanceToDestination(), 1e-4f);
        assertEquals(3.0f, navigator.estimatedTimeToDestination(), 1e-4f);
    }

    @Test
    void testFollowingPathReachesDestination() {
        var navigator = ship.navigator();
        var destination = new Point3f(0, 0, 200);
        navigator.setDestination(destination);
        for (int i = 0; i < 400 && navigator.hasPath(); i++) {
            navigator.update(0.05f);
            ship.position().scaleAdd(0.05f, ship.velocity(), ship.position());
        }
        assertFalse(navigator.hasPath());
        assertTrue(navigator.hasReachedDestination());
        assertEquals(0.0f, ship.velocity().length(), 1e-6f);
    }

    @Test
    void testStopClearsPath() {
        var navigator = ship.navigator();
        navigator.setDestination(new Point3f(0, 0, 300));
        navigator.update(0.1f);
        navigator.stop();
        assertFalse(navigator.hasPath());
        assertEquals(0.0f, ship.velocity().length(), 1e-6f);
        assertTrue(navigator.destination().isPresent());
    }

    @Test
    void testArrivalThresholdValidated() {
        assertThrows(IllegalArgumentException.class, () -> ship.navigator().setArrivalThreshold(0));
        ship.navigator().setArrivalThreshold(50);
        ship.navigator().setDestination(new Point3f(0, 0, 40));
        assertTrue(ship.navigator().hasReachedDestination());
    }

    @Test
    void testSegmentIntersectsSphere() {
        assertTrue(Navigator.segmentIntersectsSphere(new Point3f(), new Point3f(0, 0, 100), new Point3f(5, 0, 50),
                                                     10));
        assertFalse(Navigator.segmentIntersectsSphere(new Point3f(), new Point3f(0, 0, 100),
                                                      new Point3f(50, 0, 50), 10));
        assertFalse(Navigator.segmentIntersectsSphere(new Point3f(), new Point3f(0, 0, 100),
                                                      new Point3f(0, 0, 130), 10));
    }

    @Test
    void testAvoidsAllyDeadAhead() {
        var blocker = new FighterShip(new Point3f(0, 0, 25), context);
        ship.updateNearbyAllies(List.of(blocker), 100);
        var avoidance = ship.navigator().avoidance();
        assertTrue(avoidance.length() > 0.99f);
        assertTrue(Math.abs(avoidance.x) > 0.5f || Math.abs(avoidance.y) > 0.5f, avoidance.toString());

        ship.updateNearbyAllies(List.of(), 100);
        assertEquals(0.0f, ship.navigator().avoidance().length(), 1e-6f);
    }
}
