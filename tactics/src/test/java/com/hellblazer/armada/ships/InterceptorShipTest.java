package com.hellblazer.armada.ships;

import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.PlayerBody;
import com.hellblazer.armada.world.AttackIntent.ProjectileClass;
import com.hellblazer.armada.world.CombatIntentSink;
import com.hellblazer.armada.world.WorldView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
class InterceptorShipTest {

    private CombatIntentSink intents;
    private PlayerBody       player;
    private AgentContext     context;

    @BeforeEach
    void setUp() {
        intents = mock(CombatIntentSink.class);
        player = new PlayerBody(0, 0, 50);
        context = AgentContext.create(EngineConfig.defaultConfig(), WorldView.of(player), intents, 3L);
    }

    @Test
    void testInterceptPointOfStationaryTarget() {
        var point = InterceptorShip.interceptPoint(new Point3f(), new Point3f(100, 0, 0), new Vector3f(), 50);
        assertEquals(new Point3f(100, 0, 0), point);
    }

    @Test
    void testInterceptPointLeadsMovingTarget() {
        var from = new Point3f();
        var point = InterceptorShip.interceptPoint(from, new Point3f(100, 0, 0), new Vector3f(0, 10, 0), 50);
        float t = point.y / 10.0f;
        assertTrue(t > 0);
        assertEquals(100, point.x, 1e-3f);
        assertEquals(50 * t, from.distance(point), 1e-2f);
    }

    @Test
    void testUnreachableTargetFallsBackToPosition() {
        var point = InterceptorShip.interceptPoint(new Point3f(), new Point3f(100, 0, 0), new Vector3f(100, 0, 0),
                                                   50);
        assertEquals(new Point3f(100, 0, 0), point);
    }

    @Test
    void testTwinShot() {
        var interceptor = new InterceptorShip(new Point3f(), context);
        interceptor.setTarget(player);
        interceptor.attack();
        verify(intents, times(2)).fire(argThat(intent -> intent.projectileClass() == ProjectileClass.FAST));
    }

    @Test
    void testBoostCycle() {
        var interceptor = new InterceptorShip(new Point3f(), context);
        interceptor.activate();

        assertTrue(interceptor.activateBoost());
        assertFalse(interceptor.activateBoost());
        interceptor.update(0.1f);
        assertTrue(interceptor.isBoosting());
        assertEquals(interceptor.speed() * InterceptorShip.BOOST_MULTIPLIER, interceptor.velocity().length(),
                     1e-2f);

        for (int i = 0; i < 40; i++) {
            interceptor.update(0.1f);
        }
        assertFalse(interceptor.isBoosting());
        assertFalse(interceptor.activateBoost());

        for (int i = 0; i < 90; i++) {
            interceptor.update(0.1f);
        }
        assertTrue(interceptor.activateBoost());
    }

    @Test
    void testInterceptBoostsOnlyAtDistance() {
        var interceptor = new InterceptorShip(new Point3f(), context);
        interceptor.setTarget(player);
        interceptor.intercept();
        assertFalse(interceptor.isBoosting());
        assertEquals(player.position(), interceptor.navigator().destination().orElseThrow());

        player.moveTo(0, 0, 300);
        interceptor.intercept();
        assertTrue(interceptor.isBoosting());
    }

    @Test
    void testStrikeWingTakesStations() {
        var interceptor = new InterceptorShip(new Point3f(), context);
        var partner = new InterceptorShip(new Point3f(20, 0, 0), context);
        interceptor.setTarget(player);
        interceptor.updateNearbyAllies(List.of(partner), 500);

        interceptor.coordinateAttack();
        var station = interceptor.navigator().destination().orElseThrow();
        assertEquals(InterceptorShip.STRIKE_RADIUS, station.distance(player.position()), 1e-3f);
        assertEquals(0, interceptor.endpoint().pendingOutbound());
    }
}
