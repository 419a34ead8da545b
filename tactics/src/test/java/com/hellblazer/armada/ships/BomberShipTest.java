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
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
class BomberShipTest {

    private CombatIntentSink intents;
    private PlayerBody       player;
    private AgentContext     context;

    @BeforeEach
    void setUp() {
        intents = mock(CombatIntentSink.class);
        player = new PlayerBody(0, 0, 100);
        context = AgentContext.create(EngineConfig.defaultConfig(), WorldView.of(player), intents, 11L);
    }

    @Test
    void testChargedShotFiresAfterDelay() {
        var bomber = new BomberShip(new Point3f(), context);
        bomber.activate();
        bomber.setTarget(player);

        for (int i = 0; i < 3; i++) {
            bomber.update(0.5f);
            assertTrue(bomber.isCharging(), "tick " + i);
            assertFalse(bomber.canAttack());
        }
        verify(intents, never()).fire(any());

        bomber.update(0.5f);
        assertFalse(bomber.isCharging());
        verify(intents).fire(argThat(intent -> intent.projectileClass() == ProjectileClass.HEAVY));
        assertEquals(-BomberShip.RECOIL, bomber.velocity().z, 1e-3f);
        assertFalse(bomber.isWeaponReady());
    }

    @Test
    void testChargeIsHeldStill() {
        var bomber = new BomberShip(new Point3f(), context);
        bomber.setTarget(player);
        bomber.navigator().setDestination(new Point3f(0, 0, 300));
        bomber.attack();

        assertTrue(bomber.isCharging());
        assertFalse(bomber.navigator().hasPath());
        bomber.attack();
        assertTrue(bomber.isCharging());
    }

    @Test
    void testEvasionCancelsCharge() {
        var bomber = new BomberShip(new Point3f(), context);
        bomber.setTarget(player);
        bomber.attack();

        bomber.performEvasion(0.1f);
        assertFalse(bomber.isCharging());
        var destination = bomber.navigator().destination().orElseThrow();
        assertEquals(-BomberShip.RETREAT_DISTANCE, destination.z, 1e-3f);
    }

    @Test
    void testCoverBehindAlly() {
        var bomber = new BomberShip(new Point3f(50, 0, 0), context);
        var ally = new FighterShip(new Point3f(0, 0, 10), context);
        bomber.updateNearbyAllies(List.of(ally), 500);

        var cover = bomber.coverPosition(player.position());
        assertEquals(0, cover.x, 1e-3f);
        assertEquals(-20, cover.z, 1e-3f);
    }

    @Test
    void testBombardmentWaitsForWing() {
        var bomber = new BomberShip(new Point3f(), context);
        var wingman = new BomberShip(new Point3f(30, 0, 0), context);
        bomber.setTarget(player);
        bomber.updateNearbyAllies(List.of(new FighterShip(new Point3f(-30, 0, 0), context)), 500);

        bomber.coordinateAttack();
        assertFalse(bomber.isCharging());

        wingman.setTarget(player);
        wingman.attack();
        bomber.updateNearbyAllies(List.of(wingman), 500);
        bomber.coordinateAttack();
        assertFalse(bomber.isCharging());

        var ready = new BomberShip(new Point3f(-30, 0, 0), context);
        bomber.updateNearbyAllies(List.of(ready), 500);
        bomber.coordinateAttack();
        assertTrue(bomber.isCharging());
        assertEquals(1, bomber.endpoint().pendingOutbound());
    }
}
