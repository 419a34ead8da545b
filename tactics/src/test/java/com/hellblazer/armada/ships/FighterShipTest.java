package com.hellblazer.armada.ships;

import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.PlayerBody;
import com.hellblazer.armada.world.AttackIntent;
import com.hellblazer.armada.world.AttackIntent.ProjectileClass;
import com.hellblazer.armada.world.CombatIntentSink;
import com.hellblazer.armada.world.WorldView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
class FighterShipTest {

    private CombatIntentSink intents;
    private PlayerBody       player;
    private AgentContext     context;

    @BeforeEach
    void setUp() {
        intents = mock(CombatIntentSink.class);
        player = new PlayerBody(0, 0, 100);
        context = AgentContext.create(EngineConfig.defaultConfig(), WorldView.of(player), intents, 7L);
    }

    @Test
    void testBurstFire() {
        var fighter = new FighterShip(new Point3f(), context);
        fighter.setTarget(player);

        fighter.attack();
        assertEquals(1, fighter.burstShots());
        assertFalse(fighter.isWeaponReady());
        fighter.attack();
        assertEquals(2, fighter.burstShots());
        fighter.attack();
        assertEquals(0, fighter.burstShots());

        var captor = ArgumentCaptor.forClass(AttackIntent.class);
        verify(intents, times(3)).fire(captor.capture());
        for (var intent : captor.getAllValues()) {
            assertEquals(ProjectileClass.MEDIUM, intent.projectileClass());
            assertEquals(fighter.id(), intent.shooter());
            assertEquals(player.id(), intent.target());
            assertTrue(intent.direction().z > 0.9f, intent.direction().toString());
        }
    }

    @Test
    void testManeuverPicksOpenFlank() {
        var fighter = new FighterShip(new Point3f(), context);
        var crowding = new FighterShip(new Point3f(-70, 0, 100), context);
        fighter.setTarget(player);
        fighter.updateNearbyAllies(List.of(crowding), 500);

        fighter.performAttackManeuver(0.1f);
        var destination = fighter.navigator().destination().orElseThrow();
        assertEquals(70, destination.x, 1e-3f);
        assertEquals(100, destination.z, 1e-3f);
    }

    @Test
    void testRingStationsAreDistinct() {
        var squad = List.of(new FighterShip(new Point3f(0, 0, 0), context),
                            new FighterShip(new Point3f(10, 0, 0), context),
                            new FighterShip(new Point3f(20, 0, 0), context));
        var center = new Point3f(0, 0, 100);
        var stations = new HashSet<String>();
        for (var fighter : squad) {
            fighter.updateNearbyAllies(squad, 500);
            var station = fighter.ringStation(center);
            assertEquals(fighter.preferredEngagementRange(), station.distance(center), 1e-3f);
            assertTrue(stations.add(String.format("%.2f,%.2f", station.x, station.z)));
        }
    }

    @Test
    void testCoordinatedFlankSignalsOnce() {
        var fighter = new FighterShip(new Point3f(), context);
        var wing = new FighterShip(new Point3f(500, 0, 0), context);
        fighter.setTarget(player);
        fighter.updateNearbyAllies(List.of(wing), 1000);

        var station = fighter.ringStation(player.position());
        fighter.position().set(station);
        var toPlayer = new Vector3f(player.position());
        toPlayer.sub(station);
        toPlayer.normalize();
        fighter.forward().set(toPlayer);

        fighter.coordinateAttack();
        fighter.coordinateAttack();
        assertEquals(1, fighter.endpoint().pendingOutbound());
        verify(intents, atLeastOnce()).fire(any());
    }
}
