package com.hellblazer.armada.formation;

import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.ships.BomberShip;
import com.hellblazer.armada.ships.FighterShip;
import com.hellblazer.armada.ships.ScoutShip;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
class FormationRegistryTest {

    private AgentContext      context;
    private FormationRegistry registry;

    @BeforeEach
    void setUp() {
        context = AgentContext.create(EngineConfig.defaultConfig());
        registry = context.formations();
    }

    private <T extends AgentShip> T registered(T ship) {
        context.hub().register(ship);
        return ship;
    }

    @Test
    void testMembershipIsExclusive() {
        var first = registry.create(FormationType.LINE, new Point3f());
        var second = registry.create(FormationType.V_FORMATION, new Point3f());
        var agent = UUID.randomUUID();

        assertTrue(registry.join(first.id(), agent));
        assertFalse(registry.join(first.id(), agent));
        assertThrows(IllegalStateException.class, () -> registry.join(second.id(), agent));
        assertThrows(IllegalArgumentException.class, () -> registry.join(UUID.randomUUID(), agent));

        assertEquals(first, registry.formationOf(agent).orElseThrow());
        assertEquals(1, first.size());
        assertEquals(0, second.size());
    }

    @Test
    void testLeaveThenJoinElsewhere() {
        var first = registry.create(FormationType.LINE, new Point3f());
        var second = registry.create(FormationType.LINE, new Point3f());
        var agent = UUID.randomUUID();
        registry.join(first.id(), agent);

        assertTrue(registry.leave(agent));
        assertFalse(registry.leave(agent));
        assertTrue(registry.formationOf(agent).isEmpty());
        assertTrue(first.isEmpty());

        assertTrue(registry.join(second.id(), agent));
        assertEquals(second.id(), registry.formationOf(agent).orElseThrow().id());
    }

    @Test
    void testDissolveAndRemoveEmpty() {
        var populated = registry.create(FormationType.BOX, new Point3f());
        var empty = registry.create(FormationType.BOX, new Point3f());
        var a = UUID.randomUUID();
        var b = UUID.randomUUID();
        registry.join(populated.id(), a);
        registry.join(populated.id(), b);

        assertEquals(1, registry.removeEmpty());
        assertTrue(registry.formation(empty.id()).isEmpty());
        assertEquals(1, registry.size());

        registry.dissolve(populated.id());
        assertEquals(0, registry.size());
        assertTrue(registry.formationOf(a).isEmpty());
        assertTrue(registry.formationOf(b).isEmpty());
        assertTrue(populated.isEmpty());
        assertTrue(registry.formations().isEmpty());
    }

    @Test
    void testLosingLeaderElectsBestCandidate() {
        var scout = registered(new ScoutShip(new Point3f(0, 0, 0), context));
        var bomber = registered(new BomberShip(new Point3f(20, 0, 0), context));
        var fighter = registered(new FighterShip(new Point3f(40, 0, 0), context));
        var formation = registry.create(FormationType.V_FORMATION, new Point3f());
        registry.join(formation.id(), scout.id());
        registry.join(formation.id(), bomber.id());
        registry.join(formation.id(), fighter.id());
        var listener = mock(FormationListener.class);
        formation.addListener(listener);

        assertEquals(scout.id(), formation.leaderId());
        assertTrue(FormationController.leadershipScore(fighter) > FormationController.leadershipScore(bomber));

        registry.leave(scout.id());
        assertEquals(fighter.id(), formation.leaderId());
        assertTrue(fighter.isFormationLeader());
        verify(listener).onMemberRemoved(formation, scout.id());
        verify(listener).onLeaderChanged(formation, bomber.id(), fighter.id());
    }

    @Test
    void testDamagedShipsAreNotElected() {
        var scout = registered(new ScoutShip(new Point3f(0, 0, 0), context));
        var bomber = registered(new BomberShip(new Point3f(20, 0, 0), context));
        var fighter = registered(new FighterShip(new Point3f(40, 0, 0), context));
        var formation = registry.create(FormationType.V_FORMATION, new Point3f());
        registry.join(formation.id(), scout.id());
        registry.join(formation.id(), bomber.id());
        registry.join(formation.id(), fighter.id());
        fighter.takeDamage(60);

        registry.leave(scout.id());
        assertEquals(bomber.id(), formation.leaderId());
    }

    @Test
    void testNoEligibleLeaderKeepsFirstInLine() {
        var scout = registered(new ScoutShip(new Point3f(0, 0, 0), context));
        var fighter = registered(new FighterShip(new Point3f(40, 0, 0), context));
        var formation = registry.create(FormationType.LINE, new Point3f());
        registry.join(formation.id(), scout.id());
        registry.join(formation.id(), fighter.id());
        fighter.takeDamage(70);
        var listener = mock(FormationListener.class);
        formation.addListener(listener);

        registry.leave(scout.id());
        assertEquals(fighter.id(), formation.leaderId());
        verify(listener).onLeaderChanged(eq(formation), isNull(), eq(fighter.id()));
        verify(listener, never()).onFormationChanged(any(), any(), any());
    }
}
