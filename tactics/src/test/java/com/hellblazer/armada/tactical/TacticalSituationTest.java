package com.hellblazer.armada.tactical;

import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.PlayerBody;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.agent.ShipType;
import com.hellblazer.armada.formation.FormationType;
import com.hellblazer.armada.ships.FighterShip;
import com.hellblazer.armada.ships.InterceptorShip;
import com.hellblazer.armada.ships.ScoutShip;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class TacticalSituationTest {

    private AgentContext context;
    private PlayerBody   player;

    @BeforeEach
    void setUp() {
        context = AgentContext.create(EngineConfig.defaultConfig());
        player = new PlayerBody(0, 0, 100);
    }

    private FighterShip fighter(float x, float z) {
        return new FighterShip(new Point3f(x, 0, z), context);
    }

    @Test
    void testAssess() {
        var situation = TacticalSituation.assess(List.of(fighter(-20, 0), fighter(0, 0), fighter(20, 0)), player);

        float distance = (2 * (float) Math.sqrt(20 * 20 + 100 * 100) + 100) / 3;
        assertEquals(3, situation.allyCount());
        assertTrue(situation.hasTarget());
        assertEquals(1.0f, situation.averageHealth(), 1e-6f);
        assertEquals(distance, situation.averageDistance(), 1e-3f);
        assertEquals(1.0f - 40.0f / 3 / 100, situation.formationIntegrity(), 1e-5f);
        assertEquals((1.0f - distance / 200) / 2, situation.threatLevel(), 1e-5f);
        assertEquals(Set.of(ShipType.FIGHTER), situation.shipTypes());
    }

    @Test
    void testLoneShipWithoutTarget() {
        var situation = TacticalSituation.assess(List.of(fighter(0, 0)), null);
        assertFalse(situation.hasTarget());
        assertEquals(Float.MAX_VALUE, situation.averageDistance());
        assertEquals(1.0f, situation.formationIntegrity());
        assertEquals(0.0f, situation.threatLevel());
        assertEquals(1.0f, situation.spacing());
        assertEquals(0.0f, situation.encirclement());
    }

    @Test
    void testEmptyGroupRejected() {
        assertThrows(IllegalArgumentException.class, () -> TacticalSituation.assess(List.of(), player));
    }

    @Test
    void testFractions() {
        var wounded = fighter(0, 0);
        wounded.takeDamage(60);
        List<AgentShip> group = List.of(wounded, new ScoutShip(new Point3f(10, 0, 0), context),
                                        new InterceptorShip(new Point3f(20, 0, 0), context), fighter(30, 0));
        var situation = TacticalSituation.assess(group, player);

        assertEquals(0.5f, situation.fractionOf(ShipType.SCOUT, ShipType.INTERCEPTOR), 1e-6f);
        assertEquals(0.0f, situation.fractionOf(ShipType.BOMBER), 1e-6f);
        assertEquals(0.25f, situation.fractionBelowHealth(0.5f), 1e-6f);
        assertEquals((80 + 120 + 140 + 80) / 4.0f, situation.averageSpeed(), 1e-4f);
        assertEquals((0.25f + 3) / 4, situation.averageHealth(), 1e-6f);
    }

    @Test
    void testSpacing() {
        assertEquals(1.0f, TacticalSituation.assess(List.of(fighter(0, 0), fighter(40, 0)), player).spacing(), 1e-6f);
        assertEquals(0.5f, TacticalSituation.assess(List.of(fighter(0, 0), fighter(60, 0)), player).spacing(), 1e-6f);
        assertEquals(0.0f, TacticalSituation.assess(List.of(fighter(0, 0), fighter(200, 0)), player).spacing(),
                     1e-6f);
    }

    @Test
    void testEncirclement() {
        var around = TacticalSituation.assess(
        List.of(fighter(50, 100), fighter(0, 150), fighter(-50, 100), fighter(0, 50)), player);
        assertEquals(0.75f, around.encirclement(), 1e-5f);

        var stacked = TacticalSituation.assess(List.of(fighter(0, 0), fighter(0, 10), fighter(0, 20)), player);
        assertEquals(0.0f, stacked.encirclement(), 1e-6f);

        var pair = TacticalSituation.assess(List.of(fighter(50, 100), fighter(-50, 100)), player);
        assertEquals(0.0f, pair.encirclement());
    }

    @Test
    void testCoordinationRewardsFormation() {
        var first = fighter(0, 0);
        var second = fighter(30, 0);
        assertEquals(0.7f, TacticalSituation.assess(List.of(first, second), player).coordination(), 1e-6f);

        var formation = context.formations().create(FormationType.LINE, new Point3f());
        context.formations().join(formation.id(), first.id());
        assertEquals(0.9f, TacticalSituation.assess(List.of(first, second), player).coordination(), 1e-6f);
    }

    @Test
    void testRequirements() {
        List<AgentShip> mixed = List.of(fighter(0, 0), fighter(20, 0),
                                        new InterceptorShip(new Point3f(40, 0, 0), context));
        var situation = TacticalSituation.assess(mixed, player);
        assertTrue(TacticType.FLANKING_MANEUVER.admits(situation));
        assertTrue(TacticType.DIRECT_ASSAULT.admits(situation));
        assertFalse(TacticType.PINCER_MOVEMENT.admits(situation));
        assertFalse(TacticType.HIT_AND_RUN.admits(situation));
        assertFalse(TacticType.SUPPRESSION_BOMBARDMENT.admits(situation));

        var lone = TacticalSituation.assess(List.of(fighter(0, 0)), player);
        assertFalse(TacticType.DIRECT_ASSAULT.admits(lone));
        assertTrue(TacticType.DEFENSIVE_FORMATION.admits(lone));
    }
}
