package com.hellblazer.armada.tactical;

import com.hellblazer.armada.AIDirector;
import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.PlayerBody;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.agent.Posture;
import com.hellblazer.armada.agent.ShipStats;
import com.hellblazer.armada.formation.FormationType;
import com.hellblazer.armada.ships.BomberShip;
import com.hellblazer.armada.ships.FighterShip;
import com.hellblazer.armada.ships.InterceptorShip;
import com.hellblazer.armada.ships.ScoutShip;
import com.hellblazer.armada.state.AttackState;
import com.hellblazer.armada.state.SupportState;
import com.hellblazer.armada.world.CombatIntentSink;
import com.hellblazer.armada.world.WorldView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * @author hal.hildebrand
 */
class TacticalPlannerTest {

    private PlayerBody      player;
    private AIDirector      director;
    private TacticalPlanner planner;

    @BeforeEach
    void setUp() {
        player = new PlayerBody(0, 0, 100);
        var context = AgentContext.create(EngineConfig.defaultConfig(), WorldView.of(player),
                                          mock(CombatIntentSink.class), 42L);
        director = new AIDirector(context);
        planner = director.planner();
    }

    private <T extends AgentShip> T engaged(T ship) {
        director.spawn(ship);
        ship.setTarget(player);
        return ship;
    }

    private FighterShip fighter(float x, float z) {
        return engaged(new FighterShip(new Point3f(x, 0, z), director.context()));
    }

    private void failTwice(TacticType type) {
        planner.memory().record(type, false, 0.0);
        planner.memory().record(type, false, 0.0);
    }

    @Test
    void testDirectAssaultForHealthyWing() {
        var wing = List.of(fighter(-20, 0), fighter(0, 0), fighter(20, 0));
        var chosen = planner.plan(TacticalPlanner.UNFORMED_GROUP, wing).orElseThrow();

        assertEquals(TacticType.DIRECT_ASSAULT, chosen.type());
        assertEquals(25.0f / 40 * 1.2f, chosen.effectiveness(), 1e-5f);
        for (var ship : wing) {
            assertTrue(ship.stateMachine().isInState(AttackState.class));
            assertSame(player, ship.target());
        }
        assertEquals(Map.of(TacticalPlanner.UNFORMED_GROUP, TacticType.DIRECT_ASSAULT), planner.pending());
    }

    @Test
    void testHitAndRunForFastGroup() {
        var scout = engaged(new ScoutShip(new Point3f(0, 0, 0), director.context()));
        var group = List.of(scout, engaged(new ScoutShip(new Point3f(20, 0, 0), director.context())),
                            engaged(new InterceptorShip(new Point3f(40, 0, 0), director.context())));

        assertEquals(TacticType.HIT_AND_RUN, planner.plan(TacticalPlanner.UNFORMED_GROUP, group)
                                                    .orElseThrow()
                                                    .type());
        var destination = scout.navigator().destination().orElseThrow();
        assertEquals(scout.preferredEngagementRange(), destination.distance(player.position()), 1e-3f);
        assertTrue(destination.z > player.position().z);
    }

    @Test
    void testDefensiveFormationForBatteredGroup() {
        var group = List.of(fighter(-20, 0), fighter(0, 0), fighter(20, 0));
        for (var ship : group) {
            ship.takeDamage(48);
        }
        var chosen = planner.plan(TacticalPlanner.UNFORMED_GROUP, group).orElseThrow();

        assertEquals(TacticType.DEFENSIVE_FORMATION, chosen.type());
        var formation = group.get(0).formation().orElseThrow();
        assertEquals(FormationType.SPHERE, formation.type());
        assertEquals(3, formation.size());
        for (var ship : group) {
            assertEquals(TacticalPlanner.DEFENSIVE_POSTURE, ship.posture(Posture.Source.TACTICAL));
            assertEquals(ShipStats.FIGHTER.caution() + 0.3f, ship.caution(), 1e-6f);
        }

        // a second pass replaces the posture instead of stacking it
        planner.plan(formation.id(), group);
        assertEquals(ShipStats.FIGHTER.caution() + 0.3f, group.get(1).caution(), 1e-6f);
    }

    @Test
    void testDefensiveFormationReshapesExistingFormation() {
        var group = List.of(fighter(-20, 0), fighter(0, 0), fighter(20, 0));
        var formation = director.formUp(FormationType.LINE, group);
        for (var ship : group) {
            ship.takeDamage(48);
        }
        planner.plan(formation.id(), group);

        assertEquals(FormationType.SPHERE, formation.type());
        assertEquals(1, director.context().formations().size());
    }

    @Test
    void testScatteredGroupOnlyTakesDefensivePosture() {
        var group = List.of(fighter(-200, 0), fighter(200, 0));
        for (var ship : group) {
            ship.takeDamage(48);
        }
        assertEquals(TacticType.DEFENSIVE_FORMATION,
                     planner.plan(TacticalPlanner.UNFORMED_GROUP, group).orElseThrow().type());
        assertTrue(group.get(0).formation().isEmpty());
        assertEquals(TacticalPlanner.DEFENSIVE_POSTURE, group.get(0).posture(Posture.Source.TACTICAL));
    }

    @Test
    void testSuppressionBombardmentWithEscort() {
        var bomber = engaged(new BomberShip(new Point3f(0, 0, 0), director.context()));
        var scout = engaged(new ScoutShip(new Point3f(20, 0, 0), director.context()));
        bomber.takeDamage(75);
        scout.takeDamage(15);

        var chosen = planner.plan(TacticalPlanner.UNFORMED_GROUP, List.of(bomber, scout)).orElseThrow();
        assertEquals(TacticType.SUPPRESSION_BOMBARDMENT, chosen.type());
        assertEquals(bomber.coverPosition(player.position()), bomber.navigator().destination().orElseThrow());
        assertTrue(scout.stateMachine().isInState(SupportState.class));
    }

    @Test
    void testFailingTacticLosesGround() {
        var wing = List.of(fighter(0, 0), fighter(40, 0),
                           engaged(new InterceptorShip(new Point3f(80, 0, 0), director.context())));
        failTwice(TacticType.DIRECT_ASSAULT);

        assertEquals(TacticType.FLANKING_MANEUVER,
                     planner.plan(TacticalPlanner.UNFORMED_GROUP, wing).orElseThrow().type());
        var flanker = wing.get(2).navigator().destination().orElseThrow();
        assertEquals(0.0f, flanker.distance(new Point3f(0, 0, 180)), 1e-3f);
        assertEquals(player.position(), wing.get(0).navigator().destination().orElseThrow());
    }

    @Test
    void testPincerAroundTarget() {
        var ring = List.of(fighter(50, 100), fighter(0, 150), fighter(-50, 100), fighter(0, 50));
        failTwice(TacticType.DIRECT_ASSAULT);

        assertEquals(TacticType.PINCER_MOVEMENT,
                     planner.plan(TacticalPlanner.UNFORMED_GROUP, ring).orElseThrow().type());
        assertEquals(new Point3f(100, 0, 100), ring.get(0).navigator().destination().orElseThrow());
        assertEquals(new Point3f(100, 0, 100), ring.get(1).navigator().destination().orElseThrow());
        assertEquals(new Point3f(-100, 0, 100), ring.get(3).navigator().destination().orElseThrow());
    }

    @Test
    void testPincerLeadsMovingTarget() {
        player.withVelocity(0, 0, 10);
        var points = TacticalPlanner.pincerPoints(player);
        assertEquals(0.0f, points[0].distance(new Point3f(-100, 0, 130)), 1e-4f);
        assertEquals(0.0f, points[1].distance(new Point3f(100, 0, 130)), 1e-4f);
    }

    @Test
    void testOutcomesJudgedOnNextPass() {
        var wing = List.of(fighter(-20, 0), fighter(0, 0), fighter(20, 0));
        planner.plan(TacticalPlanner.UNFORMED_GROUP, wing);
        player.setHealth(80);
        assertEquals(1, planner.resolveOutcomes());
        assertEquals(1.0f, planner.memory().successRate(TacticType.DIRECT_ASSAULT), 1e-6f);
        assertTrue(planner.pending().isEmpty());

        planner.plan(TacticalPlanner.UNFORMED_GROUP, wing);
        player.setHealth(60);
        wing.get(1).destroy();
        planner.resolveOutcomes();
        assertEquals(0.5f, planner.memory().successRate(TacticType.DIRECT_ASSAULT), 1e-6f);

        planner.plan(TacticalPlanner.UNFORMED_GROUP, List.of(wing.get(0), wing.get(2)));
        planner.resolveOutcomes();
        assertEquals(1.0f / 3, planner.memory().successRate(TacticType.DIRECT_ASSAULT), 1e-6f);
    }

    @Test
    void testGroupWithoutTargetIsLeftAlone() {
        var idle = director.spawn(new FighterShip(new Point3f(), director.context()));
        idle.setPosture(Posture.Source.TACTICAL, TacticalPlanner.DEFENSIVE_POSTURE);

        assertTrue(planner.plan(TacticalPlanner.UNFORMED_GROUP, List.of(idle)).isEmpty());
        assertEquals(Posture.NEUTRAL, idle.posture(Posture.Source.TACTICAL));
        assertTrue(planner.pending().isEmpty());

        player.setHealth(0);
        var blind = fighter(0, 0);
        assertTrue(planner.plan(TacticalPlanner.UNFORMED_GROUP, List.of(blind)).isEmpty());
    }

    @Test
    void testEffectivenessWithoutTarget() {
        var situation = TacticalSituation.assess(
        List.of(new FighterShip(new Point3f(), director.context()), new BomberShip(new Point3f(10, 0, 0),
                                                                                    director.context())), null);
        assertEquals(0.0f, TacticalPlanner.effectiveness(TacticType.DIRECT_ASSAULT, situation));
        assertEquals(0.0f, TacticalPlanner.effectiveness(TacticType.SUPPRESSION_BOMBARDMENT, situation));
        assertTrue(TacticalPlanner.effectiveness(TacticType.DEFENSIVE_FORMATION, situation) > 0.0f);
    }

    @Test
    void testOptionsRankedByScore() {
        var situation = TacticalSituation.assess(List.of(fighter(-20, 0), fighter(0, 0), fighter(20, 0)), player);
        var options = planner.options(situation);

        assertEquals(List.of(TacticType.DIRECT_ASSAULT, TacticType.DEFENSIVE_FORMATION),
                     options.stream().map(TacticalOption::type).toList());
        assertTrue(options.get(0).score() >= options.get(1).score());
    }
}
