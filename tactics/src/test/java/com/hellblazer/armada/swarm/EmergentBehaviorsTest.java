package com.hellblazer.armada.swarm;

import com.hellblazer.armada.AIDirector;
import com.hellblazer.armada.AgentContext;
import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.PlayerBody;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.agent.Posture;
import com.hellblazer.armada.agent.ShipStats;
import com.hellblazer.armada.formation.FormationType;
import com.hellblazer.armada.ships.FighterShip;
import com.hellblazer.armada.ships.InterceptorShip;
import com.hellblazer.armada.ships.ScoutShip;
import com.hellblazer.armada.state.FleeState;
import com.hellblazer.armada.world.CombatIntentSink;
import com.hellblazer.armada.world.WorldView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * @author hal.hildebrand
 */
class EmergentBehaviorsTest {

    private PlayerBody        player;
    private AIDirector        director;
    private EmergentBehaviors emergent;

    @BeforeEach
    void setUp() {
        player = new PlayerBody(0, 0, 100);
        var context = AgentContext.create(EngineConfig.defaultConfig(), WorldView.of(player),
                                          mock(CombatIntentSink.class), 7L);
        director = new AIDirector(context);
        emergent = director.emergent();
    }

    private FighterShip fighter(float x, float z) {
        return (FighterShip) director.spawn(new FighterShip(new Point3f(x, 0, z), director.context()));
    }

    @Test
    void testNearbyUnformedShipsFlock() {
        var cluster = List.of(fighter(0, 0), fighter(20, 0), fighter(40, 0), fighter(0, 20));
        var strays = List.of(fighter(300, 0), fighter(320, 0));

        var formed = emergent.formFlocks(director.agents());
        assertEquals(1, formed.size());
        var flock = formed.get(0);
        assertEquals(FormationType.V_FORMATION, flock.type());
        assertEquals(4, flock.size());
        for (var ship : cluster) {
            assertSame(flock, ship.formation().orElseThrow());
        }
        for (var ship : strays) {
            assertTrue(ship.formation().isEmpty());
        }

        assertTrue(emergent.formFlocks(director.agents()).isEmpty());
    }

    @Test
    void testFlockSizeIsCapped() {
        var line = new ArrayList<AgentShip>();
        for (int i = 0; i < 8; i++) {
            line.add(fighter(i * 10, 0));
        }
        var formed = emergent.formFlocks(line);

        assertEquals(1, formed.size());
        assertEquals(EmergentBehaviors.MAX_FLOCK, formed.get(0).size());
        assertTrue(line.get(6).formation().isEmpty());
        assertTrue(line.get(7).formation().isEmpty());
    }

    @Test
    void testFleeingShipsDoNotFlock() {
        var wing = List.of(fighter(0, 0), fighter(20, 0), fighter(40, 0));
        wing.get(1).stateMachine().changeState(new FleeState(), wing.get(1));

        assertTrue(emergent.formFlocks(wing).isEmpty());
    }

    @Test
    void testChallengerReplacesWeakerLeader() {
        var scout = director.spawn(new ScoutShip(new Point3f(0, 0, 0), director.context()));
        var fighter = fighter(20, 0);
        var formation = director.formUp(FormationType.LINE, List.of(scout, fighter));
        assertEquals(scout.id(), formation.leaderId());

        assertEquals(0.12f, EmergentBehaviors.leadershipAdvantage(fighter, scout), 1e-5f);
        assertEquals(1, emergent.challengeLeadership());
        assertEquals(fighter.id(), formation.leaderId());

        assertEquals(0, emergent.challengeLeadership());
        assertEquals(fighter.id(), formation.leaderId());
    }

    @Test
    void testWoundedLeaderIsReplaced() {
        var wing = List.of(fighter(0, 0), fighter(20, 0), fighter(40, 0));
        var formation = director.formUp(FormationType.V_FORMATION, wing);
        wing.get(0).takeDamage(40);
        wing.get(2).takeDamage(10);

        emergent.challengeLeadership();
        assertEquals(wing.get(1).id(), formation.leaderId());
    }

    @Test
    void testFormationPostureFollowsLosses() {
        var wing = List.of(fighter(0, 0), fighter(20, 0), fighter(40, 0));
        var loner = fighter(300, 0);
        loner.setPosture(Posture.Source.GROUP_THREAT, EmergentBehaviors.LOW_THREAT_POSTURE);
        director.formUp(FormationType.V_FORMATION, wing);

        emergent.adaptToThreat(director.agents());
        for (var ship : wing) {
            assertEquals(EmergentBehaviors.LOW_THREAT_POSTURE, ship.posture(Posture.Source.GROUP_THREAT));
            assertEquals(ShipStats.FIGHTER.aggressiveness() + 0.1f, ship.aggressiveness(), 1e-6f);
        }
        assertEquals(Posture.NEUTRAL, loner.posture(Posture.Source.GROUP_THREAT));

        for (var ship : wing) {
            ship.takeDamage(64);
        }
        emergent.adaptToThreat(director.agents());
        for (var ship : wing) {
            assertEquals(EmergentBehaviors.HIGH_THREAT_POSTURE, ship.posture(Posture.Source.GROUP_THREAT));
            assertEquals(ShipStats.FIGHTER.caution() + 0.2f, ship.caution(), 1e-6f);
            assertEquals(1.0f, ship.teamworkTendency(), 1e-6f);
        }

        director.context().formations().leave(wing.get(0).id());
        emergent.adaptToThreat(director.agents());
        assertEquals(Posture.NEUTRAL, wing.get(0).posture(Posture.Source.GROUP_THREAT));
    }

    @Test
    void testMiddlingLossesHoldNoPosture() {
        var wing = List.of(fighter(0, 0), fighter(20, 0), fighter(40, 0));
        director.formUp(FormationType.V_FORMATION, wing);
        for (var ship : wing) {
            ship.takeDamage(40);
        }
        emergent.adaptToThreat(wing);
        for (var ship : wing) {
            assertEquals(Posture.NEUTRAL, ship.posture(Posture.Source.GROUP_THREAT));
        }
    }

    @Test
    void testShipsSharingTargetActTogether() {
        var scout = director.spawn(new ScoutShip(new Point3f(0, 0, 0), director.context()));
        var interceptor = director.spawn(new InterceptorShip(new Point3f(30, 0, 0), director.context()));
        var loneFighter = fighter(-100, 0);
        scout.setTarget(player);
        interceptor.setTarget(player);
        loneFighter.setTarget(new PlayerBody(-100, 0, 100));
        loneFighter.navigator().stop();

        assertEquals(2, emergent.coordinateGroupActions(director.agents()));
        var strike = scout.navigator().destination().orElseThrow();
        assertEquals(scout.preferredEngagementRange(), strike.distance(player.position()), 1e-3f);
        assertTrue(interceptor.navigator().destination().isPresent());
        assertTrue(loneFighter.navigator().destination().isEmpty());
    }
}
