/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Armada.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.armada;

import com.hellblazer.armada.comms.CommunicationHub;
import com.hellblazer.armada.comms.MessageHandler;
import com.hellblazer.armada.comms.MessageReactions;
import com.hellblazer.armada.formation.FormationRegistry;
import com.hellblazer.armada.knowledge.AllyTracker;
import com.hellblazer.armada.knowledge.IntelligenceDatabase;
import com.hellblazer.armada.knowledge.ThreatDatabase;
import com.hellblazer.armada.world.CombatIntentSink;
import com.hellblazer.armada.world.WorldView;

import java.util.Objects;
import java.util.Random;

/**
 * The services shared by every agent of one engine instance.
 * <p>
 * Nothing here is global: tests and multiple concurrent engines each build their own context.
 *
 * @param config     engine configuration
 * @param clock      simulation clock
 * @param hub        message router and agent registry
 * @param threats    threat blackboard
 * @param allies     ally status blackboard
 * @param intel      intelligence blackboard
 * @param formations formation membership table
 * @param reactions  inbound message handler shared by all endpoints
 * @param world      read access to the player and world bounds
 * @param intents    outbound attack intents
 * @param random     source of randomness for maneuver choices
 * @author hal.hildebrand
 */
public record AgentContext(EngineConfig config, SimulationClock clock, CommunicationHub hub, ThreatDatabase threats,
                           AllyTracker allies, IntelligenceDatabase intel, FormationRegistry formations,
                           MessageHandler reactions, WorldView world, CombatIntentSink intents, Random random) {

    public AgentContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(hub, "hub");
        Objects.requireNonNull(threats, "threats");
        Objects.requireNonNull(allies, "allies");
        Objects.requireNonNull(intel, "intel");
        Objects.requireNonNull(formations, "formations");
        Objects.requireNonNull(reactions, "reactions");
        Objects.requireNonNull(world, "world");
        Objects.requireNonNull(intents, "intents");
        Objects.requireNonNull(random, "random");
    }

    /**
     * Build a fresh set of services.
     *
     * @param config  engine configuration
     * @param world   world access
     * @param intents attack intent sink
     * @param seed    seed for maneuver randomness
     */
    public static AgentContext create(EngineConfig config, WorldView world, CombatIntentSink intents, long seed) {
        var hub = new CommunicationHub(config.getCommunicationRange());
        return new AgentContext(config, new SimulationClock(), hub, new ThreatDatabase(config.getThreatCellSize()),
                                new AllyTracker(), new IntelligenceDatabase(), new FormationRegistry(hub),
                                new MessageReactions(), world, intents, new Random(seed));
    }

    public static AgentContext create(EngineConfig config) {
        return create(config, WorldView.empty(), CombatIntentSink.discard(), 0L);
    }
}
