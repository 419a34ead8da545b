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
package com.hellblazer.armada.world;

import javax.vecmath.Point3f;
import java.util.UUID;

/**
 * Occurrences that originate outside the engine, usually in physics or gameplay, and are fed to the director.
 *
 * @author hal.hildebrand
 */
public sealed interface GameEvent permits GameEvent.DamageTaken, GameEvent.AgentDestroyed, GameEvent.AllyLost {

    /**
     * An agent was hit.
     *
     * @param agentId the damaged agent
     * @param amount  hit points removed
     */
    record DamageTaken(UUID agentId, float amount) implements GameEvent {
    }

    /**
     * Physics or gameplay destroyed an agent outright.
     */
    record AgentDestroyed(UUID agentId) implements GameEvent {
    }

    /**
     * A friendly craft the engine does not control was lost; nearby agents are told about it.
     *
     * @param position where the loss happened
     * @param lostId   identity of the lost craft
     */
    record AllyLost(Point3f position, UUID lostId) implements GameEvent {
        public AllyLost {
            position = new Point3f(position);
        }
    }
}
