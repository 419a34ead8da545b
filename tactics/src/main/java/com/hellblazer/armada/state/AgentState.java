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
package com.hellblazer.armada.state;

import com.hellblazer.armada.agent.AgentShip;

/**
 * One behavior of an agent.
 * <p>
 * Each agent gets its own state instances, so a state may keep timers for the agent it is driving. Transitions
 * are evaluated before {@link #update(AgentShip, float)} on every tick.
 *
 * @author hal.hildebrand
 */
public abstract class AgentState {

    public abstract String name();

    public void onEnter(AgentShip ship) {
    }

    public abstract void update(AgentShip ship, float deltaTime);

    public void onExit(AgentShip ship) {
    }

    /**
     * @return the state to switch to, or null to stay in this one
     */
    public AgentState checkTransitions(AgentShip ship) {
        return null;
    }

    @Override
    public String toString() {
        return name();
    }
}
