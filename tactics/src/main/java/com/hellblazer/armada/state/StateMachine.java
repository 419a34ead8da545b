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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-active-state behavior selector.
 * <p>
 * On each update the current state is asked for a transition first; if it names a different state the machine
 * exits the old one, enters the new one and runs the new one's update in the same tick.
 *
 * @author hal.hildebrand
 */
public class StateMachine {

    private static final Logger log = LoggerFactory.getLogger(StateMachine.class);

    private AgentState current;
    private AgentState previous;

    /**
     * Install the starting state and run its enter hook.
     */
    public void initialize(AgentState initial, AgentShip ship) {
        if (initial == null) {
            throw new IllegalArgumentException("Initial state cannot be null");
        }
        previous = null;
        current = initial;
        current.onEnter(ship);
    }

    public void update(AgentShip ship, float deltaTime) {
        if (current == null) {
            return;
        }
        var next = current.checkTransitions(ship);
        if (next != null && next != current) {
            changeState(next, ship);
        }
        current.update(ship, deltaTime);
    }

    /**
     * Switch to {@code next}. A null state or the state already active is ignored.
     */
    public void changeState(AgentState next, AgentShip ship) {
        if (next == null || next == current) {
            return;
        }
        if (current != null) {
            current.onExit(ship);
        }
        log.trace("{}: {} -> {}", ship.id(), current, next);
        previous = current;
        current = next;
        current.onEnter(ship);
    }

    public AgentState currentState() {
        return current;
    }

    public AgentState previousState() {
        return previous;
    }

    public boolean isInState(Class<? extends AgentState> type) {
        return type.isInstance(current);
    }

    public String currentStateName() {
        return current == null ? "None" : current.name();
    }
}
