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
package com.hellblazer.armada.comms;

/**
 * Observer of an endpoint's traffic. Callbacks run on the draining thread.
 *
 * @author hal.hildebrand
 */
public interface MessageListener {

    /**
     * An inbound message was processed.
     */
    default void onReceived(AgentMessage message) {
    }

    /**
     * An outbound message was handed to the hub.
     */
    default void onSent(AgentMessage message) {
    }

    /**
     * A message was discarded because a queue was full.
     */
    default void onDropped(AgentMessage message) {
    }
}
