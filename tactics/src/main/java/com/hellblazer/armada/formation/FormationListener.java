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
package com.hellblazer.armada.formation;

import java.util.UUID;

/**
 * Observer of formation changes.
 *
 * @author hal.hildebrand
 */
public interface FormationListener {

    default void onFormationChanged(FormationController formation, FormationType previous, FormationType current) {
    }

    default void onLeaderChanged(FormationController formation, UUID previous, UUID current) {
    }

    default void onMemberAdded(FormationController formation, UUID agentId) {
    }

    default void onMemberRemoved(FormationController formation, UUID agentId) {
    }
}
