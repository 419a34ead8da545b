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
import java.util.Optional;

/**
 * Read access to the parts of the game world the engine does not own.
 *
 * @author hal.hildebrand
 */
public interface WorldView {

    /**
     * A world with no player and no bounds.
     */
    static WorldView empty() {
        return Optional::empty;
    }

    /**
     * A world whose player is always the given body.
     */
    static WorldView of(Body player) {
        var present = Optional.of(player);
        return () -> present;
    }

    /**
     * @return the player, if one is currently alive in the world
     */
    Optional<Body> player();

    /**
     * Bounds hook applied to every agent position after integration. The default leaves positions untouched.
     *
     * @param position the candidate position, may be modified in place
     * @return the admissible position
     */
    default Point3f clamp(Point3f position) {
        return position;
    }
}
