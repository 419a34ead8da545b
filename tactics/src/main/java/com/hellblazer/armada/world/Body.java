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
import javax.vecmath.Vector3f;
import java.util.UUID;

/**
 * Anything with an identity and a world transform that an agent can observe or target: the player, or another
 * agent.
 *
 * @author hal.hildebrand
 */
public interface Body {

    UUID id();

    /**
     * @return the live position; callers must copy before retaining
     */
    Point3f position();

    /**
     * @return the live velocity; callers must copy before retaining
     */
    Vector3f velocity();

    float health();

    default boolean isAlive() {
        return health() > 0.0f;
    }
}
