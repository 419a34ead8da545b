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
import java.util.Objects;
import java.util.UUID;

/**
 * Request to the weapons layer to fire one projectile.
 *
 * @param shooter         the firing agent
 * @param target          the intended target, null for suppression fire
 * @param origin          muzzle position
 * @param direction       unit firing direction
 * @param projectileClass what to spawn
 * @author hal.hildebrand
 */
public record AttackIntent(UUID shooter, UUID target, Point3f origin, Vector3f direction,
                           ProjectileClass projectileClass) {

    public AttackIntent {
        Objects.requireNonNull(shooter, "shooter");
        Objects.requireNonNull(projectileClass, "projectileClass");
        origin = new Point3f(origin);
        direction = new Vector3f(direction);
    }

    public enum ProjectileClass {
        LIGHT, MEDIUM, HEAVY, FAST, SUPPRESSION
    }
}
