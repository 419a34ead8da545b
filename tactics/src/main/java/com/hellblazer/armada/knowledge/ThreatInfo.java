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
package com.hellblazer.armada.knowledge;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

/**
 * What is known about hostile activity in one cell of space.
 *
 * @param position last observed position within the cell
 * @param level    threat level in [0, 1]
 * @param lastSeen simulation time of the latest observation
 * @param velocity last observed velocity of the threat, zero when unknown
 * @param health   last observed health of the threat, negative when unknown
 * @author hal.hildebrand
 */
public record ThreatInfo(Point3f position, float level, double lastSeen, Vector3f velocity, float health) {

    public ThreatInfo {
        position = new Point3f(position);
        velocity = velocity == null ? new Vector3f() : new Vector3f(velocity);
    }

    @Override
    public Point3f position() {
        return new Point3f(position);
    }

    @Override
    public Vector3f velocity() {
        return new Vector3f(velocity);
    }

    ThreatInfo withLevel(float newLevel, double now) {
        return new ThreatInfo(position, newLevel, now, velocity, health);
    }

    @Override
    public String toString() {
        return String.format("Threat[(%.1f, %.1f, %.1f) level=%.2f seen=%.2f]", position.x, position.y, position.z,
                             level, lastSeen);
    }
}
