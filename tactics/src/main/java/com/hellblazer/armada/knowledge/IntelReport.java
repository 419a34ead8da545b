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
import java.util.UUID;

/**
 * A reconnaissance observation of one subject.
 *
 * @param reporterId  observing agent
 * @param subjectId   what was observed, typically the player
 * @param position    observed position
 * @param velocity    observed velocity
 * @param threatLevel assessed threat in [0, 1]
 * @param confidence  observer confidence in [0, 1]
 * @param reportedAt  simulation time of the observation
 * @author hal.hildebrand
 */
public record IntelReport(UUID reporterId, UUID subjectId, Point3f position, Vector3f velocity, float threatLevel,
                          float confidence, double reportedAt) {

    public IntelReport {
        position = new Point3f(position);
        velocity = new Vector3f(velocity);
    }

    @Override
    public Point3f position() {
        return new Point3f(position);
    }

    @Override
    public Vector3f velocity() {
        return new Vector3f(velocity);
    }
}
