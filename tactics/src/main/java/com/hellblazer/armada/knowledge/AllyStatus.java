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
 * Last self-reported condition of an agent.
 *
 * @param agentId     reporting agent
 * @param healthRatio health over max health
 * @param position    position at report time
 * @param velocity    velocity at report time
 * @param inCombat    whether the agent had a target
 * @param ammo        remaining ammunition fraction
 * @param reportedAt  simulation time of the report
 * @author hal.hildebrand
 */
public record AllyStatus(UUID agentId, float healthRatio, Point3f position, Vector3f velocity, boolean inCombat,
                         float ammo, double reportedAt) {

    public AllyStatus {
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
