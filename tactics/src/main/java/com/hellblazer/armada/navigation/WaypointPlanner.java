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
package com.hellblazer.armada.navigation;

import com.hellblazer.armada.geometry.Vectors;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.List;

/**
 * Straight-line route planner. Long legs are broken into evenly spaced intermediate waypoints so that avoidance
 * has a chance to steer between them; short legs go direct.
 *
 * @author hal.hildebrand
 */
public class WaypointPlanner {

    public static final float DEFAULT_SPACING          = 80.0f;
    public static final float DEFAULT_DIRECT_THRESHOLD = 100.0f;

    private final float spacing;
    private final float directThreshold;

    public WaypointPlanner() {
        this(DEFAULT_SPACING, DEFAULT_DIRECT_THRESHOLD);
    }

    public WaypointPlanner(float spacing, float directThreshold) {
        if (!(spacing > 0.0f)) {
            throw new IllegalArgumentException("Waypoint spacing must be positive: " + spacing);
        }
        this.spacing = spacing;
        this.directThreshold = directThreshold;
    }

    /**
     * Plan from {@code start} to {@code end}.
     *
     * @return waypoints to visit in order, excluding the start and ending with {@code end}
     */
    public List<Point3f> plan(Tuple3f start, Tuple3f end) {
        var path = new ArrayList<Point3f>();
        float distance = Vectors.distance(start, end);
        if (distance > directThreshold) {
            int segments = (int) (distance / spacing);
            for (int i = 1; i < segments; i++) {
                path.add(Vectors.lerpPoint(start, end, (float) i / segments));
            }
        }
        path.add(new Point3f(end));
        return path;
    }
}
