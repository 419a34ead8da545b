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

import com.hellblazer.armada.geometry.Vectors;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.List;

/**
 * Slot layouts for each {@link FormationType}.
 * <p>
 * Offsets are computed in a local frame where +Z is the direction of travel, +X is right and +Y is up, then mapped
 * into world space by {@link #toWorld(Tuple3f, Tuple3f, Tuple3f)}. Slot 0 always belongs to the leader.
 *
 * @author hal.hildebrand
 */
public final class FormationGeometry {

    public static final float V_SPACING       = 25.0f;
    public static final float V_ANGLE_DEGREES = 30.0f;
    public static final float DIAMOND_SPACING = 30.0f;
    public static final float DIAMOND_RING    = 0.7f;
    public static final float SPHERE_RADIUS   = 40.0f;
    public static final float HELIX_RADIUS    = 20.0f;
    public static final float HELIX_PITCH     = 15.0f;
    public static final float HELIX_STEP      = 60.0f;
    public static final float HELIX_TRAIL     = 10.0f;
    public static final float LINE_SPACING    = 20.0f;
    public static final float BOX_SPACING     = 25.0f;
    public static final float WEDGE_SPACING   = 20.0f;
    public static final float CIRCLE_RADIUS   = 30.0f;

    private static final double GOLDEN_ANGLE = Math.PI * (1.0 + Math.sqrt(5.0));

    private FormationGeometry() {
    }

    /**
     * Local slot offsets for {@code count} ships.
     */
    public static List<Vector3f> localOffsets(FormationType type, int count, float scale) {
        var offsets = new ArrayList<Vector3f>(count);
        for (int i = 0; i < count; i++) {
            offsets.add(switch (type) {
                case V_FORMATION -> vee(i, scale);
                case DIAMOND -> diamond(i, scale);
                case SPHERE -> sphere(i, count, scale);
                case HELIX -> helix(i, scale);
                case LINE -> new Vector3f((i - count / 2.0f) * LINE_SPACING * scale, 0.0f, 0.0f);
                case BOX -> box(i, count, scale);
                case WEDGE -> wedge(i, scale);
                case CIRCLE -> circle(i, count, scale);
            });
        }
        return offsets;
    }

    /**
     * Map a local offset into world space for a formation at {@code center} travelling along {@code direction}.
     */
    public static Point3f toWorld(Tuple3f local, Tuple3f center, Tuple3f direction) {
        var forward = Vectors.normalizeOrZero(direction);
        if (Vectors.lengthSquared(forward) < Vectors.EPSILON_SQUARED) {
            forward = Vectors.unitZ();
        }
        var right = Vectors.normalizeOrZero(Vectors.cross(forward, Vectors.unitY()));
        if (Vectors.lengthSquared(right) < Vectors.EPSILON_SQUARED) {
            right = Vectors.unitX();
        }
        var up = Vectors.cross(right, forward);
        return new Point3f(center.x + right.x * local.x + up.x * local.y + forward.x * local.z,
                           center.y + right.y * local.x + up.y * local.y + forward.y * local.z,
                           center.z + right.z * local.x + up.z * local.y + forward.z * local.z);
    }

    private static Vector3f vee(int i, float scale) {
        if (i == 0) {
            return Vectors.zero();
        }
        float spacing = V_SPACING * scale;
        float side = i % 2 == 1 ? -1.0f : 1.0f;
        int rank = (i + 1) / 2;
        double angle = Math.toRadians(V_ANGLE_DEGREES);
        return new Vector3f((float) (side * Math.sin(angle) * spacing * rank), 0.0f,
                            (float) (-Math.cos(angle) * spacing * rank));
    }

    private static Vector3f diamond(int i, float scale) {
        float spacing = DIAMOND_SPACING * scale;
        int side = i < 4 ? i : (i - 4) % 4;
        float reach = i < 4 ? spacing : spacing * ((i - 4) / 4 + 2) * DIAMOND_RING;
        return switch (side) {
            case 0 -> new Vector3f(0.0f, 0.0f, reach);
            case 1 -> new Vector3f(-reach, 0.0f, 0.0f);
            case 2 -> new Vector3f(reach, 0.0f, 0.0f);
            default -> new Vector3f(0.0f, 0.0f, -reach);
        };
    }

    private static Vector3f sphere(int i, int count, float scale) {
        if (i == 0) {
            return Vectors.zero();
        }
        float radius = SPHERE_RADIUS * scale;
        double phi = count <= 2 ? 0.0 : Math.acos(1.0 - 2.0 * (i - 1) / (count - 2.0));
        double theta = GOLDEN_ANGLE * (i - 1);
        return new Vector3f((float) (radius * Math.sin(phi) * Math.cos(theta)),
                            (float) (radius * Math.sin(phi) * Math.sin(theta)), (float) (radius * Math.cos(phi)));
    }

    private static Vector3f helix(int i, float scale) {
        double angle = Math.toRadians(i * HELIX_STEP);
        float radius = HELIX_RADIUS * scale;
        return new Vector3f((float) (radius * Math.cos(angle)), i * HELIX_PITCH * scale,
                            (float) (radius * Math.sin(angle)) - i * HELIX_TRAIL);
    }

    private static Vector3f box(int i, int count, float scale) {
        float spacing = BOX_SPACING * scale;
        int perSide = (int) Math.ceil(Math.sqrt(count));
        int row = i / perSide;
        int column = i % perSide;
        return new Vector3f((column - perSide / 2.0f) * spacing, 0.0f, (row - perSide / 2.0f) * spacing);
    }

    private static Vector3f wedge(int i, float scale) {
        float spacing = WEDGE_SPACING * scale;
        int row = 0;
        int inRow = 1;
        int before = 0;
        while (before + inRow <= i) {
            before += inRow;
            row++;
            inRow += 2;
        }
        int column = i - before;
        return new Vector3f((column - inRow / 2.0f + 0.5f) * spacing, 0.0f, -row * spacing);
    }

    private static Vector3f circle(int i, int count, float scale) {
        if (i == 0) {
            return Vectors.zero();
        }
        double angle = (i - 1) * 2.0 * Math.PI / (count - 1);
        float radius = CIRCLE_RADIUS * scale;
        return new Vector3f((float) (radius * Math.cos(angle)), 0.0f, (float) (radius * Math.sin(angle)));
    }
}
