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
package com.hellblazer.armada.geometry;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * Deterministic vector helpers over {@code javax.vecmath} tuples.
 * <p>
 * All operations allocate fresh results and never mutate their arguments, so callers may pass live agent state
 * without defensive copies. Square roots go through {@link StrictMath} so that two runs over the same inputs agree
 * bit for bit.
 * <p>
 * Usage:
 * <pre>
 * var toTarget = Vectors.direction(ship.position(), target.position());
 * float range = Vectors.distance(ship.position(), target.position());
 * var heading = Vectors.lerp(ship.forward(), toTarget, 0.1f);
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class Vectors {

    /**
     * Squared length below which a vector is treated as having no direction.
     */
    public static final float EPSILON_SQUARED = 1.0e-6f;

    private Vectors() {
    }

    public static Vector3f unitX() {
        return new Vector3f(1.0f, 0.0f, 0.0f);
    }

    public static Vector3f unitY() {
        return new Vector3f(0.0f, 1.0f, 0.0f);
    }

    public static Vector3f unitZ() {
        return new Vector3f(0.0f, 0.0f, 1.0f);
    }

    public static Vector3f zero() {
        return new Vector3f(0.0f, 0.0f, 0.0f);
    }

    /**
     * Straight-line distance between two points.
     *
     * @param a first point
     * @param b second point
     * @return Euclidean distance
     */
    public static float distance(Tuple3f a, Tuple3f b) {
        return (float) StrictMath.sqrt(distanceSquared(a, b));
    }

    /**
     * Squared distance between two points.
     *
     * @param a first point
     * @param b second point
     * @return squared Euclidean distance
     */
    public static float distanceSquared(Tuple3f a, Tuple3f b) {
        float dx = a.x - b.x;
        float dy = a.y - b.y;
        float dz = a.z - b.z;
        return dx * dx + dy * dy + dz * dz;
    }

    /**
     * Vector from {@code from} to {@code to}.
     */
    public static Vector3f subtract(Tuple3f to, Tuple3f from) {
        return new Vector3f(to.x - from.x, to.y - from.y, to.z - from.z);
    }

    /**
     * Unit vector pointing from {@code from} to {@code to}, or zero when the points coincide.
     *
     * @param from origin
     * @param to   destination
     * @return normalized direction
     */
    public static Vector3f direction(Tuple3f from, Tuple3f to) {
        return normalizeOrZero(subtract(to, from));
    }

    /**
     * Normalize a copy of the vector.
     *
     * @param v vector to normalize
     * @return unit vector, or zero when {@code v} has no meaningful length
     */
    public static Vector3f normalizeOrZero(Tuple3f v) {
        float lengthSquared = v.x * v.x + v.y * v.y + v.z * v.z;
        if (lengthSquared < EPSILON_SQUARED) {
            return zero();
        }
        float inverse = (float) (1.0 / StrictMath.sqrt(lengthSquared));
        return new Vector3f(v.x * inverse, v.y * inverse, v.z * inverse);
    }

    public static float length(Tuple3f v) {
        return (float) StrictMath.sqrt(v.x * v.x + v.y * v.y + v.z * v.z);
    }

    public static float lengthSquared(Tuple3f v) {
        return v.x * v.x + v.y * v.y + v.z * v.z;
    }

    public static float dot(Tuple3f a, Tuple3f b) {
        return a.x * b.x + a.y * b.y + a.z * b.z;
    }

    /**
     * Right-handed cross product {@code a × b}.
     */
    public static Vector3f cross(Tuple3f a, Tuple3f b) {
        return new Vector3f(a.y * b.z - a.z * b.y, a.z * b.x - a.x * b.z, a.x * b.y - a.y * b.x);
    }

    public static Vector3f scale(Tuple3f v, float s) {
        return new Vector3f(v.x * s, v.y * s, v.z * s);
    }

    public static Vector3f add(Tuple3f a, Tuple3f b) {
        return new Vector3f(a.x + b.x, a.y + b.y, a.z + b.z);
    }

    /**
     * Point reached by moving {@code distance} along {@code direction} from {@code origin}.
     */
    public static Point3f offset(Tuple3f origin, Tuple3f direction, float distance) {
        return new Point3f(origin.x + direction.x * distance, origin.y + direction.y * distance,
                           origin.z + direction.z * distance);
    }

    /**
     * Component-wise linear interpolation.
     *
     * @param a start
     * @param b end
     * @param t interpolation parameter, not clamped
     * @return {@code a + (b - a) * t}
     */
    public static Vector3f lerp(Tuple3f a, Tuple3f b, float t) {
        return new Vector3f(a.x + (b.x - a.x) * t, a.y + (b.y - a.y) * t, a.z + (b.z - a.z) * t);
    }

    /**
     * Point interpolation, see {@link #lerp(Tuple3f, Tuple3f, float)}.
     */
    public static Point3f lerpPoint(Tuple3f a, Tuple3f b, float t) {
        return new Point3f(a.x + (b.x - a.x) * t, a.y + (b.y - a.y) * t, a.z + (b.z - a.z) * t);
    }

    /**
     * Mean of a set of points, or {@code fallback} when there are none.
     */
    public static Point3f centroid(Iterable<? extends Tuple3f> points, Tuple3f fallback) {
        double sumX = 0, sumY = 0, sumZ = 0;
        int count = 0;
        for (var p : points) {
            sumX += p.x;
            sumY += p.y;
            sumZ += p.z;
            count++;
        }
        if (count == 0) {
            return new Point3f(fallback);
        }
        return new Point3f((float) (sumX / count), (float) (sumY / count), (float) (sumZ / count));
    }

    /**
     * Clamp value between min and max.
     */
    public static float clamp(float value, float min, float max) {
        return StrictMath.max(min, StrictMath.min(max, value));
    }

    /**
     * Clamp into the unit interval.
     */
    public static float clamp01(float value) {
        return clamp(value, 0.0f, 1.0f);
    }
}
