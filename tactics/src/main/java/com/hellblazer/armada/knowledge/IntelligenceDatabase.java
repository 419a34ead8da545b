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

import com.hellblazer.armada.common.BoundedHistory;
import com.hellblazer.armada.geometry.Vectors;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Accumulated intel reports with simple correlation queries.
 * <p>
 * Retains the most recent reports up to a fixed capacity. Synchronized; reports arrive from message reactions of
 * arbitrary agents.
 *
 * @author hal.hildebrand
 */
public class IntelligenceDatabase {

    public static final int DEFAULT_CAPACITY = 256;

    private final BoundedHistory<IntelReport> reports;

    public IntelligenceDatabase() {
        this(DEFAULT_CAPACITY);
    }

    public IntelligenceDatabase(int capacity) {
        this.reports = new BoundedHistory<>(capacity);
    }

    public synchronized void process(IntelReport report) {
        reports.add(report);
    }

    /**
     * @return retained reports, oldest first
     */
    public synchronized List<IntelReport> reports() {
        return reports.snapshot();
    }

    public synchronized List<IntelReport> reportsOn(UUID subjectId) {
        return reports.snapshot(r -> r.subjectId().equals(subjectId));
    }

    /**
     * Reports whose observed position lies within {@code radius} of {@code position}.
     */
    public synchronized List<IntelReport> correlate(Tuple3f position, float radius) {
        float radiusSquared = radius * radius;
        return reports.snapshot(r -> Vectors.distanceSquared(r.position(), position) <= radiusSquared);
    }

    /**
     * Confidence-weighted mean position of a subject over all retained reports.
     *
     * @return the estimate, or empty when no report about the subject carries any confidence
     */
    public synchronized Optional<Point3f> estimatedPosition(UUID subjectId) {
        double x = 0, y = 0, z = 0, weight = 0;
        for (var report : reports.snapshot(r -> r.subjectId().equals(subjectId))) {
            float w = report.confidence();
            x += report.position().x * w;
            y += report.position().y * w;
            z += report.position().z * w;
            weight += w;
        }
        if (weight <= 0) {
            return Optional.empty();
        }
        return Optional.of(new Point3f((float) (x / weight), (float) (y / weight), (float) (z / weight)));
    }

    public synchronized int size() {
        return reports.size();
    }

    public synchronized void clear() {
        reports.clear();
    }
}
