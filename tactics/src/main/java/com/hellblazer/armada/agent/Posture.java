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
package com.hellblazer.armada.agent;

/**
 * Additive adjustments to a ship's behavioral traits, layered over the stats derived from baseline and modifiers.
 * <p>
 * A ship holds one posture per {@link Source}. Setting a posture replaces the previous one from the same source, so
 * repeated decisions never compound.
 *
 * @author hal.hildebrand
 */
public record Posture(float caution, float aggression, float teamwork) {

    public static final Posture NEUTRAL = new Posture(0, 0, 0);

    public Posture {
        if (!Float.isFinite(caution) || !Float.isFinite(aggression) || !Float.isFinite(teamwork)) {
            throw new IllegalArgumentException("Posture adjustments must be finite");
        }
    }

    public boolean isNeutral() {
        return caution == 0.0f && aggression == 0.0f && teamwork == 0.0f;
    }

    /**
     * Who set a posture.
     */
    public enum Source {
        /** Chosen by the tactical planner for the ship's group. */
        TACTICAL,
        /** Derived from the health of the ship's formation. */
        GROUP_THREAT
    }
}
