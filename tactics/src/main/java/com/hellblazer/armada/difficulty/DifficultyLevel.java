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
package com.hellblazer.armada.difficulty;

/**
 * Difficulty tiers, each covering a band of the continuous difficulty score.
 *
 * @author hal.hildebrand
 */
public enum DifficultyLevel {
    VERY_EASY(0.2f, 0.1f, 1.5f), EASY(0.4f, 0.3f, 1.2f), MEDIUM(0.6f, 0.5f, 1.0f), HARD(0.8f, 0.7f, 0.8f),
    VERY_HARD(1.0f, 0.9f, 0.6f);

    private final float upperBound;
    private final float canonicalScore;
    private final float formationScale;

    DifficultyLevel(float upperBound, float canonicalScore, float formationScale) {
        this.upperBound = upperBound;
        this.canonicalScore = canonicalScore;
        this.formationScale = formationScale;
    }

    /**
     * Tier for a score: at most 0.2, 0.4, 0.6 and 0.8 map to the four lower tiers, anything above to
     * {@link #VERY_HARD}.
     */
    public static DifficultyLevel fromScore(float score) {
        for (var level : values()) {
            if (score <= level.upperBound) {
                return level;
            }
        }
        return VERY_HARD;
    }

    /**
     * Midpoint of the tier's band, used for manual overrides.
     */
    public float canonicalScore() {
        return canonicalScore;
    }

    /**
     * Inclusive upper breakpoint of the tier.
     */
    public float upperBound() {
        return upperBound;
    }

    public float formationScale() {
        return formationScale;
    }
}
