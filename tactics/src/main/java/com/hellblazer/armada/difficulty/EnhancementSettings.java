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

import com.hellblazer.armada.agent.StatModifiers;

import java.util.Objects;

/**
 * Multipliers and limits in force for one difficulty tier.
 *
 * @param speedMultiplier          cruise speed
 * @param healthMultiplier         maximum health
 * @param accuracyMultiplier       aim and turn rate
 * @param detectionRangeMultiplier sensor range
 * @param aggressionMultiplier     aggressiveness dial
 * @param teamworkMultiplier       teamwork dial
 * @param reactionTimeMultiplier   cooldowns and charge times; lower is faster
 * @param formationComplexity      how elaborate formations may be
 * @param maxSimultaneousEnemies   cap on concurrently active agents
 * @author hal.hildebrand
 */
public record EnhancementSettings(float speedMultiplier, float healthMultiplier, float accuracyMultiplier,
                                  float detectionRangeMultiplier, float aggressionMultiplier,
                                  float teamworkMultiplier, float reactionTimeMultiplier,
                                  FormationComplexity formationComplexity, int maxSimultaneousEnemies) {

    public static final EnhancementSettings VERY_EASY = new EnhancementSettings(0.7f, 0.6f, 0.5f, 0.8f, 0.6f, 0.5f,
                                                                                1.5f, FormationComplexity.SIMPLE, 2);
    public static final EnhancementSettings EASY      = new EnhancementSettings(0.8f, 0.8f, 0.7f, 0.9f, 0.8f, 0.7f,
                                                                                1.3f, FormationComplexity.SIMPLE, 3);
    public static final EnhancementSettings MEDIUM    = new EnhancementSettings(1.0f, 1.0f, 1.0f, 1.0f, 1.0f, 1.0f,
                                                                                1.0f, FormationComplexity.MEDIUM, 4);
    public static final EnhancementSettings HARD      = new EnhancementSettings(1.2f, 1.3f, 1.3f, 1.2f, 1.2f, 1.3f,
                                                                                0.8f, FormationComplexity.COMPLEX, 6);
    public static final EnhancementSettings VERY_HARD = new EnhancementSettings(1.4f, 1.5f, 1.5f, 1.4f, 1.4f, 1.5f,
                                                                                0.6f, FormationComplexity.VERY_COMPLEX,
                                                                                8);

    public EnhancementSettings {
        Objects.requireNonNull(formationComplexity, "formationComplexity");
        if (maxSimultaneousEnemies <= 0) {
            throw new IllegalArgumentException("Max simultaneous enemies must be positive: " + maxSimultaneousEnemies);
        }
    }

    public static EnhancementSettings forLevel(DifficultyLevel level) {
        return switch (level) {
            case VERY_EASY -> VERY_EASY;
            case EASY -> EASY;
            case MEDIUM -> MEDIUM;
            case HARD -> HARD;
            case VERY_HARD -> VERY_HARD;
        };
    }

    /**
     * The per-agent stat multipliers of this tier.
     */
    public StatModifiers modifiers() {
        return new StatModifiers(speedMultiplier, healthMultiplier, accuracyMultiplier, detectionRangeMultiplier,
                                 aggressionMultiplier, teamworkMultiplier, reactionTimeMultiplier);
    }
}
