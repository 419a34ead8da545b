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
 * Multipliers applied to a ship's {@link ShipStats} baseline.
 * <p>
 * {@code reactionTime} scales cooldowns and other timers, so values below one make a ship react faster.
 *
 * @author hal.hildebrand
 */
public record StatModifiers(float speed, float health, float accuracy, float detection, float aggression,
                            float teamwork, float reactionTime) {

    public static final StatModifiers IDENTITY = new StatModifiers(1, 1, 1, 1, 1, 1, 1);

    public StatModifiers {
        if (speed <= 0 || health <= 0 || accuracy <= 0 || detection <= 0 || aggression <= 0 || teamwork <= 0
        || reactionTime <= 0) {
            throw new IllegalArgumentException("Modifiers must be positive");
        }
    }
}
