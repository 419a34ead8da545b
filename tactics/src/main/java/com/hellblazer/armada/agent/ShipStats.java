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
 * Unmodified baseline of a ship. Effective values are always derived from this record and the modifiers in force,
 * never from previously modified values.
 *
 * @param maxHealth        hit points
 * @param speed            cruise speed, units per second
 * @param rotationSpeed    turn rate, radians per second
 * @param detectionRange   sensor reach
 * @param attackRange      weapon reach
 * @param size             collision radius
 * @param aggressiveness   dial in [0, 1]
 * @param caution          dial in [0, 1]
 * @param teamworkTendency dial in [0, 1]
 * @param attackCooldown   seconds between attacks
 * @param personality      temperament
 * @author hal.hildebrand
 */
public record ShipStats(float maxHealth, float speed, float rotationSpeed, float detectionRange, float attackRange,
                        float size, float aggressiveness, float caution, float teamworkTendency, float attackCooldown,
                        Personality personality) {

    public static final ShipStats SCOUT       = new ShipStats(30, 120, 4.0f, 200, 80, 8, 0.3f, 0.8f, 0.9f, 2.0f,
                                                              Personality.CAUTIOUS);
    public static final ShipStats FIGHTER     = new ShipStats(80, 80, 2.5f, 150, 100, 12, 0.6f, 0.4f, 0.7f, 1.2f,
                                                              Personality.BALANCED);
    public static final ShipStats BOMBER      = new ShipStats(150, 50, 1.5f, 120, 120, 18, 0.4f, 0.7f, 0.9f, 4.0f,
                                                              Personality.DEFENSIVE);
    public static final ShipStats INTERCEPTOR = new ShipStats(45, 140, 5.0f, 180, 60, 6, 0.9f, 0.2f, 0.4f, 0.8f,
                                                              Personality.AGGRESSIVE);

    public ShipStats {
        if (maxHealth <= 0.0f) {
            throw new IllegalArgumentException("Max health must be positive: " + maxHealth);
        }
        if (speed < 0.0f || rotationSpeed < 0.0f || detectionRange < 0.0f || attackRange < 0.0f || size < 0.0f
        || attackCooldown < 0.0f) {
            throw new IllegalArgumentException("Ship stats cannot be negative");
        }
        checkDial("aggressiveness", aggressiveness);
        checkDial("caution", caution);
        checkDial("teamworkTendency", teamworkTendency);
        if (personality == null) {
            throw new IllegalArgumentException("Personality cannot be null");
        }
    }

    private static void checkDial(String name, float value) {
        if (value < 0.0f || value > 1.0f) {
            throw new IllegalArgumentException(name + " must be in [0, 1]: " + value);
        }
    }
}
