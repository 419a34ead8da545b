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
 * Snapshot of how well the player is doing.
 *
 * @param averageSurvivalTime mean of recent lives, in seconds
 * @param killDeathRatio      kills per death
 * @param accuracy            hits per shot
 * @param recentDeathStreak   deaths in the last minute since the last kill
 * @param timeSinceLastDeath  seconds, {@link Float#MAX_VALUE} if the player has not died
 * @param currentSurvivalTime seconds since the last death or since tracking began
 * @author hal.hildebrand
 */
public record PlayerPerformance(float averageSurvivalTime, float killDeathRatio, float accuracy,
                                int recentDeathStreak, float timeSinceLastDeath, float currentSurvivalTime) {
}
