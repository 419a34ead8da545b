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
package com.hellblazer.armada.tactical;

/**
 * An admissible tactic with its rated effectiveness for the current situation and its track record.
 *
 * @author hal.hildebrand
 */
public record TacticalOption(TacticType type, float effectiveness, float successRate) {

    /**
     * Ranking score: effectiveness weighted by past success, where an untried tactic scores its effectiveness.
     */
    public float score() {
        return effectiveness * (0.5f + successRate);
    }
}
