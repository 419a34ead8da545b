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

import com.hellblazer.armada.agent.ShipType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Group tactics the planner chooses between, each with the conditions a group must meet to attempt it.
 *
 * @author hal.hildebrand
 */
public enum TacticType {
    DIRECT_ASSAULT(2, 0.6f),
    FLANKING_MANEUVER(3, 0.0f, ShipType.INTERCEPTOR, ShipType.FIGHTER),
    PINCER_MOVEMENT(4, 0.5f),
    DEFENSIVE_FORMATION(1, 0.3f),
    HIT_AND_RUN(1, 0.0f, ShipType.SCOUT, ShipType.INTERCEPTOR),
    SUPPRESSION_BOMBARDMENT(1, 0.0f, ShipType.BOMBER);

    private final int           minAllies;
    private final float         minHealthRatio;
    private final Set<ShipType> requiredTypes;

    TacticType(int minAllies, float minHealthRatio, ShipType... requiredTypes) {
        this.minAllies = minAllies;
        this.minHealthRatio = minHealthRatio;
        this.requiredTypes = requiredTypes.length == 0 ? EnumSet.noneOf(ShipType.class) : EnumSet.of(requiredTypes[0],
                                                                                                      requiredTypes);
    }

    public int minAllies() {
        return minAllies;
    }

    public float minHealthRatio() {
        return minHealthRatio;
    }

    public Set<ShipType> requiredTypes() {
        return Collections.unmodifiableSet(requiredTypes);
    }

    /**
     * Whether a group in this situation is able to attempt the tactic: enough ships, healthy enough on average and
     * with every required ship type present.
     */
    public boolean admits(TacticalSituation situation) {
        return situation.allyCount() >= minAllies && situation.averageHealth() >= minHealthRatio
        && situation.shipTypes().containsAll(requiredTypes);
    }
}
