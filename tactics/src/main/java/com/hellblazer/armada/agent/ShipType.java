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
 * Hull classes flown by the hostile squadrons.
 * <p>
 * Each class carries the value other agents assign to rescuing it when it calls for support, and its standing when
 * a formation elects a new leader.
 *
 * @author hal.hildebrand
 */
public enum ShipType {
    SCOUT(0.6f, 10, 0.6f), FIGHTER(0.8f, 20, 1.0f), BOMBER(1.0f, 15, 0.8f), INTERCEPTOR(0.4f, 5, 0.4f),
    COMMANDER(0.5f, 0, 0.5f);

    private final float supportPriority;
    private final int   leadershipScore;
    private final float leadershipAptitude;

    ShipType(float supportPriority, int leadershipScore, float leadershipAptitude) {
        this.supportPriority = supportPriority;
        this.leadershipScore = leadershipScore;
        this.leadershipAptitude = leadershipAptitude;
    }

    /**
     * Weight of this ship type in the support request priority blend, in [0, 1].
     */
    public float supportPriority() {
        return supportPriority;
    }

    /**
     * Bonus added to a candidate's score during leader election.
     */
    public int leadershipScore() {
        return leadershipScore;
    }

    /**
     * Standing of this type when a formation member challenges its leader, in [0, 1].
     */
    public float leadershipAptitude() {
        return leadershipAptitude;
    }
}
