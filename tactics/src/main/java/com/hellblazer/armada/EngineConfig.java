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
package com.hellblazer.armada;

import com.hellblazer.armada.difficulty.DifficultyLevel;

/**
 * Tunable knobs of the coordination engine.
 * <p>
 * Instances are immutable and validated when built: negative or non-finite ranges, intervals and capacities are
 * rejected with {@link IllegalArgumentException} rather than silently clamped.
 *
 * @author hal.hildebrand
 */
public class EngineConfig {

    private final float           communicationRange;
    private final float           messageProcessingInterval;
    private final int             messageHistorySize;
    private final int             messageQueueCapacity;
    private final float           evaluationInterval;
    private final float           adaptationRate;
    private final DifficultyLevel initialDifficulty;
    private final float           tierHysteresis;
    private final float           allySearchRadius;
    private final float           statusReportInterval;
    private final float           sightingReportInterval;
    private final float           threatCellSize;
    private final int             eventFeedCapacity;
    private final float           formationUpdateInterval;
    private final float           worldRadius;
    private final float           tacticalUpdateInterval;
    private final float           swarmUpdateInterval;
    private final float           separationRadius;
    private final float           alignmentRadius;
    private final float           cohesionRadius;
    private final float           separationWeight;
    private final float           alignmentWeight;
    private final float           cohesionWeight;
    private final float           avoidanceWeight;
    private final float           flockRadius;

    private EngineConfig(Builder builder) {
        this.communicationRange = builder.communicationRange;
        this.messageProcessingInterval = builder.messageProcessingInterval;
        this.messageHistorySize = builder.messageHistorySize;
        this.messageQueueCapacity = builder.messageQueueCapacity;
        this.evaluationInterval = builder.evaluationInterval;
        this.adaptationRate = builder.adaptationRate;
        this.initialDifficulty = builder.initialDifficulty;
        this.tierHysteresis = builder.tierHysteresis;
        this.allySearchRadius = builder.allySearchRadius;
        this.statusReportInterval = builder.statusReportInterval;
        this.sightingReportInterval = builder.sightingReportInterval;
        this.threatCellSize = builder.threatCellSize;
        this.eventFeedCapacity = builder.eventFeedCapacity;
        this.formationUpdateInterval = builder.formationUpdateInterval;
        this.worldRadius = builder.worldRadius;
        this.tacticalUpdateInterval = builder.tacticalUpdateInterval;
        this.swarmUpdateInterval = builder.swarmUpdateInterval;
        this.separationRadius = builder.separationRadius;
        this.alignmentRadius = builder.alignmentRadius;
        this.cohesionRadius = builder.cohesionRadius;
        this.separationWeight = builder.separationWeight;
        this.alignmentWeight = builder.alignmentWeight;
        this.cohesionWeight = builder.cohesionWeight;
        this.avoidanceWeight = builder.avoidanceWeight;
        this.flockRadius = builder.flockRadius;
    }

    /**
     * Creates a new builder populated with the default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Maximum straight-line distance between a broadcasting agent and a recipient.
     */
    public float getCommunicationRange() {
        return communicationRange;
    }

    /**
     * Seconds between drain passes of each agent's communication endpoint.
     */
    public float getMessageProcessingInterval() {
        return messageProcessingInterval;
    }

    public int getMessageHistorySize() {
        return messageHistorySize;
    }

    public int getMessageQueueCapacity() {
        return messageQueueCapacity;
    }

    /**
     * Seconds between difficulty evaluations.
     */
    public float getEvaluationInterval() {
        return evaluationInterval;
    }

    public float getAdaptationRate() {
        return adaptationRate;
    }

    public DifficultyLevel getInitialDifficulty() {
        return initialDifficulty;
    }

    /**
     * Dead band around tier breakpoints; zero disables hysteresis.
     */
    public float getTierHysteresis() {
        return tierHysteresis;
    }

    public float getAllySearchRadius() {
        return allySearchRadius;
    }

    public float getStatusReportInterval() {
        return statusReportInterval;
    }

    public float getSightingReportInterval() {
        return sightingReportInterval;
    }

    public float getThreatCellSize() {
        return threatCellSize;
    }

    public int getEventFeedCapacity() {
        return eventFeedCapacity;
    }

    public float getFormationUpdateInterval() {
        return formationUpdateInterval;
    }

    /**
     * Half extent of the cubic play volume centered on the origin.
     */
    public float getWorldRadius() {
        return worldRadius;
    }

    /**
     * Seconds between tactical planning passes over each group.
     */
    public float getTacticalUpdateInterval() {
        return tacticalUpdateInterval;
    }

    /**
     * Seconds between swarm steering and emergent behavior passes.
     */
    public float getSwarmUpdateInterval() {
        return swarmUpdateInterval;
    }

    public float getSeparationRadius() {
        return separationRadius;
    }

    public float getAlignmentRadius() {
        return alignmentRadius;
    }

    /**
     * Neighbors farther than this take no part in any swarm rule.
     */
    public float getCohesionRadius() {
        return cohesionRadius;
    }

    public float getSeparationWeight() {
        return separationWeight;
    }

    public float getAlignmentWeight() {
        return alignmentWeight;
    }

    public float getCohesionWeight() {
        return cohesionWeight;
    }

    public float getAvoidanceWeight() {
        return avoidanceWeight;
    }

    /**
     * Distance within which unformed ships count toward a spontaneous flock.
     */
    public float getFlockRadius() {
        return flockRadius;
    }

    @Override
    public String toString() {
        return String.format(
        "EngineConfig[range=%.1f, drain=%.2fs, history=%d, queue=%d, evaluation=%.1fs, rate=%.2f, initial=%s, hysteresis=%.2f]",
        communicationRange, messageProcessingInterval, messageHistorySize, messageQueueCapacity, evaluationInterval,
        adaptationRate, initialDifficulty, tierHysteresis);
    }

    /**
     * Builder for EngineConfig
     */
    public static class Builder {
        private float           communicationRange        = 150.0f;
        private float           messageProcessingInterval = 0.2f;
        private int             messageHistorySize        = 50;
        private int             messageQueueCapacity      = 256;
        private float           evaluationInterval        = 10.0f;
        private float           adaptationRate            = 0.1f;
        private DifficultyLevel initialDifficulty         = DifficultyLevel.MEDIUM;
        private float           tierHysteresis            = 0.0f;
        private float           allySearchRadius          = 100.0f;
        private float           statusReportInterval      = 3.0f;
        private float           sightingReportInterval    = 1.0f;
        private float           threatCellSize            = 25.0f;
        private int             eventFeedCapacity         = 128;
        private float           formationUpdateInterval   = 1.0f;
        private float           worldRadius               = 500.0f;
        private float           tacticalUpdateInterval    = 3.0f;
        private float           swarmUpdateInterval       = 0.1f;
        private float           separationRadius          = 25.0f;
        private float           alignmentRadius           = 40.0f;
        private float           cohesionRadius            = 60.0f;
        private float           separationWeight          = 2.0f;
        private float           alignmentWeight           = 1.0f;
        private float           cohesionWeight            = 1.5f;
        private float           avoidanceWeight           = 3.0f;
        private float           flockRadius               = 80.0f;

        private Builder() {
        }

        public Builder withCommunicationRange(float range) {
            this.communicationRange = nonNegative("Communication range", range);
            return this;
        }

        public Builder withMessageProcessingInterval(float seconds) {
            this.messageProcessingInterval = nonNegative("Message processing interval", seconds);
            return this;
        }

        public Builder withMessageHistorySize(int size) {
            this.messageHistorySize = positive("Message history size", size);
            return this;
        }

        public Builder withMessageQueueCapacity(int capacity) {
            this.messageQueueCapacity = positive("Message queue capacity", capacity);
            return this;
        }

        public Builder withEvaluationInterval(float seconds) {
            this.evaluationInterval = nonNegative("Evaluation interval", seconds);
            return this;
        }

        /**
         * @param rate fraction of the gap to the target difficulty closed per evaluation, in (0, 1]
         */
        public Builder withAdaptationRate(float rate) {
            if (!Float.isFinite(rate) || rate <= 0.0f || rate > 1.0f) {
                throw new IllegalArgumentException("Adaptation rate must be in (0, 1]: " + rate);
            }
            this.adaptationRate = rate;
            return this;
        }

        public Builder withInitialDifficulty(DifficultyLevel level) {
            if (level == null) {
                throw new IllegalArgumentException("Initial difficulty cannot be null");
            }
            this.initialDifficulty = level;
            return this;
        }

        public Builder withTierHysteresis(float band) {
            if (!Float.isFinite(band) || band < 0.0f || band >= 0.1f) {
                throw new IllegalArgumentException("Tier hysteresis must be in [0, 0.1): " + band);
            }
            this.tierHysteresis = band;
            return this;
        }

        public Builder withAllySearchRadius(float radius) {
            this.allySearchRadius = nonNegative("Ally search radius", radius);
            return this;
        }

        public Builder withStatusReportInterval(float seconds) {
            this.statusReportInterval = nonNegative("Status report interval", seconds);
            return this;
        }

        public Builder withSightingReportInterval(float seconds) {
            this.sightingReportInterval = nonNegative("Sighting report interval", seconds);
            return this;
        }

        public Builder withThreatCellSize(float size) {
            if (!Float.isFinite(size) || size <= 0.0f) {
                throw new IllegalArgumentException("Threat cell size must be positive: " + size);
            }
            this.threatCellSize = size;
            return this;
        }

        public Builder withEventFeedCapacity(int capacity) {
            this.eventFeedCapacity = positive("Event feed capacity", capacity);
            return this;
        }

        public Builder withFormationUpdateInterval(float seconds) {
            this.formationUpdateInterval = nonNegative("Formation update interval", seconds);
            return this;
        }

        public Builder withWorldRadius(float radius) {
            if (!Float.isFinite(radius) || radius <= 0.0f) {
                throw new IllegalArgumentException("World radius must be positive: " + radius);
            }
            this.worldRadius = radius;
            return this;
        }

        public Builder withTacticalUpdateInterval(float seconds) {
            this.tacticalUpdateInterval = nonNegative("Tactical update interval", seconds);
            return this;
        }

        public Builder withSwarmUpdateInterval(float seconds) {
            this.swarmUpdateInterval = nonNegative("Swarm update interval", seconds);
            return this;
        }

        /**
         * @throws IllegalArgumentException unless every radius is positive and the cohesion radius is the largest
         */
        public Builder withSwarmRadii(float separation, float alignment, float cohesion) {
            positive("Separation radius", separation);
            positive("Alignment radius", alignment);
            positive("Cohesion radius", cohesion);
            if (cohesion < separation || cohesion < alignment) {
                throw new IllegalArgumentException(
                "Cohesion radius " + cohesion + " must cover separation " + separation + " and alignment "
                + alignment);
            }
            this.separationRadius = separation;
            this.alignmentRadius = alignment;
            this.cohesionRadius = cohesion;
            return this;
        }

        /**
         * Relative weights of the four steering rules. A zero weight disables its rule.
         */
        public Builder withSwarmWeights(float separation, float alignment, float cohesion, float avoidance) {
            this.separationWeight = nonNegative("Separation weight", separation);
            this.alignmentWeight = nonNegative("Alignment weight", alignment);
            this.cohesionWeight = nonNegative("Cohesion weight", cohesion);
            this.avoidanceWeight = nonNegative("Avoidance weight", avoidance);
            return this;
        }

        public Builder withFlockRadius(float radius) {
            this.flockRadius = positive("Flock radius", radius);
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        private static float nonNegative(String name, float value) {
            if (!Float.isFinite(value) || value < 0.0f) {
                throw new IllegalArgumentException(name + " must be non-negative: " + value);
            }
            return value;
        }

        private static float positive(String name, float value) {
            if (!Float.isFinite(value) || value <= 0.0f) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }

        private static int positive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
