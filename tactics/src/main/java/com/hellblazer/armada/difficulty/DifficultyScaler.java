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

import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.formation.FormationController;
import com.hellblazer.armada.formation.FormationType;
import com.hellblazer.armada.geometry.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Proportional controller that moves the difficulty score toward a target derived from player performance.
 * <p>
 * The score is re-evaluated every evaluation interval. A tier change swaps the {@link EnhancementSettings} and
 * notifies listeners, which are expected to reapply the settings to live agents and formations through
 * {@link #applyTo(AgentShip)} and {@link #applyTo(FormationController)}.
 *
 * @author hal.hildebrand
 */
public class DifficultyScaler {

    public static final float MIN_ADAPTATION_RATE = 0.01f;

    private static final Logger log = LoggerFactory.getLogger(DifficultyScaler.class);

    private final PlayerPerformanceTracker tracker;
    private final float                    evaluationInterval;
    private final float                    hysteresis;
    private final List<DifficultyListener> listeners = new CopyOnWriteArrayList<>();
    private       float                    adaptationRate;
    private       float                    score;
    private       DifficultyLevel          level;
    private       EnhancementSettings      settings;
    private       float                    sinceEvaluation;

    public DifficultyScaler(EngineConfig config, PlayerPerformanceTracker tracker) {
        this.tracker = tracker;
        this.evaluationInterval = config.getEvaluationInterval();
        this.hysteresis = config.getTierHysteresis();
        this.adaptationRate = config.getAdaptationRate();
        this.level = config.getInitialDifficulty();
        this.score = level.canonicalScore();
        this.settings = EnhancementSettings.forLevel(level);
    }

    /**
     * Desired difficulty for the observed performance, in [0, 1].
     */
    public static float targetDifficulty(PlayerPerformance performance) {
        float target = 0.5f;
        if (performance.averageSurvivalTime() > 120.0f) {
            target += 0.2f;
        } else if (performance.averageSurvivalTime() < 30.0f) {
            target -= 0.3f;
        }
        if (performance.killDeathRatio() > 2.0f) {
            target += 0.3f;
        } else if (performance.killDeathRatio() < 0.5f) {
            target -= 0.2f;
        }
        if (performance.accuracy() > 0.8f) {
            target += 0.1f;
        } else if (performance.accuracy() < 0.3f) {
            target -= 0.1f;
        }
        if (performance.recentDeathStreak() >= 3) {
            target -= 0.4f;
        }
        if (performance.timeSinceLastDeath() > 180.0f) {
            target += 0.2f;
        }
        return Vectors.clamp01(target);
    }

    /**
     * Tier for {@code score} given the tier currently in force. With a positive band the tier only moves once the
     * score has cleared the crossed breakpoint by the band.
     */
    public static DifficultyLevel tierFor(float score, DifficultyLevel current, float band) {
        var raw = DifficultyLevel.fromScore(score);
        if (band <= 0.0f || raw == current) {
            return raw;
        }
        if (raw.ordinal() > current.ordinal()) {
            var shifted = DifficultyLevel.fromScore(score - band);
            return shifted.ordinal() > current.ordinal() ? shifted : current;
        }
        var shifted = DifficultyLevel.fromScore(score + band);
        return shifted.ordinal() < current.ordinal() ? shifted : current;
    }

    /**
     * Advance the evaluation timer, carrying any overshoot into the next interval.
     *
     * @return true if an evaluation ran
     */
    public boolean update(float deltaTime) {
        sinceEvaluation += deltaTime;
        if (sinceEvaluation < evaluationInterval) {
            return false;
        }
        sinceEvaluation = Math.min(sinceEvaluation - evaluationInterval, evaluationInterval);
        evaluate();
        return true;
    }

    /**
     * One control step: snapshot performance, move the score toward the target, and switch tiers if needed.
     */
    public void evaluate() {
        var performance = tracker.performance();
        float target = targetDifficulty(performance);
        DifficultyLevel previous;
        DifficultyLevel next;
        synchronized (this) {
            score = Vectors.clamp01(score + (target - score) * adaptationRate);
            previous = level;
            next = tierFor(score, level, hysteresis);
            if (next != previous) {
                level = next;
                settings = EnhancementSettings.forLevel(next);
            }
        }
        log.trace("Difficulty target {} score {} tier {}", target, score, next);
        if (next != previous) {
            log.info("Difficulty {} -> {} (score {})", previous, next, String.format("%.3f", score));
            fireChanged(previous, next);
        }
    }

    /**
     * Manual override: jump to the tier's midpoint score and notify listeners.
     */
    public void setDifficulty(DifficultyLevel newLevel) {
        DifficultyLevel previous;
        synchronized (this) {
            previous = level;
            level = newLevel;
            score = newLevel.canonicalScore();
            settings = EnhancementSettings.forLevel(newLevel);
        }
        log.info("Difficulty set {} -> {}", previous, newLevel);
        fireChanged(previous, newLevel);
    }

    public synchronized void setAdaptationRate(float rate) {
        adaptationRate = Vectors.clamp(rate, MIN_ADAPTATION_RATE, 1.0f);
    }

    /**
     * Apply the current tier's multipliers to an agent's baseline.
     */
    public void applyTo(AgentShip agent) {
        agent.applyModifiers(settings().modifiers());
    }

    /**
     * Apply the current tier's spacing and geometry upgrades to a formation.
     */
    public void applyTo(FormationController formation) {
        var current = level();
        formation.setBaseScale(current.formationScale());
        var type = formation.type();
        switch (current) {
            case HARD -> {
                if (type == FormationType.V_FORMATION) {
                    formation.changeFormation(FormationType.DIAMOND);
                }
            }
            case VERY_HARD -> {
                if (type != FormationType.SPHERE && type != FormationType.HELIX) {
                    formation.changeFormation(FormationType.SPHERE);
                }
            }
            default -> {
            }
        }
    }

    public void addListener(DifficultyListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DifficultyListener listener) {
        listeners.remove(listener);
    }

    public synchronized float score() {
        return score;
    }

    public synchronized DifficultyLevel level() {
        return level;
    }

    public synchronized EnhancementSettings settings() {
        return settings;
    }

    public synchronized float adaptationRate() {
        return adaptationRate;
    }

    public PlayerPerformanceTracker tracker() {
        return tracker;
    }

    private void fireChanged(DifficultyLevel previous, DifficultyLevel current) {
        for (var listener : listeners) {
            listener.onDifficultyChanged(previous, current);
        }
    }
}
