package com.mythos.core.ai;

import com.mythos.core.model.ObjectiveModifier;
import com.mythos.core.model.StateValues;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.layered.ShortTermObjective;
import com.mythos.core.objective.sanity.SanityIntegratedObjective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Keeps players near the target success rate.
 *
 * <p>Positive adjustments make objectives easier, negative ones harder. Adjustments are pushed
 * onto the objective as modifiers tagged {@link #SOURCE}; the definition is never rewritten and a
 * new adjustment replaces the previous one.
 */
public class DynamicDifficultyAdjuster {

    private static final Logger log = LoggerFactory.getLogger(DynamicDifficultyAdjuster.class);

    public static final String SOURCE = "difficulty";

    private final AiProperties properties;

    public DynamicDifficultyAdjuster(AiProperties properties) {
        this.properties = properties;
    }

    public PerformanceSummary analyzePerformance(List<Map<String, Object>> objectiveHistory) {
        if (objectiveHistory == null || objectiveHistory.isEmpty()) {
            return PerformanceSummary.EMPTY;
        }
        int window = Math.max(1, properties.getPerformanceWindow());
        List<Map<String, Object>> recent = objectiveHistory.subList(
                Math.max(0, objectiveHistory.size() - window), objectiveHistory.size());

        double successRate = successRate(recent);
        double averageDifficulty = recent.stream()
                .mapToDouble(o -> StateValues.getDouble(o, "difficulty_level", 3))
                .average()
                .orElse(3.0);

        double trend = 0.0;
        if (recent.size() >= 5) {
            int half = recent.size() / 2;
            trend = successRate(recent.subList(half, recent.size())) - successRate(recent.subList(0, half));
        }
        return new PerformanceSummary(successRate, averageDifficulty, trend, recent.size());
    }

    private static double successRate(List<Map<String, Object>> records) {
        long successes = records.stream().filter(o -> StateValues.getBoolean(o, "completed")).count();
        return successes / (double) records.size();
    }

    /**
     * Returns the adjustment in [-1, 1]: a success rate above target or an improving trend
     * pushes towards harder (negative).
     */
    public double calculateAdjustment(PerformanceSummary performance) {
        double sensitivity = properties.getAdjustmentSensitivity();
        double rateDifference = performance.successRate() - properties.getTargetSuccessRate();
        double base = -rateDifference * sensitivity * 2;
        double trendAdjustment = -performance.trend() * sensitivity;
        return Math.max(-1.0, Math.min(1.0, base + trendAdjustment));
    }

    /**
     * Replaces any earlier difficulty modifiers on {@code objective} with ones derived from
     * {@code adjustment}. Terminal objectives are left alone.
     *
     * @return number of modifiers added
     */
    public int applyAdjustment(Objective objective, double adjustment) {
        if (objective.isTerminal()) {
            return 0;
        }
        objective.removeModifiers(SOURCE);
        if (adjustment == 0.0) {
            return 0;
        }
        boolean easier = adjustment > 0;
        int added = 0;

        if (objective.getTimeLimit().isPresent()) {
            double factor = easier ? 1 + adjustment * 0.5 : 1 + adjustment * 0.3;
            added += push(objective, ObjectiveModifier.timeLimitScale(factor, SOURCE));
        }
        if (objective instanceof ShortTermObjective) {
            double factor = easier ? 1 - adjustment * 0.3 : 1 - adjustment * 0.2;
            added += push(objective, ObjectiveModifier.milestoneScale(factor, SOURCE));
        }
        if (objective instanceof SanityIntegratedObjective) {
            double factor = easier ? 1 - adjustment * 0.4 : 1 - adjustment * 0.3;
            added += push(objective, ObjectiveModifier.riskScale(factor, SOURCE));
        }
        if (adjustment > 0.5) {
            added += push(objective, ObjectiveModifier.priorityShift(-1, SOURCE));
        } else if (adjustment < -0.5) {
            added += push(objective, ObjectiveModifier.priorityShift(1, SOURCE));
        }

        log.debug("Applied difficulty adjustment {} to {} ({} modifiers)",
                String.format("%.3f", adjustment), objective.getObjectiveId(), added);
        return added;
    }

    private static int push(Objective objective, ObjectiveModifier modifier) {
        return objective.addModifier(modifier) ? 1 : 0;
    }
}
