package com.mythos.core.ai;

import com.mythos.core.model.ObjectiveModifier;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.layered.MetaObjective;
import com.mythos.core.objective.layered.ShortTermObjective;
import com.mythos.core.objective.sanity.CosmicInsightObjective;
import com.mythos.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DynamicDifficultyAdjusterTest {

    private MutableClock clock;
    private DynamicDifficultyAdjuster adjuster;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T20:00:00Z");
        adjuster = new DynamicDifficultyAdjuster(new AiProperties());
    }

    private static List<Map<String, Object>> history(boolean... completed) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (boolean c : completed) {
            records.add(Map.of("completed", c, "difficulty_level", 4));
        }
        return records;
    }

    @Test
    @DisplayName("too much success pushes towards harder")
    void successAboveTarget() {
        double adjustment = adjuster.calculateAdjustment(new PerformanceSummary(0.9, 3.0, 0.0, 10));
        assertEquals(-0.04, adjustment, 1e-9);
    }

    @Test
    @DisplayName("an improving trend pushes further towards harder")
    void improvingTrend() {
        double adjustment = adjuster.calculateAdjustment(new PerformanceSummary(0.7, 3.0, 0.2, 10));
        assertEquals(-0.02, adjustment, 1e-9);
    }

    @Test
    @DisplayName("performance uses the most recent window and computes a trend")
    void analyzePerformance() {
        List<Map<String, Object>> records = history(true, true, true,
                false, false, false, false, false, true, true, true, true);

        PerformanceSummary summary = adjuster.analyzePerformance(records);

        assertEquals(10, summary.sampleSize());
        assertEquals(0.5, summary.successRate(), 1e-9);
        assertEquals(4.0, summary.averageDifficulty(), 1e-9);
        assertEquals(0.6, summary.trend(), 1e-9);
    }

    @Test
    @DisplayName("no history yields the neutral summary")
    void emptyHistory() {
        assertEquals(PerformanceSummary.EMPTY, adjuster.analyzePerformance(List.of()));
    }

    @Test
    @DisplayName("an easier adjustment stretches time, shrinks milestones and lowers priority")
    void easierAdjustment() {
        ShortTermObjective objective = new ShortTermObjective(ObjectiveDefinition.builder("cellar").build(), clock);

        assertEquals(3, adjuster.applyAdjustment(objective, 0.6));

        assertEquals(Duration.ofMinutes(26), objective.getTimeLimit().orElseThrow());
        assertEquals(ObjectivePriority.LOW, objective.getPriority());
        assertTrue(objective.getModifiers().stream().allMatch(m -> DynamicDifficultyAdjuster.SOURCE.equals(m.source())));
    }

    @Test
    @DisplayName("a new adjustment replaces the previous one")
    void replacesPreviousAdjustment() {
        ShortTermObjective objective = new ShortTermObjective(ObjectiveDefinition.builder("cellar").build(), clock);
        adjuster.applyAdjustment(objective, 0.6);

        assertEquals(0, adjuster.applyAdjustment(objective, 0.0));

        assertTrue(objective.getModifiers().isEmpty());
        assertEquals(Duration.ofMinutes(20), objective.getTimeLimit().orElseThrow());
        assertEquals(ObjectivePriority.MEDIUM, objective.getPriority());
    }

    @Test
    @DisplayName("only concepts the objective has are adjusted")
    void onlyApplicableModifiers() {
        MetaObjective meta = new MetaObjective(ObjectiveDefinition.builder("mastery").build(), clock);
        CosmicInsightObjective insight = new CosmicInsightObjective(
                ObjectiveDefinition.builder("tome").timeLimit(Duration.ofMinutes(30)).build(), clock);

        assertEquals(0, adjuster.applyAdjustment(meta, -0.3));
        assertEquals(2, adjuster.applyAdjustment(insight, -0.3));
        assertTrue(insight.getModifiers().stream().anyMatch(m -> m.kind() == ObjectiveModifier.Kind.RISK_SCALE));
    }

    @Test
    @DisplayName("terminal objectives are left alone")
    void terminalUntouched() {
        ShortTermObjective objective = new ShortTermObjective(ObjectiveDefinition.builder("cellar").build(), clock);
        objective.abandon("left town");

        assertEquals(0, adjuster.applyAdjustment(objective, 0.8));
        assertTrue(objective.getModifiers().isEmpty());
    }
}
