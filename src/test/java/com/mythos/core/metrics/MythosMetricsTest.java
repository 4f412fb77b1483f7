package com.mythos.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MythosMetricsTest {

    private SimpleMeterRegistry registry;
    private MythosMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MythosMetrics(registry);
    }

    @Test
    @DisplayName("recordTurnDuration creates a timer")
    void recordTurnDuration() {
        metrics.recordTurnDuration(40);
        var timer = registry.find("mythos.turn.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordOutcome increments by status tag")
    void recordOutcome() {
        metrics.recordOutcome("completed");
        metrics.recordOutcome("completed");
        metrics.recordOutcome("expired");

        var completed = registry.find("mythos.objectives.outcomes").tag("status", "completed").counter();
        var expired = registry.find("mythos.objectives.outcomes").tag("status", "expired").counter();

        assertNotNull(completed);
        assertNotNull(expired);
        assertEquals(2.0, completed.count());
        assertEquals(1.0, expired.count());
    }

    @Test
    @DisplayName("recordAdmissionDeferral tags the cap that was hit")
    void recordAdmissionDeferral() {
        metrics.recordAdmissionDeferral("immediate");

        var counter = registry.find("mythos.objectives.deferred").tag("cap", "immediate").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordRetentionEvictions records the sweep size")
    void recordRetentionEvictions() {
        metrics.recordRetentionEvictions(3);

        var summary = registry.find("mythos.objectives.evicted").summary();
        assertNotNull(summary);
        assertEquals(3.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordAnalysisFallback increments by reason tag")
    void recordAnalysisFallback() {
        metrics.recordAnalysisFallback("timeout");

        var counter = registry.find("mythos.ai.fallbacks").tag("reason", "timeout").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordDifficultyAdjustment records magnitude with direction tag")
    void recordDifficultyAdjustment() {
        metrics.recordDifficultyAdjustment(-0.04);

        var summary = registry.find("mythos.ai.difficulty_adjustment").tag("direction", "harder").summary();
        assertNotNull(summary);
        assertEquals(0.04, summary.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordAchievementUnlock increments by rarity tag")
    void recordAchievementUnlock() {
        metrics.recordAchievementUnlock("legendary");

        var counter = registry.find("mythos.achievements.unlocked").tag("rarity", "legendary").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
