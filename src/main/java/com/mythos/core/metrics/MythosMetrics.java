package com.mythos.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for objective orchestration.
 */
@Service
public class MythosMetrics {

    private final MeterRegistry registry;

    public MythosMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTurnDuration(long ms) {
        Timer.builder("mythos.turn.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordActivation(String scope) {
        Counter.builder("mythos.objectives.activated")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    /**
     * Records an objective reaching a terminal status.
     *
     * @param status "completed", "failed", "expired" or "abandoned"
     */
    public void recordOutcome(String status) {
        Counter.builder("mythos.objectives.outcomes")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records an objective held back by a capacity cap.
     *
     * @param cap "total", "immediate" or "short_term"
     */
    public void recordAdmissionDeferral(String cap) {
        Counter.builder("mythos.objectives.deferred")
                .description("Activations deferred by capacity caps")
                .tag("cap", cap)
                .register(registry)
                .increment();
    }

    public void recordForcedFailure() {
        Counter.builder("mythos.objectives.forced_failures")
                .description("Objectives failed because their update threw")
                .register(registry)
                .increment();
    }

    public void recordRetentionEvictions(int count) {
        DistributionSummary.builder("mythos.objectives.evicted")
                .description("Terminal objectives evicted per sweep")
                .register(registry)
                .record(count);
    }

    public void recordAchievementUnlock(String rarity) {
        Counter.builder("mythos.achievements.unlocked")
                .tag("rarity", rarity)
                .register(registry)
                .increment();
    }

    public void recordSuggestions(int count) {
        DistributionSummary.builder("mythos.ai.suggestions")
                .register(registry)
                .record(count);
    }

    /**
     * Records the AI path falling back to heuristics.
     *
     * @param reason "timeout", "error" or "disabled"
     */
    public void recordAnalysisFallback(String reason) {
        Counter.builder("mythos.ai.fallbacks")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records the size of a difficulty adjustment; the sign goes into the {@code direction} tag.
     */
    public void recordDifficultyAdjustment(double adjustment) {
        DistributionSummary.builder("mythos.ai.difficulty_adjustment")
                .tag("direction", adjustment > 0 ? "easier" : adjustment < 0 ? "harder" : "none")
                .register(registry)
                .record(Math.abs(adjustment));
    }
}
