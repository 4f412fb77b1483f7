package com.mythos.core.ai;

/**
 * Recent objective performance over the rolling window.
 *
 * @param successRate       completed share of the window
 * @param averageDifficulty mean {@code difficulty_level} (1-6)
 * @param trend             second-half minus first-half success rate, 0 below five samples
 * @param sampleSize        number of records in the window
 */
public record PerformanceSummary(double successRate, double averageDifficulty, double trend, int sampleSize) {

    public static final PerformanceSummary EMPTY = new PerformanceSummary(0.5, 3.0, 0.0, 0);
}
