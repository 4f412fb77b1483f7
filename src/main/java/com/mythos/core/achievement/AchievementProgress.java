package com.mythos.core.achievement;

import java.time.Instant;

/**
 * Progress view of one achievement.
 *
 * @param unlocked       whether it is already unlocked
 * @param progress       fraction of satisfied criteria, 1.0 once unlocked
 * @param metCriteria    satisfied criteria
 * @param totalCriteria  all criteria
 * @param nextCriterion  description of the first unmet criterion, {@code null} when none
 * @param unlockedAt     unlock time, {@code null} while locked
 */
public record AchievementProgress(
        boolean unlocked,
        double progress,
        int metCriteria,
        int totalCriteria,
        String nextCriterion,
        Instant unlockedAt
) {}
