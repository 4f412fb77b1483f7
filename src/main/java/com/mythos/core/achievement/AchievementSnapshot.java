package com.mythos.core.achievement;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Save-file shape of the achievement progress.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AchievementSnapshot(
        @JsonProperty("unlocked_achievements") List<String> unlockedAchievements,
        @JsonProperty("unlocked_at") Map<String, Instant> unlockedAt,
        @JsonProperty("unlock_history") List<UnlockRecord> unlockHistory,
        @JsonProperty("saved_at") Instant savedAt
) {

    public AchievementSnapshot {
        unlockedAchievements = unlockedAchievements == null ? List.of() : List.copyOf(unlockedAchievements);
        unlockedAt = unlockedAt == null ? Map.of() : Map.copyOf(unlockedAt);
        unlockHistory = unlockHistory == null ? List.of() : List.copyOf(unlockHistory);
    }
}
