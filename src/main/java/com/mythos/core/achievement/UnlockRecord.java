package com.mythos.core.achievement;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record UnlockRecord(
        @JsonProperty("achievement_id") String achievementId,
        @JsonProperty("title") String title,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("rarity") int rarity,
        @JsonProperty("category") String category
) {}
