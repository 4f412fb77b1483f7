package com.mythos.core.achievement;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single unlockable achievement. Everything except the unlock state is fixed at creation;
 * {@link #unlock} is the only mutation and happens at most once.
 */
public class Achievement {

    private final String achievementId;
    private final String title;
    private final String description;
    private final AchievementCategory category;
    private final AchievementRarity rarity;
    private final List<AchievementCriteria> criteria;
    private final AchievementReward reward;
    private final boolean hidden;
    private final List<String> prerequisites;
    private final String cosmicSignificance;
    private final String flavorText;

    private boolean unlocked;
    private Instant unlockedAt;
    private Map<String, Object> unlockContext = Map.of();

    private Achievement(Builder builder) {
        if (builder.achievementId == null || builder.achievementId.isBlank()) {
            throw new IllegalArgumentException("achievementId must not be blank");
        }
        this.achievementId = builder.achievementId;
        this.title = builder.title == null ? builder.achievementId : builder.title;
        this.description = builder.description == null ? "" : builder.description;
        this.category = builder.category;
        this.rarity = builder.rarity;
        this.criteria = List.copyOf(builder.criteria);
        this.reward = builder.reward == null ? AchievementReward.RECOGNITION : builder.reward;
        this.hidden = builder.hidden;
        this.prerequisites = List.copyOf(builder.prerequisites);
        this.cosmicSignificance = builder.cosmicSignificance;
        this.flavorText = builder.flavorText;
    }

    public static Builder builder(String achievementId) {
        return new Builder(achievementId);
    }

    /**
     * Whether every prerequisite is in {@code unlockedIds} and every criterion holds.
     * Always {@code false} once unlocked.
     */
    public boolean isEligible(Map<String, Object> gameData, Map<String, Object> playerStats,
                              Collection<String> unlockedIds) {
        if (unlocked) {
            return false;
        }
        if (!unlockedIds.containsAll(prerequisites)) {
            return false;
        }
        return criteria.stream().allMatch(c -> c.isMet(gameData, playerStats));
    }

    /**
     * Unlocks the achievement.
     *
     * @return {@code false} when it was already unlocked
     */
    public boolean unlock(Instant when, Map<String, Object> context) {
        if (unlocked) {
            return false;
        }
        unlocked = true;
        unlockedAt = when;
        unlockContext = context == null ? Map.of() : new LinkedHashMap<>(context);
        return true;
    }

    /** Restores the unlock state from a save file. */
    void restoreUnlock(Instant when) {
        unlocked = true;
        unlockedAt = when;
    }

    public AchievementProgress progress(Map<String, Object> gameData, Map<String, Object> playerStats) {
        if (unlocked) {
            return new AchievementProgress(true, 1.0, criteria.size(), criteria.size(), null, unlockedAt);
        }
        int met = 0;
        String next = null;
        for (AchievementCriteria criterion : criteria) {
            if (criterion.isMet(gameData, playerStats)) {
                met++;
            } else if (next == null) {
                next = criterion.describe();
            }
        }
        double fraction = criteria.isEmpty() ? 0.0 : (double) met / criteria.size();
        return new AchievementProgress(false, fraction, met, criteria.size(), next, null);
    }

    public Map<String, Object> toDisplayMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("achievement_id", achievementId);
        map.put("title", title);
        map.put("description", description);
        map.put("category", category.value());
        map.put("rarity", rarity.weight());
        map.put("unlocked", unlocked);
        map.put("unlock_timestamp", unlockedAt);
        map.put("hidden", hidden);
        map.put("cosmic_significance", cosmicSignificance);
        map.put("flavor_text", flavorText);
        return map;
    }

    public String getAchievementId() {
        return achievementId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public AchievementCategory getCategory() {
        return category;
    }

    public AchievementRarity getRarity() {
        return rarity;
    }

    public List<AchievementCriteria> getCriteria() {
        return criteria;
    }

    public AchievementReward getReward() {
        return reward;
    }

    public boolean isHidden() {
        return hidden;
    }

    public List<String> getPrerequisites() {
        return prerequisites;
    }

    public Optional<String> getCosmicSignificance() {
        return Optional.ofNullable(cosmicSignificance);
    }

    public Optional<String> getFlavorText() {
        return Optional.ofNullable(flavorText);
    }

    public boolean isUnlocked() {
        return unlocked;
    }

    public Optional<Instant> getUnlockedAt() {
        return Optional.ofNullable(unlockedAt);
    }

    public Map<String, Object> getUnlockContext() {
        return unlockContext;
    }

    @Override
    public String toString() {
        return "Achievement{" + achievementId + ", " + rarity + (unlocked ? ", unlocked" : "") + "}";
    }

    public static final class Builder {
        private final String achievementId;
        private String title;
        private String description;
        private AchievementCategory category = AchievementCategory.MASTERY;
        private AchievementRarity rarity = AchievementRarity.COMMON;
        private final List<AchievementCriteria> criteria = new ArrayList<>();
        private AchievementReward reward;
        private boolean hidden;
        private final List<String> prerequisites = new ArrayList<>();
        private String cosmicSignificance;
        private String flavorText;

        private Builder(String achievementId) {
            this.achievementId = achievementId;
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder category(AchievementCategory category) { this.category = category; return this; }
        public Builder rarity(AchievementRarity rarity) { this.rarity = rarity; return this; }
        public Builder criterion(AchievementCriteria criterion) { this.criteria.add(criterion); return this; }
        public Builder reward(AchievementReward reward) { this.reward = reward; return this; }
        public Builder hidden(boolean hidden) { this.hidden = hidden; return this; }
        public Builder prerequisite(String achievementId) { this.prerequisites.add(achievementId); return this; }
        public Builder cosmicSignificance(String text) { this.cosmicSignificance = text; return this; }
        public Builder flavorText(String text) { this.flavorText = text; return this; }

        public Achievement build() {
            return new Achievement(this);
        }
    }
}
