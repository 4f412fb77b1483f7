package com.mythos.core.achievement;

/**
 * Rarity of an achievement; the weight also drives the completion percentage.
 */
public enum AchievementRarity {
    COMMON(1),
    UNCOMMON(2),
    RARE(3),
    EPIC(4),
    LEGENDARY(5),
    COSMIC(6);

    private final int weight;

    AchievementRarity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public String label() {
        return name().toLowerCase();
    }
}
