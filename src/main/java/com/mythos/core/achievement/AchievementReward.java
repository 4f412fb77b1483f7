package com.mythos.core.achievement;

import java.util.List;
import java.util.Map;

public record AchievementReward(
        String title,
        String description,
        List<String> unlockContent,
        Map<String, Double> statisticalBonus,
        List<String> cosmeticUnlocks,
        List<String> loreEntries
) {

    public static final AchievementReward RECOGNITION = of("Recognition", "Achievement unlocked");

    public AchievementReward {
        unlockContent = unlockContent == null ? List.of() : List.copyOf(unlockContent);
        statisticalBonus = statisticalBonus == null ? Map.of() : Map.copyOf(statisticalBonus);
        cosmeticUnlocks = cosmeticUnlocks == null ? List.of() : List.copyOf(cosmeticUnlocks);
        loreEntries = loreEntries == null ? List.of() : List.copyOf(loreEntries);
    }

    public static AchievementReward of(String title, String description) {
        return new AchievementReward(title, description, null, null, null, null);
    }
}
