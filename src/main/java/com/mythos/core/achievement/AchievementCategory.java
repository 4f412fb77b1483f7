package com.mythos.core.achievement;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AchievementCategory {
    SURVIVAL("survival"),
    KNOWLEDGE("knowledge"),
    INVESTIGATION("investigation"),
    SOCIAL("social"),
    EXPLORATION("exploration"),
    HORROR("horror"),
    MASTERY("mastery"),
    NARRATIVE("narrative"),
    META("meta"),
    SECRET("secret");

    private final String value;

    AchievementCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AchievementCategory fromValue(String value) {
        for (AchievementCategory category : values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown achievement category: " + value);
    }
}
