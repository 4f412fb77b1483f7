package com.mythos.core.ai;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum PlayerBehaviorPattern {
    CAUTIOUS("cautious"),
    AGGRESSIVE("aggressive"),
    INVESTIGATIVE("investigative"),
    SOCIAL("social"),
    SURVIVAL("survival"),
    EXPLORER("explorer"),
    PUZZLE_SOLVER("puzzle_solver"),
    HORROR_SEEKER("horror_seeker");

    private final String value;

    PlayerBehaviorPattern(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<PlayerBehaviorPattern> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PlayerBehaviorPattern pattern : values()) {
            if (pattern.value.equalsIgnoreCase(value.trim()) || pattern.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
