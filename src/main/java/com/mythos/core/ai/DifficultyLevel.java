package com.mythos.core.ai;

import java.util.Optional;

public enum DifficultyLevel {
    TRIVIAL(1),
    EASY(2),
    NORMAL(3),
    HARD(4),
    EXTREME(5),
    IMPOSSIBLE(6);

    private final int level;

    DifficultyLevel(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static Optional<DifficultyLevel> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (DifficultyLevel difficulty : values()) {
            if (difficulty.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(difficulty);
            }
        }
        return Optional.empty();
    }
}
