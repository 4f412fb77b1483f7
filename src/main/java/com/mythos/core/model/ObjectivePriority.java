package com.mythos.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Objective priority, from trivial (1) to cosmic (6).
 */
public enum ObjectivePriority {
    TRIVIAL(1),
    LOW(2),
    MEDIUM(3),
    HIGH(4),
    CRITICAL(5),
    COSMIC(6);

    private final int level;

    ObjectivePriority(int level) {
        this.level = level;
    }

    @JsonValue
    public int level() {
        return level;
    }

    /**
     * Returns the priority shifted by {@code delta} levels, clamped to [TRIVIAL, COSMIC].
     */
    public ObjectivePriority shift(int delta) {
        return ofLevel(Math.max(TRIVIAL.level, Math.min(COSMIC.level, level + delta)));
    }

    public boolean isAtLeast(ObjectivePriority other) {
        return level >= other.level;
    }

    @JsonCreator
    public static ObjectivePriority ofLevel(int level) {
        for (ObjectivePriority priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority level: " + level);
    }

    /**
     * Accepts a level number, a numeric string or an enum name.
     */
    public static ObjectivePriority parse(Object raw) {
        if (raw instanceof ObjectivePriority priority) {
            return priority;
        }
        if (raw instanceof Number number) {
            return ofLevel(number.intValue());
        }
        String text = String.valueOf(raw).trim();
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            return ofLevel(Integer.parseInt(text));
        }
        return valueOf(text.toUpperCase());
    }
}
