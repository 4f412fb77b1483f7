package com.mythos.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of reward granted on completion.
 */
public enum RewardType {
    NONE("none"),
    KNOWLEDGE("knowledge"),
    SKILL("skill"),
    ITEM("item"),
    ALLIANCE("alliance"),
    SAFETY("safety"),
    SANITY("sanity"),
    REVELATION("revelation"),
    SURVIVAL("survival"),
    COSMIC_INSIGHT("cosmic_insight");

    private final String value;

    RewardType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RewardType fromValue(String value) {
        for (RewardType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown reward type: " + value);
    }
}
