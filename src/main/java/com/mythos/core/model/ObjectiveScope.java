package com.mythos.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Temporal scope of an objective, from a single action to cross-campaign goals.
 */
public enum ObjectiveScope {
    IMMEDIATE("immediate"),
    SHORT_TERM("short_term"),
    MID_TERM("mid_term"),
    LONG_TERM("long_term"),
    META("meta");

    private final String value;

    ObjectiveScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ObjectiveScope fromValue(String value) {
        for (ObjectiveScope candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown objective scope: " + value);
    }
}
