package com.mythos.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Narrative category of an objective.
 */
public enum ObjectiveType {
    EXPLORATION("exploration"),
    INVESTIGATION("investigation"),
    SOCIAL("social"),
    SURVIVAL("survival"),
    KNOWLEDGE("knowledge"),
    RITUAL("ritual"),
    ESCAPE("escape"),
    CONFRONTATION("confrontation"),
    PROTECTION("protection"),
    REVELATION("revelation");

    private final String value;

    ObjectiveType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ObjectiveType fromValue(String value) {
        for (ObjectiveType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown objective type: " + value);
    }
}
