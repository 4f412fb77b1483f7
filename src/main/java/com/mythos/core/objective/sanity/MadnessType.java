package com.mythos.core.objective.sanity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MadnessType {
    PARANOIA("paranoia"),
    OBSESSION("obsession"),
    PHOBIA("phobia"),
    DELUSION("delusion"),
    COMPULSION("compulsion"),
    AMNESIA("amnesia"),
    COSMIC_AWARENESS("cosmic_awareness");

    private final String value;

    MadnessType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static MadnessType fromValue(String value) {
        for (MadnessType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown madness type: " + value);
    }
}
