package com.mythos.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of consequence applied on failure or expiry.
 */
public enum FailureConsequence {
    NONE("none"),
    SAN_LOSS("san_loss"),
    HP_LOSS("hp_loss"),
    RESOURCE_LOSS("resource_loss"),
    TIME_PRESSURE("time_pressure"),
    NEW_THREAT("new_threat"),
    REVELATION_LOST("revelation_lost"),
    NPC_DEATH("npc_death"),
    ESCALATION("escalation"),
    COSMIC_ATTENTION("cosmic_attention");

    private final String value;

    FailureConsequence(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static FailureConsequence fromValue(String value) {
        for (FailureConsequence candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown failure consequence: " + value);
    }
}
