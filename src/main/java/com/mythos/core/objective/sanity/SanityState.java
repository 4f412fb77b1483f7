package com.mythos.core.objective.sanity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mental state derived from current SAN. Never stored; always recomputed from the snapshot.
 */
public enum SanityState {
    STABLE("stable"),               // 70-99
    STRESSED("stressed"),           // 50-69
    DISTURBED("disturbed"),         // 30-49
    UNHINGED("unhinged"),           // 10-29
    MAD("mad"),                     // 0-9
    TEMPORARILY_INSANE("temp_insane");

    private final String value;

    SanityState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** DISTURBED, UNHINGED, MAD or TEMPORARILY_INSANE. */
    public boolean isDisturbedOrWorse() {
        return this != STABLE && this != STRESSED;
    }

    @JsonCreator
    public static SanityState fromValue(String value) {
        for (SanityState state : values()) {
            if (state.value.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown sanity state: " + value);
    }
}
