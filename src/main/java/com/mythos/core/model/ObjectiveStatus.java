package com.mythos.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an objective.
 */
public enum ObjectiveStatus {
    INACTIVE("inactive"),
    ACTIVE("active"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    EXPIRED("expired"),
    SUSPENDED("suspended"),
    ABANDONED("abandoned");

    private final String value;

    ObjectiveStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** ACTIVE or IN_PROGRESS. */
    public boolean isActive() {
        return this == ACTIVE || this == IN_PROGRESS;
    }

    /** No further transition is possible from a terminal status. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED || this == ABANDONED;
    }

    public boolean isFailure() {
        return this == FAILED || this == EXPIRED || this == ABANDONED;
    }

    @JsonCreator
    public static ObjectiveStatus fromValue(String value) {
        for (ObjectiveStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown objective status: " + value);
    }
}
