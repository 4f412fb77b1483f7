package com.mythos.core.model;

import java.util.Map;

/**
 * A consequence applied when an objective fails or expires.
 *
 * @param consequenceType the kind of consequence
 * @param severity        1 (mild) to 5 (catastrophic)
 * @param description     player-facing description
 * @param metadata        free-form extra data
 */
public record ObjectiveConsequence(
        FailureConsequence consequenceType,
        int severity,
        String description,
        Map<String, Object> metadata
) {

    public static final ObjectiveConsequence SAN_LOSS_MINOR =
            new ObjectiveConsequence(FailureConsequence.SAN_LOSS, 1, "Minor sanity loss");
    public static final ObjectiveConsequence SAN_LOSS_MAJOR =
            new ObjectiveConsequence(FailureConsequence.SAN_LOSS, 3, "Major sanity loss");
    public static final ObjectiveConsequence ESCALATION_MINOR =
            new ObjectiveConsequence(FailureConsequence.ESCALATION, 2, "The situation worsens");
    public static final ObjectiveConsequence COSMIC_ATTENTION =
            new ObjectiveConsequence(FailureConsequence.COSMIC_ATTENTION, 5, "Something vast takes notice");

    public ObjectiveConsequence {
        if (severity < 1 || severity > 5) {
            throw new IllegalArgumentException("Consequence severity must be between 1 and 5, got " + severity);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public ObjectiveConsequence(FailureConsequence consequenceType, int severity, String description) {
        this(consequenceType, severity, description, Map.of());
    }
}
