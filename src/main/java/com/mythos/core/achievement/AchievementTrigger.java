package com.mythos.core.achievement;

/**
 * What a single achievement criterion looks at.
 */
public enum AchievementTrigger {
    /** A numeric or textual player stat compared with the target. */
    STAT_THRESHOLD("stat_threshold"),
    /** Number of completed objectives, optionally of one objective type. */
    OBJECTIVE_COMPLETION("objective_completion"),
    /** Number of recorded game events of one type. */
    EVENT_OCCURRENCE("event_occurrence"),
    /** Sanity state, cosmic exposure, or a nested all-of / any-of group. */
    COMPOSITE_CONDITION("composite_condition"),
    /** A named sequence present in the completed sequences. */
    SEQUENCE_COMPLETION("sequence_completion");

    private final String value;

    AchievementTrigger(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
