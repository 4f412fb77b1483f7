package com.mythos.core.objective.sanity;

/**
 * Depth of cosmic understanding, read from {@code cosmic_insight} in the snapshot.
 */
public enum CosmicInsightLevel {
    IGNORANT,
    GLIMPSE,
    AWARE,
    KNOWLEDGEABLE,
    ENLIGHTENED,
    TRANSCENDENT;

    public static CosmicInsightLevel ofLevel(int level) {
        return values()[Math.max(0, Math.min(values().length - 1, level))];
    }
}
