package com.mythos.core.ai;

import java.util.List;

/**
 * Behaviour profile of the player, derived from session and objective history.
 *
 * @param primaryPattern        dominant behaviour
 * @param secondaryPatterns     the next two behaviours by score
 * @param riskTolerance         0.0 (cautious) to 1.0 (reckless)
 * @param explorationPreference share of exploring or investigating actions
 * @param socialEngagement      share of social actions
 * @param horrorTolerance       completed horror encounters over all horror encounters
 * @param completionRate        completed objectives over all recorded objectives
 * @param averageSessionHours   mean session length
 * @param preferredDifficulty   difficulty with the best weighted completion rate
 * @param adaptiveNeeds         what the player could use more of, e.g. {@code social_prompts}
 */
public record PlayerAnalysis(
        PlayerBehaviorPattern primaryPattern,
        List<PlayerBehaviorPattern> secondaryPatterns,
        double riskTolerance,
        double explorationPreference,
        double socialEngagement,
        double horrorTolerance,
        double completionRate,
        double averageSessionHours,
        DifficultyLevel preferredDifficulty,
        List<String> adaptiveNeeds
) {

    public PlayerAnalysis {
        secondaryPatterns = secondaryPatterns == null ? List.of() : List.copyOf(secondaryPatterns);
        adaptiveNeeds = adaptiveNeeds == null ? List.of() : List.copyOf(adaptiveNeeds);
    }

    public PlayerAnalysis withPrimaryPattern(PlayerBehaviorPattern pattern) {
        return new PlayerAnalysis(pattern, secondaryPatterns, riskTolerance, explorationPreference,
                socialEngagement, horrorTolerance, completionRate, averageSessionHours, preferredDifficulty,
                adaptiveNeeds);
    }
}
