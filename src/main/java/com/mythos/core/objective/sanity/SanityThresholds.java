package com.mythos.core.objective.sanity;

import com.mythos.core.model.StateValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lower SAN bounds of each sanity state. Anything below {@code unhingedMin} is MAD.
 *
 * @param stableMin    minimum SAN for STABLE
 * @param stressedMin  minimum SAN for STRESSED
 * @param disturbedMin minimum SAN for DISTURBED
 * @param unhingedMin  minimum SAN for UNHINGED
 */
public record SanityThresholds(int stableMin, int stressedMin, int disturbedMin, int unhingedMin) {

    public static final SanityThresholds DEFAULT = new SanityThresholds(70, 50, 30, 10);

    public SanityThresholds {
        if (!(stableMin > stressedMin && stressedMin > disturbedMin && disturbedMin > unhingedMin)) {
            throw new IllegalArgumentException("Sanity thresholds must be strictly descending");
        }
    }

    public SanityState stateFor(int sanity) {
        if (sanity >= stableMin) return SanityState.STABLE;
        if (sanity >= stressedMin) return SanityState.STRESSED;
        if (sanity >= disturbedMin) return SanityState.DISTURBED;
        if (sanity >= unhingedMin) return SanityState.UNHINGED;
        return SanityState.MAD;
    }

    /**
     * Derives the state from a game snapshot; the {@code temporary_insanity} flag wins over SAN.
     */
    public SanityState derive(Map<String, Object> gameState) {
        if (StateValues.getBoolean(gameState, "temporary_insanity")) {
            return SanityState.TEMPORARILY_INSANE;
        }
        return stateFor(StateValues.currentSanity(gameState));
    }

    /** Reads {@code {stable_min, stressed_min, disturbed_min, unhinged_min}}; missing bounds keep the defaults. */
    public static SanityThresholds fromMap(Map<String, Object> bounds) {
        return new SanityThresholds(
                StateValues.getInt(bounds, "stable_min", DEFAULT.stableMin()),
                StateValues.getInt(bounds, "stressed_min", DEFAULT.stressedMin()),
                StateValues.getInt(bounds, "disturbed_min", DEFAULT.disturbedMin()),
                StateValues.getInt(bounds, "unhinged_min", DEFAULT.unhingedMin()));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> bounds = new LinkedHashMap<>();
        bounds.put("stable_min", stableMin);
        bounds.put("stressed_min", stressedMin);
        bounds.put("disturbed_min", disturbedMin);
        bounds.put("unhinged_min", unhingedMin);
        return bounds;
    }
}
