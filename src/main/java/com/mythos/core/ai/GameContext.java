package com.mythos.core.ai;

import com.mythos.core.model.StateValues;
import com.mythos.core.objective.sanity.SanityState;
import com.mythos.core.objective.sanity.SanityThresholds;

import java.util.List;
import java.util.Map;

/**
 * The parts of the game state that drive suggestions.
 */
public record GameContext(
        int tensionLevel,
        String storyPhase,
        String locationType,
        List<String> npcsPresent,
        List<String> recentEvents,
        List<String> availableResources,
        boolean timePressure,
        SanityState sanityState,
        int cosmicExposure,
        int threatLevel
) {

    public GameContext {
        npcsPresent = npcsPresent == null ? List.of() : List.copyOf(npcsPresent);
        recentEvents = recentEvents == null ? List.of() : List.copyOf(recentEvents);
        availableResources = availableResources == null ? List.of() : List.copyOf(availableResources);
    }

    public static GameContext from(Map<String, Object> gameState) {
        Map<String, Object> state = gameState == null ? Map.of() : gameState;
        String phase = StateValues.getString(state, "story_phase");
        String location = StateValues.getString(state, "current_location");
        return new GameContext(
                StateValues.getInt(state, "tension_level", 2),
                phase == null ? "investigation" : phase,
                location == null ? "unknown" : location,
                StateValues.getStringList(state, "npcs_present"),
                StateValues.getStringList(state, "recent_events"),
                StateValues.getStringList(state, "inventory"),
                StateValues.getBoolean(state, "time_pressure"),
                SanityThresholds.DEFAULT.derive(state),
                StateValues.getInt(state, "cosmic_exposure", 0),
                StateValues.getInt(state, "threat_level", 1));
    }
}
