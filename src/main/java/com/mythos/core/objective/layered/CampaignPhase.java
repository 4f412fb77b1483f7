package com.mythos.core.objective.layered;

import com.mythos.core.model.StateValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A phase of a long-term campaign and the effects applied when it completes.
 *
 * @param name            phase name
 * @param unlockKnowledge mythos entity &rarr; minimum knowledge level granted on completion
 * @param worldState      world change recorded on completion (empty for none)
 */
public record CampaignPhase(
        String name,
        Map<String, Integer> unlockKnowledge,
        Map<String, Object> worldState
) {

    public CampaignPhase {
        unlockKnowledge = unlockKnowledge == null ? Map.of() : Map.copyOf(unlockKnowledge);
        worldState = worldState == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(worldState));
    }

    public static CampaignPhase named(String name) {
        return new CampaignPhase(name, Map.of(), Map.of());
    }

    /** Reads {@code {name, completion_effects: {unlock_knowledge: {...}, world_state: {...}}}}. */
    public static CampaignPhase fromMap(Map<String, Object> phase, int index) {
        String name = phase.containsKey("name") ? String.valueOf(phase.get("name")) : "Phase " + index;
        Map<String, Object> effects = StateValues.getMap(phase, "completion_effects");
        Map<String, Object> rawKnowledge = StateValues.getMap(effects, "unlock_knowledge");
        Map<String, Integer> knowledge = new LinkedHashMap<>();
        rawKnowledge.forEach((entity, level) -> knowledge.put(entity, StateValues.getInt(rawKnowledge, entity, 0)));
        return new CampaignPhase(name, knowledge, StateValues.getMap(effects, "world_state"));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> effects = new LinkedHashMap<>();
        effects.put("unlock_knowledge", new LinkedHashMap<>(unlockKnowledge));
        effects.put("world_state", new LinkedHashMap<>(worldState));
        Map<String, Object> phase = new LinkedHashMap<>();
        phase.put("name", name);
        phase.put("completion_effects", effects);
        return phase;
    }
}
