package com.mythos.core.objective.sanity;

import com.mythos.core.model.StateValues;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What reaching one cosmic insight level grants.
 *
 * @param name                 level name
 * @param knowledgeUnlocks     appended to {@code cosmic_knowledge} in the snapshot
 * @param abilityUnlocks       appended to {@code special_abilities} in the snapshot
 * @param maxSanityChange      applied to {@code max_sanity} (never below 50); 0 for none
 */
public record InsightLevel(
        String name,
        List<String> knowledgeUnlocks,
        List<String> abilityUnlocks,
        int maxSanityChange
) {

    public InsightLevel {
        knowledgeUnlocks = knowledgeUnlocks == null ? List.of() : List.copyOf(knowledgeUnlocks);
        abilityUnlocks = abilityUnlocks == null ? List.of() : List.copyOf(abilityUnlocks);
    }

    /**
     * Reads {@code {name, effects: {cosmic_knowledge_unlock, special_ability_unlock, sanity_threshold_change}}}.
     */
    public static InsightLevel fromMap(Map<String, Object> level) {
        Map<String, Object> effects = level.containsKey("effects") ? StateValues.getMap(level, "effects") : level;
        return new InsightLevel(
                StateValues.getString(level, "name"),
                StateValues.getStringList(effects, "cosmic_knowledge_unlock"),
                StateValues.getStringList(effects, "special_ability_unlock"),
                StateValues.getInt(effects, "sanity_threshold_change", 0));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> effects = new LinkedHashMap<>();
        effects.put("cosmic_knowledge_unlock", knowledgeUnlocks);
        effects.put("special_ability_unlock", abilityUnlocks);
        effects.put("sanity_threshold_change", maxSanityChange);
        Map<String, Object> level = new LinkedHashMap<>();
        level.put("name", name);
        level.put("effects", effects);
        return level;
    }
}
