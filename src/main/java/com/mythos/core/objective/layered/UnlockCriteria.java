package com.mythos.core.objective.layered;

import com.mythos.core.model.StateValues;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requirements for a piece of meta content. Null thresholds are not checked.
 *
 * @param minCampaigns     campaigns participated in
 * @param minCharacters    distinct characters played
 * @param minPlaytimeHours total playtime in hours
 * @param requiredPatterns learned patterns that must all be present
 * @param mastery          a minimum mastery level in one skill (nullable)
 */
public record UnlockCriteria(
        Integer minCampaigns,
        Integer minCharacters,
        Double minPlaytimeHours,
        List<String> requiredPatterns,
        MasteryRequirement mastery
) {

    /**
     * @param category mastery category, e.g. {@code investigation}
     * @param skill    skill within the category
     * @param level    minimum level
     */
    public record MasteryRequirement(String category, String skill, int level) {}

    public UnlockCriteria {
        requiredPatterns = requiredPatterns == null ? List.of() : List.copyOf(requiredPatterns);
    }

    public static UnlockCriteria fromMap(Map<String, Object> criteria) {
        Map<String, Object> mastery = StateValues.getMap(criteria, "mastery_level");
        return new UnlockCriteria(
                criteria.containsKey("min_campaigns") ? StateValues.getInt(criteria, "min_campaigns", 0) : null,
                criteria.containsKey("min_characters") ? StateValues.getInt(criteria, "min_characters", 0) : null,
                criteria.containsKey("min_playtime") ? StateValues.getDouble(criteria, "min_playtime", 0) : null,
                StateValues.getStringList(criteria, "required_patterns"),
                mastery.isEmpty() ? null : new MasteryRequirement(
                        StateValues.getString(mastery, "category"),
                        StateValues.getString(mastery, "skill"),
                        StateValues.getInt(mastery, "level", 1)));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (minCampaigns != null) map.put("min_campaigns", minCampaigns);
        if (minCharacters != null) map.put("min_characters", minCharacters);
        if (minPlaytimeHours != null) map.put("min_playtime", minPlaytimeHours);
        if (!requiredPatterns.isEmpty()) map.put("required_patterns", requiredPatterns);
        if (mastery != null) {
            map.put("mastery_level", Map.of("category", mastery.category(), "skill", mastery.skill(),
                    "level", mastery.level()));
        }
        return map;
    }
}
