package com.mythos.core.objective.sanity;

import com.mythos.core.model.StateValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How a {@link SanityDependentObjective} presents and behaves in one sanity state.
 * Every field is optional.
 *
 * @param titleSuffix         appended to the title in parentheses
 * @param descriptionOverride replaces the description
 * @param priorityModifier    priority shift while in this state
 * @param sanLossMultiplier   SAN risk multiplier applied to progressing actions
 * @param completionSanBonus  SAN restored on completion while disturbed or unhinged
 */
public record StateConfiguration(
        String titleSuffix,
        String descriptionOverride,
        Integer priorityModifier,
        Double sanLossMultiplier,
        Integer completionSanBonus
) {

    public static StateConfiguration fromMap(Map<String, Object> config) {
        return new StateConfiguration(
                StateValues.getString(config, "title_suffix"),
                StateValues.getString(config, "description_override"),
                config.containsKey("priority_modifier") ? StateValues.getInt(config, "priority_modifier", 0) : null,
                config.containsKey("san_loss_multiplier") ? StateValues.getDouble(config, "san_loss_multiplier", 1.0) : null,
                config.containsKey("completion_san_bonus") ? StateValues.getInt(config, "completion_san_bonus", 0) : null);
    }

    /** Set fields only, in the keys {@link #fromMap(Map)} reads. */
    public Map<String, Object> toMap() {
        Map<String, Object> config = new LinkedHashMap<>();
        if (titleSuffix != null) config.put("title_suffix", titleSuffix);
        if (descriptionOverride != null) config.put("description_override", descriptionOverride);
        if (priorityModifier != null) config.put("priority_modifier", priorityModifier);
        if (sanLossMultiplier != null) config.put("san_loss_multiplier", sanLossMultiplier);
        if (completionSanBonus != null) config.put("completion_san_bonus", completionSanBonus);
        return config;
    }
}
