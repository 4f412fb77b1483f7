package com.mythos.core.objective.sanity;

import com.mythos.core.model.StateValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A madness that can attach to a character once SAN drops far enough.
 *
 * @param madnessType            the madness
 * @param severity               1-5; DISTURBED needs 3+, UNHINGED 2+, MAD always triggers
 * @param durationHours          how long objective modifications last (null = permanent)
 * @param triggers               narrative triggers, informational
 * @param behavioralChanges      written into the game snapshot when the effect attaches
 * @param objectiveModifications {@code priority_change}, {@code time_pressure} (minutes),
 *                               {@code add_compulsion} (required action)
 */
public record MadnessEffect(
        MadnessType madnessType,
        int severity,
        Double durationHours,
        List<String> triggers,
        Map<String, Object> behavioralChanges,
        Map<String, Object> objectiveModifications
) {

    public MadnessEffect {
        if (severity < 1 || severity > 5) {
            throw new IllegalArgumentException("Madness severity must be between 1 and 5, got " + severity);
        }
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        behavioralChanges = behavioralChanges == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(behavioralChanges));
        objectiveModifications = objectiveModifications == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(objectiveModifications));
    }

    public MadnessEffect(MadnessType madnessType, int severity) {
        this(madnessType, severity, null, List.of(), Map.of(), Map.of());
    }

    /** Whether this effect attaches in the given state. */
    public boolean triggersIn(SanityState state) {
        return switch (state) {
            case DISTURBED -> severity >= 3;
            case UNHINGED -> severity >= 2;
            case MAD, TEMPORARILY_INSANE -> true;
            default -> false;
        };
    }

    /**
     * Reads {@code {madness_type, severity, duration, triggers, behavioral_changes, objective_modifications}}.
     */
    public static MadnessEffect fromMap(Map<String, Object> effect) {
        return new MadnessEffect(
                MadnessType.fromValue(StateValues.getString(effect, "madness_type")),
                StateValues.getInt(effect, "severity", 1),
                effect.get("duration") == null ? null : StateValues.getDouble(effect, "duration", 0.0),
                StateValues.getStringList(effect, "triggers"),
                StateValues.getMap(effect, "behavioral_changes"),
                StateValues.getMap(effect, "objective_modifications"));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> effect = new LinkedHashMap<>();
        effect.put("madness_type", madnessType.value());
        effect.put("severity", severity);
        effect.put("duration", durationHours);
        effect.put("triggers", triggers);
        effect.put("behavioral_changes", new LinkedHashMap<>(behavioralChanges));
        effect.put("objective_modifications", new LinkedHashMap<>(objectiveModifications));
        return effect;
    }
}
