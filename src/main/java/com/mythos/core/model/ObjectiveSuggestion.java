package com.mythos.core.model;

import java.util.List;
import java.util.Map;

/**
 * A proposed objective, produced by a suggestion source and optionally turned into a
 * real objective by the manager.
 *
 * @param factoryName       registered objective type to instantiate (e.g. {@code ShortTermObjective})
 * @param title             objective title
 * @param description       objective description
 * @param objectiveType     narrative category
 * @param scope             temporal scope
 * @param priority          suggested priority
 * @param estimatedMinutes  expected duration in minutes
 * @param confidence        0.0 to 1.0
 * @param reasoning         why the objective is suggested
 * @param contextFactors    context keys that drove the suggestion
 * @param parameters        extra constructor attributes for the objective
 */
public record ObjectiveSuggestion(
        String factoryName,
        String title,
        String description,
        ObjectiveType objectiveType,
        ObjectiveScope scope,
        ObjectivePriority priority,
        int estimatedMinutes,
        double confidence,
        String reasoning,
        List<String> contextFactors,
        Map<String, Object> parameters
) {

    public ObjectiveSuggestion {
        contextFactors = contextFactors == null ? List.of() : List.copyOf(contextFactors);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public ObjectiveSuggestion withEstimatedMinutes(int minutes) {
        return new ObjectiveSuggestion(factoryName, title, description, objectiveType, scope, priority,
                minutes, confidence, reasoning, contextFactors, parameters);
    }
}
