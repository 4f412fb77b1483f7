package com.mythos.core.objective.layered;

import com.mythos.core.model.StateValues;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One named way of resolving a mid-term scenario. Unset requirements are ignored.
 *
 * @param name                      path name, e.g. {@code confrontation} or {@code escape}
 * @param minInvestigationProgress  minimum average branch progress (nullable)
 * @param requiredRevelations       revelations that must be unlocked
 * @param minStoryBeat              minimum story beat index reached (nullable)
 */
public record CompletionPath(
        String name,
        Double minInvestigationProgress,
        List<String> requiredRevelations,
        Integer minStoryBeat
) {

    public CompletionPath {
        requiredRevelations = requiredRevelations == null ? List.of() : List.copyOf(requiredRevelations);
    }

    /**
     * Reads {@code requirements} in the form
     * {@code {min_investigation_progress, required_revelations, min_story_beat}}.
     */
    public static CompletionPath fromMap(String name, Map<String, Object> path) {
        Map<String, Object> requirements = path.containsKey("requirements")
                ? StateValues.getMap(path, "requirements") : path;
        return new CompletionPath(name,
                requirements.containsKey("min_investigation_progress")
                        ? StateValues.getDouble(requirements, "min_investigation_progress", 0.0) : null,
                StateValues.getStringList(requirements, "required_revelations"),
                requirements.containsKey("min_story_beat")
                        ? StateValues.getInt(requirements, "min_story_beat", 0) : null);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> requirements = new LinkedHashMap<>();
        if (minInvestigationProgress != null) {
            requirements.put("min_investigation_progress", minInvestigationProgress);
        }
        requirements.put("required_revelations", requiredRevelations);
        if (minStoryBeat != null) {
            requirements.put("min_story_beat", minStoryBeat);
        }
        return requirements;
    }
}
