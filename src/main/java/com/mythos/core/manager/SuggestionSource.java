package com.mythos.core.manager;

import com.mythos.core.model.ObjectiveSuggestion;
import com.mythos.core.objective.Objective;

import java.util.List;
import java.util.Map;

/**
 * Something that proposes new objectives for the current situation.
 */
@FunctionalInterface
public interface SuggestionSource {
    List<ObjectiveSuggestion> suggest(Map<String, Object> gameState, List<Objective> activeObjectives);
}
