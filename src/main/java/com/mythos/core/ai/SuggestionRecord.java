package com.mythos.core.ai;

import com.mythos.core.model.ObjectiveSuggestion;

import java.time.Instant;

/**
 * One entry of the suggestion history.
 *
 * @param objectiveId id of the objective created from the suggestion, null until implemented
 */
public record SuggestionRecord(Instant suggestedAt, ObjectiveSuggestion suggestion, String objectiveId) {

    public boolean implemented() {
        return objectiveId != null;
    }

    SuggestionRecord implementedAs(String id) {
        return new SuggestionRecord(suggestedAt, suggestion, id);
    }
}
