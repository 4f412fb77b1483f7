package com.mythos.core.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mythos.core.objective.ObjectiveDocument;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Save-file shape of the objective manager.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManagerSnapshot(
        @JsonProperty("objectives") List<ObjectiveDocument> objectives,
        @JsonProperty("statistics") Map<String, Long> statistics,
        @JsonProperty("last_update") Instant lastUpdate,
        @JsonProperty("saved_at") Instant savedAt
) {

    public ManagerSnapshot {
        objectives = objectives == null ? List.of() : List.copyOf(objectives);
        statistics = statistics == null ? Map.of() : Map.copyOf(statistics);
    }
}
