package com.mythos.core.objective;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveStatus;
import com.mythos.core.model.ObjectiveType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Serialized shape of an objective. Field names are part of the save format.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectiveDocument(
        @JsonProperty("objective_id") String objectiveId,
        @JsonProperty("uuid") String uuid,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("objective_type") ObjectiveType objectiveType,
        @JsonProperty("scope") ObjectiveScope scope,
        @JsonProperty("priority") ObjectivePriority priority,
        @JsonProperty("status") ObjectiveStatus status,
        @JsonProperty("progress") double progress,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("activated_at") Instant activatedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("time_limit") Double timeLimit,
        @JsonProperty("parent_objective") String parentObjective,
        @JsonProperty("child_objectives") List<String> childObjectives,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("attempt_count") int attemptCount,
        @JsonProperty("events") List<Map<String, Object>> events
) {}
