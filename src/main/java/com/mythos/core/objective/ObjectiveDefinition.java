package com.mythos.core.objective;

import com.mythos.core.model.ObjectiveCondition;
import com.mythos.core.model.ObjectiveConsequence;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.ObjectiveReward;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The immutable part of an objective. Runtime adjustments are layered on top as
 * {@link com.mythos.core.model.ObjectiveModifier}s and never rewrite the definition.
 *
 * @param objectiveId           unique id within a manager
 * @param title                 short player-facing title
 * @param description           longer description
 * @param objectiveType         narrative category
 * @param scope                 temporal scope
 * @param priority              base priority
 * @param timeLimit             base time limit measured from activation (null = none)
 * @param activationConditions  all must hold before the objective can activate
 * @param completionConditions  all must hold for completion; empty means "progress reaches 1.0"
 * @param rewards               applied on completion
 * @param consequences          applied on failure or expiry
 * @param parentObjective       parent id (nullable)
 * @param childObjectives       declared child ids
 * @param metadata              free-form extra data
 */
public record ObjectiveDefinition(
        String objectiveId,
        String title,
        String description,
        ObjectiveType objectiveType,
        ObjectiveScope scope,
        ObjectivePriority priority,
        Duration timeLimit,
        List<ObjectiveCondition> activationConditions,
        List<ObjectiveCondition> completionConditions,
        List<ObjectiveReward> rewards,
        List<ObjectiveConsequence> consequences,
        String parentObjective,
        List<String> childObjectives,
        Map<String, Object> metadata
) {

    public ObjectiveDefinition {
        if (objectiveId == null || objectiveId.isBlank()) {
            throw new IllegalArgumentException("objectiveId must not be blank");
        }
        if (timeLimit != null && (timeLimit.isZero() || timeLimit.isNegative())) {
            throw new IllegalArgumentException("timeLimit must be positive for objective " + objectiveId);
        }
        title = title == null ? objectiveId : title;
        description = description == null ? "" : description;
        objectiveType = objectiveType == null ? ObjectiveType.EXPLORATION : objectiveType;
        scope = scope == null ? ObjectiveScope.IMMEDIATE : scope;
        priority = priority == null ? ObjectivePriority.MEDIUM : priority;
        activationConditions = activationConditions == null ? List.of() : List.copyOf(activationConditions);
        completionConditions = completionConditions == null ? List.of() : List.copyOf(completionConditions);
        rewards = rewards == null ? List.of() : List.copyOf(rewards);
        consequences = consequences == null ? List.of() : List.copyOf(consequences);
        childObjectives = childObjectives == null ? List.of() : List.copyOf(childObjectives);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Builder builder(String objectiveId) {
        return new Builder(objectiveId);
    }

    public Builder toBuilder() {
        return new Builder(objectiveId)
                .title(title)
                .description(description)
                .objectiveType(objectiveType)
                .scope(scope)
                .priority(priority)
                .timeLimit(timeLimit)
                .activationConditions(activationConditions)
                .completionConditions(completionConditions)
                .rewards(rewards)
                .consequences(consequences)
                .parentObjective(parentObjective)
                .childObjectives(childObjectives)
                .metadata(metadata);
    }

    public ObjectiveDefinition withScope(ObjectiveScope newScope) {
        return newScope == scope ? this : toBuilder().scope(newScope).build();
    }

    /** Applies {@code fallback} only when no time limit was given. */
    public ObjectiveDefinition withDefaultTimeLimit(Duration fallback) {
        return timeLimit != null ? this : toBuilder().timeLimit(fallback).build();
    }

    public ObjectiveDefinition withoutTimeLimit() {
        return timeLimit == null ? this : toBuilder().timeLimit(null).build();
    }

    public ObjectiveDefinition withMinimumPriority(ObjectivePriority minimum) {
        return priority.isAtLeast(minimum) ? this : toBuilder().priority(minimum).build();
    }

    /**
     * Builds a definition from loosely-typed creation attributes
     * ({@code title}, {@code description}, {@code objective_type}, {@code scope},
     * {@code priority}, {@code time_limit}, {@code parent_objective}, ...).
     */
    public static ObjectiveDefinition fromParams(String objectiveId, ObjectiveParams params) {
        return builder(objectiveId)
                .title(params.string("title", objectiveId))
                .description(params.string("description", ""))
                .objectiveType(params.enumValue("objective_type", ObjectiveType.class, null))
                .scope(params.enumValue("scope", ObjectiveScope.class, null))
                .priority(params.has("priority") ? ObjectivePriority.parse(params.get("priority")) : null)
                .timeLimit(params.duration("time_limit"))
                .activationConditions(params.listOf("activation_conditions", ObjectiveCondition.class))
                .completionConditions(params.listOf("completion_conditions", ObjectiveCondition.class))
                .rewards(params.listOf("rewards", ObjectiveReward.class))
                .consequences(params.listOf("consequences", ObjectiveConsequence.class))
                .parentObjective(params.string("parent_objective", null))
                .childObjectives(params.stringList("child_objectives"))
                .metadata(params.map("metadata"))
                .build();
    }

    public static final class Builder {
        private final String objectiveId;
        private String title;
        private String description;
        private ObjectiveType objectiveType;
        private ObjectiveScope scope;
        private ObjectivePriority priority;
        private Duration timeLimit;
        private List<ObjectiveCondition> activationConditions = new ArrayList<>();
        private List<ObjectiveCondition> completionConditions = new ArrayList<>();
        private List<ObjectiveReward> rewards = new ArrayList<>();
        private List<ObjectiveConsequence> consequences = new ArrayList<>();
        private String parentObjective;
        private List<String> childObjectives = new ArrayList<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String objectiveId) {
            this.objectiveId = objectiveId;
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder objectiveType(ObjectiveType objectiveType) { this.objectiveType = objectiveType; return this; }
        public Builder scope(ObjectiveScope scope) { this.scope = scope; return this; }
        public Builder priority(ObjectivePriority priority) { this.priority = priority; return this; }
        public Builder timeLimit(Duration timeLimit) { this.timeLimit = timeLimit; return this; }
        public Builder parentObjective(String parentObjective) { this.parentObjective = parentObjective; return this; }

        public Builder activationConditions(List<ObjectiveCondition> conditions) {
            this.activationConditions = new ArrayList<>(conditions);
            return this;
        }

        public Builder activationCondition(ObjectiveCondition condition) {
            this.activationConditions.add(condition);
            return this;
        }

        public Builder completionConditions(List<ObjectiveCondition> conditions) {
            this.completionConditions = new ArrayList<>(conditions);
            return this;
        }

        public Builder completionCondition(ObjectiveCondition condition) {
            this.completionConditions.add(condition);
            return this;
        }

        public Builder rewards(List<ObjectiveReward> rewards) {
            this.rewards = new ArrayList<>(rewards);
            return this;
        }

        public Builder reward(ObjectiveReward reward) {
            this.rewards.add(reward);
            return this;
        }

        public Builder consequences(List<ObjectiveConsequence> consequences) {
            this.consequences = new ArrayList<>(consequences);
            return this;
        }

        public Builder consequence(ObjectiveConsequence consequence) {
            this.consequences.add(consequence);
            return this;
        }

        public Builder childObjectives(List<String> childObjectives) {
            this.childObjectives = new ArrayList<>(childObjectives);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = new LinkedHashMap<>(metadata);
            return this;
        }

        public ObjectiveDefinition build() {
            return new ObjectiveDefinition(objectiveId, title, description, objectiveType, scope, priority,
                    timeLimit, activationConditions, completionConditions, rewards, consequences,
                    parentObjective, childObjectives, metadata);
        }
    }
}
