package com.mythos.core.persistence;

import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.StateValues;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveDocument;
import com.mythos.core.objective.ObjectiveParams;
import com.mythos.core.objective.layered.ImmediateObjective;
import com.mythos.core.objective.layered.LongTermObjective;
import com.mythos.core.objective.layered.MetaObjective;
import com.mythos.core.objective.layered.MidTermObjective;
import com.mythos.core.objective.layered.ShortTermObjective;
import com.mythos.core.objective.sanity.CosmicInsightObjective;
import com.mythos.core.objective.sanity.MadnessObjective;
import com.mythos.core.objective.sanity.SanityDependentObjective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds objectives from saved documents.
 * <p>
 * The variant named under {@code variant_type} in the metadata is rebuilt through its
 * {@code fromParams} factory from the saved {@code variant_state}; documents without one
 * fall back to the layered variant of their scope. Runtime state and variant tracking are
 * then restored by {@link Objective#restoreState(ObjectiveDocument)}.
 */
public final class ObjectiveDocuments {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveDocuments.class);

    @FunctionalInterface
    private interface VariantFactory {
        Objective create(ObjectiveDefinition definition, ObjectiveParams params, Clock clock);
    }

    private static final Map<String, VariantFactory> VARIANTS = Map.of(
            ImmediateObjective.class.getSimpleName(), ImmediateObjective::fromParams,
            ShortTermObjective.class.getSimpleName(), ShortTermObjective::fromParams,
            MidTermObjective.class.getSimpleName(), MidTermObjective::fromParams,
            LongTermObjective.class.getSimpleName(), LongTermObjective::fromParams,
            MetaObjective.class.getSimpleName(), MetaObjective::fromParams,
            SanityDependentObjective.class.getSimpleName(), SanityDependentObjective::fromParams,
            CosmicInsightObjective.class.getSimpleName(), CosmicInsightObjective::fromParams,
            MadnessObjective.class.getSimpleName(), MadnessObjective::fromParams);

    private ObjectiveDocuments() {}

    public static Objective restore(ObjectiveDocument document, Clock clock) {
        if (document.objectiveId() == null || document.objectiveId().isBlank()) {
            throw new IllegalArgumentException("Objective document without objective_id");
        }
        Map<String, Object> metadata = document.metadata() == null ? Map.of() : document.metadata();
        Duration timeLimit = document.timeLimit() == null || document.timeLimit() <= 0
                ? null
                : Duration.ofMillis(Math.round(document.timeLimit() * 1000));

        ObjectiveDefinition definition = ObjectiveDefinition.builder(document.objectiveId())
                .title(document.title())
                .description(document.description())
                .objectiveType(document.objectiveType())
                .scope(document.scope())
                .priority(document.priority())
                .timeLimit(timeLimit)
                .parentObjective(document.parentObjective())
                .childObjectives(document.childObjectives() == null ? List.of() : document.childObjectives())
                .metadata(definitionMetadata(metadata))
                .build();

        Objective objective = instantiate(definition, metadata, clock);
        objective.restoreState(document);
        return objective;
    }

    private static Map<String, Object> definitionMetadata(Map<String, Object> metadata) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.remove(Objective.VARIANT_TYPE_KEY);
        copy.remove(Objective.VARIANT_STATE_KEY);
        return copy;
    }

    private static Objective instantiate(ObjectiveDefinition definition, Map<String, Object> metadata, Clock clock) {
        String variant = StateValues.getString(metadata, Objective.VARIANT_TYPE_KEY);
        if (variant != null) {
            VariantFactory factory = VARIANTS.get(variant);
            if (factory != null) {
                return factory.create(definition,
                        new ObjectiveParams(StateValues.getMap(metadata, Objective.VARIANT_STATE_KEY)), clock);
            }
            log.warn("Unknown variant '{}' for objective {}, restoring by scope", variant, definition.objectiveId());
        }
        ObjectiveScope scope = definition.scope() == null ? ObjectiveScope.IMMEDIATE : definition.scope();
        return switch (scope) {
            case IMMEDIATE -> new ImmediateObjective(definition, clock);
            case SHORT_TERM -> new ShortTermObjective(definition, clock);
            case MID_TERM -> new MidTermObjective(definition, clock);
            case LONG_TERM -> new LongTermObjective(definition, clock);
            case META -> new MetaObjective(definition, clock);
        };
    }
}
