package com.mythos.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;

/**
 * A named predicate over the game state, used to gate activation and completion.
 * <p>
 * Without an explicit check the condition holds when {@code gameState[conditionId]}
 * equals {@code requiredValue}. A check that throws is logged and treated as unmet.
 *
 * @param conditionId   identifier, also the default state key
 * @param description   human-readable description
 * @param requiredValue value the check compares against
 * @param check         optional custom predicate (may be null)
 * @param metadata      free-form extra data passed to the check
 */
public record ObjectiveCondition(
        String conditionId,
        String description,
        Object requiredValue,
        Check check,
        Map<String, Object> metadata
) {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveCondition.class);

    /**
     * Custom condition predicate.
     */
    @FunctionalInterface
    public interface Check {
        boolean test(Map<String, Object> gameState, Object requiredValue, Map<String, Object> metadata);
    }

    public ObjectiveCondition {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean evaluate(Map<String, Object> gameState) {
        try {
            if (check != null) {
                return check.test(gameState, requiredValue, metadata);
            }
            return gameState != null && StateValues.valuesEqual(gameState.get(conditionId), requiredValue);
        } catch (Exception e) {
            log.error("Error evaluating condition {}: {}", conditionId, e.getMessage());
            return false;
        }
    }

    public static ObjectiveCondition basic(String conditionId, String description, Object requiredValue) {
        return new ObjectiveCondition(conditionId, description, requiredValue, null, Map.of());
    }

    /** Holds when {@code current_location} equals the given location. */
    public static ObjectiveCondition location(String location) {
        return new ObjectiveCondition("at_" + location, "Be at " + location, location,
                (state, required, meta) -> StateValues.valuesEqual(state.get("current_location"), required),
                Map.of());
    }

    /** Holds when the {@code inventory} collection contains the item. */
    public static ObjectiveCondition item(String item) {
        return new ObjectiveCondition("has_" + item, "Possess " + item, item,
                (state, required, meta) -> state.get("inventory") instanceof Collection<?> inventory
                        && inventory.contains(required),
                Map.of());
    }

    /** Holds when current SAN is at least {@code minimum}. */
    public static ObjectiveCondition sanityThreshold(int minimum) {
        return new ObjectiveCondition("sanity_above_" + minimum, "Sanity of at least " + minimum, minimum,
                (state, required, meta) -> StateValues.getInt(state, "sanity", 0) >= ((Number) required).intValue(),
                Map.of());
    }
}
