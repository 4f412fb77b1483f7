package com.mythos.core.achievement;

import com.mythos.core.model.StateValues;
import com.mythos.core.objective.sanity.SanityState;
import com.mythos.core.objective.sanity.SanityThresholds;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One condition of an achievement, evaluated against read-only {@code gameData} and
 * {@code playerStats} snapshots.
 * <p>
 * Snapshot keys read: {@code completed_objectives} (maps with {@code type}), {@code events}
 * (maps with {@code type}), {@code completed_sequences}; stats are looked up by name, with
 * {@code sanity} and {@code cosmic_exposure} used by composite conditions.
 *
 * @param trigger    what is observed
 * @param target     value to reach
 * @param operator   comparison for stat thresholds
 * @param conditions trigger-specific settings ({@code stat_name}, {@code objective_type},
 *                   {@code event_type}, {@code condition_type}, {@code sequence_name}, {@code criteria})
 */
public record AchievementCriteria(
        AchievementTrigger trigger,
        Object target,
        ComparisonOperator operator,
        Map<String, Object> conditions
) {

    public static final String SANITY_STATE = "sanity_state";
    public static final String COSMIC_EXPOSURE = "cosmic_exposure";
    public static final String ALL_OF = "all_of";
    public static final String ANY_OF = "any_of";

    public AchievementCriteria {
        operator = operator == null ? ComparisonOperator.GTE : operator;
        conditions = conditions == null ? Map.of() : Map.copyOf(conditions);
    }

    public static AchievementCriteria statThreshold(String statName, ComparisonOperator operator, Object target) {
        return new AchievementCriteria(AchievementTrigger.STAT_THRESHOLD, target, operator, Map.of("stat_name", statName));
    }

    public static AchievementCriteria objectivesCompleted(int count) {
        return new AchievementCriteria(AchievementTrigger.OBJECTIVE_COMPLETION, count, ComparisonOperator.GTE, Map.of());
    }

    public static AchievementCriteria objectivesCompleted(int count, String objectiveType) {
        return new AchievementCriteria(AchievementTrigger.OBJECTIVE_COMPLETION, count, ComparisonOperator.GTE,
                Map.of("objective_type", objectiveType));
    }

    public static AchievementCriteria eventOccurred(String eventType) {
        return eventOccurred(eventType, 1);
    }

    public static AchievementCriteria eventOccurred(String eventType, int times) {
        return new AchievementCriteria(AchievementTrigger.EVENT_OCCURRENCE, times, ComparisonOperator.GTE,
                Map.of("event_type", eventType));
    }

    public static AchievementCriteria sanityState(SanityState state) {
        return new AchievementCriteria(AchievementTrigger.COMPOSITE_CONDITION, state.value(), ComparisonOperator.EQ,
                Map.of("condition_type", SANITY_STATE));
    }

    public static AchievementCriteria cosmicExposure(int minimum) {
        return new AchievementCriteria(AchievementTrigger.COMPOSITE_CONDITION, minimum, ComparisonOperator.GTE,
                Map.of("condition_type", COSMIC_EXPOSURE));
    }

    public static AchievementCriteria allOf(List<AchievementCriteria> criteria) {
        return new AchievementCriteria(AchievementTrigger.COMPOSITE_CONDITION, criteria.size(), ComparisonOperator.GTE,
                Map.of("condition_type", ALL_OF, "criteria", List.copyOf(criteria)));
    }

    public static AchievementCriteria anyOf(List<AchievementCriteria> criteria) {
        return new AchievementCriteria(AchievementTrigger.COMPOSITE_CONDITION, 1, ComparisonOperator.GTE,
                Map.of("condition_type", ANY_OF, "criteria", List.copyOf(criteria)));
    }

    public static AchievementCriteria sequenceCompleted(String sequenceName) {
        return new AchievementCriteria(AchievementTrigger.SEQUENCE_COMPLETION, true, ComparisonOperator.EQ,
                Map.of("sequence_name", sequenceName));
    }

    public boolean isMet(Map<String, Object> gameData, Map<String, Object> playerStats) {
        Map<String, Object> game = gameData == null ? Map.of() : gameData;
        Map<String, Object> stats = playerStats == null ? Map.of() : playerStats;
        return switch (trigger) {
            case STAT_THRESHOLD -> {
                String stat = StateValues.getString(conditions, "stat_name");
                yield stat != null && stats.containsKey(stat) && operator.test(stats.get(stat), target);
            }
            case OBJECTIVE_COMPLETION -> countMatching(game.get("completed_objectives"),
                    StateValues.getString(conditions, "objective_type")) >= targetCount();
            case EVENT_OCCURRENCE -> countMatching(game.get("events"),
                    StateValues.getString(conditions, "event_type")) >= targetCount();
            case COMPOSITE_CONDITION -> compositeMet(game, stats);
            case SEQUENCE_COMPLETION -> StateValues.getStringList(game, "completed_sequences")
                    .contains(StateValues.getString(conditions, "sequence_name"));
        };
    }

    private boolean compositeMet(Map<String, Object> game, Map<String, Object> stats) {
        String conditionType = StateValues.getString(conditions, "condition_type");
        if (conditionType == null) {
            return false;
        }
        return switch (conditionType) {
            case SANITY_STATE -> SanityThresholds.DEFAULT.derive(stats).value()
                    .equalsIgnoreCase(String.valueOf(target));
            case COSMIC_EXPOSURE -> StateValues.getDouble(stats, COSMIC_EXPOSURE, 0.0) >= targetCount();
            case ALL_OF -> nested().stream().allMatch(c -> c.isMet(game, stats));
            case ANY_OF -> nested().stream().anyMatch(c -> c.isMet(game, stats));
            default -> false;
        };
    }

    private List<AchievementCriteria> nested() {
        Object criteria = conditions.get("criteria");
        if (!(criteria instanceof Collection<?> collection)) {
            return List.of();
        }
        return collection.stream()
                .filter(AchievementCriteria.class::isInstance)
                .map(AchievementCriteria.class::cast)
                .toList();
    }

    /** Boolean targets count as one occurrence. */
    private double targetCount() {
        if (target instanceof Boolean flag) {
            return flag ? 1 : 0;
        }
        if (target instanceof Number number) {
            return number.doubleValue();
        }
        return 1;
    }

    private static int countMatching(Object entries, String type) {
        if (!(entries instanceof Collection<?> collection)) {
            return 0;
        }
        int count = 0;
        for (Object entry : collection) {
            if (type == null) {
                count++;
            } else if (entry instanceof Map<?, ?> map) {
                Object entryType = map.containsKey("type") ? map.get("type") : map.get("objective_type");
                if (type.equals(String.valueOf(entryType))) {
                    count++;
                }
            } else if (type.equals(String.valueOf(entry))) {
                count++;
            }
        }
        return count;
    }

    /** Player-facing description, without evaluation details. */
    public String describe() {
        return switch (trigger) {
            case STAT_THRESHOLD -> "Reach " + target + " " + conditions.getOrDefault("stat_name", "unknown");
            case OBJECTIVE_COMPLETION -> conditions.containsKey("objective_type")
                    ? "Complete " + target + " " + conditions.get("objective_type") + " objectives"
                    : "Complete " + target + " objectives";
            case EVENT_OCCURRENCE -> "Experience " + conditions.getOrDefault("event_type", "event");
            case COMPOSITE_CONDITION -> switch (String.valueOf(conditions.get("condition_type"))) {
                case SANITY_STATE -> "Reach the " + target + " sanity state";
                case COSMIC_EXPOSURE -> "Reach " + target + " cosmic exposure";
                default -> "Meet special condition";
            };
            case SEQUENCE_COMPLETION -> "Complete the " + conditions.get("sequence_name") + " sequence";
        };
    }
}
