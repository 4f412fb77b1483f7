package com.mythos.core.objective.sanity;

import com.mythos.core.model.StateValues;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gaining forbidden knowledge. Every revelation advances progress and costs SAN; crossing
 * each revelation threshold permanently reaches the next insight level.
 */
public class CosmicInsightObjective extends SanityIntegratedObjective {

    public static final List<Double> DEFAULT_REVELATION_THRESHOLDS = List.of(0.25, 0.5, 0.75, 1.0);
    public static final int DEFAULT_SANITY_COST_PER_INSIGHT = 3;
    public static final int DEFAULT_PROTECTION_THRESHOLD = 30;
    private static final int MINIMUM_MAX_SANITY = 50;

    private final List<InsightLevel> insightLevels = new ArrayList<>();
    private final List<Double> revelationThresholds = new ArrayList<>(DEFAULT_REVELATION_THRESHOLDS);
    private int sanityCostPerInsight = DEFAULT_SANITY_COST_PER_INSIGHT;
    private int insightProtectionThreshold = DEFAULT_PROTECTION_THRESHOLD;
    private int currentInsightLevel;

    public CosmicInsightObjective(ObjectiveDefinition definition, Clock clock) {
        super(definition, clock);
    }

    @SuppressWarnings("unchecked")
    public static CosmicInsightObjective fromParams(ObjectiveDefinition definition, ObjectiveParams params, Clock clock) {
        CosmicInsightObjective objective = new CosmicInsightObjective(definition, clock);
        objective.configureSanity(params);
        objective.sanityCostPerInsight = params.intValue("sanity_cost_per_insight", DEFAULT_SANITY_COST_PER_INSIGHT);
        objective.insightProtectionThreshold = params.intValue("insight_protection_threshold", DEFAULT_PROTECTION_THRESHOLD);
        if (params.has("revelation_thresholds")) {
            objective.revelationThresholds.clear();
            params.stringList("revelation_thresholds").forEach(t -> objective.revelationThresholds.add(Double.parseDouble(t)));
        }
        if (params.get("insight_levels") instanceof List<?> levels) {
            for (Object level : levels) {
                if (level instanceof InsightLevel insight) {
                    objective.insightLevels.add(insight);
                } else if (level instanceof Map<?, ?> map) {
                    objective.insightLevels.add(InsightLevel.fromMap((Map<String, Object>) map));
                }
            }
        }
        return objective;
    }

    public CosmicInsightObjective withInsightLevels(List<InsightLevel> levels) {
        insightLevels.addAll(levels);
        return this;
    }

    public CosmicInsightObjective withSanityCostPerInsight(int cost) {
        this.sanityCostPerInsight = cost;
        return this;
    }

    @Override
    protected boolean updateProgress(Map<String, Object> gameState, Map<String, Object> action) {
        if (!action.containsKey("cosmic_revelation")) {
            return false;
        }
        String revelation = String.valueOf(action.get("cosmic_revelation"));
        double insightGain = StateValues.getDouble(action, "insight_value", 0.1);
        addProgress(insightGain);
        applyInsightPenalty(gameState, revelation, insightGain);
        checkInsightProgression(gameState);
        logEvent("cosmic_revelation", Map.of("revelation", revelation, "insight_gain", insightGain,
                "insight_level", currentInsightLevel));
        return true;
    }

    /**
     * Cost of one revelation: floor(floor(gain x cost x 10) x multiplier), where the multiplier
     * is 1.5 below the protection threshold, 1.2 below 50 and 1.0 otherwise. At SAN 10 or less
     * at most one point is lost, and a single revelation never takes the last point.
     */
    int insightPenalty(int currentSanity, double insightGain) {
        int baseLoss = (int) (insightGain * sanityCostPerInsight * 10);
        double multiplier = currentSanity < insightProtectionThreshold ? 1.5 : currentSanity < 50 ? 1.2 : 1.0;
        int total = (int) (baseLoss * multiplier);
        if (currentSanity <= 10) {
            total = Math.min(total, 1);
        }
        return Math.min(total, Math.max(0, currentSanity - 1));
    }

    private void applyInsightPenalty(Map<String, Object> gameState, String revelation, double insightGain) {
        int loss = insightPenalty(StateValues.currentSanity(gameState), insightGain);
        if (loss > 0) {
            applySanLoss(gameState, loss, "Cosmic revelation: " + revelation);
        }
    }

    private void checkInsightProgression(Map<String, Object> gameState) {
        for (int i = 0; i < revelationThresholds.size(); i++) {
            if (getProgress() >= revelationThresholds.get(i) && currentInsightLevel <= i) {
                currentInsightLevel = i + 1;
                if (i < insightLevels.size()) {
                    applyLevelEffects(insightLevels.get(i), gameState);
                }
                logEvent("insight_level_reached", Map.of("level", currentInsightLevel));
            }
        }
    }

    private void applyLevelEffects(InsightLevel level, Map<String, Object> gameState) {
        if (!level.knowledgeUnlocks().isEmpty()) {
            List<String> knowledge = new ArrayList<>(StateValues.getStringList(gameState, "cosmic_knowledge"));
            knowledge.addAll(level.knowledgeUnlocks());
            gameState.put("cosmic_knowledge", knowledge);
        }
        if (!level.abilityUnlocks().isEmpty()) {
            List<String> abilities = new ArrayList<>(StateValues.getStringList(gameState, "special_abilities"));
            abilities.addAll(level.abilityUnlocks());
            gameState.put("special_abilities", abilities);
        }
        if (level.maxSanityChange() != 0) {
            int maxSanity = StateValues.getInt(gameState, "max_sanity", DEFAULT_MAX_SANITY);
            gameState.put("max_sanity", Math.max(MINIMUM_MAX_SANITY, maxSanity + level.maxSanityChange()));
        }
    }

    @Override
    protected Map<String, Object> saveVariantState() {
        Map<String, Object> state = new LinkedHashMap<>(super.saveVariantState());
        state.put("sanity_cost_per_insight", sanityCostPerInsight);
        state.put("insight_protection_threshold", insightProtectionThreshold);
        state.put("revelation_thresholds", List.copyOf(revelationThresholds));
        state.put("insight_levels", insightLevels.stream().map(InsightLevel::toMap).toList());
        state.put("current_insight_level", currentInsightLevel);
        return state;
    }

    @Override
    protected void restoreVariantState(ObjectiveParams state) {
        super.restoreVariantState(state);
        currentInsightLevel = state.intValue("current_insight_level", 0);
    }

    public int getCurrentInsightLevel() {
        return currentInsightLevel;
    }

    @Override
    protected Map<String, Object> displayDetails() {
        Map<String, Object> details = new LinkedHashMap<>(super.displayDetails());
        details.put("insight_level", currentInsightLevel);
        details.put("insight_levels_total", Math.max(insightLevels.size(), revelationThresholds.size()));
        details.put("next_threshold", currentInsightLevel < revelationThresholds.size()
                ? revelationThresholds.get(currentInsightLevel) : null);
        return details;
    }
}
