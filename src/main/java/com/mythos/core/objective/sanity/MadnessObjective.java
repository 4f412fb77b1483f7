package com.mythos.core.objective.sanity;

import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.StateValues;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;

import java.time.Clock;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An objective only a disturbed mind pursues. Activates only under the required madness,
 * regresses while that madness lapses, and restores some SAN on completion.
 * Priority is at least HIGH.
 */
public class MadnessObjective extends SanityIntegratedObjective {

    private static final List<String> MADNESS_ACTIONS = List.of("compulsive", "obsessive", "paranoid", "delusional");
    private static final double LAPSE_PENALTY = 0.1;

    private final Set<MadnessType> requiredMadnessTypes = EnumSet.noneOf(MadnessType.class);
    private int minMadnessSeverity = 1;
    private double madnessProgressMultiplier = 2.0;
    private int sanityRecoveryOnCompletion = 5;

    public MadnessObjective(ObjectiveDefinition definition, Clock clock) {
        super(definition.withMinimumPriority(ObjectivePriority.HIGH), clock);
    }

    public static MadnessObjective fromParams(ObjectiveDefinition definition, ObjectiveParams params, Clock clock) {
        MadnessObjective objective = new MadnessObjective(definition, clock);
        objective.configureSanity(params);
        params.stringList("required_madness_types")
                .forEach(type -> objective.requiredMadnessTypes.add(MadnessType.fromValue(type)));
        objective.minMadnessSeverity = params.intValue("min_madness_severity", 1);
        objective.madnessProgressMultiplier = params.doubleValue("madness_progress_multiplier", 2.0);
        objective.sanityRecoveryOnCompletion = params.intValue("sanity_recovery_on_completion", 5);
        return objective;
    }

    public MadnessObjective withRequiredMadness(MadnessType... types) {
        requiredMadnessTypes.addAll(List.of(types));
        return this;
    }

    public MadnessObjective withMinMadnessSeverity(int severity) {
        this.minMadnessSeverity = severity;
        return this;
    }

    public MadnessObjective withSanityRecoveryOnCompletion(int recovery) {
        this.sanityRecoveryOnCompletion = recovery;
        return this;
    }

    @Override
    public boolean canActivate(Map<String, Object> gameState) {
        if (!super.canActivate(gameState)) {
            return false;
        }
        if (!requiredMadnessTypes.isEmpty() && !hasRequiredMadness(gameState)) {
            return false;
        }
        return StateValues.getInt(gameState, "madness_severity", 0) >= minMadnessSeverity;
    }

    @Override
    protected boolean updateProgress(Map<String, Object> gameState, Map<String, Object> action) {
        if (!isMadnessAppropriate(gameState)) {
            addProgress(-LAPSE_PENALTY);
            logEvent("madness_progress_lost", Map.of("reason", "Inappropriate madness state",
                    "progress_lost", LAPSE_PENALTY));
            return true;
        }
        String actionType = StateValues.getString(action, "action_type");
        if (actionType != null && MADNESS_ACTIONS.stream().anyMatch(actionType::contains)) {
            double advancement = 0.1 * madnessProgressMultiplier;
            addProgress(advancement);
            logEvent("madness_enhanced_progress", Map.of("action_type", actionType,
                    "advancement", advancement, "multiplier", madnessProgressMultiplier));
            return true;
        }
        return false;
    }

    @Override
    protected void onCompleted(Map<String, Object> gameState) {
        if (sanityRecoveryOnCompletion > 0) {
            applySanGain(gameState, sanityRecoveryOnCompletion, "Completing madness-driven objective");
        }
    }

    private boolean hasRequiredMadness(Map<String, Object> gameState) {
        List<String> active = StateValues.getStringList(gameState, "active_madness");
        return requiredMadnessTypes.stream().anyMatch(type -> active.contains(type.value()));
    }

    private boolean isMadnessAppropriate(Map<String, Object> gameState) {
        if (!requiredMadnessTypes.isEmpty()) {
            return hasRequiredMadness(gameState);
        }
        return !StateValues.getStringList(gameState, "active_madness").isEmpty()
                || StateValues.getInt(gameState, "madness_severity", 0) >= minMadnessSeverity;
    }

    @Override
    protected Map<String, Object> saveVariantState() {
        Map<String, Object> state = new LinkedHashMap<>(super.saveVariantState());
        state.put("required_madness_types", requiredMadnessTypes.stream().map(MadnessType::value).toList());
        state.put("min_madness_severity", minMadnessSeverity);
        state.put("madness_progress_multiplier", madnessProgressMultiplier);
        state.put("sanity_recovery_on_completion", sanityRecoveryOnCompletion);
        return state;
    }

    public Set<MadnessType> getRequiredMadnessTypes() {
        return Set.copyOf(requiredMadnessTypes);
    }

    @Override
    protected Map<String, Object> displayDetails() {
        Map<String, Object> details = new LinkedHashMap<>(super.displayDetails());
        details.put("required_madness", requiredMadnessTypes.stream().map(MadnessType::value).toList());
        details.put("madness_progress_multiplier", madnessProgressMultiplier);
        return details;
    }
}
