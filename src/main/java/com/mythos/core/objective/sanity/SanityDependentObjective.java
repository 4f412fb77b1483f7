package com.mythos.core.objective.sanity;

import com.mythos.core.model.ObjectiveModifier;
import com.mythos.core.model.StateValues;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * An objective whose presentation and progress rules follow the character's sanity state.
 * Sane characters advance steadily; disturbed ones slowly; unhinged ones only through
 * desperate or reckless acts; mad ones through mad insight or blind luck.
 */
public class SanityDependentObjective extends SanityIntegratedObjective {

    private static final String CONFIGURATION_SOURCE = "sanity-state";

    private final Map<SanityState, StateConfiguration> stateConfigurations = new EnumMap<>(SanityState.class);
    private final Random random;
    private SanityState currentState;
    private StateConfiguration currentConfiguration;

    public SanityDependentObjective(ObjectiveDefinition definition, Clock clock) {
        this(definition, clock, new Random());
    }

    public SanityDependentObjective(ObjectiveDefinition definition, Clock clock, Random random) {
        super(definition, clock);
        this.random = random;
    }

    @SuppressWarnings("unchecked")
    public static SanityDependentObjective fromParams(ObjectiveDefinition definition, ObjectiveParams params, Clock clock) {
        SanityDependentObjective objective = new SanityDependentObjective(definition, clock);
        objective.configureSanity(params);
        Object configs = params.get("state_configurations");
        if (configs instanceof Map<?, ?> map) {
            map.forEach((state, config) -> {
                SanityState key = state instanceof SanityState s ? s : SanityState.fromValue(String.valueOf(state));
                if (config instanceof StateConfiguration c) {
                    objective.withStateConfiguration(key, c);
                } else if (config instanceof Map<?, ?> raw) {
                    objective.withStateConfiguration(key, StateConfiguration.fromMap((Map<String, Object>) raw));
                }
            });
        }
        return objective;
    }

    public SanityDependentObjective withStateConfiguration(SanityState state, StateConfiguration configuration) {
        stateConfigurations.put(state, configuration);
        return this;
    }

    @Override
    protected boolean updateProgress(Map<String, Object> gameState, Map<String, Object> action) {
        SanityState state = getSanityState(gameState);
        updateConfiguration(state);

        boolean progressMade = switch (state) {
            case MAD -> madProgress(action);
            case UNHINGED -> unhingedProgress(gameState, action);
            case DISTURBED -> steadyProgress(action, 0.05);
            default -> steadyProgress(action, 0.1);
        };

        if (progressMade) {
            applySanityEffects(state, gameState);
        }
        return progressMade;
    }

    private void updateConfiguration(SanityState state) {
        StateConfiguration configuration = stateConfigurations.get(state);
        if (configuration == null || state == currentState) {
            return;
        }
        currentState = state;
        currentConfiguration = configuration;
        removeModifiers(CONFIGURATION_SOURCE);
        if (configuration.priorityModifier() != null) {
            addModifier(ObjectiveModifier.priorityShift(configuration.priorityModifier(), CONFIGURATION_SOURCE));
        }
        logEvent("configuration_updated", Map.of("sanity_state", state.value()));
    }

    private boolean madProgress(Map<String, Object> action) {
        String actionType = StateValues.getString(action, "action_type");
        if ("mad_insight".equals(actionType)) {
            addProgress(0.3);
            return true;
        }
        if (("random_action".equals(actionType) || "compulsive_behavior".equals(actionType))
                && random.nextDouble() < 0.1) {
            addProgress(0.1);
            return true;
        }
        return false;
    }

    private boolean unhingedProgress(Map<String, Object> gameState, Map<String, Object> action) {
        String actionType = StateValues.getString(action, "action_type");
        if (actionType == null || !(actionType.contains("desperate") || actionType.contains("reckless"))) {
            return false;
        }
        addProgress(0.2);
        if (calculateSanRisk(gameState) > 3) {
            applySanLoss(gameState, 1, "Desperate action while unhinged");
        }
        return true;
    }

    private boolean steadyProgress(Map<String, Object> action, double advancement) {
        String actionType = StateValues.getString(action, "action_type");
        if (actionType == null || actionType.isEmpty()) {
            return false;
        }
        addProgress(advancement);
        return true;
    }

    private void applySanityEffects(SanityState state, Map<String, Object> gameState) {
        if (currentConfiguration == null) {
            return;
        }
        if (currentConfiguration.sanLossMultiplier() != null) {
            int risk = (int) (calculateSanRisk(gameState) * currentConfiguration.sanLossMultiplier());
            if (risk > 0) {
                applySanLoss(gameState, risk, "Action while " + state.value());
            }
        }
        if (getProgress() >= 1.0 && currentConfiguration.completionSanBonus() != null
                && (state == SanityState.DISTURBED || state == SanityState.UNHINGED)) {
            applySanGain(gameState, currentConfiguration.completionSanBonus(), "Success despite mental distress");
        }
    }

    @Override
    protected Map<String, Object> saveVariantState() {
        Map<String, Object> configs = new LinkedHashMap<>();
        stateConfigurations.forEach((state, config) -> configs.put(state.value(), config.toMap()));
        Map<String, Object> state = new LinkedHashMap<>(super.saveVariantState());
        state.put("state_configurations", configs);
        state.put("current_state", currentState == null ? null : currentState.value());
        return state;
    }

    // The saved priority already carries the configuration shift, so it is not applied again.
    @Override
    protected void restoreVariantState(ObjectiveParams state) {
        super.restoreVariantState(state);
        String saved = state.string("current_state", null);
        if (saved != null) {
            currentState = SanityState.fromValue(saved);
            currentConfiguration = stateConfigurations.get(currentState);
        }
    }

    @Override
    public String getTitle() {
        String base = super.getTitle();
        if (currentConfiguration != null && currentConfiguration.titleSuffix() != null) {
            return base + " (" + currentConfiguration.titleSuffix() + ")";
        }
        return base;
    }

    @Override
    public String getDescription() {
        if (currentConfiguration != null && currentConfiguration.descriptionOverride() != null) {
            return currentConfiguration.descriptionOverride();
        }
        return super.getDescription();
    }

    @Override
    protected Map<String, Object> displayDetails() {
        Map<String, Object> details = new LinkedHashMap<>(super.displayDetails());
        details.put("sanity_state", currentState == null ? null : currentState.value());
        return details;
    }
}
