package com.mythos.core.objective.layered;

import com.mythos.core.model.ObjectiveModifier;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.StateValues;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A one-to-three minute task: examine something, talk to someone, reach a place.
 * Progress is the share of required actions performed.
 */
public class ImmediateObjective extends Objective {

    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofMinutes(5);

    private final Set<String> requiredActions = new LinkedHashSet<>();
    private final Set<String> completedActions = new LinkedHashSet<>();
    private boolean autoCompleteOnAction = true;
    private boolean provideImmediateFeedback = true;

    public ImmediateObjective(ObjectiveDefinition definition, Clock clock) {
        super(definition.withScope(ObjectiveScope.IMMEDIATE).withDefaultTimeLimit(DEFAULT_TIME_LIMIT), clock);
    }

    public static ImmediateObjective fromParams(ObjectiveDefinition definition, ObjectiveParams params, Clock clock) {
        return new ImmediateObjective(definition, clock)
                .withRequiredActions(params.stringList("required_actions"))
                .withAutoCompleteOnAction(params.bool("auto_complete_on_action", true))
                .withImmediateFeedback(params.bool("provide_immediate_feedback", true));
    }

    public ImmediateObjective withRequiredActions(List<String> actions) {
        requiredActions.addAll(actions);
        return this;
    }

    public ImmediateObjective withAutoCompleteOnAction(boolean autoComplete) {
        this.autoCompleteOnAction = autoComplete;
        return this;
    }

    public ImmediateObjective withImmediateFeedback(boolean feedback) {
        this.provideImmediateFeedback = feedback;
        return this;
    }

    @Override
    protected boolean updateProgress(Map<String, Object> gameState, Map<String, Object> action) {
        boolean progressMade = false;
        Set<String> required = getRequiredActions();
        String actionType = StateValues.getString(action, "action_type");
        if (actionType != null && required.contains(actionType) && completedActions.add(actionType)) {
            progressMade = true;
            if (provideImmediateFeedback) {
                logEvent("action_completed", Map.of("action", actionType, "remaining", remaining(required)));
            }
        }
        setProgress(computeProgress(required, gameState));
        if (autoCompleteOnAction && getProgress() >= 1.0) {
            complete(gameState);
        }
        return progressMade;
    }

    private double computeProgress(Set<String> required, Map<String, Object> gameState) {
        if (required.isEmpty()) {
            return checkSimpleCompletion(gameState) ? 1.0 : 0.0;
        }
        long done = required.stream().filter(completedActions::contains).count();
        return (double) done / required.size();
    }

    /**
     * Completion test for objectives without required actions. Override for checks such as
     * "be at location X"; the default never completes.
     */
    protected boolean checkSimpleCompletion(Map<String, Object> gameState) {
        return false;
    }

    /** Base required actions plus any added by modifiers (compulsions, for example). */
    public Set<String> getRequiredActions() {
        Set<String> effective = new LinkedHashSet<>(requiredActions);
        for (ObjectiveModifier modifier : activeModifiers(ObjectiveModifier.Kind.REQUIRED_ACTION)) {
            effective.add(modifier.action());
        }
        return effective;
    }

    public Set<String> getCompletedActions() {
        return Set.copyOf(completedActions);
    }

    private List<String> remaining(Set<String> required) {
        List<String> remaining = new ArrayList<>(required);
        remaining.removeAll(completedActions);
        return remaining;
    }

    @Override
    protected Map<String, Object> saveVariantState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("required_actions", List.copyOf(requiredActions));
        state.put("auto_complete_on_action", autoCompleteOnAction);
        state.put("provide_immediate_feedback", provideImmediateFeedback);
        state.put("completed_actions", List.copyOf(completedActions));
        return state;
    }

    @Override
    protected void restoreVariantState(ObjectiveParams state) {
        completedActions.addAll(state.stringList("completed_actions"));
    }

    @Override
    protected Map<String, Object> displayDetails() {
        Set<String> required = getRequiredActions();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required_actions", List.copyOf(required));
        details.put("completed_actions", List.copyOf(completedActions));
        details.put("remaining_actions", remaining(required));
        details.put("immediate_feedback", provideImmediateFeedback);
        return details;
    }
}
