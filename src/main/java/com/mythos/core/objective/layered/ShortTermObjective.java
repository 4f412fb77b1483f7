package com.mythos.core.objective.layered;

import com.mythos.core.model.ObjectiveModifier;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.StateValues;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single-scene objective (five to fifteen minutes): investigate a room, interview an NPC.
 * Progress blends discoveries (60%) and milestones (40%); narrative tension ramps with it.
 */
public class ShortTermObjective extends Objective {

    private static final Logger log = LoggerFactory.getLogger(ShortTermObjective.class);

    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofMinutes(20);
    public static final int DEFAULT_MILESTONE_COUNT = 3;

    /**
     * Receives the tension level whenever progress moves.
     */
    @FunctionalInterface
    public interface TensionListener {
        void onTension(double tensionLevel, double progress);
    }

    private final Set<String> requiredDiscoveries = new LinkedHashSet<>();
    private final Set<String> discoveriesMade = new LinkedHashSet<>();
    private final Map<String, Object> sceneContext = new LinkedHashMap<>();
    private final List<TensionListener> tensionListeners = new ArrayList<>();
    private int milestoneCount = DEFAULT_MILESTONE_COUNT;
    private int milestonesCompleted;
    private boolean tensionRampEnabled = true;
    private double initialTension = 1;
    private double maxTension = 3;
    private double tensionLevel = 1;

    public ShortTermObjective(ObjectiveDefinition definition, Clock clock) {
        super(definition.withScope(ObjectiveScope.SHORT_TERM).withDefaultTimeLimit(DEFAULT_TIME_LIMIT), clock);
    }

    public static ShortTermObjective fromParams(ObjectiveDefinition definition, ObjectiveParams params, Clock clock) {
        return new ShortTermObjective(definition, clock)
                .withRequiredDiscoveries(params.stringList("required_discoveries"))
                .withMilestoneCount(params.intValue("milestone_count", DEFAULT_MILESTONE_COUNT))
                .withSceneContext(params.map("scene_context"))
                .withTensionRamp(params.bool("tension_ramp_enabled", true),
                        params.doubleValue("initial_tension", 1), params.doubleValue("max_tension", 3));
    }

    public ShortTermObjective withRequiredDiscoveries(List<String> discoveries) {
        requiredDiscoveries.addAll(discoveries);
        return this;
    }

    public ShortTermObjective withMilestoneCount(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("milestone_count must not be negative");
        }
        this.milestoneCount = count;
        return this;
    }

    public ShortTermObjective withSceneContext(Map<String, Object> context) {
        sceneContext.putAll(context);
        return this;
    }

    public ShortTermObjective withTensionRamp(boolean enabled, double initial, double max) {
        this.tensionRampEnabled = enabled;
        this.initialTension = initial;
        this.maxTension = max;
        this.tensionLevel = initial;
        return this;
    }

    public void addTensionListener(TensionListener listener) {
        tensionListeners.add(listener);
    }

    @Override
    protected boolean updateProgress(Map<String, Object> gameState, Map<String, Object> action) {
        boolean progressMade = false;
        int milestones = getMilestoneCount();

        String discovery = StateValues.getString(action, "discovery");
        if (discovery != null && requiredDiscoveries.contains(discovery) && discoveriesMade.add(discovery)) {
            progressMade = true;
            logEvent("discovery_made", Map.of("discovery", discovery));
        }

        if (StateValues.getBoolean(action, "milestone_completed")) {
            milestonesCompleted = Math.min(milestonesCompleted + 1, milestones);
            progressMade = true;
            logEvent("milestone_completed", Map.of("milestone", milestonesCompleted, "total", milestones));
        }

        setProgress(computeProgress(milestones));

        if (tensionRampEnabled && progressMade) {
            updateTension();
        }
        return progressMade;
    }

    private double computeProgress(int milestones) {
        boolean hasDiscoveries = !requiredDiscoveries.isEmpty();
        boolean hasMilestones = milestones > 0;
        double discoveryProgress = hasDiscoveries ? (double) discoveriesMade.size() / requiredDiscoveries.size() : 0.0;
        double milestoneProgress = hasMilestones ? Math.min(1.0, (double) milestonesCompleted / milestones) : 0.0;
        if (hasDiscoveries && hasMilestones) {
            return discoveryProgress * 0.6 + milestoneProgress * 0.4;
        }
        return hasDiscoveries ? discoveryProgress : milestoneProgress;
    }

    private void updateTension() {
        tensionLevel = initialTension + getProgress() * (maxTension - initialTension);
        logEvent("tension_updated", Map.of("tension_level", tensionLevel, "progress", getProgress()));
        for (TensionListener listener : tensionListeners) {
            try {
                listener.onTension(tensionLevel, getProgress());
            } catch (Exception e) {
                log.error("Tension listener failed for {}: {}", getObjectiveId(), e.getMessage(), e);
            }
        }
    }

    /** Milestone count after difficulty modifiers, never below one when the base count is positive. */
    public int getMilestoneCount() {
        double count = milestoneCount;
        if (milestoneCount == 0) {
            return 0;
        }
        for (ObjectiveModifier modifier : activeModifiers(ObjectiveModifier.Kind.MILESTONE_SCALE)) {
            count = Math.max(1, (int) (count * modifier.amount()));
        }
        return (int) count;
    }

    public int getMilestonesCompleted() {
        return milestonesCompleted;
    }

    public Set<String> getDiscoveriesMade() {
        return Set.copyOf(discoveriesMade);
    }

    public double getTensionLevel() {
        return tensionLevel;
    }

    @Override
    protected Map<String, Object> saveVariantState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("required_discoveries", List.copyOf(requiredDiscoveries));
        state.put("milestone_count", milestoneCount);
        state.put("scene_context", new LinkedHashMap<>(sceneContext));
        state.put("tension_ramp_enabled", tensionRampEnabled);
        state.put("initial_tension", initialTension);
        state.put("max_tension", maxTension);
        state.put("discoveries_made", List.copyOf(discoveriesMade));
        state.put("milestones_completed", milestonesCompleted);
        state.put("tension_level", tensionLevel);
        return state;
    }

    @Override
    protected void restoreVariantState(ObjectiveParams state) {
        discoveriesMade.addAll(state.stringList("discoveries_made"));
        milestonesCompleted = state.intValue("milestones_completed", 0);
        tensionLevel = state.doubleValue("tension_level", initialTension);
    }

    @Override
    protected Map<String, Object> displayDetails() {
        List<String> remaining = new ArrayList<>(requiredDiscoveries);
        remaining.removeAll(discoveriesMade);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("milestones", Map.of("completed", milestonesCompleted, "total", getMilestoneCount()));
        details.put("discoveries", Map.of(
                "required", List.copyOf(requiredDiscoveries),
                "made", List.copyOf(discoveriesMade),
                "remaining", remaining));
        details.put("tension_level", tensionLevel);
        details.put("scene_context", new LinkedHashMap<>(sceneContext));
        return details;
    }
}
