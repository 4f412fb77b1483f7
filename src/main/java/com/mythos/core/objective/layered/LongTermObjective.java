package com.mythos.core.objective.layered;

import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.StateValues;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A multi-session campaign goal. Progress blends campaign phases (0.5), character growth
 * goals (0.3) and recurring theme coverage (0.2), renormalized over what is configured.
 * No time limit unless one is given explicitly.
 */
public class LongTermObjective extends Objective {

    /** Growth goal satisfied by the number of mythos entities with knowledge above zero. */
    public static final String MYTHOS_ENTITIES_GOAL = "mythos_entities";

    private final List<CampaignPhase> campaignPhases = new ArrayList<>();
    private final Map<Integer, Double> phaseProgress = new LinkedHashMap<>();
    private final Map<String, Integer> characterGrowthGoals = new LinkedHashMap<>();
    private final Map<String, Integer> growthProgress = new LinkedHashMap<>();
    private final Map<String, Integer> mythosKnowledgeLevels = new LinkedHashMap<>();
    private final List<String> recurringThemes = new ArrayList<>();
    private final Map<String, Integer> themeEncounters = new LinkedHashMap<>();
    private final List<Map<String, Object>> worldStateChanges = new ArrayList<>();
    private final Map<String, Integer> npcRelationshipChanges = new LinkedHashMap<>();
    private int currentPhase;

    public LongTermObjective(ObjectiveDefinition definition, Clock clock) {
        super(definition.withScope(ObjectiveScope.LONG_TERM), clock);
    }

    @SuppressWarnings("unchecked")
    public static LongTermObjective fromParams(ObjectiveDefinition definition, ObjectiveParams params, Clock clock) {
        LongTermObjective objective = new LongTermObjective(definition, clock)
                .withRecurringThemes(params.stringList("recurring_themes"));
        Object phases = params.get("campaign_phases");
        if (phases instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                Object phase = list.get(i);
                if (phase instanceof CampaignPhase campaignPhase) {
                    objective.campaignPhases.add(campaignPhase);
                } else if (phase instanceof Map<?, ?> map) {
                    objective.campaignPhases.add(CampaignPhase.fromMap((Map<String, Object>) map, i));
                } else if (phase != null) {
                    objective.campaignPhases.add(CampaignPhase.named(String.valueOf(phase)));
                }
            }
        }
        Map<String, Object> goals = params.map("character_growth_goals");
        goals.forEach((goal, target) -> objective.characterGrowthGoals.put(goal, StateValues.getInt(goals, goal, 1)));
        Map<String, Object> knowledge = params.map("mythos_knowledge_levels");
        knowledge.forEach((entity, level) ->
                objective.mythosKnowledgeLevels.put(entity, StateValues.getInt(knowledge, entity, 0)));
        return objective;
    }

    public LongTermObjective withCampaignPhases(List<CampaignPhase> phases) {
        campaignPhases.addAll(phases);
        return this;
    }

    public LongTermObjective withCharacterGrowthGoal(String goal, int target) {
        characterGrowthGoals.put(goal, target);
        return this;
    }

    public LongTermObjective withRecurringThemes(List<String> themes) {
        recurringThemes.addAll(themes);
        return this;
    }

    @Override
    protected boolean updateProgress(Map<String, Object> gameState, Map<String, Object> action) {
        boolean progressMade = false;

        if (action.containsKey("phase_advancement")) {
            int phaseIndex = StateValues.getInt(action, "phase_index", currentPhase);
            double advancement = StateValues.getDouble(action, "phase_advancement", 0.0);
            phaseProgress.put(phaseIndex, Math.min(1.0, phaseProgress.getOrDefault(phaseIndex, 0.0) + advancement));
            completeFinishedPhases();
            progressMade = true;
        }

        Map<String, Object> knowledge = StateValues.getMap(action, "mythos_knowledge");
        if (knowledge.containsKey("entity")) {
            String entity = String.valueOf(knowledge.get("entity"));
            int gain = StateValues.getInt(knowledge, "level_gain", 1);
            int level = mythosKnowledgeLevels.merge(entity, gain, Integer::sum);
            progressMade = true;
            logEvent("mythos_knowledge_gained", Map.of("entity", entity, "new_level", level, "gain", gain));
        }

        Map<String, Object> growth = StateValues.getMap(action, "growth_progress");
        if (growth.containsKey("goal")) {
            growthProgress.merge(String.valueOf(growth.get("goal")), StateValues.getInt(growth, "amount", 1), Integer::sum);
            progressMade = true;
        }

        String theme = StateValues.getString(action, "theme_encounter");
        if (theme != null && recurringThemes.contains(theme)) {
            themeEncounters.merge(theme, 1, Integer::sum);
            progressMade = true;
        }

        if (action.containsKey("world_change")) {
            Map<String, Object> change = new LinkedHashMap<>();
            change.put("timestamp", now().toString());
            change.put("change", action.get("world_change"));
            change.put("session", gameState == null ? "unknown" : gameState.getOrDefault("current_session", "unknown"));
            worldStateChanges.add(change);
            progressMade = true;
        }

        Map<String, Object> relationship = StateValues.getMap(action, "npc_relationship");
        if (relationship.containsKey("npc")) {
            npcRelationshipChanges.merge(String.valueOf(relationship.get("npc")),
                    StateValues.getInt(relationship, "change", 0), Integer::sum);
            progressMade = true;
        }

        setProgress(computeProgress());
        return progressMade;
    }

    // A phase completes once; advancing onto an already finished phase completes it too.
    private void completeFinishedPhases() {
        while (currentPhase < campaignPhases.size() && phaseProgress.getOrDefault(currentPhase, 0.0) >= 1.0) {
            CampaignPhase phase = campaignPhases.get(currentPhase);
            logEvent("campaign_phase_completed", Map.of(
                    "phase", currentPhase,
                    "phase_name", phase.name(),
                    "completion_time", now().toString()));
            currentPhase++;
            applyPhaseEffects(phase);
        }
    }

    private void applyPhaseEffects(CampaignPhase phase) {
        phase.unlockKnowledge().forEach((entity, level) ->
                mythosKnowledgeLevels.merge(entity, level, Math::max));
        if (!phase.worldState().isEmpty()) {
            Map<String, Object> change = new LinkedHashMap<>();
            change.put("timestamp", now().toString());
            change.put("change", phase.worldState());
            change.put("source", "phase_completion");
            worldStateChanges.add(change);
        }
    }

    private double computeProgress() {
        double weightedSum = 0;
        double totalWeight = 0;
        if (!campaignPhases.isEmpty()) {
            long completed = 0;
            for (int i = 0; i < campaignPhases.size(); i++) {
                if (phaseProgress.getOrDefault(i, 0.0) >= 1.0) {
                    completed++;
                }
            }
            double current = currentPhase < campaignPhases.size() ? phaseProgress.getOrDefault(currentPhase, 0.0) : 0.0;
            if (current >= 1.0) {
                current = 0.0;
            }
            weightedSum += Math.min(1.0, (completed + current) / campaignPhases.size()) * 0.5;
            totalWeight += 0.5;
        }
        if (!characterGrowthGoals.isEmpty()) {
            long met = characterGrowthGoals.entrySet().stream()
                    .filter(goal -> growthValue(goal.getKey()) >= goal.getValue())
                    .count();
            weightedSum += (double) met / characterGrowthGoals.size() * 0.3;
            totalWeight += 0.3;
        }
        if (!recurringThemes.isEmpty()) {
            long explored = recurringThemes.stream().filter(t -> themeEncounters.getOrDefault(t, 0) > 0).count();
            weightedSum += (double) explored / recurringThemes.size() * 0.2;
            totalWeight += 0.2;
        }
        return totalWeight == 0 ? 0.0 : weightedSum / totalWeight;
    }

    private int growthValue(String goal) {
        if (MYTHOS_ENTITIES_GOAL.equals(goal)) {
            return (int) mythosKnowledgeLevels.values().stream().filter(level -> level > 0).count();
        }
        return growthProgress.getOrDefault(goal, 0);
    }

    public int getCurrentPhase() {
        return currentPhase;
    }

    public Optional<CampaignPhase> getCurrentPhaseInfo() {
        return currentPhase < campaignPhases.size() ? Optional.of(campaignPhases.get(currentPhase)) : Optional.empty();
    }

    public Map<String, Integer> getMythosKnowledgeLevels() {
        return Map.copyOf(mythosKnowledgeLevels);
    }

    public List<Map<String, Object>> getWorldStateChanges() {
        return List.copyOf(worldStateChanges);
    }

    public Map<String, Integer> getNpcRelationshipChanges() {
        return Map.copyOf(npcRelationshipChanges);
    }

    @Override
    protected Map<String, Object> saveVariantState() {
        Map<String, Object> progress = new LinkedHashMap<>();
        phaseProgress.forEach((index, value) -> progress.put(String.valueOf(index), value));
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("recurring_themes", List.copyOf(recurringThemes));
        state.put("campaign_phases", campaignPhases.stream().map(CampaignPhase::toMap).toList());
        state.put("character_growth_goals", new LinkedHashMap<>(characterGrowthGoals));
        state.put("mythos_knowledge_levels", new LinkedHashMap<>(mythosKnowledgeLevels));
        state.put("phase_progress", progress);
        state.put("growth_progress", new LinkedHashMap<>(growthProgress));
        state.put("theme_encounters", new LinkedHashMap<>(themeEncounters));
        state.put("world_state_changes", new ArrayList<>(worldStateChanges));
        state.put("npc_relationship_changes", new LinkedHashMap<>(npcRelationshipChanges));
        state.put("current_phase", currentPhase);
        return state;
    }

    @Override
    protected void restoreVariantState(ObjectiveParams state) {
        Map<String, Object> progress = state.map("phase_progress");
        progress.forEach((index, value) ->
                phaseProgress.put(Integer.parseInt(index), StateValues.getDouble(progress, index, 0.0)));
        restoreCounts(state.map("growth_progress"), growthProgress);
        restoreCounts(state.map("theme_encounters"), themeEncounters);
        restoreCounts(state.map("npc_relationship_changes"), npcRelationshipChanges);
        if (state.get("world_state_changes") instanceof List<?> changes) {
            for (Object change : changes) {
                if (change instanceof Map<?, ?> map) {
                    Map<String, Object> copy = new LinkedHashMap<>();
                    map.forEach((key, value) -> copy.put(String.valueOf(key), value));
                    worldStateChanges.add(copy);
                }
            }
        }
        currentPhase = Math.min(state.intValue("current_phase", 0), campaignPhases.size());
    }

    private static void restoreCounts(Map<String, Object> saved, Map<String, Integer> target) {
        saved.forEach((key, value) -> target.put(key, StateValues.getInt(saved, key, 0)));
    }

    @Override
    protected Map<String, Object> displayDetails() {
        Map<String, Object> campaign = new LinkedHashMap<>();
        campaign.put("current_phase", currentPhase);
        campaign.put("total_phases", campaignPhases.size());
        campaign.put("current_phase_name", getCurrentPhaseInfo().map(CampaignPhase::name).orElse(null));
        campaign.put("phase_progress", new LinkedHashMap<>(phaseProgress));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("campaign_progression", campaign);
        details.put("mythos_knowledge", new LinkedHashMap<>(mythosKnowledgeLevels));
        details.put("character_growth", new LinkedHashMap<>(characterGrowthGoals));
        details.put("theme_encounters", new LinkedHashMap<>(themeEncounters));
        details.put("world_changes", worldStateChanges.size());
        details.put("npc_relationships", new LinkedHashMap<>(npcRelationshipChanges));
        return details;
    }
}
