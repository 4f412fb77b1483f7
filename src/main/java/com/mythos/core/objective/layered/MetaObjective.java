package com.mythos.core.objective.layered;

import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.StateValues;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A cross-campaign, cross-character goal tracking player mastery. Never time limited.
 * <p>
 * Named {@link UnlockCriteria} are re-checked on every update; once satisfied, the content
 * stays unlocked and is not evaluated again.
 */
public class MetaObjective extends Objective {

    private final Set<String> campaignsParticipated = new LinkedHashSet<>();
    private final Set<String> charactersUsed = new LinkedHashSet<>();
    private double totalPlaytimeHours;
    private final Map<String, Map<String, Integer>> masteryCategories = new LinkedHashMap<>();
    private final Set<String> learnedPatterns = new LinkedHashSet<>();
    private final Map<String, Integer> survivalStrategies = new LinkedHashMap<>();
    private final Map<String, UnlockCriteria> unlockCriteria = new LinkedHashMap<>();
    private final Set<String> unlockedContent = new LinkedHashSet<>();
    private final List<Map<String, Object>> achievementUnlocks = new ArrayList<>();

    public MetaObjective(ObjectiveDefinition definition, Clock clock) {
        super(definition.withScope(ObjectiveScope.META).withoutTimeLimit(), clock);
    }

    public static MetaObjective fromParams(ObjectiveDefinition definition, ObjectiveParams params, Clock clock) {
        MetaObjective objective = new MetaObjective(definition, clock);
        objective.campaignsParticipated.addAll(params.stringList("campaigns_participated"));
        objective.charactersUsed.addAll(params.stringList("characters_used"));
        objective.learnedPatterns.addAll(params.stringList("learned_patterns"));
        objective.unlockedContent.addAll(params.stringList("unlocked_content"));
        objective.totalPlaytimeHours = params.doubleValue("total_playtime_hours", 0.0);
        Map<String, Object> criteria = params.map("unlock_criteria");
        criteria.forEach((name, value) ->
                objective.addUnlockCriteria(name, UnlockCriteria.fromMap(StateValues.getMap(criteria, name))));
        return objective;
    }

    public MetaObjective addUnlockCriteria(String unlockName, UnlockCriteria criteria) {
        unlockCriteria.put(unlockName, criteria);
        return this;
    }

    @Override
    protected boolean updateProgress(Map<String, Object> gameState, Map<String, Object> action) {
        boolean progressMade = false;

        String campaign = StateValues.getString(gameState, "campaign_id");
        if (campaign != null && campaignsParticipated.add(campaign)) {
            progressMade = true;
            logEvent("new_campaign_participated", Map.of("campaign", campaign));
        }

        String character = StateValues.getString(gameState, "character_id");
        if (character != null && charactersUsed.add(character)) {
            progressMade = true;
        }

        if (action.containsKey("session_duration")) {
            totalPlaytimeHours += StateValues.getDouble(action, "session_duration", 0.0);
            progressMade = true;
        }

        Map<String, Object> mastery = StateValues.getMap(action, "mastery_advancement");
        if (mastery.containsKey("category") && mastery.containsKey("skill")) {
            masteryCategories
                    .computeIfAbsent(String.valueOf(mastery.get("category")), k -> new LinkedHashMap<>())
                    .merge(String.valueOf(mastery.get("skill")), StateValues.getInt(mastery, "advancement", 1), Integer::sum);
            progressMade = true;
        }

        String pattern = StateValues.getString(action, "pattern_learned");
        if (pattern != null && learnedPatterns.add(pattern)) {
            progressMade = true;
            logEvent("pattern_learned", Map.of("pattern", pattern));
        }

        String strategy = StateValues.getString(action, "survival_strategy");
        boolean strategySucceeded = !action.containsKey("strategy_success") || StateValues.getBoolean(action, "strategy_success");
        if (strategy != null && strategySucceeded) {
            survivalStrategies.merge(strategy, 1, Integer::sum);
            progressMade = true;
        }

        checkContentUnlocks();
        setProgress(computeProgress());
        return progressMade;
    }

    private void checkContentUnlocks() {
        unlockCriteria.forEach((name, criteria) -> {
            if (!unlockedContent.contains(name) && criteriaMet(criteria)) {
                unlockedContent.add(name);
                Map<String, Object> unlock = new LinkedHashMap<>();
                unlock.put("unlock", name);
                unlock.put("timestamp", now().toString());
                unlock.put("criteria_met", criteria.toMap());
                achievementUnlocks.add(unlock);
                logEvent("content_unlocked", Map.of("unlock", name));
            }
        });
    }

    public boolean criteriaMet(UnlockCriteria criteria) {
        if (criteria.minCampaigns() != null && campaignsParticipated.size() < criteria.minCampaigns()) {
            return false;
        }
        if (criteria.minCharacters() != null && charactersUsed.size() < criteria.minCharacters()) {
            return false;
        }
        if (criteria.minPlaytimeHours() != null && totalPlaytimeHours < criteria.minPlaytimeHours()) {
            return false;
        }
        if (!learnedPatterns.containsAll(criteria.requiredPatterns())) {
            return false;
        }
        UnlockCriteria.MasteryRequirement mastery = criteria.mastery();
        if (mastery != null) {
            int level = masteryCategories.getOrDefault(mastery.category(), Map.of()).getOrDefault(mastery.skill(), 0);
            return level >= mastery.level();
        }
        return true;
    }

    private double computeProgress() {
        if (unlockCriteria.isEmpty()) {
            return Math.min(1.0, campaignsParticipated.size() * 0.3
                    + charactersUsed.size() * 0.2
                    + learnedPatterns.size() * 0.1
                    + Math.min(totalPlaytimeHours / 100, 1.0) * 0.4);
        }
        long unlocked = unlockCriteria.keySet().stream().filter(unlockedContent::contains).count();
        return (double) unlocked / unlockCriteria.size();
    }

    public Set<String> getUnlockedContent() {
        return Set.copyOf(unlockedContent);
    }

    public double getTotalPlaytimeHours() {
        return totalPlaytimeHours;
    }

    public Map<String, Object> getMasterySummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        masteryCategories.forEach((category, skills) -> summary.put(category, Map.of(
                "total_skills", skills.size(),
                "max_level", skills.values().stream().mapToInt(Integer::intValue).max().orElse(0),
                "skills", Map.copyOf(skills))));
        return summary;
    }

    @Override
    protected Map<String, Object> saveVariantState() {
        Map<String, Object> criteria = new LinkedHashMap<>();
        unlockCriteria.forEach((name, value) -> criteria.put(name, value.toMap()));
        Map<String, Object> mastery = new LinkedHashMap<>();
        masteryCategories.forEach((category, skills) -> mastery.put(category, new LinkedHashMap<>(skills)));
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("campaigns_participated", List.copyOf(campaignsParticipated));
        state.put("characters_used", List.copyOf(charactersUsed));
        state.put("learned_patterns", List.copyOf(learnedPatterns));
        state.put("unlocked_content", List.copyOf(unlockedContent));
        state.put("total_playtime_hours", totalPlaytimeHours);
        state.put("unlock_criteria", criteria);
        state.put("mastery_categories", mastery);
        state.put("survival_strategies", new LinkedHashMap<>(survivalStrategies));
        state.put("achievement_unlocks", new ArrayList<>(achievementUnlocks));
        return state;
    }

    @Override
    protected void restoreVariantState(ObjectiveParams state) {
        Map<String, Object> mastery = state.map("mastery_categories");
        mastery.forEach((category, value) -> {
            Map<String, Object> skills = StateValues.getMap(mastery, category);
            Map<String, Integer> levels = masteryCategories.computeIfAbsent(category, k -> new LinkedHashMap<>());
            skills.forEach((skill, level) -> levels.put(skill, StateValues.getInt(skills, skill, 0)));
        });
        Map<String, Object> strategies = state.map("survival_strategies");
        strategies.forEach((strategy, count) ->
                survivalStrategies.put(strategy, StateValues.getInt(strategies, strategy, 0)));
        if (state.get("achievement_unlocks") instanceof List<?> unlocks) {
            for (Object unlock : unlocks) {
                if (unlock instanceof Map<?, ?> map) {
                    Map<String, Object> copy = new LinkedHashMap<>();
                    map.forEach((key, value) -> copy.put(String.valueOf(key), value));
                    achievementUnlocks.add(copy);
                }
            }
        }
    }

    @Override
    protected Map<String, Object> displayDetails() {
        Map<String, Object> pending = new LinkedHashMap<>();
        unlockCriteria.forEach((name, criteria) -> {
            if (!unlockedContent.contains(name)) {
                pending.put(name, criteriaMet(criteria));
            }
        });
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("campaigns_participated", campaignsParticipated.size());
        details.put("characters_used", charactersUsed.size());
        details.put("total_playtime_hours", totalPlaytimeHours);
        details.put("mastery_summary", getMasterySummary());
        details.put("patterns_learned", learnedPatterns.size());
        details.put("survival_strategies", new LinkedHashMap<>(survivalStrategies));
        details.put("unlocked_content", List.copyOf(unlockedContent));
        details.put("recent_achievements",
                List.copyOf(achievementUnlocks.subList(Math.max(0, achievementUnlocks.size() - 5), achievementUnlocks.size())));
        details.put("unlock_progress", pending);
        return details;
    }
}
