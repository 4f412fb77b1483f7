package com.mythos.core.ai;

import com.mythos.core.model.StateValues;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Heuristic player profiling from session history.
 *
 * <p>Each session map may carry {@code actions} (maps with {@code type} and optional
 * {@code risk_level}), {@code events} (maps with {@code type} and {@code completed}) and
 * {@code duration_hours}. Objective history entries carry {@code completed} and
 * {@code difficulty}.
 */
public class PlayerBehaviorAnalyzer {

    private static final double DEFAULT_RATE = 0.5;

    public PlayerAnalysis analyze(List<Map<String, Object>> gameHistory, List<Map<String, Object>> objectiveHistory) {
        List<Map<String, Object>> sessions = gameHistory == null ? List.of() : gameHistory;
        List<Map<String, Object>> objectives = objectiveHistory == null ? List.of() : objectiveHistory;

        Map<String, Integer> actionCounts = new HashMap<>();
        List<Double> riskLevels = new ArrayList<>();
        int explorationActions = 0;
        int socialActions = 0;

        for (Map<String, Object> session : sessions) {
            for (Map<String, Object> action : mapList(session.get("actions"))) {
                String type = action.get("type") == null ? "unknown" : String.valueOf(action.get("type"));
                actionCounts.merge(type, 1, Integer::sum);
                if (action.get("risk_level") instanceof Number risk) {
                    riskLevels.add(risk.doubleValue());
                }
                if (type.contains("explore") || type.contains("investigate")) {
                    explorationActions++;
                }
                if (type.contains("talk") || type.contains("social")) {
                    socialActions++;
                }
            }
        }

        int totalActions = actionCounts.values().stream().mapToInt(Integer::intValue).sum();
        double riskTolerance = riskLevels.isEmpty()
                ? DEFAULT_RATE
                : riskLevels.stream().mapToDouble(Double::doubleValue).average().orElse(DEFAULT_RATE);
        double explorationPreference = (double) explorationActions / Math.max(totalActions, 1);
        double socialEngagement = (double) socialActions / Math.max(totalActions, 1);
        double completionRate = objectives.isEmpty()
                ? DEFAULT_RATE
                : objectives.stream().filter(o -> StateValues.getBoolean(o, "completed")).count()
                        / (double) objectives.size();

        List<PlayerBehaviorPattern> ranked = rankPatterns(actionCounts, totalActions, riskTolerance, explorationPreference);

        return new PlayerAnalysis(
                ranked.get(0),
                ranked.subList(1, Math.min(3, ranked.size())),
                riskTolerance,
                explorationPreference,
                socialEngagement,
                horrorTolerance(sessions),
                completionRate,
                averageSessionHours(sessions),
                preferredDifficulty(objectives),
                adaptiveNeeds(actionCounts, totalActions, completionRate));
    }

    /**
     * Orders the scored patterns by descending score; ties keep declaration order.
     */
    List<PlayerBehaviorPattern> rankPatterns(Map<String, Integer> counts, int total,
                                             double riskTolerance, double explorationPreference) {
        Map<PlayerBehaviorPattern, Double> scores = new EnumMap<>(PlayerBehaviorPattern.class);
        scores.put(PlayerBehaviorPattern.CAUTIOUS, share(counts, total, "careful_action") + (1 - riskTolerance));
        scores.put(PlayerBehaviorPattern.AGGRESSIVE, share(counts, total, "bold_action") + riskTolerance);
        scores.put(PlayerBehaviorPattern.INVESTIGATIVE, share(counts, total, "investigate") + share(counts, total, "analyze"));
        scores.put(PlayerBehaviorPattern.SOCIAL, share(counts, total, "talk"));
        scores.put(PlayerBehaviorPattern.EXPLORER, explorationPreference);
        scores.put(PlayerBehaviorPattern.SURVIVAL, share(counts, total, "flee") + share(counts, total, "hide"));

        return scores.entrySet().stream()
                .sorted(Map.Entry.<PlayerBehaviorPattern, Double>comparingByValue(Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static double share(Map<String, Integer> counts, int total, String type) {
        return total == 0 ? 0.0 : counts.getOrDefault(type, 0) / (double) total;
    }

    double horrorTolerance(List<Map<String, Object>> sessions) {
        int encounters = 0;
        int completions = 0;
        for (Map<String, Object> session : sessions) {
            for (Map<String, Object> event : mapList(session.get("events"))) {
                if ("horror_encounter".equals(event.get("type"))) {
                    encounters++;
                    if (StateValues.getBoolean(event, "completed")) {
                        completions++;
                    }
                }
            }
        }
        return encounters == 0 ? DEFAULT_RATE : (double) completions / encounters;
    }

    double averageSessionHours(List<Map<String, Object>> sessions) {
        return sessions.stream()
                .mapToDouble(s -> StateValues.getDouble(s, "duration_hours", 1.0))
                .average()
                .orElse(1.0);
    }

    /**
     * The difficulty whose completion rate weighted by its level is highest; NORMAL when
     * nothing was completed.
     */
    DifficultyLevel preferredDifficulty(List<Map<String, Object>> objectives) {
        Map<DifficultyLevel, int[]> tallies = new EnumMap<>(DifficultyLevel.class);
        for (Map<String, Object> record : objectives) {
            String name = StateValues.getString(record, "difficulty");
            DifficultyLevel difficulty = DifficultyLevel.parse(name == null ? "normal" : name).orElse(null);
            if (difficulty == null) {
                continue;
            }
            int[] tally = tallies.computeIfAbsent(difficulty, d -> new int[2]);
            tally[0]++;
            if (StateValues.getBoolean(record, "completed")) {
                tally[1]++;
            }
        }

        DifficultyLevel best = DifficultyLevel.NORMAL;
        double bestScore = 0;
        for (var entry : tallies.entrySet()) {
            double score = entry.getValue()[1] / (double) entry.getValue()[0] * entry.getKey().level();
            if (score > bestScore) {
                bestScore = score;
                best = entry.getKey();
            }
        }
        return best;
    }

    List<String> adaptiveNeeds(Map<String, Integer> counts, int total, double completionRate) {
        List<String> needs = new ArrayList<>();
        if (completionRate < 0.3) {
            needs.add("easier_objectives");
        } else if (completionRate > 0.9) {
            needs.add("harder_objectives");
        }
        if (share(counts, total, "social") < 0.1) {
            needs.add("social_prompts");
        }
        if (share(counts, total, "explore") < 0.2) {
            needs.add("exploration_encouragement");
        }
        return needs;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> mapList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                result.add((Map<String, Object>) map);
            }
        }
        return result;
    }
}
