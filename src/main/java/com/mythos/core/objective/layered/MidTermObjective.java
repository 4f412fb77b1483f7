package com.mythos.core.objective.layered;

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
import java.util.Optional;
import java.util.Set;

/**
 * A whole-scenario objective (thirty to ninety minutes) with investigation branches,
 * story beats, skill challenges and horror revelations, blended as
 * 0.4 / 0.3 / 0.1 / 0.2 over the parts that are configured.
 * <p>
 * Accumulated SAN loss drives horror escalation: reaching the threshold fires one
 * {@code horror_escalation} event and raises the threshold by half.
 */
public class MidTermObjective extends Objective {

    private static final Logger log = LoggerFactory.getLogger(MidTermObjective.class);

    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofHours(2);
    public static final double DEFAULT_SAN_LOSS_THRESHOLD = 10;
    private static final double ESCALATION_FACTOR = 1.5;

    /**
     * Receives the accumulated SAN loss on every horror escalation.
     */
    @FunctionalInterface
    public interface HorrorListener {
        void onEscalation(double accumulatedSanLoss, Map<String, Object> gameState);
    }

    private final Map<String, Double> investigationBranches = new LinkedHashMap<>();
    private final List<String> storyBeats = new ArrayList<>();
    private final Map<String, Integer> skillChallenges = new LinkedHashMap<>();
    private final Map<String, Integer> skillsTested = new LinkedHashMap<>();
    private final List<String> horrorRevelations = new ArrayList<>();
    private final Set<String> revelationsUnlocked = new LinkedHashSet<>();
    private final List<CompletionPath> completionPaths = new ArrayList<>();
    private final List<HorrorListener> horrorListeners = new ArrayList<>();
    private int currentBeatIndex;
    private double sanLossThreshold = DEFAULT_SAN_LOSS_THRESHOLD;
    private double accumulatedSanLoss;
    private String activePath;

    public MidTermObjective(ObjectiveDefinition definition, Clock clock) {
        super(definition.withScope(ObjectiveScope.MID_TERM).withDefaultTimeLimit(DEFAULT_TIME_LIMIT), clock);
    }

    public static MidTermObjective fromParams(ObjectiveDefinition definition, ObjectiveParams params, Clock clock) {
        MidTermObjective objective = new MidTermObjective(definition, clock)
                .withStoryBeats(params.stringList("story_beats"))
                .withHorrorRevelations(params.stringList("horror_revelations"))
                .withSanLossThreshold(params.doubleValue("san_loss_threshold", DEFAULT_SAN_LOSS_THRESHOLD));
        if (params.get("investigation_branches") instanceof Map<?, ?>) {
            Map<String, Object> branches = params.map("investigation_branches");
            branches.forEach((name, value) ->
                    objective.investigationBranches.put(name, StateValues.getDouble(branches, name, 0.0)));
        } else {
            objective.withInvestigationBranches(params.stringList("investigation_branches"));
        }
        Map<String, Object> challenges = params.map("skill_challenges");
        challenges.forEach((skill, count) ->
                objective.skillChallenges.put(skill, StateValues.getInt(challenges, skill, 1)));
        Map<String, Object> paths = params.map("completion_paths");
        paths.forEach((name, path) ->
                objective.completionPaths.add(CompletionPath.fromMap(name, StateValues.getMap(paths, name))));
        return objective;
    }

    public MidTermObjective withInvestigationBranches(List<String> branches) {
        branches.forEach(branch -> investigationBranches.put(branch, 0.0));
        return this;
    }

    public MidTermObjective withStoryBeats(List<String> beats) {
        storyBeats.addAll(beats);
        return this;
    }

    public MidTermObjective withSkillChallenges(Map<String, Integer> challenges) {
        skillChallenges.putAll(challenges);
        return this;
    }

    public MidTermObjective withHorrorRevelations(List<String> revelations) {
        horrorRevelations.addAll(revelations);
        return this;
    }

    public MidTermObjective withSanLossThreshold(double threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("san_loss_threshold must be positive");
        }
        this.sanLossThreshold = threshold;
        return this;
    }

    public MidTermObjective withCompletionPath(CompletionPath path) {
        completionPaths.add(path);
        return this;
    }

    public void addHorrorListener(HorrorListener listener) {
        horrorListeners.add(listener);
    }

    @Override
    protected boolean updateProgress(Map<String, Object> gameState, Map<String, Object> action) {
        boolean progressMade = false;

        String branch = StateValues.getString(action, "investigation_branch");
        if (branch != null && investigationBranches.containsKey(branch)) {
            double advancement = StateValues.getDouble(action, "advancement", 0.1);
            double value = Math.min(1.0, investigationBranches.get(branch) + advancement);
            investigationBranches.put(branch, value);
            progressMade = true;
            logEvent("investigation_advanced", Map.of("branch", branch, "progress", value, "advancement", advancement));
        }

        if (StateValues.getBoolean(action, "story_beat_completed") && currentBeatIndex < storyBeats.size()) {
            currentBeatIndex++;
            progressMade = true;
            logEvent("story_beat_completed", Map.of("beat_index", currentBeatIndex - 1, "total_beats", storyBeats.size()));
        }

        String skill = StateValues.getString(action, "skill_used");
        if (skill != null && skillChallenges.containsKey(skill)) {
            skillsTested.merge(skill, 1, Integer::sum);
            progressMade = true;
        }

        if (action.containsKey("san_loss")) {
            accumulatedSanLoss += StateValues.getDouble(action, "san_loss", 0.0);
            if (accumulatedSanLoss >= sanLossThreshold) {
                triggerHorrorEscalation(gameState);
            }
        }

        String revelation = StateValues.getString(action, "revelation");
        if (revelation != null && horrorRevelations.contains(revelation) && revelationsUnlocked.add(revelation)) {
            progressMade = true;
            logEvent("horror_revelation", Map.of("revelation", revelation));
        }

        setProgress(computeProgress());
        checkCompletionPaths();
        return progressMade;
    }

    private double computeProgress() {
        double weightedSum = 0;
        double totalWeight = 0;
        if (!investigationBranches.isEmpty()) {
            weightedSum += averageInvestigationProgress() * 0.4;
            totalWeight += 0.4;
        }
        if (!storyBeats.isEmpty()) {
            weightedSum += (double) currentBeatIndex / storyBeats.size() * 0.3;
            totalWeight += 0.3;
        }
        if (!horrorRevelations.isEmpty()) {
            weightedSum += (double) revelationsUnlocked.size() / horrorRevelations.size() * 0.2;
            totalWeight += 0.2;
        }
        if (!skillChallenges.isEmpty()) {
            long met = skillChallenges.entrySet().stream()
                    .filter(e -> skillsTested.getOrDefault(e.getKey(), 0) >= e.getValue())
                    .count();
            weightedSum += (double) met / skillChallenges.size() * 0.1;
            totalWeight += 0.1;
        }
        return totalWeight == 0 ? 0.0 : weightedSum / totalWeight;
    }

    private double averageInvestigationProgress() {
        if (investigationBranches.isEmpty()) {
            return 0.0;
        }
        return investigationBranches.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private void triggerHorrorEscalation(Map<String, Object> gameState) {
        logEvent("horror_escalation", Map.of("san_loss", accumulatedSanLoss, "threshold", sanLossThreshold));
        log.info("Horror escalation for {} at accumulated SAN loss {}", getObjectiveId(), accumulatedSanLoss);
        sanLossThreshold *= ESCALATION_FACTOR;
        for (HorrorListener listener : horrorListeners) {
            try {
                listener.onEscalation(accumulatedSanLoss, gameState);
            } catch (Exception e) {
                log.error("Horror listener failed for {}: {}", getObjectiveId(), e.getMessage(), e);
            }
        }
    }

    // First satisfied path wins and stays selected.
    private void checkCompletionPaths() {
        if (activePath != null) {
            return;
        }
        for (CompletionPath path : completionPaths) {
            if (pathSatisfied(path)) {
                activePath = path.name();
                logEvent("completion_path_activated", Map.of("path", path.name()));
                return;
            }
        }
    }

    private boolean pathSatisfied(CompletionPath path) {
        if (path.minInvestigationProgress() != null && averageInvestigationProgress() < path.minInvestigationProgress()) {
            return false;
        }
        if (!revelationsUnlocked.containsAll(path.requiredRevelations())) {
            return false;
        }
        return path.minStoryBeat() == null || currentBeatIndex >= path.minStoryBeat();
    }

    public Optional<String> getActivePath() {
        return Optional.ofNullable(activePath);
    }

    public double getSanLossThreshold() {
        return sanLossThreshold;
    }

    public double getAccumulatedSanLoss() {
        return accumulatedSanLoss;
    }

    public Map<String, Double> getInvestigationBranches() {
        return Map.copyOf(investigationBranches);
    }

    public Optional<String> getCurrentStoryBeat() {
        return currentBeatIndex < storyBeats.size() ? Optional.of(storyBeats.get(currentBeatIndex)) : Optional.empty();
    }

    @Override
    protected Map<String, Object> saveVariantState() {
        Map<String, Object> paths = new LinkedHashMap<>();
        completionPaths.forEach(path -> paths.put(path.name(), path.toMap()));
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("investigation_branches", new LinkedHashMap<>(investigationBranches));
        state.put("story_beats", List.copyOf(storyBeats));
        state.put("horror_revelations", List.copyOf(horrorRevelations));
        state.put("san_loss_threshold", sanLossThreshold);
        state.put("skill_challenges", new LinkedHashMap<>(skillChallenges));
        state.put("completion_paths", paths);
        state.put("skills_tested", new LinkedHashMap<>(skillsTested));
        state.put("revelations_unlocked", List.copyOf(revelationsUnlocked));
        state.put("current_beat_index", currentBeatIndex);
        state.put("accumulated_san_loss", accumulatedSanLoss);
        state.put("active_path", activePath);
        return state;
    }

    @Override
    protected void restoreVariantState(ObjectiveParams state) {
        Map<String, Object> tested = state.map("skills_tested");
        tested.forEach((skill, count) -> skillsTested.put(skill, StateValues.getInt(tested, skill, 0)));
        revelationsUnlocked.addAll(state.stringList("revelations_unlocked"));
        currentBeatIndex = Math.min(state.intValue("current_beat_index", 0), storyBeats.size());
        accumulatedSanLoss = state.doubleValue("accumulated_san_loss", 0.0);
        activePath = state.string("active_path", null);
    }

    @Override
    protected Map<String, Object> displayDetails() {
        Map<String, Object> story = new LinkedHashMap<>();
        story.put("current_beat", currentBeatIndex);
        story.put("total_beats", storyBeats.size());
        story.put("current_beat_data", getCurrentStoryBeat().orElse(null));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("investigation_branches", new LinkedHashMap<>(investigationBranches));
        details.put("story_progress", story);
        details.put("horror_progression", Map.of(
                "san_loss", accumulatedSanLoss,
                "revelations_unlocked", List.copyOf(revelationsUnlocked),
                "total_revelations", horrorRevelations.size()));
        details.put("skill_challenges", new LinkedHashMap<>(skillChallenges));
        details.put("skills_tested", new LinkedHashMap<>(skillsTested));
        details.put("active_completion_path", activePath);
        return details;
    }
}
