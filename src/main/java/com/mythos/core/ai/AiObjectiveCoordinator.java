package com.mythos.core.ai;

import com.mythos.core.llm.LlmProperties;
import com.mythos.core.llm.LlmService;
import com.mythos.core.manager.ObjectiveManager;
import com.mythos.core.manager.SuggestionSource;
import com.mythos.core.metrics.MythosMetrics;
import com.mythos.core.model.ObjectiveSuggestion;
import com.mythos.core.objective.Objective;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Glue between player profiling, suggestion generation, difficulty adjustment and the manager.
 * <p>
 * The only blocking call is the optional model refinement of the player profile. It runs on a
 * dedicated thread, is bounded by {@code mythos.llm.timeout-seconds} and is cancelled on
 * timeout; every failure falls back to the heuristic profile.
 */
@Service
public class AiObjectiveCoordinator implements SuggestionSource {

    private static final Logger log = LoggerFactory.getLogger(AiObjectiveCoordinator.class);

    static final String ANALYSIS_SYSTEM_PROMPT = """
            You classify player behaviour in a solo cosmic-horror investigation game.
            Answer with the single best matching pattern from: cautious, aggressive, investigative,
            social, explorer, survival, puzzle_solver, horror_seeker. Keep the reasoning to one sentence.
            """;

    private final AiProperties properties;
    private final LlmProperties llmProperties;
    private final LlmService llmService;
    private final MythosMetrics metrics;
    private final Clock clock;
    private final PlayerBehaviorAnalyzer analyzer;
    private final ObjectiveSuggestionGenerator generator;
    private final DynamicDifficultyAdjuster difficultyAdjuster;
    private final ExecutorService llmExecutor;

    private final List<SuggestionRecord> suggestionHistory = new ArrayList<>();
    private PlayerAnalysis playerAnalysis;
    private Instant lastAnalysisTime;
    private int implementedCount;

    /**
     * @param llmService model access, or null to run on heuristics only
     */
    public AiObjectiveCoordinator(AiProperties properties, LlmProperties llmProperties, LlmService llmService,
                                  MythosMetrics metrics, Clock clock) {
        this.properties = properties;
        this.llmProperties = llmProperties;
        this.llmService = llmService;
        this.metrics = metrics;
        this.clock = clock;
        this.analyzer = new PlayerBehaviorAnalyzer();
        this.generator = new ObjectiveSuggestionGenerator(properties);
        this.difficultyAdjuster = new DynamicDifficultyAdjuster(properties);
        this.llmExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mythos-llm");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Autowired
    public AiObjectiveCoordinator(AiProperties properties, LlmProperties llmProperties,
                                  ObjectProvider<LlmService> llmService, MythosMetrics metrics, Clock clock) {
        this(properties, llmProperties, llmService.getIfAvailable(), metrics, clock);
    }

    // -- Player analysis ------------------------------------------------------

    /**
     * Recomputes the player profile. Never throws because of the model; see the class notes.
     */
    public PlayerAnalysis updatePlayerAnalysis(List<Map<String, Object>> gameHistory,
                                               List<Map<String, Object>> objectiveHistory) {
        PlayerAnalysis heuristic = analyzer.analyze(gameHistory, objectiveHistory);
        PlayerAnalysis result = refineWithModel(heuristic).orElse(heuristic);
        playerAnalysis = result;
        lastAnalysisTime = clock.instant();
        log.info("Player analysis updated: primary pattern = {}", result.primaryPattern().value());
        return result;
    }

    private Optional<PlayerAnalysis> refineWithModel(PlayerAnalysis heuristic) {
        if (!llmProperties.isEnabled() || llmService == null) {
            metrics.recordAnalysisFallback("disabled");
            return Optional.empty();
        }

        String userPrompt = String.format(
                "Primary heuristic pattern: %s%nRisk tolerance: %.2f (0=cautious, 1=reckless)%n"
                        + "Exploration preference: %.2f%nSocial engagement: %.2f%nHorror tolerance: %.2f",
                heuristic.primaryPattern().value(), heuristic.riskTolerance(),
                heuristic.explorationPreference(), heuristic.socialEngagement(), heuristic.horrorTolerance());

        // cancel(true) on this future interrupts the model thread.
        Future<BehaviorInsight> future = llmExecutor.submit(
                () -> llmService.structuredCall(ANALYSIS_SYSTEM_PROMPT, userPrompt, BehaviorInsight.class));
        try {
            BehaviorInsight insight = future.get(llmProperties.getTimeoutSeconds(), TimeUnit.SECONDS);
            Optional<PlayerBehaviorPattern> pattern = insight == null
                    ? Optional.empty()
                    : PlayerBehaviorPattern.parse(insight.primaryPattern());
            if (pattern.isEmpty()) {
                log.warn("Model returned an unknown behaviour pattern, keeping heuristic analysis");
                metrics.recordAnalysisFallback("error");
                return Optional.empty();
            }
            log.debug("Model refined primary pattern to {}: {}", pattern.get().value(), insight.reasoning());
            return Optional.of(heuristic.withPrimaryPattern(pattern.get()));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Player analysis by model timed out after {}s, using heuristics", llmProperties.getTimeoutSeconds());
            metrics.recordAnalysisFallback("timeout");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for model analysis, using heuristics");
            metrics.recordAnalysisFallback("error");
        } catch (ExecutionException e) {
            log.warn("Player analysis by model failed, using heuristics: {}", e.getCause().getMessage());
            metrics.recordAnalysisFallback("error");
        }
        return Optional.empty();
    }

    // -- Suggestions ----------------------------------------------------------

    @Override
    public List<ObjectiveSuggestion> suggest(Map<String, Object> gameState, List<Objective> activeObjectives) {
        return suggestObjectives(gameState, activeObjectives, properties.getMaxSuggestions());
    }

    /**
     * Generates suggestions for the current state. When the state carries an
     * {@code objective_history}, estimated durations are stretched or shortened by the current
     * difficulty adjustment.
     */
    public List<ObjectiveSuggestion> suggestObjectives(Map<String, Object> gameState,
                                                       List<Objective> currentObjectives, int limit) {
        Map<String, Object> state = gameState == null ? Map.of() : gameState;
        GameContext context = GameContext.from(state);
        List<ObjectiveSuggestion> suggestions = generator.generate(context, currentObjectives, playerAnalysis, limit);

        if (state.containsKey("objective_history")) {
            List<Map<String, Object>> history = PlayerBehaviorAnalyzer.mapList(state.get("objective_history"));
            double adjustment = difficultyAdjuster.calculateAdjustment(difficultyAdjuster.analyzePerformance(history));
            metrics.recordDifficultyAdjustment(adjustment);
            double factor = adjustment > 0 ? 1 + adjustment * 0.3 : 1 + adjustment * 0.2;
            suggestions = suggestions.stream()
                    .map(s -> s.withEstimatedMinutes(Math.max(1, (int) Math.round(s.estimatedMinutes() * factor))))
                    .toList();
        }

        Instant now = clock.instant();
        suggestions.forEach(s -> suggestionHistory.add(new SuggestionRecord(now, s, null)));
        trimSuggestionHistory();
        metrics.recordSuggestions(suggestions.size());
        return suggestions;
    }

    // Oldest records go first.
    private void trimSuggestionHistory() {
        int overflow = suggestionHistory.size() - Math.max(0, properties.getSuggestionHistoryLimit());
        if (overflow > 0) {
            suggestionHistory.subList(0, overflow).clear();
        }
    }

    /**
     * Turns a suggestion into a managed objective.
     *
     * @return the created objective, or empty when the manager refused it
     */
    public Optional<Objective> implementSuggestion(ObjectiveSuggestion suggestion, ObjectiveManager manager) {
        String objectiveId = nextObjectiveId(manager);
        Map<String, Object> attributes = new LinkedHashMap<>(suggestion.parameters());
        attributes.put("title", suggestion.title());
        attributes.put("description", suggestion.description());
        attributes.put("objective_type", suggestion.objectiveType());
        attributes.put("scope", suggestion.scope());
        attributes.put("priority", suggestion.priority());
        try {
            Objective objective = manager.createObjective(suggestion.factoryName(), objectiveId, attributes);
            implementedCount++;
            markImplemented(suggestion, objectiveId);
            log.info("Implemented suggestion '{}' as {}", suggestion.title(), objectiveId);
            return Optional.of(objective);
        } catch (RuntimeException e) {
            log.error("Failed to implement suggestion '{}': {}", suggestion.title(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    private String nextObjectiveId(ObjectiveManager manager) {
        int n = implementedCount;
        while (manager.getObjective("ai_generated_" + n).isPresent()) {
            n++;
        }
        return "ai_generated_" + n;
    }

    private void markImplemented(ObjectiveSuggestion suggestion, String objectiveId) {
        for (int i = 0; i < suggestionHistory.size(); i++) {
            SuggestionRecord record = suggestionHistory.get(i);
            if (!record.implemented() && record.suggestion().equals(suggestion)) {
                suggestionHistory.set(i, record.implementedAs(objectiveId));
                return;
            }
        }
    }

    // -- Difficulty -----------------------------------------------------------

    /**
     * Computes the adjustment from {@code objectiveHistory} and applies it to each objective.
     *
     * @return the adjustment that was applied
     */
    public double applyDifficultyAdjustment(List<Map<String, Object>> objectiveHistory, List<Objective> objectives) {
        PerformanceSummary performance = difficultyAdjuster.analyzePerformance(objectiveHistory);
        double adjustment = difficultyAdjuster.calculateAdjustment(performance);
        metrics.recordDifficultyAdjustment(adjustment);
        for (Objective objective : objectives) {
            difficultyAdjuster.applyAdjustment(objective, adjustment);
        }
        log.info("Difficulty adjustment {} applied to {} objectives (success rate {}, trend {})",
                String.format("%.3f", adjustment), objectives.size(),
                String.format("%.2f", performance.successRate()), String.format("%.2f", performance.trend()));
        return adjustment;
    }

    // -- Introspection --------------------------------------------------------

    public Optional<PlayerAnalysis> getPlayerAnalysis() {
        return Optional.ofNullable(playerAnalysis);
    }

    public List<SuggestionRecord> getSuggestionHistory() {
        return List.copyOf(suggestionHistory);
    }

    public DynamicDifficultyAdjuster getDifficultyAdjuster() {
        return difficultyAdjuster;
    }

    public Map<String, Object> getAiStatistics() {
        long implemented = suggestionHistory.stream().filter(SuggestionRecord::implemented).count();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_suggestions", suggestionHistory.size());
        stats.put("implemented_suggestions", implemented);
        stats.put("implementation_rate", implemented / (double) Math.max(suggestionHistory.size(), 1));
        stats.put("player_analysis", playerAnalysis);
        stats.put("last_analysis_time", lastAnalysisTime);
        return stats;
    }

    @PreDestroy
    public void shutdown() {
        llmExecutor.shutdownNow();
    }
}
