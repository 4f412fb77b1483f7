package com.mythos.core.ai;

import com.mythos.core.catalog.ObjectiveCatalog;
import com.mythos.core.catalog.ObjectiveTypes;
import com.mythos.core.events.EventBus;
import com.mythos.core.llm.LlmParseException;
import com.mythos.core.llm.LlmProperties;
import com.mythos.core.llm.LlmService;
import com.mythos.core.manager.ObjectiveManager;
import com.mythos.core.manager.ObjectiveProperties;
import com.mythos.core.metrics.MythosMetrics;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveSuggestion;
import com.mythos.core.model.ObjectiveType;
import com.mythos.core.objective.Objective;
import com.mythos.core.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AiObjectiveCoordinatorTest {

    private MutableClock clock;
    private AiProperties aiProperties;
    private LlmProperties llmProperties;
    private LlmService llmService;
    private SimpleMeterRegistry meterRegistry;
    private MythosMetrics metrics;
    private AiObjectiveCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T20:00:00Z");
        aiProperties = new AiProperties();
        llmProperties = new LlmProperties();
        llmProperties.setTimeoutSeconds(1);
        llmService = mock(LlmService.class);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MythosMetrics(meterRegistry);
        coordinator = new AiObjectiveCoordinator(aiProperties, llmProperties, llmService, metrics, clock);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private static List<Map<String, Object>> investigatingSessions() {
        return List.of(Map.of("actions", List.of(
                Map.of("type", "investigate", "risk_level", 0.6),
                Map.of("type", "analyze", "risk_level", 0.6))));
    }

    private double fallbacks(String reason) {
        var counter = meterRegistry.find("mythos.ai.fallbacks").tag("reason", reason).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Nested
    @DisplayName("player analysis")
    class PlayerAnalysisTests {

        @Test
        @DisplayName("with the model disabled the heuristic profile is used")
        void disabled() {
            PlayerAnalysis analysis = coordinator.updatePlayerAnalysis(investigatingSessions(), List.of());

            assertEquals(PlayerBehaviorPattern.INVESTIGATIVE, analysis.primaryPattern());
            assertEquals(1.0, fallbacks("disabled"));
            verifyNoInteractions(llmService);
            assertSame(analysis, coordinator.getPlayerAnalysis().orElseThrow());
        }

        @Test
        @DisplayName("the model may refine the primary pattern")
        void refinedByModel() {
            llmProperties.setEnabled(true);
            when(llmService.structuredCall(anyString(), anyString(), eq(BehaviorInsight.class)))
                    .thenReturn(new BehaviorInsight("explorer", "Wanders off the map"));

            PlayerAnalysis analysis = coordinator.updatePlayerAnalysis(investigatingSessions(), List.of());

            assertEquals(PlayerBehaviorPattern.EXPLORER, analysis.primaryPattern());
            verify(llmService).structuredCall(eq(AiObjectiveCoordinator.ANALYSIS_SYSTEM_PROMPT),
                    contains("investigative"), eq(BehaviorInsight.class));
        }

        @Test
        @DisplayName("an unknown pattern from the model keeps the heuristic profile")
        void unknownPattern() {
            llmProperties.setEnabled(true);
            when(llmService.structuredCall(anyString(), anyString(), eq(BehaviorInsight.class)))
                    .thenReturn(new BehaviorInsight("necromancer", "?"));

            assertEquals(PlayerBehaviorPattern.INVESTIGATIVE,
                    coordinator.updatePlayerAnalysis(investigatingSessions(), List.of()).primaryPattern());
            assertEquals(1.0, fallbacks("error"));
        }

        @Test
        @DisplayName("a failing model call falls back to heuristics")
        void modelFailure() {
            llmProperties.setEnabled(true);
            when(llmService.structuredCall(anyString(), anyString(), eq(BehaviorInsight.class)))
                    .thenThrow(new LlmParseException("garbled"));

            assertEquals(PlayerBehaviorPattern.INVESTIGATIVE,
                    coordinator.updatePlayerAnalysis(investigatingSessions(), List.of()).primaryPattern());
            assertEquals(1.0, fallbacks("error"));
        }

        @Test
        @DisplayName("a slow model call times out and falls back to heuristics")
        void modelTimeout() {
            llmProperties.setEnabled(true);
            when(llmService.structuredCall(anyString(), anyString(), eq(BehaviorInsight.class)))
                    .thenAnswer(invocation -> {
                        Thread.sleep(5_000);
                        return new BehaviorInsight("explorer", "late");
                    });

            long start = System.currentTimeMillis();
            PlayerAnalysis analysis = coordinator.updatePlayerAnalysis(investigatingSessions(), List.of());

            assertEquals(PlayerBehaviorPattern.INVESTIGATIVE, analysis.primaryPattern());
            assertEquals(1.0, fallbacks("timeout"));
            assertTrue(System.currentTimeMillis() - start < 4_000);
        }

        @Test
        @DisplayName("a timed-out call frees the model thread for the next analysis")
        void modelUsableAfterTimeout() {
            llmProperties.setEnabled(true);
            when(llmService.structuredCall(anyString(), anyString(), eq(BehaviorInsight.class)))
                    .thenAnswer(invocation -> {
                        Thread.sleep(4_000);
                        return new BehaviorInsight("explorer", "late");
                    })
                    .thenReturn(new BehaviorInsight("social", "talks to everyone"));

            coordinator.updatePlayerAnalysis(investigatingSessions(), List.of());
            PlayerAnalysis second = coordinator.updatePlayerAnalysis(investigatingSessions(), List.of());

            assertEquals(PlayerBehaviorPattern.SOCIAL, second.primaryPattern());
            assertEquals(1.0, fallbacks("timeout"));
        }
    }

    @Nested
    @DisplayName("suggestions")
    class Suggestions {

        @Test
        @DisplayName("suggestions are recorded in the history")
        void recordsHistory() {
            List<ObjectiveSuggestion> suggestions = coordinator.suggest(Map.of("current_location", "library"), List.of());

            assertFalse(suggestions.isEmpty());
            assertEquals(suggestions.size(), coordinator.getSuggestionHistory().size());
            assertEquals(suggestions.size(), coordinator.getAiStatistics().get("total_suggestions"));
        }

        @Test
        @DisplayName("the history keeps only the most recent suggestions")
        void historyIsBounded() {
            aiProperties.setSuggestionHistoryLimit(3);

            Map<String, Object> library = Map.of("tension_level", 2, "story_phase", "investigation",
                    "current_location", "library", "npcs_present", List.of("Librarian"));

            coordinator.suggest(library, List.of());
            List<ObjectiveSuggestion> latest = coordinator.suggest(library, List.of());

            List<SuggestionRecord> history = coordinator.getSuggestionHistory();
            assertEquals(3, history.size());
            assertEquals(latest.get(latest.size() - 1), history.get(history.size() - 1).suggestion());
            assertEquals(3, coordinator.getAiStatistics().get("total_suggestions"));
        }

        @Test
        @DisplayName("a struggling player gets longer estimates")
        void estimatesFollowDifficulty() {
            aiProperties.setAdjustmentSensitivity(1.0);
            List<Map<String, Object>> history = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                history.add(Map.of("completed", false));
            }

            List<ObjectiveSuggestion> suggestions = coordinator.suggestObjectives(
                    Map.of("objective_history", history), List.of(), 5);

            ObjectiveSuggestion safety = suggestions.stream()
                    .filter(s -> s.title().equals("Ensure Safety"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(10, safety.estimatedMinutes());
        }
    }

    @Nested
    @DisplayName("implementation")
    class Implementation {

        private ObjectiveManager manager;

        @BeforeEach
        void setUpManager() {
            manager = new ObjectiveManager(new ObjectiveProperties(), ObjectiveCatalog.defaultRegistry(),
                    new EventBus(), metrics, clock);
        }

        private ObjectiveSuggestion suggestion(String factory) {
            return new ObjectiveSuggestion(factory, "Speak with Librarian", "Ask about the missing tome",
                    ObjectiveType.SOCIAL, ObjectiveScope.IMMEDIATE, ObjectivePriority.MEDIUM, 5, 0.8,
                    "NPC available", List.of("npcs_present"),
                    Map.of("required_actions", List.of("ask_questions")));
        }

        @Test
        @DisplayName("a suggestion becomes a managed objective with a fresh id")
        void implementsSuggestion() {
            manager.createObjective(ObjectiveTypes.IMMEDIATE, "ai_generated_0", Map.of());

            Objective objective = coordinator.implementSuggestion(suggestion(ObjectiveTypes.IMMEDIATE), manager)
                    .orElseThrow();

            assertEquals("ai_generated_1", objective.getObjectiveId());
            assertEquals("Speak with Librarian", objective.getTitle());
            assertEquals(ObjectiveType.SOCIAL, objective.getObjectiveType());
            assertTrue(manager.getObjective("ai_generated_1").isPresent());
        }

        @Test
        @DisplayName("implemented suggestions are marked in the history")
        void marksHistory() {
            ObjectiveSuggestion suggestion = coordinator.suggest(
                    Map.of("npcs_present", List.of("Librarian")), List.of()).stream()
                    .filter(s -> s.title().equals("Speak with Librarian"))
                    .findFirst()
                    .orElseThrow();

            coordinator.implementSuggestion(suggestion, manager);

            assertEquals(1L, coordinator.getAiStatistics().get("implemented_suggestions"));
        }

        @Test
        @DisplayName("a refused suggestion yields nothing")
        void refusedSuggestion() {
            assertTrue(coordinator.implementSuggestion(suggestion("UnknownObjective"), manager).isEmpty());
            assertEquals(0, manager.size());
        }
    }

    @Test
    @DisplayName("difficulty adjustment is applied to every objective")
    void appliesDifficulty() {
        ObjectiveCatalog catalog = new ObjectiveCatalog(clock);
        Objective survival = catalog.survival("flee", "Flee", "the hound", null);
        List<Map<String, Object>> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(Map.of("completed", true));
        }

        double adjustment = coordinator.applyDifficultyAdjustment(history, List.of(survival));

        assertEquals(-0.06, adjustment, 1e-9);
        assertFalse(survival.getModifiers().isEmpty());
        assertNotNull(meterRegistry.find("mythos.ai.difficulty_adjustment").tag("direction", "harder").summary());
    }
}
