package com.mythos.core.ai;

import com.mythos.core.model.ObjectiveSuggestion;
import com.mythos.core.model.ObjectiveType;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.layered.ShortTermObjective;
import com.mythos.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ObjectiveSuggestionGeneratorTest {

    private AiProperties properties;
    private ObjectiveSuggestionGenerator generator;

    @BeforeEach
    void setUp() {
        properties = new AiProperties();
        generator = new ObjectiveSuggestionGenerator(properties);
    }

    private static GameContext library() {
        return GameContext.from(Map.of(
                "tension_level", 2,
                "story_phase", "investigation",
                "current_location", "library",
                "npcs_present", List.of("Librarian")));
    }

    private static List<String> titles(List<ObjectiveSuggestion> suggestions) {
        return suggestions.stream().map(ObjectiveSuggestion::title).toList();
    }

    private static PlayerAnalysis analysis(PlayerBehaviorPattern pattern, List<String> needs) {
        return new PlayerAnalysis(pattern, List.of(), 0.5, 0.5, 0.5, 0.5, 0.5, 1.0,
                DifficultyLevel.NORMAL, needs);
    }

    @Test
    @DisplayName("suggestions are de-duplicated by title and ordered by confidence")
    void dedupedAndOrdered() {
        List<ObjectiveSuggestion> suggestions = generator.generate(library(), List.of(), null, 10);

        assertEquals(List.of("Ensure Safety", "Speak with Librarian", "Examine library", "Explore Nearby Areas"),
                titles(suggestions));
    }

    @Test
    @DisplayName("the limit and the minimum confidence are honoured")
    void limitAndConfidence() {
        assertEquals(List.of("Ensure Safety", "Speak with Librarian"),
                titles(generator.generate(library(), List.of(), null, 2)));

        properties.setMinConfidence(0.75);
        assertEquals(List.of("Ensure Safety", "Speak with Librarian"),
                titles(generator.generate(library(), List.of(), null, 10)));

        properties.setMinConfidence(0.6);
        properties.setMaxSuggestions(1);
        assertEquals(List.of("Ensure Safety"), titles(generator.generate(library(), List.of(), null, 10)));
    }

    @Test
    @DisplayName("low tension asks for something unsettling")
    void lowTension() {
        GameContext quiet = GameContext.from(Map.of("tension_level", 1, "story_phase", "action"));

        ObjectiveSuggestion first = generator.generate(quiet, List.of(), null, 10).stream()
                .filter(s -> s.title().equals("Investigate Disturbing Sounds"))
                .findFirst()
                .orElseThrow();

        assertEquals(0.8, first.confidence());
        assertEquals(2, first.parameters().get("initial_tension"));
    }

    @Test
    @DisplayName("investigative players without a knowledge objective get one")
    void investigativePlayer() {
        List<ObjectiveSuggestion> suggestions = generator.generate(library(), List.of(),
                analysis(PlayerBehaviorPattern.INVESTIGATIVE, List.of()), 10);

        ObjectiveSuggestion knowledge = suggestions.stream()
                .filter(s -> s.objectiveType() == ObjectiveType.KNOWLEDGE)
                .findFirst()
                .orElseThrow();
        assertEquals("Uncover Hidden Knowledge", knowledge.title());
    }

    @Test
    @DisplayName("only active objectives count towards the essential types")
    void missingTypes() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T20:00:00Z");
        Objective investigation = new ShortTermObjective(ObjectiveDefinition.builder("study")
                .objectiveType(ObjectiveType.INVESTIGATION).build(), clock);

        assertEquals(ObjectiveSuggestionGenerator.ESSENTIAL_TYPES, generator.missingTypes(List.of(investigation)));

        investigation.activate(Map.of());
        assertEquals(List.of(ObjectiveType.EXPLORATION, ObjectiveType.SOCIAL, ObjectiveType.SURVIVAL),
                generator.missingTypes(List.of(investigation)));
    }
}
