package com.mythos.core.achievement;

import com.mythos.core.events.EventBus;
import com.mythos.core.events.MythosEvent;
import com.mythos.core.metrics.MythosMetrics;
import com.mythos.core.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AchievementManagerTest {

    private MutableClock clock;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private AchievementManager manager;
    private final List<MythosEvent> unlocked = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T01:00:00Z");
        eventBus = new EventBus();
        eventBus.subscribe("achievement_unlocked", unlocked::add);
        meterRegistry = new SimpleMeterRegistry();
        manager = newManager();
    }

    private AchievementManager newManager() {
        return new AchievementManager(eventBus, new MythosMetrics(meterRegistry), clock);
    }

    private static List<String> ids(List<Achievement> achievements) {
        return achievements.stream().map(Achievement::getAchievementId).toList();
    }

    @Nested
    @DisplayName("unlocking")
    class Unlocking {

        @Test
        @DisplayName("unlocks once and publishes achievement_unlocked")
        void unlocksOnce() {
            Map<String, Object> stats = Map.of("cosmic_knowledge_count", 1);

            assertEquals(List.of("first_truth"), ids(manager.checkAllAchievements(Map.of(), stats)));
            assertTrue(manager.checkAllAchievements(Map.of(), stats).isEmpty());

            assertEquals(1, unlocked.size());
            assertEquals("first_truth", unlocked.get(0).subjectId());
            assertEquals(Instant.parse("2026-03-02T01:00:00Z"),
                    manager.getAchievement("first_truth").orElseThrow().getUnlockedAt().orElseThrow());
            assertEquals(1.0, meterRegistry.find("mythos.achievements.unlocked").tag("rarity", "common")
                    .counter().count());
        }

        @Test
        @DisplayName("prerequisites must be unlocked first")
        void prerequisites() {
            assertTrue(manager.checkAllAchievements(Map.of(), Map.of("known_entities_count", 6)).isEmpty());

            List<Achievement> both = manager.checkAllAchievements(Map.of(),
                    Map.of("known_entities_count", 6, "cosmic_knowledge_count", 2));

            assertEquals(List.of("first_truth", "forbidden_scholar"), ids(both));
        }

        @Test
        @DisplayName("unlocks recorded in the game data satisfy prerequisites")
        void externalPrerequisites() {
            List<Achievement> result = manager.checkAllAchievements(
                    Map.of("unlocked_achievements", List.of("first_truth")),
                    Map.of("known_entities_count", 5));

            assertEquals(List.of("forbidden_scholar"), ids(result));
        }

        @Test
        @DisplayName("objective completion counts only the configured objective type")
        void objectiveCompletionFiltersByType() {
            Map<String, Object> exploration = Map.of("completed_objectives",
                    List.of(Map.of("type", "exploration")));
            assertTrue(manager.checkAllAchievements(exploration, Map.of()).isEmpty());

            Map<String, Object> investigation = Map.of("completed_objectives",
                    List.of(Map.of("type", "investigation")));
            assertEquals(List.of("first_mystery"), ids(manager.checkAllAchievements(investigation, Map.of())));
        }

        @Test
        @DisplayName("sanity-state achievements read the player's SAN")
        void sanityState() {
            assertEquals(List.of("madness_embrace"),
                    ids(manager.checkAllAchievements(Map.of(), Map.of("sanity", 4))));
        }
    }

    @Nested
    @DisplayName("views")
    class Views {

        @Test
        @DisplayName("completion is weighted by rarity")
        void completionPercentage() {
            int total = manager.getAllAchievements().stream().mapToInt(a -> a.getRarity().weight()).sum();
            manager.checkAllAchievements(Map.of(), Map.of("cosmic_knowledge_count", 1, "known_entities_count", 5));

            assertEquals(4 * 100.0 / total, manager.getCompletionPercentage(), 1e-9);
            assertEquals("forbidden_scholar", manager.getRarestUnlocked().orElseThrow().getAchievementId());
            assertEquals(2, manager.getUnlockHistory().size());
        }

        @Test
        @DisplayName("progress reports the first unmet criterion")
        void progress() {
            AchievementProgress progress = manager.getAchievementProgress("first_truth", Map.of(), Map.of())
                    .orElseThrow();

            assertFalse(progress.unlocked());
            assertEquals(0.0, progress.progress());
            assertNotNull(progress.nextCriterion());
            assertTrue(manager.getAchievementProgress("missing", Map.of(), Map.of()).isEmpty());
        }

        @Test
        @DisplayName("duplicate achievement ids are rejected")
        void duplicateIds() {
            Achievement duplicate = Achievement.builder("first_truth").title("Again").build();
            assertThrows(IllegalArgumentException.class, () -> manager.addAchievement(duplicate));
        }
    }

    @Nested
    @DisplayName("persistence")
    class Persistence {

        @Test
        @DisplayName("save and load restore unlocked achievements")
        void roundTrip(@TempDir Path dir) {
            manager.checkAllAchievements(Map.of(), Map.of("cosmic_knowledge_count", 1));
            Path file = dir.resolve("achievements.json");
            assertTrue(manager.saveToFile(file));

            AchievementManager restored = newManager();
            assertTrue(restored.loadFromFile(file));

            assertEquals(Set.of("first_truth"), restored.getUnlockedIds());
            assertTrue(restored.getAchievement("first_truth").orElseThrow().isUnlocked());
            assertEquals(1, restored.getUnlockHistory().size());
            assertTrue(restored.checkAllAchievements(Map.of(), Map.of("cosmic_knowledge_count", 1)).isEmpty());
        }

        @Test
        @DisplayName("unknown ids are ignored and nothing is re-locked")
        void unknownIdsIgnored(@TempDir Path dir) throws Exception {
            manager.checkAllAchievements(Map.of(), Map.of("sanity", 4));
            Path file = dir.resolve("achievements.json");
            Files.writeString(file, """
                    {"unlocked_achievements": ["first_truth", "retired_achievement"], "unlocked_at": {}}
                    """);

            assertTrue(manager.loadFromFile(file));

            assertEquals(Set.of("madness_embrace", "first_truth"), manager.getUnlockedIds());
        }

        @Test
        @DisplayName("an unreadable file leaves the state untouched")
        void unreadableFile(@TempDir Path dir) {
            manager.checkAllAchievements(Map.of(), Map.of("cosmic_knowledge_count", 1));

            assertFalse(manager.loadFromFile(dir.resolve("missing.json")));
            assertEquals(Set.of("first_truth"), manager.getUnlockedIds());
        }
    }

    @Nested
    @DisplayName("comparison operators")
    class Operators {

        @Test
        @DisplayName("numbers compare numerically across types")
        void numeric() {
            assertTrue(ComparisonOperator.GTE.test(5, 5.0));
            assertTrue(ComparisonOperator.GT.test(5.5, 5));
            assertTrue(ComparisonOperator.LT.test(1L, 2));
            assertFalse(ComparisonOperator.LTE.test(3, 2));
            assertTrue(ComparisonOperator.EQ.test(2, 2.0));
        }

        @Test
        @DisplayName("membership operators work on collections and strings")
        void membership() {
            assertTrue(ComparisonOperator.IN.test("paranoia", List.of("paranoia", "phobia")));
            assertTrue(ComparisonOperator.CONTAINS.test(List.of("ancient_book"), "ancient_book"));
            assertTrue(ComparisonOperator.CONTAINS.test("necronomicon", "nomicon"));
            assertFalse(ComparisonOperator.IN.test("amnesia", List.of("paranoia")));
        }

        @Test
        @DisplayName("missing or incomparable values never match")
        void incomparable() {
            assertFalse(ComparisonOperator.GTE.test(null, 1));
            assertFalse(ComparisonOperator.GT.test("ten", 1));
            assertEquals(ComparisonOperator.GTE, ComparisonOperator.fromSymbol("gte"));
            assertThrows(IllegalArgumentException.class, () -> ComparisonOperator.fromSymbol("~"));
        }
    }
}
