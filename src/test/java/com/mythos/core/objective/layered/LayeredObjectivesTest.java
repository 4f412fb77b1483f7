package com.mythos.core.objective.layered;

import com.mythos.core.model.ObjectiveModifier;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveStatus;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LayeredObjectivesTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T20:00:00Z");
    }

    @Nested
    @DisplayName("ShortTermObjective")
    class ShortTerm {

        private ShortTermObjective scene() {
            return new ShortTermObjective(ObjectiveDefinition.builder("study").build(), clock)
                    .withRequiredDiscoveries(List.of("diary"))
                    .withMilestoneCount(2)
                    .withTensionRamp(true, 1, 3);
        }

        @Test
        @DisplayName("weights discoveries at 0.6 and milestones at 0.4")
        void weightsDiscoveriesAndMilestones() {
            var objective = scene();
            objective.activate(Map.of());

            objective.update(Map.of(), Map.of("discovery", "diary"));
            assertEquals(0.6, objective.getProgress(), 1e-9);

            objective.update(Map.of(), Map.of("milestone_completed", true));
            assertEquals(0.8, objective.getProgress(), 1e-9);

            objective.update(Map.of(), Map.of("milestone_completed", true));
            assertEquals(ObjectiveStatus.COMPLETED, objective.getStatus());
        }

        @Test
        @DisplayName("ignores unknown and repeated discoveries")
        void ignoresUnknownDiscoveries() {
            var objective = scene();
            objective.activate(Map.of());

            assertFalse(objective.update(Map.of(), Map.of("discovery", "nothing")));
            objective.update(Map.of(), Map.of("discovery", "diary"));
            assertFalse(objective.update(Map.of(), Map.of("discovery", "diary")));
            assertEquals(1, objective.getDiscoveriesMade().size());
        }

        @Test
        @DisplayName("tension ramps with progress and notifies listeners")
        void tensionRamps() {
            var objective = scene();
            List<Double> seen = new ArrayList<>();
            objective.addTensionListener((tension, progress) -> seen.add(tension));
            objective.activate(Map.of());

            objective.update(Map.of(), Map.of("discovery", "diary"));

            assertEquals(1 + 0.6 * 2, objective.getTensionLevel(), 1e-9);
            assertEquals(List.of(objective.getTensionLevel()), seen);
        }

        @Test
        @DisplayName("difficulty modifiers scale the milestone count but never below one")
        void milestoneScale() {
            var objective = scene();
            objective.addModifier(ObjectiveModifier.milestoneScale(0.1, "difficulty"));
            assertEquals(1, objective.getMilestoneCount());

            objective.removeModifiers("difficulty");
            objective.addModifier(ObjectiveModifier.milestoneScale(1.6, "difficulty"));
            assertEquals(3, objective.getMilestoneCount());
        }

        @Test
        @DisplayName("defaults to a twenty minute limit and short-term scope")
        void defaults() {
            var objective = scene();
            assertEquals(ObjectiveScope.SHORT_TERM, objective.getScope());
            assertEquals(Duration.ofMinutes(20), objective.getTimeLimit().orElseThrow());
        }
    }

    @Nested
    @DisplayName("MidTermObjective")
    class MidTerm {

        private MidTermObjective arc() {
            return MidTermObjective.fromParams(ObjectiveDefinition.builder("arc").build(),
                    new com.mythos.core.objective.ObjectiveParams(Map.of(
                            "investigation_branches", List.of("library", "docks"),
                            "story_beats", List.of("arrival", "discovery"),
                            "horror_revelations", List.of("the_truth"))),
                    clock);
        }

        @Test
        @DisplayName("fires one escalation when the threshold is crossed and raises it by half")
        void escalatesOnce() {
            var objective = arc();
            List<Double> escalations = new ArrayList<>();
            objective.addHorrorListener((loss, state) -> escalations.add(loss));
            objective.activate(Map.of());

            objective.update(new HashMap<>(), Map.of("san_loss", 12));
            assertEquals(15.0, objective.getSanLossThreshold(), 1e-9);

            objective.update(new HashMap<>(), Map.of("san_loss", 1));
            assertEquals(13.0, objective.getAccumulatedSanLoss(), 1e-9);

            long events = objective.getEventLog().stream()
                    .filter(e -> e.eventType().equals("horror_escalation"))
                    .count();
            assertEquals(1, events);
            assertEquals(List.of(12.0), escalations);
        }

        @Test
        @DisplayName("combines branches, beats and revelations by weight")
        void weightedProgress() {
            var objective = arc();
            objective.activate(Map.of());

            objective.update(Map.of(), Map.of("investigation_branch", "library", "advancement", 1.0));
            // branches average 0.5 at weight 0.4 over a total weight of 0.9
            assertEquals(0.5 * 0.4 / 0.9, objective.getProgress(), 1e-9);

            objective.update(Map.of(), Map.of("story_beat_completed", true, "revelation", "the_truth"));
            assertEquals((0.5 * 0.4 + 0.5 * 0.3 + 0.2) / 0.9, objective.getProgress(), 1e-9);
        }

        @Test
        @DisplayName("defaults to a two hour limit")
        void defaultLimit() {
            assertEquals(Duration.ofHours(2), arc().getTimeLimit().orElseThrow());
        }
    }

    @Nested
    @DisplayName("LongTermObjective")
    class LongTerm {

        @Test
        @DisplayName("completing a phase moves to the next one and applies its knowledge")
        void phaseCompletion() {
            var objective = new LongTermObjective(ObjectiveDefinition.builder("campaign").build(), clock)
                    .withCampaignPhases(List.of(
                            new CampaignPhase("Arrival", Map.of("deep_ones", 1), Map.of("town", "wary")),
                            CampaignPhase.named("Descent")));
            objective.activate(Map.of());

            objective.update(Map.of(), Map.of("phase_advancement", 1.0));

            assertEquals(1, objective.getCurrentPhase());
            assertEquals(0.5, objective.getProgress(), 1e-9);
            assertEquals(1, objective.getMythosKnowledgeLevels().get("deep_ones"));
            assertEquals(1, objective.getWorldStateChanges().size());
        }
    }

    @Nested
    @DisplayName("MetaObjective")
    class Meta {

        @Test
        @DisplayName("unlocks content once its criteria are met and completes when all are unlocked")
        void unlocksContent() {
            var objective = new MetaObjective(ObjectiveDefinition.builder("veteran").build(), clock)
                    .addUnlockCriteria("veteran_mode", new UnlockCriteria(2, null, null, List.of(), null));
            objective.activate(Map.of());

            objective.update(Map.of("campaign_id", "arkham"), Map.of());
            assertTrue(objective.getUnlockedContent().isEmpty());

            objective.update(Map.of("campaign_id", "innsmouth"), Map.of());
            assertEquals(java.util.Set.of("veteran_mode"), objective.getUnlockedContent());
            assertEquals(ObjectiveStatus.COMPLETED, objective.getStatus());
        }

        @Test
        @DisplayName("drops any time limit")
        void noTimeLimit() {
            var objective = new MetaObjective(ObjectiveDefinition.builder("veteran")
                    .timeLimit(Duration.ofHours(1)).build(), clock);
            assertTrue(objective.getTimeLimit().isEmpty());
        }

        @Test
        @DisplayName("the same campaign counts once")
        void campaignCountsOnce() {
            var objective = new MetaObjective(ObjectiveDefinition.builder("veteran").build(), clock);
            objective.activate(Map.of());

            objective.update(Map.of("campaign_id", "arkham"), Map.of());
            assertFalse(objective.update(Map.of("campaign_id", "arkham"), Map.of()));
            assertEquals(0.3, objective.getProgress(), 1e-9);
        }
    }
}
