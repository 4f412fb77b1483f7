package com.mythos.core.objective;

import com.mythos.core.model.ObjectiveCondition;
import com.mythos.core.model.ObjectiveConsequence;
import com.mythos.core.model.ObjectiveModifier;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.ObjectiveReward;
import com.mythos.core.model.ObjectiveStatus;
import com.mythos.core.model.ObjectiveType;
import com.mythos.core.objective.layered.ImmediateObjective;
import com.mythos.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle tests for {@link Objective}, driven through {@link ImmediateObjective}.
 */
class ObjectiveTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
    }

    private ImmediateObjective objective(ObjectiveDefinition.Builder builder, List<String> actions) {
        return new ImmediateObjective(builder.build(), clock).withRequiredActions(actions);
    }

    private ImmediateObjective simple() {
        return objective(ObjectiveDefinition.builder("open_door").title("Open the door"), List.of("open", "enter"));
    }

    @Nested
    @DisplayName("activation")
    class Activation {

        @Test
        @DisplayName("activates when every activation condition holds")
        void activatesWhenConditionsHold() {
            var objective = objective(ObjectiveDefinition.builder("cellar")
                    .activationCondition(ObjectiveCondition.location("cellar")), List.of("look"));

            assertFalse(objective.canActivate(Map.of("current_location", "attic")));
            assertTrue(objective.activate(Map.of("current_location", "cellar")));
            assertEquals(ObjectiveStatus.ACTIVE, objective.getStatus());
            assertEquals(clock.instant(), objective.getActivatedAt().orElseThrow());
            assertEquals(1, objective.getAttemptCount());
        }

        @Test
        @DisplayName("cannot activate twice")
        void cannotActivateTwice() {
            var objective = simple();
            assertTrue(objective.activate(Map.of()));
            assertFalse(objective.canActivate(Map.of()));
            assertFalse(objective.activate(Map.of()));
        }

        @Test
        @DisplayName("a throwing condition counts as false")
        void throwingConditionIsFalse() {
            var broken = new ObjectiveCondition("broken", "always throws", null,
                    (state, required, meta) -> { throw new IllegalStateException("boom"); }, Map.of());
            var objective = objective(ObjectiveDefinition.builder("x").activationCondition(broken), List.of("a"));

            assertFalse(objective.canActivate(Map.of()));
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("completes once every required action is done and logs rewards")
        void completesAfterRequiredActions() {
            var objective = objective(ObjectiveDefinition.builder("door")
                    .reward(ObjectiveReward.KNOWLEDGE_REWARD), List.of("open", "enter"));
            objective.activate(Map.of());

            assertTrue(objective.update(Map.of(), Map.of("action_type", "open")));
            assertEquals(0.5, objective.getProgress(), 1e-9);
            objective.update(Map.of(), Map.of("action_type", "enter"));

            assertEquals(ObjectiveStatus.COMPLETED, objective.getStatus());
            assertEquals(1.0, objective.getProgress());
            assertTrue(objective.getCompletedAt().isPresent());
            assertTrue(objective.getEventLog().stream().anyMatch(e -> e.eventType().equals("reward_applied")));
        }

        @Test
        @DisplayName("ignores updates while inactive")
        void ignoresUpdatesWhileInactive() {
            var objective = simple();
            assertFalse(objective.update(Map.of(), Map.of("action_type", "open")));
            assertEquals(0.0, objective.getProgress());
        }

        @Test
        @DisplayName("explicit completion conditions win over progress")
        void completionConditionsWin() {
            var objective = objective(ObjectiveDefinition.builder("escape")
                    .completionCondition(ObjectiveCondition.basic("door_open", "Door open", true)),
                    List.of("run"));
            objective.withAutoCompleteOnAction(false);
            objective.activate(Map.of());

            objective.update(Map.of("door_open", false), Map.of("action_type", "run"));
            assertEquals(ObjectiveStatus.ACTIVE, objective.getStatus());

            objective.update(Map.of("door_open", true), Map.of());
            assertEquals(ObjectiveStatus.COMPLETED, objective.getStatus());
        }
    }

    @Nested
    @DisplayName("time limits")
    class TimeLimits {

        @Test
        @DisplayName("expires exactly when the limit is reached and applies consequences")
        void expiresAtLimit() {
            var objective = objective(ObjectiveDefinition.builder("timed")
                    .timeLimit(Duration.ofMinutes(2))
                    .consequence(ObjectiveConsequence.SAN_LOSS_MINOR), List.of("a", "b"));
            objective.activate(Map.of());

            clock.advance(Duration.ofMinutes(1).plusSeconds(59));
            objective.update(Map.of(), Map.of("action_type", "a"));
            assertTrue(objective.isActive());

            clock.advance(Duration.ofSeconds(1));
            assertTrue(objective.update(Map.of(), Map.of("action_type", "b")));
            assertEquals(ObjectiveStatus.EXPIRED, objective.getStatus());
            assertEquals(0.5, objective.getProgress(), 1e-9);
            assertTrue(objective.getEventLog().stream().anyMatch(e -> e.eventType().equals("consequence_applied")));
        }

        @Test
        @DisplayName("immediate objectives default to five minutes")
        void immediateDefaultLimit() {
            assertEquals(Duration.ofMinutes(5), simple().getTimeLimit().orElseThrow());
        }

        @Test
        @DisplayName("time limit modifiers shorten and scale the base limit")
        void timeLimitModifiers() {
            var objective = objective(ObjectiveDefinition.builder("timed").timeLimit(Duration.ofMinutes(10)), List.of("a"));
            objective.addModifier(ObjectiveModifier.timeLimitReduction(4, "madness"));
            objective.addModifier(ObjectiveModifier.timeLimitScale(0.5, "difficulty"));

            assertEquals(Duration.ofMinutes(3), objective.getTimeLimit().orElseThrow());

            objective.removeModifiers("madness");
            assertEquals(Duration.ofMinutes(5), objective.getTimeLimit().orElseThrow());
        }
    }

    @Nested
    @DisplayName("terminal monotonicity")
    class Terminal {

        @Test
        @DisplayName("no transition leaves a terminal state")
        void terminalIsFinal() {
            var objective = simple();
            objective.activate(Map.of());
            assertTrue(objective.fail(Map.of(), "caught"));

            assertFalse(objective.complete(Map.of()));
            assertFalse(objective.abandon("later"));
            assertFalse(objective.resume());
            assertFalse(objective.suspend());
            assertFalse(objective.update(Map.of(), Map.of("action_type", "open")));
            assertEquals(ObjectiveStatus.FAILED, objective.getStatus());
            assertEquals(0.0, objective.getProgress());
        }

        @Test
        @DisplayName("modifiers are refused once terminal")
        void modifiersRefusedWhenTerminal() {
            var objective = simple();
            objective.abandon("bored");

            assertFalse(objective.addModifier(ObjectiveModifier.priorityShift(1, "test")));
            assertEquals(ObjectivePriority.MEDIUM, objective.getPriority());
        }
    }

    @Nested
    @DisplayName("suspension")
    class Suspension {

        @Test
        @DisplayName("suspended objectives do not progress until resumed")
        void suspendAndResume() {
            var objective = simple();
            objective.activate(Map.of());
            assertTrue(objective.suspend());

            assertFalse(objective.update(Map.of(), Map.of("action_type", "open")));
            assertEquals(0.0, objective.getProgress());

            assertTrue(objective.resume());
            objective.update(Map.of(), Map.of("action_type", "open"));
            assertEquals(0.5, objective.getProgress(), 1e-9);
        }

        @Test
        @DisplayName("in-progress objectives can be suspended too")
        void suspendInProgress() {
            var objective = simple();
            objective.activate(Map.of());
            assertTrue(objective.startProgress());
            assertEquals(ObjectiveStatus.IN_PROGRESS, objective.getStatus());
            assertTrue(objective.suspend());
        }
    }

    @Test
    @DisplayName("priority shifts are clamped to the scale")
    void priorityShiftClamped() {
        var objective = objective(ObjectiveDefinition.builder("p").priority(ObjectivePriority.CRITICAL), List.of("a"));
        objective.addModifier(ObjectiveModifier.priorityShift(3, "test"));
        assertEquals(ObjectivePriority.COSMIC, objective.getPriority());
    }

    @Test
    @DisplayName("definition defaults are applied")
    void definitionDefaults() {
        var definition = ObjectiveDefinition.builder("d").build();
        assertEquals("d", definition.title());
        assertEquals(ObjectiveType.EXPLORATION, definition.objectiveType());
        assertEquals(ObjectivePriority.MEDIUM, definition.priority());
        assertThrows(IllegalArgumentException.class, () -> ObjectiveDefinition.builder(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> ObjectiveDefinition.builder("bad").timeLimit(Duration.ZERO).build());
    }
}
