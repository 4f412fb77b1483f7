package com.mythos.core.catalog;

import com.mythos.core.manager.ObjectiveManagerException;
import com.mythos.core.manager.ObjectiveRegistry;
import com.mythos.core.manager.ObjectiveTemplate;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveType;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.layered.ImmediateObjective;
import com.mythos.core.objective.layered.ShortTermObjective;
import com.mythos.core.objective.sanity.CosmicInsightObjective;
import com.mythos.core.objective.sanity.MadnessObjective;
import com.mythos.core.objective.sanity.MadnessType;
import com.mythos.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ObjectiveCatalogTest {

    private MutableClock clock;
    private ObjectiveCatalog catalog;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T20:00:00Z");
        catalog = new ObjectiveCatalog(clock);
    }

    @Nested
    @DisplayName("default registry")
    class DefaultRegistry {

        @Test
        @DisplayName("registers every built-in type and template")
        void registersBuiltIns() {
            ObjectiveRegistry registry = ObjectiveCatalog.defaultRegistry();

            assertEquals(Set.of(ObjectiveTypes.IMMEDIATE, ObjectiveTypes.SHORT_TERM, ObjectiveTypes.MID_TERM,
                    ObjectiveTypes.LONG_TERM, ObjectiveTypes.META, ObjectiveTypes.SANITY_DEPENDENT,
                    ObjectiveTypes.COSMIC_INSIGHT, ObjectiveTypes.MADNESS), registry.getTypeNames());
            assertEquals(Set.of("library_investigation", "basement_exploration", "npc_interview",
                    "cult_investigation", "survival_horror"), registry.getTemplateNames());
        }

        @Test
        @DisplayName("templates must refer to a registered type")
        void templateNeedsKnownType() {
            ObjectiveRegistry registry = new ObjectiveRegistry();

            assertThrows(ObjectiveManagerException.class,
                    () -> registry.registerTemplate(new ObjectiveTemplate("ghost", "GhostObjective", Map.of())));
        }

        @Test
        @DisplayName("construction errors are wrapped")
        void wrapsConstructionErrors() {
            ObjectiveRegistry registry = ObjectiveCatalog.defaultRegistry();

            ObjectiveManagerException e = assertThrows(ObjectiveManagerException.class,
                    () -> registry.create(ObjectiveTypes.IMMEDIATE, "bad", Map.of("priority", "unthinkable"), clock));
            assertTrue(e.getMessage().contains("bad"));
        }

        @Test
        @DisplayName("the survival template is critical with its own time limit")
        void survivalTemplate() {
            ObjectiveRegistry registry = ObjectiveCatalog.defaultRegistry();
            ObjectiveTemplate template = registry.getTemplate("survival_horror");

            Objective objective = registry.create(template.typeName(), "encounter", template.attributes(), clock);

            assertEquals(ObjectivePriority.CRITICAL, objective.getPriority());
            assertEquals(Duration.ofMinutes(8), objective.getTimeLimit().orElseThrow());
            assertEquals(ObjectiveType.SURVIVAL, objective.getObjectiveType());
        }
    }

    @Nested
    @DisplayName("helpers")
    class Helpers {

        @Test
        @DisplayName("investigation activates only at its location")
        void investigation() {
            ShortTermObjective objective = catalog.investigation("library", "Search the Library", "library",
                    List.of("ancient_book"), null);

            assertEquals(ObjectiveScope.SHORT_TERM, objective.getScope());
            assertEquals(Duration.ofMinutes(15), objective.getTimeLimit().orElseThrow());
            assertFalse(objective.canActivate(Map.of("current_location", "street")));
            assertTrue(objective.canActivate(Map.of("current_location", "library")));
        }

        @Test
        @DisplayName("social falls back to default conversation goals")
        void socialDefaults() {
            ImmediateObjective objective = catalog.social("talk", "Talk to the Librarian", "Mrs. Whateley",
                    null, null);

            assertEquals(Set.of("initiate_conversation", "ask_questions", "conclude_conversation"),
                    objective.getRequiredActions());
            assertEquals(ObjectiveType.SOCIAL, objective.getObjectiveType());
            assertEquals("Mrs. Whateley", objective.getDefinition().metadata().get("npc_name"));
        }

        @Test
        @DisplayName("extra attributes override helper defaults")
        void extraOverridesDefaults() {
            ShortTermObjective objective = catalog.survival("flee", "Flee the Shoggoth", "the shoggoth",
                    Map.of("priority", ObjectivePriority.COSMIC, "time_limit", Duration.ofMinutes(3)));

            assertEquals(ObjectivePriority.COSMIC, objective.getPriority());
            assertEquals(Duration.ofMinutes(3), objective.getTimeLimit().orElseThrow());
        }

        @Test
        @DisplayName("sanity helpers build sanity-integrated objectives")
        void sanityHelpers() {
            CosmicInsightObjective insight = catalog.forbiddenKnowledge("truth", "The Truth", "the Outer Gods",
                    List.of(Map.of("name", "glimpse")), null);
            MadnessObjective madness = catalog.madnessDriven("ritual", "Complete the Pattern",
                    List.of(MadnessType.OBSESSION), null);

            assertEquals(ObjectiveScope.MID_TERM, insight.getScope());
            assertEquals(4, insight.getSanRiskLevel());
            assertEquals(Set.of(MadnessType.OBSESSION), madness.getRequiredMadnessTypes());
            assertTrue(madness.getPriority().isAtLeast(ObjectivePriority.HIGH));
        }
    }
}
