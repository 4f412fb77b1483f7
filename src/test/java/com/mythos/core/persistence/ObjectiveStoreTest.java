package com.mythos.core.persistence;

import com.mythos.core.catalog.ObjectiveCatalog;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveStatus;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveDocument;
import com.mythos.core.objective.ObjectiveParams;
import com.mythos.core.objective.layered.ShortTermObjective;
import com.mythos.core.objective.sanity.CosmicInsightObjective;
import com.mythos.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ObjectiveStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ObjectiveCatalog catalog;
    private ObjectiveStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T19:30:00Z");
        catalog = new ObjectiveCatalog(clock);
        store = new ObjectiveStore();
    }

    private ShortTermObjective activeInvestigation() {
        ShortTermObjective objective = catalog.investigation("study", "Search the Study", "study",
                List.of("ledger", "key"), Map.of());
        Map<String, Object> state = new HashMap<>();
        state.put("sanity", 70);
        state.put("current_location", "study");
        objective.activate(state);
        clock.advance(Duration.ofMinutes(3));
        objective.update(state, Map.of("discovery", "ledger"));
        return objective;
    }

    @Test
    void snapshotSurvivesAFileRoundTrip() {
        ShortTermObjective original = activeInvestigation();
        Path file = tempDir.resolve("saves/objectives.json");
        ManagerSnapshot snapshot = new ManagerSnapshot(List.of(original.toDocument()),
                Map.of("objectives_created", 1L), clock.instant(), clock.instant());

        assertTrue(store.save(file, snapshot));
        ManagerSnapshot loaded = store.load(file).orElseThrow();

        assertEquals(1, loaded.objectives().size());
        assertEquals(1L, loaded.statistics().get("objectives_created"));
        assertEquals(clock.instant(), loaded.savedAt());

        Objective restored = ObjectiveDocuments.restore(loaded.objectives().get(0), clock);
        assertInstanceOf(ShortTermObjective.class, restored);
        assertEquals("study", restored.getObjectiveId());
        assertEquals(original.getUuid(), restored.getUuid());
        assertEquals(ObjectiveStatus.ACTIVE, restored.getStatus());
        assertEquals(original.getProgress(), restored.getProgress(), 1e-9);
        assertEquals(original.getActivatedAt(), restored.getActivatedAt());
        assertEquals(original.getTimeLimit(), restored.getTimeLimit());
    }

    @Test
    void savedFileUsesSnakeCaseFields() throws Exception {
        Path file = tempDir.resolve("objectives.json");
        store.save(file, new ManagerSnapshot(List.of(activeInvestigation().toDocument()), Map.of(), null, clock.instant()));

        String json = Files.readString(file);
        assertTrue(json.contains("\"objective_id\""));
        assertTrue(json.contains("\"short_term\""));
        assertTrue(json.contains("\"saved_at\""));
    }

    @Test
    void missingFileLoadsNothing() {
        assertTrue(store.load(tempDir.resolve("absent.json")).isEmpty());
    }

    @Test
    void malformedFileLoadsNothing() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"objectives\": [");

        assertTrue(store.load(file).isEmpty());
    }

    @Test
    void documentWithoutIdIsRejected() {
        ObjectiveDocument document = new ObjectiveDocument(null, "u-1", "Nameless", null, null,
                ObjectiveScope.SHORT_TERM, null, ObjectiveStatus.INACTIVE, 0.0, clock.instant(), null, null,
                null, null, List.of(), Map.of(), 0, List.of());

        assertThrows(IllegalArgumentException.class, () -> ObjectiveDocuments.restore(document, clock));
    }

    @Test
    void scopeSelectsTheRestoredVariant() {
        ObjectiveDocument document = new ObjectiveDocument("ritual", "u-2", "Stop the Ritual", null, null,
                ObjectiveScope.META, null, ObjectiveStatus.INACTIVE, 0.0, clock.instant(), null, null,
                null, null, List.of(), Map.of(), 0, List.of());

        Objective restored = ObjectiveDocuments.restore(document, clock);

        assertEquals(ObjectiveScope.META, restored.getScope());
        assertTrue(restored.getTimeLimit().isEmpty());
    }

    private Objective reloaded(Objective original) {
        Path file = tempDir.resolve("reload.json");
        assertTrue(store.save(file, new ManagerSnapshot(List.of(original.toDocument()), Map.of(), null, clock.instant())));
        return ObjectiveDocuments.restore(store.load(file).orElseThrow().objectives().get(0), clock);
    }

    @Test
    void restoredInvestigationKeepsItsDiscoveries() {
        ShortTermObjective original = activeInvestigation();

        ShortTermObjective restored = assertInstanceOf(ShortTermObjective.class, reloaded(original));
        assertEquals(Set.of("ledger"), restored.getDiscoveriesMade());
        assertEquals(original.getMilestoneCount(), restored.getMilestoneCount());
        assertFalse(restored.toDocument().metadata().isEmpty());

        Map<String, Object> state = new HashMap<>();
        state.put("sanity", 70);
        assertTrue(restored.update(state, Map.of("discovery", "key")));
        assertEquals(Set.of("ledger", "key"), restored.getDiscoveriesMade());
        assertTrue(restored.getProgress() > original.getProgress());
    }

    @Test
    void restoredSanityVariantKeepsItsInsightAndSanLoss() {
        ObjectiveDefinition definition = ObjectiveDefinition.builder("tome")
                .title("Read the Forbidden Tome")
                .scope(ObjectiveScope.SHORT_TERM)
                .build();
        CosmicInsightObjective original = CosmicInsightObjective.fromParams(definition, new ObjectiveParams(Map.of(
                "sanity_cost_per_insight", 2,
                "revelation_thresholds", List.of(0.25, 0.5),
                "madness_effects", List.of(Map.of("madness_type", "paranoia", "severity", 3)))), clock);
        Map<String, Object> state = new HashMap<>();
        state.put("sanity", 70);
        original.activate(state);
        original.update(state, Map.of("cosmic_revelation", "the stars are wrong", "insight_value", 0.3));
        assertEquals(1, original.getCurrentInsightLevel());
        assertEquals(6, original.getCumulativeSanLoss());

        Objective restored = reloaded(original);

        CosmicInsightObjective tome = assertInstanceOf(CosmicInsightObjective.class, restored);
        assertEquals(1, tome.getCurrentInsightLevel());
        assertEquals(6, tome.getCumulativeSanLoss());
        assertEquals(1, tome.getSanityEvents().size());
        assertFalse(tome.getDefinition().metadata().containsKey(Objective.VARIANT_STATE_KEY));

        tome.update(state, Map.of("cosmic_revelation", "the sleeper stirs", "insight_value", 0.3));
        assertEquals(2, tome.getCurrentInsightLevel());
        assertEquals(12, tome.getCumulativeSanLoss());
        assertEquals(0.6, tome.getProgress(), 1e-9);
    }

    @Test
    void unknownVariantFallsBackToScope() {
        ObjectiveDocument document = new ObjectiveDocument("lamp", "u-3", "Light the Lamp", null, null,
                ObjectiveScope.IMMEDIATE, null, ObjectiveStatus.INACTIVE, 0.0, clock.instant(), null, null,
                null, null, List.of(), Map.of(Objective.VARIANT_TYPE_KEY, "RetiredObjective", "room", "attic"), 0,
                List.of());

        Objective restored = ObjectiveDocuments.restore(document, clock);

        assertEquals(ObjectiveScope.IMMEDIATE, restored.getScope());
        assertEquals(Map.of("room", "attic"), restored.getDefinition().metadata());
    }
}
