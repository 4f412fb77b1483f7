package com.mythos.core.manager;

import com.mythos.core.events.EventBus;
import com.mythos.core.events.MythosEvent;
import com.mythos.core.logging.MdcContext;
import com.mythos.core.metrics.MythosMetrics;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveStatus;
import com.mythos.core.model.ObjectiveSuggestion;
import com.mythos.core.model.ObjectiveType;
import com.mythos.core.model.UpdateReport;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDocument;
import com.mythos.core.persistence.ManagerSnapshot;
import com.mythos.core.persistence.ObjectiveDocuments;
import com.mythos.core.persistence.ObjectiveStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns every objective of a session and drives them once per turn.
 * <p>
 * A turn runs in a fixed order: eligible objectives are activated under the capacity caps,
 * every active objective is updated, terminal transitions are reported and published, and
 * terminal objectives past the retention window are evicted. A failing objective update
 * force-fails that objective only; the rest of the turn carries on.
 * <p>
 * Not thread-safe. Event subscribers must not call back into mutating methods.
 */
@Service
public class ObjectiveManager {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveManager.class);

    public static final String STAT_CREATED = "objectives_created";
    public static final String STAT_COMPLETED = "objectives_completed";
    public static final String STAT_FAILED = "objectives_failed";
    public static final String STAT_EXPIRED = "objectives_expired";
    public static final String STAT_PROGRESS_UPDATES = "total_progress_updates";

    private static final Comparator<Objective> BY_PRIORITY_DESC =
            Comparator.comparingInt((Objective o) -> o.getPriority().level()).reversed();

    private final ObjectiveProperties properties;
    private final ObjectiveRegistry registry;
    private final EventBus eventBus;
    private final MythosMetrics metrics;
    private final Clock clock;
    private final ObjectiveStore store;
    private final List<SuggestionSource> suggestionSources = new CopyOnWriteArrayList<>();

    private final ObjectiveIndex index = new ObjectiveIndex();
    private final Map<String, Long> statistics = new LinkedHashMap<>();
    private final Deque<MythosEvent> recentEvents = new ArrayDeque<>();

    private long turn;
    private Instant lastUpdate;

    public ObjectiveManager(ObjectiveProperties properties, ObjectiveRegistry registry,
                            EventBus eventBus, MythosMetrics metrics, Clock clock) {
        this.properties = properties;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.store = new ObjectiveStore();
        resetStatistics();
    }

    @Autowired
    public ObjectiveManager(ObjectiveProperties properties, ObjectiveRegistry registry,
                            EventBus eventBus, MythosMetrics metrics, Clock clock,
                            ObjectProvider<SuggestionSource> suggestionSources) {
        this(properties, registry, eventBus, metrics, clock);
        suggestionSources.orderedStream().forEach(this.suggestionSources::add);
    }

    // -- Registration ---------------------------------------------------------

    public void registerObjectiveType(String typeName, ObjectiveFactory factory) {
        registry.registerType(typeName, factory);
    }

    public void registerTemplate(ObjectiveTemplate template) {
        registry.registerTemplate(template);
    }

    public void registerSuggestionSource(SuggestionSource source) {
        suggestionSources.add(source);
    }

    public ObjectiveRegistry getRegistry() {
        return registry;
    }

    // -- Creation -------------------------------------------------------------

    /**
     * Creates an objective of a registered type and adds it to the manager.
     *
     * @throws ObjectiveManagerException for a duplicate id, an unknown type or a failed construction
     */
    public Objective createObjective(String typeName, String objectiveId, Map<String, ?> attributes) {
        requireUnused(objectiveId);
        Objective objective = registry.create(typeName, objectiveId, attributes == null ? Map.of() : attributes, clock);
        addObjective(objective);
        return objective;
    }

    /**
     * Creates an objective from a registered template; {@code overrides} win over template attributes.
     */
    public Objective createFromTemplate(String templateName, String objectiveId, Map<String, ?> overrides) {
        ObjectiveTemplate template = registry.getTemplate(templateName);
        Map<String, Object> attributes = new LinkedHashMap<>(template.attributes());
        if (overrides != null) {
            attributes.putAll(overrides);
        }
        return createObjective(template.typeName(), objectiveId, attributes);
    }

    public void addObjective(Objective objective) {
        requireUnused(objective.getObjectiveId());
        index.add(objective);
        increment(STAT_CREATED);
        log.info("Added objective {} ({}, {})", objective.getObjectiveId(),
                objective.getScope().value(), objective.getObjectiveType().value());
        emit("objective_created", objective, Map.of());
    }

    public boolean removeObjective(String objectiveId) {
        Optional<Objective> removed = index.remove(objectiveId);
        removed.ifPresent(o -> {
            log.info("Removed objective {}", objectiveId);
            emit("objective_removed", o, Map.of());
        });
        return removed.isPresent();
    }

    private void requireUnused(String objectiveId) {
        if (index.contains(objectiveId)) {
            throw new ObjectiveManagerException("Objective already exists: " + objectiveId);
        }
    }

    // -- Queries --------------------------------------------------------------

    public Optional<Objective> getObjective(String objectiveId) {
        return index.get(objectiveId);
    }

    public List<Objective> getAllObjectives() {
        return index.all();
    }

    public List<Objective> getObjectivesByStatus(ObjectiveStatus status) {
        return index.all().stream().filter(o -> o.getStatus() == status).toList();
    }

    public List<Objective> getObjectivesByType(ObjectiveType type) {
        return index.ofType(type);
    }

    public List<Objective> getObjectivesByScope(ObjectiveScope scope) {
        return index.ofScope(scope);
    }

    public List<Objective> getObjectivesByPriority(ObjectivePriority priority) {
        return index.all().stream().filter(o -> o.getPriority() == priority).toList();
    }

    public List<Objective> getActiveObjectives() {
        return index.all().stream().filter(Objective::isActive).toList();
    }

    /** Active objectives, highest effective priority first, insertion order within a priority. */
    public List<Objective> getActiveObjectivesByPriority() {
        return getActiveObjectives().stream().sorted(BY_PRIORITY_DESC).toList();
    }

    public List<Objective> getCompletedObjectives() {
        return getObjectivesByStatus(ObjectiveStatus.COMPLETED);
    }

    /** Objectives that ended without success: failed, expired or abandoned. */
    public List<Objective> getFailedObjectives() {
        return index.all().stream().filter(o -> o.getStatus().isFailure()).toList();
    }

    public List<Objective> getAvailableObjectives(Map<String, Object> gameState) {
        return index.all().stream().filter(o -> safeCanActivate(o, gameState)).toList();
    }

    public List<Objective> getChildren(String objectiveId) {
        return index.children(objectiveId);
    }

    public Optional<Objective> getParent(String objectiveId) {
        return index.parent(objectiveId);
    }

    public int size() {
        return index.size();
    }

    // -- Explicit lifecycle ---------------------------------------------------

    public boolean startProgress(String objectiveId) {
        return index.get(objectiveId).map(Objective::startProgress).orElse(false);
    }

    public boolean suspendObjective(String objectiveId) {
        return index.get(objectiveId)
                .filter(Objective::suspend)
                .map(o -> {
                    emit("objective_suspended", o, Map.of());
                    return true;
                })
                .orElse(false);
    }

    /**
     * Resumes a suspended objective. Resuming is an admission like activation: it is refused
     * while the total or scope cap is full.
     */
    public boolean resumeObjective(String objectiveId) {
        Optional<Objective> found = index.get(objectiveId);
        if (found.isEmpty() || found.get().getStatus() != ObjectiveStatus.SUSPENDED) {
            return false;
        }
        Objective objective = found.get();
        List<Objective> active = getActiveObjectives();
        long scopeCount = active.stream().filter(o -> o.getScope() == objective.getScope()).count();
        String cap = capacityExceeded(active.size(), objective.getScope(), (int) scopeCount);
        if (cap != null) {
            log.info("Refused to resume objective {}: {} cap reached", objectiveId, cap);
            metrics.recordAdmissionDeferral(cap);
            return false;
        }
        if (!objective.resume()) {
            return false;
        }
        emit("objective_resumed", objective, Map.of());
        return true;
    }

    public boolean abandonObjective(String objectiveId, String reason) {
        Optional<Objective> objective = index.get(objectiveId);
        if (objective.isEmpty() || !objective.get().abandon(reason)) {
            return false;
        }
        increment(STAT_FAILED);
        metrics.recordOutcome(ObjectiveStatus.ABANDONED.value());
        emit("objective_failed", objective.get(), payload(ObjectiveStatus.ABANDONED, reason));
        return true;
    }

    public boolean failObjective(String objectiveId, Map<String, Object> gameState, String reason) {
        Optional<Objective> objective = index.get(objectiveId);
        if (objective.isEmpty() || !objective.get().fail(gameState, reason)) {
            return false;
        }
        increment(STAT_FAILED);
        metrics.recordOutcome(ObjectiveStatus.FAILED.value());
        emit("objective_failed", objective.get(), payload(ObjectiveStatus.FAILED, reason));
        return true;
    }

    // -- Turn -----------------------------------------------------------------

    /**
     * Runs one turn: admission, progress, terminal bookkeeping, retention.
     *
     * @param gameState current game state snapshot
     * @param action    the action taken this turn, may be {@code null}
     * @return ids of the objectives touched this turn
     */
    public UpdateReport updateAllObjectives(Map<String, Object> gameState, Map<String, Object> action) {
        long start = System.currentTimeMillis();
        turn++;
        MdcContext.setTurn(turn);
        try {
            List<String> activated = activateEligible(gameState);
            List<String> updated = new ArrayList<>();
            List<String> completed = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            List<String> expired = new ArrayList<>();

            for (Objective objective : getActiveObjectives()) {
                String id = objective.getObjectiveId();
                MdcContext.setObjective(id);
                try {
                    ObjectiveStatus before = objective.getStatus();
                    boolean changed = updateSafely(objective, gameState, action);
                    if (changed) {
                        increment(STAT_PROGRESS_UPDATES);
                    }
                    ObjectiveStatus after = objective.getStatus();
                    if (after == before || !after.isTerminal()) {
                        if (changed) {
                            updated.add(id);
                        }
                        continue;
                    }
                    switch (after) {
                        case COMPLETED -> {
                            completed.add(id);
                            increment(STAT_COMPLETED);
                            emit("objective_completed", objective, payload(after, null));
                        }
                        case EXPIRED -> {
                            expired.add(id);
                            increment(STAT_EXPIRED);
                            emit("objective_failed", objective, payload(after, "Time limit exceeded"));
                        }
                        default -> {
                            failed.add(id);
                            increment(STAT_FAILED);
                            emit("objective_failed", objective, payload(after, null));
                        }
                    }
                    metrics.recordOutcome(after.value());
                    log.info("Objective {} finished as {} (progress {})", id, after.value(),
                            String.format("%.2f", objective.getProgress()));
                } finally {
                    MdcContext.clearObjective();
                }
            }

            if (properties.isAutoCleanupCompleted()) {
                cleanupOldObjectives();
            }
            lastUpdate = clock.instant();

            UpdateReport report = new UpdateReport(activated, updated, completed, failed, expired);
            if (!report.isEmpty()) {
                log.debug("Turn {} report: {}", turn, report);
            }
            return report;
        } finally {
            metrics.recordTurnDuration(System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    private boolean updateSafely(Objective objective, Map<String, Object> gameState, Map<String, Object> action) {
        try {
            return objective.update(gameState, action);
        } catch (RuntimeException e) {
            log.error("Update of objective {} failed: {}", objective.getObjectiveId(), e.getMessage(), e);
            metrics.recordForcedFailure();
            objective.fail(gameState, "Update error: " + e.getMessage());
            return true;
        }
    }

    private List<String> activateEligible(Map<String, Object> gameState) {
        List<Objective> candidates = index.all().stream()
                .filter(o -> o.getStatus() == ObjectiveStatus.INACTIVE)
                .filter(o -> safeCanActivate(o, gameState))
                .sorted(BY_PRIORITY_DESC)
                .toList();
        if (candidates.isEmpty()) {
            return List.of();
        }

        int activeCount = 0;
        Map<ObjectiveScope, Integer> scopeCounts = new EnumMap<>(ObjectiveScope.class);
        for (Objective objective : getActiveObjectives()) {
            activeCount++;
            scopeCounts.merge(objective.getScope(), 1, Integer::sum);
        }

        List<String> activated = new ArrayList<>();
        for (Objective candidate : candidates) {
            ObjectiveScope scope = candidate.getScope();
            String cap = capacityExceeded(activeCount, scope, scopeCounts.getOrDefault(scope, 0));
            if (cap != null) {
                log.debug("Deferred activation of {}: {} cap reached", candidate.getObjectiveId(), cap);
                metrics.recordAdmissionDeferral(cap);
                continue;
            }
            if (candidate.activate(gameState)) {
                activeCount++;
                scopeCounts.merge(scope, 1, Integer::sum);
                activated.add(candidate.getObjectiveId());
                metrics.recordActivation(scope.value());
                log.info("Activated objective {} ({})", candidate.getObjectiveId(), candidate.getTitle());
                emit("objective_activated", candidate, Map.of("priority", candidate.getPriority().level()));
            }
        }
        return activated;
    }

    private String capacityExceeded(int activeCount, ObjectiveScope scope, int scopeCount) {
        if (activeCount >= properties.getMaxActiveObjectives()) {
            return "total";
        }
        if (scope == ObjectiveScope.IMMEDIATE && scopeCount >= properties.getMaxImmediateObjectives()) {
            return "immediate";
        }
        if (scope == ObjectiveScope.SHORT_TERM && scopeCount >= properties.getMaxShortTermObjectives()) {
            return "short_term";
        }
        return null;
    }

    private boolean safeCanActivate(Objective objective, Map<String, Object> gameState) {
        try {
            return objective.canActivate(gameState);
        } catch (RuntimeException e) {
            log.warn("Activation check of objective {} failed: {}", objective.getObjectiveId(), e.getMessage());
            return false;
        }
    }

    /**
     * Evicts terminal objectives whose terminal timestamp is older than the retention window.
     * Completed objectives are aged by completion time, the others by their last update.
     *
     * @return number of evicted objectives
     */
    public int cleanupOldObjectives() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getAutoCleanupAfterHours()));
        List<String> evict = new ArrayList<>();
        for (Objective objective : index.all()) {
            if (!objective.isTerminal()) {
                continue;
            }
            Instant endedAt = objective.getStatus() == ObjectiveStatus.COMPLETED
                    ? objective.getCompletedAt().orElse(objective.getLastUpdate())
                    : objective.getLastUpdate();
            if (endedAt.isBefore(cutoff)) {
                evict.add(objective.getObjectiveId());
            }
        }
        evict.forEach(index::remove);
        if (!evict.isEmpty()) {
            log.info("Evicted {} finished objectives older than {}h", evict.size(),
                    properties.getAutoCleanupAfterHours());
            metrics.recordRetentionEvictions(evict.size());
        }
        return evict.size();
    }

    // -- Suggestions ----------------------------------------------------------

    /**
     * Collects suggestions from every registered source. A failing source is skipped.
     */
    public List<ObjectiveSuggestion> suggestNewObjectives(Map<String, Object> gameState) {
        List<Objective> active = getActiveObjectives();
        List<ObjectiveSuggestion> suggestions = new ArrayList<>();
        for (SuggestionSource source : suggestionSources) {
            try {
                suggestions.addAll(source.suggest(gameState, active));
            } catch (RuntimeException e) {
                log.warn("Suggestion source {} failed: {}", source.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        return suggestions;
    }

    // -- Events ---------------------------------------------------------------

    public List<MythosEvent> getRecentEvents() {
        return List.copyOf(recentEvents);
    }

    private void emit(String eventType, Objective objective, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", objective.getTitle());
        payload.put("scope", objective.getScope().value());
        payload.put("objective_type", objective.getObjectiveType().value());
        payload.put("progress", objective.getProgress());
        payload.putAll(extra);
        MythosEvent event = new MythosEvent(eventType, objective.getObjectiveId(), payload, clock.instant());
        recentEvents.addLast(event);
        while (recentEvents.size() > properties.getRecentEventLimit()) {
            recentEvents.removeFirst();
        }
        eventBus.publish(event);
    }

    private static Map<String, Object> payload(ObjectiveStatus status, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status.value());
        if (reason != null) {
            payload.put("reason", reason);
        }
        return payload;
    }

    // -- Statistics & views ---------------------------------------------------

    public Map<String, Long> getStatistics() {
        return Map.copyOf(statistics);
    }

    public Optional<Instant> getLastUpdate() {
        return Optional.ofNullable(lastUpdate);
    }

    public long getTurn() {
        return turn;
    }

    public Map<String, Object> getDisplaySummary() {
        Map<String, Long> byScope = new LinkedHashMap<>();
        for (ObjectiveScope scope : ObjectiveScope.values()) {
            byScope.put(scope.value(), getActiveObjectives().stream().filter(o -> o.getScope() == scope).count());
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_objectives", index.size());
        summary.put("active_count", getActiveObjectives().size());
        summary.put("completed_count", getCompletedObjectives().size());
        summary.put("failed_count", getFailedObjectives().size());
        summary.put("active_by_scope", byScope);
        summary.put("active_objectives", getActiveObjectivesByPriority().stream().map(Objective::getDisplayInfo).toList());
        summary.put("statistics", getStatistics());
        summary.put("last_update", lastUpdate);
        return summary;
    }

    private void increment(String key) {
        statistics.merge(key, 1L, Long::sum);
    }

    private void resetStatistics() {
        statistics.clear();
        for (String key : List.of(STAT_CREATED, STAT_COMPLETED, STAT_FAILED, STAT_EXPIRED, STAT_PROGRESS_UPDATES)) {
            statistics.put(key, 0L);
        }
    }

    public void reset() {
        index.clear();
        recentEvents.clear();
        resetStatistics();
        turn = 0;
        lastUpdate = null;
        log.info("Objective manager reset");
    }

    // -- Persistence ----------------------------------------------------------

    public boolean saveToFile(Path path) {
        List<ObjectiveDocument> documents = index.all().stream().map(Objective::toDocument).toList();
        return store.save(path, new ManagerSnapshot(documents, statistics, lastUpdate, clock.instant()));
    }

    /**
     * Replaces the current objectives with the ones saved at {@code path}. On any failure the
     * current state is left untouched and {@code false} is returned.
     */
    public boolean loadFromFile(Path path) {
        Optional<ManagerSnapshot> snapshot = store.load(path);
        if (snapshot.isEmpty()) {
            return false;
        }
        List<Objective> restored = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        try {
            for (ObjectiveDocument document : snapshot.get().objectives()) {
                if (!seen.add(document.objectiveId())) {
                    log.warn("Skipping duplicate objective {} in {}", document.objectiveId(), path);
                    continue;
                }
                restored.add(ObjectiveDocuments.restore(document, clock));
            }
        } catch (RuntimeException e) {
            log.error("Failed to restore objectives from {}: {}", path, e.getMessage(), e);
            return false;
        }

        index.clear();
        restored.forEach(index::add);
        resetStatistics();
        statistics.putAll(snapshot.get().statistics());
        lastUpdate = snapshot.get().lastUpdate();
        log.info("Loaded {} objectives from {}", restored.size(), path);
        return true;
    }
}
