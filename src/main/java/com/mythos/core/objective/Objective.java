package com.mythos.core.objective;

import com.mythos.core.model.ObjectiveCondition;
import com.mythos.core.model.ObjectiveConsequence;
import com.mythos.core.model.ObjectiveModifier;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.ObjectiveReward;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveStatus;
import com.mythos.core.model.ObjectiveType;
import com.mythos.core.model.StateValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Base class of every objective: an immutable {@link ObjectiveDefinition}, a modifier
 * stack applied at read time, and the lifecycle state machine
 * INACTIVE &rarr; ACTIVE &rarr; IN_PROGRESS &rarr; {COMPLETED, FAILED, EXPIRED, ABANDONED},
 * with ACTIVE/IN_PROGRESS &harr; SUSPENDED.
 * <p>
 * Progress stays within [0, 1]. Once terminal, status, progress and modifiers are frozen;
 * only the bounded event log may still grow. Time limits run from {@code activatedAt}.
 * <p>
 * Subclasses implement {@link #updateProgress(Map, Map)} with their scope's algorithm.
 * Instances are not thread-safe; the manager drives them from a single writer.
 */
public abstract class Objective {

    public static final int EVENT_LOG_LIMIT = 50;
    public static final int SERIALIZED_EVENT_LIMIT = 10;

    /** Metadata key holding the concrete variant name in saved documents. */
    public static final String VARIANT_TYPE_KEY = "variant_type";
    /** Metadata key holding variant configuration and tracking in saved documents. */
    public static final String VARIANT_STATE_KEY = "variant_state";

    private static final Logger log = LoggerFactory.getLogger(Objective.class);
    private static final Duration MINIMUM_MODIFIED_TIME_LIMIT = Duration.ofMinutes(1);

    private final ObjectiveDefinition definition;
    protected final Clock clock;

    private String uuid = UUID.randomUUID().toString();
    private ObjectiveStatus status = ObjectiveStatus.INACTIVE;
    private double progress;
    private Instant createdAt;
    private Instant activatedAt;
    private Instant completedAt;
    private Instant lastUpdate;
    private int attemptCount;

    private final List<ObjectiveModifier> modifiers = new ArrayList<>();
    private final Deque<ObjectiveLogEntry> eventLog = new ArrayDeque<>();

    protected Objective(ObjectiveDefinition definition, Clock clock) {
        this.definition = definition;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastUpdate = createdAt;
    }

    // -- Scope algorithm ------------------------------------------------------

    /**
     * Advances scope-specific progress for one turn.
     *
     * @param gameState snapshot owned by the game loop (may be mutated by SAN effects)
     * @param action    the action taken this turn, never null
     * @return true when anything changed
     */
    protected abstract boolean updateProgress(Map<String, Object> gameState, Map<String, Object> action);

    /** Hook invoked once, right after the transition to COMPLETED. */
    protected void onCompleted(Map<String, Object> gameState) {
    }

    /**
     * Variant configuration and tracking for saved documents. Configuration uses the same keys
     * as the variant's {@code fromParams} factory, so a restore rebuilds it from this map.
     */
    protected Map<String, Object> saveVariantState() {
        return Map.of();
    }

    /** Restores the tracking written by {@link #saveVariantState()}. */
    protected void restoreVariantState(ObjectiveParams state) {
    }

    /** Variant-specific entries for {@link #getDisplayInfo()}. */
    protected Map<String, Object> displayDetails() {
        return Map.of();
    }

    // -- Lifecycle ------------------------------------------------------------

    public boolean canActivate(Map<String, Object> gameState) {
        if (status != ObjectiveStatus.INACTIVE) {
            return false;
        }
        for (ObjectiveCondition condition : definition.activationConditions()) {
            if (!condition.evaluate(gameState)) {
                return false;
            }
        }
        return true;
    }

    public boolean activate(Map<String, Object> gameState) {
        if (!canActivate(gameState)) {
            return false;
        }
        status = ObjectiveStatus.ACTIVE;
        activatedAt = now();
        lastUpdate = activatedAt;
        attemptCount++;
        logEvent("activated", relevantState(gameState));
        log.info("Objective activated: {} ({})", getObjectiveId(), getTitle());
        return true;
    }

    /** ACTIVE &rarr; IN_PROGRESS. Never called by the manager itself. */
    public boolean startProgress() {
        if (status != ObjectiveStatus.ACTIVE) {
            return false;
        }
        status = ObjectiveStatus.IN_PROGRESS;
        lastUpdate = now();
        logEvent("progress_started", Map.of());
        return true;
    }

    /**
     * One turn of the state machine: expiry check, scope progress, completion check.
     *
     * @return true when the objective changed
     */
    public boolean update(Map<String, Object> gameState, Map<String, Object> action) {
        if (!status.isActive()) {
            return false;
        }
        if (isExpired()) {
            expire(gameState);
            return true;
        }
        boolean changed = updateProgress(gameState, action == null ? Map.of() : action);
        if (!status.isActive()) {
            return true;
        }
        lastUpdate = now();
        if (checkCompletion(gameState)) {
            complete(gameState);
            return true;
        }
        return changed;
    }

    /**
     * All explicit completion conditions hold, or progress reached 1.0 when none are defined.
     */
    public boolean checkCompletion(Map<String, Object> gameState) {
        List<ObjectiveCondition> conditions = definition.completionConditions();
        if (conditions.isEmpty()) {
            return progress >= 1.0;
        }
        for (ObjectiveCondition condition : conditions) {
            if (!condition.evaluate(gameState)) {
                return false;
            }
        }
        return true;
    }

    public boolean complete(Map<String, Object> gameState) {
        if (status.isTerminal()) {
            return false;
        }
        status = ObjectiveStatus.COMPLETED;
        progress = 1.0;
        completedAt = now();
        lastUpdate = completedAt;
        applyRewards();
        onCompleted(gameState);
        logEvent("completed", Map.of("rewards", definition.rewards().size()));
        log.info("Objective completed: {} ({})", getObjectiveId(), getTitle());
        return true;
    }

    public boolean fail(Map<String, Object> gameState, String reason) {
        if (status.isTerminal()) {
            return false;
        }
        status = ObjectiveStatus.FAILED;
        lastUpdate = now();
        applyConsequences();
        logEvent("failed", Map.of("reason", reason == null ? "" : reason));
        log.info("Objective failed: {} ({})", getObjectiveId(), reason);
        return true;
    }

    public boolean abandon(String reason) {
        if (status.isTerminal()) {
            return false;
        }
        status = ObjectiveStatus.ABANDONED;
        lastUpdate = now();
        logEvent("abandoned", Map.of("reason", reason == null ? "" : reason));
        log.info("Objective abandoned: {}", getObjectiveId());
        return true;
    }

    public boolean suspend() {
        if (!status.isActive()) {
            return false;
        }
        status = ObjectiveStatus.SUSPENDED;
        lastUpdate = now();
        logEvent("suspended", Map.of());
        return true;
    }

    public boolean resume() {
        if (status != ObjectiveStatus.SUSPENDED) {
            return false;
        }
        status = ObjectiveStatus.ACTIVE;
        lastUpdate = now();
        logEvent("resumed", Map.of());
        return true;
    }

    private void expire(Map<String, Object> gameState) {
        status = ObjectiveStatus.EXPIRED;
        lastUpdate = now();
        applyConsequences();
        logEvent("expired", Map.of("time_limit_seconds", getTimeLimit().map(Duration::toSeconds).orElse(0L)));
        log.info("Objective expired: {}", getObjectiveId());
    }

    private void applyRewards() {
        for (ObjectiveReward reward : definition.rewards()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("reward_type", reward.rewardType().value());
            data.put("value", reward.value());
            data.put("description", reward.description());
            logEvent("reward_applied", data);
            log.debug("Applied reward {} for {}", reward.rewardType(), getObjectiveId());
        }
    }

    private void applyConsequences() {
        for (ObjectiveConsequence consequence : definition.consequences()) {
            logEvent("consequence_applied", Map.of(
                    "consequence_type", consequence.consequenceType().value(),
                    "severity", consequence.severity(),
                    "description", consequence.description()));
            log.debug("Applied consequence {} for {}", consequence.consequenceType(), getObjectiveId());
        }
    }

    // -- Time -----------------------------------------------------------------

    public boolean isExpired() {
        Optional<Duration> limit = getTimeLimit();
        if (activatedAt == null || limit.isEmpty()) {
            return false;
        }
        return !now().isBefore(activatedAt.plus(limit.get()));
    }

    public Optional<Duration> getTimeRemaining() {
        Optional<Duration> limit = getTimeLimit();
        if (activatedAt == null || limit.isEmpty()) {
            return Optional.empty();
        }
        Duration remaining = Duration.between(now(), activatedAt.plus(limit.get()));
        return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
    }

    protected Instant now() {
        return clock.instant();
    }

    // -- Modifiers ------------------------------------------------------------

    /**
     * Pushes a modifier. Refused once the objective is terminal.
     */
    public boolean addModifier(ObjectiveModifier modifier) {
        if (status.isTerminal()) {
            log.debug("Ignoring modifier {} on terminal objective {}", modifier.kind(), getObjectiveId());
            return false;
        }
        modifiers.add(modifier);
        logEvent("modifier_added", Map.of("kind", modifier.kind().name(), "source", modifier.source()));
        return true;
    }

    /**
     * Removes every modifier added by {@code source}.
     *
     * @return number of modifiers removed
     */
    public int removeModifiers(String source) {
        if (status.isTerminal()) {
            return 0;
        }
        int before = modifiers.size();
        modifiers.removeIf(m -> m.source().equals(source));
        return before - modifiers.size();
    }

    /** Modifiers currently in effect (expired ones excluded). */
    public List<ObjectiveModifier> getModifiers() {
        Instant now = now();
        return modifiers.stream().filter(m -> !m.isExpired(now)).toList();
    }

    protected List<ObjectiveModifier> activeModifiers(ObjectiveModifier.Kind kind) {
        return getModifiers().stream().filter(m -> m.kind() == kind).toList();
    }

    public ObjectivePriority getPriority() {
        ObjectivePriority effective = definition.priority();
        for (ObjectiveModifier modifier : activeModifiers(ObjectiveModifier.Kind.PRIORITY_SHIFT)) {
            effective = effective.shift((int) modifier.amount());
        }
        return effective;
    }

    /** Effective time limit: the base limit with reductions and scales applied in order. */
    public Optional<Duration> getTimeLimit() {
        Duration base = definition.timeLimit();
        if (base == null) {
            return Optional.empty();
        }
        double seconds = base.toMillis() / 1000.0;
        boolean modified = false;
        for (ObjectiveModifier modifier : getModifiers()) {
            switch (modifier.kind()) {
                case TIME_LIMIT_REDUCTION -> {
                    seconds -= modifier.amount() * 60;
                    modified = true;
                }
                case TIME_LIMIT_SCALE -> {
                    seconds *= modifier.amount();
                    modified = true;
                }
                default -> {
                }
            }
        }
        Duration effective = Duration.ofMillis(Math.round(seconds * 1000));
        if (modified && effective.compareTo(MINIMUM_MODIFIED_TIME_LIMIT) < 0) {
            effective = MINIMUM_MODIFIED_TIME_LIMIT;
        }
        return Optional.of(effective);
    }

    // -- Progress -------------------------------------------------------------

    /** Sets progress clamped to [0, 1]; ignored once terminal. */
    protected void setProgress(double value) {
        if (status.isTerminal()) {
            return;
        }
        progress = Math.max(0.0, Math.min(1.0, value));
    }

    protected void addProgress(double delta) {
        setProgress(progress + delta);
    }

    // -- Event log ------------------------------------------------------------

    protected void logEvent(String eventType, Map<String, Object> data) {
        eventLog.addLast(new ObjectiveLogEntry(now(), eventType, getObjectiveId(), status, progress, data));
        while (eventLog.size() > EVENT_LOG_LIMIT) {
            eventLog.removeFirst();
        }
    }

    public List<ObjectiveLogEntry> getEventLog() {
        return List.copyOf(eventLog);
    }

    private static Map<String, Object> relevantState(Map<String, Object> gameState) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        if (gameState == null) {
            return snapshot;
        }
        for (String key : List.of("current_location", "sanity", "hp", "time", "npcs_met", "items_found")) {
            if (gameState.containsKey(key)) {
                snapshot.put(key, gameState.get(key));
            }
        }
        return snapshot;
    }

    // -- Views ----------------------------------------------------------------

    public Map<String, Object> getDisplayInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("id", getObjectiveId());
        info.put("title", getTitle());
        info.put("description", getDescription());
        info.put("type", getObjectiveType().value());
        info.put("scope", getScope().value());
        info.put("priority", getPriority().name());
        info.put("status", status.value());
        info.put("progress", progress);
        info.put("progress_percent", (int) Math.round(progress * 100));
        info.put("time_remaining", getTimeRemaining().map(Duration::toSeconds).orElse(null));
        info.put("attempt_count", attemptCount);
        info.putAll(displayDetails());
        return info;
    }

    public ObjectiveDocument toDocument() {
        List<ObjectiveLogEntry> entries = getEventLog();
        List<Map<String, Object>> events = entries
                .subList(Math.max(0, entries.size() - SERIALIZED_EVENT_LIMIT), entries.size())
                .stream().map(ObjectiveLogEntry::toMap).toList();
        return new ObjectiveDocument(
                getObjectiveId(),
                uuid,
                definition.title(),
                definition.description(),
                definition.objectiveType(),
                definition.scope(),
                getPriority(),
                status,
                progress,
                createdAt,
                activatedAt,
                completedAt,
                getTimeLimit().map(d -> d.toMillis() / 1000.0).orElse(null),
                definition.parentObjective(),
                definition.childObjectives(),
                documentMetadata(),
                attemptCount,
                events);
    }

    private Map<String, Object> documentMetadata() {
        Map<String, Object> variantState = saveVariantState();
        if (variantState.isEmpty()) {
            return definition.metadata();
        }
        Map<String, Object> metadata = new LinkedHashMap<>(definition.metadata());
        metadata.put(VARIANT_TYPE_KEY, getClass().getSimpleName());
        metadata.put(VARIANT_STATE_KEY, variantState);
        return metadata;
    }

    /**
     * Restores runtime state (uuid, status, progress, timestamps, attempts) and the variant's
     * tracking from a saved document.
     */
    public void restoreState(ObjectiveDocument document) {
        if (!getObjectiveId().equals(document.objectiveId())) {
            throw new IllegalArgumentException("Document " + document.objectiveId()
                    + " does not belong to objective " + getObjectiveId());
        }
        if (document.uuid() != null) {
            uuid = document.uuid();
        }
        status = document.status() == null ? ObjectiveStatus.INACTIVE : document.status();
        progress = Math.max(0.0, Math.min(1.0, document.progress()));
        createdAt = document.createdAt() == null ? createdAt : document.createdAt();
        activatedAt = document.activatedAt();
        completedAt = document.completedAt();
        attemptCount = document.attemptCount();
        lastUpdate = completedAt != null ? completedAt : activatedAt != null ? activatedAt : createdAt;
        Map<String, Object> metadata = document.metadata() == null ? Map.of() : document.metadata();
        restoreVariantState(new ObjectiveParams(StateValues.getMap(metadata, VARIANT_STATE_KEY)));
        logEvent("restored", Map.of());
    }

    // -- Accessors ------------------------------------------------------------

    public ObjectiveDefinition getDefinition() {
        return definition;
    }

    public String getObjectiveId() {
        return definition.objectiveId();
    }

    public String getUuid() {
        return uuid;
    }

    public String getTitle() {
        return definition.title();
    }

    public String getDescription() {
        return definition.description();
    }

    public ObjectiveType getObjectiveType() {
        return definition.objectiveType();
    }

    public ObjectiveScope getScope() {
        return definition.scope();
    }

    public ObjectiveStatus getStatus() {
        return status;
    }

    public double getProgress() {
        return progress;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Optional<Instant> getActivatedAt() {
        return Optional.ofNullable(activatedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    /** Time of the last state change; for terminal objectives, the terminal transition. */
    public Instant getLastUpdate() {
        return lastUpdate;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean isCompleted() {
        return status == ObjectiveStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status.isFailure();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getObjectiveId() + ", " + status.value()
                + ", " + String.format("%.2f", progress) + "]";
    }
}
