package com.mythos.core.objective.sanity;

import com.mythos.core.model.ObjectiveModifier;
import com.mythos.core.model.StateValues;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for objectives wired into the SAN system: activation gated on sanity state and
 * cosmic insight, SAN risk estimation, audited SAN loss and gain, and madness effects
 * that attach once the character is DISTURBED or worse.
 */
public abstract class SanityIntegratedObjective extends Objective {

    private static final Logger log = LoggerFactory.getLogger(SanityIntegratedObjective.class);

    public static final int DEFAULT_MAX_SANITY = 99;
    private static final int MAX_RISK = 10;

    private SanityThresholds thresholds = SanityThresholds.DEFAULT;
    private SanityState requiredSanityState;
    private int sanRiskLevel = 1;
    private CosmicInsightLevel cosmicInsightRequired = CosmicInsightLevel.IGNORANT;
    private final List<MadnessEffect> madnessEffects = new ArrayList<>();
    private boolean madnessProtection;
    private int potentialSanGain;
    private int cumulativeSanLoss;
    private final List<Map<String, Object>> sanityEvents = new ArrayList<>();

    protected SanityIntegratedObjective(ObjectiveDefinition definition, Clock clock) {
        super(definition, clock);
    }

    /** Reads the SAN-related creation attributes shared by every sanity-integrated variant. */
    @SuppressWarnings("unchecked")
    protected void configureSanity(ObjectiveParams params) {
        Object requirements = params.get("san_requirements");
        if (requirements instanceof SanityThresholds custom) {
            thresholds = custom;
        } else if (requirements instanceof Map<?, ?>) {
            thresholds = SanityThresholds.fromMap(params.map("san_requirements"));
        }
        requiredSanityState = params.enumValue("required_sanity_state", SanityState.class, null);
        sanRiskLevel = params.intValue("san_risk_level", 1);
        cosmicInsightRequired = CosmicInsightLevel.ofLevel(params.intValue("cosmic_insight_required", 0));
        if (params.get("madness_effects") instanceof List<?> effects) {
            for (Object effect : effects) {
                if (effect instanceof MadnessEffect madness) {
                    madnessEffects.add(madness);
                } else if (effect instanceof Map<?, ?> map) {
                    madnessEffects.add(MadnessEffect.fromMap((Map<String, Object>) map));
                }
            }
        }
        madnessProtection = params.bool("madness_protection", false);
        potentialSanGain = params.intValue("potential_san_gain", 0);
    }

    public SanityIntegratedObjective withSanRiskLevel(int level) {
        this.sanRiskLevel = level;
        return this;
    }

    public SanityIntegratedObjective withRequiredSanityState(SanityState state) {
        this.requiredSanityState = state;
        return this;
    }

    public SanityIntegratedObjective withCosmicInsightRequired(CosmicInsightLevel level) {
        this.cosmicInsightRequired = level;
        return this;
    }

    public SanityIntegratedObjective withMadnessEffect(MadnessEffect effect) {
        madnessEffects.add(effect);
        return this;
    }

    public SanityIntegratedObjective withMadnessProtection(boolean protection) {
        this.madnessProtection = protection;
        return this;
    }

    public SanityIntegratedObjective withThresholds(SanityThresholds custom) {
        this.thresholds = custom;
        return this;
    }

    public SanityState getSanityState(Map<String, Object> gameState) {
        return thresholds.derive(gameState);
    }

    @Override
    public boolean canActivate(Map<String, Object> gameState) {
        if (!super.canActivate(gameState)) {
            return false;
        }
        if (requiredSanityState != null && getSanityState(gameState) != requiredSanityState) {
            return false;
        }
        return StateValues.getInt(gameState, "cosmic_insight", 0) >= cosmicInsightRequired.ordinal();
    }

    /** Base risk after difficulty modifiers. */
    public int getSanRiskLevel() {
        int risk = sanRiskLevel;
        for (ObjectiveModifier modifier : activeModifiers(ObjectiveModifier.Kind.RISK_SCALE)) {
            int scaled = (int) (risk * modifier.amount());
            risk = modifier.amount() < 1.0 ? Math.max(1, scaled) : Math.min(5, scaled);
        }
        return risk;
    }

    /**
     * Expected SAN loss for pursuing this objective now: base risk plus a state modifier,
     * two less with madness protection, within [1, 10].
     */
    public int calculateSanRisk(Map<String, Object> gameState) {
        int modifier = switch (getSanityState(gameState)) {
            case STABLE -> 0;
            case STRESSED -> 1;
            case DISTURBED -> 2;
            case UNHINGED, TEMPORARILY_INSANE -> 3;
            case MAD -> 5;
        };
        int total = getSanRiskLevel() + modifier;
        if (madnessProtection) {
            total -= 2;
        }
        return Math.max(1, Math.min(MAX_RISK, total));
    }

    /**
     * Subtracts SAN from the snapshot (never below zero), records an audit event, then checks
     * whether any madness effect attaches. Ignored once the objective is terminal.
     */
    public void applySanLoss(Map<String, Object> gameState, int amount, String reason) {
        if (isTerminal() || amount <= 0) {
            return;
        }
        cumulativeSanLoss += amount;
        int before = StateValues.currentSanity(gameState);
        int after = Math.max(0, before - amount);
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", now().toString());
        event.put("san_loss", amount);
        event.put("reason", reason);
        event.put("cumulative_loss", cumulativeSanLoss);
        event.put("sanity_before", before);
        event.put("sanity_after", after);
        sanityEvents.add(event);
        gameState.put("sanity", after);
        logEvent("san_loss_applied", event);
        log.warn("SAN loss applied on {}: {} points - {}", getObjectiveId(), amount, reason);
        checkMadnessThreshold(gameState);
    }

    /** Restores SAN up to {@code max_sanity} (default 99) and records an audit event. */
    public void applySanGain(Map<String, Object> gameState, int amount, String reason) {
        int maxSanity = StateValues.getInt(gameState, "max_sanity", DEFAULT_MAX_SANITY);
        int before = StateValues.currentSanity(gameState);
        int gain = Math.min(amount, maxSanity - before);
        if (gain <= 0) {
            return;
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", now().toString());
        event.put("san_gain", gain);
        event.put("reason", reason);
        event.put("sanity_before", before);
        event.put("sanity_after", before + gain);
        sanityEvents.add(event);
        gameState.put("sanity", before + gain);
        logEvent("san_gain_applied", event);
        log.info("SAN restored on {}: {} points - {}", getObjectiveId(), gain, reason);
    }

    private void checkMadnessThreshold(Map<String, Object> gameState) {
        SanityState state = getSanityState(gameState);
        if (!state.isDisturbedOrWorse()) {
            return;
        }
        for (MadnessEffect effect : madnessEffects) {
            List<String> active = StateValues.getStringList(gameState, "active_madness");
            if (!active.contains(effect.madnessType().value()) && effect.triggersIn(state)) {
                applyMadnessEffect(effect, gameState, active);
            }
        }
    }

    private void applyMadnessEffect(MadnessEffect effect, Map<String, Object> gameState, List<String> active) {
        List<String> updated = new ArrayList<>(active);
        updated.add(effect.madnessType().value());
        gameState.put("active_madness", updated);
        gameState.putAll(effect.behavioralChanges());

        String source = "madness:" + effect.madnessType().value();
        Instant expiry = effect.durationHours() == null ? null
                : now().plus(Duration.ofMillis(Math.round(effect.durationHours() * 3_600_000)));
        effect.objectiveModifications().forEach((kind, value) -> {
            ObjectiveModifier modifier = switch (kind) {
                case "priority_change" -> ObjectiveModifier.priorityShift(
                        StateValues.getInt(effect.objectiveModifications(), kind, 0), source);
                case "time_pressure" -> ObjectiveModifier.timeLimitReduction(
                        StateValues.getDouble(effect.objectiveModifications(), kind, 0), source);
                case "add_compulsion" -> ObjectiveModifier.requiredAction(String.valueOf(value), source);
                default -> null;
            };
            if (modifier != null) {
                addModifier(expiry == null ? modifier : modifier.until(expiry));
            } else {
                log.debug("Ignoring unknown objective modification '{}' from {}", kind, source);
            }
        });

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("madness_type", effect.madnessType().value());
        data.put("severity", effect.severity());
        data.put("duration", effect.durationHours());
        logEvent("madness_effect_applied", data);
        log.warn("Madness effect applied on {}: {} (severity {})", getObjectiveId(),
                effect.madnessType().value(), effect.severity());
    }

    public int getCumulativeSanLoss() {
        return cumulativeSanLoss;
    }

    public int getPotentialSanGain() {
        return potentialSanGain;
    }

    public List<Map<String, Object>> getSanityEvents() {
        return List.copyOf(sanityEvents);
    }

    public SanityThresholds getThresholds() {
        return thresholds;
    }

    /** Shared SAN configuration and audit trail; subclasses add their own entries. */
    @Override
    protected Map<String, Object> saveVariantState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("san_requirements", thresholds.toMap());
        state.put("required_sanity_state", requiredSanityState == null ? null : requiredSanityState.name());
        state.put("san_risk_level", sanRiskLevel);
        state.put("cosmic_insight_required", cosmicInsightRequired.ordinal());
        state.put("madness_effects", madnessEffects.stream().map(MadnessEffect::toMap).toList());
        state.put("madness_protection", madnessProtection);
        state.put("potential_san_gain", potentialSanGain);
        state.put("cumulative_san_loss", cumulativeSanLoss);
        state.put("sanity_events", new ArrayList<>(sanityEvents));
        return state;
    }

    @Override
    protected void restoreVariantState(ObjectiveParams state) {
        cumulativeSanLoss = state.intValue("cumulative_san_loss", 0);
        if (state.get("sanity_events") instanceof List<?> events) {
            for (Object event : events) {
                if (event instanceof Map<?, ?> map) {
                    Map<String, Object> copy = new LinkedHashMap<>();
                    map.forEach((key, value) -> copy.put(String.valueOf(key), value));
                    sanityEvents.add(copy);
                }
            }
        }
    }

    @Override
    protected Map<String, Object> displayDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("san_risk_level", getSanRiskLevel());
        details.put("required_sanity_state", requiredSanityState == null ? null : requiredSanityState.value());
        details.put("cumulative_san_loss", cumulativeSanLoss);
        details.put("madness_protection", madnessProtection);
        details.put("compulsions", activeModifiers(ObjectiveModifier.Kind.REQUIRED_ACTION).stream()
                .map(ObjectiveModifier::action).toList());
        return details;
    }
}
