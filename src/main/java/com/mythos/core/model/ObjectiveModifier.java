package com.mythos.core.model;

import java.time.Instant;

/**
 * A runtime adjustment layered over an objective's immutable definition.
 * <p>
 * Modifiers are applied in insertion order at read time, tagged by {@code source}
 * so they can be inspected and removed, and optionally expire.
 *
 * @param kind      what the modifier adjusts
 * @param amount    numeric amount (priority delta, minutes, or scale factor depending on kind)
 * @param action    action name for {@link Kind#REQUIRED_ACTION}, otherwise null
 * @param source    who added it, e.g. {@code difficulty} or {@code madness:paranoia}
 * @param expiresAt when the modifier stops applying (null = never)
 */
public record ObjectiveModifier(
        Kind kind,
        double amount,
        String action,
        String source,
        Instant expiresAt
) {

    public enum Kind {
        /** Shift priority by {@code amount} levels. */
        PRIORITY_SHIFT,
        /** Shorten the time limit by {@code amount} minutes (never below one minute). */
        TIME_LIMIT_REDUCTION,
        /** Multiply the time limit by {@code amount}. */
        TIME_LIMIT_SCALE,
        /** Add {@code action} to the required action set. */
        REQUIRED_ACTION,
        /** Multiply the milestone count by {@code amount}. */
        MILESTONE_SCALE,
        /** Multiply the SAN risk level by {@code amount}. */
        RISK_SCALE
    }

    public static ObjectiveModifier priorityShift(int delta, String source) {
        return new ObjectiveModifier(Kind.PRIORITY_SHIFT, delta, null, source, null);
    }

    public static ObjectiveModifier timeLimitReduction(double minutes, String source) {
        return new ObjectiveModifier(Kind.TIME_LIMIT_REDUCTION, minutes, null, source, null);
    }

    public static ObjectiveModifier timeLimitScale(double factor, String source) {
        return new ObjectiveModifier(Kind.TIME_LIMIT_SCALE, factor, null, source, null);
    }

    public static ObjectiveModifier requiredAction(String action, String source) {
        return new ObjectiveModifier(Kind.REQUIRED_ACTION, 0, action, source, null);
    }

    public static ObjectiveModifier milestoneScale(double factor, String source) {
        return new ObjectiveModifier(Kind.MILESTONE_SCALE, factor, null, source, null);
    }

    public static ObjectiveModifier riskScale(double factor, String source) {
        return new ObjectiveModifier(Kind.RISK_SCALE, factor, null, source, null);
    }

    public ObjectiveModifier until(Instant expiry) {
        return new ObjectiveModifier(kind, amount, action, source, expiry);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
