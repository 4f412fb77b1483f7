package com.mythos.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Mythos-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTurn(long turnNumber) {
        MDC.put("turn", String.valueOf(turnNumber));
    }

    public static void setObjective(String objectiveId) {
        MDC.put("objectiveId", objectiveId);
    }

    public static void clearObjective() {
        MDC.remove("objectiveId");
    }

    public static void clear() {
        MDC.remove("turn");
        MDC.remove("objectiveId");
    }
}
