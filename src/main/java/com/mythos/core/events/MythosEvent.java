package com.mythos.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the objective manager or the achievement engine.
 *
 * @param eventType  e.g. "objective_completed", "objective_failed", "achievement_unlocked"
 * @param subjectId  the objective or achievement the event is about
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record MythosEvent(
    String eventType,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
