package com.mythos.core.objective;

import com.mythos.core.model.ObjectiveStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of an objective's bounded event log.
 *
 * @param timestamp   when it was recorded
 * @param eventType   e.g. {@code activated}, {@code completed}, {@code horror_escalation}
 * @param objectiveId owning objective
 * @param status      status at the time of the event
 * @param progress    progress at the time of the event
 * @param data        event-specific data
 */
public record ObjectiveLogEntry(
        Instant timestamp,
        String eventType,
        String objectiveId,
        ObjectiveStatus status,
        double progress,
        Map<String, Object> data
) {

    public ObjectiveLogEntry {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timestamp", timestamp.toString());
        map.put("event_type", eventType);
        map.put("objective_id", objectiveId);
        map.put("status", status.value());
        map.put("progress", progress);
        map.put("data", data);
        return map;
    }
}
