package com.mythos.core.model;

import java.util.List;

/**
 * Ids of the objectives touched by one manager update pass.
 *
 * @param activated objectives activated this turn
 * @param updated   objectives whose update reported a change
 * @param completed objectives that completed this turn
 * @param failed    objectives that failed (explicitly or by a forced fail) this turn
 * @param expired   objectives whose time limit ran out this turn
 */
public record UpdateReport(
        List<String> activated,
        List<String> updated,
        List<String> completed,
        List<String> failed,
        List<String> expired
) {

    public UpdateReport {
        activated = List.copyOf(activated);
        updated = List.copyOf(updated);
        completed = List.copyOf(completed);
        failed = List.copyOf(failed);
        expired = List.copyOf(expired);
    }

    public boolean isEmpty() {
        return activated.isEmpty() && updated.isEmpty() && completed.isEmpty()
                && failed.isEmpty() && expired.isEmpty();
    }
}
