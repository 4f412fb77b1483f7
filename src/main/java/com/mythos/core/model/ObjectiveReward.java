package com.mythos.core.model;

import java.util.Map;

/**
 * A reward granted when an objective completes.
 *
 * @param rewardType  the kind of reward
 * @param value       reward magnitude or payload (number, item name, ...)
 * @param description player-facing description
 * @param metadata    free-form extra data
 */
public record ObjectiveReward(
        RewardType rewardType,
        Object value,
        String description,
        Map<String, Object> metadata
) {

    public static final ObjectiveReward KNOWLEDGE_REWARD =
            new ObjectiveReward(RewardType.KNOWLEDGE, 1, "Gain valuable knowledge");
    public static final ObjectiveReward SURVIVAL_REWARD =
            new ObjectiveReward(RewardType.SURVIVAL, 1, "Improve survival chances");
    public static final ObjectiveReward SANITY_MINOR_REWARD =
            new ObjectiveReward(RewardType.SANITY, 2, "Restore a little sanity");
    public static final ObjectiveReward SANITY_MAJOR_REWARD =
            new ObjectiveReward(RewardType.SANITY, 5, "Restore significant sanity");

    public ObjectiveReward {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public ObjectiveReward(RewardType rewardType, Object value, String description) {
        this(rewardType, value, description, Map.of());
    }
}
