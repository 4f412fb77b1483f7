package com.mythos.core.ai;

/**
 * Model answer when asked to classify the player's behaviour.
 *
 * @param primaryPattern one of the {@link PlayerBehaviorPattern} values
 * @param reasoning      short justification
 */
public record BehaviorInsight(String primaryPattern, String reasoning) {}
