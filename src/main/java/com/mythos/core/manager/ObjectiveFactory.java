package com.mythos.core.manager;

import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;

import java.time.Clock;

/**
 * Builds an objective of one registered type from its definition and the remaining
 * creation attributes.
 */
@FunctionalInterface
public interface ObjectiveFactory {
    Objective create(ObjectiveDefinition definition, ObjectiveParams params, Clock clock);
}
