package com.mythos.core.catalog;

/**
 * Names under which the built-in objective variants are registered.
 */
public final class ObjectiveTypes {

    public static final String IMMEDIATE = "ImmediateObjective";
    public static final String SHORT_TERM = "ShortTermObjective";
    public static final String MID_TERM = "MidTermObjective";
    public static final String LONG_TERM = "LongTermObjective";
    public static final String META = "MetaObjective";
    public static final String SANITY_DEPENDENT = "SanityDependentObjective";
    public static final String COSMIC_INSIGHT = "CosmicInsightObjective";
    public static final String MADNESS = "MadnessObjective";

    private ObjectiveTypes() {}
}
