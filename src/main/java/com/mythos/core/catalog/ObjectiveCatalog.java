package com.mythos.core.catalog;

import com.mythos.core.manager.ObjectiveFactory;
import com.mythos.core.manager.ObjectiveRegistry;
import com.mythos.core.manager.ObjectiveTemplate;
import com.mythos.core.model.FailureConsequence;
import com.mythos.core.model.ObjectiveCondition;
import com.mythos.core.model.ObjectiveConsequence;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.ObjectiveReward;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveType;
import com.mythos.core.model.RewardType;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;
import com.mythos.core.objective.layered.ImmediateObjective;
import com.mythos.core.objective.layered.LongTermObjective;
import com.mythos.core.objective.layered.MetaObjective;
import com.mythos.core.objective.layered.MidTermObjective;
import com.mythos.core.objective.layered.ShortTermObjective;
import com.mythos.core.objective.sanity.CosmicInsightObjective;
import com.mythos.core.objective.sanity.MadnessObjective;
import com.mythos.core.objective.sanity.MadnessType;
import com.mythos.core.objective.sanity.SanityDependentObjective;
import com.mythos.core.objective.sanity.SanityState;
import com.mythos.core.objective.sanity.StateConfiguration;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ready-made objectives for the common situations of an investigation, plus the registration
 * of the built-in objective types and templates.
 * <p>
 * Every helper accepts extra attributes that override the defaults it sets.
 */
@Component
public class ObjectiveCatalog {

    private final Clock clock;

    public ObjectiveCatalog(Clock clock) {
        this.clock = clock;
    }

    // -- Registration ---------------------------------------------------------

    public static ObjectiveRegistry defaultRegistry() {
        ObjectiveRegistry registry = new ObjectiveRegistry();
        registerDefaultTypes(registry);
        registerDefaultTemplates(registry);
        return registry;
    }

    public static void registerDefaultTypes(ObjectiveRegistry registry) {
        registry.registerType(ObjectiveTypes.IMMEDIATE, ImmediateObjective::fromParams);
        registry.registerType(ObjectiveTypes.SHORT_TERM, ShortTermObjective::fromParams);
        registry.registerType(ObjectiveTypes.MID_TERM, MidTermObjective::fromParams);
        registry.registerType(ObjectiveTypes.LONG_TERM, LongTermObjective::fromParams);
        registry.registerType(ObjectiveTypes.META, MetaObjective::fromParams);
        registry.registerType(ObjectiveTypes.SANITY_DEPENDENT, SanityDependentObjective::fromParams);
        registry.registerType(ObjectiveTypes.COSMIC_INSIGHT, CosmicInsightObjective::fromParams);
        registry.registerType(ObjectiveTypes.MADNESS, MadnessObjective::fromParams);
    }

    public static void registerDefaultTemplates(ObjectiveRegistry registry) {
        registry.registerTemplate(new ObjectiveTemplate("library_investigation", ObjectiveTypes.SHORT_TERM, Map.of(
                "title", "Investigate the Library",
                "description", "Search the library for clues and forbidden knowledge",
                "objective_type", ObjectiveType.INVESTIGATION,
                "required_discoveries", List.of("ancient_book", "hidden_note", "strange_symbol"),
                "rewards", List.of(ObjectiveReward.KNOWLEDGE_REWARD),
                "consequences", List.of(ObjectiveConsequence.SAN_LOSS_MINOR))));

        registry.registerTemplate(new ObjectiveTemplate("basement_exploration", ObjectiveTypes.SHORT_TERM, Map.of(
                "title", "Explore the Basement",
                "description", "Investigate the basement despite the feeling of dread",
                "objective_type", ObjectiveType.EXPLORATION,
                "tension_ramp_enabled", true,
                "initial_tension", 2,
                "max_tension", 4,
                "rewards", List.of(ObjectiveReward.KNOWLEDGE_REWARD),
                "consequences", List.of(ObjectiveConsequence.SAN_LOSS_MAJOR))));

        registry.registerTemplate(new ObjectiveTemplate("npc_interview", ObjectiveTypes.IMMEDIATE, Map.of(
                "title", "Interview NPC",
                "description", "Conduct a thorough interview to gather information",
                "objective_type", ObjectiveType.SOCIAL,
                "required_actions", List.of("ask_about_events", "probe_for_details", "conclude_interview"),
                "rewards", List.of(ObjectiveReward.KNOWLEDGE_REWARD))));

        registry.registerTemplate(new ObjectiveTemplate("cult_investigation", ObjectiveTypes.MID_TERM, Map.of(
                "title", "Investigate the Cult",
                "description", "Uncover the cult's plans and membership",
                "objective_type", ObjectiveType.INVESTIGATION,
                "investigation_branches", List.of("member_identification", "ritual_discovery", "location_mapping"),
                "horror_revelations", List.of("cult_purpose", "ritual_details", "cosmic_connection"),
                "rewards", List.of(ObjectiveReward.KNOWLEDGE_REWARD),
                "consequences", List.of(ObjectiveConsequence.SAN_LOSS_MAJOR, ObjectiveConsequence.COSMIC_ATTENTION))));

        registry.registerTemplate(new ObjectiveTemplate("survival_horror", ObjectiveTypes.SHORT_TERM, Map.of(
                "title", "Survive the Encounter",
                "description", "Survive a terrifying supernatural encounter",
                "objective_type", ObjectiveType.SURVIVAL,
                "priority", ObjectivePriority.CRITICAL,
                "tension_ramp_enabled", true,
                "initial_tension", 3,
                "max_tension", 5,
                "time_limit", Duration.ofMinutes(8),
                "rewards", List.of(ObjectiveReward.SURVIVAL_REWARD, ObjectiveReward.SANITY_MINOR_REWARD),
                "consequences", List.of(ObjectiveConsequence.SAN_LOSS_MAJOR))));
    }

    // -- Layered helpers ------------------------------------------------------

    public ShortTermObjective investigation(String id, String title, String location,
                                            List<String> requiredDiscoveries, Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title, "Thoroughly investigate " + location + " to uncover its secrets",
                ObjectiveType.INVESTIGATION, ObjectivePriority.MEDIUM);
        attributes.put("time_limit", Duration.ofMinutes(15));
        attributes.put("activation_conditions", List.of(ObjectiveCondition.location(location)));
        attributes.put("required_discoveries", requiredDiscoveries);
        attributes.put("scene_context", Map.of("location", location));
        attributes.put("rewards", List.of(ObjectiveReward.KNOWLEDGE_REWARD));
        attributes.put("consequences", List.of(ObjectiveConsequence.SAN_LOSS_MINOR));
        return build(ShortTermObjective::fromParams, id, attributes, extra);
    }

    public ShortTermObjective survival(String id, String title, String threat, Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title, "Survive " + threat,
                ObjectiveType.SURVIVAL, ObjectivePriority.HIGH);
        attributes.put("time_limit", Duration.ofMinutes(10));
        attributes.put("rewards", List.of(ObjectiveReward.SURVIVAL_REWARD, ObjectiveReward.SANITY_MINOR_REWARD));
        attributes.put("consequences", List.of(ObjectiveConsequence.SAN_LOSS_MAJOR));
        attributes.put("tension_ramp_enabled", true);
        attributes.put("initial_tension", 2);
        attributes.put("max_tension", 5);
        return build(ShortTermObjective::fromParams, id, attributes, extra);
    }

    public ImmediateObjective social(String id, String title, String npcName,
                                     List<String> conversationGoals, Map<String, ?> extra) {
        List<String> goals = conversationGoals == null || conversationGoals.isEmpty()
                ? List.of("initiate_conversation", "ask_questions", "conclude_conversation")
                : conversationGoals;
        Map<String, Object> attributes = attributes(title, "Engage with " + npcName + " to gather information",
                ObjectiveType.SOCIAL, ObjectivePriority.MEDIUM);
        attributes.put("required_actions", goals);
        attributes.put("rewards", List.of(ObjectiveReward.KNOWLEDGE_REWARD));
        attributes.put("metadata", Map.of("npc_name", npcName, "conversation_goals", goals));
        return build(ImmediateObjective::fromParams, id, attributes, extra);
    }

    public ShortTermObjective exploration(String id, String title, List<String> areas, Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title,
                "Explore and map out the following areas: " + String.join(", ", areas),
                ObjectiveType.EXPLORATION, ObjectivePriority.MEDIUM);
        attributes.put("required_discoveries", areas.stream().map(area -> "explored_" + area).toList());
        attributes.put("milestone_count", Math.max(1, areas.size()));
        attributes.put("rewards", List.of(ObjectiveReward.KNOWLEDGE_REWARD));
        attributes.put("consequences", List.of(ObjectiveConsequence.SAN_LOSS_MINOR));
        return build(ShortTermObjective::fromParams, id, attributes, extra);
    }

    public MidTermObjective knowledge(String id, String title, String mythosEntity, int knowledgeLevel,
                                      Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title,
                "Learn about " + mythosEntity + " and its connection to current events",
                ObjectiveType.KNOWLEDGE, ObjectivePriority.MEDIUM);
        attributes.put("horror_revelations", List.of(mythosEntity + "_basic", mythosEntity + "_advanced"));
        attributes.put("rewards", List.of(ObjectiveReward.KNOWLEDGE_REWARD));
        attributes.put("consequences", List.of(ObjectiveConsequence.SAN_LOSS_MAJOR, ObjectiveConsequence.COSMIC_ATTENTION));
        attributes.put("metadata", Map.of("mythos_entity", mythosEntity, "target_knowledge_level", knowledgeLevel));
        return build(MidTermObjective::fromParams, id, attributes, extra);
    }

    public MidTermObjective protection(String id, String title, String protectedEntity, int threatLevel,
                                       Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title, "Keep " + protectedEntity + " safe from harm",
                ObjectiveType.PROTECTION, ObjectivePriority.HIGH);
        attributes.put("story_beats", List.of("identify_threat", "establish_protection",
                "monitor_situation", "respond_to_crisis"));
        attributes.put("rewards", List.of(ObjectiveReward.SURVIVAL_REWARD,
                new ObjectiveReward(RewardType.ALLIANCE, 1, "Gain trust of " + protectedEntity)));
        attributes.put("consequences", List.of(
                new ObjectiveConsequence(FailureConsequence.NPC_DEATH, 5, protectedEntity + " is harmed or killed"),
                ObjectiveConsequence.SAN_LOSS_MAJOR));
        attributes.put("metadata", Map.of("protected_entity", protectedEntity, "threat_level", threatLevel));
        return build(MidTermObjective::fromParams, id, attributes, extra);
    }

    public ShortTermObjective escape(String id, String title, String location, int urgencyLevel,
                                     Map<String, ?> extra) {
        int severity = Math.max(1, Math.min(5, urgencyLevel));
        Map<String, Object> attributes = attributes(title, "Escape from " + location + " before it's too late",
                ObjectiveType.ESCAPE, ObjectivePriority.CRITICAL);
        attributes.put("time_limit", Duration.ofMinutes(10));
        attributes.put("required_discoveries", List.of("exit_route", "clear_obstacles", "avoid_dangers"));
        attributes.put("tension_ramp_enabled", true);
        attributes.put("initial_tension", urgencyLevel);
        attributes.put("max_tension", 5);
        attributes.put("rewards", List.of(ObjectiveReward.SURVIVAL_REWARD));
        attributes.put("consequences", List.of(
                new ObjectiveConsequence(FailureConsequence.HP_LOSS, severity, "Physical harm from failed escape"),
                new ObjectiveConsequence(FailureConsequence.SAN_LOSS, severity, "Terror from being trapped")));
        attributes.put("metadata", Map.of("escape_location", location, "urgency_level", urgencyLevel));
        return build(ShortTermObjective::fromParams, id, attributes, extra);
    }

    public LongTermObjective campaign(String id, String title, String campaignName,
                                      List<Map<String, Object>> phases, List<String> themes, Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title,
                "Complete the " + campaignName + " campaign and uncover its mysteries",
                ObjectiveType.REVELATION, ObjectivePriority.HIGH);
        attributes.put("campaign_phases", phases);
        attributes.put("recurring_themes", themes == null ? List.of() : themes);
        attributes.put("character_growth_goals", Map.of(
                LongTermObjective.MYTHOS_ENTITIES_GOAL, 5,
                "successful_investigations", 3,
                "survival_encounters", 10));
        attributes.put("rewards", List.of(
                new ObjectiveReward(RewardType.COSMIC_INSIGHT, 1, "Gain deep understanding of cosmic truth"),
                new ObjectiveReward(RewardType.KNOWLEDGE, 5, "Extensive mythos knowledge")));
        attributes.put("consequences", List.of(ObjectiveConsequence.COSMIC_ATTENTION));
        attributes.put("metadata", Map.of("campaign_name", campaignName));
        return build(LongTermObjective::fromParams, id, attributes, extra);
    }

    public MetaObjective mastery(String id, String title, String masteryType, Map<String, Object> unlockCriteria,
                                 Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title,
                "Achieve mastery in " + masteryType + " across multiple campaigns",
                ObjectiveType.KNOWLEDGE, ObjectivePriority.LOW);
        attributes.put("unlock_criteria", Map.of(masteryType + "_mastery", unlockCriteria));
        attributes.put("rewards", List.of(
                new ObjectiveReward(RewardType.COSMIC_INSIGHT, 1, "Master-level understanding of " + masteryType)));
        attributes.put("metadata", Map.of("mastery_type", masteryType));
        return build(MetaObjective::fromParams, id, attributes, extra);
    }

    // -- Sanity helpers -------------------------------------------------------

    public CosmicInsightObjective forbiddenKnowledge(String id, String title, String knowledgeType,
                                                     List<Map<String, Object>> insightLevels, Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title, "Learn the terrible truth about " + knowledgeType,
                ObjectiveType.KNOWLEDGE, ObjectivePriority.HIGH);
        attributes.put("scope", ObjectiveScope.MID_TERM);
        attributes.put("san_risk_level", 4);
        attributes.put("insight_levels", insightLevels);
        attributes.put("sanity_cost_per_insight", 3);
        attributes.put("rewards", List.of(
                new ObjectiveReward(RewardType.COSMIC_INSIGHT, 1, "Deep understanding of " + knowledgeType),
                new ObjectiveReward(RewardType.KNOWLEDGE, 3, "Forbidden knowledge gained")));
        attributes.put("consequences", List.of(
                new ObjectiveConsequence(FailureConsequence.SAN_LOSS, 5, "Failed to comprehend cosmic truth"),
                new ObjectiveConsequence(FailureConsequence.COSMIC_ATTENTION, 3, "Noticed by cosmic entities")));
        return build(CosmicInsightObjective::fromParams, id, attributes, extra);
    }

    public SanityDependentObjective sanityDependentInvestigation(String id, String title, String location,
                                                                 Map<SanityState, StateConfiguration> configurations,
                                                                 Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title,
                "Investigate " + location + " - methods depend on mental state",
                ObjectiveType.INVESTIGATION, ObjectivePriority.MEDIUM);
        attributes.put("scope", ObjectiveScope.SHORT_TERM);
        attributes.put("state_configurations", configurations);
        attributes.put("san_risk_level", 2);
        attributes.put("rewards", List.of(new ObjectiveReward(RewardType.KNOWLEDGE, 1, "Information gathered")));
        attributes.put("consequences", List.of(
                new ObjectiveConsequence(FailureConsequence.SAN_LOSS, 2, "Disturbing findings")));
        return build(SanityDependentObjective::fromParams, id, attributes, extra);
    }

    public MadnessObjective madnessDriven(String id, String title, List<MadnessType> requiredMadness,
                                          Map<String, ?> extra) {
        Map<String, Object> attributes = attributes(title, "An action that only makes sense to a disturbed mind",
                ObjectiveType.RITUAL, ObjectivePriority.HIGH);
        attributes.put("scope", ObjectiveScope.SHORT_TERM);
        attributes.put("required_madness_types", requiredMadness.stream().map(MadnessType::value).toList());
        attributes.put("madness_progress_multiplier", 2.0);
        attributes.put("sanity_recovery_on_completion", 3);
        attributes.put("rewards", List.of(
                new ObjectiveReward(RewardType.SANITY, 3, "Confronting madness provides clarity"),
                new ObjectiveReward(RewardType.REVELATION, 1, "Madness reveals hidden truth")));
        return build(MadnessObjective::fromParams, id, attributes, extra);
    }

    private static Map<String, Object> attributes(String title, String description, ObjectiveType type,
                                                  ObjectivePriority priority) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("title", title);
        attributes.put("description", description);
        attributes.put("objective_type", type);
        attributes.put("priority", priority);
        return attributes;
    }

    @SuppressWarnings("unchecked")
    private <T extends Objective> T build(ObjectiveFactory factory, String id, Map<String, Object> defaults,
                                          Map<String, ?> extra) {
        ObjectiveParams params = new ObjectiveParams(defaults).merge(extra == null ? Map.of() : extra);
        return (T) factory.create(ObjectiveDefinition.fromParams(id, params), params, clock);
    }
}
