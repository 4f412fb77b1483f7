package com.mythos.core.achievement;

import com.mythos.core.model.ObjectiveType;
import com.mythos.core.objective.sanity.SanityState;

import java.util.List;
import java.util.Map;

import static com.mythos.core.achievement.ComparisonOperator.GTE;

/**
 * The achievement set every session starts with.
 */
public final class DefaultAchievements {

    private DefaultAchievements() {}

    public static List<Achievement> create() {
        return List.of(
                Achievement.builder("first_survival")
                        .title("The Living")
                        .description("Survive your first supernatural encounter")
                        .category(AchievementCategory.SURVIVAL)
                        .rarity(AchievementRarity.COMMON)
                        .criterion(AchievementCriteria.eventOccurred("supernatural_encounter_survived"))
                        .reward(AchievementReward.of("Survivor's Instinct", "You've learned to recognize danger"))
                        .flavorText("The first brush with the impossible leaves its mark.")
                        .build(),
                Achievement.builder("sanity_keeper")
                        .title("Keeper of Reason")
                        .description("Maintain sanity above 70 for an entire session")
                        .category(AchievementCategory.SURVIVAL)
                        .rarity(AchievementRarity.UNCOMMON)
                        .criterion(AchievementCriteria.statThreshold("session_min_sanity", GTE, 70))
                        .reward(new AchievementReward("Mental Fortitude", "Resistance to madness",
                                null, Map.of("sanity_resistance", 0.1), null, null))
                        .flavorText("A clear mind in a world gone mad.")
                        .build(),
                Achievement.builder("first_truth")
                        .title("Glimpse of Truth")
                        .description("Gain your first piece of cosmic knowledge")
                        .category(AchievementCategory.KNOWLEDGE)
                        .rarity(AchievementRarity.COMMON)
                        .criterion(AchievementCriteria.statThreshold("cosmic_knowledge_count", GTE, 1))
                        .reward(new AchievementReward("Awakened Mind", "Understanding begins",
                                null, null, null, List.of("cosmic_awareness_intro")))
                        .flavorText("The first step into a larger, more terrible universe.")
                        .build(),
                Achievement.builder("forbidden_scholar")
                        .title("Scholar of the Forbidden")
                        .description("Acquire knowledge of 5 different mythos entities")
                        .category(AchievementCategory.KNOWLEDGE)
                        .rarity(AchievementRarity.RARE)
                        .prerequisite("first_truth")
                        .criterion(AchievementCriteria.statThreshold("known_entities_count", GTE, 5))
                        .reward(new AchievementReward("Deep Understanding", "Profound cosmic insights",
                                List.of("advanced_lore"), Map.of("investigation_bonus", 0.15), null, null))
                        .cosmicSignificance("Understanding multiple cosmic entities fundamentally changes one's worldview")
                        .flavorText("To know them is to invite their attention.")
                        .build(),
                Achievement.builder("first_mystery")
                        .title("First Case")
                        .description("Complete your first investigation objective")
                        .category(AchievementCategory.INVESTIGATION)
                        .rarity(AchievementRarity.COMMON)
                        .criterion(AchievementCriteria.objectivesCompleted(1, ObjectiveType.INVESTIGATION.value()))
                        .reward(AchievementReward.of("Detective's Eye", "Enhanced observation skills"))
                        .flavorText("Every great investigator starts with a single case.")
                        .build(),
                Achievement.builder("master_detective")
                        .title("Master Detective")
                        .description("Complete 25 investigation objectives")
                        .category(AchievementCategory.INVESTIGATION)
                        .rarity(AchievementRarity.EPIC)
                        .prerequisite("first_mystery")
                        .criterion(AchievementCriteria.objectivesCompleted(25, ObjectiveType.INVESTIGATION.value()))
                        .reward(new AchievementReward("Investigative Mastery", "Superior deductive abilities",
                                null, Map.of("investigation_success_rate", 0.2), null, null))
                        .flavorText("The threads of mystery bend to your will.")
                        .build(),
                Achievement.builder("madness_embrace")
                        .title("Embrace of Madness")
                        .description("Continue playing while completely mad")
                        .category(AchievementCategory.HORROR)
                        .rarity(AchievementRarity.RARE)
                        .criterion(AchievementCriteria.sanityState(SanityState.MAD))
                        .reward(new AchievementReward("Mad Insight", "Wisdom through madness",
                                List.of("madness_mechanics"), Map.of("mad_action_success", 0.3), null, null))
                        .cosmicSignificance("Madness can be a doorway to impossible truths")
                        .flavorText("In madness, sometimes clarity is found.")
                        .build(),
                Achievement.builder("cosmic_witness")
                        .title("Witness to the Cosmos")
                        .description("Encounter 3 different cosmic entities")
                        .category(AchievementCategory.HORROR)
                        .rarity(AchievementRarity.LEGENDARY)
                        .criterion(AchievementCriteria.statThreshold("cosmic_encounters", GTE, 3))
                        .reward(new AchievementReward("Cosmic Awareness", "Understanding of the infinite",
                                List.of("cosmic_entities_compendium"), Map.of("cosmic_resistance", 0.25), null, null))
                        .cosmicSignificance("To witness the cosmic entities is to understand humanity's place in the universe")
                        .flavorText("You have looked upon the face of eternity.")
                        .build(),
                Achievement.builder("dedicated_investigator")
                        .title("Dedicated Investigator")
                        .description("Play for a total of 50 hours")
                        .category(AchievementCategory.META)
                        .rarity(AchievementRarity.UNCOMMON)
                        .criterion(AchievementCriteria.statThreshold("total_playtime_hours", GTE, 50))
                        .reward(new AchievementReward("Veteran Status", "Recognition of dedication",
                                null, null, List.of("veteran_title", "experience_badge"), null))
                        .flavorText("Dedication to the truth requires time and sacrifice.")
                        .build(),
                Achievement.builder("ultimate_survivor")
                        .title("Ultimate Survivor")
                        .description("Complete 10 different campaigns")
                        .category(AchievementCategory.META)
                        .rarity(AchievementRarity.LEGENDARY)
                        .criterion(AchievementCriteria.statThreshold("completed_campaigns", GTE, 10))
                        .reward(new AchievementReward("Master Survivor", "Legendary status among investigators",
                                List.of("master_difficulty", "legendary_scenarios"), Map.of("all_skills", 0.1), null, null))
                        .cosmicSignificance("To survive so many encounters with the unknown marks you as extraordinary")
                        .flavorText("You have walked through hell and emerged scarred but whole.")
                        .build(),
                Achievement.builder("fourth_wall")
                        .title("Beyond the Fourth Wall")
                        .description("Discover the true nature of your reality")
                        .category(AchievementCategory.SECRET)
                        .rarity(AchievementRarity.COSMIC)
                        .criterion(AchievementCriteria.eventOccurred("meta_realization"))
                        .reward(new AchievementReward("True Sight", "See beyond the veil of reality",
                                List.of("meta_content", "reality_mechanics"), null, null, null))
                        .hidden(true)
                        .cosmicSignificance("Some truths transcend even cosmic horror")
                        .flavorText("The greatest horror is realizing you are just a character in someone else's story.")
                        .build());
    }
}
