package com.mythos.core.ai;

import com.mythos.core.catalog.ObjectiveTypes;
import com.mythos.core.model.ObjectivePriority;
import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveSuggestion;
import com.mythos.core.model.ObjectiveType;
import com.mythos.core.objective.Objective;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Proposes objectives from narrative pacing, the player profile and gaps in the active set.
 *
 * <p>Candidates are gathered in that order, then filtered by minimum confidence, de-duplicated by
 * title (first wins), sorted by descending confidence and truncated.
 */
public class ObjectiveSuggestionGenerator {

    /** Types a balanced session should always have one of, in fill order. */
    static final List<ObjectiveType> ESSENTIAL_TYPES = List.of(
            ObjectiveType.INVESTIGATION,
            ObjectiveType.EXPLORATION,
            ObjectiveType.SOCIAL,
            ObjectiveType.SURVIVAL);

    private static final Set<String> INFORMATION_PHASES = Set.of("investigation", "discovery");

    private final AiProperties properties;

    public ObjectiveSuggestionGenerator(AiProperties properties) {
        this.properties = properties;
    }

    /**
     * @param analysis current player profile, or null when none has been computed yet
     */
    public List<ObjectiveSuggestion> generate(GameContext context, List<Objective> currentObjectives,
                                              PlayerAnalysis analysis, int limit) {
        List<Objective> current = currentObjectives == null ? List.of() : currentObjectives;
        List<ObjectiveSuggestion> candidates = new ArrayList<>();

        storyDriven(context).forEach(s -> s.ifPresent(candidates::add));
        playerDriven(context, current, analysis).forEach(s -> s.ifPresent(candidates::add));
        for (ObjectiveType missing : missingTypes(current)) {
            contextual(missing, context).ifPresent(candidates::add);
        }

        Map<String, ObjectiveSuggestion> byTitle = new LinkedHashMap<>();
        for (ObjectiveSuggestion candidate : candidates) {
            if (candidate.confidence() >= properties.getMinConfidence()) {
                byTitle.putIfAbsent(candidate.title(), candidate);
            }
        }

        int cap = Math.max(0, Math.min(limit, properties.getMaxSuggestions()));
        return byTitle.values().stream()
                .sorted(Comparator.comparingDouble(ObjectiveSuggestion::confidence).reversed())
                .limit(cap)
                .toList();
    }

    List<ObjectiveType> missingTypes(List<Objective> current) {
        Set<ObjectiveType> present = new LinkedHashSet<>();
        for (Objective objective : current) {
            if (objective.isActive()) {
                present.add(objective.getObjectiveType());
            }
        }
        return ESSENTIAL_TYPES.stream().filter(t -> !present.contains(t)).toList();
    }

    private List<Optional<ObjectiveSuggestion>> storyDriven(GameContext context) {
        List<Optional<ObjectiveSuggestion>> result = new ArrayList<>();
        if (context.tensionLevel() < 2) {
            result.add(Optional.of(tensionIncrease(context)));
        } else if (context.tensionLevel() > 4) {
            result.add(Optional.of(survival(context)));
        }
        if (INFORMATION_PHASES.contains(context.storyPhase())) {
            result.add(Optional.of(investigation(context)));
        }
        if (!context.npcsPresent().isEmpty() && !"action".equals(context.storyPhase())) {
            result.add(social(context));
        }
        return result;
    }

    private List<Optional<ObjectiveSuggestion>> playerDriven(GameContext context, List<Objective> current,
                                                             PlayerAnalysis analysis) {
        List<Optional<ObjectiveSuggestion>> result = new ArrayList<>();
        if (analysis == null) {
            return result;
        }
        for (String need : analysis.adaptiveNeeds()) {
            switch (need) {
                case "easier_objectives" -> result.add(Optional.of(exploration()));
                case "social_prompts" -> result.add(social(context));
                default -> { }
            }
        }
        boolean hasKnowledge = current.stream().anyMatch(o -> o.getObjectiveType() == ObjectiveType.KNOWLEDGE);
        if (analysis.primaryPattern() == PlayerBehaviorPattern.INVESTIGATIVE && !hasKnowledge) {
            result.add(Optional.of(knowledge()));
        }
        return result;
    }

    private Optional<ObjectiveSuggestion> contextual(ObjectiveType type, GameContext context) {
        return switch (type) {
            case INVESTIGATION -> Optional.of(investigation(context));
            case EXPLORATION -> Optional.of(exploration());
            case SOCIAL -> social(context);
            case SURVIVAL -> Optional.of(survival(context));
            default -> Optional.empty();
        };
    }

    private ObjectiveSuggestion tensionIncrease(GameContext context) {
        return new ObjectiveSuggestion(
                ObjectiveTypes.SHORT_TERM,
                "Investigate Disturbing Sounds",
                "Strange noises coming from nearby demand investigation",
                ObjectiveType.INVESTIGATION,
                ObjectiveScope.SHORT_TERM,
                ObjectivePriority.MEDIUM,
                10,
                0.8,
                "Story needs tension increase",
                List.of("low_tension", "story_pacing"),
                Map.of("tension_ramp_enabled", true,
                        "initial_tension", context.tensionLevel() + 1));
    }

    private ObjectiveSuggestion investigation(GameContext context) {
        String location = context.locationType();
        return new ObjectiveSuggestion(
                ObjectiveTypes.SHORT_TERM,
                "Examine " + location,
                "Carefully investigate the " + location + " for clues",
                ObjectiveType.INVESTIGATION,
                ObjectiveScope.SHORT_TERM,
                ObjectivePriority.MEDIUM,
                15,
                0.7,
                "Investigation needed for story progression",
                List.of("location_type", "story_phase"),
                Map.of("required_discoveries", List.of("examine_" + location, "find_clue"),
                        "milestone_count", 2));
    }

    private Optional<ObjectiveSuggestion> social(GameContext context) {
        if (context.npcsPresent().isEmpty()) {
            return Optional.empty();
        }
        String npc = context.npcsPresent().get(0);
        return Optional.of(new ObjectiveSuggestion(
                ObjectiveTypes.IMMEDIATE,
                "Speak with " + npc,
                "Engage " + npc + " in conversation to gather information",
                ObjectiveType.SOCIAL,
                ObjectiveScope.IMMEDIATE,
                ObjectivePriority.MEDIUM,
                5,
                0.8,
                "NPC available for interaction",
                List.of("npcs_present", "social_opportunity"),
                Map.of("required_actions", List.of("initiate_conversation", "ask_questions", "conclude_conversation"),
                        "metadata", Map.of("npc_name", npc))));
    }

    private ObjectiveSuggestion exploration() {
        return new ObjectiveSuggestion(
                ObjectiveTypes.SHORT_TERM,
                "Explore Nearby Areas",
                "Survey the surrounding area for points of interest",
                ObjectiveType.EXPLORATION,
                ObjectiveScope.SHORT_TERM,
                ObjectivePriority.LOW,
                12,
                0.6,
                "Exploration provides context and opportunities",
                List.of("location_context", "exploration_opportunities"),
                Map.of("required_discoveries", List.of("survey_area", "identify_landmarks", "note_features"),
                        "milestone_count", 3));
    }

    private ObjectiveSuggestion survival(GameContext context) {
        return new ObjectiveSuggestion(
                ObjectiveTypes.SHORT_TERM,
                "Ensure Safety",
                "Take measures to ensure your continued safety",
                ObjectiveType.SURVIVAL,
                ObjectiveScope.SHORT_TERM,
                ObjectivePriority.HIGH,
                8,
                0.9,
                "Survival is always a priority in cosmic horror",
                List.of("threat_level", "safety_concerns"),
                Map.of("tension_ramp_enabled", true,
                        "initial_tension", Math.max(1, context.threatLevel()),
                        "max_tension", 5));
    }

    private ObjectiveSuggestion knowledge() {
        return new ObjectiveSuggestion(
                ObjectiveTypes.MID_TERM,
                "Uncover Hidden Knowledge",
                "Seek out forbidden knowledge related to current events",
                ObjectiveType.KNOWLEDGE,
                ObjectiveScope.MID_TERM,
                ObjectivePriority.MEDIUM,
                30,
                0.7,
                "Knowledge objectives satisfy investigative players",
                List.of("cosmic_exposure", "knowledge_opportunities"),
                Map.of("horror_revelations", List.of("initial_truth", "deeper_understanding"),
                        "san_risk_level", 3));
    }
}
