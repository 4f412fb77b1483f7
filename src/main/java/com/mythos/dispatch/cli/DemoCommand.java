package com.mythos.dispatch.cli;

import com.mythos.core.achievement.Achievement;
import com.mythos.core.achievement.AchievementManager;
import com.mythos.core.ai.AiObjectiveCoordinator;
import com.mythos.core.catalog.ObjectiveCatalog;
import com.mythos.core.manager.ObjectiveManager;
import com.mythos.core.model.ObjectiveStatus;
import com.mythos.core.model.ObjectiveSuggestion;
import com.mythos.core.model.UpdateReport;
import com.mythos.core.objective.Objective;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: mythos demo
 * <p>
 * Plays a short scripted library scene: two objectives are created, driven for a few turns,
 * achievements are evaluated against the outcome and follow-up objectives are suggested.
 */
@Command(name = "demo", mixinStandardHelpOptions = true, description = "Play a short scripted scene")
@Component
public class DemoCommand implements Runnable {

    @Option(names = {"--save"}, description = "Write the final objective state to this file")
    private Path saveFile;

    @Option(names = {"--achievements-file"}, description = "Write unlocked achievements to this file")
    private Path achievementsFile;

    @Option(names = {"--implement"}, description = "Turn the best suggestion into an objective")
    private boolean implement;

    private final ObjectiveManager manager;
    private final ObjectiveCatalog catalog;
    private final AchievementManager achievements;
    private final AiObjectiveCoordinator coordinator;

    public DemoCommand(ObjectiveManager manager, ObjectiveCatalog catalog,
                       AchievementManager achievements, AiObjectiveCoordinator coordinator) {
        this.manager = manager;
        this.catalog = catalog;
        this.achievements = achievements;
        this.coordinator = coordinator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        manager.addObjective(catalog.investigation("library_search", "Search the Library", "library",
                List.of("old_diary", "strange_symbol"), Map.of()));
        manager.addObjective(catalog.social("question_librarian", "Question the Librarian", "Librarian",
                null, Map.of()));

        Map<String, Object> state = new HashMap<>();
        state.put("current_location", "library");
        state.put("sanity", 72);
        state.put("npcs_present", List.of("Librarian"));
        state.put("story_phase", "investigation");
        state.put("tension_level", 2);

        List<Map<String, Object>> script = List.of(
                Map.of(),
                Map.of("discovery", "old_diary", "action_type", "initiate_conversation"),
                Map.of("discovery", "strange_symbol", "action_type", "ask_questions"),
                Map.of("action_type", "conclude_conversation"));

        for (Map<String, Object> action : script) {
            UpdateReport report = manager.updateAllObjectives(state, action);
            ConsoleOutput.turn(manager.getTurn(), report);
        }

        System.out.println();
        ConsoleOutput.objectiveHeader();
        manager.getAllObjectives().forEach(ConsoleOutput::objective);

        List<Achievement> unlocked = achievements.checkAllAchievements(gameData(), playerStats(state));
        System.out.println();
        if (unlocked.isEmpty()) {
            ConsoleOutput.info("No achievements unlocked");
        } else {
            unlocked.forEach(a -> ConsoleOutput.success("Achievement unlocked: " + a.getTitle()));
        }

        List<ObjectiveSuggestion> suggestions = manager.suggestNewObjectives(state);
        System.out.println();
        ConsoleOutput.info("Suggested next objectives:");
        suggestions.forEach(ConsoleOutput::suggestion);

        if (implement && !suggestions.isEmpty()) {
            coordinator.implementSuggestion(suggestions.get(0), manager).ifPresentOrElse(
                    o -> ConsoleOutput.success("Created objective " + o.getObjectiveId()),
                    () -> ConsoleOutput.error("Could not create an objective from the suggestion"));
        }

        if (saveFile != null) {
            report(manager.saveToFile(saveFile), "Objectives saved to " + saveFile);
        }
        if (achievementsFile != null) {
            report(achievements.saveToFile(achievementsFile), "Achievements saved to " + achievementsFile);
        }
    }

    private Map<String, Object> gameData() {
        List<Map<String, Object>> completed = new ArrayList<>();
        for (Objective objective : manager.getObjectivesByStatus(ObjectiveStatus.COMPLETED)) {
            completed.add(Map.of("objective_id", objective.getObjectiveId(),
                    "objective_type", objective.getObjectiveType().value()));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("completed_objectives", completed);
        data.put("events", List.of());
        return data;
    }

    private static Map<String, Object> playerStats(Map<String, Object> state) {
        return Map.of("session_min_sanity", state.get("sanity"), "cosmic_knowledge_count", 0);
    }

    private static void report(boolean ok, String message) {
        if (ok) {
            ConsoleOutput.success(message);
        } else {
            ConsoleOutput.error("Failed: " + message);
        }
    }
}
