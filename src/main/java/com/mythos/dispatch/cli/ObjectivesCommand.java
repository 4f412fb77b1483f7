package com.mythos.dispatch.cli;

import com.mythos.core.manager.ObjectiveManager;
import com.mythos.core.model.ObjectiveScope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Map;

/**
 * CLI command: mythos objectives &lt;file&gt;
 * <p>
 * Loads a saved objective file and lists its objectives with their statistics.
 */
@Command(name = "objectives", mixinStandardHelpOptions = true, description = "Show objectives from a saved file")
@Component
public class ObjectivesCommand implements Runnable {

    @Parameters(index = "0", description = "Saved objective file")
    private Path file;

    @Option(names = {"--scope", "-s"}, description = "Only list objectives of this scope: ${COMPLETION-CANDIDATES}")
    private ObjectiveScope scope;

    private final ObjectiveManager manager;

    public ObjectivesCommand(ObjectiveManager manager) {
        this.manager = manager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (!manager.loadFromFile(file)) {
            ConsoleOutput.error("Could not load objectives from " + file);
            return;
        }

        var objectives = scope == null ? manager.getAllObjectives() : manager.getObjectivesByScope(scope);
        if (objectives.isEmpty()) {
            ConsoleOutput.info("No objectives found.");
        } else {
            System.out.println();
            ConsoleOutput.objectiveHeader();
            objectives.forEach(ConsoleOutput::objective);
        }

        System.out.println();
        for (Map.Entry<String, Long> stat : manager.getStatistics().entrySet()) {
            ConsoleOutput.info(stat.getKey() + ": " + stat.getValue());
        }
    }
}
