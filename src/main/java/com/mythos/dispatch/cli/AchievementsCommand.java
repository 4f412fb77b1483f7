package com.mythos.dispatch.cli;

import com.mythos.core.achievement.AchievementManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * CLI command: mythos achievements [--file &lt;file&gt;]
 * <p>
 * Lists every achievement, marking the ones unlocked in the given save file.
 */
@Command(name = "achievements", mixinStandardHelpOptions = true, description = "List achievements")
@Component
public class AchievementsCommand implements Runnable {

    @Option(names = {"--file", "-f"}, description = "Saved achievement file")
    private Path file;

    private final AchievementManager achievements;

    public AchievementsCommand(AchievementManager achievements) {
        this.achievements = achievements;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (file != null && !achievements.loadFromFile(file)) {
            ConsoleOutput.error("Could not load achievements from " + file);
            return;
        }

        System.out.println();
        achievements.getAllAchievements().forEach(ConsoleOutput::achievement);
        System.out.println();
        ConsoleOutput.info(String.format("Unlocked %d of %d (%.0f%%)",
                achievements.getUnlockedIds().size(), achievements.getAllAchievements().size(),
                achievements.getCompletionPercentage()));
        achievements.getRarestUnlocked().ifPresent(a ->
                ConsoleOutput.info("Rarest: " + a.getTitle() + " (" + a.getRarity().label() + ")"));
    }
}
