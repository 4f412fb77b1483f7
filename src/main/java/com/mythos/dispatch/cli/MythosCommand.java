package com.mythos.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Mythos.
 * Routes to subcommands: demo, objectives, achievements.
 */
@Command(
        name = "mythos",
        mixinStandardHelpOptions = true,
        version = "Mythos 0.1.0",
        description = "Objective lifecycle orchestrator for cosmic-horror investigations",
        subcommands = {
                DemoCommand.class,
                ObjectivesCommand.class,
                AchievementsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MythosCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
