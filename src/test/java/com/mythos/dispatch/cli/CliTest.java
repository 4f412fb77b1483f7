package com.mythos.dispatch.cli;

import com.mythos.core.achievement.AchievementManager;
import com.mythos.core.ai.AiObjectiveCoordinator;
import com.mythos.core.ai.AiProperties;
import com.mythos.core.catalog.ObjectiveCatalog;
import com.mythos.core.events.EventBus;
import com.mythos.core.llm.LlmProperties;
import com.mythos.core.llm.LlmService;
import com.mythos.core.manager.ObjectiveManager;
import com.mythos.core.manager.ObjectiveProperties;
import com.mythos.core.metrics.MythosMetrics;
import com.mythos.core.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Mythos CLI command structure.
 * Commands are wired by hand through a picocli factory, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private MutableClock clock;
    private MythosMetrics metrics;
    private AiObjectiveCoordinator coordinator;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T21:00:00Z");
        metrics = new MythosMetrics(new SimpleMeterRegistry());
        coordinator = new AiObjectiveCoordinator(new AiProperties(), new LlmProperties(), (LlmService) null,
                metrics, clock);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    /**
     * Each execution gets fresh managers, so state only carries over through files.
     */
    private CommandLine.IFactory createFactory() {
        EventBus eventBus = new EventBus();
        ObjectiveManager manager = new ObjectiveManager(new ObjectiveProperties(),
                ObjectiveCatalog.defaultRegistry(), eventBus, metrics, clock);
        manager.registerSuggestionSource(coordinator);
        AchievementManager achievements = new AchievementManager(eventBus, metrics, clock);
        ObjectiveCatalog catalog = new ObjectiveCatalog(clock);

        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == DemoCommand.class) {
                    return (K) new DemoCommand(manager, catalog, achievements, coordinator);
                }
                if (cls == ObjectivesCommand.class) {
                    return (K) new ObjectivesCommand(manager);
                }
                if (cls == AchievementsCommand.class) {
                    return (K) new AchievementsCommand(achievements);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new MythosCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("help and version")
    class HelpTests {

        @Test
        void topLevelHelpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("demo"));
            assertTrue(result.output().contains("objectives"));
            assertTrue(result.output().contains("achievements"));
        }

        @Test
        void versionIsPrinted() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Mythos 0.1.0"));
        }

        @Test
        void noSubcommandPrintsUsage() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("MYTHOS v0.1.0"));
            assertTrue(result.output().contains("Usage: mythos"));
        }

        @Test
        void objectivesRequiresAFile() {
            CliResult result = execute("objectives");

            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    @Nested
    @DisplayName("demo")
    class DemoTests {

        @Test
        void demoPlaysTheScene() {
            CliResult result = execute("demo");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[TURN 1]"));
            assertTrue(result.output().contains("[TURN 4]"));
            assertTrue(result.output().contains("library_search"));
            assertTrue(result.output().contains("question_librarian"));
            assertTrue(result.output().contains("Suggested next objectives:"));
        }

        @Test
        void savedStateCanBeListedAfterwards() {
            Path objectives = tempDir.resolve("objectives.json");
            Path achievements = tempDir.resolve("achievements.json");

            CliResult demo = execute("demo", "--save", objectives.toString(),
                    "--achievements-file", achievements.toString());
            assertEquals(0, demo.exitCode());
            assertTrue(Files.exists(objectives));
            assertTrue(Files.exists(achievements));

            CliResult listed = execute("objectives", objectives.toString());
            assertEquals(0, listed.exitCode());
            assertTrue(listed.output().contains("library_search"));
            assertTrue(listed.output().contains("objectives_created"));

            CliResult unlocked = execute("achievements", "--file", achievements.toString());
            assertEquals(0, unlocked.exitCode());
            assertTrue(unlocked.output().contains("Unlocked"));
            assertTrue(unlocked.output().contains("first_survival"));
        }

        @Test
        void implementTurnsASuggestionIntoAnObjective() {
            CliResult result = execute("demo", "--implement");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Created objective ai_generated_0"));
        }
    }

    @Nested
    @DisplayName("loading")
    class LoadingTests {

        @Test
        void missingObjectiveFileIsReported() {
            CliResult result = execute("objectives", tempDir.resolve("absent.json").toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Could not load objectives"));
        }

        @Test
        void achievementsWithoutFileListsEverything() {
            CliResult result = execute("achievements");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Unlocked 0 of"));
        }
    }
}
