package com.mythos.dispatch.cli;

import com.mythos.core.achievement.Achievement;
import com.mythos.core.model.ObjectiveSuggestion;
import com.mythos.core.model.UpdateReport;
import com.mythos.core.objective.Objective;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Mythos CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) MYTHOS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MYTHOS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void turn(long turn, UpdateReport report) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [TURN " + turn + "]|@" + (report.isEmpty() ? " nothing changed" : "")));
        line("activated", "fg(cyan)", report.activated());
        line("updated", "fg(blue)", report.updated());
        line("completed", "fg(green)", report.completed());
        line("failed", "fg(red)", report.failed());
        line("expired", "fg(magenta)", report.expired());
    }

    private static void line(String label, String style, List<String> ids) {
        if (!ids.isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|" + style + " " + label + "|@ " + String.join(", ", ids)));
        }
    }

    public static void objectiveHeader() {
        System.out.printf("  %-24s %-11s %-13s %-9s %-8s %s%n",
                "OBJECTIVE", "SCOPE", "STATUS", "PRIORITY", "PROGRESS", "TITLE");
        System.out.println("  " + "-".repeat(86));
    }

    public static void objective(Objective objective) {
        System.out.printf("  %-24s %-11s %-13s %-9s %7.0f%% %s%n",
                truncate(objective.getObjectiveId(), 24),
                objective.getScope().value(),
                objective.getStatus().value(),
                objective.getPriority().name(),
                objective.getProgress() * 100,
                truncate(objective.getTitle(), 30));
    }

    public static void suggestion(ObjectiveSuggestion suggestion) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|fg(yellow) [%.0f%%]|@ %s (%s, ~%d min) - %s",
                suggestion.confidence() * 100, suggestion.title(), suggestion.scope().value(),
                suggestion.estimatedMinutes(), suggestion.reasoning())));
    }

    public static void achievement(Achievement achievement) {
        String mark = achievement.isUnlocked() ? "@|fg(green) *|@" : "@|faint -|@";
        String title = achievement.isHidden() && !achievement.isUnlocked() ? "???" : achievement.getTitle();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %s %-22s %-10s %s", mark, achievement.getAchievementId(),
                achievement.getRarity().label(), title)));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
