package com.abathur.dispatch.cli;

import com.abathur.core.model.ExecutionResult;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Abathur CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ABATHUR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ABATHUR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(TaskStatus status) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("Status: " + colored(status)));
    }

    public static void taskHeader() {
        System.out.printf("  %-38s %-20s %8s %5s  %s%n", "TASK", "STATUS", "PRIORITY", "DEPTH", "SUMMARY");
        System.out.println("  " + "-".repeat(96));
    }

    public static void taskRow(Task task) {
        System.out.printf("  %-38s %-20s %8.2f %5d  %s%n",
                task.id(), task.status(), task.calculatedPriority(), task.dependencyDepth(),
                truncate(task.summary(), 40));
    }

    public static void executionResult(ExecutionResult result) {
        String outcome = switch (result.outcome()) {
            case "success" -> "@|fg(green) DONE|@";
            case "cancelled" -> "@|fg(yellow) CANCELLED|@";
            default -> "@|fg(red) FAILED|@";
        };
        String detail = result.success() ? "" : " " + truncate(firstLine(result.error()), 60);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + outcome + " " + result.taskId() + " (" + formatDuration(result.elapsedMs()) + ")" + detail));
    }

    static String colored(TaskStatus status) {
        String color = switch (status) {
            case COMPLETED -> "fg(green)";
            case FAILED, CANCELLED -> "fg(red)";
            case RUNNING -> "fg(blue)";
            case READY -> "fg(cyan)";
            default -> "fg(yellow)";
        };
        return "@|" + color + " " + status + "|@";
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String firstLine(String s) {
        if (s == null) return null;
        int newline = s.indexOf('\n');
        return newline < 0 ? s : s.substring(0, newline);
    }
}
