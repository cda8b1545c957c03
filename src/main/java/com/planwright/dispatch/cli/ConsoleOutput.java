package com.planwright.dispatch.cli;

import com.planwright.core.events.PlanEvent;
import com.planwright.core.model.StatusSnapshot;
import com.planwright.core.model.Task;
import com.planwright.core.model.TaskStatus;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Planwright CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) PLANWRIGHT|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [PLANWRIGHT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static void event(PlanEvent event) {
        String prefix = switch (event.type()) {
            case RUN_STARTED, RUN_PAUSED, RUN_RESUMED, BATCH_RESIZED -> "@|fg(cyan) [RUN]|@";
            case RUN_COMPLETED -> "@|bold,fg(green) [RUN]|@";
            case TASK_STARTED -> "@|fg(blue) [TASK]|@";
            case TASK_COMPLETED -> "@|fg(green) [TASK]|@";
            case TASK_FAILED, TASK_STUCK -> "@|fg(red) [TASK]|@";
            case TASK_RETRYING, TASK_SKIPPED, TASK_RESET, TASK_RECOVERED -> "@|fg(yellow) [TASK]|@";
            case PHASE_COMPLETED -> "@|bold,fg(yellow) [PHASE]|@";
            case CONSTRAINT_APPLIED, DEPENDENCY_OVERRIDDEN, POLICY_APPLIED -> "@|fg(magenta) [SCHED]|@";
            case PLAN_INITIALIZED -> "@|fg(cyan) [PLAN]|@";
            case PLAN_RESTORED -> "@|fg(yellow) [PLAN]|@";
        };
        var subject = event.taskId() != null ? event.taskId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " #" + event.id() + " " + event.type().wireName() + " " + subject + brief(event.payload())));
    }

    public static void taskTable(StatusSnapshot snapshot) {
        System.out.printf("  %-8s %-12s %-7s %-6s %s%n", "TASK", "STATUS", "RETRY", "PHASE", "DESCRIPTION");
        System.out.println("  " + "-".repeat(68));
        for (Task t : snapshot.tasks().values()) {
            String status = switch (t.status()) {
                case COMPLETED -> "@|fg(green) " + pad(t.status().wireName()) + "|@";
                case FAILED -> "@|fg(red) " + pad(t.status().wireName()) + "|@";
                case IN_PROGRESS -> "@|fg(blue) " + pad(t.status().wireName()) + "|@";
                case SKIPPED -> "@|fg(yellow) " + pad(t.status().wireName()) + "|@";
                default -> pad(t.status().wireName());
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-8s %s %-7d %-6s %s",
                    t.id(), status, t.retryCount(), t.phase(), truncate(t.description(), 40))));
            if (t.lastError() != null && t.status() != TaskStatus.COMPLETED) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "           @|fg(red) " + truncate(t.lastError(), 60) + "|@"));
            }
        }
    }

    public static void summary(Map<String, Long> summary) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  Tasks: %d total, @|fg(green) %d completed|@, @|fg(red) %d failed|@, %d skipped, %d pending, %d in progress",
                summary.getOrDefault("total", 0L), summary.getOrDefault("completed", 0L),
                summary.getOrDefault("failed", 0L), summary.getOrDefault("skipped", 0L),
                summary.getOrDefault("pending", 0L), summary.getOrDefault("in_progress", 0L))));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String brief(Map<String, Object> payload) {
        if (payload.isEmpty()) {
            return "";
        }
        var text = payload.toString();
        return truncate(text, 120);
    }

    private static String pad(String s) {
        return String.format("%-12s", s);
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
