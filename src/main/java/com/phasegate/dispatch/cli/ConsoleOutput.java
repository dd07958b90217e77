package com.phasegate.dispatch.cli;

import com.phasegate.core.engine.OrchestrationResult;
import com.phasegate.core.engine.PhaseExecutionResult;
import com.phasegate.core.events.OrchestrationEvent;
import com.phasegate.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Phasegate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PHASEGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PHASEGATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agentOutput(String chunk) {
        System.out.print(CommandLine.Help.Ansi.AUTO.string("@|faint " + escape(chunk) + "|@"));
    }

    /**
     * Renders one orchestration event. Agent output chunks are only shown when verbose.
     */
    public static void event(OrchestrationEvent event, boolean verbose) {
        String message = escape(event.message());
        String prefix = switch (event.type()) {
            case ORCHESTRATION_START -> "@|bold,fg(cyan) [RUN]|@";
            case PHASE_START -> "@|bold,fg(yellow) [PHASE " + event.phaseNumber() + "]|@";
            case PHASE_COMPLETE -> "@|fg(green),bold [PHASE " + event.phaseNumber() + " COMPLETE]|@";
            case PHASE_FAILED -> "@|fg(red),bold [PHASE " + event.phaseNumber() + " FAILED]|@";
            case TASK_START -> "  @|fg(blue) [TASK " + event.taskId() + "]|@";
            case TASK_PROGRESS -> null;
            case TASK_RETRY -> "  @|fg(yellow) [RETRY " + event.taskId() + "]|@";
            case TASK_COMPLETE -> "  @|fg(green) [DONE " + event.taskId() + "]|@";
            case TASK_FAILED -> "  @|fg(red) [FAILED " + event.taskId() + "]|@";
            case ORCHESTRATION_COMPLETE -> "@|bold,fg(cyan) [RUN]|@";
            case ORCHESTRATION_ABORTED -> "@|fg(red),bold [ABORTED]|@";
        };
        if (prefix == null) {
            if (verbose && "validate".equals(event.payload().get("stage"))) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|faint " + message + "|@"));
            } else if (verbose) {
                agentOutput(event.message());
            }
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + message));
    }

    public static void runSummary(OrchestrationResult result) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + result.runId() + "|@"));
        for (PhaseExecutionResult phase : result.phaseResults()) {
            String status = phase.aborted() ? "@|fg(yellow) aborted|@"
                    : phase.success() ? "@|fg(green) complete|@" : "@|fg(red) failed|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  Phase " + phase.phaseNumber() + " " + escape(phase.phaseName()) + ": " + status
                    + " (" + phase.tasksCompleted() + " done, " + phase.tasksFailed() + " failed, "
                    + phase.tasksSkipped() + " skipped, " + formatDuration(phase.durationMs()) + ")"));
            phase.blockedTasks().forEach((taskId, blockers) -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(yellow) blocked|@ " + taskId + " by " + String.join(", ", blockers))));
            phase.issues().forEach(issue -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) " + issue.type().name().toLowerCase() + "|@ " + escape(issue.details()))));
        }
        for (String warning : result.warnings()) {
            warn(warning);
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Phases: @|fg(green) " + result.phasesCompleted() + " completed|@, @|fg(red) "
                + result.phasesFailed() + " failed|@" + (result.dryRun() ? " (dry run)" : "")));
        System.out.println("  Duration: " + formatDuration(result.durationMs()));
    }

    /**
     * Colored status markup, padded to a fixed width so tables line up.
     */
    public static String statusLabel(TaskStatus status) {
        String text = String.format("%-12s", status.name().toLowerCase().replace('_', ' '));
        return switch (status) {
            case PENDING -> "@|faint " + text + "|@";
            case IN_PROGRESS -> "@|fg(cyan) " + text + "|@";
            case COMPLETE -> "@|fg(green) " + text + "|@";
            case FAILED -> "@|fg(red) " + text + "|@";
            case SKIPPED -> "@|fg(yellow) " + text + "|@";
        };
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    // Agent output may contain picocli markup
    private static String escape(String text) {
        return text == null ? "" : text.replace("@|", "@ |");
    }
}
