package com.phasegate.dispatch.cli;

import com.phasegate.core.engine.ExecutionService;
import com.phasegate.core.model.ImplementationPhase;
import com.phasegate.core.model.ProjectState;
import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskStatus;
import com.phasegate.core.phases.PlanImportPhase;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * CLI command: phasegate status
 * <p>
 * Shows the plan with per-task status, approvals and accumulated usage.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show plan and task status")
@Component
public class StatusCommand implements Runnable {

    private final ExecutionService executionService;

    public StatusCommand(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ProjectState state = executionService.status();

        System.out.println();
        System.out.println("PROJECT " + state.projectName());
        if (state.phases().isEmpty()) {
            ConsoleOutput.info("No plan imported yet. Start with: phasegate plan <file>");
            return;
        }
        ConsoleOutput.info("Current phase: " + state.currentImplPhase());
        if (!state.approvals().containsKey(PlanImportPhase.PLANNING_APPROVAL)) {
            ConsoleOutput.warn("Plan awaiting approval: phasegate approve planning");
        }

        for (ImplementationPhase phase : state.phases()) {
            long done = phase.tasks().stream().filter(t -> t.status() == TaskStatus.COMPLETE).count();
            boolean approved = state.approvals().containsKey(phase.approvalKey());
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold Phase " + phase.phaseNumber() + ": " + phase.name() + "|@ (" + done + "/"
                    + phase.tasks().size() + ")" + (approved ? " @|fg(green) approved|@" : "")));
            System.out.printf("  %-8s %-12s %s%n", "TASK", "STATUS", "DESCRIPTION");
            System.out.println("  " + "-".repeat(64));
            for (Task task : phase.tasks()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-8s %s %s",
                        task.id(), ConsoleOutput.statusLabel(task.status()), truncate(task.description(), 40))));
                if (task.failureReason() != null
                        && (task.status() == TaskStatus.FAILED || task.status() == TaskStatus.SKIPPED)) {
                    System.out.println("           " + truncate(task.failureReason(), 70));
                }
            }
        }

        System.out.println();
        if (state.totalTokens() > 0 || state.totalCostUsd() > 0) {
            ConsoleOutput.info(String.format("Usage: %d tokens, $%.2f", state.totalTokens(), state.totalCostUsd()));
        }
        if (executionService.isRunning()) {
            ConsoleOutput.info("A run is in progress.");
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
