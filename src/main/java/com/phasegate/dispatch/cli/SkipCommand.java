package com.phasegate.dispatch.cli;

import com.phasegate.core.engine.ExecutionService;
import com.phasegate.core.errors.PhasegateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: phasegate skip &lt;task-id&gt; [--reason text]
 * <p>
 * A skipped task satisfies the tasks that depend on it.
 */
@Command(name = "skip", mixinStandardHelpOptions = true, description = "Skip a pending or failed task")
@Component
public class SkipCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID, e.g. 2.3")
    private String taskId;

    @Option(names = {"--reason", "-r"}, description = "Why the task is skipped (default: ${DEFAULT-VALUE})",
            defaultValue = "Skipped by user")
    private String reason;

    private final ExecutionService executionService;

    public SkipCommand(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @Override
    public Integer call() {
        try {
            executionService.skipTask(taskId, reason);
        } catch (PhasegateException e) {
            ConsoleOutput.error("Cannot skip task " + taskId + ": " + e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Task " + taskId + " skipped: " + reason);
        return 0;
    }
}
