package com.phasegate.dispatch.cli;

import com.phasegate.core.engine.ExecutionService;
import com.phasegate.core.errors.PhasegateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: phasegate retry &lt;task-id&gt;
 */
@Command(name = "retry", mixinStandardHelpOptions = true, description = "Reset a failed task so it runs again")
@Component
public class RetryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID, e.g. 2.3")
    private String taskId;

    private final ExecutionService executionService;

    public RetryCommand(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @Override
    public Integer call() {
        try {
            executionService.retryTask(taskId);
        } catch (PhasegateException e) {
            ConsoleOutput.error("Cannot retry task " + taskId + ": " + e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Task " + taskId + " reset to pending.");
        ConsoleOutput.info("Continue with: phasegate resume");
        return 0;
    }
}
