package com.phasegate.dispatch.cli;

import com.phasegate.core.engine.ExecutionService;
import com.phasegate.core.errors.PhasegateException;
import com.phasegate.core.errors.StateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate approve planning|impl-N
 * <p>
 * Refused while the plan is missing, or while the phase still has pending or failed tasks.
 */
@Command(name = "approve", mixinStandardHelpOptions = true, description = "Approve the plan or an implementation phase")
@Component
public class ApproveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "What to approve: planning or impl-N")
    private String approval;

    private final ExecutionService executionService;

    public ApproveCommand(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @Override
    public Integer call() {
        try {
            executionService.approve(approval);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (PhasegateException e) {
            if (StateException.NOT_READY.equals(e.getCode())
                    && e.getContext().get("blockers") instanceof List<?> blockers) {
                ConsoleOutput.error(approval + " is not ready for approval:");
                blockers.forEach(b -> ConsoleOutput.warn("  - " + b));
            } else {
                ConsoleOutput.error("Cannot approve " + approval + ": " + e.getMessage());
            }
            return 1;
        }
        ConsoleOutput.success("Approved " + approval + ".");
        ConsoleOutput.info(approval.startsWith("impl-") ? "Continue with: phasegate resume" : "Start with: phasegate run");
        return 0;
    }
}
