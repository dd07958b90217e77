package com.phasegate.dispatch.cli;

import com.phasegate.core.engine.ExecutionService;
import com.phasegate.core.engine.OrchestrationOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate run [--start N] [--end N] [--dry-run]
 * <p>
 * Executes the implementation phases of the current plan with the coding agent.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute implementation phases")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--start", "-s"}, description = "First phase to run")
    private Integer startPhase;

    @Option(names = {"--end", "-e"}, description = "Last phase to run")
    private Integer endPhase;

    @Option(names = "--dry-run", description = "Show what would run without executing tasks")
    private boolean dryRun;

    @Option(names = "--continue-on-failure", description = "Keep going after a phase fails")
    private boolean continueOnFailure;

    @Option(names = "--max-retries", description = "Retries per task after the first attempt")
    private Integer maxRetries;

    @Option(names = "--timeout-minutes", description = "Time limit per agent invocation")
    private Integer timeoutMinutes;

    @Option(names = "--no-validate", description = "Skip the validation pass on task output")
    private boolean noValidate;

    @Option(names = {"--verbose", "-v"}, description = "Stream agent output")
    private boolean verbose;

    private final ExecutionService executionService;

    public RunCommand(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (startPhase != null && endPhase != null && startPhase > endPhase) {
            ConsoleOutput.error("--start must not be greater than --end");
            return RunSupport.EXIT_FAILED;
        }

        OrchestrationOptions.Builder options = executionService.defaultOptions()
                .startPhase(startPhase)
                .endPhase(endPhase)
                .dryRun(dryRun);
        if (continueOnFailure) {
            options.stopOnFailure(false);
        }
        if (maxRetries != null) {
            options.maxRetries(maxRetries);
        }
        if (timeoutMinutes != null) {
            options.taskTimeout(Duration.ofMinutes(timeoutMinutes));
        }
        if (noValidate) {
            options.validateResults(false);
        }
        return RunSupport.execute(executionService, options.build(), false, verbose);
    }
}
