package com.phasegate.dispatch.cli;

import com.phasegate.core.engine.ExecutionService;
import com.phasegate.core.engine.OrchestrationOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: phasegate resume
 * <p>
 * Continues execution from the current implementation phase recorded in the project state.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume from the current phase")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Option(names = {"--end", "-e"}, description = "Last phase to run")
    private Integer endPhase;

    @Option(names = "--continue-on-failure", description = "Keep going after a phase fails")
    private boolean continueOnFailure;

    @Option(names = {"--verbose", "-v"}, description = "Stream agent output")
    private boolean verbose;

    private final ExecutionService executionService;

    public ResumeCommand(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        OrchestrationOptions.Builder options = executionService.defaultOptions().endPhase(endPhase);
        if (continueOnFailure) {
            options.stopOnFailure(false);
        }
        return RunSupport.execute(executionService, options.build(), true, verbose);
    }
}
