package com.phasegate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Phasegate.
 * Routes to subcommands: plan, approve, run, resume, retry, skip, status.
 */
@Command(
        name = "phasegate",
        mixinStandardHelpOptions = true,
        version = "Phasegate 0.1.0",
        description = "Phase-gated task orchestration for coding agents",
        subcommands = {
                PlanCommand.class,
                ApproveCommand.class,
                RunCommand.class,
                ResumeCommand.class,
                RetryCommand.class,
                SkipCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PhasegateCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
