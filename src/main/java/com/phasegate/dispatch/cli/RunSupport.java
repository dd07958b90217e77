package com.phasegate.dispatch.cli;

import com.phasegate.core.engine.ExecutionService;
import com.phasegate.core.engine.OrchestrationOptions;
import com.phasegate.core.engine.OrchestrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared execution path of {@code run} and {@code resume}: streams events to the console,
 * aborts the run when the JVM is asked to stop and maps the outcome to an exit code.
 */
final class RunSupport {

    private static final Logger log = LoggerFactory.getLogger(RunSupport.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_ABORTED = 130;

    private RunSupport() {
    }

    static int execute(ExecutionService service, OrchestrationOptions options, boolean resume, boolean verbose) {
        Thread hook = new Thread(() -> {
            if (service.abort()) {
                log.info("Shutdown requested, aborting active run");
            }
        }, "phasegate-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        OrchestrationResult result;
        try {
            result = resume
                    ? service.resume(options, e -> ConsoleOutput.event(e, verbose))
                    : service.run(options, e -> ConsoleOutput.event(e, verbose));
        } catch (Exception e) {
            ConsoleOutput.error((resume ? "Resume" : "Run") + " failed: " + ConsoleOutput.rootCauseMessage(e));
            return EXIT_FAILED;
        } finally {
            removeHook(hook);
        }

        ConsoleOutput.runSummary(result);
        if (result.aborted()) {
            ConsoleOutput.warn("Run aborted. Continue with: phasegate resume");
            return EXIT_ABORTED;
        }
        if (!result.success()) {
            ConsoleOutput.error("Run failed. Fix or skip the failed tasks, then: phasegate resume");
            return EXIT_FAILED;
        }
        ConsoleOutput.success(result.dryRun() ? "Dry run complete." : "Run complete.");
        return 0;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
    }
}
