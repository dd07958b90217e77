package com.phasegate.dispatch.cli;

import com.phasegate.core.model.ImplementationPlan;
import com.phasegate.core.phases.PhaseOutcome;
import com.phasegate.core.phases.PhaseRunnerDriver;
import com.phasegate.core.phases.PlanImportPhase;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: phasegate plan &lt;file&gt;
 * <p>
 * Imports an implementation plan (JSON) into the project state. Running it needs
 * {@code phasegate approve planning} first.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Import an implementation plan")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan file (JSON)")
    private Path planFile;

    private final PhaseRunnerDriver driver;
    private final PlanImportPhase planImportPhase;

    public PlanCommand(PhaseRunnerDriver driver, PlanImportPhase planImportPhase) {
        this.driver = driver;
        this.planImportPhase = planImportPhase;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Importing plan " + planFile + "...");

        PhaseOutcome<ImplementationPlan> outcome = driver.run(planImportPhase, planFile);
        if (!outcome.success()) {
            ConsoleOutput.error("Plan import failed during " + outcome.failedStage() + ": " + outcome.error());
            return 1;
        }

        ImplementationPlan plan = outcome.data();
        for (ImplementationPlan.PlanPhase phase : plan.phases()) {
            System.out.printf("  Phase %d: %s (%d tasks)%n", phase.phaseNumber(), phase.name(), phase.tasks().size());
        }
        ConsoleOutput.success("Plan imported: " + plan.phases().size() + " phases, " + plan.taskCount() + " tasks.");
        ConsoleOutput.info("Review the plan, then: phasegate approve planning");
        return 0;
    }
}
