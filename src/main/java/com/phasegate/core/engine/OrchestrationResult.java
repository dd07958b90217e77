package com.phasegate.core.engine;

import java.util.List;

/**
 * Outcome of an orchestration run.
 *
 * @param runId           identifier of the run
 * @param success         no phase failed and the run was not aborted
 * @param aborted         the run was aborted
 * @param dryRun          the run was a dry run
 * @param phasesCompleted phases that completed (all phases in scope for a dry run)
 * @param phasesFailed    phases that failed
 * @param phaseResults    results of the phases actually executed
 * @param warnings        conditions worth showing the user, such as an empty scope
 * @param durationMs      wall time of the run
 */
public record OrchestrationResult(
    String runId,
    boolean success,
    boolean aborted,
    boolean dryRun,
    int phasesCompleted,
    int phasesFailed,
    List<PhaseExecutionResult> phaseResults,
    List<String> warnings,
    long durationMs
) {

    public OrchestrationResult {
        phaseResults = phaseResults == null ? List.of() : List.copyOf(phaseResults);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String status() {
        if (aborted) {
            return "aborted";
        }
        return success ? "completed" : "failed";
    }
}
