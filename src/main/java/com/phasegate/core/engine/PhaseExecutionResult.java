package com.phasegate.core.engine;

import com.phasegate.core.model.TaskResult;
import com.phasegate.core.scheduler.DependencyIssue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running one implementation phase.
 *
 * @param phaseNumber    the phase
 * @param phaseName      phase name
 * @param success        no failed tasks, nothing left blocked and the run was not aborted
 * @param aborted        the run was aborted while this phase was executing
 * @param tasksCompleted tasks of the phase now COMPLETE
 * @param tasksFailed    tasks of the phase now FAILED
 * @param tasksSkipped   tasks SKIPPED plus pending tasks left blocked by an unsatisfied dependency
 * @param blockedTasks   blocked task ID to the dependencies blocking it, in execution order
 * @param issues         dependency graph problems that prevented the phase from running
 * @param results        results produced during this execution, in execution order
 * @param durationMs     wall time of the phase
 * @param branch         version-control branch the phase ran on, null when not available
 */
public record PhaseExecutionResult(
    int phaseNumber,
    String phaseName,
    boolean success,
    boolean aborted,
    int tasksCompleted,
    int tasksFailed,
    int tasksSkipped,
    Map<String, List<String>> blockedTasks,
    List<DependencyIssue> issues,
    List<TaskResult> results,
    long durationMs,
    String branch
) {

    public PhaseExecutionResult {
        blockedTasks = blockedTasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(blockedTasks));
        issues = issues == null ? List.of() : List.copyOf(issues);
        results = results == null ? List.of() : List.copyOf(results);
    }
}
