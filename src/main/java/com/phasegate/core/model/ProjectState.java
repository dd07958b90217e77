package com.phasegate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted orchestration state of a project: the approved plan, task statuses,
 * recorded results, approvals and the current-phase pointer.
 *
 * @param projectName      display name of the project
 * @param phases           implementation phases in ascending phase-number order
 * @param currentImplPhase phase a resumed run starts from; 0 before a plan is loaded
 * @param approvals        approval key (e.g. "planning", "impl-2") to time of approval
 * @param results          task ID to its results, oldest first
 * @param totalTokens      tokens used across all recorded results
 * @param totalCostUsd     cost across all recorded results
 * @param updatedAt        time of the last successful save
 */
public record ProjectState(
    String projectName,
    List<ImplementationPhase> phases,
    int currentImplPhase,
    Map<String, Instant> approvals,
    Map<String, List<TaskResult>> results,
    long totalTokens,
    double totalCostUsd,
    Instant updatedAt
) implements Serializable {

    public ProjectState {
        phases = phases == null ? List.of() : List.copyOf(phases);
        approvals = approvals == null ? Map.of() : Map.copyOf(approvals);
        results = results == null ? Map.of() : Map.copyOf(results);
    }

    public static ProjectState empty(String projectName) {
        return new ProjectState(projectName, List.of(), 0, Map.of(), Map.of(), 0, 0.0, null);
    }
}
