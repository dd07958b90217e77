package com.phasegate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A single unit of work within an implementation phase, handed to the coding agent.
 *
 * @param id                 dotted identifier, unique across the plan (e.g. "2.3")
 * @param description        what the task should accomplish
 * @param acceptanceCriteria ordered criteria the agent must report on
 * @param dependsOn          IDs of tasks that must be complete or skipped first
 * @param status             current execution status
 * @param failureReason      why the task last failed or was skipped, null otherwise
 * @param startedAt          when the current or last attempt started
 * @param completedAt        when the task reached a terminal status
 * @param commitHash         checkpoint commit recorded for the task, if any
 */
public record Task(
    String id,
    String description,
    List<String> acceptanceCriteria,
    List<String> dependsOn,
    TaskStatus status,
    String failureReason,
    Instant startedAt,
    Instant completedAt,
    String commitHash
) implements Serializable {

    public Task {
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (status == null) {
            status = TaskStatus.PENDING;
        }
    }

    public static Task pending(String id, String description, List<String> acceptanceCriteria,
                               List<String> dependsOn) {
        return new Task(id, description, acceptanceCriteria, dependsOn,
                TaskStatus.PENDING, null, null, null, null);
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, description, acceptanceCriteria, dependsOn,
                newStatus, failureReason, startedAt, completedAt, commitHash);
    }

    public Task withFailureReason(String reason) {
        return new Task(id, description, acceptanceCriteria, dependsOn,
                status, reason, startedAt, completedAt, commitHash);
    }

    public Task withTimes(Instant started, Instant completed) {
        return new Task(id, description, acceptanceCriteria, dependsOn,
                status, failureReason, started, completed, commitHash);
    }

    public Task withCommitHash(String hash) {
        return new Task(id, description, acceptanceCriteria, dependsOn,
                status, failureReason, startedAt, completedAt, hash);
    }
}
