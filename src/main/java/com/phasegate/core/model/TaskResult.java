package com.phasegate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one task attempt. Immutable once written; a retry appends a new
 * result rather than changing an earlier one.
 *
 * @param taskId             the task this result belongs to
 * @param taskDescription    task description at the time of execution
 * @param status             COMPLETE, FAILED or SKIPPED
 * @param summary            human-readable summary of the attempt
 * @param files              files the agent reported as changed
 * @param keyDecisions       design decisions the agent reported
 * @param assumptions        assumptions the agent reported
 * @param tests              test counts the agent reported
 * @param acceptanceCriteria per-criterion pass/fail as reported by the agent
 * @param validation         outcome of the secondary validation pass, null if not run
 * @param usage              token and cost usage of the attempt
 * @param failureReason      classified failure, null on success
 * @param failureDetail      specific failure message, null on success
 * @param commitHash         checkpoint commit for the task, if one was made
 * @param attempts           number of attempts made to reach this result
 * @param startedAt          start of the attempt
 * @param completedAt        end of the attempt
 * @param durationMs         wall time of the attempt
 * @param rawOutput          agent output, truncated to {@link #MAX_RAW_OUTPUT} characters
 */
public record TaskResult(
    String taskId,
    String taskDescription,
    TaskStatus status,
    String summary,
    FileChanges files,
    List<KeyDecision> keyDecisions,
    List<String> assumptions,
    TestCounts tests,
    List<CriterionResult> acceptanceCriteria,
    Validation validation,
    Usage usage,
    FailureReason failureReason,
    String failureDetail,
    String commitHash,
    int attempts,
    Instant startedAt,
    Instant completedAt,
    long durationMs,
    String rawOutput
) implements Serializable {

    public static final int MAX_RAW_OUTPUT = 10_000;

    public TaskResult {
        files = files == null ? FileChanges.empty() : files;
        keyDecisions = keyDecisions == null ? List.of() : List.copyOf(keyDecisions);
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        tests = tests == null ? TestCounts.NONE : tests;
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
        usage = usage == null ? Usage.NONE : usage;
        if (rawOutput != null && rawOutput.length() > MAX_RAW_OUTPUT) {
            rawOutput = rawOutput.substring(0, MAX_RAW_OUTPUT);
        }
    }

    /**
     * A failed attempt that produced nothing structured.
     */
    public static TaskResult failed(Task task, FailureReason reason, String detail,
                                    Instant startedAt, String rawOutput) {
        Instant now = Instant.now();
        return new TaskResult(task.id(), task.description(), TaskStatus.FAILED, detail,
                null, null, null, null, null, null, null,
                reason, detail, null, 1, startedAt, now,
                Math.max(0, now.toEpochMilli() - startedAt.toEpochMilli()), rawOutput);
    }

    /**
     * Result recorded when a user skips a task.
     */
    public static TaskResult skipped(Task task, String reason) {
        Instant now = Instant.now();
        return new TaskResult(task.id(), task.description(), TaskStatus.SKIPPED,
                "Skipped: " + reason, null, null, null, null, null, null, null,
                null, reason, null, 0, now, now, 0, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == TaskStatus.COMPLETE;
    }

    public TaskResult withAttempts(int count) {
        return new TaskResult(taskId, taskDescription, status, summary, files, keyDecisions,
                assumptions, tests, acceptanceCriteria, validation, usage, failureReason,
                failureDetail, commitHash, count, startedAt, completedAt, durationMs, rawOutput);
    }

    public TaskResult withCommitHash(String hash) {
        return new TaskResult(taskId, taskDescription, status, summary, files, keyDecisions,
                assumptions, tests, acceptanceCriteria, validation, usage, failureReason,
                failureDetail, hash, attempts, startedAt, completedAt, durationMs, rawOutput);
    }

    public TaskResult withValidation(Validation outcome) {
        return new TaskResult(taskId, taskDescription, status, summary, files, keyDecisions,
                assumptions, tests, acceptanceCriteria, outcome, usage, failureReason,
                failureDetail, commitHash, attempts, startedAt, completedAt, durationMs, rawOutput);
    }

    /**
     * Copy of this result marked as failed for the given reason.
     */
    public TaskResult asFailure(FailureReason reason, String detail) {
        return new TaskResult(taskId, taskDescription, TaskStatus.FAILED, summary, files, keyDecisions,
                assumptions, tests, acceptanceCriteria, validation, usage, reason,
                detail, commitHash, attempts, startedAt, completedAt, durationMs, rawOutput);
    }

    /**
     * @param created  paths created
     * @param modified paths modified
     * @param deleted  paths deleted
     */
    public record FileChanges(List<String> created, List<String> modified, List<String> deleted)
            implements Serializable {

        public FileChanges {
            created = created == null ? List.of() : List.copyOf(created);
            modified = modified == null ? List.of() : List.copyOf(modified);
            deleted = deleted == null ? List.of() : List.copyOf(deleted);
        }

        public static FileChanges empty() {
            return new FileChanges(List.of(), List.of(), List.of());
        }

        public int total() {
            return created.size() + modified.size() + deleted.size();
        }
    }

    public record KeyDecision(String decision, String rationale) implements Serializable {}

    public record TestCounts(int added, int passing, int failing) implements Serializable {
        public static final TestCounts NONE = new TestCounts(0, 0, 0);
    }

    /**
     * @param criterion the criterion text as reported
     * @param met       whether the agent reported it as met
     * @param notes     reason given by the agent, may be null
     */
    public record CriterionResult(String criterion, boolean met, String notes) implements Serializable {}

    public record Validation(boolean passed, String validatorOutput, int criteriaChecked, int criteriaPassed)
            implements Serializable {}

    public record Usage(long tokens, double costUsd) implements Serializable {
        public static final Usage NONE = new Usage(0, 0.0);
    }
}
