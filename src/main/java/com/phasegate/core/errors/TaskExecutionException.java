package com.phasegate.core.errors;

import com.phasegate.core.model.FailureReason;

import java.util.Map;

/**
 * A single task attempt could not produce a usable result. Recoverable by retry;
 * the task executor converts it into a failed result and never lets it escape.
 */
public class TaskExecutionException extends PhasegateException {

    private final FailureReason reason;

    public TaskExecutionException(FailureReason reason, String taskId, String message) {
        super(reason.code(), message, Map.of("taskId", taskId));
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }

    public static TaskExecutionException timeout(String taskId, long timeoutMs) {
        return new TaskExecutionException(FailureReason.TIMEOUT, taskId,
                "Task %s timed out after %d ms".formatted(taskId, timeoutMs));
    }

    public static TaskExecutionException executionFailed(String taskId, int exitCode, String error) {
        String detail = error == null || error.isBlank() ? "" : ": " + error.strip();
        return new TaskExecutionException(FailureReason.EXECUTION_FAILED, taskId,
                "Agent exited with code %d for task %s%s".formatted(exitCode, taskId, detail));
    }

    public static TaskExecutionException parseError(String taskId) {
        return new TaskExecutionException(FailureReason.PARSE_ERROR, taskId,
                "Output for task %s has no completion marker".formatted(taskId));
    }

    public static TaskExecutionException aborted(String taskId) {
        return new TaskExecutionException(FailureReason.ABORTED, taskId,
                "Task %s was aborted".formatted(taskId));
    }
}
