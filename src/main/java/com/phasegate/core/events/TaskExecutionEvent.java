package com.phasegate.core.events;

import com.phasegate.core.model.TaskResult;

import java.time.Instant;

/**
 * Event emitted by a task executor while it drives a single task.
 *
 * @param type      event kind
 * @param taskId    the task being executed
 * @param attempt   1-based attempt number
 * @param message   human-readable description, or the output chunk for PROGRESS
 * @param result    the settled result for COMPLETE and FAILED, null otherwise
 * @param timestamp when the event was created
 */
public record TaskExecutionEvent(
    Type type,
    String taskId,
    int attempt,
    String message,
    TaskResult result,
    Instant timestamp
) {

    public enum Type {
        START,
        PROGRESS,
        VALIDATE,
        RETRY,
        COMPLETE,
        FAILED
    }

    public static TaskExecutionEvent of(Type type, String taskId, int attempt, String message) {
        return new TaskExecutionEvent(type, taskId, attempt, message, null, Instant.now());
    }

    public static TaskExecutionEvent settled(Type type, String taskId, int attempt, String message,
                                             TaskResult result) {
        return new TaskExecutionEvent(type, taskId, attempt, message, result, Instant.now());
    }
}
