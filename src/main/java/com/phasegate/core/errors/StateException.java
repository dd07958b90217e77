package com.phasegate.core.errors;

import com.phasegate.core.model.TaskStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Illegal operation against project state. Surfaced to the caller as a user error, never retried.
 */
public class StateException extends PhasegateException {

    public static final String TASK_NOT_FOUND = "task_not_found";
    public static final String TASK_NOT_FAILED = "task_not_failed";
    public static final String INVALID_TRANSITION = "invalid_transition";
    public static final String DUPLICATE_TASK_ID = "duplicate_task_id";
    public static final String DUPLICATE_PHASE_NUMBER = "duplicate_phase_number";
    public static final String PHASE_NOT_FOUND = "phase_not_found";
    public static final String PERSISTENCE_FAILED = "persistence_failed";
    public static final String NOT_APPROVED = "not_approved";
    public static final String NOT_READY = "not_ready";

    public StateException(String code, String message, Map<String, Object> context) {
        super(code, message, context);
    }

    public StateException(String code, String message, Map<String, Object> context, Throwable cause) {
        super(code, message, context, cause);
    }

    public static StateException taskNotFound(String taskId) {
        return new StateException(TASK_NOT_FOUND, "Task not found: " + taskId, Map.of("taskId", taskId));
    }

    public static StateException taskNotFailed(String taskId, TaskStatus status) {
        return new StateException(TASK_NOT_FAILED,
                "Task %s is %s, only failed tasks can be retried".formatted(taskId, status),
                Map.of("taskId", taskId, "status", status.name()));
    }

    public static StateException invalidTransition(String taskId, TaskStatus from, TaskStatus to) {
        return new StateException(INVALID_TRANSITION,
                "Task %s cannot move from %s to %s".formatted(taskId, from, to),
                Map.of("taskId", taskId, "from", from.name(), "to", to.name()));
    }

    public static StateException duplicateTaskId(String taskId) {
        return new StateException(DUPLICATE_TASK_ID, "Duplicate task ID in plan: " + taskId,
                Map.of("taskId", taskId));
    }

    public static StateException duplicatePhaseNumber(int phaseNumber) {
        return new StateException(DUPLICATE_PHASE_NUMBER, "Duplicate phase number in plan: " + phaseNumber,
                Map.of("phase", phaseNumber));
    }

    public static StateException phaseNotFound(int phaseNumber) {
        return new StateException(PHASE_NOT_FOUND, "Implementation phase not found: " + phaseNumber,
                Map.of("phase", phaseNumber));
    }

    public static StateException persistenceFailed(Path path, Throwable cause) {
        return new StateException(PERSISTENCE_FAILED, "Failed to persist project state to " + path,
                Map.of("path", path.toString()), cause);
    }

    public static StateException notApproved(String approvalKey) {
        return new StateException(NOT_APPROVED,
                "'%s' is not approved yet, approve it before running".formatted(approvalKey),
                Map.of("approval", approvalKey));
    }

    public static StateException notReady(String approvalKey, List<String> blockers) {
        return new StateException(NOT_READY,
                "%s is not ready for approval: %s".formatted(approvalKey, String.join("; ", blockers)),
                Map.of("approval", approvalKey, "blockers", List.copyOf(blockers)));
    }
}
