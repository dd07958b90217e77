package com.phasegate.core.errors;

import com.phasegate.core.model.FailureReason;

import java.util.List;
import java.util.Map;

/**
 * The agent produced a structured result that does not satisfy the task's acceptance criteria.
 */
public class ValidationException extends PhasegateException {

    private final FailureReason reason;

    private ValidationException(FailureReason reason, String taskId, String message) {
        super(reason.code(), message, Map.of("taskId", taskId));
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }

    public static ValidationException criteriaNotMet(String taskId, List<String> failing) {
        return new ValidationException(FailureReason.CRITERIA_NOT_MET, taskId,
                "Task %s failed acceptance criteria: %s".formatted(taskId, String.join("; ", failing)));
    }

    public static ValidationException validatorFailed(String taskId, String summary) {
        String detail = summary == null || summary.isBlank() ? "no summary given" : summary;
        return new ValidationException(FailureReason.VALIDATOR_FAILED, taskId,
                "Validation rejected task %s: %s".formatted(taskId, detail));
    }
}
