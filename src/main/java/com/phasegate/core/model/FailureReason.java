package com.phasegate.core.model;

/**
 * Why a task attempt settled as failed.
 */
public enum FailureReason {
    /** The agent exceeded the per-attempt time limit. */
    TIMEOUT("timeout"),
    /** The agent exited non-zero or could not be started. */
    EXECUTION_FAILED("execution_failed"),
    /** The output carried no recognizable completion marker. */
    PARSE_ERROR("parse_error"),
    /** One or more acceptance criteria were reported as failing. */
    CRITERIA_NOT_MET("criteria_not_met"),
    /** The secondary validation pass rejected the output. */
    VALIDATOR_FAILED("validator_failed"),
    /** The run was aborted while the attempt was in flight. */
    ABORTED("aborted");

    private final String code;

    FailureReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Everything except an abort may be retried.
     */
    public boolean isRetryable() {
        return this != ABORTED;
    }
}
