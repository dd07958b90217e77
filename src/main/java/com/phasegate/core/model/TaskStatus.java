package com.phasegate.core.model;

/**
 * Status of an individual task within an implementation phase.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETE,
    FAILED,
    SKIPPED;

    /**
     * Whether a task in this status satisfies a dependency on it.
     */
    public boolean satisfiesDependency() {
        return this == COMPLETE || this == SKIPPED;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == SKIPPED;
    }
}
