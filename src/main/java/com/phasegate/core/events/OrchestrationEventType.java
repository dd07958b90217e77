package com.phasegate.core.events;

/**
 * Kinds of events emitted during an orchestration run.
 */
public enum OrchestrationEventType {
    ORCHESTRATION_START,
    PHASE_START,
    PHASE_COMPLETE,
    PHASE_FAILED,
    TASK_START,
    TASK_PROGRESS,
    TASK_RETRY,
    TASK_COMPLETE,
    TASK_FAILED,
    ORCHESTRATION_COMPLETE,
    ORCHESTRATION_ABORTED
}
