package com.phasegate.core.phases;

/**
 * Lifecycle stages tracked by {@link PhaseRunnerDriver}.
 */
public enum PhaseStage {
    CREATED,
    SETTING_UP,
    EXECUTING,
    PERSISTING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
