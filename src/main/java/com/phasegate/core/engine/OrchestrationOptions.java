package com.phasegate.core.engine;

import java.time.Duration;

/**
 * Settings for one orchestration run.
 *
 * @param startPhase      lowest phase number to run, null for no lower bound
 * @param endPhase        highest phase number to run, null for no upper bound
 * @param dryRun          walk the phases without executing any task
 * @param stopOnFailure   halt after the first failed phase
 * @param taskTimeout     limit for a single agent invocation
 * @param maxRetries      retries per task after the first attempt
 * @param validateResults run the secondary validation pass
 */
public record OrchestrationOptions(
    Integer startPhase,
    Integer endPhase,
    boolean dryRun,
    boolean stopOnFailure,
    Duration taskTimeout,
    int maxRetries,
    boolean validateResults
) {

    public static Builder builder() {
        return new Builder();
    }

    public boolean inRange(int phaseNumber) {
        return (startPhase == null || phaseNumber >= startPhase)
                && (endPhase == null || phaseNumber <= endPhase);
    }

    public OrchestrationOptions withStartPhase(Integer phase) {
        return new OrchestrationOptions(phase, endPhase, dryRun, stopOnFailure, taskTimeout, maxRetries,
                validateResults);
    }

    public static class Builder {
        private Integer startPhase;
        private Integer endPhase;
        private boolean dryRun;
        private boolean stopOnFailure = true;
        private Duration taskTimeout = Duration.ofMinutes(10);
        private int maxRetries = 2;
        private boolean validateResults = true;

        public Builder startPhase(Integer startPhase) { this.startPhase = startPhase; return this; }
        public Builder endPhase(Integer endPhase) { this.endPhase = endPhase; return this; }
        public Builder dryRun(boolean dryRun) { this.dryRun = dryRun; return this; }
        public Builder stopOnFailure(boolean stopOnFailure) { this.stopOnFailure = stopOnFailure; return this; }
        public Builder taskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder validateResults(boolean validateResults) { this.validateResults = validateResults; return this; }

        public OrchestrationOptions build() {
            return new OrchestrationOptions(startPhase, endPhase, dryRun, stopOnFailure, taskTimeout,
                    maxRetries, validateResults);
        }
    }
}
