package com.phasegate.core.phases;

/**
 * Result of driving a {@link PhaseRunner} to completion.
 *
 * @param success     every stage completed
 * @param data        output of execute, null on failure
 * @param error       message of the failure, null on success
 * @param failedStage stage that failed, null on success
 * @param cost        cost reported by the runner
 * @param <O>         output type
 */
public record PhaseOutcome<O>(
    boolean success,
    O data,
    String error,
    PhaseStage failedStage,
    double cost
) {

    public static <O> PhaseOutcome<O> succeeded(O data, double cost) {
        return new PhaseOutcome<>(true, data, null, null, cost);
    }

    public static <O> PhaseOutcome<O> failed(PhaseStage stage, String error, double cost) {
        return new PhaseOutcome<>(false, null, error, stage, cost);
    }
}
