package com.phasegate.core.phases;

/**
 * A unit of work with a fixed setup, execute, persist lifecycle.
 * <p>
 * Implementations only supply the three steps; ordering, error capture and stage tracking
 * belong to {@link PhaseRunnerDriver}. A step signals failure by throwing.
 *
 * @param <I> input handed to setup and execute
 * @param <O> output produced by execute and handed to persist
 */
public interface PhaseRunner<I, O> {

    /** Display name used in logs and outcomes. */
    String name();

    /** Checks preconditions and prepares resources. Nothing is persisted here. */
    void setup(I input) throws Exception;

    O execute(I input) throws Exception;

    /** Stores the output; only called after execute succeeded. */
    void persist(O output) throws Exception;

    /** Accumulated cost in USD, read after the run whether it succeeded or not. */
    default double cost() {
        return 0.0;
    }
}
