package com.phasegate.core.engine;

/**
 * Creates the executor for one phase of a run. Called lazily, once per phase actually attempted.
 */
@FunctionalInterface
public interface PhaseExecutorFactory {

    PhaseExecutor create(int phaseNumber, String runId, OrchestrationOptions options);
}
