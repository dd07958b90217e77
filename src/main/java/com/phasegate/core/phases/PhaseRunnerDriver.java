package com.phasegate.core.phases;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.BiConsumer;

/**
 * Drives a {@link PhaseRunner} through CREATED, SETTING_UP, EXECUTING, PERSISTING and then
 * SUCCEEDED or FAILED. Stages never repeat or go backwards, and an exception from any step
 * is captured in the returned {@link PhaseOutcome} rather than thrown.
 */
@Component
public class PhaseRunnerDriver {

    private static final Logger log = LoggerFactory.getLogger(PhaseRunnerDriver.class);

    public <I, O> PhaseOutcome<O> run(PhaseRunner<I, O> runner, I input) {
        return run(runner, input, (name, stage) -> {});
    }

    /**
     * @param onStage called with the runner name on every stage transition, starting with SETTING_UP
     */
    public <I, O> PhaseOutcome<O> run(PhaseRunner<I, O> runner, I input, BiConsumer<String, PhaseStage> onStage) {
        String name = runner.name();
        PhaseStage stage = PhaseStage.CREATED;
        try {
            stage = enter(name, PhaseStage.SETTING_UP, onStage);
            runner.setup(input);

            stage = enter(name, PhaseStage.EXECUTING, onStage);
            O output = runner.execute(input);

            stage = enter(name, PhaseStage.PERSISTING, onStage);
            runner.persist(output);

            enter(name, PhaseStage.SUCCEEDED, onStage);
            log.info("{} complete", name);
            return PhaseOutcome.succeeded(output, runner.cost());
        } catch (Exception e) {
            log.error("{} failed during {}: {}", name, stage, e.getMessage(), e);
            notify(name, PhaseStage.FAILED, onStage);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return PhaseOutcome.failed(stage, message, safeCost(runner));
        }
    }

    private static PhaseStage enter(String name, PhaseStage stage, BiConsumer<String, PhaseStage> onStage) {
        log.debug("{} -> {}", name, stage);
        notify(name, stage, onStage);
        return stage;
    }

    private static void notify(String name, PhaseStage stage, BiConsumer<String, PhaseStage> onStage) {
        try {
            onStage.accept(name, stage);
        } catch (RuntimeException e) {
            log.warn("Stage listener threw for {} at {}: {}", name, stage, e.getMessage());
        }
    }

    private static double safeCost(PhaseRunner<?, ?> runner) {
        try {
            return runner.cost();
        } catch (RuntimeException e) {
            log.warn("Could not read cost of {}: {}", runner.name(), e.getMessage());
            return 0.0;
        }
    }
}
