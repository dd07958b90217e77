package com.phasegate.core.engine;

import com.phasegate.core.errors.GitException;
import com.phasegate.core.events.EventBus;
import com.phasegate.core.events.OrchestrationEvent;
import com.phasegate.core.events.OrchestrationEventType;
import com.phasegate.core.logging.MdcContext;
import com.phasegate.core.metrics.OrchestrationMetrics;
import com.phasegate.core.model.ImplementationPhase;
import com.phasegate.core.scheduler.DependencyResolver;
import com.phasegate.core.state.ProjectStateStore;
import com.phasegate.vcs.CheckpointManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the implementation phases of the plan in ascending order for one run.
 *
 * <p>A successful phase is approved as {@code impl-N}, the current-phase pointer moves to the lowest
 * phase not yet approved and a checkpoint commit is made. With {@code stopOnFailure} the first failed phase ends the run and
 * no executor is ever created for later phases. A dry run walks the phases in scope, emitting the
 * phase events, without touching the agent, git or task state.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final String EMPTY_SCOPE_WARNING = "No implementation phases to execute";

    private final String runId;
    private final OrchestrationOptions options;
    private final ProjectStateStore store;
    private final PhaseExecutorFactory executorFactory;
    private final CheckpointManager checkpoints;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;

    private volatile boolean aborted;
    private volatile PhaseExecutor currentPhase;

    public Orchestrator(String runId, OrchestrationOptions options, ProjectStateStore store,
                        PhaseExecutorFactory executorFactory, CheckpointManager checkpoints, EventBus eventBus,
                        OrchestrationMetrics metrics) {
        this.runId = runId;
        this.options = options;
        this.store = store;
        this.executorFactory = executorFactory;
        this.checkpoints = checkpoints;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public String getRunId() {
        return runId;
    }

    public OrchestrationResult execute() {
        return run(options);
    }

    /**
     * Continues from the phase recorded as current in the project state, keeping the end bound.
     */
    public OrchestrationResult resume() {
        int current = store.getCurrentImplPhase();
        log.info("Resuming run {} from phase {}", runId, current);
        return run(options.withStartPhase(current));
    }

    /**
     * Requests the run to stop. The phase in flight is aborted and no further phase starts.
     */
    public void abort() {
        log.info("Abort requested for run {}", runId);
        aborted = true;
        PhaseExecutor executor = currentPhase;
        if (executor != null) {
            executor.abort();
        }
    }

    private OrchestrationResult run(OrchestrationOptions runOptions) {
        MdcContext.setRun(runId);
        long start = System.currentTimeMillis();
        try {
            List<ImplementationPhase> phases = store.getPhases().stream()
                    .filter(p -> runOptions.inRange(p.phaseNumber()))
                    .sorted((a, b) -> Integer.compare(a.phaseNumber(), b.phaseNumber()))
                    .toList();

            publish(OrchestrationEvent.run(OrchestrationEventType.ORCHESTRATION_START, runId,
                    "Starting %d phase(s)%s".formatted(phases.size(), runOptions.dryRun() ? " (dry run)" : ""),
                    Map.of("phases", phases.size(), "dryRun", runOptions.dryRun())));

            List<String> warnings = new ArrayList<>();
            if (phases.isEmpty()) {
                log.warn(EMPTY_SCOPE_WARNING);
                warnings.add(EMPTY_SCOPE_WARNING);
            }

            List<PhaseExecutionResult> results = new ArrayList<>();
            int completed = 0;
            int failed = 0;

            for (ImplementationPhase phase : phases) {
                if (aborted) {
                    break;
                }
                int n = phase.phaseNumber();
                MdcContext.setPhase(runId, n);
                publish(OrchestrationEvent.phase(OrchestrationEventType.PHASE_START, runId, n,
                        "Phase %d: %s".formatted(n, phase.name()), Map.of("tasks", phase.tasks().size())));

                if (runOptions.dryRun()) {
                    log.info("Dry run: phase {} ({}) with {} tasks", n, phase.name(), phase.tasks().size());
                    completed++;
                    publish(OrchestrationEvent.phase(OrchestrationEventType.PHASE_COMPLETE, runId, n,
                            "Phase %d would run (dry run)".formatted(n), Map.of("dryRun", true)));
                    continue;
                }

                PhaseExecutor executor = executorFactory.create(n, runId, runOptions);
                currentPhase = executor;
                if (aborted) {
                    executor.abort();
                }
                PhaseExecutionResult result;
                try {
                    result = executor.execute();
                } finally {
                    currentPhase = null;
                }
                results.add(result);

                if (result.aborted()) {
                    break;
                }
                if (result.success()) {
                    completed++;
                    completePhase(phase);
                    publish(OrchestrationEvent.phase(OrchestrationEventType.PHASE_COMPLETE, runId, n,
                            "Phase %d complete: %s".formatted(n, phase.name()), phasePayload(result)));
                } else {
                    failed++;
                    log.warn("Phase {} failed: {} failed, {} blocked", n, result.tasksFailed(),
                            result.blockedTasks().size());
                    publish(OrchestrationEvent.phase(OrchestrationEventType.PHASE_FAILED, runId, n,
                            "Phase %d failed: %s".formatted(n, phase.name()), phasePayload(result)));
                    if (runOptions.stopOnFailure()) {
                        log.info("Stopping run {} after failed phase {}", runId, n);
                        break;
                    }
                }
            }

            boolean wasAborted = aborted;
            boolean success = !wasAborted && failed == 0;
            long duration = System.currentTimeMillis() - start;
            OrchestrationResult outcome = new OrchestrationResult(runId, success, wasAborted, runOptions.dryRun(),
                    completed, failed, results, warnings, duration);

            Map<String, Object> payload = Map.of("phasesCompleted", completed, "phasesFailed", failed,
                    "durationMs", duration);
            if (wasAborted) {
                publish(OrchestrationEvent.run(OrchestrationEventType.ORCHESTRATION_ABORTED, runId,
                        "Run aborted", payload));
            } else {
                publish(OrchestrationEvent.run(OrchestrationEventType.ORCHESTRATION_COMPLETE, runId,
                        success ? "Run completed" : "Run finished with failures", payload));
            }
            metrics.recordRunResult(outcome.status());
            log.info("Run {} {}: {} phase(s) completed, {} failed in {} ms", runId, outcome.status(), completed,
                    failed, duration);
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    private void completePhase(ImplementationPhase phase) {
        store.approvePhase(phase.approvalKey());
        store.setCurrentImplPhase(firstUnapprovedPhase(store));
        try {
            checkpoints.checkpoint("Phase %d complete: %s".formatted(phase.phaseNumber(), phase.name()));
        } catch (GitException e) {
            log.warn("Checkpoint after phase {} failed, continuing: {}", phase.phaseNumber(), e.getMessage());
        }
    }

    /**
     * Lowest phase not yet approved, or one past the last phase when every phase is. A phase that
     * failed earlier in the run keeps the pointer even when later phases succeed.
     */
    static int firstUnapprovedPhase(ProjectStateStore store) {
        List<ImplementationPhase> phases = store.getPhases();
        return phases.stream()
                .filter(p -> !store.isApproved(p.approvalKey()))
                .mapToInt(ImplementationPhase::phaseNumber)
                .min()
                .orElseGet(() -> phases.stream().mapToInt(ImplementationPhase::phaseNumber).max().orElse(0) + 1);
    }

    private static Map<String, Object> phasePayload(PhaseExecutionResult result) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("tasksCompleted", result.tasksCompleted());
        payload.put("tasksFailed", result.tasksFailed());
        payload.put("tasksSkipped", result.tasksSkipped());
        payload.put("durationMs", result.durationMs());
        if (!result.blockedTasks().isEmpty()) {
            payload.put("blocked", result.blockedTasks().keySet().stream()
                    .sorted(DependencyResolver.TASK_ID_ORDER)
                    .toList());
        }
        return payload;
    }

    private void publish(OrchestrationEvent event) {
        eventBus.publish(event);
    }
}
