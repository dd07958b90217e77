package com.phasegate.core.engine;

import com.phasegate.agent.AgentAdapter;
import com.phasegate.config.PhasegateProperties;
import com.phasegate.core.errors.GitException;
import com.phasegate.core.errors.StateException;
import com.phasegate.core.events.EventBus;
import com.phasegate.core.events.OrchestrationEvent;
import com.phasegate.core.execution.TaskExecutorSettings;
import com.phasegate.core.metrics.OrchestrationMetrics;
import com.phasegate.core.model.ImplementationPhase;
import com.phasegate.core.model.ProjectState;
import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskStatus;
import com.phasegate.core.phases.PlanImportPhase;
import com.phasegate.core.state.ProjectStateStore;
import com.phasegate.vcs.CheckpointManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point for running the implementation plan.
 * <p>
 * Builds one {@link Orchestrator} per run, wires the caller's listener to the run's events and
 * allows a single active run per process; nothing runs until planning is approved. Also exposes the
 * state operations that sit between runs: approving phases, retrying and skipping tasks, and reading
 * status.
 */
@Service
public class ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final Duration EVENT_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    private static final Pattern IMPL_APPROVAL = Pattern.compile("impl-(\\d+)");

    private final ProjectStateStore store;
    private final AgentAdapter adapter;
    private final CheckpointManager checkpoints;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;
    private final PhasegateProperties properties;

    private final AtomicReference<Orchestrator> active = new AtomicReference<>();

    public ExecutionService(ProjectStateStore store, AgentAdapter adapter, CheckpointManager checkpoints,
                            EventBus eventBus, OrchestrationMetrics metrics, PhasegateProperties properties) {
        this.store = store;
        this.adapter = adapter;
        this.checkpoints = checkpoints;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Options seeded from configuration; callers override individual fields through the builder.
     */
    public OrchestrationOptions.Builder defaultOptions() {
        return OrchestrationOptions.builder()
                .stopOnFailure(properties.getExecution().isStopOnFailure())
                .taskTimeout(properties.getTaskTimeout())
                .maxRetries(properties.getAgent().getMaxRetries())
                .validateResults(properties.getAgent().isValidateResults());
    }

    /**
     * Runs the phases selected by the options and blocks until the run ends.
     *
     * @param listener receives the run's events, may be null
     * @throws StateException not_approved when planning has not been approved
     * @throws IllegalStateException if another run is active
     */
    public OrchestrationResult run(OrchestrationOptions options, Consumer<OrchestrationEvent> listener) {
        return start(options, listener, false);
    }

    /**
     * Continues from the current implementation phase recorded in the project state.
     */
    public OrchestrationResult resume(OrchestrationOptions options, Consumer<OrchestrationEvent> listener) {
        return start(options, listener, true);
    }

    /**
     * Aborts the active run, if any.
     *
     * @return true if a run was active
     */
    public boolean abort() {
        Orchestrator orchestrator = active.get();
        if (orchestrator == null) {
            return false;
        }
        orchestrator.abort();
        return true;
    }

    public boolean isRunning() {
        return active.get() != null;
    }

    /**
     * Resets a failed task to pending so the next run or resume executes it again.
     */
    public Task retryTask(String taskId) {
        Task task = store.retryTask(taskId);
        commitStateChange("retry task " + taskId);
        return task;
    }

    /**
     * Marks a pending or failed task as skipped, unblocking the tasks depending on it.
     */
    public Task skipTask(String taskId, String reason) {
        Task task = store.skipTask(taskId, reason);
        commitStateChange("skip task " + taskId);
        return task;
    }

    /**
     * Records a human approval of {@code planning} or {@code impl-N} after checking readiness.
     * Planning is ready once a plan is loaded; an implementation phase once none of its tasks is
     * pending, in progress or failed. Approving a phase moves the current-phase pointer to the lowest
     * phase still unapproved.
     *
     * @throws StateException not_ready with the blockers, or phase_not_found
     * @throws IllegalArgumentException for a key that is neither form
     */
    public void approve(String approvalKey) {
        List<String> blockers = new ArrayList<>();
        if (PlanImportPhase.PLANNING_APPROVAL.equals(approvalKey)) {
            if (store.getPhases().isEmpty()) {
                blockers.add("no implementation plan loaded");
            }
        } else {
            Matcher m = IMPL_APPROVAL.matcher(approvalKey == null ? "" : approvalKey);
            if (!m.matches()) {
                throw new IllegalArgumentException(
                        "Unknown approval '%s', expected planning or impl-N".formatted(approvalKey));
            }
            int phaseNumber = Integer.parseInt(m.group(1));
            ImplementationPhase phase = store.getPhase(phaseNumber)
                    .orElseThrow(() -> StateException.phaseNotFound(phaseNumber));
            for (Task task : phase.tasks()) {
                if (task.status() == TaskStatus.PENDING || task.status() == TaskStatus.IN_PROGRESS
                        || task.status() == TaskStatus.FAILED) {
                    blockers.add("task %s is %s".formatted(task.id(), task.status().name().toLowerCase()));
                }
            }
        }
        if (!blockers.isEmpty()) {
            throw StateException.notReady(approvalKey, blockers);
        }
        store.approvePhase(approvalKey);
        if (!PlanImportPhase.PLANNING_APPROVAL.equals(approvalKey)) {
            store.setCurrentImplPhase(Orchestrator.firstUnapprovedPhase(store));
        }
        commitStateChange("approve " + approvalKey);
    }

    public ProjectState status() {
        return store.snapshot();
    }

    /**
     * Generates a run ID in the format RUN-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("RUN-%d-%04d", year, count);
    }

    Orchestrator createOrchestrator(String runId, OrchestrationOptions options) {
        PhaseExecutorFactory factory = (phaseNumber, id, opts) -> new PhaseExecutor(phaseNumber, id, store, adapter,
                new TaskExecutorSettings(opts.taskTimeout(), opts.maxRetries(), opts.validateResults()),
                checkpoints, eventBus, metrics);
        return new Orchestrator(runId, options, store, factory, checkpoints, eventBus, metrics);
    }

    private OrchestrationResult start(OrchestrationOptions options, Consumer<OrchestrationEvent> listener,
                                      boolean resume) {
        if (!store.isApproved(PlanImportPhase.PLANNING_APPROVAL)) {
            throw StateException.notApproved(PlanImportPhase.PLANNING_APPROVAL);
        }
        String runId = generateRunId();
        Orchestrator orchestrator = createOrchestrator(runId, options);
        if (!active.compareAndSet(null, orchestrator)) {
            throw new IllegalStateException("Run " + active.get().getRunId() + " is already active");
        }
        EventBus.Subscription subscription = listener == null ? null : eventBus.subscribe(runId, listener);
        try {
            log.info("{} run {}", resume ? "Resuming" : "Starting", runId);
            return resume ? orchestrator.resume() : orchestrator.execute();
        } finally {
            active.set(null);
            if (subscription != null) {
                if (!eventBus.drain(EVENT_DRAIN_TIMEOUT)) {
                    log.warn("Timed out delivering events for run {}", runId);
                }
                subscription.unsubscribe();
            }
        }
    }

    private void commitStateChange(String action) {
        try {
            checkpoints.commitStateChange(action);
        } catch (GitException e) {
            log.warn("Could not commit state change '{}': {}", action, e.getMessage());
        }
    }
}
