package com.phasegate.core.engine;

import com.phasegate.agent.AgentAdapter;
import com.phasegate.core.errors.GitException;
import com.phasegate.core.errors.StateException;
import com.phasegate.core.events.EventBus;
import com.phasegate.core.events.OrchestrationEvent;
import com.phasegate.core.events.OrchestrationEventType;
import com.phasegate.core.events.TaskExecutionEvent;
import com.phasegate.core.execution.TaskContext;
import com.phasegate.core.execution.TaskExecutor;
import com.phasegate.core.execution.TaskExecutorSettings;
import com.phasegate.core.logging.MdcContext;
import com.phasegate.core.metrics.OrchestrationMetrics;
import com.phasegate.core.model.FailureReason;
import com.phasegate.core.model.ImplementationPhase;
import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskResult;
import com.phasegate.core.model.TaskStatus;
import com.phasegate.core.scheduler.DependencyResolver;
import com.phasegate.core.scheduler.DependencyValidation;
import com.phasegate.core.state.ProjectStateStore;
import com.phasegate.vcs.CheckpointManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every runnable task of one implementation phase, strictly one at a time in dependency order.
 *
 * <p>Each scheduling round builds a fresh {@link DependencyResolver} from the persisted task
 * snapshot. Tasks of other phases are passed as context so cross-phase dependencies resolve.
 * Pending tasks whose dependencies can no longer be satisfied are left PENDING and reported as
 * blocked, so a later retry of the failed dependency lets them run on resume.
 *
 * <p>Task and git failures never escape: they end up in the returned {@link PhaseExecutionResult}.
 */
public class PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private final int phaseNumber;
    private final String runId;
    private final ProjectStateStore store;
    private final AgentAdapter adapter;
    private final TaskExecutorSettings settings;
    private final CheckpointManager checkpoints;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;

    private volatile boolean aborted;
    private volatile TaskExecutor currentTask;

    public PhaseExecutor(int phaseNumber, String runId, ProjectStateStore store, AgentAdapter adapter,
                         TaskExecutorSettings settings, CheckpointManager checkpoints, EventBus eventBus,
                         OrchestrationMetrics metrics) {
        this.phaseNumber = phaseNumber;
        this.runId = runId;
        this.store = store;
        this.adapter = adapter;
        this.settings = settings;
        this.checkpoints = checkpoints;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public PhaseExecutionResult execute() {
        MdcContext.setPhase(runId, phaseNumber);
        long start = System.currentTimeMillis();
        ImplementationPhase phase = store.getPhase(phaseNumber)
                .orElseThrow(() -> StateException.phaseNotFound(phaseNumber));
        log.info("Executing phase {}: {} ({} tasks)", phaseNumber, phase.name(), phase.tasks().size());

        try {
            resetInterruptedTasks(phase);

            DependencyValidation validation = resolverFor(currentPhase()).validate();
            if (!validation.valid()) {
                validation.issues().forEach(issue ->
                        log.error("Dependency issue in phase {}: {}", phaseNumber, issue.details()));
                return finish(phase, start, List.of(), Map.of(), validation, null);
            }

            String branch = prepareBranch(phase);
            List<TaskResult> results = new ArrayList<>();

            while (!aborted) {
                ImplementationPhase snapshot = currentPhase();
                Task next = resolverFor(snapshot).getNextRunnable();
                if (next == null) {
                    break;
                }
                results.add(runTask(snapshot, next));
            }

            Map<String, List<String>> blocked = aborted ? Map.of() : blockedTasks();
            return finish(phase, start, results, blocked, validation, branch);
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * Stops after the current task; the in-flight attempt is aborted.
     */
    public void abort() {
        aborted = true;
        TaskExecutor executor = currentTask;
        if (executor != null) {
            executor.abort();
        }
    }

    /**
     * Task executor for one task; overridable for tests.
     */
    protected TaskExecutor newTaskExecutor(TaskContext context) {
        return new TaskExecutor(adapter, context, settings, this::forward, metrics);
    }

    private TaskResult runTask(ImplementationPhase snapshot, Task task) {
        MdcContext.setTask(task.id());
        store.setTaskStatus(task.id(), TaskStatus.IN_PROGRESS, null);

        TaskContext context = new TaskContext(store.getProjectName(), phaseNumber, snapshot.name(),
                snapshot.description(), snapshot.tasks().stream()
                        .filter(t -> t.status() == TaskStatus.COMPLETE)
                        .toList());
        TaskExecutor executor = newTaskExecutor(context);
        currentTask = executor;
        TaskResult result;
        try {
            if (aborted) {
                executor.abort();
            }
            result = executor.executeWithRetry(task, settings.maxRetries());
        } finally {
            currentTask = null;
        }

        if (result.isSuccess()) {
            result = commit(task, result);
        }
        store.appendResult(result);

        if (result.isSuccess()) {
            store.setTaskStatus(task.id(), TaskStatus.COMPLETE, null);
        } else if (result.failureReason() == FailureReason.ABORTED) {
            // Interrupted work is not a failure of the task itself
            store.setTaskStatus(task.id(), TaskStatus.PENDING, null);
        } else {
            store.setTaskStatus(task.id(), TaskStatus.FAILED, result.failureDetail());
        }
        MdcContext.clearTask();
        return result;
    }

    private TaskResult commit(Task task, TaskResult result) {
        try {
            String hash = checkpoints.commitTask(task.id(), result);
            return hash == null ? result : result.withCommitHash(hash);
        } catch (GitException e) {
            log.warn("Checkpoint commit for task {} failed, continuing: {}", task.id(), e.getMessage());
            return result;
        }
    }

    private String prepareBranch(ImplementationPhase phase) {
        try {
            checkpoints.ensureClean();
            return checkpoints.startImplPhase(phase.phaseNumber(), phase.name());
        } catch (GitException e) {
            log.warn("Could not prepare branch for phase {}, continuing without it: {}",
                    phase.phaseNumber(), e.getMessage());
            return null;
        }
    }

    private void resetInterruptedTasks(ImplementationPhase phase) {
        for (Task task : phase.tasks()) {
            if (task.status() == TaskStatus.IN_PROGRESS) {
                log.warn("Task {} was left in progress by an earlier run, resetting to pending", task.id());
                store.setTaskStatus(task.id(), TaskStatus.PENDING, null);
            }
        }
    }

    private Map<String, List<String>> blockedTasks() {
        ImplementationPhase snapshot = currentPhase();
        DependencyResolver resolver = resolverFor(snapshot);
        Map<String, List<String>> blocked = new LinkedHashMap<>();
        for (Task task : snapshot.tasks()) {
            if (task.status() == TaskStatus.PENDING) {
                List<String> blocking = resolver.getBlockingDeps(task.id());
                blocked.put(task.id(), blocking);
                log.warn("Task {} is blocked by {}", task.id(), blocking);
            }
        }
        return blocked;
    }

    private PhaseExecutionResult finish(ImplementationPhase phase, long start, List<TaskResult> results,
                                        Map<String, List<String>> blocked, DependencyValidation validation,
                                        String branch) {
        Map<TaskStatus, Integer> counts = new HashMap<>();
        for (Task task : currentPhase().tasks()) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        int completed = counts.getOrDefault(TaskStatus.COMPLETE, 0);
        int failed = counts.getOrDefault(TaskStatus.FAILED, 0);
        int skipped = counts.getOrDefault(TaskStatus.SKIPPED, 0) + blocked.size();
        boolean success = validation.valid() && !aborted && failed == 0 && blocked.isEmpty();

        long duration = System.currentTimeMillis() - start;
        if (!aborted) {
            metrics.recordPhaseResult(success);
        }
        log.info("Phase {} finished in {} ms: {} completed, {} failed, {} skipped{}", phaseNumber, duration,
                completed, failed, skipped, aborted ? " (aborted)" : "");
        return new PhaseExecutionResult(phaseNumber, phase.name(), success, aborted, completed, failed, skipped,
                blocked, validation.issues(), results, duration, branch);
    }

    private ImplementationPhase currentPhase() {
        return store.getPhase(phaseNumber).orElseThrow(() -> StateException.phaseNotFound(phaseNumber));
    }

    private DependencyResolver resolverFor(ImplementationPhase phase) {
        List<Task> others = store.getAllTasks().stream()
                .filter(t -> phase.findTask(t.id()).isEmpty())
                .toList();
        return new DependencyResolver(phase.tasks(), others);
    }

    private void forward(TaskExecutionEvent event) {
        OrchestrationEventType type = switch (event.type()) {
            case START -> OrchestrationEventType.TASK_START;
            case PROGRESS, VALIDATE -> OrchestrationEventType.TASK_PROGRESS;
            case RETRY -> OrchestrationEventType.TASK_RETRY;
            case COMPLETE -> OrchestrationEventType.TASK_COMPLETE;
            case FAILED -> OrchestrationEventType.TASK_FAILED;
        };
        Map<String, Object> payload = new HashMap<>();
        payload.put("attempt", event.attempt());
        if (event.type() == TaskExecutionEvent.Type.VALIDATE) {
            payload.put("stage", "validate");
        }
        TaskResult result = event.result();
        if (result != null) {
            payload.put("durationMs", result.durationMs());
            payload.put("attempts", result.attempts());
            if (result.failureReason() != null) {
                payload.put("reason", result.failureReason().code());
            }
        }
        eventBus.publish(OrchestrationEvent.task(type, runId, phaseNumber, event.taskId(), event.message(), payload));
    }
}
