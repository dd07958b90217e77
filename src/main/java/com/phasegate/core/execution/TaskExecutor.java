package com.phasegate.core.execution;

import com.phasegate.agent.AgentAdapter;
import com.phasegate.agent.AgentExecutionResult;
import com.phasegate.core.errors.TaskExecutionException;
import com.phasegate.core.errors.ValidationException;
import com.phasegate.core.events.TaskExecutionEvent;
import com.phasegate.core.metrics.OrchestrationMetrics;
import com.phasegate.core.model.FailureReason;
import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskResult;
import com.phasegate.core.model.TaskResult.CriterionResult;
import com.phasegate.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Drives a single task through the coding agent and turns its output into a {@link TaskResult}.
 *
 * <p>An attempt succeeds only if the agent exits cleanly, its output carries the completion
 * marker, no acceptance criterion is reported as failing and, when enabled, the validation pass
 * agrees. Every failure becomes a FAILED result; nothing is thrown to the caller.
 */
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final AgentAdapter adapter;
    private final TaskContext context;
    private final TaskExecutorSettings settings;
    private final Consumer<TaskExecutionEvent> listener;
    private final OrchestrationMetrics metrics;

    private volatile boolean aborted;

    public TaskExecutor(AgentAdapter adapter, TaskContext context, TaskExecutorSettings settings,
                        Consumer<TaskExecutionEvent> listener, OrchestrationMetrics metrics) {
        this.adapter = adapter;
        this.context = context;
        this.settings = settings;
        this.listener = listener == null ? e -> {} : listener;
        this.metrics = metrics;
    }

    /**
     * Runs one attempt of the task.
     */
    public TaskResult execute(Task task) {
        emit(TaskExecutionEvent.of(TaskExecutionEvent.Type.START, task.id(), 1, "Starting task " + task.id()));
        TaskResult result = runAttempt(task, TaskPromptBuilder.buildTaskPrompt(task, context), 1);
        settle(task, result, 1);
        return result;
    }

    /**
     * Runs up to {@code 1 + maxRetries} attempts, stopping at the first success or an abort.
     * Later attempts carry the previous failure in their prompt.
     *
     * @return the successful result, or the last failed one, annotated with the attempts made
     */
    public TaskResult executeWithRetry(Task task, int maxRetries) {
        int maxAttempts = 1 + Math.max(0, maxRetries);
        emit(TaskExecutionEvent.of(TaskExecutionEvent.Type.START, task.id(), 1, "Starting task " + task.id()));

        TaskResult last = null;
        int attempts = 0;
        while (attempts < maxAttempts) {
            String prompt;
            if (attempts == 0) {
                prompt = TaskPromptBuilder.buildTaskPrompt(task, context);
            } else {
                if (aborted) {
                    break;
                }
                log.warn("Retrying task {} (attempt {}/{}): {}", task.id(), attempts + 1, maxAttempts,
                        last.failureDetail());
                emit(TaskExecutionEvent.of(TaskExecutionEvent.Type.RETRY, task.id(), attempts + 1,
                        "Retrying task %s (attempt %d/%d) after %s".formatted(task.id(), attempts + 1,
                                maxAttempts, last.failureReason().code())));
                metrics.incrementRetries();
                prompt = TaskPromptBuilder.buildRetryPrompt(task, context, last.rawOutput(), last.failureDetail());
            }

            attempts++;
            last = runAttempt(task, prompt, attempts);
            if (last.isSuccess() || !last.failureReason().isRetryable()) {
                break;
            }
        }

        TaskResult result = last.withAttempts(attempts);
        settle(task, result, attempts);
        return result;
    }

    /**
     * Asks the agent, in a separate invocation, whether the output satisfies the task's criteria.
     */
    public TaskResult.Validation validate(Task task, String rawOutput) {
        AgentExecutionResult exec;
        try {
            exec = adapter.execute(TaskPromptBuilder.buildValidationPrompt(task, rawOutput), settings.timeout());
        } catch (RuntimeException e) {
            log.error("Validation call for task {} failed", task.id(), e);
            return new TaskResult.Validation(false, e.getMessage(), task.acceptanceCriteria().size(), 0);
        }
        if (!exec.success()) {
            String detail = exec.error() != null ? exec.error() : "validator exited with code " + exec.exitCode();
            return new TaskResult.Validation(false, detail, task.acceptanceCriteria().size(), 0);
        }
        ValidationVerdict verdict = TaskOutputParser.parseValidation(exec.output());
        int passed = (int) verdict.criteria().stream().filter(CriterionResult::met).count();
        String summary = verdict.summary().isEmpty() ? exec.output().strip() : verdict.summary();
        return new TaskResult.Validation(verdict.passed(), summary, verdict.criteria().size(), passed);
    }

    /**
     * Stops the in-flight attempt; it settles as ABORTED and no further attempts are made.
     */
    public void abort() {
        aborted = true;
        adapter.abort();
    }

    public boolean isRunning() {
        return adapter.isRunning();
    }

    private TaskResult runAttempt(Task task, String prompt, int attempt) {
        Instant startedAt = Instant.now();
        TaskResult candidate = null;
        String rawOutput = null;
        TaskResult result;
        try {
            if (aborted) {
                throw TaskExecutionException.aborted(task.id());
            }
            AgentExecutionResult exec = adapter.executeStream(prompt, settings.timeout(), chunk ->
                    emit(TaskExecutionEvent.of(TaskExecutionEvent.Type.PROGRESS, task.id(), attempt, chunk)));
            rawOutput = exec.output();

            if (aborted || exec.aborted()) {
                throw TaskExecutionException.aborted(task.id());
            }
            if (exec.timedOut()) {
                throw TaskExecutionException.timeout(task.id(), settings.timeout().toMillis());
            }
            if (!exec.success()) {
                throw TaskExecutionException.executionFailed(task.id(), exec.exitCode(), exec.error());
            }

            ParsedOutput parsed = TaskOutputParser.parse(exec.output());
            candidate = toResult(task, parsed, exec, startedAt, attempt);
            if (!parsed.completed()) {
                throw TaskExecutionException.parseError(task.id());
            }
            List<String> failing = parsed.failingCriteria().stream().map(CriterionResult::criterion).toList();
            if (!failing.isEmpty()) {
                throw ValidationException.criteriaNotMet(task.id(), failing);
            }

            if (settings.validateResults()) {
                emit(TaskExecutionEvent.of(TaskExecutionEvent.Type.VALIDATE, task.id(), attempt,
                        "Validating task " + task.id()));
                TaskResult.Validation validation = validate(task, exec.output());
                candidate = candidate.withValidation(validation);
                if (aborted) {
                    throw TaskExecutionException.aborted(task.id());
                }
                if (!validation.passed()) {
                    throw ValidationException.validatorFailed(task.id(), validation.validatorOutput());
                }
            }
            result = candidate;
        } catch (TaskExecutionException e) {
            result = failure(task, candidate, e.getReason(), e.getMessage(), startedAt, rawOutput);
        } catch (ValidationException e) {
            result = failure(task, candidate, e.getReason(), e.getMessage(), startedAt, rawOutput);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing task {}", task.id(), e);
            result = failure(task, candidate, FailureReason.EXECUTION_FAILED,
                    "Unexpected error: " + e.getMessage(), startedAt, rawOutput);
        }

        metrics.recordTaskExecution(result.isSuccess(), result.durationMs());
        if (!result.isSuccess()) {
            metrics.recordTaskFailure(result.failureReason());
            log.info("Task {} attempt {} failed ({}): {}", task.id(), attempt,
                    result.failureReason().code(), result.failureDetail());
        }
        return result;
    }

    private TaskResult failure(Task task, TaskResult candidate, FailureReason reason, String detail,
                               Instant startedAt, String rawOutput) {
        if (candidate != null) {
            return candidate.asFailure(reason, detail);
        }
        return TaskResult.failed(task, reason, detail, startedAt, rawOutput);
    }

    private static TaskResult toResult(Task task, ParsedOutput parsed, AgentExecutionResult exec,
                                       Instant startedAt, int attempt) {
        return new TaskResult(task.id(), task.description(), TaskStatus.COMPLETE, parsed.summary(),
                parsed.files(), parsed.keyDecisions(), parsed.assumptions(), parsed.tests(), parsed.criteria(),
                null, parsed.usage(), null, null, null, attempt, startedAt, Instant.now(),
                exec.durationMs(), exec.output());
    }

    private void settle(Task task, TaskResult result, int attempts) {
        if (result.isSuccess()) {
            log.info("Task {} completed after {} attempt(s)", task.id(), attempts);
            emit(TaskExecutionEvent.settled(TaskExecutionEvent.Type.COMPLETE, task.id(), attempts,
                    "Task %s completed".formatted(task.id()), result));
        } else {
            log.warn("Task {} failed after {} attempt(s): {}", task.id(), attempts, result.failureDetail());
            emit(TaskExecutionEvent.settled(TaskExecutionEvent.Type.FAILED, task.id(), attempts,
                    "Task %s failed after %d attempt(s): %s".formatted(task.id(), attempts, result.failureDetail()),
                    result));
        }
    }

    private void emit(TaskExecutionEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            log.warn("Task event listener threw exception on {}: {}", event.type(), e.getMessage());
        }
    }
}
