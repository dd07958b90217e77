package com.phasegate.core.execution;

import com.phasegate.agent.AgentAdapter;
import com.phasegate.agent.AgentExecutionResult;
import com.phasegate.agent.ScriptedAgentAdapter;
import com.phasegate.core.events.TaskExecutionEvent;
import com.phasegate.core.metrics.OrchestrationMetrics;
import com.phasegate.core.model.FailureReason;
import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskResult;
import com.phasegate.core.model.TaskStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskExecutorTest {

    private static final String INCOMPLETE_OUTPUT = "I looked at the code but ran out of time.";

    private static final String FAILING_CRITERION_OUTPUT = """
            ## Task Complete
            ### Summary
            Partially done.

            ### Acceptance Criteria Status
            1. [PASS] It compiles - ok
            2. [FAIL] It handles errors - not yet
            """;

    private final Task task = Task.pending("1.1", "Add a repository", List.of("It works"), List.of());
    private final TaskContext context = new TaskContext("demo", 1, "Foundation", null, List.of());

    private SimpleMeterRegistry registry;
    private OrchestrationMetrics metrics;
    private List<TaskExecutionEvent> events;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestrationMetrics(registry);
        events = new ArrayList<>();
    }

    private TaskExecutor executor(AgentAdapter adapter, boolean validate) {
        return new TaskExecutor(adapter, context, new TaskExecutorSettings(Duration.ofMinutes(1), 2, validate),
                events::add, metrics);
    }

    private List<TaskExecutionEvent.Type> types() {
        return events.stream().map(TaskExecutionEvent::type).toList();
    }

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        @DisplayName("successful attempt produces a complete result")
        void success() {
            var adapter = new ScriptedAgentAdapter();
            TaskResult result = executor(adapter, true).execute(task);

            assertTrue(result.isSuccess());
            assertEquals(TaskStatus.COMPLETE, result.status());
            assertEquals("Did the work.", result.summary());
            assertNull(result.failureReason());
            assertNotNull(result.validation());
            assertTrue(result.validation().passed());
            assertEquals(2, adapter.prompts().size());
        }

        @Test
        @DisplayName("emits start, progress, validate and complete in order")
        void events() {
            executor(new ScriptedAgentAdapter(), true).execute(task);
            assertEquals(List.of(TaskExecutionEvent.Type.START, TaskExecutionEvent.Type.PROGRESS,
                    TaskExecutionEvent.Type.VALIDATE, TaskExecutionEvent.Type.COMPLETE), types());
            assertNotNull(events.get(events.size() - 1).result());
        }

        @Test
        @DisplayName("missing completion marker is a parse error")
        void parseError() {
            var adapter = new ScriptedAgentAdapter().thenReturn(ScriptedAgentAdapter.output(INCOMPLETE_OUTPUT));
            TaskResult result = executor(adapter, true).execute(task);

            assertFalse(result.isSuccess());
            assertEquals(FailureReason.PARSE_ERROR, result.failureReason());
            assertEquals(INCOMPLETE_OUTPUT, result.rawOutput());
            assertEquals(1, adapter.prompts().size(), "no validation after a parse error");
        }

        @Test
        @DisplayName("failing criterion fails the task without validation")
        void criteriaNotMet() {
            var adapter = new ScriptedAgentAdapter().thenReturn(ScriptedAgentAdapter.output(FAILING_CRITERION_OUTPUT));
            TaskResult result = executor(adapter, true).execute(task);

            assertEquals(FailureReason.CRITERIA_NOT_MET, result.failureReason());
            assertTrue(result.failureDetail().contains("It handles errors"));
            assertEquals("Partially done.", result.summary());
            assertEquals(1, adapter.prompts().size());
        }

        @Test
        @DisplayName("validator rejection fails the task")
        void validatorFailed() {
            var adapter = new ScriptedAgentAdapter().thenValidate(ScriptedAgentAdapter.output("""
                    ## Validation Result
                    Status: FAIL

                    ### Summary
                    Tests are missing.
                    """));
            TaskResult result = executor(adapter, true).execute(task);

            assertEquals(FailureReason.VALIDATOR_FAILED, result.failureReason());
            assertFalse(result.validation().passed());
            assertEquals("Tests are missing.", result.validation().validatorOutput());
        }

        @Test
        @DisplayName("validation pass is skipped when disabled")
        void noValidation() {
            var adapter = new ScriptedAgentAdapter();
            TaskResult result = executor(adapter, false).execute(task);

            assertTrue(result.isSuccess());
            assertNull(result.validation());
            assertEquals(1, adapter.prompts().size());
        }

        @Test
        @DisplayName("timeout becomes a TIMEOUT failure")
        void timeout() {
            var adapter = new ScriptedAgentAdapter().thenReturn(AgentExecutionResult.timedOut("partial", 60_000));
            TaskResult result = executor(adapter, true).execute(task);

            assertEquals(FailureReason.TIMEOUT, result.failureReason());
            assertEquals("partial", result.rawOutput());
        }

        @Test
        @DisplayName("non-zero exit becomes EXECUTION_FAILED")
        void executionFailed() {
            var adapter = new ScriptedAgentAdapter()
                    .thenReturn(AgentExecutionResult.completed("", "boom", 2, 10));
            TaskResult result = executor(adapter, true).execute(task);

            assertEquals(FailureReason.EXECUTION_FAILED, result.failureReason());
            assertTrue(result.failureDetail().contains("boom"));
        }

        @Test
        @DisplayName("exception from the adapter becomes EXECUTION_FAILED")
        void adapterThrows() {
            AgentAdapter adapter = mock(AgentAdapter.class);
            when(adapter.executeStream(anyString(), any(), any())).thenThrow(new IllegalStateException("no agent"));
            TaskResult result = executor(adapter, true).execute(task);

            assertEquals(FailureReason.EXECUTION_FAILED, result.failureReason());
            assertTrue(result.failureDetail().contains("no agent"));
            assertEquals(TaskExecutionEvent.Type.FAILED, events.get(events.size() - 1).type());
        }

        @Test
        @DisplayName("failing listener does not disturb execution")
        void listenerFailure() {
            var executor = new TaskExecutor(new ScriptedAgentAdapter(), context, TaskExecutorSettings.defaults(),
                    e -> { throw new RuntimeException("listener down"); }, metrics);
            assertTrue(executor.execute(task).isSuccess());
        }

        @Test
        @DisplayName("records duration and failure metrics")
        void metrics() {
            var adapter = new ScriptedAgentAdapter().thenReturn(ScriptedAgentAdapter.output(INCOMPLETE_OUTPUT));
            executor(adapter, false).execute(task);

            assertEquals(1, registry.find("phasegate.task.duration").tag("outcome", "failed").timer().count());
            assertEquals(1.0, registry.find("phasegate.task.failures").tag("reason", "parse_error")
                    .counter().count());
        }
    }

    @Nested
    @DisplayName("executeWithRetry")
    class ExecuteWithRetry {

        @Test
        @DisplayName("makes at most one plus maxRetries attempts")
        void exhaustsRetries() {
            AgentAdapter adapter = mock(AgentAdapter.class);
            when(adapter.executeStream(anyString(), any(), any()))
                    .thenReturn(AgentExecutionResult.completed(INCOMPLETE_OUTPUT, null, 0, 1));

            TaskResult result = executor(adapter, false).executeWithRetry(task, 1);

            verify(adapter, times(2)).executeStream(anyString(), any(), any());
            assertFalse(result.isSuccess());
            assertEquals(2, result.attempts());
            assertEquals(FailureReason.PARSE_ERROR, result.failureReason());
        }

        @Test
        @DisplayName("zero retries means exactly one attempt")
        void zeroRetries() {
            var adapter = new ScriptedAgentAdapter().byDefault(ScriptedAgentAdapter.output(INCOMPLETE_OUTPUT));
            TaskResult result = executor(adapter, false).executeWithRetry(task, 0);

            assertEquals(1, adapter.taskPrompts().size());
            assertEquals(1, result.attempts());
        }

        @Test
        @DisplayName("fail then succeed emits RETRY and ends complete")
        void failThenSucceed() {
            var adapter = new ScriptedAgentAdapter()
                    .thenReturn(ScriptedAgentAdapter.output(INCOMPLETE_OUTPUT))
                    .thenReturn(ScriptedAgentAdapter.output(ScriptedAgentAdapter.COMPLETE_OUTPUT));

            TaskResult result = executor(adapter, false).executeWithRetry(task, 2);

            assertTrue(result.isSuccess());
            assertEquals(2, result.attempts());
            assertEquals(1, types().stream().filter(t -> t == TaskExecutionEvent.Type.START).count());
            assertEquals(1, types().stream().filter(t -> t == TaskExecutionEvent.Type.RETRY).count());
            assertEquals(TaskExecutionEvent.Type.COMPLETE, types().get(types().size() - 1));
            assertFalse(types().contains(TaskExecutionEvent.Type.FAILED));
            assertEquals(1.0, registry.find("phasegate.task.retries").counter().count());
        }

        @Test
        @DisplayName("retry prompt carries the previous failure and output")
        void retryPrompt() {
            var adapter = new ScriptedAgentAdapter()
                    .thenReturn(ScriptedAgentAdapter.output(INCOMPLETE_OUTPUT))
                    .thenReturn(ScriptedAgentAdapter.output(ScriptedAgentAdapter.COMPLETE_OUTPUT));

            executor(adapter, false).executeWithRetry(task, 2);

            String retry = adapter.taskPrompts().get(1);
            assertTrue(retry.contains("## Previous Attempt Failed"));
            assertTrue(retry.contains(INCOMPLETE_OUTPUT));
            assertFalse(adapter.taskPrompts().get(0).contains("Previous Attempt"));
        }

        @Test
        @DisplayName("exactly one terminal event after exhausting retries")
        void singleTerminalEvent() {
            var adapter = new ScriptedAgentAdapter().byDefault(ScriptedAgentAdapter.output(INCOMPLETE_OUTPUT));
            executor(adapter, false).executeWithRetry(task, 2);

            assertEquals(1, types().stream().filter(t -> t == TaskExecutionEvent.Type.FAILED).count());
            assertEquals(2, types().stream().filter(t -> t == TaskExecutionEvent.Type.RETRY).count());
            assertFalse(types().contains(TaskExecutionEvent.Type.COMPLETE));
        }

        @Test
        @DisplayName("aborted attempt is final")
        void abortIsFinal() {
            var adapter = new ScriptedAgentAdapter().byDefault(AgentExecutionResult.aborted("", 1));
            TaskResult result = executor(adapter, false).executeWithRetry(task, 3);

            assertEquals(FailureReason.ABORTED, result.failureReason());
            assertEquals(1, adapter.taskPrompts().size());
            assertFalse(types().contains(TaskExecutionEvent.Type.RETRY));
        }

        @Test
        @DisplayName("abort during an attempt stops without further retries")
        void abortDuringAttempt() {
            var adapter = new ScriptedAgentAdapter().byDefault(ScriptedAgentAdapter.output(INCOMPLETE_OUTPUT));
            var executor = executor(adapter, false);
            adapter.onExecute(executor::abort);

            TaskResult result = executor.executeWithRetry(task, 3);

            assertEquals(FailureReason.ABORTED, result.failureReason());
            assertEquals(1, adapter.taskPrompts().size());
            assertEquals(1, adapter.aborts());
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("counts criteria reported by the validator")
        void countsCriteria() {
            var adapter = new ScriptedAgentAdapter().thenValidate(ScriptedAgentAdapter.output("""
                    ## Validation Result
                    Status: FAIL

                    ### Criteria Status
                    1. [PASS] It works - yes
                    2. [FAIL] It is fast - no

                    ### Summary
                    Too slow.
                    """));
            TaskResult.Validation validation = executor(adapter, true).validate(task, "output");

            assertFalse(validation.passed());
            assertEquals(2, validation.criteriaChecked());
            assertEquals(1, validation.criteriaPassed());
            assertEquals("Too slow.", validation.validatorOutput());
        }

        @Test
        @DisplayName("validator process failure counts as not passed")
        void validatorProcessFails() {
            var adapter = new ScriptedAgentAdapter()
                    .thenValidate(AgentExecutionResult.completed("", "crashed", 1, 3));
            TaskResult.Validation validation = executor(adapter, true).validate(task, "output");

            assertFalse(validation.passed());
            assertEquals("crashed", validation.validatorOutput());
        }
    }
}
