package com.phasegate.core.engine;

import com.phasegate.core.errors.GitException;
import com.phasegate.core.events.EventBus;
import com.phasegate.core.events.OrchestrationEvent;
import com.phasegate.core.events.OrchestrationEventType;
import com.phasegate.core.metrics.OrchestrationMetrics;
import com.phasegate.core.model.ImplementationPhase;
import com.phasegate.core.model.Task;
import com.phasegate.core.state.JsonProjectStateStore;
import com.phasegate.vcs.CheckpointManager;
import com.phasegate.vcs.GitClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class OrchestratorTest {

    @TempDir
    Path tempDir;

    private JsonProjectStateStore store;
    private GitClient git;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private final List<OrchestrationEvent> events = new CopyOnWriteArrayList<>();
    private final List<Integer> created = new ArrayList<>();
    private final Map<Integer, PhaseExecutor> executors = new HashMap<>();

    @BeforeEach
    void setUp() {
        store = new JsonProjectStateStore(tempDir.resolve("state.json"), JsonProjectStateStore.defaultMapper(), "shop");
        store.addImplementationPhases(List.of(
                phase(1, "Setup", "1.1"),
                phase(2, "Core", "2.1"),
                phase(3, "Polish", "3.1")));
        git = mock(GitClient.class);
        eventBus = new EventBus(Runnable::run);
        eventBus.subscribeAll(events::add);
        registry = new SimpleMeterRegistry();
    }

    private static ImplementationPhase phase(int n, String name, String taskId) {
        return new ImplementationPhase(n, name, null,
                List.of(Task.pending(taskId, "Task " + taskId, List.of("done"), List.of())));
    }

    private static PhaseExecutionResult result(int n, boolean success, boolean aborted) {
        return new PhaseExecutionResult(n, "Phase " + n, success, aborted, success ? 1 : 0, success || aborted ? 0 : 1,
                0, Map.of(), List.of(), List.of(), 3, null);
    }

    private PhaseExecutor stub(int n, boolean success) {
        PhaseExecutor executor = mock(PhaseExecutor.class);
        when(executor.execute()).thenReturn(result(n, success, false));
        executors.put(n, executor);
        return executor;
    }

    private Orchestrator orchestrator(OrchestrationOptions options, boolean gitEnabled) {
        PhaseExecutorFactory factory = (n, runId, opts) -> {
            created.add(n);
            return executors.get(n);
        };
        return new Orchestrator("RUN-1", options, store, factory, new CheckpointManager(git, gitEnabled, true, "impl"),
                eventBus, new OrchestrationMetrics(registry));
    }

    private static OrchestrationOptions.Builder options() {
        return OrchestrationOptions.builder().taskTimeout(Duration.ofSeconds(5));
    }

    private List<OrchestrationEventType> eventTypes() {
        return events.stream().map(OrchestrationEvent::type).toList();
    }

    @Test
    @DisplayName("runs phases in order, approving each and advancing the current phase")
    void runsAllPhases() {
        stub(1, true);
        stub(2, true);
        stub(3, true);

        OrchestrationResult result = orchestrator(options().build(), false).execute();

        assertTrue(result.success());
        assertEquals("completed", result.status());
        assertEquals(3, result.phasesCompleted());
        assertEquals(List.of(1, 2, 3), created);
        assertTrue(store.isApproved("impl-1"));
        assertTrue(store.isApproved("impl-3"));
        assertEquals(4, store.getCurrentImplPhase());
        assertEquals(OrchestrationEventType.ORCHESTRATION_START, eventTypes().get(0));
        assertEquals(List.of(
                OrchestrationEventType.ORCHESTRATION_START,
                OrchestrationEventType.PHASE_START, OrchestrationEventType.PHASE_COMPLETE,
                OrchestrationEventType.PHASE_START, OrchestrationEventType.PHASE_COMPLETE,
                OrchestrationEventType.PHASE_START, OrchestrationEventType.PHASE_COMPLETE,
                OrchestrationEventType.ORCHESTRATION_COMPLETE), eventTypes());
        assertEquals(1.0, registry.get("phasegate.runs.total").tag("status", "completed").counter().count());
    }

    @Test
    @DisplayName("stops at the first failed phase without creating later executors")
    void stopOnFailure() {
        stub(1, true);
        stub(2, false);
        stub(3, true);

        OrchestrationResult result = orchestrator(options().build(), false).execute();

        assertFalse(result.success());
        assertEquals("failed", result.status());
        assertEquals(1, result.phasesCompleted());
        assertEquals(1, result.phasesFailed());
        assertEquals(List.of(1, 2), created);
        assertFalse(store.isApproved("impl-2"));
        assertEquals(2, store.getCurrentImplPhase());
        assertTrue(eventTypes().contains(OrchestrationEventType.PHASE_FAILED));
        assertEquals(OrchestrationEventType.ORCHESTRATION_COMPLETE, eventTypes().get(eventTypes().size() - 1));
    }

    @Test
    @DisplayName("continues past a failed phase when asked to")
    void continueOnFailure() {
        stub(1, false);
        stub(2, true);
        stub(3, true);

        OrchestrationResult result = orchestrator(options().stopOnFailure(false).build(), false).execute();

        assertFalse(result.success());
        assertEquals(List.of(1, 2, 3), created);
        assertEquals(2, result.phasesCompleted());
        assertEquals(1, result.phasesFailed());
        assertEquals(3, result.phaseResults().size());
    }

    @Test
    @DisplayName("only phases within the start and end bounds run")
    void phaseRange() {
        stub(2, true);

        OrchestrationResult result = orchestrator(options().startPhase(2).endPhase(2).build(), false).execute();

        assertTrue(result.success());
        assertEquals(List.of(2), created);
        assertFalse(store.isApproved("impl-1"));
    }

    @Test
    @DisplayName("a dry run never creates an executor or changes state")
    void dryRun() {
        OrchestrationResult result = orchestrator(options().dryRun(true).build(), true).execute();

        assertTrue(result.success());
        assertTrue(result.dryRun());
        assertEquals(3, result.phasesCompleted());
        assertTrue(created.isEmpty());
        assertTrue(result.phaseResults().isEmpty());
        assertFalse(store.isApproved("impl-1"));
        assertEquals(1, store.getCurrentImplPhase());
        verifyNoInteractions(git);
        assertEquals(3, eventTypes().stream().filter(t -> t == OrchestrationEventType.PHASE_COMPLETE).count());
    }

    @Test
    @DisplayName("an empty scope completes with a warning")
    void emptyScope() {
        OrchestrationResult result = orchestrator(options().startPhase(9).build(), false).execute();

        assertTrue(result.success());
        assertEquals(0, result.phasesCompleted());
        assertEquals(List.of(Orchestrator.EMPTY_SCOPE_WARNING), result.warnings());
        assertTrue(created.isEmpty());
    }

    @Test
    @DisplayName("abort stops the phase in flight and starts no further phase")
    void abort() {
        PhaseExecutor first = mock(PhaseExecutor.class);
        executors.put(1, first);
        stub(2, true);
        Orchestrator orchestrator = orchestrator(options().build(), false);
        when(first.execute()).thenAnswer(inv -> {
            orchestrator.abort();
            return result(1, false, true);
        });

        OrchestrationResult result = orchestrator.execute();

        assertTrue(result.aborted());
        assertFalse(result.success());
        assertEquals("aborted", result.status());
        assertEquals(0, result.phasesCompleted());
        assertEquals(0, result.phasesFailed());
        assertEquals(List.of(1), created);
        verify(first).abort();
        assertFalse(store.isApproved("impl-1"));
        assertEquals(OrchestrationEventType.ORCHESTRATION_ABORTED, eventTypes().get(eventTypes().size() - 1));
    }

    @Test
    @DisplayName("resume starts from the recorded current phase")
    void resume() {
        store.approvePhase("impl-1");
        store.setCurrentImplPhase(2);
        stub(2, true);
        stub(3, true);

        OrchestrationResult result = orchestrator(options().endPhase(3).build(), false).resume();

        assertTrue(result.success());
        assertEquals(List.of(2, 3), created);
        assertEquals(4, store.getCurrentImplPhase());
    }

    @Test
    @DisplayName("a phase that failed before later phases succeeded is picked up again by resume")
    void resumeReturnsToEarlierFailedPhase() {
        stub(1, false);
        stub(2, true);
        stub(3, true);

        orchestrator(options().stopOnFailure(false).build(), false).execute();

        assertTrue(store.isApproved("impl-2"));
        assertTrue(store.isApproved("impl-3"));
        assertEquals(1, store.getCurrentImplPhase());

        created.clear();
        stub(1, true);
        OrchestrationResult resumed = orchestrator(options().stopOnFailure(false).build(), false).resume();

        assertTrue(resumed.success());
        assertTrue(resumed.warnings().isEmpty());
        assertEquals(List.of(1, 2, 3), created);
        assertTrue(store.isApproved("impl-1"));
        assertEquals(4, store.getCurrentImplPhase());
    }

    @Test
    @DisplayName("blocked tasks keep their order and are reported in task ID order")
    void blockedTaskOrder() {
        Map<String, List<String>> blocked = new LinkedHashMap<>();
        blocked.put("1.10", List.of("1.9"));
        blocked.put("1.2", List.of("1.1"));
        blocked.put("1.3", List.of("1.1"));
        PhaseExecutionResult failedPhase = new PhaseExecutionResult(1, "Setup", false, false, 0, 1, 3, blocked,
                List.of(), List.of(), 3, null);
        PhaseExecutor executor = mock(PhaseExecutor.class);
        when(executor.execute()).thenReturn(failedPhase);
        executors.put(1, executor);

        orchestrator(options().endPhase(1).build(), false).execute();

        assertEquals(List.of("1.10", "1.2", "1.3"), List.copyOf(failedPhase.blockedTasks().keySet()));
        OrchestrationEvent phaseFailed = events.stream()
                .filter(e -> e.type() == OrchestrationEventType.PHASE_FAILED)
                .findFirst().orElseThrow();
        assertEquals(List.of("1.2", "1.3", "1.10"), phaseFailed.payload().get("blocked"));
    }

    @Test
    @DisplayName("a completed phase is checkpointed; git failures are tolerated")
    void checkpointAfterPhase() {
        stub(1, true);
        when(git.hasUncommittedChanges()).thenReturn(true);
        when(git.commit(anyString())).thenThrow(new GitException(GitException.OPERATION_FAILED, "commit failed", Map.of()));

        OrchestrationResult result = orchestrator(options().endPhase(1).build(), true).execute();

        assertTrue(result.success());
        verify(git).commit("checkpoint: Phase 1 complete: Setup");
        assertTrue(store.isApproved("impl-1"));
    }
}
