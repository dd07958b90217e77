package com.phasegate.core.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.phasegate.core.errors.StateException;
import com.phasegate.core.model.ImplementationPhase;
import com.phasegate.core.model.ProjectState;
import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskResult;
import com.phasegate.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * {@link ProjectStateStore} persisted as a single JSON document.
 *
 * <p>Writes go to a temporary file in the same directory which is then atomically
 * moved over the state file, so a reader sees either the old or the new document.
 * The in-memory state is replaced only after the write succeeded.
 */
public class JsonProjectStateStore implements ProjectStateStore {

    private static final Logger log = LoggerFactory.getLogger(JsonProjectStateStore.class);

    public static final String STATE_FILE = "state.json";

    private final Path stateFile;
    private final ObjectMapper mapper;
    private ProjectState state;

    /**
     * Opens the store, loading existing state if the file exists.
     *
     * @param stateFile   path of the JSON state document
     * @param mapper      mapper configured by {@link #defaultMapper()}
     * @param projectName name used when no state exists yet
     */
    public JsonProjectStateStore(Path stateFile, ObjectMapper mapper, String projectName) {
        this.stateFile = stateFile;
        this.mapper = mapper;
        this.state = Files.exists(stateFile) ? read() : ProjectState.empty(projectName);
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getStateFile() {
        return stateFile;
    }

    @Override
    public synchronized ProjectState snapshot() {
        return state;
    }

    @Override
    public synchronized String getProjectName() {
        return state.projectName();
    }

    @Override
    public synchronized List<ImplementationPhase> getPhases() {
        return state.phases();
    }

    @Override
    public synchronized Optional<ImplementationPhase> getPhase(int phaseNumber) {
        return state.phases().stream().filter(p -> p.phaseNumber() == phaseNumber).findFirst();
    }

    @Override
    public synchronized Optional<Task> findTask(String taskId) {
        return getAllTasks().stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    @Override
    public synchronized List<Task> getAllTasks() {
        return state.phases().stream().flatMap(p -> p.tasks().stream()).toList();
    }

    @Override
    public synchronized Task setTaskStatus(String taskId, TaskStatus status, String reason) {
        Task current = requireTask(taskId);
        if (!isAllowed(current.status(), status)) {
            throw StateException.invalidTransition(taskId, current.status(), status);
        }
        Instant now = Instant.now();
        Task updated = switch (status) {
            case IN_PROGRESS -> current.withStatus(status).withFailureReason(null).withTimes(now, null);
            case PENDING -> current.withStatus(status).withFailureReason(null).withTimes(null, null);
            case FAILED -> current.withStatus(status).withFailureReason(reason)
                    .withTimes(current.startedAt(), now);
            default -> current.withStatus(status).withFailureReason(null)
                    .withTimes(current.startedAt(), now);
        };
        replaceTask(updated);
        log.debug("Task {} {} -> {}", taskId, current.status(), status);
        return updated;
    }

    @Override
    public synchronized void appendResult(TaskResult result) {
        Task task = requireTask(result.taskId());
        Map<String, List<TaskResult>> results = new HashMap<>(state.results());
        List<TaskResult> forTask = new ArrayList<>(results.getOrDefault(result.taskId(), List.of()));
        forTask.add(result);
        results.put(result.taskId(), forTask);

        List<ImplementationPhase> phases = result.commitHash() == null
                ? state.phases()
                : withTask(state.phases(), task.withCommitHash(result.commitHash()));
        save(new ProjectState(state.projectName(), phases, state.currentImplPhase(), state.approvals(),
                results, state.totalTokens() + result.usage().tokens(),
                state.totalCostUsd() + result.usage().costUsd(), Instant.now()));
    }

    @Override
    public synchronized Optional<TaskResult> getLatestResult(String taskId) {
        List<TaskResult> results = state.results().getOrDefault(taskId, List.of());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(results.size() - 1));
    }

    @Override
    public synchronized List<TaskResult> getResults(String taskId) {
        return List.copyOf(state.results().getOrDefault(taskId, List.of()));
    }

    @Override
    public synchronized int getCurrentImplPhase() {
        return state.currentImplPhase();
    }

    @Override
    public synchronized void setCurrentImplPhase(int phaseNumber) {
        update(s -> new ProjectState(s.projectName(), s.phases(), phaseNumber, s.approvals(), s.results(),
                s.totalTokens(), s.totalCostUsd(), Instant.now()));
    }

    @Override
    public synchronized void approvePhase(String approvalKey) {
        Map<String, Instant> approvals = new LinkedHashMap<>(state.approvals());
        approvals.put(approvalKey, Instant.now());
        update(s -> new ProjectState(s.projectName(), s.phases(), s.currentImplPhase(), approvals, s.results(),
                s.totalTokens(), s.totalCostUsd(), Instant.now()));
        log.info("Approved {}", approvalKey);
    }

    @Override
    public synchronized boolean isApproved(String approvalKey) {
        return state.approvals().containsKey(approvalKey);
    }

    @Override
    public synchronized Task retryTask(String taskId) {
        Task current = requireTask(taskId);
        if (current.status() != TaskStatus.FAILED) {
            throw StateException.taskNotFailed(taskId, current.status());
        }
        Task reset = current.withStatus(TaskStatus.PENDING).withFailureReason(null)
                .withTimes(null, null).withCommitHash(null);
        replaceTask(reset);
        log.info("Task {} reset for retry", taskId);
        return reset;
    }

    @Override
    public synchronized Task skipTask(String taskId, String reason) {
        Task current = requireTask(taskId);
        if (current.status() != TaskStatus.PENDING && current.status() != TaskStatus.FAILED) {
            throw StateException.invalidTransition(taskId, current.status(), TaskStatus.SKIPPED);
        }
        Task skipped = current.withStatus(TaskStatus.SKIPPED).withFailureReason(reason)
                .withTimes(current.startedAt(), Instant.now());
        Map<String, List<TaskResult>> results = new HashMap<>(state.results());
        List<TaskResult> forTask = new ArrayList<>(results.getOrDefault(taskId, List.of()));
        forTask.add(TaskResult.skipped(skipped, reason));
        results.put(taskId, forTask);
        // status and result land in one write
        save(new ProjectState(state.projectName(), withTask(state.phases(), skipped), state.currentImplPhase(),
                state.approvals(), results, state.totalTokens(), state.totalCostUsd(), Instant.now()));
        log.info("Task {} skipped: {}", taskId, reason);
        return skipped;
    }

    @Override
    public synchronized void addImplementationPhases(String projectName, List<ImplementationPhase> phases) {
        Set<Integer> numbers = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (ImplementationPhase phase : phases) {
            if (!numbers.add(phase.phaseNumber())) {
                throw StateException.duplicatePhaseNumber(phase.phaseNumber());
            }
            for (Task task : phase.tasks()) {
                if (!ids.add(task.id())) {
                    throw StateException.duplicateTaskId(task.id());
                }
            }
        }
        List<ImplementationPhase> sorted = phases.stream()
                .sorted(Comparator.comparingInt(ImplementationPhase::phaseNumber))
                .toList();
        int first = sorted.isEmpty() ? 0 : sorted.get(0).phaseNumber();
        String name = projectName == null || projectName.isBlank() ? state.projectName() : projectName;
        update(s -> new ProjectState(name, sorted, first, Map.of(), Map.of(),
                s.totalTokens(), s.totalCostUsd(), Instant.now()));
        log.info("Loaded {} implementation phases with {} tasks", sorted.size(), ids.size());
    }

    private static boolean isAllowed(TaskStatus from, TaskStatus to) {
        return switch (from) {
            case PENDING -> to == TaskStatus.IN_PROGRESS;
            case IN_PROGRESS -> to == TaskStatus.COMPLETE || to == TaskStatus.FAILED || to == TaskStatus.PENDING;
            default -> false;
        };
    }

    private Task requireTask(String taskId) {
        return findTask(taskId).orElseThrow(() -> StateException.taskNotFound(taskId));
    }

    private void replaceTask(Task updated) {
        List<ImplementationPhase> phases = withTask(state.phases(), updated);
        update(s -> new ProjectState(s.projectName(), phases, s.currentImplPhase(), s.approvals(), s.results(),
                s.totalTokens(), s.totalCostUsd(), Instant.now()));
    }

    private static List<ImplementationPhase> withTask(List<ImplementationPhase> phases, Task updated) {
        List<ImplementationPhase> result = new ArrayList<>(phases.size());
        for (ImplementationPhase phase : phases) {
            List<Task> tasks = phase.tasks().stream()
                    .map(t -> t.id().equals(updated.id()) ? updated : t)
                    .toList();
            result.add(phase.withTasks(tasks));
        }
        return result;
    }

    private void update(UnaryOperator<ProjectState> change) {
        save(change.apply(state));
    }

    private void save(ProjectState next) {
        try {
            Files.createDirectories(stateFile.toAbsolutePath().getParent());
            Path temp = Files.createTempFile(stateFile.toAbsolutePath().getParent(), STATE_FILE, ".tmp");
            try {
                mapper.writeValue(temp.toFile(), next);
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            log.error("Failed to save project state to {}", stateFile, e);
            throw StateException.persistenceFailed(stateFile, e);
        }
        state = next;
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", stateFile);
            Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private ProjectState read() {
        try {
            return mapper.readValue(stateFile.toFile(), ProjectState.class);
        } catch (IOException e) {
            throw new StateException(StateException.PERSISTENCE_FAILED,
                    "Failed to read project state from " + stateFile, Map.of("path", stateFile.toString()), e);
        }
    }
}
