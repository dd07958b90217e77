package com.phasegate.core.state;

import com.phasegate.core.model.ImplementationPhase;
import com.phasegate.core.model.ProjectState;
import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskResult;
import com.phasegate.core.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Single gateway for reading and mutating project state.
 *
 * <p>All mutations go through the typed operations below so that task ID uniqueness
 * and status transitions are enforced in one place. Each mutation is persisted before
 * it returns; if persisting fails, the prior state is retained and a
 * {@link com.phasegate.core.errors.StateException} is thrown.
 */
public interface ProjectStateStore {

    /** Immutable view of the whole state at this moment. */
    ProjectState snapshot();

    String getProjectName();

    /** Phases in ascending phase-number order. */
    List<ImplementationPhase> getPhases();

    Optional<ImplementationPhase> getPhase(int phaseNumber);

    Optional<Task> findTask(String taskId);

    /** Every task of every phase, in plan order. */
    List<Task> getAllTasks();

    /**
     * Moves a task along the execution lifecycle: PENDING to IN_PROGRESS, and
     * IN_PROGRESS to COMPLETE, FAILED or back to PENDING.
     *
     * @param reason failure reason recorded with FAILED, ignored otherwise
     * @return the updated task
     */
    Task setTaskStatus(String taskId, TaskStatus status, String reason);

    /** Records a result for its task; earlier results are kept. */
    void appendResult(TaskResult result);

    Optional<TaskResult> getLatestResult(String taskId);

    List<TaskResult> getResults(String taskId);

    int getCurrentImplPhase();

    void setCurrentImplPhase(int phaseNumber);

    /** Records an approval such as "planning" or "impl-2". */
    void approvePhase(String approvalKey);

    boolean isApproved(String approvalKey);

    /**
     * Resets a failed task to PENDING so the next run picks it up again.
     *
     * @throws com.phasegate.core.errors.StateException task_not_found or task_not_failed
     */
    Task retryTask(String taskId);

    /**
     * Marks a pending or failed task as skipped, which satisfies tasks depending on it.
     */
    Task skipTask(String taskId, String reason);

    /**
     * Replaces the plan with the given phases and points the current phase at the first of them.
     * Results and approvals of the previous plan are dropped.
     *
     * @throws com.phasegate.core.errors.StateException on duplicate task IDs or phase numbers
     */
    default void addImplementationPhases(List<ImplementationPhase> phases) {
        addImplementationPhases(null, phases);
    }

    /**
     * Same as {@link #addImplementationPhases(List)}, also renaming the project when a name is given.
     *
     * @param projectName new project name, null or blank keeps the current one
     */
    void addImplementationPhases(String projectName, List<ImplementationPhase> phases);
}
