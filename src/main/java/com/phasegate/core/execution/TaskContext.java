package com.phasegate.core.execution;

import com.phasegate.core.model.Task;

import java.util.List;

/**
 * Project and phase context supplied by the caller for prompt construction.
 *
 * @param projectName      project display name
 * @param phaseNumber      number of the phase the task belongs to
 * @param phaseName        phase name
 * @param phaseDescription phase description, may be null
 * @param previousTasks    tasks of the phase that ran before this one
 */
public record TaskContext(
    String projectName,
    int phaseNumber,
    String phaseName,
    String phaseDescription,
    List<Task> previousTasks
) {

    public TaskContext {
        previousTasks = previousTasks == null ? List.of() : List.copyOf(previousTasks);
    }

    public TaskContext withPreviousTasks(List<Task> tasks) {
        return new TaskContext(projectName, phaseNumber, phaseName, phaseDescription, tasks);
    }
}
