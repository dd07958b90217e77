package com.phasegate.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * An ordered group of tasks making up one implementation milestone.
 *
 * @param phaseNumber positive, unique number defining the phase order
 * @param name        short phase name, used in branch names
 * @param description what the phase delivers
 * @param tasks       tasks in plan order
 */
public record ImplementationPhase(
    int phaseNumber,
    String name,
    String description,
    List<Task> tasks
) implements Serializable {

    public ImplementationPhase {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public Optional<Task> findTask(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public ImplementationPhase withTasks(List<Task> newTasks) {
        return new ImplementationPhase(phaseNumber, name, description, newTasks);
    }

    /** Approval key recorded once this phase has completed. */
    public String approvalKey() {
        return "impl-" + phaseNumber;
    }
}
