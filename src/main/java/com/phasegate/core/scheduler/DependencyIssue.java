package com.phasegate.core.scheduler;

/**
 * A problem found in a task dependency graph.
 *
 * @param type    kind of problem
 * @param taskId  task the problem is attributed to
 * @param details human-readable description
 */
public record DependencyIssue(Type type, String taskId, String details) {

    public enum Type {
        /** Dependency ID not present in the task set. */
        MISSING,
        /** Task lists itself as a dependency. */
        SELF_REFERENCE,
        /** Task participates in a dependency cycle. */
        CIRCULAR
    }
}
