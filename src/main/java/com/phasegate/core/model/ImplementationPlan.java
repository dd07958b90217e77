package com.phasegate.core.model;

import java.util.List;

/**
 * Approved implementation plan as handed over by the planning step. Carries no execution
 * state; {@link #toPhases()} produces the phases with every task pending.
 *
 * @param projectName optional project display name
 * @param phases      phases in any order
 */
public record ImplementationPlan(String projectName, List<PlanPhase> phases) {

    public ImplementationPlan {
        phases = phases == null ? List.of() : List.copyOf(phases);
    }

    public List<ImplementationPhase> toPhases() {
        return phases.stream()
                .map(p -> new ImplementationPhase(p.phaseNumber(), p.name(), p.description(),
                        p.tasks().stream()
                                .map(t -> Task.pending(t.id(), t.description(), t.acceptanceCriteria(), t.dependsOn()))
                                .toList()))
                .toList();
    }

    public int taskCount() {
        return phases.stream().mapToInt(p -> p.tasks().size()).sum();
    }

    public record PlanPhase(int phaseNumber, String name, String description, List<PlanTask> tasks) {
        public PlanPhase {
            tasks = tasks == null ? List.of() : List.copyOf(tasks);
        }
    }

    public record PlanTask(String id, String description, List<String> acceptanceCriteria, List<String> dependsOn) {
        public PlanTask {
            acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
            dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        }
    }
}
