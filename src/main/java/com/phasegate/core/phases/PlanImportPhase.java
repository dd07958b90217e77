package com.phasegate.core.phases;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.errors.PlanException;
import com.phasegate.core.model.ImplementationPlan;
import com.phasegate.core.model.Task;
import com.phasegate.core.scheduler.DependencyIssue;
import com.phasegate.core.scheduler.DependencyResolver;
import com.phasegate.core.state.ProjectStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads an implementation plan from a JSON file into the project state. The plan still needs a
 * human approval of {@link #PLANNING_APPROVAL} before anything runs.
 * <p>
 * The whole plan is checked before anything is stored: phase numbers must be positive and unique,
 * task IDs non-blank and unique across phases, and the dependency graph over all tasks free of
 * missing, self and circular references. Every problem found is reported, not just the first.
 */
public class PlanImportPhase implements PhaseRunner<Path, ImplementationPlan> {

    private static final Logger log = LoggerFactory.getLogger(PlanImportPhase.class);

    public static final String PLANNING_APPROVAL = "planning";

    private final ProjectStateStore store;
    private final ObjectMapper mapper;

    public PlanImportPhase(ProjectStateStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "Plan import";
    }

    @Override
    public void setup(Path planFile) {
        if (planFile == null || !Files.isRegularFile(planFile)) {
            throw new PlanException("Plan file not found: " + planFile, List.of("missing file " + planFile));
        }
        if (!store.getPhases().isEmpty()) {
            log.warn("Replacing existing plan with {} phases", store.getPhases().size());
        }
    }

    @Override
    public ImplementationPlan execute(Path planFile) {
        ImplementationPlan plan;
        try {
            plan = mapper.readValue(planFile.toFile(), ImplementationPlan.class);
        } catch (IOException e) {
            throw new PlanException("Could not read plan " + planFile + ": " + e.getMessage(), e);
        }
        List<String> problems = check(plan);
        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("Plan problem: {}", p));
            throw new PlanException("Plan has %d problem(s): %s".formatted(problems.size(),
                    String.join("; ", problems)), problems);
        }
        log.info("Plan {} valid: {} phases, {} tasks", planFile, plan.phases().size(), plan.taskCount());
        return plan;
    }

    @Override
    public void persist(ImplementationPlan plan) {
        store.addImplementationPhases(plan.projectName(), plan.toPhases());
    }

    static List<String> check(ImplementationPlan plan) {
        List<String> problems = new ArrayList<>();
        if (plan.phases().isEmpty()) {
            problems.add("plan has no phases");
            return problems;
        }
        Set<Integer> numbers = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (ImplementationPlan.PlanPhase phase : plan.phases()) {
            if (phase.phaseNumber() <= 0) {
                problems.add("phase '%s' has non-positive number %d".formatted(phase.name(), phase.phaseNumber()));
            } else if (!numbers.add(phase.phaseNumber())) {
                problems.add("duplicate phase number " + phase.phaseNumber());
            }
            for (ImplementationPlan.PlanTask task : phase.tasks()) {
                if (task.id() == null || task.id().isBlank()) {
                    problems.add("phase %d has a task without id".formatted(phase.phaseNumber()));
                } else if (!ids.add(task.id())) {
                    problems.add("duplicate task id " + task.id());
                }
            }
        }
        if (!problems.isEmpty()) {
            return problems;
        }

        List<Task> tasks = plan.toPhases().stream()
                .flatMap(p -> p.tasks().stream())
                .toList();
        for (DependencyIssue issue : new DependencyResolver(tasks).validate().issues()) {
            problems.add("%s: %s".formatted(issue.type().name().toLowerCase(), issue.details()));
        }
        return problems;
    }
}
