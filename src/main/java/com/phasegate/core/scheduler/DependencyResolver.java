package com.phasegate.core.scheduler;

import com.phasegate.core.errors.CircularDependencyException;
import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Dependency graph over an immutable snapshot of tasks: validation, readiness
 * queries and a deterministic topological order.
 *
 * <p>The resolver is stateless beyond its snapshot. Callers build a new one for
 * every scheduling round so the answers always reflect current task statuses.
 *
 * <p>Optional context tasks (typically tasks of other phases) are consulted only
 * when resolving a dependency's existence and status. They are never returned as
 * runnable, ordered or validated.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /** Orders dotted task IDs component-wise, so "1.2" precedes "1.10" precedes "2.1". */
    public static final Comparator<String> TASK_ID_ORDER = DependencyResolver::compareTaskIds;

    private enum Mark { UNVISITED, IN_PROGRESS, DONE }

    /** Tasks in scope, keyed by ID in snapshot order. */
    private final Map<String, Task> tasks = new LinkedHashMap<>();

    /** Scope plus context tasks, used for dependency lookups. */
    private final Map<String, Task> lookup = new HashMap<>();

    public DependencyResolver(List<Task> tasks) {
        this(tasks, List.of());
    }

    public DependencyResolver(List<Task> tasks, List<Task> contextTasks) {
        for (Task task : contextTasks) {
            lookup.putIfAbsent(task.id(), task);
        }
        for (Task task : tasks) {
            if (this.tasks.putIfAbsent(task.id(), task) != null) {
                log.warn("Duplicate task ID {} in snapshot, keeping the first occurrence", task.id());
                continue;
            }
            lookup.put(task.id(), task);
        }
    }

    /**
     * Checks the whole graph and reports every missing dependency, self-reference and cycle.
     * A self-reference is also reported as a single-task cycle.
     */
    public DependencyValidation validate() {
        List<DependencyIssue> issues = new ArrayList<>();

        for (Task task : tasks.values()) {
            if (task.dependsOn().contains(task.id())) {
                issues.add(new DependencyIssue(DependencyIssue.Type.SELF_REFERENCE, task.id(),
                        "Task %s depends on itself".formatted(task.id())));
            }
            for (String depId : task.dependsOn()) {
                if (!lookup.containsKey(depId)) {
                    issues.add(new DependencyIssue(DependencyIssue.Type.MISSING, task.id(),
                            "Task %s depends on non-existent task %s".formatted(task.id(), depId)));
                }
            }
        }

        for (List<String> cycle : findCycles()) {
            issues.add(new DependencyIssue(DependencyIssue.Type.CIRCULAR, cycle.get(0),
                    "Circular dependency: %s -> %s".formatted(String.join(" -> ", cycle), cycle.get(0))));
        }

        return DependencyValidation.of(issues);
    }

    /**
     * True only for a known, pending task whose dependencies all resolve to complete or skipped tasks.
     */
    public boolean canRun(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null || task.status() != TaskStatus.PENDING) {
            return false;
        }
        for (String depId : task.dependsOn()) {
            Task dep = lookup.get(depId);
            if (dep == null || !dep.status().satisfiesDependency()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Dependencies of the task that are not yet complete or skipped, in declared order.
     * A dependency on an unknown task is reported as blocking since it can never be satisfied.
     */
    public List<String> getBlockingDeps(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return List.of();
        }
        List<String> blocking = new ArrayList<>();
        for (String depId : task.dependsOn()) {
            Task dep = lookup.get(depId);
            if (dep == null || !dep.status().satisfiesDependency()) {
                blocking.add(depId);
            }
        }
        return blocking;
    }

    /**
     * The runnable task with the smallest ID, or null if nothing can run.
     */
    public Task getNextRunnable() {
        Task next = tasks.values().stream()
                .filter(t -> canRun(t.id()))
                .min(Comparator.comparing(Task::id, TASK_ID_ORDER))
                .orElse(null);
        if (next != null) {
            log.debug("Next runnable task: {}", next.id());
        }
        return next;
    }

    /**
     * Every task in scope, ordered so each task follows all of its dependencies.
     * Ties are broken by ID order.
     *
     * @throws CircularDependencyException if the graph has a cycle
     */
    public List<Task> getExecutionOrder() {
        List<List<String>> cycles = findCycles();
        if (!cycles.isEmpty()) {
            throw new CircularDependencyException(cycles);
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (String id : tasks.keySet()) {
            inDegree.put(id, 0);
            dependents.put(id, new ArrayList<>());
        }
        for (Task task : tasks.values()) {
            // Duplicate entries in dependsOn count once
            for (String depId : new HashSet<>(task.dependsOn())) {
                if (tasks.containsKey(depId)) {
                    dependents.get(depId).add(task.id());
                    inDegree.merge(task.id(), 1, Integer::sum);
                }
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>(TASK_ID_ORDER);
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<Task> order = new ArrayList<>(tasks.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(tasks.get(id));
            for (String dependent : dependents.get(id)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order;
    }

    /**
     * Every distinct cycle in scope, each as the ordered list of task IDs composing it.
     * Found by depth-first traversal with three-colour marking.
     */
    public List<List<String>> findCycles() {
        Map<String, Mark> marks = new HashMap<>();
        for (String id : tasks.keySet()) {
            marks.put(id, Mark.UNVISITED);
        }

        List<List<String>> cycles = new ArrayList<>();
        Set<List<String>> seen = new HashSet<>();
        List<String> path = new ArrayList<>();
        for (String id : tasks.keySet()) {
            if (marks.get(id) == Mark.UNVISITED) {
                visit(id, marks, path, cycles, seen);
            }
        }
        return cycles;
    }

    private void visit(String id, Map<String, Mark> marks, List<String> path,
                       List<List<String>> cycles, Set<List<String>> seen) {
        marks.put(id, Mark.IN_PROGRESS);
        path.add(id);

        for (String depId : tasks.get(id).dependsOn()) {
            Mark mark = marks.get(depId);
            if (mark == Mark.IN_PROGRESS) {
                List<String> cycle = List.copyOf(path.subList(path.indexOf(depId), path.size()));
                if (seen.add(canonical(cycle))) {
                    cycles.add(cycle);
                }
            } else if (mark == Mark.UNVISITED) {
                visit(depId, marks, path, cycles, seen);
            }
        }

        path.remove(path.size() - 1);
        marks.put(id, Mark.DONE);
    }

    /** Rotation of the cycle starting at its smallest ID, so the same cycle is reported once. */
    private static List<String> canonical(List<String> cycle) {
        int start = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (TASK_ID_ORDER.compare(cycle.get(i), cycle.get(start)) < 0) {
                start = i;
            }
        }
        List<String> rotated = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((start + i) % cycle.size()));
        }
        return rotated;
    }

    /**
     * Compares dotted IDs component by component. Numeric components compare numerically,
     * anything else lexically; a shorter ID precedes a longer one it prefixes.
     */
    public static int compareTaskIds(String a, String b) {
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.min(left.length, right.length); i++) {
            int cmp = compareComponent(left[i], right[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        if (left.length != right.length) {
            return Integer.compare(left.length, right.length);
        }
        return a.compareTo(b);
    }

    private static int compareComponent(String a, String b) {
        boolean numericA = isNumeric(a);
        boolean numericB = isNumeric(b);
        if (numericA && numericB) {
            String x = stripLeadingZeros(a);
            String y = stripLeadingZeros(b);
            if (x.length() != y.length()) {
                return Integer.compare(x.length(), y.length());
            }
            return x.compareTo(y);
        }
        if (numericA != numericB) {
            // Numbers sort before words
            return numericA ? -1 : 1;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String s) {
        int i = 0;
        while (i < s.length() - 1 && s.charAt(i) == '0') {
            i++;
        }
        return s.substring(i);
    }
}
