package com.phasegate.core.errors;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * No execution order exists because the task graph contains at least one cycle.
 */
public class CircularDependencyException extends PhasegateException {

    private final List<List<String>> cycles;

    public CircularDependencyException(List<List<String>> cycles) {
        super("circular_dependency",
                "Cannot determine execution order: circular dependencies detected: " + describe(cycles),
                Map.of("cycles", cycles));
        this.cycles = List.copyOf(cycles);
    }

    public List<List<String>> getCycles() {
        return cycles;
    }

    private static String describe(List<List<String>> cycles) {
        return cycles.stream()
                .map(c -> String.join(" -> ", c) + " -> " + c.get(0))
                .collect(Collectors.joining(", "));
    }
}
