package com.phasegate.core.errors;

import java.util.List;
import java.util.Map;

/**
 * An implementation plan could not be loaded or failed validation.
 */
public class PlanException extends PhasegateException {

    private final List<String> problems;

    public PlanException(String message, List<String> problems) {
        super("invalid_plan", message, Map.of("problems", problems));
        this.problems = List.copyOf(problems);
    }

    public PlanException(String message, Throwable cause) {
        super("invalid_plan", message, Map.of(), cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
