package com.phasegate.core.scheduler;

import java.util.List;

/**
 * Full result of validating a dependency graph; never short-circuits on the first problem.
 *
 * @param valid  true iff there are no issues
 * @param issues every issue found
 */
public record DependencyValidation(boolean valid, List<DependencyIssue> issues) {

    public DependencyValidation {
        issues = List.copyOf(issues);
    }

    public static DependencyValidation of(List<DependencyIssue> issues) {
        return new DependencyValidation(issues.isEmpty(), issues);
    }

    public long count(DependencyIssue.Type type) {
        return issues.stream().filter(i -> i.type() == type).count();
    }
}
