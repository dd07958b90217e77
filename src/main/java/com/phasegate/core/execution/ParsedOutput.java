package com.phasegate.core.execution;

import com.phasegate.core.model.TaskResult.CriterionResult;
import com.phasegate.core.model.TaskResult.FileChanges;
import com.phasegate.core.model.TaskResult.KeyDecision;
import com.phasegate.core.model.TaskResult.TestCounts;
import com.phasegate.core.model.TaskResult.Usage;

import java.util.List;

/**
 * Structured report extracted from agent output.
 *
 * @param completed    the completion marker was present
 * @param summary      summary text, empty if none could be found
 * @param files        reported file changes
 * @param keyDecisions reported decisions
 * @param assumptions  reported assumptions
 * @param tests        reported test counts
 * @param criteria     reported per-criterion status
 * @param usage        reported token and cost usage
 */
public record ParsedOutput(
    boolean completed,
    String summary,
    FileChanges files,
    List<KeyDecision> keyDecisions,
    List<String> assumptions,
    TestCounts tests,
    List<CriterionResult> criteria,
    Usage usage
) {

    public List<CriterionResult> failingCriteria() {
        return criteria.stream().filter(c -> !c.met()).toList();
    }
}
