package com.phasegate.core.execution;

import com.phasegate.core.model.TaskResult.CriterionResult;

import java.util.List;

/**
 * Parsed response of a validation pass.
 *
 * @param passed   explicit status, or all criteria passing when no status line was given
 * @param criteria per-criterion status reported by the validator
 * @param summary  validator's explanation
 */
public record ValidationVerdict(boolean passed, List<CriterionResult> criteria, String summary) {}
