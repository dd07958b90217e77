package com.phasegate.core.execution;

import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskStatus;

import java.util.List;

/**
 * Builds the prompts sent to the coding agent.
 * Pure functions, no Spring dependencies.
 */
public final class TaskPromptBuilder {

    /** Heading the agent must emit once it considers the task done. */
    public static final String COMPLETION_MARKER = "## Task Complete";

    static final int MAX_VALIDATION_OUTPUT = 5_000;
    static final int MAX_RETRY_OUTPUT = 2_000;
    private static final int MAX_PREVIOUS_TASKS = 5;

    private TaskPromptBuilder() {}

    public static String buildTaskPrompt(Task task, TaskContext context) {
        var sb = new StringBuilder();

        sb.append("# Project: ").append(context.projectName()).append("\n");
        sb.append("Phase ").append(context.phaseNumber()).append(": ").append(context.phaseName()).append("\n");
        if (context.phaseDescription() != null && !context.phaseDescription().isBlank()) {
            sb.append("\n").append(context.phaseDescription().strip()).append("\n");
        }
        sb.append("\n");

        appendTask(sb, task);

        List<Task> completed = context.previousTasks().stream()
                .filter(t -> t.status() == TaskStatus.COMPLETE)
                .toList();
        if (!completed.isEmpty()) {
            sb.append("## Previously Completed Tasks\n");
            for (Task t : completed.subList(Math.max(0, completed.size() - MAX_PREVIOUS_TASKS), completed.size())) {
                sb.append("- ").append(t.id()).append(": ").append(t.description()).append("\n");
            }
            sb.append("\n");
        }

        sb.append("## Instructions\n");
        sb.append("1. Implement the task described above\n");
        sb.append("2. Ensure all acceptance criteria are met\n");
        sb.append("3. Follow existing code patterns and conventions\n");
        sb.append("4. Write or update tests for the behavior you change\n\n");

        sb.append("### Output Format\n");
        sb.append("When complete, finish your response with a report in exactly this format:\n");
        sb.append("```\n");
        sb.append(COMPLETION_MARKER).append("\n");
        sb.append("### Summary\n");
        sb.append("One short paragraph describing what was done.\n\n");
        sb.append("### Files Created\n");
        sb.append("- path/to/new-file\n\n");
        sb.append("### Files Modified\n");
        sb.append("- path/to/file: description of changes\n\n");
        sb.append("### Files Deleted\n");
        sb.append("- path/to/removed-file\n\n");
        sb.append("### Key Decisions\n");
        sb.append("- decision: rationale\n\n");
        sb.append("### Assumptions\n");
        sb.append("- assumption\n\n");
        sb.append("### Tests\n");
        sb.append("Added: 0, Passing: 0, Failing: 0\n\n");
        sb.append("### Acceptance Criteria Status\n");
        for (int i = 0; i < task.acceptanceCriteria().size(); i++) {
            sb.append(i + 1).append(". [PASS/FAIL] ").append(task.acceptanceCriteria().get(i))
                    .append(" - evidence\n");
        }
        sb.append("```\n");
        sb.append("Leave out sections that do not apply. Mark a criterion FAIL if it is not fully met.\n");

        return sb.toString();
    }

    public static String buildValidationPrompt(Task task, String executionOutput) {
        var sb = new StringBuilder();
        sb.append("# Task Validation\n\n");
        sb.append("## Original Task\n");
        sb.append(task.description()).append("\n\n");

        sb.append("## Acceptance Criteria\n");
        appendCriteria(sb, task);

        sb.append("\n## Execution Output\n");
        sb.append("```\n").append(truncate(executionOutput, MAX_VALIDATION_OUTPUT)).append("\n```\n\n");

        sb.append("## Instructions\n");
        sb.append("Analyze the execution output and the current state of the project and determine:\n");
        sb.append("1. Was the task completed successfully?\n");
        sb.append("2. Were all acceptance criteria met?\n\n");

        sb.append("Respond in this format:\n");
        sb.append("```\n");
        sb.append("## Validation Result\n");
        sb.append("Status: [PASS/FAIL]\n\n");
        sb.append("### Criteria Status\n");
        sb.append("1. [PASS/FAIL] First criterion - reason\n\n");
        sb.append("### Summary\n");
        sb.append("Brief explanation of the validation result.\n");
        sb.append("```\n");
        return sb.toString();
    }

    /**
     * The original task prompt followed by the failure of the previous attempt.
     */
    public static String buildRetryPrompt(Task task, TaskContext context, String previousOutput,
                                          String failureReason) {
        var sb = new StringBuilder(buildTaskPrompt(task, context));
        sb.append("\n## Previous Attempt Failed\n");
        sb.append("Reason: ").append(failureReason == null || failureReason.isBlank()
                ? "Unknown failure" : failureReason).append("\n\n");
        sb.append("### Previous Output (truncated)\n");
        sb.append("```\n").append(truncate(previousOutput, MAX_RETRY_OUTPUT)).append("\n```\n\n");
        sb.append("### Retry Instructions\n");
        sb.append("Fix the issues from the previous attempt, focusing on the failure reason above.\n");
        return sb.toString();
    }

    private static void appendTask(StringBuilder sb, Task task) {
        sb.append("## Task ").append(task.id()).append("\n");
        sb.append(task.description()).append("\n\n");

        sb.append("### Acceptance Criteria\n");
        appendCriteria(sb, task);

        if (!task.dependsOn().isEmpty()) {
            sb.append("\n### Dependencies\n");
            sb.append("This task builds on: ").append(String.join(", ", task.dependsOn())).append("\n");
        }
        sb.append("\n");
    }

    private static void appendCriteria(StringBuilder sb, Task task) {
        List<String> criteria = task.acceptanceCriteria();
        for (int i = 0; i < criteria.size(); i++) {
            sb.append(i + 1).append(". ").append(criteria.get(i)).append("\n");
        }
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
