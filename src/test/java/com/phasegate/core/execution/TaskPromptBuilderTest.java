package com.phasegate.core.execution;

import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskPromptBuilderTest {

    private final Task task = Task.pending("2.3", "Add login endpoint",
            List.of("Returns a token", "Rejects bad passwords"), List.of("2.1", "2.2"));

    private final TaskContext context = new TaskContext("shop", 2, "Auth", "User authentication", List.of());

    @Test
    @DisplayName("task prompt includes project, task, criteria and dependencies")
    void taskPrompt() {
        String prompt = TaskPromptBuilder.buildTaskPrompt(task, context);

        assertTrue(prompt.contains("# Project: shop"));
        assertTrue(prompt.contains("Phase 2: Auth"));
        assertTrue(prompt.contains("User authentication"));
        assertTrue(prompt.contains("## Task 2.3"));
        assertTrue(prompt.contains("1. Returns a token"));
        assertTrue(prompt.contains("2. Rejects bad passwords"));
        assertTrue(prompt.contains("This task builds on: 2.1, 2.2"));
        assertTrue(prompt.contains(TaskPromptBuilder.COMPLETION_MARKER));
        assertTrue(prompt.contains("2. [PASS/FAIL] Rejects bad passwords - evidence"));
    }

    @Test
    @DisplayName("only the last five completed tasks are listed")
    void previousTasks() {
        List<Task> previous = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            previous.add(Task.pending("1." + i, "Earlier " + i, List.of(), List.of()).withStatus(TaskStatus.COMPLETE));
        }
        previous.add(Task.pending("1.8", "Still open", List.of(), List.of()));

        String prompt = TaskPromptBuilder.buildTaskPrompt(task, context.withPreviousTasks(previous));

        assertTrue(prompt.contains("## Previously Completed Tasks"));
        assertFalse(prompt.contains("1.2: Earlier 2"));
        assertTrue(prompt.contains("1.3: Earlier 3"));
        assertTrue(prompt.contains("1.7: Earlier 7"));
        assertFalse(prompt.contains("Still open"));
    }

    @Test
    @DisplayName("validation prompt truncates long output")
    void validationPrompt() {
        String output = "x".repeat(TaskPromptBuilder.MAX_VALIDATION_OUTPUT + 100);
        String prompt = TaskPromptBuilder.buildValidationPrompt(task, output);

        assertTrue(prompt.startsWith("# Task Validation"));
        assertTrue(prompt.contains("Status: [PASS/FAIL]"));
        assertTrue(prompt.contains("x".repeat(TaskPromptBuilder.MAX_VALIDATION_OUTPUT)));
        assertFalse(prompt.contains("x".repeat(TaskPromptBuilder.MAX_VALIDATION_OUTPUT + 1)));
    }

    @Test
    @DisplayName("retry prompt appends failure reason and truncated output")
    void retryPrompt() {
        String output = "y".repeat(TaskPromptBuilder.MAX_RETRY_OUTPUT + 50);
        String prompt = TaskPromptBuilder.buildRetryPrompt(task, context, output, "No completion marker");

        assertTrue(prompt.startsWith(TaskPromptBuilder.buildTaskPrompt(task, context)));
        assertTrue(prompt.contains("Reason: No completion marker"));
        assertTrue(prompt.contains("y".repeat(TaskPromptBuilder.MAX_RETRY_OUTPUT)));
        assertFalse(prompt.contains("y".repeat(TaskPromptBuilder.MAX_RETRY_OUTPUT + 1)));
    }

    @Test
    @DisplayName("retry prompt tolerates a missing reason")
    void retryPromptWithoutReason() {
        String prompt = TaskPromptBuilder.buildRetryPrompt(task, context, null, null);
        assertTrue(prompt.contains("Reason: Unknown failure"));
    }
}
