package com.phasegate.agent;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Abstraction over the external coding agent that performs the work of a task.
 * Implementations: ClaudeCodeAdapter (Claude Code CLI).
 *
 * <p>Output is treated as unstructured text; locating a completion marker and
 * criteria status in it is the caller's job.
 */
public interface AgentAdapter {

    /**
     * Runs the prompt and waits for the agent to finish, streaming stdout to {@code onChunk}
     * as it arrives. Never throws for agent-side failures; they are reported in the result.
     *
     * @param prompt  full prompt text
     * @param timeout per-invocation limit; the agent is killed once it elapses
     * @param onChunk receives output chunks in order
     */
    AgentExecutionResult executeStream(String prompt, Duration timeout, Consumer<String> onChunk);

    /**
     * Runs the prompt without streaming.
     */
    default AgentExecutionResult execute(String prompt, Duration timeout) {
        return executeStream(prompt, timeout, chunk -> {});
    }

    /**
     * Stops the in-flight invocation, if any. The pending call returns promptly with an aborted result.
     */
    void abort();

    /**
     * Whether an invocation is currently in flight.
     */
    boolean isRunning();
}
