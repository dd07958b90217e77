package com.phasegate.agent;

/**
 * Outcome of a single agent invocation.
 *
 * @param success    true iff the agent exited with code 0 without timing out or being aborted
 * @param output     everything the agent wrote to stdout
 * @param error      stderr or a failure description, null when empty
 * @param exitCode   process exit code, -1 if the process never exited normally
 * @param durationMs wall time of the invocation
 * @param timedOut   the invocation was killed after exceeding its timeout
 * @param aborted    the invocation was killed by {@link AgentAdapter#abort()}
 */
public record AgentExecutionResult(
    boolean success,
    String output,
    String error,
    int exitCode,
    long durationMs,
    boolean timedOut,
    boolean aborted
) {

    public static AgentExecutionResult completed(String output, String error, int exitCode, long durationMs) {
        return new AgentExecutionResult(exitCode == 0, output, error, exitCode, durationMs, false, false);
    }

    public static AgentExecutionResult timedOut(String output, long durationMs) {
        return new AgentExecutionResult(false, output, "Execution timed out", -1, durationMs, true, false);
    }

    public static AgentExecutionResult aborted(String output, long durationMs) {
        return new AgentExecutionResult(false, output, "Execution aborted", -1, durationMs, false, true);
    }

    public static AgentExecutionResult failedToStart(String error, long durationMs) {
        return new AgentExecutionResult(false, "", error, -1, durationMs, false, false);
    }
}
