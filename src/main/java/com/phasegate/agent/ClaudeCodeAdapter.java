package com.phasegate.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs tasks through the Claude Code CLI in print mode.
 *
 * <p>Shells out via {@link ProcessBuilder}; stdout is streamed line by line to the
 * caller while stderr is collected for the result. One invocation at a time.
 */
public class ClaudeCodeAdapter implements AgentAdapter {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCodeAdapter.class);

    private static final long STREAM_DRAIN_MS = 5_000;

    private final Path workDir;
    private final String cliPath;
    private final int maxTurns;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean aborted;
    private volatile Process current;

    /**
     * @param workDir  directory the agent runs in (the project root)
     * @param cliPath  path or name of the {@code claude} executable
     * @param maxTurns value passed as {@code --max-turns}
     */
    public ClaudeCodeAdapter(Path workDir, String cliPath, int maxTurns) {
        this.workDir = workDir;
        this.cliPath = cliPath;
        this.maxTurns = maxTurns;
    }

    @Override
    public AgentExecutionResult executeStream(String prompt, Duration timeout, Consumer<String> onChunk) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("An agent invocation is already in progress");
        }
        aborted = false;
        long start = System.currentTimeMillis();
        List<String> command = buildCommand(prompt);
        log.debug("Running agent: {} (timeout {}s)", command.get(0), timeout.toSeconds());

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .start();
            process.getOutputStream().close();
        } catch (IOException e) {
            running.set(false);
            log.error("Failed to start agent {}: {}", cliPath, e.getMessage());
            return AgentExecutionResult.failedToStart("Failed to start agent: " + e.getMessage(),
                    System.currentTimeMillis() - start);
        }
        current = process;

        StringBuffer stdout = new StringBuffer();
        StringBuffer stderr = new StringBuffer();
        Thread stdoutReader = pump(process.getInputStream(), line -> {
            String chunk = line + "\n";
            stdout.append(chunk);
            try {
                onChunk.accept(chunk);
            } catch (Exception e) {
                log.warn("Output listener failed: {}", e.getMessage());
            }
        }, "agent-stdout");
        Thread stderrReader = pump(process.getErrorStream(), line -> stderr.append(line).append('\n'),
                "agent-stderr");

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Agent exceeded timeout of {}s, killing it", timeout.toSeconds());
                kill(process);
                process.waitFor(STREAM_DRAIN_MS, TimeUnit.MILLISECONDS);
            }
            stdoutReader.join(STREAM_DRAIN_MS);
            stderrReader.join(STREAM_DRAIN_MS);

            long duration = System.currentTimeMillis() - start;
            if (aborted) {
                return AgentExecutionResult.aborted(stdout.toString(), duration);
            }
            if (!finished) {
                return AgentExecutionResult.timedOut(stdout.toString(), duration);
            }
            int exitCode = process.exitValue();
            log.debug("Agent exited with code {} after {} ms", exitCode, duration);
            String error = stderr.length() == 0 ? null : stderr.toString();
            return AgentExecutionResult.completed(stdout.toString(), error, exitCode, duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            return AgentExecutionResult.aborted(stdout.toString(), System.currentTimeMillis() - start);
        } finally {
            current = null;
            running.set(false);
        }
    }

    @Override
    public void abort() {
        aborted = true;
        Process process = current;
        if (process != null) {
            log.info("Aborting agent process {}", process.pid());
            kill(process);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Builds the agent command line for a prompt.
     */
    List<String> buildCommand(String prompt) {
        return List.of(cliPath, "--print", "--max-turns", String.valueOf(maxTurns), "-p", prompt);
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static Thread pump(InputStream stream, Consumer<String> lineConsumer, String name) {
        Thread thread = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineConsumer.accept(line);
                }
            } catch (IOException e) {
                // Stream closes when the process is killed
                log.debug("{} closed: {}", name, e.getMessage());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
