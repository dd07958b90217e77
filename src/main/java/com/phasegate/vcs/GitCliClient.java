package com.phasegate.vcs;

import com.phasegate.core.errors.GitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link GitClient} backed by the {@code git} CLI.
 *
 * <p>This class shells out to {@code git} via {@link ProcessBuilder}
 * rather than depending on JGit.
 */
public class GitCliClient implements GitClient {

    private static final Logger log = LoggerFactory.getLogger(GitCliClient.class);

    private final Path workDir;

    /**
     * @param workDir repository working directory
     */
    public GitCliClient(Path workDir) {
        this.workDir = workDir;
    }

    @Override
    public boolean isRepo() {
        return runGit("rev-parse", "--is-inside-work-tree").exitCode() == 0;
    }

    @Override
    public boolean branchExists(String name) {
        return runGit("rev-parse", "--verify", "--quiet", "refs/heads/" + name).exitCode() == 0;
    }

    @Override
    public void createBranch(String name) {
        log.info("Creating branch '{}'", name);
        require(runGit("checkout", "-b", name), "checkout -b " + name);
    }

    @Override
    public void checkout(String name) {
        log.info("Checking out branch '{}'", name);
        require(runGit("checkout", name), "checkout " + name);
    }

    @Override
    public boolean hasUncommittedChanges() {
        GitResult status = runGit("status", "--porcelain");
        if (status.exitCode() != 0) {
            throw notRepoOrFailed(status, "status");
        }
        return !status.output().isBlank();
    }

    @Override
    public void add() {
        require(runGit("add", "-A"), "add");
    }

    @Override
    public String commit(String message) {
        require(runGit("commit", "-m", message), "commit");
        String hash = require(runGit("rev-parse", "HEAD"), "rev-parse HEAD").output().strip();
        log.info("Committed {}: {}", abbreviate(hash), message);
        return hash;
    }

    @Override
    public String getCurrentBranch() {
        GitResult result = runGit("rev-parse", "--abbrev-ref", "HEAD");
        if (result.exitCode() != 0) {
            return null;
        }
        String branch = result.output().strip();
        return branch.isEmpty() || "HEAD".equals(branch) ? null : branch;
    }

    /**
     * Runs a git command in the working directory and captures its combined output.
     *
     * @param args git arguments (e.g. "checkout", "-b", "branch-name")
     * @return exit code and output
     */
    GitResult runGit(String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.debug("git exited with code {}: {}", exitCode, output);
            }
            return new GitResult(exitCode, output);
        } catch (IOException e) {
            log.error("Git command failed: {}", String.join(" ", command), e);
            throw GitException.operationFailed(args.length > 0 ? args[0] : "", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GitException.operationFailed(args.length > 0 ? args[0] : "", e);
        }
    }

    private GitResult require(GitResult result, String operation) {
        if (result.exitCode() != 0) {
            throw notRepoOrFailed(result, operation);
        }
        return result;
    }

    private GitException notRepoOrFailed(GitResult result, String operation) {
        if (result.output().contains("not a git repository")) {
            return GitException.notRepo(workDir);
        }
        return GitException.operationFailed(operation, result.exitCode(), result.output());
    }

    private static String abbreviate(String hash) {
        return hash.length() > 7 ? hash.substring(0, 7) : hash;
    }

    /**
     * Exit code and combined stdout/stderr of a git invocation.
     */
    record GitResult(int exitCode, String output) {}
}
