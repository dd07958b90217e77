package com.phasegate.vcs;

import com.phasegate.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Policy layer over a {@link GitClient}: phase branches and checkpoint commits.
 *
 * <p>Every commit operation is a no-op returning null when the working tree is clean,
 * so calling it twice in a row produces at most one commit. {@link #commitTask} and
 * {@link #commitStateChange} additionally honour the auto-commit switch; explicit
 * checkpoints and {@link #ensureClean()} only require integration to be enabled.
 * Git failures propagate as {@link com.phasegate.core.errors.GitException}; callers
 * treat them as best-effort.
 */
public class CheckpointManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    static final int MAX_DESCRIPTION_LENGTH = 72;
    static final String SAVE_PENDING_MESSAGE = "orchestrator: save pending changes";

    private final GitClient git;
    private final boolean enabled;
    private final boolean autoCommit;
    private final String branchPrefix;

    public CheckpointManager(GitClient git, boolean enabled, boolean autoCommit, String branchPrefix) {
        this.git = git;
        this.enabled = enabled;
        this.autoCommit = autoCommit;
        this.branchPrefix = branchPrefix == null || branchPrefix.isBlank() ? "impl" : branchPrefix;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Checks out the phase branch, creating it from HEAD if it does not exist yet.
     *
     * @return the branch name, or null when integration is disabled
     */
    public String startImplPhase(int phaseNumber, String phaseName) {
        if (!enabled) {
            return null;
        }
        String branch = formatBranchName(phaseNumber, phaseName);
        if (git.branchExists(branch)) {
            git.checkout(branch);
        } else {
            git.createBranch(branch);
        }
        log.info("Phase {} working on branch {}", phaseNumber, branch);
        return branch;
    }

    /**
     * Commits the working tree after a task completed.
     *
     * @return the commit hash, or null if nothing was committed
     */
    public String commitTask(String taskId, TaskResult result) {
        if (!enabled || !autoCommit) {
            return null;
        }
        String summary = result.summary() == null || result.summary().isBlank()
                ? "Task completed" : result.summary();
        return commitIfDirty(formatCommitMessage("task-" + taskId, summary));
    }

    /**
     * Commits the working tree after an orchestration state change.
     *
     * @return the commit hash, or null if nothing was committed
     */
    public String commitStateChange(String action) {
        if (!enabled || !autoCommit) {
            return null;
        }
        return commitIfDirty(formatCommitMessage("orchestrator", action));
    }

    /**
     * Creates a manual save point.
     *
     * @return the commit hash, or null if nothing was committed
     */
    public String checkpoint(String message) {
        if (!enabled) {
            return null;
        }
        return commitIfDirty(formatCommitMessage("checkpoint", message));
    }

    /**
     * Commits any pending changes before new work starts so they are never lost.
     *
     * @return the commit hash, or null if the tree was already clean
     */
    public String ensureClean() {
        if (!enabled) {
            return null;
        }
        String hash = commitIfDirty(SAVE_PENDING_MESSAGE);
        if (hash != null) {
            log.info("Saved pending changes before starting work ({})", hash);
        }
        return hash;
    }

    public String getCurrentBranch() {
        return enabled ? git.getCurrentBranch() : null;
    }

    /**
     * Branch name for a phase: {@code <prefix>/phase-<n>-<slug>}.
     */
    public String formatBranchName(int phaseNumber, String phaseName) {
        String slug = phaseName == null ? "" : phaseName.toLowerCase()
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-|-$", "");
        return "%s/phase-%d-%s".formatted(branchPrefix, phaseNumber, slug);
    }

    /**
     * {@code <type>: <description>}, with the description cut to 72 characters ending in "...".
     */
    public static String formatCommitMessage(String type, String description) {
        String text = description == null ? "" : description.strip().replaceAll("\\s+", " ");
        if (text.length() > MAX_DESCRIPTION_LENGTH) {
            text = text.substring(0, MAX_DESCRIPTION_LENGTH - 3) + "...";
        }
        return type + ": " + text;
    }

    private String commitIfDirty(String message) {
        if (!git.hasUncommittedChanges()) {
            log.debug("Nothing to commit for '{}'", message);
            return null;
        }
        git.add();
        return git.commit(message);
    }
}
