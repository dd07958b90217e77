package com.phasegate.vcs;

/**
 * Minimal version-control capability set used for checkpointing.
 * Operations that fail throw {@link com.phasegate.core.errors.GitException}.
 */
public interface GitClient {

    boolean isRepo();

    boolean branchExists(String name);

    /** Creates the branch from HEAD and checks it out. */
    void createBranch(String name);

    void checkout(String name);

    /** True if the working tree has staged, unstaged or untracked changes. */
    boolean hasUncommittedChanges();

    /** Stages every change in the working tree. */
    void add();

    /**
     * Commits the staged changes.
     *
     * @return the new commit hash
     */
    String commit(String message);

    /** Current branch name, or null when HEAD is detached or unknown. */
    String getCurrentBranch();
}
