package com.phasegate.vcs;

import com.phasegate.core.model.Task;
import com.phasegate.core.model.TaskResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CheckpointManagerTest {

    private GitClient git;
    private CheckpointManager checkpoints;

    @BeforeEach
    void setUp() {
        git = mock(GitClient.class);
        checkpoints = new CheckpointManager(git, true, true, "impl");
    }

    @Nested
    @DisplayName("branches")
    class Branches {

        @Test
        @DisplayName("branch names are slugged from the phase name")
        void branchName() {
            assertEquals("impl/phase-3-api-auth-jwt", checkpoints.formatBranchName(3, "API: Auth & JWT!"));
            assertEquals("impl/phase-1-", checkpoints.formatBranchName(1, null));
            assertEquals("work/phase-2-core", new CheckpointManager(git, true, true, "work").formatBranchName(2, "Core"));
            assertEquals("impl/phase-2-core", new CheckpointManager(git, true, true, " ").formatBranchName(2, "Core"));
        }

        @Test
        @DisplayName("a new phase branch is created")
        void createsBranch() {
            when(git.branchExists("impl/phase-1-setup")).thenReturn(false);

            assertEquals("impl/phase-1-setup", checkpoints.startImplPhase(1, "Setup"));
            verify(git).createBranch("impl/phase-1-setup");
            verify(git, never()).checkout(anyString());
        }

        @Test
        @DisplayName("an existing phase branch is checked out")
        void reusesBranch() {
            when(git.branchExists("impl/phase-1-setup")).thenReturn(true);

            checkpoints.startImplPhase(1, "Setup");
            verify(git).checkout("impl/phase-1-setup");
            verify(git, never()).createBranch(anyString());
        }
    }

    @Nested
    @DisplayName("commits")
    class Commits {

        private final TaskResult result = TaskResult.skipped(
                Task.pending("2.1", "Add login", List.of(), List.of()), "n/a");

        @Test
        @DisplayName("a clean tree produces no commit")
        void cleanTree() {
            when(git.hasUncommittedChanges()).thenReturn(false);

            assertNull(checkpoints.checkpoint("nothing"));
            assertNull(checkpoints.ensureClean());
            verify(git, never()).add();
            verify(git, never()).commit(anyString());
        }

        @Test
        @DisplayName("committing twice in a row makes at most one commit")
        void idempotent() {
            when(git.hasUncommittedChanges()).thenReturn(true, false);
            when(git.commit(anyString())).thenReturn("abc123");

            assertEquals("abc123", checkpoints.commitStateChange("skip task 2.1"));
            assertNull(checkpoints.commitStateChange("skip task 2.1"));
            verify(git, times(1)).commit("orchestrator: skip task 2.1");
        }

        @Test
        @DisplayName("task commits use the task summary")
        void taskCommit() {
            when(git.hasUncommittedChanges()).thenReturn(true);
            when(git.commit(anyString())).thenReturn("abc123");

            checkpoints.commitTask("2.1", result);
            verify(git).add();
            verify(git).commit(startsWith("task-2.1: "));
        }

        @Test
        @DisplayName("pending changes are saved before work starts")
        void ensureClean() {
            when(git.hasUncommittedChanges()).thenReturn(true);
            when(git.commit(anyString())).thenReturn("abc123");

            assertEquals("abc123", checkpoints.ensureClean());
            verify(git).commit(CheckpointManager.SAVE_PENDING_MESSAGE);
        }

        @Test
        @DisplayName("auto-commit off skips task and state commits but not checkpoints")
        void autoCommitOff() {
            CheckpointManager manual = new CheckpointManager(git, true, false, "impl");
            when(git.hasUncommittedChanges()).thenReturn(true);
            when(git.commit(anyString())).thenReturn("abc123");

            assertNull(manual.commitTask("2.1", result));
            assertNull(manual.commitStateChange("retry task 2.1"));
            assertEquals("abc123", manual.checkpoint("Phase 1 complete: Setup"));
            verify(git).commit("checkpoint: Phase 1 complete: Setup");
        }

        @Test
        @DisplayName("disabled integration never touches git")
        void disabled() {
            CheckpointManager off = new CheckpointManager(git, false, true, "impl");

            assertNull(off.startImplPhase(1, "Setup"));
            assertNull(off.commitTask("2.1", result));
            assertNull(off.checkpoint("x"));
            assertNull(off.ensureClean());
            assertNull(off.getCurrentBranch());
            assertFalse(off.isEnabled());
            verifyNoInteractions(git);
        }
    }

    @Test
    @DisplayName("commit descriptions are collapsed and cut to 72 characters")
    void commitMessageFormat() {
        assertEquals("task-1.1: two lines", CheckpointManager.formatCommitMessage("task-1.1", "  two\n  lines "));
        String cut = CheckpointManager.formatCommitMessage("checkpoint", "a".repeat(100));
        assertEquals("checkpoint: " + "a".repeat(69) + "...", cut);
        assertEquals("orchestrator: ", CheckpointManager.formatCommitMessage("orchestrator", null));
    }
}
