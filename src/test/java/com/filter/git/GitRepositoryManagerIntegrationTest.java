package com.filter.git;

import com.filter.core.error.StateConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs {@link GitRepositoryManager} against a real git executable and a local bare repository.
 * Skipped when git is not installed.
 */
class GitRepositoryManagerIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @TempDir
    Path tempDir;

    private GitRepositoryManager git;
    private String remote;

    @BeforeEach
    void setUp() {
        git = new GitRepositoryManager("git");
        assumeTrue(git.version().isPresent(), "git is not available");

        Path seed = tempDir.resolve("seed");
        Path bare = tempDir.resolve("remote.git");
        run(tempDir, "init", "--quiet", seed.toString());
        run(seed, "-c", "user.name=Test", "-c", "user.email=test@example.com",
                "commit", "--quiet", "--allow-empty", "-m", "initial");
        run(tempDir, "clone", "--quiet", "--bare", seed.toString(), bare.toString());
        remote = bare.toString();
    }

    private void run(Path workDir, String... args) {
        GitResult result = git.runGit(workDir, TIMEOUT, List.of(args));
        assertTrue(result.isSuccess(), () -> "git " + String.join(" ", args) + " failed: " + result.stderr());
    }

    @Test
    @DisplayName("clone, branch and re-clone are idempotent against a real repository")
    void cloneAndBranch() {
        Path target = tempDir.resolve("workspaces/ibstr-1");

        assertTrue(git.cloneIfAbsent(remote, target, TIMEOUT));
        assertTrue(git.isValidWorktree(target));
        assertFalse(git.cloneIfAbsent(remote, target, TIMEOUT));

        assertEquals(GitRepositoryManager.BranchOrigin.CREATED,
                git.checkoutOrCreateBranch(target, "story/ibstr-1", TIMEOUT));
        assertEquals(GitRepositoryManager.BranchOrigin.LOCAL,
                git.checkoutOrCreateBranch(target, "story/ibstr-1", TIMEOUT));
        assertTrue(git.fetchIfStale(target, Duration.ZERO, TIMEOUT));
    }

    @Test
    @DisplayName("a clone of a different remote is refused")
    void differentRemote() throws Exception {
        Path target = tempDir.resolve("workspaces/ibstr-2");
        git.cloneIfAbsent(remote, target, TIMEOUT);

        Path otherBare = tempDir.resolve("other.git");
        run(tempDir, "clone", "--quiet", "--bare", remote, otherBare.toString());

        assertThrows(StateConflictException.class,
                () -> git.cloneIfAbsent(otherBare.toString(), target, TIMEOUT));
        assertTrue(Files.isDirectory(target.resolve(".git")));
    }
}
