package com.filter.git;

import com.filter.core.error.OperationTimeoutException;
import com.filter.core.error.StateConflictException;
import com.filter.core.error.StorageException;
import com.filter.core.error.ValidationException;
import com.filter.core.fs.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Clone, branch and fetch operations on story workspaces.
 *
 * <p>This class shells out to the {@code git} CLI via {@link ProcessBuilder} rather than depending
 * on JGit. Every call runs with {@code GIT_TERMINAL_PROMPT=0} and a timeout; on expiry the process
 * is destroyed and {@link OperationTimeoutException} is raised. Operations are idempotent so a
 * caller may re-run them after any failure.
 */
public class GitRepositoryManager {

    private static final Logger log = LoggerFactory.getLogger(GitRepositoryManager.class);

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    /**
     * How {@link #checkoutOrCreateBranch} obtained the story branch.
     */
    public enum BranchOrigin {
        /** The branch already existed locally. */
        LOCAL,
        /** A local branch was created tracking {@code origin/<branch>}. */
        TRACKED_REMOTE,
        /** Neither existed; the branch was created from the current HEAD. */
        CREATED
    }

    private final String executable;

    public GitRepositoryManager(String executable) {
        this.executable = executable;
    }

    /**
     * Clones {@code url} into {@code target} unless it already holds a clone of the same remote.
     *
     * @return {@code true} when a clone was made, {@code false} when one was already in place
     * @throws StateConflictException {@code target} is a clone of another remote or a non-empty non-repository
     * @throws GitCommandException    the clone failed
     */
    public boolean cloneIfAbsent(String url, Path target, Duration timeout) {
        String redacted = GitUrls.redact(url);
        if (isValidWorktree(target)) {
            Optional<String> existing = remoteUrl(target);
            if (existing.isPresent() && GitUrls.sameRemote(existing.get(), url)) {
                log.info("Workspace {} already cloned from {}", target, redacted);
                return false;
            }
            throw new StateConflictException("Workspace " + target + " is a clone of "
                    + existing.map(GitUrls::redact).orElse("an unknown remote") + ", not " + redacted,
                    "Tear the workspace down with 'filter workspace teardown <id>' and provision again");
        }
        try {
            if (FileTrees.isNonEmptyDirectory(target)) {
                throw new StateConflictException("Directory " + target + " exists and is not a git worktree",
                        "Move or delete " + target + " manually");
            }
            Files.createDirectories(target.getParent());
        } catch (IOException e) {
            throw new StorageException("Failed to prepare clone target " + target, e);
        }

        log.info("Cloning {} into {}", redacted, target);
        GitResult result = runGit(target.getParent(), timeout, List.of("clone", "--", url, target.toString()));
        if (!result.isSuccess()) {
            throw new GitCommandException("clone", redacted, result.exitCode(), result.stderr());
        }
        return true;
    }

    /**
     * Checks out {@code branch}: the local branch if present, else a branch tracking
     * {@code origin/<branch>}, else a new branch from HEAD.
     *
     * @throws ValidationException    {@code branch} is not a valid branch name
     * @throws StateConflictException local and remote branch both exist and have diverged
     */
    public BranchOrigin checkoutOrCreateBranch(Path workTree, String branch, Duration timeout) {
        GitResult format = runGit(workTree, timeout, List.of("check-ref-format", "--branch", branch));
        if (!format.isSuccess()) {
            throw new ValidationException("Invalid branch name '" + branch + "'",
                    "Adjust the branch strategy so it renders a valid git branch name");
        }

        Optional<String> local = resolveRef(workTree, timeout, "refs/heads/" + branch);
        Optional<String> remote = resolveRef(workTree, timeout, "refs/remotes/origin/" + branch);

        if (local.isPresent() && remote.isPresent() && !local.get().equals(remote.get())
                && !isAncestor(workTree, timeout, local.get(), remote.get())
                && !isAncestor(workTree, timeout, remote.get(), local.get())) {
            throw new StateConflictException("Branch " + branch + " in " + workTree
                    + " has diverged from origin/" + branch,
                    "Reconcile the histories manually (git -C " + workTree + " pull --rebase) and re-run");
        }

        BranchOrigin origin;
        List<String> args;
        if (local.isPresent()) {
            origin = BranchOrigin.LOCAL;
            args = List.of("checkout", branch);
        } else if (remote.isPresent()) {
            origin = BranchOrigin.TRACKED_REMOTE;
            args = List.of("checkout", "-b", branch, "--track", "origin/" + branch);
        } else {
            origin = BranchOrigin.CREATED;
            args = List.of("checkout", "-b", branch);
        }
        GitResult result = runGit(workTree, timeout, args);
        if (!result.isSuccess()) {
            throw new GitCommandException("checkout " + branch, null, result.exitCode(), result.stderr());
        }
        log.info("Checked out branch {} in {} ({})", branch, workTree, origin);
        return origin;
    }

    /**
     * Fetches from {@code origin} unless the last fetch is younger than {@code maxAge}.
     *
     * @return {@code true} when a fetch ran
     */
    public boolean fetchIfStale(Path workTree, Duration maxAge, Duration timeout) {
        Path fetchHead = workTree.resolve(".git").resolve("FETCH_HEAD");
        try {
            if (Files.exists(fetchHead)) {
                Instant lastFetch = Files.getLastModifiedTime(fetchHead).toInstant();
                if (lastFetch.isAfter(Instant.now().minus(maxAge))) {
                    log.debug("Skipping fetch in {}, last fetch at {}", workTree, lastFetch);
                    return false;
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to read " + fetchHead, e);
        }

        GitResult result = runGit(workTree, timeout, List.of("fetch", "--prune", "origin"));
        if (!result.isSuccess()) {
            throw new GitCommandException("fetch", remoteUrl(workTree).map(GitUrls::redact).orElse(null),
                    result.exitCode(), result.stderr());
        }
        return true;
    }

    /**
     * @return true when {@code path} is the top level of a git worktree
     */
    public boolean isValidWorktree(Path path) {
        if (!Files.isDirectory(path) || !Files.exists(path.resolve(".git"))) {
            return false;
        }
        GitResult result = runGit(path, PROBE_TIMEOUT, List.of("rev-parse", "--is-inside-work-tree"));
        return result.isSuccess() && "true".equals(result.firstLine());
    }

    public Optional<String> remoteUrl(Path workTree) {
        GitResult result = runGit(workTree, PROBE_TIMEOUT, List.of("config", "--get", "remote.origin.url"));
        if (!result.isSuccess() || result.firstLine().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(result.firstLine());
    }

    /**
     * Probes the git executable.
     *
     * @return the version line, or empty when git cannot be run
     */
    public Optional<String> version() {
        try {
            GitResult result = runGit(Path.of(".").toAbsolutePath(), PROBE_TIMEOUT, List.of("--version"));
            return result.isSuccess() ? Optional.of(result.firstLine()) : Optional.empty();
        } catch (GitCommandException | OperationTimeoutException e) {
            log.debug("git probe failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> resolveRef(Path workTree, Duration timeout, String ref) {
        GitResult result = runGit(workTree, timeout, List.of("rev-parse", "--verify", "--quiet", ref));
        return result.isSuccess() ? Optional.of(result.firstLine()) : Optional.empty();
    }

    private boolean isAncestor(Path workTree, Duration timeout, String ancestor, String descendant) {
        GitResult result = runGit(workTree, timeout, List.of("merge-base", "--is-ancestor", ancestor, descendant));
        if (result.exitCode() > 1) {
            throw new GitCommandException("merge-base", null, result.exitCode(), result.stderr());
        }
        return result.isSuccess();
    }

    /**
     * Runs a git command and captures its output.
     *
     * @param workDir working directory for the git command
     * @param timeout maximum run time, after which the process is destroyed
     * @param args    git arguments (e.g. "checkout", "-b", "branch-name")
     * @throws OperationTimeoutException the process outlived {@code timeout}
     * @throws GitCommandException       the executable could not be started
     */
    GitResult runGit(Path workDir, Duration timeout, List<String> args) {
        List<String> command = buildCommand(args);
        log.debug("Running: {}", maskCommand(command));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command).directory(workDir.toFile());
            builder.environment().put("GIT_TERMINAL_PROMPT", "0");
            process = builder.start();
        } catch (IOException e) {
            throw new GitCommandException(args.get(0), null, -1,
                    "git executable '" + executable + "' could not be started: " + e.getMessage());
        }

        // Drain both streams concurrently to prevent blocking
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("git {} timed out after {}s", maskCommand(args), timeout.toSeconds());
                throw new OperationTimeoutException("git " + args.get(0), timeout);
            }
            GitResult result = new GitResult(process.exitValue(), stdout.join(), stderr.join());
            if (!result.isSuccess()) {
                log.debug("git exited with code {}: {}", result.exitCode(), GitUrls.redact(result.stderr().strip()));
            }
            return result;
        } catch (CompletionException e) {
            throw new GitCommandException(args.get(0), null, -1, "Failed to read git output: " + e.getMessage());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException("git " + args.get(0) + " (interrupted)", timeout);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String maskCommand(List<String> command) {
        return command.stream()
                .map(GitUrls::redact)
                .collect(Collectors.joining(" "));
    }

    private List<String> buildCommand(List<String> args) {
        var command = new ArrayList<String>();
        command.add(executable);
        command.addAll(args);
        return command;
    }
}
