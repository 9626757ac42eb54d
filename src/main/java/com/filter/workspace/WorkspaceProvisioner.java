package com.filter.workspace;

import com.filter.core.config.EffectiveSettings;
import com.filter.core.error.FilterException;
import com.filter.core.error.OperationTimeoutException;
import com.filter.core.error.StateConflictException;
import com.filter.core.error.StorageException;
import com.filter.core.error.ValidationException;
import com.filter.core.fs.FileTrees;
import com.filter.core.lock.LockHandle;
import com.filter.core.lock.LockManager;
import com.filter.core.logging.InvocationContext;
import com.filter.core.logging.MdcContext;
import com.filter.core.metrics.FilterMetrics;
import com.filter.core.model.Story;
import com.filter.core.model.WorkspaceRecord;
import com.filter.core.project.ProjectLayout;
import com.filter.core.story.StoryRegistry;
import com.filter.git.GitCommandException;
import com.filter.git.GitRepositoryManager;
import com.filter.git.GitUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Creates and tears down the per-story git workspaces of one project.
 *
 * <p>All work on a workspace happens under its lock, so a path is never cloned into twice.
 * Every step is idempotent and the record is written before and after each phase; a crashed
 * provisioning leaves a {@code CLONING} record that the next caller restarts from scratch. A
 * {@code READY} workspace is only ever recloned when its directory is gone.
 */
public class WorkspaceProvisioner {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceProvisioner.class);

    private final StoryRegistry registry;
    private final Function<Story, EffectiveSettings> settingsFor;
    private final WorkspaceRecordStore store;
    private final GitRepositoryManager git;
    private final ScaffoldRenderer scaffold;
    private final LockManager lockManager;
    private final Duration lockTimeout;
    private final BackoffCalculator backoff;
    private final Duration fetchMaxAge;
    private final FilterMetrics metrics;

    public WorkspaceProvisioner(StoryRegistry registry, Function<Story, EffectiveSettings> settingsFor,
                                WorkspaceRecordStore store, GitRepositoryManager git, ScaffoldRenderer scaffold,
                                LockManager lockManager, Duration lockTimeout, BackoffCalculator backoff,
                                Duration fetchMaxAge, FilterMetrics metrics) {
        this.registry = registry;
        this.settingsFor = settingsFor;
        this.store = store;
        this.git = git;
        this.scaffold = scaffold;
        this.lockManager = lockManager;
        this.lockTimeout = lockTimeout;
        this.backoff = backoff;
        this.fetchMaxAge = fetchMaxAge;
        this.metrics = metrics;
    }

    /**
     * Ensures the story has a ready workspace.
     *
     * @param refresh on a ready workspace, fetch if stale and re-checkout the story branch
     * @return the {@code READY} record
     * @throws ValidationException       the story has no repository
     * @throws StateConflictException    a foreign directory occupies the workspace path, a ready workspace is
     *                                   no longer a valid worktree, or branches diverged
     * @throws GitCommandException       git failed after retries; the record is left {@code FAILED}
     * @throws OperationTimeoutException git timed out; the record is left {@code CLONING}
     * @throws com.filter.core.error.BusyException another invocation holds the workspace lock
     */
    public WorkspaceRecord provision(InvocationContext ctx, String storyId, boolean refresh) {
        storyId = ProjectLayout.requireValidId(storyId);
        Story story = registry.require(storyId);
        MdcContext.setStory(storyId);
        EffectiveSettings settings = settingsFor.apply(story);
        if (!settings.hasRepository()) {
            throw new ValidationException("Story " + storyId + " has no repository to provision",
                    "Create the story with --repo <url> or add a repository to the project");
        }
        String branch = BranchNameTemplate.render(story, settings.branchTemplate());
        Path dir = store.workspaceDir(storyId);
        long start = System.currentTimeMillis();

        try (LockHandle ignored = lockManager.acquire(store.lockFile(storyId),
                ctx.correlationId() + " provision", lockTimeout)) {
            Optional<WorkspaceRecord> existing = store.load(storyId);
            if (existing.isPresent() && existing.get().isReady() && Files.isDirectory(dir)) {
                WorkspaceRecord ready = existing.get();
                if (!Files.exists(dir.resolve(".git")) || (refresh && !git.isValidWorktree(dir))) {
                    throw new StateConflictException("Workspace " + dir + " of " + storyId
                            + " is recorded as ready but is not a valid git worktree",
                            "Inspect " + dir + ", then run 'filter workspace teardown " + storyId
                                    + "' and provision again");
                }
                if (refresh) {
                    refresh(ctx, ready, settings);
                    metrics.recordProvisioning("refreshed", System.currentTimeMillis() - start);
                } else {
                    log.info("Workspace of {} already ready at {}", storyId, dir);
                    metrics.recordProvisioning("reused", System.currentTimeMillis() - start);
                }
                return ready;
            }

            WorkspaceRecord base = prepare(storyId, existing, dir, settings.repositoryUrl(), branch);
            WorkspaceRecord cloning = store.save(base.cloning());
            ctx.audit("workspace.cloning", storyId + " attempt " + cloning.attempts() + " from "
                    + GitUrls.redact(cloning.remoteUrl()));

            try {
                cloneWithRetry(cloning, dir, settings);
                git.checkoutOrCreateBranch(dir, branch, settings.gitTimeout());
                scaffold.render(story, cloning, dir);
            } catch (OperationTimeoutException e) {
                log.warn("Provisioning of {} timed out, record left in CLONING: {}", storyId, e.getMessage());
                metrics.recordProvisioning("timeout", System.currentTimeMillis() - start);
                throw e;
            } catch (FilterException e) {
                store.save(cloning.failed(e.getMessage()));
                log.warn("Provisioning of {} failed: {}", storyId, e.getMessage());
                ctx.audit("workspace.failed", storyId + " " + e.getMessage());
                metrics.recordProvisioning("failed", System.currentTimeMillis() - start);
                throw e;
            }

            WorkspaceRecord ready = store.save(cloning.ready());
            log.info("Workspace of {} ready at {} on branch {}", storyId, dir, branch);
            ctx.audit("workspace.ready", storyId + " " + dir + " " + branch);
            metrics.recordProvisioning("created", System.currentTimeMillis() - start);
            return ready;
        }
    }

    /**
     * Deletes the working tree and record of a story. Idempotent; a directory with no record is
     * left untouched.
     *
     * @return true when anything was removed
     */
    public boolean teardown(InvocationContext ctx, String storyId) {
        storyId = ProjectLayout.requireValidId(storyId);
        Path dir = store.workspaceDir(storyId);
        try (LockHandle ignored = lockManager.acquire(store.lockFile(storyId),
                ctx.correlationId() + " teardown", lockTimeout)) {
            if (store.load(storyId).isEmpty()) {
                if (FileTrees.isNonEmptyDirectory(dir)) {
                    log.warn("Leaving {} in place: no workspace record owns it", dir);
                }
                return false;
            }
            FileTrees.deleteRecursively(dir);
            store.delete(storyId);
            log.info("Tore down workspace of {} at {}", storyId, dir);
            ctx.audit("workspace.teardown", storyId + " " + dir);
            return true;
        } catch (IOException e) {
            throw new StorageException("Failed to tear down workspace " + dir, e);
        }
    }

    public Optional<WorkspaceRecord> status(String storyId) {
        return store.load(ProjectLayout.requireValidId(storyId));
    }

    public WorkspaceRecordStore store() {
        return store;
    }

    private WorkspaceRecord prepare(String storyId, Optional<WorkspaceRecord> existing, Path dir,
                                    String remoteUrl, String branch) {
        try {
            if (existing.isEmpty()) {
                if (FileTrees.isNonEmptyDirectory(dir)) {
                    throw new StateConflictException("Directory " + dir + " exists but no workspace record owns it",
                            "Move or delete " + dir + " manually, then re-run 'filter workspace provision "
                                    + storyId + "'");
                }
                return WorkspaceRecord.unprovisioned(storyId, dir.toString(), remoteUrl, branch);
            }
            WorkspaceRecord previous = existing.get();
            log.warn("Restarting provisioning of {} from status {} (attempt {})", storyId, previous.status(),
                    previous.attempts() + 1);
            FileTrees.deleteRecursively(dir);
            return new WorkspaceRecord(storyId, dir.toString(), remoteUrl, branch, previous.status(),
                    previous.attempts(), previous.lastError(), Instant.now());
        } catch (IOException e) {
            throw new StorageException("Failed to prepare workspace " + dir, e);
        }
    }

    private void cloneWithRetry(WorkspaceRecord record, Path dir, EffectiveSettings settings) {
        int retries = settings.cloneRetryCount();
        for (int attempt = 0; ; attempt++) {
            try {
                git.cloneIfAbsent(record.remoteUrl(), dir, settings.gitTimeout());
                return;
            } catch (GitCommandException e) {
                if (!e.isTransient() || attempt >= retries) {
                    throw e;
                }
                long delay = backoff.delayBefore(attempt + 1);
                log.warn("Transient clone failure for {} (retry {}/{} in {}ms): {}", record.storyId(),
                        attempt + 1, retries, delay, e.getMessage());
                metrics.recordGitRetry("clone");
                discardPartialClone(dir);
                sleep(delay, e);
            }
        }
    }

    private void refresh(InvocationContext ctx, WorkspaceRecord record, EffectiveSettings settings) {
        Path dir = Path.of(record.path());
        int retries = settings.cloneRetryCount();
        for (int attempt = 0; ; attempt++) {
            try {
                git.fetchIfStale(dir, fetchMaxAge, settings.gitTimeout());
                break;
            } catch (GitCommandException e) {
                if (!e.isTransient() || attempt >= retries) {
                    throw e;
                }
                metrics.recordGitRetry("fetch");
                sleep(backoff.delayBefore(attempt + 1), e);
            }
        }
        git.checkoutOrCreateBranch(dir, record.branch(), settings.gitTimeout());
        ctx.audit("workspace.refreshed", record.storyId() + " " + record.branch());
    }

    private static void discardPartialClone(Path dir) {
        try {
            if (Files.exists(dir)) {
                FileTrees.deleteRecursively(dir);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to remove partial clone " + dir, e);
        }
    }

    private static void sleep(long millis, GitCommandException pending) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw pending;
        }
    }
}
