package com.filter.core.kanban;

import com.filter.core.error.StateConflictException;
import com.filter.core.error.StorageException;
import com.filter.core.error.StoryNotFoundException;
import com.filter.core.error.ValidationException;
import com.filter.core.lock.LockHandle;
import com.filter.core.lock.LockManager;
import com.filter.core.logging.InvocationContext;
import com.filter.core.logging.MdcContext;
import com.filter.core.metrics.FilterMetrics;
import com.filter.core.model.BoardListing;
import com.filter.core.model.ListingProblem;
import com.filter.core.model.StageListing;
import com.filter.core.model.Story;
import com.filter.core.model.TransitionResult;
import com.filter.core.project.ProjectLayout;
import com.filter.core.story.StoryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Owns stage membership: a story is in stage {@code S} iff {@code kanban/S/<story-id>} exists.
 *
 * <p>Transitions run under a lock scoped to the story, so transitions of one story are totally
 * ordered while different stories never block each other. A transition creates the new link,
 * verifies it, then removes the old one; the target stage is journaled first so that a process
 * killed between the two steps is repaired toward the new stage by {@link #currentStage}.
 *
 * <p>Listing takes no lock and reports corruption next to partial results.
 */
public class KanbanStateMachine {

    private static final Logger log = LoggerFactory.getLogger(KanbanStateMachine.class);

    private final ProjectLayout layout;
    private final List<String> stages;
    private final StoryRegistry registry;
    private final LockManager lockManager;
    private final Duration lockTimeout;
    private final ConflictPolicy conflictPolicy;
    private final FilterMetrics metrics;

    public KanbanStateMachine(ProjectLayout layout, List<String> stages, StoryRegistry registry,
                              LockManager lockManager, Duration lockTimeout, ConflictPolicy conflictPolicy,
                              FilterMetrics metrics) {
        this.layout = layout;
        this.stages = List.copyOf(stages);
        this.registry = registry;
        this.lockManager = lockManager;
        this.lockTimeout = lockTimeout;
        this.conflictPolicy = conflictPolicy;
        this.metrics = metrics;
    }

    public List<String> stages() {
        return stages;
    }

    /**
     * Returns the single stage holding the story, or empty when no stage links it.
     *
     * <p>An empty result means either "not started" or "link lost"; callers tell them apart
     * through {@link StoryRegistry#exists}. Duplicate links are resolved per {@link ConflictPolicy}
     * under the story lock.
     */
    public Optional<String> currentStage(InvocationContext ctx, String storyId) {
        storyId = ProjectLayout.requireValidId(storyId);
        List<String> found = scan(storyId);
        if (found.size() <= 1) {
            return found.stream().findFirst();
        }
        log.warn("Story {} is linked from {} stages: {}", storyId, found.size(), found);
        try (LockHandle ignored = lock(ctx, storyId, "repair")) {
            return resolveLocked(ctx, storyId);
        }
    }

    /**
     * Moves a story to {@code toStage}.
     *
     * @param fromStage expected current stage, or {@code null} to move from wherever it is
     * @return the transition; {@code changed} is false when the story already was in {@code toStage}
     * @throws ValidationException    unknown stage, or the story is not in {@code fromStage}
     * @throws StoryNotFoundException the story has no canonical file
     */
    public TransitionResult transition(InvocationContext ctx, String storyId, String fromStage, String toStage) {
        requireStage(toStage);
        if (fromStage != null) {
            requireStage(fromStage);
        }
        storyId = ProjectLayout.requireValidId(storyId);
        MdcContext.setStory(storyId);
        if (!registry.exists(storyId)) {
            throw new StoryNotFoundException(storyId);
        }

        try (LockHandle ignored = lock(ctx, storyId, "transition to " + toStage)) {
            Optional<String> current = resolveLocked(ctx, storyId);
            if (fromStage != null && !current.map(fromStage::equals).orElse(false)) {
                throw new ValidationException("Story " + storyId + " is in "
                        + current.map(s -> "'" + s + "'").orElse("no stage") + ", not '" + fromStage + "'",
                        "Omit --from or pass the story's current stage");
            }
            if (current.isPresent() && current.get().equals(toStage)) {
                log.info("Story {} already in {}", storyId, toStage);
                metrics.recordTransition(toStage, false);
                return new TransitionResult(storyId, toStage, toStage, false);
            }

            writeJournal(storyId, toStage);
            Path newLink = layout.stageLink(toStage, storyId);
            Files.createDirectories(newLink.getParent());
            Files.createSymbolicLink(newLink, ProjectLayout.linkTarget(storyId));
            if (!resolvesToCanonical(newLink, storyId)) {
                Files.deleteIfExists(newLink);
                clearJournal(storyId);
                throw new StoryNotFoundException(storyId);
            }
            if (current.isPresent()) {
                Files.deleteIfExists(layout.stageLink(current.get(), storyId));
            }
            clearJournal(storyId);

            log.info("Moved story {} from {} to {}", storyId, current.orElse("(none)"), toStage);
            ctx.audit("kanban.transition", storyId + " " + current.orElse("-") + " -> " + toStage);
            metrics.recordTransition(toStage, true);
            return new TransitionResult(storyId, current.orElse(null), toStage, true);
        } catch (IOException e) {
            throw new StorageException("Failed to move story " + storyId + " to " + toStage, e);
        }
    }

    /**
     * Resolves every link of a stage back to its story. Does not lock; a link created
     * concurrently may or may not be observed.
     */
    public StageListing listStage(InvocationContext ctx, String stage) {
        requireStage(stage);
        Path dir = layout.stageDir(stage);
        List<Story> stories = new ArrayList<>();
        List<ListingProblem> problems = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            log.warn("Stage directory {} is missing", dir);
            return new StageListing(stage, stories, problems);
        }

        List<Path> entries;
        try (Stream<Path> list = Files.list(dir)) {
            entries = list.sorted().toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list stage " + stage, e);
        }

        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (name.startsWith(".")) {
                continue;
            }
            if (!ProjectLayout.isValidStoryId(name) || !Files.isSymbolicLink(entry)) {
                problems.add(new ListingProblem(stage, name, ListingProblem.Kind.NOT_A_LINK,
                        "Unexpected entry " + entry + " is not a story link",
                        "Remove " + entry));
                continue;
            }
            if (!resolvesToCanonical(entry, name)) {
                problems.add(new ListingProblem(stage, name, ListingProblem.Kind.DANGLING_LINK,
                        "Link " + entry + " does not resolve to stories/" + name + ".md",
                        "Delete the link, or restore the story file if it was removed by mistake"));
                continue;
            }
            try {
                registry.find(name).ifPresentOrElse(stories::add, () -> problems.add(
                        new ListingProblem(stage, name, ListingProblem.Kind.DANGLING_LINK,
                                "Story " + name + " vanished while listing", "Re-run the listing")));
            } catch (StorageException e) {
                problems.add(new ListingProblem(stage, name, ListingProblem.Kind.UNREADABLE_STORY,
                        e.getMessage(), "Check permissions and encoding of stories/" + name + ".md"));
            }
        }

        for (ListingProblem problem : problems) {
            log.warn("Board corruption in stage {}: {}", stage, problem.detail());
        }
        metrics.recordListingProblems(problems.size());
        stories.sort(Comparator.comparing(Story::prefix).thenComparingInt(Story::number));
        return new StageListing(stage, stories, problems);
    }

    /**
     * Lists all stages in board order. Stories linked from several stages are reported,
     * not repaired, since listing is read-only.
     */
    public BoardListing listBoard(InvocationContext ctx) {
        List<StageListing> listings = new ArrayList<>();
        List<ListingProblem> problems = new ArrayList<>();
        Map<String, List<String>> stagesById = new LinkedHashMap<>();

        for (String stage : stages) {
            StageListing listing = listStage(ctx, stage);
            listings.add(listing);
            problems.addAll(listing.problems());
            for (Story story : listing.stories()) {
                stagesById.computeIfAbsent(story.id(), k -> new ArrayList<>()).add(stage);
            }
        }

        stagesById.forEach((storyId, inStages) -> {
            if (inStages.size() > 1) {
                problems.add(new ListingProblem(String.join(",", inStages), storyId,
                        ListingProblem.Kind.DUPLICATE_STAGE,
                        "Story " + storyId + " is linked from stages " + inStages,
                        "Run 'filter story move " + storyId + " <stage>' to keep exactly one"));
            }
        });

        Set<String> linked = new HashSet<>(stagesById.keySet());
        List<Story> unstarted = registry.listAll().stream()
                .filter(story -> !linked.contains(story.id()))
                .toList();
        return new BoardListing(listings, unstarted, problems);
    }

    /**
     * Removes every stage link of a story and its journal. Used before deleting the story file.
     *
     * @return the stages the story was removed from
     */
    public List<String> unlinkAll(InvocationContext ctx, String storyId) {
        storyId = ProjectLayout.requireValidId(storyId);
        try (LockHandle ignored = lock(ctx, storyId, "unlink")) {
            List<String> removed = new ArrayList<>();
            for (String stage : stages) {
                if (Files.deleteIfExists(layout.stageLink(stage, storyId))) {
                    removed.add(stage);
                }
            }
            clearJournal(storyId);
            if (!removed.isEmpty()) {
                log.info("Removed story {} from stages {}", storyId, removed);
                ctx.audit("kanban.unlinked", storyId + " " + removed);
            }
            return removed;
        } catch (IOException e) {
            throw new StorageException("Failed to unlink story " + storyId, e);
        }
    }

    public void requireStage(String stage) {
        if (stage == null || !stages.contains(stage)) {
            throw new ValidationException("Invalid stage '" + stage + "'. Valid stages: " + String.join(", ", stages));
        }
    }

    // -- internals, callers hold the story lock unless noted --

    private LockHandle lock(InvocationContext ctx, String storyId, String operation) {
        return lockManager.acquire(layout.storyLock(storyId), ctx.correlationId() + " " + operation, lockTimeout);
    }

    /** Lock-free scan of all configured stages. */
    List<String> scan(String storyId) {
        List<String> found = new ArrayList<>();
        for (String stage : stages) {
            if (Files.exists(layout.stageLink(stage, storyId), LinkOption.NOFOLLOW_LINKS)) {
                found.add(stage);
            }
        }
        return found;
    }

    private Optional<String> resolveLocked(InvocationContext ctx, String storyId) {
        List<String> found = scan(storyId);
        if (found.size() <= 1) {
            return found.stream().findFirst();
        }

        Optional<String> journaled = readJournal(storyId).filter(found::contains);
        if (journaled.isEmpty() && conflictPolicy == ConflictPolicy.FAIL) {
            throw new StateConflictException("Story " + storyId + " is linked from several stages: " + found,
                    "Delete all but one of " + found.stream()
                            .map(s -> layout.stageLink(s, storyId).toString()).toList());
        }

        String winner = journaled.orElseGet(() -> newestLink(storyId, found));
        try {
            for (String stage : found) {
                if (!stage.equals(winner)) {
                    Files.deleteIfExists(layout.stageLink(stage, storyId));
                }
            }
            clearJournal(storyId);
        } catch (IOException e) {
            throw new StorageException("Failed to repair stage links of " + storyId, e);
        }

        log.warn("Repaired story {}: kept {} (by {}), removed others of {}", storyId, winner,
                journaled.isPresent() ? "journal" : "newest link", found);
        ctx.audit("kanban.conflict.repaired", storyId + " kept " + winner + " of " + found);
        metrics.recordConflictRepair(winner);
        return Optional.of(winner);
    }

    private String newestLink(String storyId, List<String> found) {
        Comparator<String> byMtimeDesc = Comparator.comparing(
                (String stage) -> linkModified(layout.stageLink(stage, storyId))).reversed();
        return found.stream()
                .sorted(byMtimeDesc.thenComparing(Comparator.naturalOrder()))
                .findFirst()
                .orElseThrow();
    }

    private static FileTime linkModified(Path link) {
        try {
            return Files.getLastModifiedTime(link, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private boolean resolvesToCanonical(Path link, String storyId) {
        Path canonical = layout.storyFile(storyId);
        try {
            return Files.exists(link) && Files.isSameFile(link, canonical);
        } catch (IOException e) {
            return false;
        }
    }

    private void writeJournal(String storyId, String stage) throws IOException {
        Path journal = layout.journalFile(storyId);
        Files.createDirectories(journal.getParent());
        Path tmp = Files.createTempFile(journal.getParent(), storyId, ".tmp");
        try {
            Files.writeString(tmp, stage, StandardCharsets.UTF_8);
            Files.move(tmp, journal, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Optional<String> readJournal(String storyId) {
        try {
            return Optional.of(Files.readString(layout.journalFile(storyId), StandardCharsets.UTF_8).strip())
                    .filter(s -> !s.isEmpty());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable transition journal for {}: {}", storyId, e.getMessage());
            return Optional.empty();
        }
    }

    private void clearJournal(String storyId) throws IOException {
        Files.deleteIfExists(layout.journalFile(storyId));
    }
}
