package com.filter.core.story;

import com.filter.core.error.StorageException;
import com.filter.core.error.StoryNotFoundException;
import com.filter.core.error.ValidationException;
import com.filter.core.lock.LockHandle;
import com.filter.core.lock.LockManager;
import com.filter.core.logging.InvocationContext;
import com.filter.core.model.ProjectConfig;
import com.filter.core.model.RepositoryRef;
import com.filter.core.model.Story;
import com.filter.core.project.ProjectConfigStore;
import com.filter.core.project.ProjectLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Source of truth for story identity and metadata: the markdown files under {@code stories/}.
 */
public class StoryRegistry {

    private static final Logger log = LoggerFactory.getLogger(StoryRegistry.class);

    static final Comparator<Story> BY_NUMBER = Comparator.comparing(Story::prefix)
            .thenComparingInt(Story::number)
            .thenComparing(Story::id);

    private final ProjectLayout layout;
    private final LockManager lockManager;
    private final Duration lockTimeout;

    public StoryRegistry(ProjectLayout layout, LockManager lockManager, Duration lockTimeout) {
        this.layout = layout;
        this.lockManager = lockManager;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Reserves the next story id by bumping {@code last_story_number} under the project lock.
     * Numbers already taken by existing files are skipped.
     */
    public String allocateId(InvocationContext ctx) {
        try (LockHandle ignored = lockManager.acquire(layout.projectLock(), ctx.correlationId(), lockTimeout)) {
            ProjectConfig config = ProjectConfigStore.load(layout);
            int next = config.lastStoryNumber() + 1;
            while (Files.exists(layout.storyFile(config.prefix() + "-" + next))) {
                log.warn("Story number {} already used on disk, skipping", next);
                next++;
            }
            ProjectConfigStore.save(layout, config.withLastStoryNumber(next));
            String storyId = config.prefix() + "-" + next;
            log.info("Allocated story id {}", storyId);
            ctx.audit("story.id.allocated", storyId);
            return storyId;
        }
    }

    /**
     * Writes the canonical story file. Never overwrites an existing story.
     */
    public Story create(InvocationContext ctx, String storyId, String title, String description,
                        RepositoryRef repository) {
        validateTitle(title);
        storyId = ProjectLayout.requireValidId(storyId);
        var story = new Story(storyId, title.strip(), description, Instant.now().truncatedTo(ChronoUnit.SECONDS),
                repository);
        Path target = layout.storyFile(storyId);
        try {
            Path tmp = Files.createTempFile(layout.storiesDir(), "." + storyId, ".tmp");
            try {
                Files.writeString(tmp, StoryMarkdown.render(story), StandardCharsets.UTF_8);
                Files.move(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (FileAlreadyExistsException e) {
            throw new ValidationException("Story " + storyId + " already exists");
        } catch (IOException e) {
            throw new StorageException("Failed to create story " + storyId, e);
        }
        log.info("Created story file {}", target);
        ctx.audit("story.created", storyId + " \"" + story.title() + "\"");
        return story;
    }

    public static void validateTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Story title must not be empty");
        }
        if (title.contains("\n") || title.contains("\r")) {
            throw new ValidationException("Story title must be a single line");
        }
    }

    public boolean exists(String storyId) {
        return Files.isRegularFile(layout.storyFile(storyId));
    }

    public Optional<Story> find(String storyId) {
        storyId = ProjectLayout.requireValidId(storyId);
        Path file = layout.storyFile(storyId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(StoryMarkdown.parse(storyId, Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new StorageException("Failed to read story " + storyId, e);
        }
    }

    public Story require(String storyId) {
        return find(storyId).orElseThrow(() -> new StoryNotFoundException(storyId));
    }

    /**
     * @return all stories, ordered by prefix and number
     */
    public List<Story> listAll() {
        List<Story> stories = new ArrayList<>();
        try (Stream<Path> files = Files.list(layout.storiesDir())) {
            for (Path file : files.sorted().toList()) {
                String name = file.getFileName().toString();
                if (!name.endsWith(".md")) {
                    continue;
                }
                String storyId = name.substring(0, name.length() - 3);
                if (!ProjectLayout.isValidStoryId(storyId)) {
                    log.debug("Ignoring non-story file {}", file);
                    continue;
                }
                find(storyId).ifPresent(stories::add);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list " + layout.storiesDir(), e);
        }
        stories.sort(BY_NUMBER);
        return stories;
    }

    /**
     * Removes the canonical file. Callers route deletion through
     * {@link com.filter.core.kanban.KanbanStateMachine#unlinkAll} first so no link is left behind.
     *
     * @return {@code true} if a file was deleted
     */
    public boolean delete(InvocationContext ctx, String storyId) {
        storyId = ProjectLayout.requireValidId(storyId);
        try {
            boolean deleted = Files.deleteIfExists(layout.storyFile(storyId));
            if (deleted) {
                log.info("Deleted story file for {}", storyId);
                ctx.audit("story.deleted", storyId);
            }
            return deleted;
        } catch (IOException e) {
            throw new StorageException("Failed to delete story " + storyId, e);
        }
    }

    public ProjectLayout layout() {
        return layout;
    }
}
