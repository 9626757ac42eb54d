package com.filter.core.project;

import com.filter.core.error.ValidationException;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Paths of a project's on-disk layout.
 *
 * <pre>
 * &lt;path&gt;/.filter/                      project root
 *   config.yml
 *   stories/&lt;story-id&gt;.md              canonical story content
 *   kanban/&lt;stage&gt;/&lt;story-id&gt;          link to ../../stories/&lt;story-id&gt;.md
 *   .locks/&lt;story-id&gt;.lock              per-story transition lock
 *   .journal/&lt;story-id&gt;                 target stage of an in-flight transition
 * </pre>
 */
public final class ProjectLayout {

    public static final String FILTER_DIR = ".filter";

    private static final Pattern STORY_ID = Pattern.compile("[a-z0-9]+-[0-9]+");

    private final Path projectPath;
    private final Path root;

    public ProjectLayout(Path projectPath) {
        this.projectPath = projectPath.toAbsolutePath().normalize();
        this.root = this.projectPath.resolve(FILTER_DIR);
    }

    public Path projectPath() { return projectPath; }
    public Path root() { return root; }
    public Path configFile() { return root.resolve("config.yml"); }
    public Path readme() { return root.resolve("README.md"); }
    public Path storiesDir() { return root.resolve("stories"); }
    public Path kanbanDir() { return root.resolve("kanban"); }
    public Path locksDir() { return root.resolve(".locks"); }
    public Path journalDir() { return root.resolve(".journal"); }

    public Path storyFile(String storyId) {
        return storiesDir().resolve(requireValidId(storyId) + ".md");
    }

    public Path stageDir(String stage) {
        return kanbanDir().resolve(stage);
    }

    public Path stageLink(String stage, String storyId) {
        return stageDir(stage).resolve(requireValidId(storyId));
    }

    /**
     * Relative target written into stage links, so a project directory can be moved as a whole.
     */
    public static Path linkTarget(String storyId) {
        return Path.of("..", "..", "stories", storyId + ".md");
    }

    public Path storyLock(String storyId) {
        return locksDir().resolve(requireValidId(storyId) + ".lock");
    }

    public Path projectLock() {
        return locksDir().resolve("project.lock");
    }

    public Path journalFile(String storyId) {
        return journalDir().resolve(requireValidId(storyId));
    }

    public static boolean isValidStoryId(String storyId) {
        return storyId != null && STORY_ID.matcher(storyId).matches();
    }

    /**
     * Story ids are case-insensitive on input and lower case everywhere else.
     *
     * @return the lower-cased id
     * @throws ValidationException when the id does not look like {@code <prefix>-<number>}
     */
    public static String requireValidId(String storyId) {
        String normalized = storyId == null ? null : storyId.strip().toLowerCase(Locale.ROOT);
        if (!isValidStoryId(normalized)) {
            throw new ValidationException("Invalid story id '" + storyId + "'",
                    "Story ids look like <prefix>-<number>, e.g. ibstr-1");
        }
        return normalized;
    }
}
