package com.filter.workspace;

import com.filter.core.error.StorageException;
import com.filter.core.model.Story;
import com.filter.core.model.WorkspaceRecord;
import com.filter.git.GitUrls;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Default scaffold: a {@code .filter-story.md} brief at the worktree root, excluded from git
 * through {@code .git/info/exclude}.
 */
public class StoryBriefRenderer implements ScaffoldRenderer {

    static final String BRIEF_FILE = ".filter-story.md";

    @Override
    public List<Path> render(Story story, WorkspaceRecord record, Path workTree) {
        Path brief = workTree.resolve(BRIEF_FILE);
        try {
            Files.writeString(brief, build(story, record), StandardCharsets.UTF_8);
            excludeFromGit(workTree);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + brief, e);
        }
        return List.of(Path.of(BRIEF_FILE));
    }

    static String build(Story story, WorkspaceRecord record) {
        var sb = new StringBuilder();
        sb.append("# ").append(story.id()).append(": ").append(story.title()).append("\n\n");
        sb.append("- **Branch:** ").append(record.branch()).append("\n");
        sb.append("- **Remote:** ").append(GitUrls.redact(record.remoteUrl())).append("\n");
        if (story.createdAt() != null) {
            sb.append("- **Created:** ").append(story.createdAt()).append("\n");
        }
        sb.append("\n## Description\n\n");
        sb.append(story.description().isBlank() ? "No description provided." : story.description()).append("\n\n");
        sb.append("## Workflow\n\n");
        sb.append("- Commit your work on `").append(record.branch()).append("`\n");
        sb.append("- Move the story along the board with `filter story move ").append(story.id())
                .append(" <stage>`\n");
        return sb.toString();
    }

    private static void excludeFromGit(Path workTree) throws IOException {
        Path exclude = workTree.resolve(".git").resolve("info").resolve("exclude");
        if (!Files.isDirectory(workTree.resolve(".git"))) {
            return;
        }
        Files.createDirectories(exclude.getParent());
        if (Files.exists(exclude) && Files.readAllLines(exclude, StandardCharsets.UTF_8).contains(BRIEF_FILE)) {
            return;
        }
        Files.writeString(exclude, "\n" + BRIEF_FILE + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
