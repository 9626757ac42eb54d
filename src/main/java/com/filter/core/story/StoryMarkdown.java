package com.filter.core.story;

import com.filter.core.model.RepositoryRef;
import com.filter.core.model.Story;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Renders and parses the canonical story markdown file.
 * Pure functions, no filesystem access.
 */
public final class StoryMarkdown {

    static final String CREATED = "**Created:** ";
    static final String REPOSITORY = "**Repository:** ";
    static final String BRANCH_STRATEGY = "**Branch Strategy:** ";
    private static final String DESCRIPTION_HEADING = "## Description";
    private static final String NO_DESCRIPTION = "No description provided.";

    private StoryMarkdown() {}

    public static String render(Story story) {
        var sb = new StringBuilder();
        sb.append("# ").append(story.id()).append(": ").append(story.title()).append("\n\n");
        sb.append(CREATED).append(story.createdAt()).append("\n");
        if (story.repository().hasUrl()) {
            sb.append(REPOSITORY).append(story.repository().url()).append("\n");
        }
        if (story.repository().hasBranchStrategy()) {
            sb.append(BRANCH_STRATEGY).append(story.repository().branchStrategy()).append("\n");
        }
        sb.append("\n");

        sb.append(DESCRIPTION_HEADING).append("\n\n");
        sb.append(story.description().isBlank() ? NO_DESCRIPTION : story.description()).append("\n\n");

        sb.append("## Acceptance Criteria\n\n");
        sb.append("- [ ] Define acceptance criteria for this story\n\n");

        sb.append("## Notes\n\n");
        sb.append("<!-- Add any additional notes or updates here -->\n\n");

        sb.append("## Related Issues\n\n");
        sb.append("<!-- Link to any related issues or stories -->\n");
        return sb.toString();
    }

    /**
     * Parses a story file. Unknown sections are ignored; a missing title line falls back to the id.
     *
     * @param storyId id taken from the file name
     * @param content file content
     */
    public static Story parse(String storyId, String content) {
        String title = storyId;
        Instant created = null;
        String url = null;
        String branchStrategy = null;
        var description = new StringBuilder();
        boolean titleSeen = false;
        boolean inDescription = false;

        for (String line : content.split("\n", -1)) {
            if (!titleSeen && line.startsWith("# ")) {
                title = extractTitle(line.substring(2).strip());
                titleSeen = true;
            } else if (line.startsWith(CREATED)) {
                created = parseInstant(line.substring(CREATED.length()).strip());
            } else if (line.startsWith(REPOSITORY)) {
                url = line.substring(REPOSITORY.length()).strip();
            } else if (line.startsWith(BRANCH_STRATEGY)) {
                branchStrategy = line.substring(BRANCH_STRATEGY.length()).strip();
            } else if (line.startsWith("## ")) {
                inDescription = line.strip().equals(DESCRIPTION_HEADING);
            } else if (inDescription) {
                description.append(line).append("\n");
            }
        }

        String desc = description.toString().strip();
        if (desc.equals(NO_DESCRIPTION)) {
            desc = "";
        }
        return new Story(storyId, title, desc, created, new RepositoryRef(url, branchStrategy));
    }

    private static String extractTitle(String heading) {
        int sep = heading.indexOf(": ");
        return sep >= 0 ? heading.substring(sep + 2) : heading;
    }

    private static Instant parseInstant(String raw) {
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
