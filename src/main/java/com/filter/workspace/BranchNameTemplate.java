package com.filter.workspace;

import com.filter.core.error.ValidationException;
import com.filter.core.model.Story;

/**
 * Renders story branch names from templates such as {@code story/{id}} or {@code feature/{prefix}-{number}}.
 *
 * <p>Placeholders: {@code {id}}, {@code {prefix}}, {@code {number}}. A template must contain
 * {@code {id}} or {@code {number}} so that two stories never share a branch.
 */
public final class BranchNameTemplate {

    private BranchNameTemplate() {}

    public static void validate(String template) {
        if (template == null || template.isBlank()) {
            throw new ValidationException("Branch template is empty", "Use a template such as story/{id}");
        }
        if (!template.contains("{id}") && !template.contains("{number}")) {
            throw new ValidationException("Branch template '" + template + "' contains neither {id} nor {number}",
                    "Include {id} or {number} so each story gets its own branch, e.g. story/{id}");
        }
    }

    /**
     * Picks the story's own branch strategy if set, else {@code fallback}, and renders it.
     */
    public static String render(Story story, String fallback) {
        String template = story.repository().hasBranchStrategy() ? story.repository().branchStrategy() : fallback;
        validate(template);
        return template
                .replace("{id}", story.id())
                .replace("{prefix}", story.prefix())
                .replace("{number}", String.valueOf(story.number()));
    }
}
