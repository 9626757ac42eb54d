package com.filter.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A story as recorded in its canonical markdown file. The current stage is not part of the
 * record; it is derived from the board.
 *
 * @param id          slug of the form {@code <prefix>-<number>}, e.g. {@code ibstr-1}
 * @param title       one-line title
 * @param description free text, may be empty
 * @param createdAt   creation time; {@code null} only for files written by hand
 * @param repository  repository binding, never {@code null}
 */
public record Story(
    String id,
    String title,
    String description,
    Instant createdAt,
    RepositoryRef repository
) implements Serializable {

    public Story {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (repository == null) {
            repository = RepositoryRef.inherit();
        }
        if (description == null) {
            description = "";
        }
    }

    public String prefix() {
        int dash = id.lastIndexOf('-');
        return dash > 0 ? id.substring(0, dash) : id;
    }

    /**
     * @return the sequence number of the id, or {@code -1} when the id has no numeric suffix
     */
    public int number() {
        int dash = id.lastIndexOf('-');
        try {
            return Integer.parseInt(id.substring(dash + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
