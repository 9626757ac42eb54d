package com.filter.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * Summary of a project for {@code project info}.
 */
public record ProjectInfo(
    Path projectPath,
    Path filterPath,
    String name,
    String prefix,
    int totalStories,
    Map<String, Integer> stageCounts,
    Instant createdAt
) {
}
