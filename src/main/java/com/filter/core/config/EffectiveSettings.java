package com.filter.core.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Fully resolved settings for one project or story after the layer merge.
 *
 * @param repositoryUrl may be {@code null} when no layer names a remote
 */
public record EffectiveSettings(
        Path workspaceRoot,
        String branchTemplate,
        Duration lockTimeout,
        int cloneRetryCount,
        Duration gitTimeout,
        String repositoryUrl
) {

    public boolean hasRepository() {
        return repositoryUrl != null && !repositoryUrl.isBlank();
    }
}
