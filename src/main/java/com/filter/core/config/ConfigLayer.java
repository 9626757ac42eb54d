package com.filter.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One layer of configuration. Every field is optional; {@code null} means "not set here".
 *
 * @param workspaceRoot      directory holding per-story workspaces
 * @param branchTemplate     branch naming template, e.g. {@code story/{id}}
 * @param lockTimeoutSeconds how long to wait for a story or workspace lock
 * @param cloneRetryCount    retries after the first failed clone/fetch attempt
 * @param gitTimeoutSeconds  timeout of a single git invocation
 * @param repositoryUrl      remote to bind new workspaces to
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigLayer(
        String workspaceRoot,
        String branchTemplate,
        Integer lockTimeoutSeconds,
        Integer cloneRetryCount,
        Integer gitTimeoutSeconds,
        String repositoryUrl
) {

    public static ConfigLayer empty() {
        return new ConfigLayer(null, null, null, null, null, null);
    }

    /**
     * Returns a layer where every field set in {@code higher} replaces the value of this layer.
     */
    public ConfigLayer overriddenBy(ConfigLayer higher) {
        if (higher == null) {
            return this;
        }
        return new ConfigLayer(
                pick(higher.workspaceRoot, workspaceRoot),
                pick(higher.branchTemplate, branchTemplate),
                pick(higher.lockTimeoutSeconds, lockTimeoutSeconds),
                pick(higher.cloneRetryCount, cloneRetryCount),
                pick(higher.gitTimeoutSeconds, gitTimeoutSeconds),
                pick(higher.repositoryUrl, repositoryUrl));
    }

    private static <T> T pick(T higher, T lower) {
        if (higher instanceof String s && s.isBlank()) {
            return lower;
        }
        return higher != null ? higher : lower;
    }
}
