package com.filter.core.model;

import java.io.Serializable;

/**
 * Repository a story's workspace is bound to.
 *
 * @param url            remote URL, {@code null} to inherit the project's default remote
 * @param branchStrategy branch naming template, {@code null} to inherit the project's template
 */
public record RepositoryRef(String url, String branchStrategy) implements Serializable {

    public static RepositoryRef inherit() {
        return new RepositoryRef(null, null);
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    public boolean hasBranchStrategy() {
        return branchStrategy != null && !branchStrategy.isBlank();
    }
}
