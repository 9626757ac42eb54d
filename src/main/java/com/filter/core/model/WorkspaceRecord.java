package com.filter.core.model;

import java.time.Instant;

/**
 * Persisted state of a story workspace.
 *
 * @param storyId   owning story; a record is never shared between stories
 * @param path      absolute path of the working tree
 * @param remoteUrl remote the tree was cloned from
 * @param branch    story branch checked out in the tree
 * @param status    provisioning status
 * @param attempts  number of provisioning attempts so far
 * @param lastError message of the last failure, or {@code null}
 * @param updatedAt time of the last status change
 */
public record WorkspaceRecord(
    String storyId,
    String path,
    String remoteUrl,
    String branch,
    ProvisioningStatus status,
    int attempts,
    String lastError,
    Instant updatedAt
) {

    public static WorkspaceRecord unprovisioned(String storyId, String path, String remoteUrl, String branch) {
        return new WorkspaceRecord(storyId, path, remoteUrl, branch, ProvisioningStatus.UNPROVISIONED, 0, null,
                Instant.now());
    }

    public WorkspaceRecord cloning() {
        return new WorkspaceRecord(storyId, path, remoteUrl, branch, ProvisioningStatus.CLONING, attempts + 1, null,
                Instant.now());
    }

    public WorkspaceRecord ready() {
        return new WorkspaceRecord(storyId, path, remoteUrl, branch, ProvisioningStatus.READY, attempts, null,
                Instant.now());
    }

    public WorkspaceRecord failed(String error) {
        return new WorkspaceRecord(storyId, path, remoteUrl, branch, ProvisioningStatus.FAILED, attempts, error,
                Instant.now());
    }

    public boolean isReady() {
        return status == ProvisioningStatus.READY;
    }
}
