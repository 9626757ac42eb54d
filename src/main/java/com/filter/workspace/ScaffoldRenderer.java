package com.filter.workspace;

import com.filter.core.model.Story;
import com.filter.core.model.WorkspaceRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes story-specific scaffold files into a freshly provisioned workspace.
 * Must be idempotent: provisioning re-runs it on every attempt.
 */
public interface ScaffoldRenderer {

    /**
     * @return the files written, relative to {@code workTree}
     */
    List<Path> render(Story story, WorkspaceRecord record, Path workTree);
}
