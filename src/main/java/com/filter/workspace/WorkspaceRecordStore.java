package com.filter.workspace;

import com.filter.core.config.Mappers;
import com.filter.core.error.StateConflictException;
import com.filter.core.error.StorageException;
import com.filter.core.model.WorkspaceRecord;
import com.filter.core.project.ProjectLayout;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON workspace records under {@code <workspace-root>/.records/}, replaced atomically.
 *
 * <pre>
 * &lt;workspace-root&gt;/&lt;story-id&gt;/              working tree
 * &lt;workspace-root&gt;/.records/&lt;story-id&gt;.json   record
 * &lt;workspace-root&gt;/.locks/&lt;story-id&gt;.lock     provisioning lock
 * </pre>
 */
public class WorkspaceRecordStore {

    private final Path workspaceRoot;

    public WorkspaceRecordStore(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
    }

    public Path workspaceRoot() { return workspaceRoot; }

    public Path workspaceDir(String storyId) {
        return workspaceRoot.resolve(ProjectLayout.requireValidId(storyId));
    }

    public Path recordFile(String storyId) {
        return workspaceRoot.resolve(".records").resolve(ProjectLayout.requireValidId(storyId) + ".json");
    }

    public Path lockFile(String storyId) {
        return workspaceRoot.resolve(".locks").resolve(ProjectLayout.requireValidId(storyId) + ".lock");
    }

    /**
     * @throws StateConflictException the record on disk belongs to another story
     */
    public Optional<WorkspaceRecord> load(String storyId) {
        Path file = recordFile(storyId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        WorkspaceRecord record;
        try {
            record = Mappers.JSON.readValue(file.toFile(), WorkspaceRecord.class);
        } catch (IOException e) {
            throw new StorageException("Failed to read workspace record " + file, e);
        }
        if (record == null || !storyId.equals(record.storyId())) {
            throw new StateConflictException("Workspace record " + file + " belongs to "
                    + (record == null ? "no story" : record.storyId()) + ", not " + storyId,
                    "Delete " + file + " and provision the workspace again");
        }
        return Optional.of(record);
    }

    public WorkspaceRecord save(WorkspaceRecord record) {
        Path file = recordFile(record.storyId());
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), record.storyId(), ".tmp");
            try {
                Mappers.JSON.writeValue(tmp.toFile(), record);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write workspace record " + file, e);
        }
        return record;
    }

    public boolean delete(String storyId) {
        try {
            return Files.deleteIfExists(recordFile(storyId));
        } catch (IOException e) {
            throw new StorageException("Failed to delete workspace record of " + storyId, e);
        }
    }
}
