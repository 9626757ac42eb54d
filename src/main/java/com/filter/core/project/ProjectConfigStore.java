package com.filter.core.project;

import com.filter.core.config.Mappers;
import com.filter.core.error.StorageException;
import com.filter.core.error.ValidationException;
import com.filter.core.model.ProjectConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and atomically rewrites {@code config.yml}.
 */
public final class ProjectConfigStore {

    private ProjectConfigStore() {}

    public static ProjectConfig load(ProjectLayout layout) {
        requireProject(layout);
        try {
            ProjectConfig config = Mappers.YAML.readValue(layout.configFile().toFile(), ProjectConfig.class);
            if (config == null || config.prefix() == null || config.kanbanStages().isEmpty()) {
                throw new ValidationException("Project configuration " + layout.configFile()
                        + " is missing its prefix or kanban stages",
                        "Restore config.yml or recreate the project");
            }
            return config;
        } catch (IOException e) {
            throw new StorageException("Failed to read " + layout.configFile(), e);
        }
    }

    public static void save(ProjectLayout layout, ProjectConfig config) {
        writeAtomically(layout.configFile(), config);
    }

    /**
     * Verifies the project root and its essential directories exist.
     */
    public static void requireProject(ProjectLayout layout) {
        if (!Files.isDirectory(layout.root())) {
            throw new ValidationException("No filter project found at " + layout.projectPath(),
                    "Run 'filter project create' first");
        }
        for (Path required : new Path[]{layout.storiesDir(), layout.kanbanDir(), layout.configFile()}) {
            if (!Files.exists(required)) {
                throw new ValidationException("Missing " + required + ". Project structure may be corrupted",
                        "Recreate the missing path or run 'filter project create' in a fresh directory");
            }
        }
    }

    static void writeAtomically(Path target, Object value) {
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try {
                Mappers.YAML.writeValue(tmp.toFile(), value);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write " + target, e);
        }
    }
}
