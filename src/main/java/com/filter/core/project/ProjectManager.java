package com.filter.core.project;

import com.filter.core.error.StorageException;
import com.filter.core.error.ValidationException;
import com.filter.core.fs.FileTrees;
import com.filter.core.logging.InvocationContext;
import com.filter.core.model.ProjectConfig;
import com.filter.core.model.ProjectInfo;
import com.filter.core.story.PrefixGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Creates, inspects and deletes the {@code .filter} structure of a project.
 */
public class ProjectManager {

    private static final Logger log = LoggerFactory.getLogger(ProjectManager.class);

    private final ProjectIndex index;
    private final List<String> defaultStages;

    public ProjectManager(ProjectIndex index, List<String> defaultStages) {
        this.index = index;
        this.defaultStages = List.copyOf(defaultStages);
    }

    /**
     * Parameters of a new project.
     *
     * @param name         project name, defaults to the directory name
     * @param prefix       story id prefix, derived from the name when {@code null}
     * @param repositories git remotes, the first one is the default
     * @param maintainers  maintainer names or emails
     */
    public record NewProject(String name, String prefix, List<String> repositories, List<String> maintainers) {

        public NewProject {
            repositories = repositories == null ? List.of() : List.copyOf(repositories);
            maintainers = maintainers == null ? List.of() : List.copyOf(maintainers);
        }
    }

    /**
     * Creates the project structure at {@code projectPath}. The project root is created while the
     * installation index is locked, so two projects can never claim the same prefix.
     *
     * @throws ValidationException when a project already exists there or the prefix is taken
     */
    public ProjectConfig create(InvocationContext ctx, Path projectPath, NewProject request) {
        ProjectLayout layout = new ProjectLayout(projectPath);
        if (Files.exists(layout.root())) {
            throw new ValidationException("Filter project already exists at " + layout.root());
        }

        String name = request.name() != null && !request.name().isBlank()
                ? request.name()
                : String.valueOf(layout.projectPath().getFileName());
        String prefix = request.prefix() != null && !request.prefix().isBlank()
                ? request.prefix().toLowerCase(Locale.ROOT)
                : PrefixGenerator.generate(name);
        if (!PrefixGenerator.isValid(prefix)) {
            throw new ValidationException("Invalid prefix '" + prefix + "'",
                    "Use 1-16 letters or digits, e.g. --prefix api");
        }

        index.register(ctx, prefix, layout.projectPath(), name, () -> claimRoot(layout));

        ProjectConfig config = new ProjectConfig(name, prefix, 0, Instant.now().truncatedTo(ChronoUnit.SECONDS),
                defaultStages, request.repositories(), request.maintainers(), null);
        try {
            Files.createDirectories(layout.storiesDir());
            for (String stage : defaultStages) {
                Files.createDirectories(layout.stageDir(stage));
            }
            Files.createDirectories(layout.locksDir());
            Files.createDirectories(layout.journalDir());
            ProjectConfigStore.save(layout, config);
            Files.writeString(layout.readme(), readme(defaultStages), StandardCharsets.UTF_8);
        } catch (IOException e) {
            discardPartial(ctx, layout);
            throw new StorageException("Failed to create project structure at " + layout.root(), e);
        } catch (StorageException e) {
            discardPartial(ctx, layout);
            throw e;
        }

        log.info("Created project {} with prefix {} at {}", name, prefix, layout.root());
        ctx.audit("project.created", prefix + " " + layout.root());
        return config;
    }

    /**
     * Deletes the project's {@code .filter} directory.
     *
     * @param force delete even when stories exist
     * @throws ValidationException no project, or stories exist and {@code force} is false
     */
    public void delete(InvocationContext ctx, Path projectPath, boolean force) {
        ProjectLayout layout = new ProjectLayout(projectPath);
        if (!Files.isDirectory(layout.root())) {
            throw new ValidationException("No filter project found at " + layout.root());
        }
        try {
            int stories = FileTrees.countVisibleEntries(layout.storiesDir());
            if (stories > 0 && !force) {
                throw new ValidationException("Project contains " + stories + " stories",
                        "Use --force to delete anyway");
            }
            FileTrees.deleteRecursively(layout.root());
        } catch (IOException e) {
            throw new StorageException("Failed to delete project structure at " + layout.root(), e);
        }
        index.unregister(ctx, layout.projectPath());
        log.info("Deleted project at {}", layout.root());
        ctx.audit("project.deleted", layout.root().toString());
    }

    private static void claimRoot(ProjectLayout layout) {
        try {
            Files.createDirectories(layout.projectPath());
            Files.createDirectory(layout.root());
        } catch (FileAlreadyExistsException e) {
            throw new ValidationException("Filter project already exists at " + layout.root());
        } catch (IOException e) {
            throw new StorageException("Failed to create " + layout.root(), e);
        }
    }

    private void discardPartial(InvocationContext ctx, ProjectLayout layout) {
        index.unregister(ctx, layout.projectPath());
        try {
            FileTrees.deleteRecursively(layout.root());
        } catch (IOException e) {
            log.warn("Could not remove partially created project at {}: {}", layout.root(), e.getMessage());
        }
    }

    public ProjectInfo info(Path projectPath) {
        ProjectLayout layout = new ProjectLayout(projectPath);
        ProjectConfig config = ProjectConfigStore.load(layout);
        try {
            Map<String, Integer> stageCounts = new LinkedHashMap<>();
            for (String stage : config.kanbanStages()) {
                stageCounts.put(stage, FileTrees.countVisibleEntries(layout.stageDir(stage)));
            }
            return new ProjectInfo(layout.projectPath(), layout.root(), config.projectName(), config.prefix(),
                    FileTrees.countVisibleEntries(layout.storiesDir()), stageCounts, config.createdAt());
        } catch (IOException e) {
            throw new StorageException("Failed to inspect project at " + layout.root(), e);
        }
    }

    public boolean exists(Path projectPath) {
        return Files.isDirectory(new ProjectLayout(projectPath).root());
    }

    static String readme(List<String> stages) {
        var sb = new StringBuilder();
        sb.append("# Filter Project\n\n");
        sb.append("This directory holds a Filter kanban board.\n\n");
        sb.append("## Directory Structure\n\n");
        sb.append("- `stories/` - Contains all story markdown files\n");
        sb.append("- `kanban/` - Kanban workflow directories with symbolic links to stories\n");
        for (String stage : stages) {
            sb.append("  - `").append(stage).append("/`\n");
        }
        sb.append("\n## Usage\n\n");
        sb.append("```bash\n");
        sb.append("# Create a new story\n");
        sb.append("filter story create \"Story title\"\n\n");
        sb.append("# Move story to different stage\n");
        sb.append("filter story move <story-id> <stage>\n\n");
        sb.append("# List stories by stage\n");
        sb.append("filter story list --stage ").append(stages.isEmpty() ? "<stage>" : stages.get(0)).append("\n");
        sb.append("```\n");
        return sb.toString();
    }
}
