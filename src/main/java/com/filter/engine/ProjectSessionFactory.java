package com.filter.engine;

import com.filter.core.config.ConfigLayer;
import com.filter.core.config.ConfigMerger;
import com.filter.core.config.EffectiveSettings;
import com.filter.core.config.FilterEnvironment;
import com.filter.core.config.FilterProperties;
import com.filter.core.kanban.KanbanStateMachine;
import com.filter.core.lock.LockManager;
import com.filter.core.metrics.FilterMetrics;
import com.filter.core.model.ProjectConfig;
import com.filter.core.model.Story;
import com.filter.core.project.ProjectConfigStore;
import com.filter.core.project.ProjectIndex;
import com.filter.core.project.ProjectLayout;
import com.filter.core.project.ProjectManager;
import com.filter.core.story.StoryRegistry;
import com.filter.git.GitRepositoryManager;
import com.filter.workspace.BackoffCalculator;
import com.filter.workspace.ScaffoldRenderer;
import com.filter.workspace.WorkspaceProvisioner;
import com.filter.workspace.WorkspaceRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;

/**
 * Builds {@link ProjectSession}s from the project's {@code config.yml} and the global configuration.
 */
@Component
public class ProjectSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(ProjectSessionFactory.class);

    private static final double BACKOFF_JITTER = 0.1;

    private final FilterProperties properties;
    private final FilterEnvironment environment;
    private final LockManager lockManager;
    private final GitRepositoryManager git;
    private final ScaffoldRenderer scaffold;
    private final FilterMetrics metrics;

    public ProjectSessionFactory(FilterProperties properties, FilterEnvironment environment,
                                 LockManager lockManager, GitRepositoryManager git,
                                 ScaffoldRenderer scaffold, FilterMetrics metrics) {
        this.properties = properties;
        this.environment = environment;
        this.lockManager = lockManager;
        this.git = git;
        this.scaffold = scaffold;
        this.metrics = metrics;
    }

    /**
     * @throws com.filter.core.error.ValidationException no project at {@code projectPath}
     */
    public ProjectSession open(Path projectPath) {
        ProjectLayout layout = new ProjectLayout(projectPath);
        ProjectConfig config = ProjectConfigStore.load(layout);

        ConfigLayer global = properties.asLayer();
        ConfigLayer project = config.asLayer();
        EffectiveSettings settings = anchor(ConfigMerger.merge(global, project, null, environment), layout);
        Function<Story, EffectiveSettings> storySettings =
                story -> anchor(ConfigMerger.merge(global, project, storyLayer(story), environment), layout);

        Duration lockTimeout = settings.lockTimeout();
        StoryRegistry registry = new StoryRegistry(layout, lockManager, lockTimeout);
        KanbanStateMachine kanban = new KanbanStateMachine(layout, config.kanbanStages(), registry, lockManager,
                lockTimeout, properties.getKanban().getConflictPolicy(), metrics);
        FilterProperties.Git gitProps = properties.getGit();
        WorkspaceProvisioner provisioner = new WorkspaceProvisioner(registry, storySettings,
                new WorkspaceRecordStore(settings.workspaceRoot()), git, scaffold, lockManager, lockTimeout,
                new BackoffCalculator(gitProps.getBackoffBaseMillis(), gitProps.getBackoffMaxMillis(), BACKOFF_JITTER),
                Duration.ofSeconds(gitProps.getFetchMaxAgeSeconds()), metrics);

        log.debug("Opened project {} (prefix {}, workspaces under {})", config.projectName(), config.prefix(),
                settings.workspaceRoot());
        return new ProjectSession(layout, config, settings, storySettings, registry, kanban, provisioner);
    }

    /**
     * Project lifecycle operations need no open project, only the installation index.
     */
    public ProjectManager projectManager() {
        return new ProjectManager(projectIndex(), properties.getDefaultStages());
    }

    public ProjectIndex projectIndex() {
        EffectiveSettings global = ConfigMerger.merge(properties.asLayer(), null, null, environment);
        return new ProjectIndex(properties.homePath(), lockManager, global.lockTimeout());
    }

    static ConfigLayer storyLayer(Story story) {
        return new ConfigLayer(null, story.repository().branchStrategy(), null, null, null,
                story.repository().url());
    }

    /**
     * Resolves a relative workspace root against the project directory.
     */
    private static EffectiveSettings anchor(EffectiveSettings settings, ProjectLayout layout) {
        if (settings.workspaceRoot().isAbsolute()) {
            return settings;
        }
        return new EffectiveSettings(layout.projectPath().resolve(settings.workspaceRoot()).normalize(),
                settings.branchTemplate(), settings.lockTimeout(), settings.cloneRetryCount(),
                settings.gitTimeout(), settings.repositoryUrl());
    }
}
