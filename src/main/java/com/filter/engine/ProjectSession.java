package com.filter.engine;

import com.filter.core.config.EffectiveSettings;
import com.filter.core.kanban.KanbanStateMachine;
import com.filter.core.model.ProjectConfig;
import com.filter.core.model.Story;
import com.filter.core.project.ProjectLayout;
import com.filter.core.story.StoryRegistry;
import com.filter.workspace.WorkspaceProvisioner;

import java.util.function.Function;

/**
 * The components of one project, wired for a single invocation.
 */
public final class ProjectSession {

    private final ProjectLayout layout;
    private final ProjectConfig config;
    private final EffectiveSettings settings;
    private final Function<Story, EffectiveSettings> storySettings;
    private final StoryRegistry registry;
    private final KanbanStateMachine kanban;
    private final WorkspaceProvisioner provisioner;

    ProjectSession(ProjectLayout layout, ProjectConfig config, EffectiveSettings settings,
                   Function<Story, EffectiveSettings> storySettings, StoryRegistry registry,
                   KanbanStateMachine kanban, WorkspaceProvisioner provisioner) {
        this.layout = layout;
        this.config = config;
        this.settings = settings;
        this.storySettings = storySettings;
        this.registry = registry;
        this.kanban = kanban;
        this.provisioner = provisioner;
    }

    public ProjectLayout layout() { return layout; }
    public ProjectConfig config() { return config; }
    public StoryRegistry registry() { return registry; }
    public KanbanStateMachine kanban() { return kanban; }
    public WorkspaceProvisioner provisioner() { return provisioner; }

    /**
     * Settings of the project itself: global, project and environment layers.
     */
    public EffectiveSettings settings() { return settings; }

    /**
     * Settings for one story, with its repository binding as the workspace layer.
     */
    public EffectiveSettings settingsFor(Story story) {
        return storySettings.apply(story);
    }
}
