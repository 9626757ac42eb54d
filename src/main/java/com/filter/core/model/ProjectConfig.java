package com.filter.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.filter.core.config.ConfigLayer;

import java.time.Instant;
import java.util.List;

/**
 * Contents of {@code <project-root>/config.yml}.
 *
 * @param projectName     human-readable project name
 * @param prefix          story id prefix, unique within the installation
 * @param lastStoryNumber highest allocated story number
 * @param createdAt       creation time of the project
 * @param kanbanStages    configured stages in board order
 * @param repositories    git remotes; the first one is the default for new workspaces
 * @param maintainers     people responsible for the project
 * @param settings        project configuration layer, may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectConfig(
    @JsonProperty("project_name") String projectName,
    @JsonProperty("prefix") String prefix,
    @JsonProperty("last_story_number") int lastStoryNumber,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("kanban_stages") List<String> kanbanStages,
    @JsonProperty("repositories") List<String> repositories,
    @JsonProperty("maintainers") List<String> maintainers,
    @JsonProperty("settings") ConfigLayer settings
) {

    public ProjectConfig {
        kanbanStages = kanbanStages == null ? List.of() : List.copyOf(kanbanStages);
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
        maintainers = maintainers == null ? List.of() : List.copyOf(maintainers);
    }

    public ProjectConfig withLastStoryNumber(int number) {
        return new ProjectConfig(projectName, prefix, number, createdAt, kanbanStages, repositories,
                maintainers, settings);
    }

    /**
     * The project's configuration layer, with the default remote folded in.
     */
    public ConfigLayer asLayer() {
        ConfigLayer base = settings != null ? settings : ConfigLayer.empty();
        String defaultRemote = repositories.isEmpty() ? null : repositories.get(0);
        return new ConfigLayer(null, null, null, null, null, defaultRemote).overriddenBy(base);
    }

    public String initialStage() {
        return kanbanStages.isEmpty() ? null : kanbanStages.get(0);
    }
}
