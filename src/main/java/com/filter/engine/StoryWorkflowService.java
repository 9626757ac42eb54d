package com.filter.engine;

import com.filter.core.error.ValidationException;
import com.filter.core.logging.InvocationContext;
import com.filter.core.metrics.FilterMetrics;
import com.filter.core.model.BoardListing;
import com.filter.core.model.ProjectConfig;
import com.filter.core.model.ProjectInfo;
import com.filter.core.model.RepositoryRef;
import com.filter.core.model.StageListing;
import com.filter.core.model.Story;
import com.filter.core.model.TransitionResult;
import com.filter.core.model.WorkspaceRecord;
import com.filter.core.pipeline.CommandPipeline;
import com.filter.core.pipeline.Result;
import com.filter.core.project.ProjectLayout;
import com.filter.core.project.ProjectManager;
import com.filter.core.story.StoryRegistry;
import com.filter.workspace.BranchNameTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Multi-step story and workspace operations, each assembled as a {@link CommandPipeline}.
 *
 * <p>Pipelines do not roll back. A story whose workspace or initial stage step failed stays
 * valid and can be resumed with {@code workspace provision} and {@code story move}.
 */
@Service
public class StoryWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(StoryWorkflowService.class);

    private final ProjectSessionFactory sessions;
    private final FilterMetrics metrics;

    public StoryWorkflowService(ProjectSessionFactory sessions, FilterMetrics metrics) {
        this.sessions = sessions;
        this.metrics = metrics;
    }

    /**
     * Request for a new story.
     *
     * @param initialStage stage to place the story in, {@code null} for the project's first stage
     */
    public record NewStory(String title, String description, String repositoryUrl, String branchStrategy,
                           String initialStage, boolean skipWorkspace) {
    }

    /**
     * @param workspace the provisioned workspace, {@code null} when provisioning was skipped
     */
    public record CreatedStory(Story story, WorkspaceRecord workspace, String stage) {
    }

    public record DeletedStory(String storyId, List<String> removedFromStages, boolean workspaceRemoved) {
    }

    public record StoryDetails(Story story, Optional<String> stage, Optional<WorkspaceRecord> workspace) {
    }

    private record Draft(ProjectSession session, String storyId, Story story, WorkspaceRecord workspace) {

        Draft withStory(Story created) {
            return new Draft(session, storyId, created, workspace);
        }

        Draft withWorkspace(WorkspaceRecord record) {
            return new Draft(session, storyId, story, record);
        }
    }

    private record TornDown(ProjectSession session, boolean workspaceRemoved) {
    }

    private record Unlinked(TornDown tornDown, List<String> stages) {
    }

    public Result<CreatedStory> createStory(InvocationContext ctx, Path projectPath, NewStory request) {
        return CommandPipeline.start(ctx, "resolve project", () -> sessions.open(projectPath))
                .then("validate request", session -> {
                    StoryRegistry.validateTitle(request.title());
                    if (request.initialStage() != null) {
                        session.kanban().requireStage(request.initialStage());
                    }
                    if (request.branchStrategy() != null && !request.branchStrategy().isBlank()) {
                        BranchNameTemplate.validate(request.branchStrategy());
                    }
                    return session;
                })
                .then("allocate story id", session -> new Draft(session, session.registry().allocateId(ctx), null, null))
                .then("create story record", draft -> draft.withStory(draft.session().registry().create(ctx,
                        draft.storyId(), request.title(), request.description(),
                        new RepositoryRef(request.repositoryUrl(), request.branchStrategy()))))
                .then("provision workspace", draft -> {
                    if (request.skipWorkspace()) {
                        log.info("Skipping workspace for {} on request", draft.storyId());
                        return draft;
                    }
                    if (!draft.session().settingsFor(draft.story()).hasRepository()) {
                        log.info("Story {} has no repository, no workspace provisioned", draft.storyId());
                        return draft;
                    }
                    return draft.withWorkspace(draft.session().provisioner().provision(ctx, draft.storyId(), false));
                })
                .then("transition to initial stage", draft -> {
                    String stage = request.initialStage() != null
                            ? request.initialStage()
                            : draft.session().config().initialStage();
                    draft.session().kanban().transition(ctx, draft.storyId(), null, stage);
                    return new CreatedStory(draft.story(), draft.workspace(), stage);
                })
                .peek("record metrics", created -> metrics.recordStoryCreated())
                .result();
    }

    public Result<TransitionResult> moveStory(InvocationContext ctx, Path projectPath, String storyId,
                                              String fromStage, String toStage) {
        return CommandPipeline.start(ctx, "resolve project", () -> sessions.open(projectPath))
                .then("move story", session -> session.kanban().transition(ctx, storyId, fromStage, toStage))
                .result();
    }

    /**
     * @param stage limit the listing to one stage, {@code null} for the whole board
     */
    public Result<BoardListing> listStories(InvocationContext ctx, Path projectPath, String stage) {
        return CommandPipeline.start(ctx, "resolve project", () -> sessions.open(projectPath))
                .then("list stories", session -> {
                    if (stage == null) {
                        return session.kanban().listBoard(ctx);
                    }
                    StageListing listing = session.kanban().listStage(ctx, stage);
                    return new BoardListing(List.of(listing), List.of(), listing.problems());
                })
                .result();
    }

    public Result<StoryDetails> showStory(InvocationContext ctx, Path projectPath, String storyId) {
        return CommandPipeline.start(ctx, "resolve project", () -> sessions.open(projectPath))
                .then("read story", session -> new StoryDetails(session.registry().require(storyId),
                        session.kanban().currentStage(ctx, storyId),
                        session.provisioner().status(storyId)))
                .result();
    }

    /**
     * Removes the workspace, then every stage link, then the story file. Each step is idempotent,
     * so a failed deletion can simply be re-run.
     */
    public Result<DeletedStory> deleteStory(InvocationContext ctx, Path projectPath, String storyId) {
        return CommandPipeline.start(ctx, "resolve project", () -> sessions.open(projectPath))
                .then("find story", session -> {
                    session.registry().require(storyId);
                    return session;
                })
                .then("tear down workspace", session -> new TornDown(session,
                        session.provisioner().teardown(ctx, storyId)))
                .then("unlink from board", tornDown -> new Unlinked(tornDown,
                        tornDown.session().kanban().unlinkAll(ctx, storyId)))
                .then("delete story record", unlinked -> {
                    unlinked.tornDown().session().registry().delete(ctx, storyId);
                    return new DeletedStory(ProjectLayout.requireValidId(storyId), unlinked.stages(), unlinked.tornDown().workspaceRemoved());
                })
                .result();
    }

    public Result<WorkspaceRecord> provisionWorkspace(InvocationContext ctx, Path projectPath, String storyId,
                                                      boolean refresh) {
        return CommandPipeline.start(ctx, "resolve project", () -> sessions.open(projectPath))
                .then("provision workspace", session -> session.provisioner().provision(ctx, storyId, refresh))
                .result();
    }

    public Result<Boolean> teardownWorkspace(InvocationContext ctx, Path projectPath, String storyId) {
        return CommandPipeline.start(ctx, "resolve project", () -> sessions.open(projectPath))
                .then("tear down workspace", session -> session.provisioner().teardown(ctx, storyId))
                .result();
    }

    public Result<Optional<WorkspaceRecord>> workspaceStatus(InvocationContext ctx, Path projectPath,
                                                             String storyId) {
        return CommandPipeline.start(ctx, "resolve project", () -> sessions.open(projectPath))
                .then("read workspace record", session -> session.provisioner().status(storyId))
                .result();
    }

    public Result<ProjectConfig> createProject(InvocationContext ctx, Path projectPath,
                                               ProjectManager.NewProject request) {
        return CommandPipeline.start(ctx, "create project",
                        () -> sessions.projectManager().create(ctx, projectPath, request))
                .result();
    }

    /**
     * Tears down the workspaces of all stories, then deletes the project structure.
     *
     * @return number of workspaces removed
     */
    public Result<Integer> deleteProject(InvocationContext ctx, Path projectPath, boolean force) {
        return CommandPipeline.start(ctx, "resolve project", () -> sessions.open(projectPath))
                .then("check stories", session -> {
                    int stories = session.registry().listAll().size();
                    if (stories > 0 && !force) {
                        throw new ValidationException("Project contains " + stories + " stories",
                                "Use --force to delete anyway");
                    }
                    return session;
                })
                .then("tear down workspaces", session -> {
                    int removed = 0;
                    for (Story story : session.registry().listAll()) {
                        if (session.provisioner().teardown(ctx, story.id())) {
                            removed++;
                        }
                    }
                    return removed;
                })
                .then("delete project", removed -> {
                    sessions.projectManager().delete(ctx, projectPath, force);
                    return removed;
                })
                .result();
    }

    public Result<ProjectInfo> projectInfo(InvocationContext ctx, Path projectPath) {
        return CommandPipeline.start(ctx, "read project", () -> sessions.projectManager().info(projectPath))
                .result();
    }
}
