package com.filter.dispatch.cli;

import com.filter.core.logging.InvocationContext;
import com.filter.core.model.TransitionResult;
import com.filter.core.pipeline.Result;
import com.filter.engine.StoryWorkflowService;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command group: filter story create|move|list|show|delete
 */
@Command(name = "story", mixinStandardHelpOptions = true, description = "Manage stories on the board",
        subcommands = {
                StoryCommand.Create.class,
                StoryCommand.Move.class,
                StoryCommand.ListStories.class,
                StoryCommand.Show.class,
                StoryCommand.Delete.class
        })
@Component
public class StoryCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "create", mixinStandardHelpOptions = true, description = "Create a new story")
    @Component
    public static class Create implements Callable<Integer> {

        @Parameters(index = "0", description = "Story title")
        private String title;

        @Option(names = {"-d", "--description"}, defaultValue = "", description = "Story description")
        private String description;

        @Option(names = {"--repo"}, description = "Git remote for the story workspace (default: project repository)")
        private String repo;

        @Option(names = {"--branch-strategy"}, description = "Branch template, e.g. feature/{id}")
        private String branchStrategy;

        @Option(names = {"-s", "--stage"}, description = "Initial kanban stage (default: first stage)")
        private String stage;

        @Option(names = {"--skip-workspace"}, description = "Do not provision a workspace")
        private boolean skipWorkspace;

        @Mixin
        private ProjectPathOption project;

        private final StoryWorkflowService workflow;
        private final Invocations invocations;

        public Create(StoryWorkflowService workflow, Invocations invocations) {
            this.workflow = workflow;
            this.invocations = invocations;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("story create");
            try {
                var request = new StoryWorkflowService.NewStory(title, description, repo, branchStrategy, stage,
                        skipWorkspace);
                var result = workflow.createStory(ctx, project.path(), request);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                var created = result.orElseThrow();
                ConsoleOutput.success("Created story " + created.story().id() + ": " + created.story().title());
                ConsoleOutput.info("Stage: " + created.stage());
                if (created.workspace() != null) {
                    ConsoleOutput.info("Workspace: " + created.workspace().path()
                            + " (branch " + created.workspace().branch() + ")");
                }
                return 0;
            } finally {
                invocations.end();
            }
        }
    }

    @Command(name = "move", mixinStandardHelpOptions = true, description = "Move a story to another stage")
    @Component
    public static class Move implements Callable<Integer> {

        @Parameters(index = "0", description = "Story ID")
        private String storyId;

        @Parameters(index = "1", description = "Target stage")
        private String stage;

        @Option(names = {"--from"}, description = "Expected current stage; refuse to move otherwise")
        private String fromStage;

        @Mixin
        private ProjectPathOption project;

        private final StoryWorkflowService workflow;
        private final Invocations invocations;

        public Move(StoryWorkflowService workflow, Invocations invocations) {
            this.workflow = workflow;
            this.invocations = invocations;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("story move");
            try {
                var result = workflow.moveStory(ctx, project.path(), storyId, fromStage, stage);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                TransitionResult moved = result.orElseThrow();
                if (moved.changed()) {
                    ConsoleOutput.success("Moved " + moved.storyId() + " from "
                            + (moved.fromStage() != null ? moved.fromStage() : "(not started)")
                            + " to " + moved.toStage());
                } else {
                    ConsoleOutput.info(moved.storyId() + " is already in " + moved.toStage());
                }
                return 0;
            } finally {
                invocations.end();
            }
        }
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List stories by stage")
    @Component
    public static class ListStories implements Callable<Integer> {

        @Option(names = {"-s", "--stage"}, description = "Only list this stage")
        private String stage;

        @Mixin
        private ProjectPathOption project;

        private final StoryWorkflowService workflow;
        private final Invocations invocations;

        public ListStories(StoryWorkflowService workflow, Invocations invocations) {
            this.workflow = workflow;
            this.invocations = invocations;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("story list");
            try {
                var result = workflow.listStories(ctx, project.path(), stage);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                var board = result.orElseThrow();
                if (board.storyCount() == 0 && board.problems().isEmpty()) {
                    ConsoleOutput.info(stage != null ? "No stories in " + stage : "No stories yet");
                    return 0;
                }
                ConsoleOutput.board(board);
                return 0;
            } finally {
                invocations.end();
            }
        }
    }

    @Command(name = "show", mixinStandardHelpOptions = true, description = "Show a story with its stage and workspace")
    @Component
    public static class Show implements Callable<Integer> {

        @Parameters(index = "0", description = "Story ID")
        private String storyId;

        @Mixin
        private ProjectPathOption project;

        private final StoryWorkflowService workflow;
        private final Invocations invocations;

        public Show(StoryWorkflowService workflow, Invocations invocations) {
            this.workflow = workflow;
            this.invocations = invocations;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("story show");
            try {
                var result = workflow.showStory(ctx, project.path(), storyId);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                var details = result.orElseThrow();
                ConsoleOutput.story(details.story(), details.stage().orElse(null));
                details.workspace().ifPresent(record -> {
                    System.out.println();
                    ConsoleOutput.workspace(record);
                });
                return 0;
            } finally {
                invocations.end();
            }
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true,
            description = "Delete a story, its stage links and its workspace")
    @Component
    public static class Delete implements Callable<Integer> {

        @Parameters(index = "0", description = "Story ID")
        private String storyId;

        @Option(names = {"-f", "--force"}, description = "Delete without confirmation")
        private boolean force;

        @Mixin
        private ProjectPathOption project;

        private final StoryWorkflowService workflow;
        private final Invocations invocations;
        private final Prompter prompter;

        public Delete(StoryWorkflowService workflow, Invocations invocations, Prompter prompter) {
            this.workflow = workflow;
            this.invocations = invocations;
            this.prompter = prompter;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("story delete");
            try {
                if (!force) {
                    if (ctx.nonInteractive()) {
                        ConsoleOutput.error("Refusing to delete " + storyId + " without confirmation");
                        ConsoleOutput.hint("Pass --force in non-interactive mode");
                        return 1;
                    }
                    if (!prompter.confirm("Delete story " + storyId + " and its workspace?")) {
                        ConsoleOutput.info("Deletion cancelled");
                        return 0;
                    }
                }
                var result = workflow.deleteStory(ctx, project.path(), storyId);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                var deleted = result.orElseThrow();
                ConsoleOutput.success("Deleted story " + deleted.storyId()
                        + (deleted.workspaceRemoved() ? " and its workspace" : ""));
                return 0;
            } finally {
                invocations.end();
            }
        }
    }
}
