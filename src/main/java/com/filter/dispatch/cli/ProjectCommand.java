package com.filter.dispatch.cli;

import com.filter.core.logging.InvocationContext;
import com.filter.core.model.ProjectConfig;
import com.filter.core.model.ProjectInfo;
import com.filter.core.pipeline.Result;
import com.filter.core.project.ProjectManager;
import com.filter.engine.StoryWorkflowService;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command group: filter project create|delete|info
 */
@Command(name = "project", mixinStandardHelpOptions = true, description = "Manage filter projects",
        subcommands = {
                ProjectCommand.Create.class,
                ProjectCommand.Delete.class,
                ProjectCommand.Info.class
        })
@Component
public class ProjectCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "create", mixinStandardHelpOptions = true, description = "Create a new filter project")
    @Component
    public static class Create implements Callable<Integer> {

        @Parameters(index = "0", defaultValue = ".", description = "Project directory (default: ${DEFAULT-VALUE})")
        private Path path;

        @Option(names = {"--name"}, description = "Project name (default: directory name)")
        private String name;

        @Option(names = {"--prefix"}, description = "Story id prefix (default: derived from the name)")
        private String prefix;

        @Option(names = {"--repo"}, description = "Git remote; repeatable, the first one is the default")
        private List<String> repositories = new ArrayList<>();

        @Option(names = {"--maintainer"}, description = "Maintainer name or email; repeatable")
        private List<String> maintainers = new ArrayList<>();

        private final StoryWorkflowService workflow;
        private final Invocations invocations;

        public Create(StoryWorkflowService workflow, Invocations invocations) {
            this.workflow = workflow;
            this.invocations = invocations;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("project create");
            try {
                var request = new ProjectManager.NewProject(name, prefix, repositories, maintainers);
                var result = workflow.createProject(ctx, path, request);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                ProjectConfig config = result.orElseThrow();
                ConsoleOutput.success("Created project " + config.projectName() + " at "
                        + path.toAbsolutePath().normalize());
                ConsoleOutput.info("Story prefix: " + config.prefix());
                ConsoleOutput.info("Stages: " + String.join(" -> ", config.kanbanStages()));
                return 0;
            } finally {
                invocations.end();
            }
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true,
            description = "Delete a filter project and its story workspaces")
    @Component
    public static class Delete implements Callable<Integer> {

        @Parameters(index = "0", defaultValue = ".", description = "Project directory (default: ${DEFAULT-VALUE})")
        private Path path;

        @Option(names = {"--force"}, description = "Delete project even if it contains stories")
        private boolean force;

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
            InvocationContext ctx = invocations.begin("project delete");
            try {
                if (!force && !ctx.nonInteractive()
                        && !prompter.confirm("Delete the filter project at " + path.toAbsolutePath().normalize() + "?")) {
                    ConsoleOutput.info("Deletion cancelled");
                    return 0;
                }
                var result = workflow.deleteProject(ctx, path, force);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                int workspaces = result.orElseThrow();
                ConsoleOutput.success("Deleted filter project at " + path.toAbsolutePath().normalize()
                        + (workspaces > 0 ? " (" + workspaces + " workspaces removed)" : ""));
                return 0;
            } finally {
                invocations.end();
            }
        }
    }

    @Command(name = "info", mixinStandardHelpOptions = true, description = "Show project information")
    @Component
    public static class Info implements Callable<Integer> {

        @Parameters(index = "0", defaultValue = ".", description = "Project directory (default: ${DEFAULT-VALUE})")
        private Path path;

        private final StoryWorkflowService workflow;
        private final Invocations invocations;

        public Info(StoryWorkflowService workflow, Invocations invocations) {
            this.workflow = workflow;
            this.invocations = invocations;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("project info");
            try {
                var result = workflow.projectInfo(ctx, path);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                ProjectInfo info = result.orElseThrow();
                System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Project " + info.name() + "|@"));
                System.out.println("  Path:    " + info.projectPath());
                System.out.println("  Board:   " + info.filterPath());
                System.out.println("  Prefix:  " + info.prefix());
                System.out.println("  Created: " + info.createdAt());
                System.out.println("  Stories: " + info.totalStories());
                info.stageCounts().forEach((stage, count) -> System.out.printf("    %-12s %d%n", stage, count));
                return 0;
            } finally {
                invocations.end();
            }
        }
    }
}
