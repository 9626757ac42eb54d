package com.filter.dispatch.cli;

import com.filter.core.error.BusyException;
import com.filter.core.logging.InvocationContext;
import com.filter.core.model.WorkspaceRecord;
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
 * CLI command group: filter workspace provision|teardown|status
 */
@Command(name = "workspace", mixinStandardHelpOptions = true, description = "Manage per-story git workspaces",
        subcommands = {
                WorkspaceCommand.Provision.class,
                WorkspaceCommand.Teardown.class,
                WorkspaceCommand.Status.class
        })
@Component
public class WorkspaceCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "provision", mixinStandardHelpOptions = true,
            description = "Clone the story's repository and check out its branch")
    @Component
    public static class Provision implements Callable<Integer> {

        @Parameters(index = "0", description = "Story ID")
        private String storyId;

        @Option(names = {"--refresh"}, description = "Fetch if stale and re-checkout the story branch")
        private boolean refresh;

        @Mixin
        private ProjectPathOption project;

        private final StoryWorkflowService workflow;
        private final Invocations invocations;
        private final Prompter prompter;

        public Provision(StoryWorkflowService workflow, Invocations invocations, Prompter prompter) {
            this.workflow = workflow;
            this.invocations = invocations;
            this.prompter = prompter;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("workspace provision");
            try {
                while (true) {
                    var result = workflow.provisionWorkspace(ctx, project.path(), storyId, refresh);
                    if (result instanceof Result.Failure<?> failure) {
                        if (failure.error() instanceof BusyException && !ctx.nonInteractive()
                                && prompter.confirm("Workspace of " + storyId
                                + " is being provisioned by another process. Wait and retry?")) {
                            continue;
                        }
                        return ConsoleOutput.failure(failure);
                    }
                    WorkspaceRecord record = result.orElseThrow();
                    ConsoleOutput.success("Workspace of " + storyId + " ready at " + record.path());
                    ConsoleOutput.info("Branch: " + record.branch());
                    return 0;
                }
            } finally {
                invocations.end();
            }
        }
    }

    @Command(name = "teardown", mixinStandardHelpOptions = true,
            description = "Delete the story's working directory and workspace record")
    @Component
    public static class Teardown implements Callable<Integer> {

        @Parameters(index = "0", description = "Story ID")
        private String storyId;

        @Mixin
        private ProjectPathOption project;

        private final StoryWorkflowService workflow;
        private final Invocations invocations;

        public Teardown(StoryWorkflowService workflow, Invocations invocations) {
            this.workflow = workflow;
            this.invocations = invocations;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("workspace teardown");
            try {
                var result = workflow.teardownWorkspace(ctx, project.path(), storyId);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                if (result.orElseThrow()) {
                    ConsoleOutput.success("Removed workspace of " + storyId);
                } else {
                    ConsoleOutput.info("No workspace recorded for " + storyId);
                }
                return 0;
            } finally {
                invocations.end();
            }
        }
    }

    @Command(name = "status", mixinStandardHelpOptions = true, description = "Show the story's workspace record")
    @Component
    public static class Status implements Callable<Integer> {

        @Parameters(index = "0", description = "Story ID")
        private String storyId;

        @Mixin
        private ProjectPathOption project;

        private final StoryWorkflowService workflow;
        private final Invocations invocations;

        public Status(StoryWorkflowService workflow, Invocations invocations) {
            this.workflow = workflow;
            this.invocations = invocations;
        }

        @Override
        public Integer call() {
            InvocationContext ctx = invocations.begin("workspace status");
            try {
                var result = workflow.workspaceStatus(ctx, project.path(), storyId);
                if (result instanceof Result.Failure<?> failure) {
                    return ConsoleOutput.failure(failure);
                }
                result.orElseThrow().ifPresentOrElse(ConsoleOutput::workspace,
                        () -> ConsoleOutput.info("No workspace provisioned for " + storyId));
                return 0;
            } finally {
                invocations.end();
            }
        }
    }
}
