package com.filter.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Filter.
 * Routes to subcommands: story, workspace, project, status.
 */
@Command(
        name = "filter",
        mixinStandardHelpOptions = true,
        version = "Filter 0.1.0",
        description = "File-backed kanban board for stories with per-story git workspaces",
        subcommands = {
                StoryCommand.class,
                WorkspaceCommand.class,
                ProjectCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FilterCommand implements Runnable {

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
