package com.filter.dispatch.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * The {@code -p/--project-path} option shared by story and workspace commands.
 */
public class ProjectPathOption {

    @Option(names = {"-p", "--project-path"}, defaultValue = ".",
            description = "Path to the project directory (default: ${DEFAULT-VALUE})")
    Path projectPath;

    public Path path() {
        return projectPath;
    }
}
