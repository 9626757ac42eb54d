package com.filter.dispatch.cli;

import com.filter.core.config.FilterProperties;
import com.filter.core.error.FilterException;
import com.filter.engine.ProjectSessionFactory;
import com.filter.git.GitRepositoryManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: filter status
 * <p>
 * Reports whether the git executable can be run, plus the installation paths.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check tool availability")
@Component
public class StatusCommand implements Callable<Integer> {

    private final GitRepositoryManager git;
    private final FilterProperties properties;
    private final ProjectSessionFactory sessions;

    public StatusCommand(GitRepositoryManager git, FilterProperties properties, ProjectSessionFactory sessions) {
        this.git = git;
        this.properties = properties;
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        Optional<String> version = git.version();
        if (version.isPresent()) {
            ConsoleOutput.success("git: " + version.get());
        } else {
            ConsoleOutput.error("git: not available (" + properties.getGit().getExecutable() + ")");
            ConsoleOutput.hint("Install git or set filter.git.executable");
        }
        ConsoleOutput.info("Home: " + properties.homePath());
        ConsoleOutput.info("Workspaces: " + properties.workspaceRootPath());
        try {
            ConsoleOutput.info("Registered projects: " + sessions.projectIndex().entries().size());
        } catch (FilterException e) {
            ConsoleOutput.warn("Project index unreadable: " + e.getMessage());
        }
        return version.isPresent() ? 0 : 3;
    }
}
