package com.filter.dispatch.cli;

import com.filter.core.error.FilterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final FilterCommand filterCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FilterCommand filterCommand, IFactory factory) {
        this.filterCommand = filterCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(filterCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Builds the command line with the exit-code mapping for failures escaping a command.
     */
    public static CommandLine commandLine(FilterCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof FilterException fe) {
                        return ConsoleOutput.failure(fe);
                    }
                    log.error("Unexpected failure in '{}'", cmd.getCommandName(), ex);
                    ConsoleOutput.error("Unexpected error: " + ex.getMessage());
                    return 3;
                });
    }
}
