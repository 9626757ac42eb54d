package com.filter.dispatch.cli;

import com.filter.core.error.FilterException;
import com.filter.core.model.BoardListing;
import com.filter.core.model.ListingProblem;
import com.filter.core.model.StageListing;
import com.filter.core.model.Story;
import com.filter.core.model.WorkspaceRecord;
import com.filter.core.pipeline.Result;
import com.filter.git.GitUrls;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Filter CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FILTER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void hint(String suggestion) {
        if (suggestion != null && !suggestion.isBlank()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|faint hint:|@ " + suggestion));
        }
    }

    /**
     * Prints a failed pipeline as "step: message" plus the repair hint.
     *
     * @return the process exit code for the failure
     */
    public static int failure(Result.Failure<?> failure) {
        FilterException e = failure.error();
        error(failure.step() + ": " + e.getMessage());
        hint(e.suggestion());
        return e.exitCode();
    }

    public static int failure(FilterException e) {
        error(e.getMessage());
        hint(e.suggestion());
        return e.exitCode();
    }

    public static void board(BoardListing board) {
        for (StageListing stage : board.stages()) {
            stageHeader(stage.stage(), stage.stories().size());
            stories(stage.stories());
        }
        if (!board.unstarted().isEmpty()) {
            stageHeader("not started", board.unstarted().size());
            stories(board.unstarted());
        }
        problems(board.problems());
    }

    public static void problems(List<ListingProblem> problems) {
        if (problems.isEmpty()) {
            return;
        }
        System.out.println();
        warn("Board problems (" + problems.size() + "):");
        for (ListingProblem p : problems) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) [" + p.kind() + "]|@ " + p.stage() + "/" + p.entry() + ": " + p.detail()));
            hint(p.suggestion());
        }
    }

    public static void story(Story story, String stage) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + story.id() + "|@: " + story.title()));
        System.out.println("  Stage:   " + (stage != null ? stage : "(not started)"));
        if (story.createdAt() != null) {
            System.out.println("  Created: " + story.createdAt());
        }
        if (story.repository().hasUrl()) {
            System.out.println("  Repo:    " + GitUrls.redact(story.repository().url()));
        }
        if (story.repository().hasBranchStrategy()) {
            System.out.println("  Branch strategy: " + story.repository().branchStrategy());
        }
        if (!story.description().isBlank()) {
            System.out.println();
            System.out.println(story.description());
        }
    }

    public static void workspace(WorkspaceRecord record) {
        String color = switch (record.status()) {
            case READY -> "fg(green)";
            case FAILED -> "fg(red)";
            default -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Workspace " + record.storyId() + "|@ @|" + color + " " + record.status() + "|@"));
        System.out.println("  Path:     " + record.path());
        System.out.println("  Remote:   " + GitUrls.redact(record.remoteUrl()));
        System.out.println("  Branch:   " + record.branch());
        System.out.println("  Attempts: " + record.attempts());
        System.out.println("  Updated:  " + record.updatedAt());
        if (record.lastError() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) Error:|@    " + record.lastError()));
        }
    }

    private static void stageHeader(String stage, int count) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) " + stage.toUpperCase(Locale.ROOT) + "|@ (" + count + ")"));
    }

    private static void stories(List<Story> stories) {
        if (stories.isEmpty()) {
            System.out.println("  -");
            return;
        }
        for (Story s : stories) {
            System.out.printf("  %-12s %s%n", s.id(), truncate(s.title(), 60));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
