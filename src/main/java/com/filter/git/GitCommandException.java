package com.filter.git;

import com.filter.core.error.ErrorCategory;
import com.filter.core.error.FilterException;

import java.util.List;
import java.util.Locale;

/**
 * A git invocation exited non-zero or could not be started.
 */
public class GitCommandException extends FilterException {

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "connection reset",
            "connection refused",
            "could not resolve host",
            "temporary failure in name resolution",
            "timed out");

    private final String operation;
    private final String redactedUrl;
    private final int exitCode;
    private final String stderr;

    public GitCommandException(String operation, String redactedUrl, int exitCode, String stderr) {
        super(ErrorCategory.EXTERNAL_TOOL, message(operation, redactedUrl, exitCode, stderr),
                "Check the remote URL and your git credentials, then re-run the command", null);
        this.operation = operation;
        this.redactedUrl = redactedUrl;
        this.exitCode = exitCode;
        this.stderr = GitUrls.redact(stderr == null ? "" : stderr);
    }

    public String operation() {
        return operation;
    }

    public String redactedUrl() {
        return redactedUrl;
    }

    /**
     * @return the git exit code, {@code -1} when the process could not be started
     */
    public int gitExitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }

    /**
     * True for network failures worth retrying: connection reset or refused, host resolution,
     * network timeouts. Authentication and missing-repository errors are permanent.
     */
    public boolean isTransient() {
        String lower = stderr.toLowerCase(Locale.ROOT);
        return TRANSIENT_MARKERS.stream().anyMatch(lower::contains);
    }

    private static String message(String operation, String redactedUrl, int exitCode, String stderr) {
        String detail = GitUrls.redact(stderr == null ? "" : stderr.strip());
        int nl = detail.lastIndexOf('\n');
        if (nl >= 0) {
            detail = detail.substring(nl + 1);
        }
        return "git " + operation + " failed (exit " + exitCode + ")"
                + (redactedUrl != null ? " for " + redactedUrl : "")
                + (detail.isEmpty() ? "" : ": " + detail);
    }
}
