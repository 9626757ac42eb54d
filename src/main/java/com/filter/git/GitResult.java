package com.filter.git;

/**
 * Outcome of one git invocation. Output is captured verbatim; callers redact before reporting.
 */
public record GitResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public String firstLine() {
        String out = stdout == null ? "" : stdout.strip();
        int nl = out.indexOf('\n');
        return nl >= 0 ? out.substring(0, nl).strip() : out;
    }
}
