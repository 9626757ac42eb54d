package com.filter.core.error;

/**
 * Classes of failure surfaced by the core, each mapped to a process exit code.
 */
public enum ErrorCategory {
    VALIDATION(1),
    STATE_CONFLICT(2),
    EXTERNAL_TOOL(3),
    STORAGE(3),
    TIMEOUT(4),
    BUSY(4);

    private final int exitCode;

    ErrorCategory(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
