package com.filter.core.error;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Another invocation holds the lock guarding a story or workspace.
 * The caller decides whether to wait and retry or abort.
 */
public class BusyException extends FilterException {

    private final Path lockFile;

    public BusyException(Path lockFile, Duration waited) {
        super(ErrorCategory.BUSY,
                "Lock " + lockFile + " is held by another operation (waited " + waited.toSeconds() + "s)",
                "Retry once the other operation finishes, or raise FILTER_LOCK_TIMEOUT_SECONDS",
                null);
        this.lockFile = lockFile;
    }

    public Path lockFile() {
        return lockFile;
    }
}
