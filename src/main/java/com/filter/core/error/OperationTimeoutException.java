package com.filter.core.error;

import java.time.Duration;

/**
 * An external call exceeded its configured timeout. Terminal for the current invocation;
 * persisted state stays in its last intermediate status.
 */
public class OperationTimeoutException extends FilterException {

    public OperationTimeoutException(String operation, Duration timeout) {
        super(ErrorCategory.TIMEOUT,
                operation + " timed out after " + timeout.toSeconds() + "s",
                "Check network connectivity or raise filter.git.timeout-seconds, then re-run the command",
                null);
    }
}
