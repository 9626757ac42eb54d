package com.filter.core.error;

/**
 * Persisted state violates an invariant and needs manual intervention
 * (story in more than one stage, foreign directory at a workspace path, divergent branches).
 */
public class StateConflictException extends FilterException {

    public StateConflictException(String message, String suggestion) {
        super(ErrorCategory.STATE_CONFLICT, message, suggestion, null);
    }
}
