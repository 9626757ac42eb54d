package com.filter.core.error;

/**
 * Bad user input or a violated precondition (unknown stage, duplicate prefix). Never retried.
 */
public class ValidationException extends FilterException {

    public ValidationException(String message) {
        super(ErrorCategory.VALIDATION, message, null, null);
    }

    public ValidationException(String message, String suggestion) {
        super(ErrorCategory.VALIDATION, message, suggestion, null);
    }
}
