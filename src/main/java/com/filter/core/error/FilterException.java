package com.filter.core.error;

/**
 * Base type for every failure the core reports to its callers.
 *
 * <p>Carries the {@link ErrorCategory} that decides the CLI exit code and an optional
 * repair suggestion rendered next to the message.
 */
public abstract class FilterException extends RuntimeException {

    private final ErrorCategory category;
    private final String suggestion;

    protected FilterException(ErrorCategory category, String message, String suggestion, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.suggestion = suggestion;
    }

    public ErrorCategory category() {
        return category;
    }

    /**
     * @return a human-readable hint on how to recover, or {@code null}
     */
    public String suggestion() {
        return suggestion;
    }

    public int exitCode() {
        return category.exitCode();
    }
}
