package com.filter.core.logging;

import java.util.UUID;

/**
 * Per-invocation context handed to every core operation.
 *
 * <p>Created when a CLI command starts and discarded when it returns. Replaces global logging
 * state: the correlation id ties log lines and audit events of one invocation together.
 *
 * @param correlationId  identifier shared by all log lines and audit events of the invocation
 * @param sink           destination for audit events
 * @param nonInteractive true when prompts must not be shown
 */
public record InvocationContext(String correlationId, AuditSink sink, boolean nonInteractive) {

    public InvocationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
    }

    public static InvocationContext create(AuditSink sink, boolean nonInteractive) {
        return new InvocationContext(UUID.randomUUID().toString().substring(0, 8), sink, nonInteractive);
    }

    public void audit(String event, String detail) {
        sink.record(correlationId, event, detail);
    }
}
