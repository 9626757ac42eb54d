package com.filter.core.logging;

/**
 * Receives audit events emitted by core operations.
 */
@FunctionalInterface
public interface AuditSink {

    void record(String correlationId, String event, String detail);
}
