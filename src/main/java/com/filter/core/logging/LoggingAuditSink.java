package com.filter.core.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events to the dedicated {@code filter.audit} logger.
 */
public class LoggingAuditSink implements AuditSink {

    private static final Logger audit = LoggerFactory.getLogger("filter.audit");

    @Override
    public void record(String correlationId, String event, String detail) {
        audit.info("[{}] {} {}", correlationId, event, detail);
    }
}
