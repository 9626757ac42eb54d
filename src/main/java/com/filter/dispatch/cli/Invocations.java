package com.filter.dispatch.cli;

import com.filter.core.config.FilterEnvironment;
import com.filter.core.logging.AuditSink;
import com.filter.core.logging.InvocationContext;
import com.filter.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link InvocationContext} of a CLI command and tags the MDC with it.
 */
@Component
public class Invocations {

    private static final Logger log = LoggerFactory.getLogger(Invocations.class);

    private final AuditSink sink;
    private final FilterEnvironment environment;

    public Invocations(AuditSink sink, FilterEnvironment environment) {
        this.sink = sink;
        this.environment = environment;
    }

    public InvocationContext begin(String command) {
        InvocationContext ctx = InvocationContext.create(sink, environment.nonInteractive());
        MdcContext.setInvocation(ctx.correlationId(), command);
        log.info("Running '{}' (non-interactive: {})", command, ctx.nonInteractive());
        return ctx;
    }

    public void end() {
        MdcContext.clear();
    }
}
