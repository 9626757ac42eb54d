package com.filter.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Filter-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setInvocation(String correlationId, String command) {
        MDC.put("correlationId", correlationId);
        MDC.put("command", command);
    }

    public static void setStory(String storyId) {
        MDC.put("storyId", storyId);
    }

    public static void setStep(String step) {
        MDC.put("step", step);
    }

    public static void clearStep() {
        MDC.remove("step");
    }

    public static void clear() {
        MDC.remove("correlationId");
        MDC.remove("command");
        MDC.remove("storyId");
        MDC.remove("step");
    }
}
