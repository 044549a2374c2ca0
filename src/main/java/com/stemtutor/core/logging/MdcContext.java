package com.stemtutor.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing tutoring-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setStep(String sessionId, String step) {
        MDC.put("sessionId", sessionId);
        MDC.put("step", step);
    }

    public static void clearStep() {
        MDC.remove("step");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("step");
    }
}
