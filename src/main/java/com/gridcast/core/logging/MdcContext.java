package com.gridcast.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Gridcast-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setPhase(String sessionId, String phase, int iteration) {
        MDC.put("sessionId", sessionId);
        MDC.put("phase", phase);
        MDC.put("iteration", String.valueOf(iteration));
    }

    public static void setCapability(String capability) {
        MDC.put("capability", capability);
    }

    public static void clearCapability() {
        MDC.remove("capability");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("phase");
        MDC.remove("iteration");
        MDC.remove("capability");
    }
}
