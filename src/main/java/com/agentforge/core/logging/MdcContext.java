package com.agentforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Agentforge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String workflow, String userId) {
        MDC.put("runId", runId);
        MDC.put("workflow", workflow);
        MDC.put("userId", userId);
    }

    public static void setAgent(String runId, String agent) {
        MDC.put("runId", runId);
        MDC.put("agent", agent);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("workflow");
        MDC.remove("userId");
        MDC.remove("agent");
    }
}
