package com.planwright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Planwright-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId) {
        MDC.put("planId", planId);
    }

    public static void setRun(String planId, String runId) {
        MDC.put("planId", planId);
        MDC.put("runId", runId);
    }

    public static void setTask(String planId, String runId, String taskId) {
        MDC.put("planId", planId);
        if (runId != null) {
            MDC.put("runId", runId);
        }
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("runId");
        MDC.remove("taskId");
    }
}
