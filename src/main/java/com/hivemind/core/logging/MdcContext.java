package com.hivemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Hivemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId, String agentLevel) {
        put("agentId", agentId);
        put("agentLevel", agentLevel);
    }

    public static void setTask(String agentId, String taskId) {
        put("agentId", agentId);
        put("taskId", taskId);
    }

    public static void setVision(String visionId) {
        put("visionId", visionId);
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("agentLevel");
        MDC.remove("taskId");
        MDC.remove("visionId");
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
