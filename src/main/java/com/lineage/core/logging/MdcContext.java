package com.lineage.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Lineage-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void setHistory(String agentId, String historyId) {
        MDC.put("agentId", agentId);
        MDC.put("historyId", historyId);
    }

    /**
     * Sets agent and history keys for the duration of a try-with-resources block,
     * restoring the previous values on close.
     */
    public static Scope scoped(String agentId, String historyId) {
        String previousAgent = MDC.get("agentId");
        String previousHistory = MDC.get("historyId");
        setHistory(agentId, historyId);
        return () -> {
            restore("agentId", previousAgent);
            restore("historyId", previousHistory);
        };
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("historyId");
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
