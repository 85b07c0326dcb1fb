package com.taskweaver.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing delegation-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setDelegation(String delegationId) {
        MDC.put("delegationId", delegationId);
    }

    public static void setWorkItem(String delegationId, String workItem) {
        MDC.put("delegationId", delegationId);
        MDC.put("workItem", workItem);
    }

    public static void setChildSession(String childSessionId) {
        MDC.put("childSessionId", childSessionId);
    }

    public static void clear() {
        MDC.remove("delegationId");
        MDC.remove("workItem");
        MDC.remove("childSessionId");
    }
}
