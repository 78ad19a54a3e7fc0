package com.chimera.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Chimera-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String operationId) {
        MDC.put("operationId", operationId);
    }

    public static void setLink(String operationId, String linkId, String paw) {
        MDC.put("operationId", operationId);
        MDC.put("linkId", linkId);
        MDC.put("agentPaw", paw);
    }

    public static void setAgent(String paw) {
        MDC.put("agentPaw", paw);
    }

    public static void clear() {
        MDC.remove("operationId");
        MDC.remove("linkId");
        MDC.remove("agentPaw");
    }
}
