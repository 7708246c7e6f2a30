package com.agentvm.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing AgentVM-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPool(String poolId) {
        MDC.put("poolId", poolId);
    }

    public static void setMachine(String poolId, String machineName) {
        MDC.put("poolId", poolId);
        MDC.put("machine", machineName);
    }

    public static void setChannel(String channelName) {
        MDC.put("channel", channelName);
    }

    public static void clear() {
        MDC.remove("poolId");
        MDC.remove("machine");
        MDC.remove("channel");
    }
}
