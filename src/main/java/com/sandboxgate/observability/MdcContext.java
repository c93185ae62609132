package com.sandboxgate.observability;

import org.slf4j.MDC;

/**
 * MDC keys identifying the tool call being processed on the current thread.
 */
public final class MdcContext {

    public static final String CALL_ID = "callId";
    public static final String TOOL_NAME = "toolName";
    public static final String USER_ID = "userId";
    public static final String SESSION_ID = "sessionId";

    private MdcContext() {}

    public static void setCall(String callId, String toolName, String userId, String sessionId) {
        put(CALL_ID, callId);
        put(TOOL_NAME, toolName);
        put(USER_ID, userId);
        put(SESSION_ID, sessionId);
    }

    public static void clear() {
        MDC.remove(CALL_ID);
        MDC.remove(TOOL_NAME);
        MDC.remove(USER_ID);
        MDC.remove(SESSION_ID);
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
