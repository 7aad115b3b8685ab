package com.codeharness.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys carried on harness worker threads.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setRole(String sessionId, String role) {
        MDC.put("sessionId", sessionId);
        MDC.put("role", role);
    }

    public static void setTest(String sessionId, int testNumber, String testKind) {
        MDC.put("sessionId", sessionId);
        MDC.put("testNumber", String.valueOf(testNumber));
        MDC.put("testKind", testKind);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("role");
        MDC.remove("testNumber");
        MDC.remove("testKind");
    }
}
