package com.testament.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Testament-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String MODULE = "module";
    public static final String TEST = "test";
    public static final String FIXTURE = "fixture";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setModule(String runId, String module) {
        putIfPresent(RUN_ID, runId);
        MDC.put(MODULE, module);
    }

    public static void setTest(String runId, String module, String test) {
        setModule(runId, module);
        MDC.put(TEST, test);
    }

    public static void setFixture(String fixture) {
        MDC.put(FIXTURE, fixture);
    }

    public static void clearFixture() {
        MDC.remove(FIXTURE);
    }

    public static void clearTest() {
        MDC.remove(TEST);
        MDC.remove(FIXTURE);
    }

    public static void clearModule() {
        MDC.remove(MODULE);
        clearTest();
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(MODULE);
        MDC.remove(TEST);
        MDC.remove(FIXTURE);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
