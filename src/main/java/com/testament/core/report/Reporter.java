package com.testament.core.report;

import com.testament.core.model.Result;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestModuleResult;
import com.testament.core.model.TestSuiteResult;

/**
 * Callbacks the engine invokes at each state transition of a run.
 * <p>
 * Callbacks arrive from worker threads when modules or tests run in parallel, so
 * implementations must be thread-safe. They are expected to return quickly.
 */
public interface Reporter {

    Reporter NOOP = new Reporter() {};

    default void onSuiteStart(String suiteName) {}

    default void onModuleStart(String moduleName) {}

    default void onSetupModuleDone(String moduleName, Result result) {}

    default void onSetupTestDone(String moduleName, String testName, Result result) {}

    /** A plain test, or one parameter tuple of a parameterized test, finished. */
    default void onTestDone(String moduleName, TestMethodResult result) {}

    /** Every selected tuple of a parameterized test finished; the parent is sealed. */
    default void onParameterizedTestDone(String moduleName, TestMethodResult result) {}

    default void onTeardownTestDone(String moduleName, String testName, Result result) {}

    default void onTeardownModuleDone(String moduleName, Result result) {}

    default void onModuleDone(TestModuleResult result) {}

    default void onSuiteStop(TestSuiteResult result) {}
}
