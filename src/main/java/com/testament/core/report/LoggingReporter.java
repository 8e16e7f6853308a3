package com.testament.core.report;

import com.testament.core.model.Result;
import com.testament.core.model.Status;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestModuleResult;
import com.testament.core.model.TestSuiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the callback stream to SLF4J. Failures go to WARN, everything else to INFO or
 * DEBUG, so the file appender of a run folder holds the whole story.
 */
public class LoggingReporter implements Reporter {

    private static final Logger log = LoggerFactory.getLogger("testament.report");

    @Override
    public void onSuiteStart(String suiteName) {
        log.info("Suite {} started", suiteName);
    }

    @Override
    public void onModuleStart(String moduleName) {
        log.info("Module {} started", moduleName);
    }

    @Override
    public void onSetupModuleDone(String moduleName, Result result) {
        logFixture(moduleName, "setup", result);
    }

    @Override
    public void onSetupTestDone(String moduleName, String testName, Result result) {
        logFixture(moduleName + "::" + testName, "setup test", result);
    }

    @Override
    public void onTestDone(String moduleName, TestMethodResult result) {
        if (result.getStatus() == Status.FAILED) {
            log.warn("{}::{} FAILED - {}", moduleName, result.getName(), result.getRecord());
        } else if (result.getStatus() == Status.SKIPPED) {
            log.info("{}::{} SKIPPED - {}", moduleName, result.getName(), result.getRecord());
        } else {
            log.info("{}::{} PASSED ({}s)", moduleName, result.getName(), String.format("%.3f", result.getTotalSeconds()));
        }
    }

    @Override
    public void onParameterizedTestDone(String moduleName, TestMethodResult result) {
        log.info("{}::{} {} ({} parameter sets)", moduleName, result.getName(), result.getStatus(),
                result.getParameterizedResults().size());
    }

    @Override
    public void onTeardownTestDone(String moduleName, String testName, Result result) {
        logFixture(moduleName + "::" + testName, "teardown test", result);
    }

    @Override
    public void onTeardownModuleDone(String moduleName, Result result) {
        logFixture(moduleName, "teardown", result);
    }

    @Override
    public void onModuleDone(TestModuleResult result) {
        log.info("{}", result);
    }

    @Override
    public void onSuiteStop(TestSuiteResult result) {
        log.info("{} -> {}", result, result.getStatus());
        result.getFailedImports().forEach(f -> log.warn("Failed import: {}", f));
    }

    private static void logFixture(String owner, String kind, Result result) {
        if (result.getStatus() == Status.PASSED) {
            log.debug("{} {} passed", owner, kind);
        } else {
            log.warn("{} {} {} - {}", owner, kind, result.getStatus(), result.getRecord());
        }
    }
}
