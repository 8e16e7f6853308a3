package com.testament.dispatch.cli;

import com.testament.core.model.Result;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestModuleResult;
import com.testament.core.model.TestSuiteResult;
import com.testament.core.report.Reporter;

/**
 * Prints run progress to the terminal. Methods are synchronized so lines from parallel
 * modules never interleave.
 */
public class ConsoleReporter implements Reporter {

    @Override
    public synchronized void onSuiteStart(String suiteName) {
        ConsoleOutput.info("Running suite " + suiteName);
    }

    @Override
    public synchronized void onModuleStart(String moduleName) {
        ConsoleOutput.moduleStart(moduleName);
    }

    @Override
    public synchronized void onSetupModuleDone(String moduleName, Result result) {
        ConsoleOutput.fixture(moduleName, "setup", result);
    }

    @Override
    public synchronized void onTestDone(String moduleName, TestMethodResult result) {
        // tuple results are named name[i]; method names never contain a bracket
        ConsoleOutput.testResult(result, result.getName().indexOf('[') >= 0);
    }

    @Override
    public synchronized void onParameterizedTestDone(String moduleName, TestMethodResult result) {
        ConsoleOutput.testResult(result, false);
    }

    @Override
    public synchronized void onTeardownModuleDone(String moduleName, Result result) {
        ConsoleOutput.fixture(moduleName, "teardown", result);
    }

    @Override
    public synchronized void onModuleDone(TestModuleResult result) {
        ConsoleOutput.moduleResult(result);
    }

    @Override
    public synchronized void onSuiteStop(TestSuiteResult result) {
        ConsoleOutput.summary(result);
    }
}
