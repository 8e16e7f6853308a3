package com.testament.core.report;

import com.testament.core.model.Result;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestModuleResult;
import com.testament.core.model.TestSuiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans callbacks out to several reporters. A reporter that throws is logged and skipped;
 * it never affects the run or the other reporters.
 */
public class CompositeReporter implements Reporter {

    private static final Logger log = LoggerFactory.getLogger(CompositeReporter.class);

    private final List<Reporter> reporters;

    public CompositeReporter(List<Reporter> reporters) {
        this.reporters = List.copyOf(reporters);
    }

    public static Reporter of(Reporter... reporters) {
        return new CompositeReporter(List.of(reporters));
    }

    @Override
    public void onSuiteStart(String suiteName) {
        publish("onSuiteStart", r -> r.onSuiteStart(suiteName));
    }

    @Override
    public void onModuleStart(String moduleName) {
        publish("onModuleStart", r -> r.onModuleStart(moduleName));
    }

    @Override
    public void onSetupModuleDone(String moduleName, Result result) {
        publish("onSetupModuleDone", r -> r.onSetupModuleDone(moduleName, result));
    }

    @Override
    public void onSetupTestDone(String moduleName, String testName, Result result) {
        publish("onSetupTestDone", r -> r.onSetupTestDone(moduleName, testName, result));
    }

    @Override
    public void onTestDone(String moduleName, TestMethodResult result) {
        publish("onTestDone", r -> r.onTestDone(moduleName, result));
    }

    @Override
    public void onParameterizedTestDone(String moduleName, TestMethodResult result) {
        publish("onParameterizedTestDone", r -> r.onParameterizedTestDone(moduleName, result));
    }

    @Override
    public void onTeardownTestDone(String moduleName, String testName, Result result) {
        publish("onTeardownTestDone", r -> r.onTeardownTestDone(moduleName, testName, result));
    }

    @Override
    public void onTeardownModuleDone(String moduleName, Result result) {
        publish("onTeardownModuleDone", r -> r.onTeardownModuleDone(moduleName, result));
    }

    @Override
    public void onModuleDone(TestModuleResult result) {
        publish("onModuleDone", r -> r.onModuleDone(result));
    }

    @Override
    public void onSuiteStop(TestSuiteResult result) {
        publish("onSuiteStop", r -> r.onSuiteStop(result));
    }

    private void publish(String callback, Consumer<Reporter> call) {
        for (Reporter reporter : reporters) {
            deliverSafely(reporter, callback, call);
        }
    }

    private void deliverSafely(Reporter reporter, String callback, Consumer<Reporter> call) {
        try {
            call.accept(reporter);
        } catch (Exception e) {
            log.warn("Reporter {} threw in {}: {}", reporter.getClass().getSimpleName(), callback, e.getMessage(), e);
        }
    }
}
