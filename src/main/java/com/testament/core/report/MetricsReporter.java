package com.testament.core.report;

import com.testament.core.metrics.TestamentMetrics;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestModuleResult;
import com.testament.core.model.TestSuiteResult;

/**
 * Feeds test, module and suite outcomes into {@link TestamentMetrics}.
 */
public class MetricsReporter implements Reporter {

    private final TestamentMetrics metrics;

    public MetricsReporter(TestamentMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onTestDone(String moduleName, TestMethodResult result) {
        metrics.recordTest(result.getStatus(), result.getDuration());
    }

    @Override
    public void onModuleDone(TestModuleResult result) {
        metrics.recordModule(result.getRunMode(), result.getStatus(), result.getDuration());
    }

    @Override
    public void onSuiteStop(TestSuiteResult result) {
        metrics.recordSuiteResult(result.getStatus());
        metrics.recordFailedImports(result.getFailedImports().size());
    }
}
