package com.testament.core.metrics;

import com.testament.api.RunMode;
import com.testament.core.model.Status;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for suite execution.
 */
@Service
public class TestamentMetrics {

    private final MeterRegistry registry;

    public TestamentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTest(Status status, Duration duration) {
        Timer.builder("testament.test.duration")
                .tag("status", String.valueOf(status))
                .register(registry)
                .record(duration != null ? duration : Duration.ZERO);
    }

    public void recordModule(RunMode runMode, Status status, Duration duration) {
        Timer.builder("testament.module.duration")
                .tag("runMode", String.valueOf(runMode))
                .tag("status", String.valueOf(status))
                .register(registry)
                .record(duration != null ? duration : Duration.ZERO);
    }

    public void recordSuiteResult(Status status) {
        Counter.builder("testament.suite.results")
                .tag("status", String.valueOf(status))
                .register(registry)
                .increment();
    }

    /**
     * Records how many imports failed during one discovery pass.
     *
     * @param count failed-import entries
     */
    public void recordFailedImports(int count) {
        DistributionSummary.builder("testament.discovery.failed_imports")
                .description("Failed imports per discovery pass")
                .register(registry)
                .record(count);
    }

    public MeterRegistry registry() {
        return registry;
    }
}
