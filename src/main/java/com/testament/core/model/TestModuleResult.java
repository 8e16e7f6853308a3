package com.testament.core.model;

import com.testament.api.RunMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one test module: its fixture results and the results of every test that ran.
 * Counts and status are recomputed from the test results on {@link #end()}.
 */
public class TestModuleResult extends Result {

    private final String fileName;
    private final String description;
    private RunMode runMode;
    private final List<Result> setupResults = new ArrayList<>();
    private final List<Result> teardownResults = new ArrayList<>();
    private final List<TestMethodResult> testResults = new ArrayList<>();
    private int passedCount;
    private int failedCount;
    private int skippedCount;

    public TestModuleResult(String name, String fileName, String description) {
        super(name);
        this.fileName = fileName;
        this.description = description != null ? description : "";
    }

    public TestModuleResult(TestModule module) {
        this(module.name(), module.fileName(), module.description());
        this.runMode = module.runMode();
    }

    @Override
    public TestModuleResult end() {
        return end(null);
    }

    @Override
    public TestModuleResult end(Status status) {
        super.end(status);
        passedCount = 0;
        failedCount = 0;
        skippedCount = 0;
        for (var result : testResults) {
            switch (result.getStatus()) {
                case PASSED -> passedCount++;
                case FAILED -> failedCount++;
                case SKIPPED -> skippedCount++;
            }
        }
        if (status == null) {
            boolean allSkipped = testResults.stream().allMatch(Result::skipped);
            setStatus(Status.rollup(testResults.size(), allSkipped, passedCount, failedCount, skippedCount));
            if (testResults.isEmpty() && getRecord().isEmpty()) {
                setRecord("No tests were run");
            }
        }
        return this;
    }

    public void addTestResult(TestMethodResult result) {
        if (result != null) {
            testResults.add(result);
        }
    }

    public void addSetupResult(Result result) { setupResults.add(result); }
    public void addTeardownResult(Result result) { teardownResults.add(result); }

    /** The module-level setup result, or {@code null} before setup ran. */
    public Result getSetupResult() {
        return setupResults.isEmpty() ? null : setupResults.get(0);
    }

    /** The module-level teardown result, which is always recorded last. */
    public Result getTeardownResult() {
        return teardownResults.isEmpty() ? null : teardownResults.get(teardownResults.size() - 1);
    }

    public List<Result> getSetupResults() { return Collections.unmodifiableList(setupResults); }
    public List<Result> getTeardownResults() { return Collections.unmodifiableList(teardownResults); }
    public List<TestMethodResult> getTestResults() { return Collections.unmodifiableList(testResults); }
    public String getFileName() { return fileName; }
    public String getDescription() { return description; }
    public RunMode getRunMode() { return runMode; }
    public int getPassedCount() { return passedCount; }
    public int getFailedCount() { return failedCount; }
    public int getSkippedCount() { return skippedCount; }

    public int getTotalCount() {
        return passedCount + failedCount + skippedCount;
    }

    @Override
    public String toString() {
        return getName() + " Results: {Total: " + getTotalCount() + " | Passed: " + passedCount
                + " | Failed: " + failedCount + " | Skipped: " + skippedCount
                + " | Duration: " + getDuration() + "}";
    }
}
