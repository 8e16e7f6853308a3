package com.testament.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a whole suite run. Counts are the sums of the module counts.
 */
public class TestSuiteResult extends Result {

    private final List<TestModuleResult> moduleResults = new ArrayList<>();
    private final List<String> failedImports = new ArrayList<>();
    private int passedCount;
    private int failedCount;
    private int skippedCount;

    public TestSuiteResult(String name) {
        super(name);
    }

    @Override
    public TestSuiteResult end() {
        return end(null);
    }

    @Override
    public TestSuiteResult end(Status status) {
        super.end(status);
        passedCount = 0;
        failedCount = 0;
        skippedCount = 0;
        for (var module : moduleResults) {
            passedCount += module.getPassedCount();
            failedCount += module.getFailedCount();
            skippedCount += module.getSkippedCount();
        }
        if (status == null) {
            boolean allSkipped = moduleResults.stream().allMatch(Result::skipped);
            setStatus(Status.rollup(moduleResults.size(), allSkipped, passedCount, failedCount, skippedCount));
        }
        return this;
    }

    public synchronized void addModuleResult(TestModuleResult result) {
        if (result != null) {
            moduleResults.add(result);
        }
    }

    public void addFailedImports(List<String> imports) {
        failedImports.addAll(imports);
    }

    public int exitCode() {
        return getStatus() == Status.PASSED ? 0 : 1;
    }

    public List<TestModuleResult> getModuleResults() { return Collections.unmodifiableList(moduleResults); }
    public List<String> getFailedImports() { return Collections.unmodifiableList(failedImports); }
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
