package com.testament.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Result of one test function, including its test-scope fixtures and, for parameterized
 * tests, one sub-result per selected parameter tuple.
 */
public class TestMethodResult extends Result {

    private Result setupResult;
    private Result teardownResult;
    private final List<TestMethodResult> parameterizedResults = new ArrayList<>();
    private Set<String> tags = Set.of();
    private String description = "";

    public TestMethodResult(String name) {
        super(name);
    }

    public TestMethodResult(String name, Status status, String record) {
        super(name, status, record);
    }

    public static TestMethodResult skipped(String name, String record, Set<String> tags) {
        var result = new TestMethodResult(name, Status.SKIPPED, record);
        result.setTags(tags);
        return result.end();
    }

    @Override
    public TestMethodResult end() {
        super.end();
        return this;
    }

    @Override
    public TestMethodResult end(Status status) {
        super.end(status);
        return this;
    }

    /**
     * Seals a parameterized result: passed only when every selected tuple passed, skipped
     * when every sub-result was skipped, failed otherwise.
     *
     * @param rangeLength number of tuples the resolved range selected
     */
    public TestMethodResult endParameterized(int rangeLength) {
        long passed = parameterizedResults.stream().filter(Result::passed).count();
        boolean allSkipped = !parameterizedResults.isEmpty()
                && parameterizedResults.stream().allMatch(Result::skipped);
        Status status;
        if (allSkipped) {
            status = Status.SKIPPED;
        } else if (rangeLength > 0 && passed == rangeLength) {
            status = Status.PASSED;
        } else {
            status = Status.FAILED;
            if (getRecord().isEmpty()) {
                setRecord(passed + " of " + rangeLength + " parameter sets passed");
            }
        }
        return end(status);
    }

    public void addParameterizedResult(TestMethodResult result) {
        parameterizedResults.add(result);
    }

    public List<TestMethodResult> getParameterizedResults() {
        return Collections.unmodifiableList(parameterizedResults);
    }

    public boolean isParameterized() {
        return !parameterizedResults.isEmpty();
    }

    public Result getSetupResult() { return setupResult; }
    public void setSetupResult(Result setupResult) { this.setupResult = setupResult; }
    public Result getTeardownResult() { return teardownResult; }
    public void setTeardownResult(Result teardownResult) { this.teardownResult = teardownResult; }
    public Set<String> getTags() { return tags; }
    public void setTags(Set<String> tags) { this.tags = tags != null ? Set.copyOf(tags) : Set.of(); }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description != null ? description : ""; }

    /** Copies the tags and description of the test this result belongs to. */
    public TestMethodResult describe(TestCase test) {
        setTags(test.tags());
        setDescription(test.description());
        return this;
    }
}
