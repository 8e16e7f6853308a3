package com.testament.core.matcher;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which test functions of a module run.
 */
@FunctionalInterface
public interface TestMatcher {

    TestMatcher ALL = (name, tags) -> true;

    /**
     * @param testName bare test method name
     * @param tags     the test's tags together with its module's tags
     */
    boolean includesTest(String testName, Set<String> tags);

    /** The filter text that selected {@code testName}, used to read its parameter slice. */
    default Optional<String> selectorFor(String testName) {
        return Optional.empty();
    }

    /** Tests this matcher explicitly excludes; remembered when modules are merged. */
    default Set<String> ignoredTests() {
        return Set.of();
    }

    /** A matcher that includes a test only when both matchers do. */
    default TestMatcher and(TestMatcher other) {
        TestMatcher self = this;
        return new TestMatcher() {
            @Override
            public boolean includesTest(String testName, Set<String> tags) {
                return self.includesTest(testName, tags) && other.includesTest(testName, tags);
            }

            @Override
            public Optional<String> selectorFor(String testName) {
                return self.selectorFor(testName).or(() -> other.selectorFor(testName));
            }

            @Override
            public Set<String> ignoredTests() {
                var ignored = new LinkedHashSet<>(self.ignoredTests());
                ignored.addAll(other.ignoredTests());
                return ignored;
            }
        };
    }
}
