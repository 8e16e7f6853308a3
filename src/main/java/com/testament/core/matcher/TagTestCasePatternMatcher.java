package com.testament.core.matcher;

import java.util.Set;

/**
 * Per-test side of a tag selection. A test's tags are its own tags together with its
 * module's; the test runs when they intersect the listed tags (inclusion mode) or when
 * they don't (exclusion mode).
 */
public class TagTestCasePatternMatcher extends TagModulePatternMatcher implements TestMatcher {

    private TagTestCasePatternMatcher(TagModulePatternMatcher source) {
        super(source.path(), source.tags(), source.pattern(), source.isInclude());
    }

    public static TagTestCasePatternMatcher parse(String pattern) {
        return new TagTestCasePatternMatcher(TagModulePatternMatcher.parse(pattern));
    }

    @Override
    public boolean includesTest(String testName, Set<String> tags) {
        if (tags().isEmpty()) {
            return true;
        }
        return intersects(tags) == isInclude();
    }
}
