package com.testament.core.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Test-name regular expression, anchored at the start of the name. An expression that
 * does not compile matches nothing.
 */
public class RegexTestCasePatternMatcher extends PatternMatcherBase implements TestMatcher {

    private static final Logger log = LoggerFactory.getLogger(RegexTestCasePatternMatcher.class);

    private final Pattern compiled;

    private RegexTestCasePatternMatcher(String pattern, Pattern compiled) {
        super(Set.of(), pattern, true);
        this.compiled = compiled;
    }

    public static RegexTestCasePatternMatcher parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return new RegexTestCasePatternMatcher("", Pattern.compile(""));
        }
        try {
            return new RegexTestCasePatternMatcher(pattern, Pattern.compile(pattern.trim()));
        } catch (PatternSyntaxException e) {
            log.warn("Invalid test regex '{}': {}", pattern, e.getDescription());
            return new RegexTestCasePatternMatcher(pattern, null);
        }
    }

    @Override
    public boolean included(String item) {
        return compiled != null && compiled.matcher(item).lookingAt();
    }

    @Override
    public boolean includesTest(String testName, Set<String> tags) {
        return included(testName);
    }
}
