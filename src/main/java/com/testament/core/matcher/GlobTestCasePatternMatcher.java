package com.testament.core.matcher;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Test-name glob: {@code *} matches any run of characters, {@code ?} a single one.
 * Names are matched from the start, a trailing remainder is allowed.
 */
public class GlobTestCasePatternMatcher extends PatternMatcherBase implements TestMatcher {

    private final Pattern compiled;

    private GlobTestCasePatternMatcher(String pattern, Pattern compiled) {
        super(Set.of(), pattern, true);
        this.compiled = compiled;
    }

    public static GlobTestCasePatternMatcher parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return new GlobTestCasePatternMatcher("", Pattern.compile(""));
        }
        return new GlobTestCasePatternMatcher(pattern, Pattern.compile(toRegex(pattern.trim())));
    }

    static String toRegex(String glob) {
        var regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    @Override
    public boolean included(String item) {
        return compiled.matcher(item).lookingAt();
    }

    @Override
    public boolean includesTest(String testName, Set<String> tags) {
        return included(testName);
    }
}
