package com.testament.core.matcher;

import com.testament.core.selector.SelectorParser;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Literal test list, {@code testA,testB[1:3]} or {@code !testA,testB}. Items are matched
 * by bare name; the full filter text is kept so the slice can be read later.
 */
public class DefaultTestCasePatternMatcher extends PatternMatcherBase implements TestMatcher {

    public static final String DELIMITER = ",";

    private final Map<String, String> filtersByName;

    protected DefaultTestCasePatternMatcher(Map<String, String> filtersByName, String pattern, boolean include) {
        super(filtersByName.keySet(), pattern, include);
        this.filtersByName = Map.copyOf(filtersByName);
    }

    public static DefaultTestCasePatternMatcher parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return of(List.of());
        }
        return of(SelectorParser.parseTestFilters(pattern));
    }

    /** Builds a matcher from already split filters, negated ones prefixed with {@code !}. */
    public static DefaultTestCasePatternMatcher of(List<String> filters) {
        boolean include = filters.stream().noneMatch(f -> f.startsWith(EXCLUDER));
        var byName = new LinkedHashMap<String, String>();
        for (String filter : filters) {
            String text = filter.startsWith(EXCLUDER) ? filter.substring(1) : filter;
            byName.putIfAbsent(bareName(text), text);
        }
        return new DefaultTestCasePatternMatcher(byName, String.join(DELIMITER, filters), include);
    }

    static String bareName(String filter) {
        int open = filter.indexOf('[');
        int close = filter.indexOf(']');
        int cut = open < 0 ? close : (close < 0 ? open : Math.min(open, close));
        return (cut < 0 ? filter : filter.substring(0, cut)).trim();
    }

    @Override
    public boolean includesTest(String testName, Set<String> tags) {
        return included(testName);
    }

    @Override
    public Optional<String> selectorFor(String testName) {
        return isInclude() ? Optional.ofNullable(filtersByName.get(testName)) : Optional.empty();
    }

    @Override
    public Set<String> ignoredTests() {
        return new LinkedHashSet<>(excludedItems());
    }
}
