package com.testament.core.selector;

import java.util.List;

/**
 * One parsed suite selector entry.
 *
 * @param importPath  dotted package or class name
 * @param testFilters test-name filters, every element prefixed with {@code !} when negated
 * @param ignored     whether the path (and everything under it) is excluded from the run
 */
public record Selector(String importPath, List<String> testFilters, boolean ignored) {

    public Selector {
        testFilters = testFilters == null ? List.of() : List.copyOf(testFilters);
    }

    public static Selector include(String importPath, List<String> testFilters) {
        return new Selector(importPath, testFilters, false);
    }

    public static Selector ignore(String importPath) {
        return new Selector(importPath, List.of(), true);
    }
}
