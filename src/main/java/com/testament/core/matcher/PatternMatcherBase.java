package com.testament.core.matcher;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Item-list matcher: in inclusion mode only the listed items pass, in exclusion mode
 * everything but the listed items passes. An empty item list lets everything through.
 */
public abstract class PatternMatcherBase implements PatternMatcher {

    public static final String EXCLUDER = "!";

    private final Set<String> items;
    private final boolean include;
    private final String pattern;

    protected PatternMatcherBase(Set<String> items, String pattern, boolean include) {
        this.items = new LinkedHashSet<>(items);
        this.pattern = pattern != null ? pattern : "";
        this.include = include;
    }

    @Override
    public boolean included(String item) {
        if (items.isEmpty()) {
            return true;
        }
        return items.contains(item) == include;
    }

    @Override
    public Set<String> includedItems() {
        return include ? Set.copyOf(items) : Set.of();
    }

    @Override
    public Set<String> excludedItems() {
        return include ? Set.of() : Set.copyOf(items);
    }

    public boolean isInclude() {
        return include;
    }

    public String pattern() {
        return pattern;
    }

    protected Set<String> items() {
        return items;
    }

    @Override
    public String toString() {
        return (include ? "include: " : "exclude: ") + items;
    }
}
