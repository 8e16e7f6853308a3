package com.testament.core.matcher;

import java.util.Set;

/**
 * Inclusion predicate over a set of items.
 */
public interface PatternMatcher {

    boolean included(String item);

    default boolean excluded(String item) {
        return !included(item);
    }

    /** Items explicitly included; empty in exclusion mode. */
    Set<String> includedItems();

    /** Items explicitly excluded; empty in inclusion mode. */
    Set<String> excludedItems();
}
