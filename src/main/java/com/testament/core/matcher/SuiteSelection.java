package com.testament.core.matcher;

import java.util.List;

/**
 * Everything discovery needs to know about what to run.
 *
 * @param importables  packages and classes to import, in selector order
 * @param ignoredPaths packages and classes excluded together with everything under them
 */
public record SuiteSelection(List<Importable> importables, List<String> ignoredPaths) {

    public SuiteSelection {
        importables = List.copyOf(importables);
        ignoredPaths = List.copyOf(ignoredPaths);
    }

    public boolean isEmpty() {
        return importables.isEmpty();
    }

    /** Whether {@code path} is an ignored path or lies underneath one. */
    public boolean isIgnored(String path) {
        for (String ignored : ignoredPaths) {
            if (path.equals(ignored) || path.startsWith(ignored + ".") || path.startsWith(ignored + "$")) {
                return true;
            }
        }
        return false;
    }
}
