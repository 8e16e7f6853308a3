package com.testament.core.discovery;

import java.util.List;

/**
 * The suite selectors given on the command line, one list per selector flavour.
 */
public record SuiteRequest(List<String> suites, List<String> globs, List<String> regexes, List<String> tags,
                           boolean lastFailed) {

    public SuiteRequest {
        suites = suites != null ? List.copyOf(suites) : List.of();
        globs = globs != null ? List.copyOf(globs) : List.of();
        regexes = regexes != null ? List.copyOf(regexes) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static SuiteRequest ofSuites(List<String> suites) {
        return new SuiteRequest(suites, List.of(), List.of(), List.of(), false);
    }

    public boolean isEmpty() {
        return suites.isEmpty() && globs.isEmpty() && regexes.isEmpty() && tags.isEmpty() && !lastFailed;
    }
}
