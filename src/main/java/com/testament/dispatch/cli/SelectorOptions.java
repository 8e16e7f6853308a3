package com.testament.dispatch.cli;

import com.testament.core.discovery.SuiteRequest;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;

/**
 * Suite selector options shared by {@code run} and {@code discover}.
 */
public class SelectorOptions {

    @Option(names = {"-s", "--suite"}, paramLabel = "SELECTOR", arity = "1..*",
            description = "Packages, modules or tests to run, e.g. com.acme.smoke.!Slow;Fast::testA,testB")
    List<String> suites = new ArrayList<>();

    @Option(names = "--suite-glob", paramLabel = "PATTERN", arity = "1..*",
            description = "Glob over module paths, optionally followed by ::testGlob")
    List<String> globs = new ArrayList<>();

    @Option(names = "--suite-regex", paramLabel = "PATTERN", arity = "1..*",
            description = "Regex over module names, optionally followed by ::testRegex")
    List<String> regexes = new ArrayList<>();

    @Option(names = "--suite-tag", paramLabel = "PATH/TAGS", arity = "1..*",
            description = "Tag filter, path/tag1,tag2 or path/!tag1,tag2")
    List<String> tags = new ArrayList<>();

    @Option(names = "--suite-last-failed",
            description = "Rerun the tests that did not pass in the previous run")
    boolean lastFailed;

    public SuiteRequest toRequest() {
        return new SuiteRequest(suites, globs, regexes, tags, lastFailed);
    }
}
