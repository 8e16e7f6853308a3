package com.testament.core.model;

import java.util.List;

/**
 * Output of discovery: the package tree to run and the imports that failed along the way.
 */
public record DiscoveredSuite(TestPackageTree packageTree, List<String> failedImports) {

    public DiscoveredSuite {
        failedImports = List.copyOf(failedImports);
    }

    public List<TestModule> sequentialModules() {
        return packageTree.packages().stream().flatMap(p -> p.sequentialModules().stream()).toList();
    }

    public List<TestModule> parallelModules() {
        return packageTree.packages().stream().flatMap(p -> p.parallelModules().stream()).toList();
    }

    public List<TestModule> allModules() {
        return packageTree.allModules();
    }

    public int testCount() {
        return allModules().stream().mapToInt(TestModule::testCount).sum();
    }
}
