package com.testament.core.model;

import com.testament.api.RunMode;
import com.testament.core.scope.Scope;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A loaded test module: one {@code @Module} class, its group tree and the scope frame of
 * the package it lives in. Two modules are equal when they have the same name.
 */
public final class TestModule {

    private final String name;
    private final String fileName;
    private final String description;
    private final RunMode runMode;
    private final Set<String> tags;
    private final TestGroup rootGroup;
    private final Set<String> ignoredTests = new LinkedHashSet<>();
    private Scope scope = Scope.root();

    public TestModule(String name, String fileName, String description, RunMode runMode,
                      Set<String> tags, TestGroup rootGroup) {
        this.name = name;
        this.fileName = fileName;
        this.description = description != null ? description : "";
        this.runMode = runMode;
        this.tags = tags != null ? Set.copyOf(tags) : Set.of();
        this.rootGroup = rootGroup;
    }

    /** Fully qualified class name. */
    public String name() { return name; }
    public String fileName() { return fileName; }
    public String description() { return description; }
    public RunMode runMode() { return runMode; }
    public Set<String> tags() { return tags; }
    public TestGroup rootGroup() { return rootGroup; }
    public Scope scope() { return scope; }

    public void setScope(Scope scope) {
        this.scope = scope;
    }

    public String packageName() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }

    public String simpleName() {
        return name.substring(name.lastIndexOf('.') + 1);
    }

    public Set<String> ignoredTests() {
        return Collections.unmodifiableSet(ignoredTests);
    }

    public void ignoreTests(Set<String> names) {
        ignoredTests.addAll(names);
        rootGroup.removeTestsIf(t -> ignoredTests.contains(t.name()));
    }

    public List<TestCase> allTests() {
        return rootGroup.allTests();
    }

    public int testCount() {
        return rootGroup.testCount();
    }

    /**
     * Folds a second discovery of this module into this one: included tests are unioned,
     * then tests ignored by either discovery are removed.
     */
    public void merge(TestModule other) {
        if (!name.equals(other.name)) {
            throw new IllegalArgumentException("Cannot merge " + other.name + " into " + name);
        }
        rootGroup.absorb(other.rootGroup);
        ignoreTests(other.ignoredTests);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestModule other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "TestModule[" + name + ", " + runMode + ", tests=" + testCount() + "]";
    }
}
