package com.testament.core.model;

import com.testament.core.scope.Scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A package node of the discovered tree. Holds the package fixtures, the scope frame they
 * write to, the modules found directly in the package and the sub-packages.
 * <p>
 * Setup and teardown are claimed through {@link #claimSetup()} / {@link #claimTeardown()}
 * so each runs at most once per node.
 */
public final class TestPackage {

    private final String name;
    private final Scope scope;
    private Fixture setupFixture;
    private Fixture teardownFixture;
    private final AtomicBoolean setupDone = new AtomicBoolean();
    private final AtomicBoolean teardownDone = new AtomicBoolean();
    private final List<TestModule> sequentialModules = new ArrayList<>();
    private final List<TestModule> parallelModules = new ArrayList<>();
    private final Map<String, TestPackage> subPackages = new LinkedHashMap<>();

    public TestPackage(String name, Scope scope) {
        this.name = name;
        this.scope = scope;
    }

    /** Fully qualified package name. */
    public String name() { return name; }
    public Scope scope() { return scope; }
    public Fixture setupFixture() { return setupFixture; }
    public Fixture teardownFixture() { return teardownFixture; }

    public void setFixtures(Fixture setup, Fixture teardown) {
        this.setupFixture = setup;
        this.teardownFixture = teardown;
    }

    public boolean claimSetup() {
        return setupDone.compareAndSet(false, true);
    }

    public boolean claimTeardown() {
        return teardownDone.compareAndSet(false, true);
    }

    public List<TestModule> sequentialModules() { return sequentialModules; }
    public List<TestModule> parallelModules() { return parallelModules; }

    public Collection<TestPackage> subPackages() {
        return Collections.unmodifiableCollection(subPackages.values());
    }

    TestPackage subPackage(String segment) {
        return subPackages.get(segment);
    }

    void putSubPackage(String segment, TestPackage child) {
        subPackages.put(segment, child);
    }

    /** Every module in this package and all sub-packages. */
    public List<TestModule> allModules() {
        var all = new ArrayList<TestModule>(sequentialModules);
        all.addAll(parallelModules);
        subPackages.values().forEach(p -> all.addAll(p.allModules()));
        return all;
    }

    @Override
    public String toString() {
        return "TestPackage[" + name + ", sequential=" + sequentialModules.size()
                + ", parallel=" + parallelModules.size() + ", sub=" + subPackages.keySet() + "]";
    }
}
