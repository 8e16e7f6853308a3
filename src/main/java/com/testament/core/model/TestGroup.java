package com.testament.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * A scoping node inside a module: the module class itself or one of its nested classes.
 * Groups own their tests and fixtures and nest recursively.
 */
public final class TestGroup {

    private final String name;
    private final Object instance;
    private final TestGroup parent;
    private Fixture setupFixture;
    private Fixture teardownFixture;
    private Fixture setupTestFixture;
    private Fixture teardownTestFixture;
    private final Map<String, TestCase> tests = new LinkedHashMap<>();
    private final List<TestGroup> children = new ArrayList<>();

    public TestGroup(String name, Object instance, TestGroup parent) {
        this.name = name;
        this.instance = instance;
        this.parent = parent;
    }

    public String name() { return name; }
    public Object instance() { return instance; }
    public TestGroup parent() { return parent; }

    public Fixture setupFixture() { return setupFixture; }
    public Fixture teardownFixture() { return teardownFixture; }
    public Fixture setupTestFixture() { return setupTestFixture; }
    public Fixture teardownTestFixture() { return teardownTestFixture; }

    public void setSetupFixture(Fixture fixture) { this.setupFixture = fixture; }
    public void setTeardownFixture(Fixture fixture) { this.teardownFixture = fixture; }
    public void setSetupTestFixture(Fixture fixture) { this.setupTestFixture = fixture; }
    public void setTeardownTestFixture(Fixture fixture) { this.teardownTestFixture = fixture; }

    Fixture nearestSetupTest() {
        for (TestGroup g = this; g != null; g = g.parent) {
            if (g.setupTestFixture != null) {
                return g.setupTestFixture;
            }
        }
        return null;
    }

    Fixture nearestTeardownTest() {
        for (TestGroup g = this; g != null; g = g.parent) {
            if (g.teardownTestFixture != null) {
                return g.teardownTestFixture;
            }
        }
        return null;
    }

    public void addTest(TestCase test) {
        tests.put(test.name(), test);
    }

    public void addChild(TestGroup child) {
        children.add(child);
    }

    /** Tests declared directly on this group, in their current order. */
    public Collection<TestCase> tests() {
        return Collections.unmodifiableCollection(tests.values());
    }

    public List<TestGroup> children() {
        return Collections.unmodifiableList(children);
    }

    /** Every test in this group and its descendants. */
    public List<TestCase> allTests() {
        var all = new ArrayList<TestCase>(tests.values());
        children.forEach(c -> all.addAll(c.allTests()));
        return all;
    }

    public int testCount() {
        return allTests().size();
    }

    public boolean isEmpty() {
        return testCount() == 0;
    }

    public void removeTestsIf(Predicate<TestCase> filter) {
        tests.values().removeIf(filter);
        children.forEach(c -> c.removeTestsIf(filter));
    }

    /**
     * Adds tests present in {@code other} but missing here, matching nested groups by name.
     * A group only {@code other} has is adopted as is.
     */
    void absorb(TestGroup other) {
        for (TestCase test : other.tests.values()) {
            tests.putIfAbsent(test.name(), test.rebind(this));
        }
        for (TestGroup otherChild : other.children) {
            children.stream()
                    .filter(c -> c.name.equals(otherChild.name))
                    .findFirst()
                    .ifPresentOrElse(c -> c.absorb(otherChild), () -> children.add(otherChild));
        }
    }

    @Override
    public String toString() {
        return "TestGroup[" + name + ", tests=" + tests.keySet() + ", children=" + children.size() + "]";
    }
}
