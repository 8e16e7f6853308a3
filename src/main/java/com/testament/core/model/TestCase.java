package com.testament.core.model;

import com.testament.core.selector.ParameterRange;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * A single test function as discovered: where it lives, which test-scope fixtures wrap it,
 * and, for parameterized tests, the tuples and the range a selector picked.
 */
public final class TestCase {

    private final String name;
    private final String moduleName;
    private final Method method;
    private final TestGroup group;
    private final Set<String> tags;
    private final List<Object[]> parameters;
    private final boolean firstArgIsName;
    private final String description;
    private ParameterRange parameterRange;

    public TestCase(String name, String moduleName, Method method, TestGroup group, Set<String> tags,
                    List<Object[]> parameters, boolean firstArgIsName, String description) {
        this.name = name;
        this.moduleName = moduleName;
        this.method = method;
        this.group = group;
        this.tags = tags != null ? Collections.unmodifiableSet(new LinkedHashSet<>(tags)) : Set.of();
        this.parameters = parameters != null ? List.copyOf(parameters) : null;
        this.firstArgIsName = firstArgIsName;
        this.description = description != null ? description : "";
        this.parameterRange = parameters != null ? ParameterRange.full(parameters.size()) : null;
    }

    /** The same test re-homed into another group instance, used when merging modules. */
    TestCase rebind(TestGroup newGroup) {
        var copy = new TestCase(name, moduleName, method, newGroup, tags, parameters, firstArgIsName, description);
        copy.parameterRange = parameterRange;
        return copy;
    }

    public String name() { return name; }
    public String moduleName() { return moduleName; }
    public Method method() { return method; }
    public TestGroup group() { return group; }
    public Set<String> tags() { return tags; }
    public String description() { return description; }

    public String fullName() {
        return moduleName + "::" + name;
    }

    /** Receiver of the test method. */
    public Object target() {
        return group.instance();
    }

    /** Nearest {@code @SetupTest} declared on this test's group or an enclosing one. */
    public Fixture setupFixture() {
        return group.nearestSetupTest();
    }

    public Fixture teardownFixture() {
        return group.nearestTeardownTest();
    }

    public boolean isAsync() {
        return CompletionStage.class.isAssignableFrom(method.getReturnType());
    }

    public boolean isParameterized() {
        return parameters != null;
    }

    /** Parameter tuples, or {@code null} for a plain test. */
    public List<Object[]> parameters() { return parameters; }
    public boolean firstArgIsName() { return firstArgIsName; }
    public ParameterRange parameterRange() { return parameterRange; }

    public void setParameterRange(ParameterRange parameterRange) {
        this.parameterRange = parameterRange;
    }

    /** Indices of the selected tuples; empty for a plain test. */
    public int[] selectedIndices() {
        return isParameterized() ? parameterRange.indices(parameters.size()) : new int[0];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestCase other)) return false;
        return fullName().equals(other.fullName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleName, name);
    }

    @Override
    public String toString() {
        return fullName();
    }
}
