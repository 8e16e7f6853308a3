package com.testament.core.model;

import com.testament.core.scope.Scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Trie of packages keyed by dotted name segments. Registering {@code a.b.c} after
 * {@code a.b.d} reuses the {@code a} and {@code a.b} nodes, so every package exists once
 * and its scope frame is shared by everything beneath it.
 */
public final class TestPackageTree {

    private final Scope rootScope = Scope.root();
    private final Map<String, TestPackage> roots = new LinkedHashMap<>();

    /**
     * Returns the node for {@code packageName}, creating it and any missing ancestors.
     *
     * @param onCreate called once for every node created by this call, outermost first
     */
    public TestPackage register(String packageName, Consumer<TestPackage> onCreate) {
        String[] segments = packageName.split("\\.");
        TestPackage node = roots.get(segments[0]);
        if (node == null) {
            node = new TestPackage(segments[0], rootScope.child(segments[0]));
            roots.put(segments[0], node);
            onCreate.accept(node);
        }
        for (int i = 1; i < segments.length; i++) {
            TestPackage child = node.subPackage(segments[i]);
            if (child == null) {
                child = new TestPackage(node.name() + "." + segments[i], node.scope().child(segments[i]));
                node.putSubPackage(segments[i], child);
                onCreate.accept(child);
            }
            node = child;
        }
        return node;
    }

    public Collection<TestPackage> roots() {
        return Collections.unmodifiableCollection(roots.values());
    }

    public Scope rootScope() {
        return rootScope;
    }

    public boolean isEmpty() {
        return allModules().isEmpty();
    }

    public List<TestModule> allModules() {
        var all = new ArrayList<TestModule>();
        roots.values().forEach(p -> all.addAll(p.allModules()));
        return all;
    }

    /** Depth-first list of every package node, parents before children. */
    public List<TestPackage> packages() {
        var all = new ArrayList<TestPackage>();
        roots.values().forEach(p -> collect(p, all));
        return all;
    }

    private static void collect(TestPackage node, List<TestPackage> into) {
        into.add(node);
        node.subPackages().forEach(p -> collect(p, into));
    }
}
