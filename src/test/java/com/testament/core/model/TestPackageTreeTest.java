package com.testament.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestPackageTreeTest {

    @Test
    @DisplayName("shared ancestors are created once, outermost first")
    void sharedAncestors() {
        var tree = new TestPackageTree();
        List<String> created = new ArrayList<>();

        tree.register("com.acme.smoke", node -> created.add(node.name()));
        tree.register("com.acme.regression", node -> created.add(node.name()));

        assertEquals(List.of("com", "com.acme", "com.acme.smoke", "com.acme.regression"), created);
        assertEquals(1, tree.roots().size());
    }

    @Test
    @DisplayName("registering an existing package returns the same node")
    void sameNode() {
        var tree = new TestPackageTree();
        var first = tree.register("com.acme", node -> {});
        var second = tree.register("com.acme", node -> fail("nothing new to create"));
        assertSame(first, second);
    }

    @Test
    @DisplayName("package scopes chain up to the root scope")
    void scopeChain() {
        var tree = new TestPackageTree();
        var acme = tree.register("com.acme", node -> {});
        var smoke = tree.register("com.acme.smoke", node -> {});
        acme.scope().set("token", "abc");

        assertEquals("abc", smoke.scope().<String>get("token"));
        tree.rootScope().set("global", 1);
        assertEquals(Integer.valueOf(1), smoke.scope().get("global"));
    }

    @Test
    @DisplayName("packages lists parents before children")
    void depthFirst() {
        var tree = new TestPackageTree();
        tree.register("com.acme.smoke", node -> {});
        tree.register("org.other", node -> {});
        assertEquals(List.of("com", "com.acme", "com.acme.smoke", "org", "org.other"),
                tree.packages().stream().map(TestPackage::name).toList());
        assertTrue(tree.isEmpty());
    }

    @Test
    @DisplayName("package setup and teardown are claimed once")
    void claimOnce() {
        var node = new TestPackageTree().register("com.acme", n -> {});
        assertTrue(node.claimSetup());
        assertFalse(node.claimSetup());
        assertTrue(node.claimTeardown());
        assertFalse(node.claimTeardown());
    }
}
