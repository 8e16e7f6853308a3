package com.testament.core.matcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultPatternMatcherTest {

    // ── module lists ─────────────────────────────────────────────────────

    @Test
    @DisplayName("empty module list includes every module")
    void emptyModuleList() {
        var matcher = DefaultModulePatternMatcher.parse("");
        assertTrue(matcher.includesModule("com.acme.Anything", Set.of()));
        assertTrue(matcher.includedItems().isEmpty());
        assertTrue(matcher.excludedItems().isEmpty());
    }

    @Test
    @DisplayName("module list matches simple and qualified names")
    void moduleList() {
        var matcher = DefaultModulePatternMatcher.parse("LoginModule;com.acme.CartModule");
        assertTrue(matcher.includesModule("com.acme.LoginModule", Set.of()));
        assertTrue(matcher.includesModule("com.acme.CartModule", Set.of()));
        assertFalse(matcher.includesModule("com.acme.SearchModule", Set.of()));
    }

    @Test
    @DisplayName("negated module list excludes the listed modules")
    void negatedModuleList() {
        var matcher = DefaultModulePatternMatcher.parse("!LoginModule;CartModule");
        assertFalse(matcher.includesModule("com.acme.LoginModule", Set.of()));
        assertFalse(matcher.includesModule("com.acme.CartModule", Set.of()));
        assertTrue(matcher.includesModule("com.acme.SearchModule", Set.of()));
        assertEquals(Set.of("LoginModule", "CartModule"), matcher.excludedItems());
    }

    // ── test lists ───────────────────────────────────────────────────────

    @Test
    @DisplayName("included and excluded are complements for listed items")
    void complement() {
        var include = DefaultTestCasePatternMatcher.parse("testA,testB");
        var exclude = DefaultTestCasePatternMatcher.parse("!testA,testB");
        for (String name : List.of("testA", "testB", "testC")) {
            assertEquals(!include.included(name), include.excluded(name));
            assertEquals(include.included(name) && !name.equals("testC"), !exclude.included(name));
        }
    }

    @Test
    @DisplayName("bracket slices are matched by bare name")
    void bareNames() {
        var matcher = DefaultTestCasePatternMatcher.parse("testAdd[1:3],testSub");
        assertTrue(matcher.includesTest("testAdd", Set.of()));
        assertTrue(matcher.includesTest("testSub", Set.of()));
        assertFalse(matcher.includesTest("testMul", Set.of()));
        assertEquals(Optional.of("testAdd[1:3]"), matcher.selectorFor("testAdd"));
    }

    @Test
    @DisplayName("exclusion mode reports ignored tests and no slices")
    void exclusionMode() {
        var matcher = DefaultTestCasePatternMatcher.parse("!testA[0]");
        assertFalse(matcher.includesTest("testA", Set.of()));
        assertTrue(matcher.includesTest("testB", Set.of()));
        assertEquals(Set.of("testA"), matcher.ignoredTests());
        assertTrue(matcher.selectorFor("testA").isEmpty());
    }

    @Test
    @DisplayName("and() keeps only tests both matchers include")
    void conjunction() {
        TestMatcher both = DefaultTestCasePatternMatcher.parse("testA,testB")
                .and(DefaultTestCasePatternMatcher.parse("!testB"));
        assertTrue(both.includesTest("testA", Set.of()));
        assertFalse(both.includesTest("testB", Set.of()));
        assertFalse(both.includesTest("testC", Set.of()));
        assertEquals(Set.of("testB"), both.ignoredTests());
    }
}
