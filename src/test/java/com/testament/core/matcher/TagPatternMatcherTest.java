package com.testament.core.matcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TagPatternMatcherTest {

    @Test
    @DisplayName("path and tags are split at the last slash")
    void parse() {
        var matcher = TagModulePatternMatcher.parse("com.acme.smoke/fast, db");
        assertEquals("com.acme.smoke", matcher.path());
        assertEquals(Set.of("fast", "db"), matcher.tags());
        assertTrue(matcher.isInclude());
    }

    @Test
    @DisplayName("selector without tags is just a path")
    void noTags() {
        var matcher = TagModulePatternMatcher.parse("com.acme.smoke");
        assertEquals("com.acme.smoke", matcher.path());
        assertTrue(matcher.tags().isEmpty());
        assertTrue(matcher.includesModule("com.acme.smoke.Login", Set.of()));
    }

    // ── inclusion ────────────────────────────────────────────────────────

    @Test
    @DisplayName("module is included when any module or test tag is listed")
    void moduleInclusion() {
        var matcher = TagModulePatternMatcher.parse("com.acme/fast");
        assertTrue(matcher.includesModule("com.acme.Login", Set.of("smoke", "fast")));
        assertFalse(matcher.includesModule("com.acme.Login", Set.of("slow")));
    }

    @Test
    @DisplayName("test is included when its tags intersect")
    void testInclusion() {
        var matcher = TagTestCasePatternMatcher.parse("com.acme/fast,db");
        assertTrue(matcher.includesTest("testA", Set.of("db")));
        assertFalse(matcher.includesTest("testB", Set.of("slow")));
        assertFalse(matcher.includesTest("testC", Set.of()));
    }

    // ── exclusion ────────────────────────────────────────────────────────

    @Test
    @DisplayName("exclusion mode loads every module and drops tagged tests")
    void exclusion() {
        var modules = TagModulePatternMatcher.parse("com.acme/!slow");
        var tests = TagTestCasePatternMatcher.parse("com.acme/!slow");
        assertFalse(modules.isInclude());
        assertTrue(modules.includesModule("com.acme.Login", Set.of("slow")));
        assertFalse(tests.includesTest("testSlow", Set.of("slow", "smoke")));
        assertTrue(tests.includesTest("testFast", Set.of("smoke")));
        assertTrue(tests.includesTest("testPlain", Set.of()));
    }
}
