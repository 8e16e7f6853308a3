package com.testament.core.selector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectorParserTest {

    private SelectorParser parser;

    @BeforeEach
    void setUp() {
        parser = new SelectorParser();
    }

    private ParsedSelectors parse(String... selectors) {
        return parser.parse(Arrays.asList(selectors));
    }

    // ── plain paths ──────────────────────────────────────────────────────

    @Test
    @DisplayName("plain module path imports the module with no filters")
    void plainPath() {
        var parsed = parse("com.acme.smoke.LoginModule");
        assertEquals(List.of(Selector.include("com.acme.smoke.LoginModule", List.of())), parsed.importables());
        assertTrue(parsed.ignoredPaths().isEmpty());
    }

    @Test
    @DisplayName("blank selectors are skipped")
    void blankSelectors() {
        assertTrue(parse("", "  ").selectors().isEmpty());
    }

    // ── sibling groups ───────────────────────────────────────────────────

    @Test
    @DisplayName("ignored sibling and filtered sibling share the prefix")
    void ignoredAndFilteredSiblings() {
        var parsed = parse("pkg.!SkipModule;RunModule::testA,testB");
        assertEquals(List.of(Selector.include("pkg.RunModule", List.of("testA", "testB"))), parsed.importables());
        assertEquals(List.of("pkg.SkipModule"), parsed.ignoredPaths());
    }

    @Test
    @DisplayName("semicolon siblings each become an importable")
    void siblings() {
        var parsed = parse("com.acme.First;Second");
        assertEquals(List.of("com.acme.First", "com.acme.Second"),
                parsed.importables().stream().map(Selector::importPath).toList());
    }

    @Test
    @DisplayName("group of only ignored siblings imports the prefix")
    void onlyIgnoredImportsPrefix() {
        var parsed = parse("com.acme.!Slow");
        assertEquals(List.of("com.acme"), parsed.importables().stream().map(Selector::importPath).toList());
        assertEquals(List.of("com.acme.Slow"), parsed.ignoredPaths());
    }

    @Test
    @DisplayName("ignored selector with no prefix imports nothing")
    void ignoredWithoutPrefix() {
        var parsed = parse("!Slow");
        assertTrue(parsed.importables().isEmpty());
        assertEquals(List.of("Slow"), parsed.ignoredPaths());
    }

    @Test
    @DisplayName("empty module part filters the prefix itself")
    void emptyModulePart() {
        var parsed = parse("com.acme.LoginModule.::testLogin");
        assertEquals(List.of(Selector.include("com.acme.LoginModule", List.of("testLogin"))), parsed.importables());
    }

    @Test
    @DisplayName("slice filters are kept verbatim")
    void sliceFilter() {
        var parsed = parse("com.acme.Math::testAdd[1:3],testSub");
        assertEquals(List.of("testAdd[1:3]", "testSub"), parsed.importables().get(0).testFilters());
    }

    // ── test filters ─────────────────────────────────────────────────────

    @Test
    @DisplayName("one negated filter negates them all")
    void negationSpreads() {
        assertEquals(List.of("!testA", "!testB"), SelectorParser.parseTestFilters("!testA,testB"));
        assertEquals(List.of("!testA", "!testB"), SelectorParser.parseTestFilters("testA, !testB"));
    }

    @Test
    @DisplayName("blank filters are dropped")
    void blankFilters() {
        assertEquals(List.of("testA"), SelectorParser.parseTestFilters("testA,,"));
        assertTrue(SelectorParser.parseTestFilters("").isEmpty());
    }
}
