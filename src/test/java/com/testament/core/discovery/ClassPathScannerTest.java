package com.testament.core.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClassPathScannerTest {

    private static final String SELECTION = "com.testament.samples.selection";

    private final ClassPathScanner scanner = new ClassPathScanner(getClass().getClassLoader());

    @Test
    @DisplayName("classes and packages are told apart")
    void classesAndPackages() {
        assertTrue(scanner.isClass(SELECTION + ".RunModule"));
        assertFalse(scanner.isPackage(SELECTION + ".RunModule"));
        assertTrue(scanner.isPackage(SELECTION));
        assertFalse(scanner.isClass(SELECTION));
        assertFalse(scanner.isPackage("com.testament.samples.nowhere"));
        assertFalse(scanner.isClass(""));
    }

    @Test
    @DisplayName("directory listing gives sub-packages and top-level classes")
    void listsDirectory() throws Exception {
        var listing = scanner.list(SELECTION);
        assertEquals(List.of(SELECTION + ".nested"), listing.packages());
        assertEquals(List.of(SELECTION + ".Helpers", SELECTION + ".RunModule", SELECTION + ".SkipModule",
                SELECTION + ".TaggedModule"), listing.classNames());
    }

    @Test
    @DisplayName("nested classes are never listed")
    void skipsNestedClasses() throws Exception {
        var listing = scanner.list("com.testament.samples.fixtures");
        assertTrue(listing.classNames().contains("com.testament.samples.fixtures.GroupedChecks"));
        assertTrue(listing.classNames().stream().noneMatch(name -> name.contains("$")));
    }

    @Test
    @DisplayName("jar listing works like a directory")
    void listsJar() throws Exception {
        var listing = scanner.list("org.junit.jupiter.api");
        assertTrue(listing.classNames().contains("org.junit.jupiter.api.Test"));
        assertTrue(listing.packages().contains("org.junit.jupiter.api.extension"));
    }

    @Test
    @DisplayName("sweep applies the filter to every class directory")
    void sweeps() {
        Set<String> names = scanner.findClassNames(name -> name.startsWith(SELECTION + ".nested."));
        assertEquals(Set.of(SELECTION + ".nested.NestedModule"), names);
    }
}
