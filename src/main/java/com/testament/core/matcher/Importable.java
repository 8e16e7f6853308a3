package com.testament.core.matcher;

/**
 * Something discovery can import: a package or class name plus the matchers deciding which
 * of its modules and tests take part.
 */
public record Importable(String path, ModuleMatcher moduleMatcher, TestMatcher testMatcher) {

    public static Importable of(String path) {
        return new Importable(path, ModuleMatcher.ALL, TestMatcher.ALL);
    }
}
