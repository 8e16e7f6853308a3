package com.testament.core.matcher;

import com.testament.core.discovery.ClassPathScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Set;

/**
 * Selects module classes whose class-path resource name matches a glob, e.g.
 * {@code com/acme/smoke/*Checks}. The candidate set is resolved once, eagerly, and each
 * matching class becomes its own importable.
 */
public class GlobModulePatternMatcher extends PatternMatcherBase implements ModuleMatcher {

    private static final Logger log = LoggerFactory.getLogger(GlobModulePatternMatcher.class);

    private final boolean valid;

    private GlobModulePatternMatcher(Set<String> items, String pattern, boolean valid) {
        super(items, pattern, true);
        this.valid = valid;
    }

    public static GlobModulePatternMatcher parse(String pattern, ClassPathScanner scanner) {
        PathMatcher matcher;
        try {
            matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid module glob '{}': {}", pattern, e.getMessage());
            return new GlobModulePatternMatcher(Set.of(), pattern, false);
        }
        Set<String> items = scanner.findClassNames(className ->
                matcher.matches(Path.of(className.replace('.', '/'))));
        log.debug("Module glob '{}' matched {} classes", pattern, items.size());
        return new GlobModulePatternMatcher(items, pattern, true);
    }

    @Override
    public boolean included(String item) {
        return valid && super.included(item);
    }

    @Override
    public boolean includesModule(String moduleName, Set<String> tags) {
        return included(moduleName);
    }

    public boolean isValid() {
        return valid;
    }
}
