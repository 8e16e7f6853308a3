package com.testament.core.matcher;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Literal module list, {@code ModA;ModB} or {@code !ModA;ModB}. Items are matched against
 * both the fully qualified and the simple module name.
 */
public class DefaultModulePatternMatcher extends PatternMatcherBase implements ModuleMatcher {

    public static final String DELIMITER = ";";

    protected DefaultModulePatternMatcher(Set<String> items, String pattern, boolean include) {
        super(items, pattern, include);
    }

    public static DefaultModulePatternMatcher parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return new DefaultModulePatternMatcher(Set.of(), pattern, true);
        }
        boolean include = !pattern.startsWith(EXCLUDER);
        Set<String> items = Arrays.stream((include ? pattern : pattern.substring(1)).split(DELIMITER))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new DefaultModulePatternMatcher(items, pattern, include);
    }

    @Override
    public boolean includesModule(String moduleName, Set<String> tags) {
        if (items().isEmpty()) {
            return true;
        }
        String simpleName = moduleName.substring(moduleName.lastIndexOf('.') + 1);
        boolean listed = items().contains(moduleName) || items().contains(simpleName);
        return listed == isInclude();
    }
}
