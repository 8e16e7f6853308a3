package com.testament.core.matcher;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tag selection, {@code path/tag1,tag2} or {@code path/!tag1,tag2}.
 * <p>
 * In inclusion mode a module takes part when any of its tags (its own or its tests')
 * is listed. In exclusion mode every module is loaded and the exclusion is decided per
 * test by {@link TagTestCasePatternMatcher}.
 */
public class TagModulePatternMatcher extends PatternMatcherBase implements ModuleMatcher {

    public static final String PATH_SEPARATOR = "/";
    public static final String DELIMITER = ",";

    private final String path;

    protected TagModulePatternMatcher(String path, Set<String> tags, String pattern, boolean include) {
        super(tags, pattern, include);
        this.path = path;
    }

    public static TagModulePatternMatcher parse(String pattern) {
        int separator = pattern.lastIndexOf(PATH_SEPARATOR);
        if (separator < 0) {
            return new TagModulePatternMatcher(pattern.trim(), Set.of(), pattern, true);
        }
        String path = pattern.substring(0, separator).trim();
        String tagList = pattern.substring(separator + 1).trim();
        boolean include = !tagList.startsWith(EXCLUDER);
        return new TagModulePatternMatcher(path, splitTags(include ? tagList : tagList.substring(1)), pattern, include);
    }

    static Set<String> splitTags(String tagList) {
        return Arrays.stream(tagList.split(DELIMITER))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** The import path in front of the tag list. */
    public String path() {
        return path;
    }

    public Set<String> tags() {
        return items();
    }

    protected boolean intersects(Set<String> candidateTags) {
        return !Collections.disjoint(items(), candidateTags);
    }

    @Override
    public boolean includesModule(String moduleName, Set<String> tags) {
        if (items().isEmpty() || !isInclude()) {
            return true;
        }
        return intersects(tags);
    }
}
