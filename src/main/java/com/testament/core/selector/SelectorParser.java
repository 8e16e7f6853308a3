package com.testament.core.selector;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Parses suite selectors of the form {@code path.to.module[;sibling]*[::test1[,test2]]}.
 * <p>
 * The first dotted segment carrying {@code !}, {@code ;} or {@code ::} opens a sibling
 * group; everything before it is a shared prefix. Each sibling is resolved against the
 * prefix: {@code !Sibling} is ignored together with everything under it, any other sibling
 * becomes an importable with its own {@code ::} test filters. A group made only of ignored
 * siblings imports the prefix itself, unless the prefix is empty.
 * <p>
 * Test filters are comma-separated. Once one of them is negated, all of them are.
 */
@Component
public class SelectorParser {

    static final String EXCLUDER = "!";
    static final String MODULE_DELIMITER = ";";
    static final String TEST_DELIMITER = ",";
    static final String TEST_SEPARATOR = "::";

    public ParsedSelectors parse(Collection<String> rawSelectors) {
        var selectors = new ArrayList<Selector>();
        for (String raw : rawSelectors) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            selectors.addAll(parseOne(raw.trim()));
        }
        return new ParsedSelectors(selectors);
    }

    List<Selector> parseOne(String selector) {
        String[] segments = selector.split("\\.");
        int groupIndex = -1;
        for (int i = 0; i < segments.length; i++) {
            if (isSpecial(segments[i])) {
                groupIndex = i;
                break;
            }
        }
        if (groupIndex < 0) {
            return List.of(Selector.include(selector, List.of()));
        }

        String prefix = String.join(".", Arrays.copyOfRange(segments, 0, groupIndex));
        String group = String.join(".", Arrays.copyOfRange(segments, groupIndex, segments.length));

        var result = new ArrayList<Selector>();
        boolean anyIncluded = false;
        for (String sibling : group.split(MODULE_DELIMITER)) {
            sibling = sibling.trim();
            if (sibling.isEmpty()) {
                continue;
            }
            String modulePart = sibling;
            List<String> filters = List.of();
            int separator = sibling.indexOf(TEST_SEPARATOR);
            if (separator >= 0) {
                modulePart = sibling.substring(0, separator);
                filters = parseTestFilters(sibling.substring(separator + TEST_SEPARATOR.length()));
            }
            if (modulePart.contains(EXCLUDER)) {
                result.add(Selector.ignore(join(prefix, modulePart.replace(EXCLUDER, ""))));
            } else if (!modulePart.isEmpty()) {
                result.add(Selector.include(join(prefix, modulePart), filters));
                anyIncluded = true;
            } else if (!prefix.isEmpty()) {
                // "pkg.::testA" filters the prefix itself
                result.add(Selector.include(prefix, filters));
                anyIncluded = true;
            }
        }
        if (!anyIncluded && !prefix.isEmpty()) {
            result.add(0, Selector.include(prefix, List.of()));
        }
        return result;
    }

    /**
     * Splits a comma-separated test list. If any filter is negated the whole list is.
     */
    public static List<String> parseTestFilters(String tests) {
        var filters = new ArrayList<String>();
        for (String test : tests.split(TEST_DELIMITER)) {
            if (!test.isBlank()) {
                filters.add(test.trim());
            }
        }
        boolean negated = filters.stream().anyMatch(f -> f.startsWith(EXCLUDER));
        if (negated) {
            filters.replaceAll(f -> f.startsWith(EXCLUDER) ? f : EXCLUDER + f);
        }
        return filters;
    }

    private static boolean isSpecial(String segment) {
        return segment.contains(EXCLUDER) || segment.contains(MODULE_DELIMITER) || segment.contains(TEST_SEPARATOR);
    }

    private static String join(String prefix, String path) {
        return prefix.isEmpty() ? path : prefix + "." + path;
    }
}
