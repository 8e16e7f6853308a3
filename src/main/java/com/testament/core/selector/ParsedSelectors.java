package com.testament.core.selector;

import java.util.List;

/**
 * Output of {@link SelectorParser}: what to import and which paths to leave out.
 */
public record ParsedSelectors(List<Selector> selectors) {

    public ParsedSelectors {
        selectors = List.copyOf(selectors);
    }

    public List<Selector> importables() {
        return selectors.stream().filter(s -> !s.ignored()).toList();
    }

    public List<String> ignoredPaths() {
        return selectors.stream().filter(Selector::ignored).map(Selector::importPath).toList();
    }
}
