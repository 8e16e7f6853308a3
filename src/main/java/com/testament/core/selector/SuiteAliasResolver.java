package com.testament.core.selector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands suite aliases and drops disabled suites before selectors are parsed.
 * <p>
 * An alias maps a short name to a space-separated list of selectors or other aliases.
 * A disabled entry removes the selector or alias wherever it appears in the expansion.
 */
public class SuiteAliasResolver {

    private static final Logger log = LoggerFactory.getLogger(SuiteAliasResolver.class);

    private final Map<String, String> aliases;
    private final Map<String, String> disabled;

    public SuiteAliasResolver(Map<String, String> aliases, Map<String, String> disabled) {
        this.aliases = aliases != null ? Map.copyOf(aliases) : Map.of();
        this.disabled = disabled != null ? Map.copyOf(disabled) : Map.of();
    }

    public Set<String> resolve(Collection<String> selectors) {
        var resolved = new LinkedHashSet<String>();
        resolve(selectors, resolved, new ArrayDeque<>());
        return resolved;
    }

    private void resolve(Collection<String> selectors, Set<String> resolved, Deque<String> expanding) {
        for (String selector : selectors) {
            if (selector.isBlank()) {
                continue;
            }
            if (disabled.containsKey(selector)) {
                log.info("Suite {} is disabled: {}", selector, disabled.get(selector));
                continue;
            }
            String expansion = aliases.get(selector);
            if (expansion == null) {
                resolved.add(selector);
            } else if (expanding.contains(selector)) {
                log.warn("Suite alias cycle through {} ({}), ignoring", selector, expanding);
            } else {
                expanding.push(selector);
                resolve(List.of(expansion.trim().split("\\s+")), resolved, expanding);
                expanding.pop();
            }
        }
    }
}
