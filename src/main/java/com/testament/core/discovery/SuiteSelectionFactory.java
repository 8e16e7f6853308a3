package com.testament.core.discovery;

import com.testament.core.matcher.DefaultModulePatternMatcher;
import com.testament.core.matcher.DefaultTestCasePatternMatcher;
import com.testament.core.matcher.GlobModulePatternMatcher;
import com.testament.core.matcher.GlobTestCasePatternMatcher;
import com.testament.core.matcher.Importable;
import com.testament.core.matcher.RegexModulePatternMatcher;
import com.testament.core.matcher.RegexTestCasePatternMatcher;
import com.testament.core.matcher.SuiteSelection;
import com.testament.core.matcher.TagModulePatternMatcher;
import com.testament.core.matcher.TagTestCasePatternMatcher;
import com.testament.core.report.LastFailedStore;
import com.testament.core.selector.ParsedSelectors;
import com.testament.core.selector.Selector;
import com.testament.core.selector.SelectorParser;
import com.testament.core.selector.SuiteAliasResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link SuiteSelection} for a {@link SuiteRequest}.
 * <p>
 * Literal selectors go through alias resolution and the {@link SelectorParser}. Glob and
 * regex selectors take the form {@code modulePattern[::testPattern]}; every class the module
 * pattern matches becomes one importable. A tag selector on the same path as a literal
 * selector narrows it: a test must pass both.
 */
@Component
public class SuiteSelectionFactory {

    private static final Logger log = LoggerFactory.getLogger(SuiteSelectionFactory.class);

    private static final String TEST_SEPARATOR = "::";

    private final SelectorParser parser;
    private final SuiteAliasResolver aliasResolver;
    private final ClassPathScanner scanner;
    private final LastFailedStore lastFailedStore;

    public SuiteSelectionFactory(SelectorParser parser, SuiteAliasResolver aliasResolver,
                                 ClassPathScanner scanner, LastFailedStore lastFailedStore) {
        this.parser = parser;
        this.aliasResolver = aliasResolver;
        this.scanner = scanner;
        this.lastFailedStore = lastFailedStore;
    }

    /**
     * @throws IOException if the last-failed file was requested and cannot be read
     */
    public SuiteSelection create(SuiteRequest request) throws IOException {
        var importables = new ArrayList<Importable>();
        var ignored = new LinkedHashSet<String>();

        addLiteral(aliasResolver.resolve(request.suites()), importables, ignored);
        if (request.lastFailed()) {
            List<String> selectors = lastFailedStore.readSelectors();
            if (selectors.isEmpty()) {
                log.info("No failed tests recorded in {}", lastFailedStore.file());
            }
            addLiteral(selectors, importables, ignored);
        }
        request.globs().forEach(pattern -> addGlob(pattern, importables));
        request.regexes().forEach(pattern -> addRegex(pattern, importables));
        request.tags().forEach(pattern -> addTag(pattern, importables));

        log.debug("Selection: {} importables, ignored {}", importables.size(), ignored);
        return new SuiteSelection(importables, new ArrayList<>(ignored));
    }

    private void addLiteral(Collection<String> selectors, List<Importable> importables, Set<String> ignored) {
        ParsedSelectors parsed = parser.parse(selectors);
        for (Selector selector : parsed.importables()) {
            importables.add(new Importable(selector.importPath(), DefaultModulePatternMatcher.parse(""),
                    DefaultTestCasePatternMatcher.of(selector.testFilters())));
        }
        ignored.addAll(parsed.ignoredPaths());
    }

    private void addGlob(String selector, List<Importable> importables) {
        String[] parts = splitTests(selector);
        var modules = GlobModulePatternMatcher.parse(parts[0], scanner);
        var tests = GlobTestCasePatternMatcher.parse(parts[1]);
        if (!modules.isValid() || modules.includedItems().isEmpty()) {
            log.warn("Glob selector '{}' matched no classes", selector);
            return;
        }
        modules.includedItems().stream().sorted()
                .forEach(className -> importables.add(new Importable(className, modules, tests)));
    }

    private void addRegex(String selector, List<Importable> importables) {
        String[] parts = splitTests(selector);
        var modules = RegexModulePatternMatcher.parse(parts[0], scanner);
        var tests = RegexTestCasePatternMatcher.parse(parts[1]);
        if (!modules.isValid() || modules.includedItems().isEmpty()) {
            log.warn("Regex selector '{}' matched no classes", selector);
            return;
        }
        modules.includedItems().stream().sorted()
                .forEach(className -> importables.add(new Importable(className, modules, tests)));
    }

    private void addTag(String selector, List<Importable> importables) {
        var modules = TagModulePatternMatcher.parse(selector);
        var tests = TagTestCasePatternMatcher.parse(selector);
        if (modules.path().isEmpty()) {
            log.warn("Tag selector '{}' names no path", selector);
            return;
        }
        for (int i = 0; i < importables.size(); i++) {
            Importable existing = importables.get(i);
            if (existing.path().equals(modules.path())) {
                importables.set(i, new Importable(existing.path(),
                        existing.moduleMatcher().and(modules),
                        existing.testMatcher().and(tests)));
                return;
            }
        }
        importables.add(new Importable(modules.path(), modules, tests));
    }

    private static String[] splitTests(String selector) {
        int separator = selector.indexOf(TEST_SEPARATOR);
        if (separator < 0) {
            return new String[]{selector.trim(), ""};
        }
        return new String[]{selector.substring(0, separator).trim(),
                selector.substring(separator + TEST_SEPARATOR.length()).trim()};
    }
}
