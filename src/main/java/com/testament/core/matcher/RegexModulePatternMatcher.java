package com.testament.core.matcher;

import com.testament.core.discovery.ClassPathScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Selects module classes whose fully qualified name matches a regular expression,
 * anchored at the start of the name.
 */
public class RegexModulePatternMatcher extends PatternMatcherBase implements ModuleMatcher {

    private static final Logger log = LoggerFactory.getLogger(RegexModulePatternMatcher.class);

    private final boolean valid;

    private RegexModulePatternMatcher(Set<String> items, String pattern, boolean valid) {
        super(items, pattern, true);
        this.valid = valid;
    }

    public static RegexModulePatternMatcher parse(String pattern, ClassPathScanner scanner) {
        Pattern compiled;
        try {
            compiled = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid module regex '{}': {}", pattern, e.getDescription());
            return new RegexModulePatternMatcher(Set.of(), pattern, false);
        }
        Set<String> items = scanner.findClassNames(name -> compiled.matcher(name).lookingAt());
        log.debug("Module regex '{}' matched {} classes", pattern, items.size());
        return new RegexModulePatternMatcher(items, pattern, true);
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
