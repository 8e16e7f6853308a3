package com.testament.core.matcher;

import java.util.Set;

/**
 * Decides whether a loaded module takes part in the run.
 */
@FunctionalInterface
public interface ModuleMatcher {

    ModuleMatcher ALL = (name, tags) -> true;

    /**
     * @param moduleName fully qualified module class name
     * @param tags       the module's tags together with the tags of its tests
     */
    boolean includesModule(String moduleName, Set<String> tags);

    default ModuleMatcher and(ModuleMatcher other) {
        return (name, tags) -> includesModule(name, tags) && other.includesModule(name, tags);
    }
}
