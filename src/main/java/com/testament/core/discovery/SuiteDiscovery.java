package com.testament.core.discovery;

import com.testament.api.RunMode;
import com.testament.core.matcher.Importable;
import com.testament.core.matcher.SuiteSelection;
import com.testament.core.model.DiscoveredSuite;
import com.testament.core.model.TestModule;
import com.testament.core.model.TestPackage;
import com.testament.core.model.TestPackageTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Resolves a {@link SuiteSelection} into a {@link DiscoveredSuite}.
 * <p>
 * Packages are walked depth-first in shuffled order; classes are loaded through the
 * {@link ModuleLoader}. Import problems never abort discovery, each becomes one entry of
 * the failed-import list.
 */
@Service
public class SuiteDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SuiteDiscovery.class);

    private final ClassPathScanner scanner;
    private final ModuleLoader loader;

    public SuiteDiscovery(ClassPathScanner scanner, ModuleLoader loader) {
        this.scanner = scanner;
        this.loader = loader;
    }

    public DiscoveredSuite discover(SuiteSelection selection, Random random) {
        var walk = new Walk(selection, random);
        var importables = new ArrayList<>(selection.importables());
        Collections.shuffle(importables, random);
        for (Importable importable : importables) {
            walk.importPath(importable);
        }
        return walk.finish();
    }

    /** State of one discovery pass. */
    private final class Walk {

        private final SuiteSelection selection;
        private final Random random;
        private final Map<String, TestModule> modules = new LinkedHashMap<>();
        private final Set<String> failedImports = new LinkedHashSet<>();

        Walk(SuiteSelection selection, Random random) {
            this.selection = selection;
            this.random = random;
        }

        void importPath(Importable importable) {
            String path = importable.path();
            if (selection.isIgnored(path)) {
                log.debug("Skipping ignored path {}", path);
                return;
            }
            if (scanner.isPackage(path)) {
                walkPackage(path, importable);
            } else {
                loadModule(path, importable);
            }
        }

        private void walkPackage(String packageName, Importable importable) {
            ClassPathScanner.PackageListing listing;
            try {
                listing = scanner.list(packageName);
            } catch (IOException e) {
                failedImports.add("Failed to load " + packageName + " - " + e.getMessage());
                return;
            }
            var children = new ArrayList<String>(listing.packages());
            children.addAll(listing.classNames());
            Collections.shuffle(children, random);
            for (String child : children) {
                if (selection.isIgnored(child)) {
                    log.debug("Skipping ignored path {}", child);
                } else if (listing.packages().contains(child)) {
                    walkPackage(child, importable);
                } else {
                    loadModule(child, importable);
                }
            }
        }

        private void loadModule(String className, Importable importable) {
            try {
                loader.load(className, importable, random).ifPresent(this::register);
            } catch (ModuleLoadException | FixtureDeclarationException e) {
                log.debug("Failed import: {}", e.getMessage());
                failedImports.add(e.getMessage());
            }
        }

        private void register(TestModule module) {
            TestModule existing = modules.get(module.name());
            if (existing != null) {
                existing.merge(module);
                log.debug("Merged second discovery of {}", module.name());
            } else {
                modules.put(module.name(), module);
            }
        }

        DiscoveredSuite finish() {
            var tree = new TestPackageTree();
            for (TestModule module : modules.values()) {
                if (module.testCount() == 0) {
                    continue;
                }
                TestPackage node = tree.register(module.packageName(), this::attachFixtures);
                module.setScope(node.scope());
                if (module.runMode() == RunMode.SEQUENTIAL) {
                    node.sequentialModules().add(module);
                } else {
                    node.parallelModules().add(module);
                }
            }
            for (TestPackage node : tree.packages()) {
                Collections.shuffle(node.sequentialModules(), random);
                Collections.shuffle(node.parallelModules(), random);
            }
            List<String> failures = new ArrayList<>(failedImports);
            log.info("Discovered {} modules in {} packages, {} failed imports",
                    tree.allModules().size(), tree.packages().size(), failures.size());
            return new DiscoveredSuite(tree, failures);
        }

        private void attachFixtures(TestPackage node) {
            try {
                loader.attachPackageFixtures(node);
            } catch (ModuleLoadException | FixtureDeclarationException e) {
                failedImports.add(e.getMessage());
            }
        }
    }
}
