package com.testament.core.discovery;

import com.testament.api.RunMode;
import com.testament.core.matcher.DefaultTestCasePatternMatcher;
import com.testament.core.matcher.Importable;
import com.testament.core.matcher.ModuleMatcher;
import com.testament.core.matcher.TagModulePatternMatcher;
import com.testament.core.matcher.TagTestCasePatternMatcher;
import com.testament.core.model.TestCase;
import com.testament.core.model.TestModule;
import com.testament.core.model.TestPackage;
import com.testament.core.scope.Scope;
import com.testament.samples.broken.DuplicateSetup;
import com.testament.samples.broken.MissingRunMode;
import com.testament.samples.fixtures.GroupedChecks;
import com.testament.samples.params.ParamChecks;
import com.testament.samples.selection.Helpers;
import com.testament.samples.selection.RunModule;
import com.testament.samples.selection.TaggedModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModuleLoaderTest {

    private ModuleLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ModuleLoader(getClass().getClassLoader());
    }

    private TestModule load(Class<?> type, Importable importable) {
        return loader.load(type.getName(), importable, null).orElseThrow();
    }

    private static List<String> testNames(TestModule module) {
        return module.allTests().stream().map(TestCase::name).toList();
    }

    private static Importable withTests(Class<?> type, String filter) {
        return new Importable(type.getName(), ModuleMatcher.ALL, DefaultTestCasePatternMatcher.parse(filter));
    }

    // ── module declaration ───────────────────────────────────────────────

    @Test
    @DisplayName("annotated class becomes a module with its tests in name order")
    void loadsModule() {
        TestModule module = load(RunModule.class, Importable.of(RunModule.class.getName()));
        assertEquals(RunModule.class.getName(), module.name());
        assertEquals("RunModule", module.simpleName());
        assertEquals("com.testament.samples.selection", module.packageName());
        assertEquals(RunMode.PARALLEL, module.runMode());
        assertEquals("Three passing tests", module.description());
        assertEquals(List.of("testA", "testB", "testC"), testNames(module));
    }

    @Test
    @DisplayName("class with tests but no @Module is a failed import")
    void missingRunMode() {
        var error = assertThrows(ModuleLoadException.class,
                () -> loader.load(MissingRunMode.class.getName(), Importable.of(MissingRunMode.class.getName()), null));
        assertEquals("Failed to load " + MissingRunMode.class.getName()
                + " - no valid RunMode declared, annotate the class with @Module", error.getMessage());
    }

    @Test
    @DisplayName("duplicate fixture declaration is rejected")
    void duplicateFixture() {
        var error = assertThrows(FixtureDeclarationException.class,
                () -> loader.load(DuplicateSetup.class.getName(), Importable.of(DuplicateSetup.class.getName()), null));
        assertEquals("More than 1 @Setup in " + DuplicateSetup.class.getName(), error.getMessage());
    }

    @Test
    @DisplayName("class without tests is not a module")
    void notAModule() {
        assertTrue(loader.load(Helpers.class.getName(), Importable.of(Helpers.class.getName()), null).isEmpty());
    }

    @Test
    @DisplayName("unknown class reports that the module doesn't exist")
    void unknownClass() {
        var error = assertThrows(ModuleLoadException.class,
                () -> loader.load("com.testament.samples.Nope", Importable.of("com.testament.samples.Nope"), null));
        assertEquals("Module doesn't exist - com.testament.samples.Nope", error.getMessage());
    }

    // ── test filtering ───────────────────────────────────────────────────

    @Test
    @DisplayName("test list keeps only the listed tests")
    void includedTests() {
        assertEquals(List.of("testA", "testC"), testNames(load(RunModule.class, withTests(RunModule.class, "testC,testA"))));
    }

    @Test
    @DisplayName("negated test list drops the listed tests and remembers them")
    void excludedTests() {
        TestModule module = load(RunModule.class, withTests(RunModule.class, "!testB"));
        assertEquals(List.of("testA", "testC"), testNames(module));
        assertEquals(Set.of("testB"), module.ignoredTests());
    }

    @Test
    @DisplayName("module whose every test is filtered out is dropped")
    void everythingFiltered() {
        assertTrue(loader.load(RunModule.class.getName(), withTests(RunModule.class, "testZ"), null).isEmpty());
    }

    @Test
    @DisplayName("tag selection filters tests by their own and the module's tags")
    void tagFiltering() {
        String selector = TaggedModule.class.getName() + "/fast";
        var importable = new Importable(TaggedModule.class.getName(),
                TagModulePatternMatcher.parse(selector), TagTestCasePatternMatcher.parse(selector));
        TestModule module = load(TaggedModule.class, importable);
        assertEquals(List.of("testFast"), testNames(module));
        assertEquals(Set.of("smoke", "fast"), module.allTests().get(0).tags());
    }

    @Test
    @DisplayName("module tag selects every test of the module")
    void moduleTag() {
        String selector = TaggedModule.class.getName() + "/smoke";
        var importable = new Importable(TaggedModule.class.getName(),
                TagModulePatternMatcher.parse(selector), TagTestCasePatternMatcher.parse(selector));
        assertEquals(3, load(TaggedModule.class, importable).testCount());
    }

    @Test
    @DisplayName("shuffler reorders tests within a group")
    void shuffled() {
        var module = loader.load(RunModule.class.getName(), Importable.of(RunModule.class.getName()),
                new Random(7)).orElseThrow();
        assertEquals(Set.of("testA", "testB", "testC"), Set.copyOf(testNames(module)));
    }

    // ── parameters and groups ────────────────────────────────────────────

    @Test
    @DisplayName("parameter provider tuples are loaded and sliced by the selector")
    void parameters() {
        TestModule module = load(ParamChecks.class, withTests(ParamChecks.class, "testAdd[1:3],testWord"));
        TestCase add = module.allTests().stream().filter(t -> t.name().equals("testAdd")).findFirst().orElseThrow();
        TestCase word = module.allTests().stream().filter(t -> t.name().equals("testWord")).findFirst().orElseThrow();

        assertTrue(add.isParameterized());
        assertEquals(5, add.parameters().size());
        assertArrayEquals(new int[]{1, 2}, add.selectedIndices());
        assertArrayEquals(new Object[]{"alpha"}, word.parameters().get(0));
        assertArrayEquals(new int[]{0, 1, 2}, word.selectedIndices());
    }

    @Test
    @DisplayName("public nested classes become groups with their own fixtures")
    void groups() {
        TestModule module = load(GroupedChecks.class, Importable.of(GroupedChecks.class.getName()));
        assertEquals(List.of("testOuter", "testInner"), testNames(module));
        assertEquals(1, module.rootGroup().children().size());
        var inner = module.rootGroup().children().get(0);
        assertEquals("Inner", inner.name());
        assertNotNull(inner.setupFixture());
        assertNotNull(module.rootGroup().setupTestFixture());
        TestCase innerTest = inner.tests().iterator().next();
        assertEquals("beforeInner", innerTest.setupFixture().method().getName());
        assertEquals("afterEach", innerTest.teardownFixture().method().getName());
    }

    // ── package fixtures ─────────────────────────────────────────────────

    @Test
    @DisplayName("PackageFixtures setup and teardown bind to the package node")
    void packageFixtures() {
        var node = new TestPackage("com.testament.samples.fixtures", Scope.root().child("fixtures"));
        loader.attachPackageFixtures(node);
        assertEquals("openPackage", node.setupFixture().method().getName());
        assertEquals("closePackage", node.teardownFixture().method().getName());
    }

    @Test
    @DisplayName("package without PackageFixtures keeps no fixtures")
    void noPackageFixtures() {
        var node = new TestPackage("com.testament.samples.selection", Scope.root());
        loader.attachPackageFixtures(node);
        assertNull(node.setupFixture());
        assertNull(node.teardownFixture());
    }
}
