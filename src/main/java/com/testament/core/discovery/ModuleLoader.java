package com.testament.core.discovery;

import com.testament.api.Description;
import com.testament.api.Module;
import com.testament.api.Parameterize;
import com.testament.api.Setup;
import com.testament.api.SetupTest;
import com.testament.api.Tags;
import com.testament.api.Teardown;
import com.testament.api.TeardownTest;
import com.testament.core.matcher.Importable;
import com.testament.core.model.Fixture;
import com.testament.core.model.TestCase;
import com.testament.core.model.TestGroup;
import com.testament.core.model.TestModule;
import com.testament.core.model.TestPackage;
import com.testament.core.selector.ParameterRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Turns classes into {@link TestModule}s.
 * <p>
 * A module is a public top-level class with public instance methods named {@code test*},
 * on the class itself or on its public nested classes (groups). Fixtures are found by
 * annotation; a class may declare at most one fixture of each kind.
 */
@Component
public class ModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModuleLoader.class);

    public static final String TEST_PREFIX = "test";
    public static final String PACKAGE_FIXTURES = "PackageFixtures";

    private final ClassLoader classLoader;

    public ModuleLoader(ClassPathScanner scanner) {
        this(scanner.classLoader());
    }

    ModuleLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * Imports {@code className} and builds its module, keeping only the tests the
     * importable's matchers accept.
     *
     * @param shuffler shuffles the tests of every group, or {@code null} to keep name order
     * @return the module, or empty when the class is not a module, is excluded by the module
     *         matcher, or has no test left after filtering
     * @throws ModuleLoadException         if the class cannot be imported or instantiated
     * @throws FixtureDeclarationException if a class declares a fixture kind twice
     */
    public Optional<TestModule> load(String className, Importable importable, Random shuffler) {
        Class<?> type = importClass(className);
        if (!isModuleCandidate(type) || !hasTests(type)) {
            log.debug("{} declares no tests, not a module", className);
            return Optional.empty();
        }
        Module declaration = type.getAnnotation(Module.class);
        if (declaration == null) {
            throw new ModuleLoadException("Failed to load " + className
                    + " - no valid RunMode declared, annotate the class with @Module");
        }

        Set<String> moduleTags = new LinkedHashSet<>(Arrays.asList(declaration.tags()));
        Set<String> candidateTags = new LinkedHashSet<>(moduleTags);
        collectTestTags(type, candidateTags);
        if (!importable.moduleMatcher().includesModule(className, candidateTags)) {
            log.debug("{} excluded by module matcher", className);
            return Optional.empty();
        }

        Object instance = instantiate(type, null, className);
        TestGroup root = new TestGroup(type.getSimpleName(), instance, null);
        buildGroup(root, type, className, moduleTags, importable, shuffler);

        var module = new TestModule(className, fileNameOf(type), declaration.description(),
                declaration.runMode(), moduleTags, root);
        module.ignoreTests(importable.testMatcher().ignoredTests());
        if (module.testCount() == 0) {
            log.debug("{} has no tests left after filtering", className);
            return Optional.empty();
        }
        return Optional.of(module);
    }

    /**
     * Loads {@code <package>.PackageFixtures}, if the package has one, and binds its
     * {@code @Setup} / {@code @Teardown} methods to the package node.
     */
    public void attachPackageFixtures(TestPackage node) {
        String className = node.name().isEmpty() ? PACKAGE_FIXTURES : node.name() + "." + PACKAGE_FIXTURES;
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            return;
        } catch (LinkageError e) {
            throw new ModuleLoadException("Failed to load " + className + " - " + e, e);
        }
        Method setup = findFixture(type, Setup.class, className);
        Method teardown = findFixture(type, Teardown.class, className);
        if (setup == null && teardown == null) {
            return;
        }
        boolean needsInstance = (setup != null && !isStatic(setup)) || (teardown != null && !isStatic(teardown));
        Object instance = needsInstance ? instantiate(type, null, className) : null;
        node.setFixtures(bind(setup, instance), bind(teardown, instance));
        log.debug("Package fixtures for {}: setup={}, teardown={}", node.name(), setup, teardown);
    }

    private Class<?> importClass(String className) {
        try {
            return Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new ModuleLoadException("Module doesn't exist - " + className, e);
        } catch (ExceptionInInitializerError e) {
            throw new ModuleLoadException("Failed to load " + className + " - " + e.getCause(), e);
        } catch (LinkageError e) {
            throw new ModuleLoadException("Failed to load " + className + " - " + e, e);
        }
    }

    private static boolean isModuleCandidate(Class<?> type) {
        int modifiers = type.getModifiers();
        return type.getEnclosingClass() == null
                && Modifier.isPublic(modifiers)
                && !Modifier.isAbstract(modifiers)
                && !type.isInterface()
                && !type.isEnum()
                && !type.isAnnotation()
                && !PACKAGE_FIXTURES.equals(type.getSimpleName());
    }

    private static boolean hasTests(Class<?> type) {
        if (!testMethods(type).isEmpty()) {
            return true;
        }
        return groupClasses(type).stream().anyMatch(ModuleLoader::hasTests);
    }

    private static void collectTestTags(Class<?> type, Set<String> into) {
        for (Method method : testMethods(type)) {
            into.addAll(tagsOf(method));
        }
        groupClasses(type).forEach(g -> collectTestTags(g, into));
    }

    private void buildGroup(TestGroup group, Class<?> type, String moduleName, Set<String> moduleTags,
                            Importable importable, Random shuffler) {
        group.setSetupFixture(bind(findFixture(type, Setup.class, moduleName), group.instance()));
        group.setTeardownFixture(bind(findFixture(type, Teardown.class, moduleName), group.instance()));
        group.setSetupTestFixture(bind(findFixture(type, SetupTest.class, moduleName), group.instance()));
        group.setTeardownTestFixture(bind(findFixture(type, TeardownTest.class, moduleName), group.instance()));

        var tests = new ArrayList<TestCase>();
        for (Method method : testMethods(type)) {
            Set<String> testTags = tagsOf(method);
            Set<String> matchTags = new LinkedHashSet<>(moduleTags);
            matchTags.addAll(testTags);
            if (!importable.testMatcher().includesTest(method.getName(), matchTags)) {
                continue;
            }
            tests.add(createTest(method, group, moduleName, matchTags, importable));
        }
        if (shuffler != null) {
            Collections.shuffle(tests, shuffler);
        }
        tests.forEach(group::addTest);

        for (Class<?> nested : groupClasses(type)) {
            Object instance = instantiate(nested, group.instance(), moduleName);
            var child = new TestGroup(nested.getSimpleName(), instance, group);
            buildGroup(child, nested, moduleName, moduleTags, importable, shuffler);
            if (!child.isEmpty()) {
                group.addChild(child);
            }
        }
    }

    private TestCase createTest(Method method, TestGroup group, String moduleName, Set<String> tags,
                                Importable importable) {
        Description description = method.getAnnotation(Description.class);
        String summary = description != null ? description.value() : "";
        Parameterize parameterize = method.getAnnotation(Parameterize.class);
        if (parameterize == null) {
            return new TestCase(method.getName(), moduleName, method, group, tags, null, false, summary);
        }
        List<Object[]> tuples = parameterTuples(method, parameterize.value(), group.instance(), moduleName);
        var test = new TestCase(method.getName(), moduleName, method, group, tags, tuples,
                parameterize.firstArgIsName(), summary);
        importable.testMatcher().selectorFor(method.getName())
                .map(filter -> ParameterRange.parse(filter, tuples.size()))
                .ifPresent(test::setParameterRange);
        return test;
    }

    private List<Object[]> parameterTuples(Method test, String providerName, Object instance, String moduleName) {
        Method provider;
        try {
            provider = test.getDeclaringClass().getDeclaredMethod(providerName);
        } catch (NoSuchMethodException e) {
            throw new ModuleLoadException("Failed to load " + moduleName + " - parameter provider "
                    + providerName + " not found for " + test.getName(), e);
        }
        Object values;
        try {
            provider.setAccessible(true);
            values = provider.invoke(isStatic(provider) ? null : instance);
        } catch (InvocationTargetException e) {
            throw new ModuleLoadException("Failed to load " + moduleName + " - " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ModuleLoadException("Failed to load " + moduleName + " - " + e, e);
        }
        var tuples = new ArrayList<Object[]>();
        if (values instanceof List<?> list) {
            list.forEach(v -> tuples.add(asTuple(v)));
        } else if (values instanceof Object[] array) {
            Arrays.stream(array).forEach(v -> tuples.add(asTuple(v)));
        } else {
            throw new ModuleLoadException("Failed to load " + moduleName + " - parameter provider "
                    + providerName + " must return a List or an array");
        }
        return tuples;
    }

    private static Object[] asTuple(Object value) {
        return value instanceof Object[] tuple ? tuple : new Object[]{value};
    }

    private static List<Method> testMethods(Class<?> type) {
        return Arrays.stream(type.getMethods())
                .filter(m -> m.getDeclaringClass() != Object.class)
                .filter(m -> m.getName().startsWith(TEST_PREFIX))
                .filter(m -> !isStatic(m) && !m.isSynthetic() && !m.isBridge())
                .sorted(Comparator.comparing(Method::getName))
                .toList();
    }

    private static List<Class<?>> groupClasses(Class<?> type) {
        return Arrays.stream(type.getDeclaredClasses())
                .filter(c -> Modifier.isPublic(c.getModifiers()))
                .filter(c -> !c.isInterface() && !c.isEnum() && !c.isAnnotation())
                .filter(c -> !Modifier.isAbstract(c.getModifiers()))
                .sorted(Comparator.comparing(Class::getSimpleName))
                .toList();
    }

    private static Set<String> tagsOf(Method method) {
        Tags tags = method.getAnnotation(Tags.class);
        return tags == null ? Set.of() : new LinkedHashSet<>(Arrays.asList(tags.value()));
    }

    private static Method findFixture(Class<?> type, Class<? extends Annotation> kind, String moduleName) {
        Method found = null;
        for (Method method : type.getDeclaredMethods()) {
            if (!method.isAnnotationPresent(kind)) {
                continue;
            }
            if (found != null) {
                throw new FixtureDeclarationException("More than 1 @" + kind.getSimpleName() + " in " + moduleName
                        + (type.getEnclosingClass() != null ? "$" + type.getSimpleName() : ""));
            }
            found = method;
        }
        if (found != null) {
            found.setAccessible(true);
        }
        return found;
    }

    private static Fixture bind(Method method, Object instance) {
        if (method == null) {
            return null;
        }
        return new Fixture(method, isStatic(method) ? null : instance);
    }

    private static Object instantiate(Class<?> type, Object outer, String moduleName) {
        try {
            boolean inner = type.getEnclosingClass() != null && !Modifier.isStatic(type.getModifiers());
            Constructor<?> constructor = inner
                    ? type.getDeclaredConstructor(type.getEnclosingClass())
                    : type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return inner ? constructor.newInstance(outer) : constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new ModuleLoadException("Failed to load " + moduleName + " - " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ModuleLoadException("Failed to load " + moduleName + " - " + e, e);
        }
    }

    private static boolean isStatic(Method method) {
        return Modifier.isStatic(method.getModifiers());
    }

    private static String fileNameOf(Class<?> type) {
        var resource = type.getResource(type.getSimpleName() + ".class");
        return resource != null ? resource.toString() : type.getName().replace('.', '/') + ".class";
    }
}
