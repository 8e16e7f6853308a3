package com.testament.core.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.JarURLConnection;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Lists packages and top-level classes visible to a class loader, from class directories
 * and jar files alike.
 * <p>
 * Nested classes ({@code Outer$Inner}), {@code package-info} and {@code module-info} are
 * never reported as classes.
 */
@Service
public class ClassPathScanner {

    private static final Logger log = LoggerFactory.getLogger(ClassPathScanner.class);

    private static final String CLASS_SUFFIX = ".class";
    private static final Set<String> IGNORE_CLASSES = Set.of("package-info", "module-info");

    private final ClassLoader classLoader;

    public ClassPathScanner() {
        this(defaultClassLoader());
    }

    public ClassPathScanner(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    public ClassLoader classLoader() {
        return classLoader;
    }

    /**
     * Direct children of a package.
     *
     * @param packages    names of the immediate sub-packages, fully qualified
     * @param classNames  names of the top-level classes, fully qualified
     */
    public record PackageListing(List<String> packages, List<String> classNames) {
    }

    public boolean isClass(String name) {
        return !name.isEmpty() && classLoader.getResource(toPath(name) + CLASS_SUFFIX) != null;
    }

    public boolean isPackage(String name) {
        if (name.isEmpty() || isClass(name)) {
            return false;
        }
        try {
            return classLoader.getResources(toPath(name)).hasMoreElements();
        } catch (IOException e) {
            log.debug("Could not look up package {}: {}", name, e.getMessage());
            return false;
        }
    }

    /**
     * Lists the immediate sub-packages and classes of {@code packageName} across every
     * class-path root that contains it.
     *
     * @throws IOException if a directory or jar cannot be read
     */
    public PackageListing list(String packageName) throws IOException {
        var packages = new TreeSet<String>();
        var classes = new TreeSet<String>();
        String path = toPath(packageName);
        Enumeration<URL> roots = classLoader.getResources(path);
        while (roots.hasMoreElements()) {
            URL url = roots.nextElement();
            switch (url.getProtocol()) {
                case "file" -> listDirectory(toLocalPath(url), packageName, packages, classes);
                case "jar" -> listJar(url, path, packageName, packages, classes);
                default -> log.debug("Skipping unsupported class-path location {}", url);
            }
        }
        return new PackageListing(new ArrayList<>(packages), new ArrayList<>(classes));
    }

    /**
     * Sweeps every class directory on the class path and returns the top-level class
     * names accepted by {@code filter}. Jar files are not swept.
     */
    public Set<String> findClassNames(Predicate<String> filter) {
        var names = new TreeSet<String>();
        try {
            Enumeration<URL> roots = classLoader.getResources("");
            while (roots.hasMoreElements()) {
                URL url = roots.nextElement();
                if (!"file".equals(url.getProtocol())) {
                    continue;
                }
                Path root = toLocalPath(url);
                try (var stream = Files.walk(root)) {
                    stream.filter(Files::isRegularFile)
                          .map(p -> root.relativize(p).toString().replace('\\', '/'))
                          .filter(this::isTopLevelClassFile)
                          .map(p -> p.substring(0, p.length() - CLASS_SUFFIX.length()).replace('/', '.'))
                          .filter(filter)
                          .forEach(names::add);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Class-path sweep failed", e);
        }
        return Collections.unmodifiableSet(names);
    }

    private void listDirectory(Path directory, String packageName, Set<String> packages, Set<String> classes)
            throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (var stream = Files.list(directory)) {
            stream.forEach(p -> {
                String fileName = p.getFileName().toString();
                if (Files.isDirectory(p)) {
                    packages.add(qualify(packageName, fileName));
                } else if (isTopLevelClassFile(fileName)) {
                    classes.add(qualify(packageName, stripSuffix(fileName)));
                }
            });
        }
    }

    private void listJar(URL url, String path, String packageName, Set<String> packages, Set<String> classes)
            throws IOException {
        var connection = (JarURLConnection) url.openConnection();
        connection.setUseCaches(false);
        String prefix = path.isEmpty() ? "" : path + "/";
        try (JarFile jar = connection.getJarFile()) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                String entry = entries.nextElement().getName();
                if (!entry.startsWith(prefix) || entry.length() == prefix.length()) {
                    continue;
                }
                String rest = entry.substring(prefix.length());
                int slash = rest.indexOf('/');
                if (slash >= 0) {
                    packages.add(qualify(packageName, rest.substring(0, slash)));
                } else if (isTopLevelClassFile(rest)) {
                    classes.add(qualify(packageName, stripSuffix(rest)));
                }
            }
        }
    }

    private boolean isTopLevelClassFile(String fileName) {
        if (!fileName.endsWith(CLASS_SUFFIX) || fileName.contains("$")) {
            return false;
        }
        String simple = stripSuffix(fileName.substring(fileName.lastIndexOf('/') + 1));
        return !IGNORE_CLASSES.contains(simple);
    }

    private static String stripSuffix(String fileName) {
        return fileName.substring(0, fileName.length() - CLASS_SUFFIX.length());
    }

    private static String qualify(String packageName, String child) {
        return packageName.isEmpty() ? child : packageName + "." + child;
    }

    private static String toPath(String name) {
        return name.replace('.', '/');
    }

    private static Path toLocalPath(URL url) throws IOException {
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IOException("Bad class-path location " + url, e);
        }
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : ClassPathScanner.class.getClassLoader();
    }
}
