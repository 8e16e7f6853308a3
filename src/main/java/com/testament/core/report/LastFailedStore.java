package com.testament.core.report;

import com.testament.core.config.TestamentProperties;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestModuleResult;
import com.testament.core.model.TestSuiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The "last failed" artifact: newline-delimited {@code module::test} names of every test
 * that did not pass, rewritten at the end of each suite run.
 */
@Component
public class LastFailedStore {

    private static final Logger log = LoggerFactory.getLogger(LastFailedStore.class);

    private static final String TEST_SEPARATOR = "::";

    private final Path file;

    @Autowired
    public LastFailedStore(TestamentProperties properties) {
        this(Path.of(properties.getLastFailedFile()));
    }

    public LastFailedStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /** Rewrites the file from {@code result}. An I/O problem is logged, never thrown. */
    public void write(TestSuiteResult result) {
        var lines = new ArrayList<String>();
        for (TestModuleResult module : result.getModuleResults()) {
            for (TestMethodResult test : module.getTestResults()) {
                if (!test.passed()) {
                    lines.add(module.getName() + TEST_SEPARATOR + test.getName());
                }
            }
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, lines, StandardCharsets.UTF_8);
            log.debug("Wrote {} failed tests to {}", lines.size(), file);
        } catch (IOException e) {
            log.warn("Could not write last-failed file {}: {}", file, e.getMessage());
        }
    }

    /** Failed test names of the previous run; empty when there is no file. */
    public List<String> readTestNames() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    /** The previous run's failures grouped per module, as {@code module::t1,t2} selectors. */
    public List<String> readSelectors() throws IOException {
        Map<String, List<String>> byModule = new LinkedHashMap<>();
        for (String name : readTestNames()) {
            int separator = name.indexOf(TEST_SEPARATOR);
            if (separator <= 0) {
                log.debug("Ignoring malformed last-failed entry '{}'", name);
                continue;
            }
            String module = name.substring(0, separator);
            String test = name.substring(separator + TEST_SEPARATOR.length());
            List<String> tests = byModule.computeIfAbsent(module, k -> new ArrayList<>());
            if (!tests.contains(test)) {
                tests.add(test);
            }
        }
        return byModule.entrySet().stream()
                .map(e -> e.getKey() + TEST_SEPARATOR + String.join(",", e.getValue()))
                .toList();
    }
}
