package com.testament.dispatch.cli;

import com.testament.core.config.TestamentConfig;
import com.testament.core.config.TestamentProperties;
import com.testament.core.discovery.ClassPathScanner;
import com.testament.core.discovery.ModuleLoader;
import com.testament.core.discovery.SuiteDiscovery;
import com.testament.core.discovery.SuiteSelectionFactory;
import com.testament.core.engine.RunOptions;
import com.testament.core.engine.SuiteEngine;
import com.testament.core.logging.RunFolderManager;
import com.testament.core.metrics.TestamentMetrics;
import com.testament.core.report.LastFailedStore;
import com.testament.core.report.ResultReportWriter;
import com.testament.core.selector.SelectorParser;
import com.testament.core.selector.SuiteAliasResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the testament CLI command structure.
 * These tests exercise picocli directly without a Spring context, wiring the real
 * discovery and engine over the sample modules on the test class path.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path workDir;

    private TestamentProperties properties;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new TestamentProperties();
        properties.getLogs().setFolder(workDir.resolve("logs").toString());
        properties.setLastFailedFile(workDir.resolve("last-failed").toString());
        properties.setSuiteAlias(Map.of("basics", "com.testament.samples.selection.RunModule"));
        registry = new SimpleMeterRegistry();
    }

    /**
     * Custom picocli IFactory that builds the commands from real collaborators.
     */
    private CommandLine.IFactory createFactory() {
        var scanner = new ClassPathScanner();
        var lastFailed = new LastFailedStore(properties);
        var selectionFactory = new SuiteSelectionFactory(new SelectorParser(),
                new SuiteAliasResolver(properties.getSuiteAlias(), properties.getSuiteDisabled()),
                scanner, lastFailed);
        var discovery = new SuiteDiscovery(scanner, new ModuleLoader(scanner));
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(selectionFactory, discovery, new SuiteEngine(),
                            new RunFolderManager(properties), lastFailed,
                            new ResultReportWriter(new TestamentConfig().objectMapper()),
                            new TestamentMetrics(registry), properties);
                }
                if (cls == DiscoverCommand.class) {
                    return (K) new DiscoverCommand(selectionFactory, discovery);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new TestamentCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString().replaceAll("\u001B\\[[;\\d]*m", ""));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    // Top-level command
    // =====================================================================

    @Nested
    @DisplayName("testament")
    class TopLevel {

        @Test
        @DisplayName("no arguments prints the banner and usage")
        void noArgs() {
            var result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TESTAMENT"));
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("discover"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            var result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("testament 0.1.0"));
        }

        @Test
        @DisplayName("help run describes the selector options")
        void helpRun() {
            var result = execute("help", "run");
            assertTrue(result.output().contains("--suite-glob"));
            assertTrue(result.output().contains("--stop-on-fail"));
        }

        @Test
        @DisplayName("unknown option is a usage error")
        void unknownOption() {
            assertEquals(2, execute("run", "--bogus").exitCode());
        }
    }

    // =====================================================================
    // run
    // =====================================================================

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("without a selector exits with 2")
        void noSelector() {
            var result = execute("run");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("No suite selected"));
        }

        @Test
        @DisplayName("passing suite exits 0 and writes the results file")
        void passing() throws Exception {
            var result = execute("run", "--suite", "basics", "--seed", "7");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("testA"));
            assertTrue(result.output().contains("Suite passed"));
            try (Stream<Path> walk = Files.walk(workDir.resolve("logs"))) {
                assertEquals(1, walk.filter(p -> p.getFileName().toString().equals("results.json")).count());
            }
            assertTrue(Files.readAllLines(workDir.resolve("last-failed")).isEmpty());
            assertNotNull(registry.find("testament.suite.results").tag("status", "PASSED").counter());
        }

        @Test
        @DisplayName("failing suite exits 1 and remembers what failed")
        void failing() throws Exception {
            var result = execute("run", "-s", "com.testament.samples.engine.StopChecks", "--no-concurrency");

            assertEquals(1, result.exitCode(), result.output());
            assertEquals(List.of("com.testament.samples.engine.StopChecks::testBFails"),
                    Files.readAllLines(workDir.resolve("last-failed")));
        }

        @Test
        @DisplayName("--suite-last-failed reruns only the failed tests")
        void rerunLastFailed() throws Exception {
            Files.write(workDir.resolve("last-failed"),
                    List.of("com.testament.samples.selection.RunModule::testB"));

            var result = execute("run", "--suite-last-failed");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("Discovered 1 modules, 1 tests"));
        }

        @Test
        @DisplayName("selector with an excluded sibling and test filters runs only the chosen tests")
        void selectorExpression() {
            var result = execute("run", "-s",
                    "com.testament.samples.selection.!SkipModule;RunModule::testA,testB", "--no-concurrency");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("Discovered 1 modules, 2 tests"));
        }

        @Test
        @DisplayName("invalid worker count is a usage error")
        void invalidWorkers() {
            var result = execute("run", "-s", "basics", "--max-workers", "0");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("maxWorkers must be at least 1"));
        }

        @Test
        @DisplayName("command-line flags override configured defaults")
        void resolveOptions() {
            properties.getRun().setMaxWorkers(8);
            properties.getRun().setNoConcurrency(true);
            var cli = new CommandLine(new TestamentCommand(), createFactory());
            cli.parseArgs("run", "--max-workers", "3", "--stop-on-fail", "--seed", "42");
            RunCommand run = cli.getSubcommands().get("run").getCommand();

            RunOptions options = run.resolveOptions();

            assertEquals(3, options.maxWorkers());
            assertTrue(options.noConcurrency());
            assertTrue(options.stopOnFail());
            assertEquals(42L, options.seed());
        }
    }

    // =====================================================================
    // discover
    // =====================================================================

    @Nested
    @DisplayName("discover")
    class Discover {

        @Test
        @DisplayName("prints modules, run modes and tests")
        void listsTree() {
            var result = execute("discover", "-s", "com.testament.samples.selection", "com.testament.samples.params");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("TaggedModule [PARALLEL_TEST]"));
            assertTrue(result.output().contains("testFast tags=[smoke, fast]"));
            assertTrue(result.output().contains("testAdd x5"));
            assertTrue(result.output().contains("NestedModule"));
        }

        @Test
        @DisplayName("marks packages with fixtures")
        void packageFixtures() {
            var result = execute("discover", "-s", "com.testament.samples.fixtures");
            assertTrue(result.output().contains("com.testament.samples.fixtures (package setup)"));
        }

        @Test
        @DisplayName("failed imports exit with 1")
        void failedImports() {
            var result = execute("discover", "-s", "com.testament.samples.broken");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("GoodNeighbour"));
            assertTrue(result.output().contains("MissingRunMode"));
        }
    }
}
