package com.testament.dispatch.cli;

import com.testament.core.config.TestamentProperties;
import com.testament.core.discovery.SuiteDiscovery;
import com.testament.core.discovery.SuiteRequest;
import com.testament.core.discovery.SuiteSelectionFactory;
import com.testament.core.engine.RunOptions;
import com.testament.core.engine.SuiteEngine;
import com.testament.core.logging.RunFolderManager;
import com.testament.core.matcher.SuiteSelection;
import com.testament.core.metrics.TestamentMetrics;
import com.testament.core.model.DiscoveredSuite;
import com.testament.core.model.TestSuiteResult;
import com.testament.core.report.CompositeReporter;
import com.testament.core.report.LastFailedStore;
import com.testament.core.report.LoggingReporter;
import com.testament.core.report.MetricsReporter;
import com.testament.core.report.Reporter;
import com.testament.core.report.ResultReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.concurrent.Callable;

/**
 * CLI command: testament run --suite &lt;selector&gt;...
 * <p>
 * Discovers the selected modules, runs them and exits with 0 when the suite passed,
 * 1 when it did not. Each run writes {@code results.json} into a fresh timestamped
 * folder under the logs folder and records the tests that did not pass for
 * {@code --suite-last-failed}.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Discover and run test modules")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final String SUITE_NAME = "suite_run";

    @Mixin
    SelectorOptions selectors = new SelectorOptions();

    @Option(names = "--max-workers", paramLabel = "N",
            description = "Threads for parallel modules, and again for parallel tests (default: testament.run.max-workers)")
    Integer maxWorkers;

    @Option(names = "--max-sub-folders", paramLabel = "N",
            description = "Run folders to keep under the logs folder (default: testament.logs.max-sub-folders)")
    Integer maxSubFolders;

    @Option(names = "--no-concurrency", description = "Run every module and test one at a time")
    boolean noConcurrency;

    @Option(names = "--stop-on-fail", description = "Stop the run at the first failed test")
    boolean stopOnFail;

    @Option(names = "--seed", paramLabel = "SEED", description = "Seed for the module and test shuffle")
    Long seed;

    private final SuiteSelectionFactory selectionFactory;
    private final SuiteDiscovery discovery;
    private final SuiteEngine engine;
    private final RunFolderManager runFolderManager;
    private final LastFailedStore lastFailedStore;
    private final ResultReportWriter reportWriter;
    private final TestamentMetrics metrics;
    private final TestamentProperties properties;

    public RunCommand(SuiteSelectionFactory selectionFactory, SuiteDiscovery discovery, SuiteEngine engine,
                      RunFolderManager runFolderManager, LastFailedStore lastFailedStore,
                      ResultReportWriter reportWriter, TestamentMetrics metrics, TestamentProperties properties) {
        this.selectionFactory = selectionFactory;
        this.discovery = discovery;
        this.engine = engine;
        this.runFolderManager = runFolderManager;
        this.lastFailedStore = lastFailedStore;
        this.reportWriter = reportWriter;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        SuiteRequest request = selectors.toRequest();
        if (request.isEmpty()) {
            ConsoleOutput.error("No suite selected. Use --suite, --suite-glob, --suite-regex, --suite-tag or --suite-last-failed");
            return CommandLine.ExitCode.USAGE;
        }

        RunOptions options;
        try {
            options = resolveOptions();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        SuiteSelection selection;
        try {
            selection = selectionFactory.create(request);
        } catch (IOException e) {
            ConsoleOutput.error("Could not read last failed tests from " + lastFailedStore.file() + ": " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        DiscoveredSuite suite = discovery.discover(selection, options.random());
        ConsoleOutput.info(String.format("Discovered %d modules, %d tests", suite.allModules().size(), suite.testCount()));
        suite.failedImports().forEach(ConsoleOutput::failedImport);

        Path runFolder = createRunFolder();
        Reporter reporter = CompositeReporter.of(new ConsoleReporter(), new LoggingReporter(), new MetricsReporter(metrics));
        TestSuiteResult result = engine.run(SUITE_NAME, suite, options, reporter);

        lastFailedStore.write(result);
        if (runFolder != null) {
            try {
                Path report = reportWriter.write(result, runFolder);
                ConsoleOutput.info("Results written to " + report);
            } catch (IOException e) {
                log.warn("Could not write results to {}: {}", runFolder, e.getMessage());
            }
        }

        if (result.passed()) {
            ConsoleOutput.success("Suite passed");
        } else {
            ConsoleOutput.error("Suite " + result.getStatus());
        }
        return result.exitCode();
    }

    RunOptions resolveOptions() {
        TestamentProperties.Run defaults = properties.getRun();
        return new RunOptions(
                maxWorkers != null ? maxWorkers : defaults.getMaxWorkers(),
                noConcurrency || defaults.isNoConcurrency(),
                stopOnFail || defaults.isStopOnFail(),
                seed != null ? seed : defaults.getSeed());
    }

    private Path createRunFolder() {
        int keep = maxSubFolders != null ? maxSubFolders : properties.getLogs().getMaxSubFolders();
        try {
            Path folder = runFolderManager.create(LocalDateTime.now(), keep);
            log.info("Run folder: {}", folder);
            return folder;
        } catch (IOException e) {
            log.warn("Could not create run folder under {}: {}", runFolderManager.logsFolder(), e.getMessage());
            return null;
        }
    }
}
