package com.testament.dispatch.cli;

import com.testament.core.discovery.SuiteDiscovery;
import com.testament.core.discovery.SuiteRequest;
import com.testament.core.discovery.SuiteSelectionFactory;
import com.testament.core.matcher.SuiteSelection;
import com.testament.core.model.DiscoveredSuite;
import com.testament.core.model.TestCase;
import com.testament.core.model.TestModule;
import com.testament.core.model.TestPackage;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.Comparator;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * CLI command: testament discover --suite &lt;selector&gt;...
 * <p>
 * Prints the package tree the selectors resolve to, without running anything.
 * Exits with 1 when any import failed.
 */
@Command(name = "discover", mixinStandardHelpOptions = true,
        description = "Show the modules and tests a selection resolves to")
@Component
public class DiscoverCommand implements Callable<Integer> {

    @Mixin
    SelectorOptions selectors = new SelectorOptions();

    @Option(names = "--seed", paramLabel = "SEED",
            description = "Show the order a run with this seed would use; names are sorted otherwise")
    Long seed;

    private final SuiteSelectionFactory selectionFactory;
    private final SuiteDiscovery discovery;

    public DiscoverCommand(SuiteSelectionFactory selectionFactory, SuiteDiscovery discovery) {
        this.selectionFactory = selectionFactory;
        this.discovery = discovery;
    }

    @Override
    public Integer call() {
        SuiteRequest request = selectors.toRequest();
        if (request.isEmpty()) {
            ConsoleOutput.error("No suite selected. Use --suite, --suite-glob, --suite-regex, --suite-tag or --suite-last-failed");
            return CommandLine.ExitCode.USAGE;
        }

        SuiteSelection selection;
        try {
            selection = selectionFactory.create(request);
        } catch (IOException e) {
            ConsoleOutput.error("Could not read last failed tests: " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        DiscoveredSuite suite = discovery.discover(selection, new Random(seed != null ? seed : 0L));
        for (TestPackage testPackage : suite.packageTree().packages()) {
            if (testPackage.allModules().isEmpty()) {
                continue;
            }
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + testPackage.name() + "|@"
                    + (testPackage.setupFixture() != null ? " (package setup)" : "")));
            testPackage.sequentialModules().stream().sorted(order()).forEach(this::printModule);
            testPackage.parallelModules().stream().sorted(order()).forEach(this::printModule);
        }
        suite.failedImports().forEach(ConsoleOutput::failedImport);
        ConsoleOutput.info(String.format("%d modules, %d tests, %d failed imports",
                suite.allModules().size(), suite.testCount(), suite.failedImports().size()));
        return suite.failedImports().isEmpty() ? CommandLine.ExitCode.OK : CommandLine.ExitCode.SOFTWARE;
    }

    private Comparator<TestModule> order() {
        return seed != null ? (a, b) -> 0 : Comparator.comparing(TestModule::name);
    }

    private void printModule(TestModule module) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) " + module.simpleName() + "|@ [" + module.runMode() + "]"
                + (module.tags().isEmpty() ? "" : " tags=" + module.tags())));
        for (TestCase test : module.allTests()) {
            String params = test.isParameterized() ? " x" + test.selectedIndices().length : "";
            System.out.println("    " + test.name() + params
                    + (test.tags().isEmpty() ? "" : " tags=" + test.tags()));
        }
    }
}
