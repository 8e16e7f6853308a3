package com.testament.core.engine;

import com.testament.api.StopRunException;
import com.testament.core.logging.MdcContext;
import com.testament.core.model.DiscoveredSuite;
import com.testament.core.model.Fixture;
import com.testament.core.model.Result;
import com.testament.core.model.Status;
import com.testament.core.model.TestCase;
import com.testament.core.model.TestModule;
import com.testament.core.model.TestModuleResult;
import com.testament.core.model.TestPackage;
import com.testament.core.model.TestSuiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Walks the package tree of a discovered suite. Per package: setup once, sequential
 * modules in order, parallel modules on the module pool, sub-packages, teardown once.
 * <p>
 * A {@link StopRunException} unwinds every package (teardowns still run); the suite result
 * is sealed and reported either way.
 */
final class SuiteRun {

    private static final Logger log = LoggerFactory.getLogger(SuiteRun.class);

    private final String name;
    private final DiscoveredSuite suite;
    private final RunContext context;
    private final ExecutorService modulePool;
    private final TestSuiteResult result;

    SuiteRun(String name, DiscoveredSuite suite, RunContext context, ExecutorService modulePool) {
        this.name = name;
        this.suite = suite;
        this.context = context;
        this.modulePool = modulePool;
        this.result = new TestSuiteResult(name);
    }

    TestSuiteResult execute() {
        result.addFailedImports(suite.failedImports());
        context.reporter().onSuiteStart(name);
        try {
            for (TestPackage root : suite.packageTree().roots()) {
                runPackage(root);
            }
        } catch (StopRunException e) {
            log.warn("Run stopped: {}", e.getMessage());
        }
        result.end();
        context.reporter().onSuiteStop(result);
        return result;
    }

    private void runPackage(TestPackage node) {
        Logger packageLogger = LoggerFactory.getLogger("testament." + node.name());
        Result setup = null;
        StopRunException setupStop = null;
        if (node.claimSetup() && node.setupFixture() != null) {
            String fixtureName = fixtureName(node, node.setupFixture());
            try {
                setup = context.invoker().runFixture(fixtureName, node.setupFixture(), node.scope(), packageLogger);
            } catch (StopRunException e) {
                setup = new Result(fixtureName, Status.FAILED, "Stop run requested: " + e.getMessage()).end();
                String reason = "Stop requested by " + fixtureName + ": " + e.getMessage();
                context.stopSignal().raise(node.name(), reason);
                setupStop = new StopRunException(reason);
            }
        }
        boolean teardownStop;
        try {
            if (setup != null && !setup.passed()) {
                log.warn("Package setup of {} {}: {}", node.name(), setup.getStatus(), setup.getRecord());
                skipModules(node.allModules(), "Package setup failed for " + node.name() + ": " + setup.getRecord());
                if (setupStop != null) {
                    throw setupStop;
                }
            } else {
                for (TestModule module : node.sequentialModules()) {
                    recordModule(module);
                }
                runParallel(node.parallelModules());
                for (TestPackage child : node.subPackages()) {
                    runPackage(child);
                }
            }
        } finally {
            teardownStop = runTeardown(node, packageLogger);
        }
        if (teardownStop) {
            throw new StopRunException(context.stopSignal().reason());
        }
    }

    /** Runs the package teardown once; {@code true} when it asked to stop the run. */
    private boolean runTeardown(TestPackage node, Logger packageLogger) {
        if (!node.claimTeardown() || node.teardownFixture() == null) {
            return false;
        }
        String fixtureName = fixtureName(node, node.teardownFixture());
        try {
            Result teardown = context.invoker().runFixture(fixtureName, node.teardownFixture(), node.scope(),
                    packageLogger);
            if (!teardown.passed()) {
                log.error("Package teardown of {} {}: {}", node.name(), teardown.getStatus(), teardown.getRecord());
            }
            return false;
        } catch (StopRunException e) {
            log.warn("Package teardown of {} requested a stop: {}", node.name(), e.getMessage());
            context.stopSignal().raise(node.name(), "Stop requested by " + fixtureName + ": " + e.getMessage());
            return true;
        }
    }

    private void recordModule(TestModule module) {
        try {
            result.addModuleResult(new ModuleRun(module, context).execute());
        } catch (StopRunException e) {
            result.addModuleResult(e.partialResult());
            throw e;
        }
    }

    private void runParallel(List<TestModule> modules) {
        if (modules.isEmpty()) {
            return;
        }
        if (modulePool == null) {
            modules.forEach(this::recordModule);
            return;
        }
        var completion = new ExecutorCompletionService<TestModuleResult>(modulePool);
        var futures = new ArrayList<Future<TestModuleResult>>();
        for (TestModule module : modules) {
            futures.add(completion.submit(() -> runOnWorker(module)));
        }

        StopRunException stop = null;
        for (int i = 0; i < futures.size(); i++) {
            Future<TestModuleResult> done;
            try {
                done = completion.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(false));
                throw new StopRunException("Interrupted while waiting for parallel modules");
            }
            try {
                TestModuleResult moduleResult = done.get();
                if (context.stopSignal().isRaised()) {
                    log.debug("Discarding result of {} finished after the stop", moduleResult.getName());
                } else {
                    result.addModuleResult(moduleResult);
                }
            } catch (CancellationException e) {
                log.debug("Parallel module cancelled before it started: {}", context.stopSignal().reason());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StopRunException("Interrupted while waiting for parallel modules");
            } catch (ExecutionException e) {
                if (e.getCause() instanceof StopRunException moduleStop) {
                    if (stop == null && isOrigin(moduleStop)) {
                        stop = moduleStop;
                        result.addModuleResult(moduleStop.partialResult());
                        futures.forEach(f -> f.cancel(false));
                    }
                } else {
                    log.error("Module worker failed: {}", e.getCause().getMessage(), e.getCause());
                }
            }
        }
        if (stop != null) {
            throw stop;
        }
        if (context.stopSignal().isRaised()) {
            throw new StopRunException(context.stopSignal().reason());
        }
    }

    private boolean isOrigin(StopRunException stop) {
        TestModuleResult partial = stop.partialResult();
        return partial != null && partial.getName().equals(context.stopSignal().origin());
    }

    private TestModuleResult runOnWorker(TestModule module) {
        MdcContext.setModule(context.runId(), module.name());
        try {
            return new ModuleRun(module, context).execute();
        } finally {
            MdcContext.clear();
        }
    }

    private void skipModules(List<TestModule> modules, String record) {
        for (TestModule module : modules) {
            var moduleResult = new TestModuleResult(module);
            context.reporter().onModuleStart(module.name());
            for (TestCase test : module.allTests()) {
                var skipped = TestMethodRun.skippedResult(test, record);
                moduleResult.addTestResult(skipped);
                context.reporter().onTestDone(module.name(), skipped);
            }
            moduleResult.setRecord(record);
            moduleResult.end();
            context.reporter().onModuleDone(moduleResult);
            result.addModuleResult(moduleResult);
        }
    }

    private static String fixtureName(TestPackage node, Fixture fixture) {
        return node.name() + "." + fixture.name();
    }
}
