package com.testament.core.engine;

import com.testament.api.IgnoreTestException;
import com.testament.api.RunMode;
import com.testament.api.StopRunException;
import com.testament.core.logging.MdcContext;
import com.testament.core.model.Fixture;
import com.testament.core.model.Result;
import com.testament.core.model.Status;
import com.testament.core.model.TestCase;
import com.testament.core.model.TestGroup;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestModule;
import com.testament.core.model.TestModuleResult;
import com.testament.core.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Runs one module: {@code setup -> tests -> teardown}, then the same for each nested group.
 * <p>
 * Synchronous tests of a {@link RunMode#PARALLEL_TEST} module go to the test pool and
 * asynchronous ones are started on the module's task lane; both report into one completion
 * channel. Every other module runs its tests one after another on the calling thread.
 * <p>
 * When stop-on-fail sees a failure, or a test throws {@link StopRunException}, the run
 * raises the suite stop signal and throws a {@link StopRunException} carrying the sealed
 * partial result.
 */
final class ModuleRun {

    private static final Logger log = LoggerFactory.getLogger(ModuleRun.class);

    private final TestModule module;
    private final RunContext context;
    private final Reporter reporter;
    private final Logger testLogger;
    private final TestModuleResult result;
    private ExecutorService lane;
    private String fixtureStopRequest;

    ModuleRun(TestModule module, RunContext context) {
        this.module = module;
        this.context = context;
        this.reporter = context.reporter();
        this.testLogger = LoggerFactory.getLogger("testament." + module.name());
        this.result = new TestModuleResult(module);
    }

    TestModuleResult execute() {
        MdcContext.setModule(context.runId(), module.name());
        reporter.onModuleStart(module.name());
        lane = Executors.newSingleThreadExecutor(SuiteEngine.daemonThreads("testament-lane-" + module.simpleName() + "-"));
        try {
            runGroup(module.rootGroup(), true);
        } catch (StopRunException e) {
            result.end();
            reporter.onModuleDone(result);
            throw new StopRunException(e.getMessage(), result);
        } finally {
            lane.shutdownNow();
            MdcContext.clearModule();
        }
        result.end();
        reporter.onModuleDone(result);
        return result;
    }

    private void runGroup(TestGroup group, boolean root) {
        Result setup = null;
        if (group.setupFixture() != null) {
            setup = runFixture(group, group.setupFixture());
            result.addSetupResult(setup);
            if (root) {
                reporter.onSetupModuleDone(module.name(), setup);
            }
        }
        try {
            if (fixtureStopRequest != null) {
                throw stop("Stop requested by " + fixtureStopRequest);
            }
            if (setup != null && !setup.passed()) {
                String record = "Setup failed for " + group.name() + ": " + setup.getRecord();
                log.warn("{} - skipping {} tests", record, group.testCount());
                for (TestCase test : group.allTests()) {
                    record(TestMethodRun.skippedResult(test, record), test);
                }
                if (setup.failed() && context.options().stopOnFail()) {
                    throw stop("Stop on fail: setup of " + module.name() + "$" + group.name() + " failed");
                }
                return;
            }
            runTests(new ArrayList<>(group.tests()));
            for (TestGroup child : group.children()) {
                if (context.stopSignal().isRaised()) {
                    break;
                }
                runGroup(child, false);
            }
        } finally {
            if (group.teardownFixture() != null) {
                String stopBeforeTeardown = fixtureStopRequest;
                Result teardown = runFixture(group, group.teardownFixture());
                if (!teardown.passed()) {
                    log.error("Teardown of {} {}: {}", module.name(), teardown.getStatus(), teardown.getRecord());
                }
                result.addTeardownResult(teardown);
                if (root) {
                    reporter.onTeardownModuleDone(module.name(), teardown);
                }
                if (fixtureStopRequest != null && stopBeforeTeardown == null) {
                    throw stop("Stop requested by " + fixtureStopRequest);
                }
            }
        }
    }

    private Result runFixture(TestGroup group, Fixture fixture) {
        String name = group.name() + "." + fixture.name();
        try {
            return context.invoker().runFixture(name, fixture, module.scope(), testLogger);
        } catch (StopRunException e) {
            fixtureStopRequest = name + ": " + e.getMessage();
            return new Result(name, Status.FAILED, "Stop run requested: " + e.getMessage()).end();
        }
    }

    private void runTests(List<TestCase> tests) {
        if (tests.isEmpty()) {
            return;
        }
        if (module.runMode() == RunMode.PARALLEL_TEST && context.concurrent()) {
            runConcurrently(tests);
        } else {
            runInOrder(tests);
        }
    }

    private void runInOrder(List<TestCase> tests) {
        for (TestCase test : tests) {
            if (context.stopSignal().isRaised()) {
                log.debug("Run is stopping, {} not started", test.fullName());
                return;
            }
            var run = new TestMethodRun(test, module, context, testLogger);
            TestMethodResult testResult;
            try {
                CompletableFuture<TestMethodResult> future = test.isAsync()
                        ? CompletableFuture.supplyAsync(run::start, lane).thenCompose(f -> f)
                        : run.start();
                testResult = future.join();
            } catch (RuntimeException e) {
                Throwable cause = FunctionInvoker.unwrap(e);
                if (cause instanceof IgnoreTestException) {
                    log.debug("{} ignored: {}", test.fullName(), cause.getMessage());
                    continue;
                }
                if (cause instanceof StopRunException stop) {
                    record(stopRequested(test, stop), test);
                    throw stop("Stop requested by " + test.fullName() + ": " + stop.getMessage());
                }
                log.error("Unexpected error running {}: {}", test.fullName(), cause.getMessage());
                testResult = context.invoker().conclude(new TestMethodResult(test.name()), cause);
            }
            record(testResult, test);
            if (testResult.failed() && context.options().stopOnFail()) {
                throw stop("Stop on fail: " + test.fullName() + " failed");
            }
        }
    }

    /** One finished unit of work on the completion channel. */
    private record Completion(TestCase test, TestMethodResult result, Throwable error) {
    }

    /** A test handed to the pool or the lane. */
    private record Pending(TestMethodRun run, Future<?> handle, boolean async) {
    }

    private void runConcurrently(List<TestCase> tests) {
        BlockingQueue<Completion> channel = new LinkedBlockingQueue<>();
        Map<TestCase, Pending> pending = new LinkedHashMap<>();
        for (TestCase test : tests) {
            var run = new TestMethodRun(test, module, context, testLogger);
            Future<?> handle = test.isAsync()
                    ? lane.submit(() -> startOnLane(run, channel))
                    : context.testPool().submit(() -> runOnPool(run, channel));
            pending.put(test, new Pending(run, handle, test.isAsync()));
        }

        while (!pending.isEmpty()) {
            Completion completion = take(channel);
            if (pending.remove(completion.test()) == null) {
                continue;
            }
            Throwable error = completion.error();
            if (error instanceof IgnoreTestException) {
                log.debug("{} ignored: {}", completion.test().fullName(), error.getMessage());
                continue;
            }
            if (error instanceof StopRunException stop) {
                record(stopRequested(completion.test(), stop), completion.test());
                cancelPending(pending, channel);
                throw stop("Stop requested by " + completion.test().fullName() + ": " + stop.getMessage());
            }
            TestMethodResult testResult = error == null
                    ? completion.result()
                    : context.invoker().conclude(new TestMethodResult(completion.test().name()), error);
            record(testResult, completion.test());
            if (testResult.failed() && context.options().stopOnFail()) {
                cancelPending(pending, channel);
                throw stop("Stop on fail: " + completion.test().fullName() + " failed");
            }
        }
    }

    private void startOnLane(TestMethodRun run, BlockingQueue<Completion> channel) {
        CompletableFuture<TestMethodResult> future;
        try {
            future = run.start();
        } catch (RuntimeException e) {
            channel.add(new Completion(run.test(), null, FunctionInvoker.unwrap(e)));
            return;
        }
        future.whenComplete((testResult, error) -> channel.add(error == null
                ? new Completion(run.test(), testResult, null)
                : new Completion(run.test(), null, FunctionInvoker.unwrap(error))));
    }

    private void runOnPool(TestMethodRun run, BlockingQueue<Completion> channel) {
        MdcContext.setModule(context.runId(), module.name());
        try {
            channel.add(new Completion(run.test(), run.start().join(), null));
        } catch (RuntimeException e) {
            channel.add(new Completion(run.test(), null, FunctionInvoker.unwrap(e)));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Stops everything still pending after a failure. Pool work not yet started is
     * cancelled and pool work already running is left to finish unrecorded. Asynchronous
     * tests the lane has not started are recorded as cancelled; started ones are cancelled
     * and their outcome is awaited and recorded.
     */
    private void cancelPending(Map<TestCase, Pending> pending, BlockingQueue<Completion> channel) {
        context.stopSignal().raise(module.name(), "stop on fail in " + module.name());
        var awaiting = new ArrayList<TestCase>();
        for (Pending p : pending.values()) {
            if (!p.async()) {
                p.handle().cancel(false);
            } else if (p.run().cancelBeforeStart()) {
                p.handle().cancel(false);
                record(TestMethodResult.skipped(p.run().test().name(), FunctionInvoker.CANCELLED_RECORD,
                        p.run().test().tags()), p.run().test());
            } else {
                p.run().cancel();
                awaiting.add(p.run().test());
            }
        }
        while (!awaiting.isEmpty()) {
            Completion completion = take(channel);
            if (!awaiting.remove(completion.test())) {
                continue;
            }
            if (completion.result() != null) {
                record(completion.result(), completion.test());
            } else if (!(completion.error() instanceof IgnoreTestException)
                    && !(completion.error() instanceof StopRunException)) {
                record(context.invoker().conclude(new TestMethodResult(completion.test().name()), completion.error()),
                        completion.test());
            }
        }
        pending.clear();
    }

    private Completion take(BlockingQueue<Completion> channel) {
        try {
            return channel.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw stop("Interrupted while waiting for tests of " + module.name());
        }
    }

    private TestMethodResult stopRequested(TestCase test, StopRunException stop) {
        var failed = new TestMethodResult(test.name(), Status.FAILED, "Stop run requested: " + stop.getMessage());
        failed.describe(test);
        return failed.end();
    }

    private StopRunException stop(String reason) {
        context.stopSignal().raise(module.name(), reason);
        log.warn("{}", reason);
        return new StopRunException(reason, null);
    }

    private void record(TestMethodResult testResult, TestCase test) {
        testResult.describe(test);
        synchronized (result) {
            result.addTestResult(testResult);
        }
        if (test.isParameterized() && !testResult.getParameterizedResults().isEmpty()) {
            reporter.onParameterizedTestDone(module.name(), testResult);
        } else {
            reporter.onTestDone(module.name(), testResult);
        }
    }
}
