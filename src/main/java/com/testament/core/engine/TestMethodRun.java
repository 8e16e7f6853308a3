package com.testament.core.engine;

import com.testament.core.logging.MdcContext;
import com.testament.core.model.Fixture;
import com.testament.core.model.Result;
import com.testament.core.model.Status;
import com.testament.core.model.TestCase;
import com.testament.core.model.TestMethodResult;
import com.testament.core.model.TestModule;
import org.slf4j.Logger;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One test from setup to teardown: {@code setupTest -> run -> teardownTest}.
 * <p>
 * {@link #start()} runs on the calling thread until the body suspends. For a synchronous
 * test the returned future is already complete; for an asynchronous test it completes
 * when the body's stage does and the test teardown ran.
 */
final class TestMethodRun {

    private final TestCase test;
    private final TestModule module;
    private final RunContext context;
    private final Logger logger;

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean cancelled;
    private volatile CompletableFuture<?> inFlight;

    TestMethodRun(TestCase test, TestModule module, RunContext context, Logger logger) {
        this.test = test;
        this.module = module;
        this.context = context;
        this.logger = logger;
    }

    TestCase test() {
        return test;
    }

    /**
     * Claims a run that has not started yet so it never will.
     *
     * @return {@code false} when the run already started; cancel it with {@link #cancel()}
     */
    boolean cancelBeforeStart() {
        if (started.compareAndSet(false, true)) {
            cancelled = true;
            return true;
        }
        return false;
    }

    /** Cancels an in-flight body; tuples not yet started are recorded as cancelled. */
    void cancel() {
        cancelled = true;
        CompletableFuture<?> body = inFlight;
        if (body != null) {
            body.cancel(false);
        }
    }

    CompletableFuture<TestMethodResult> start() {
        if (!started.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(
                    TestMethodResult.skipped(test.name(), FunctionInvoker.CANCELLED_RECORD, test.tags()));
        }
        MdcContext.setTest(context.runId(), module.name(), test.name());
        try {
            Result setup = runSetupTest();
            if (setup != null && !setup.passed()) {
                TestMethodResult skipped = skippedResult(test, "Setup test failed: " + setup.getRecord());
                skipped.setSetupResult(setup);
                runTeardownTest(skipped);
                return CompletableFuture.completedFuture(skipped);
            }
            CompletableFuture<TestMethodResult> body;
            try {
                body = test.isParameterized() ? runParameterized() : invokeOnce(test.name(), null);
            } catch (RuntimeException e) {
                runTeardownTest(null);
                throw e;
            }
            return body.handle((result, error) -> {
                if (result != null) {
                    result.setSetupResult(setup);
                }
                runTeardownTest(result);
                if (error != null) {
                    throw error instanceof RuntimeException runtime ? runtime : new IllegalStateException(error);
                }
                return result;
            });
        } finally {
            MdcContext.clearTest();
        }
    }

    private CompletableFuture<TestMethodResult> runParameterized() {
        var parent = new TestMethodResult(test.name());
        parent.describe(test);
        int[] indices = test.selectedIndices();
        if (indices.length == 0) {
            parent.setRecord("No parameter sets selected by range " + test.parameterRange());
            return CompletableFuture.completedFuture(parent.end(Status.SKIPPED));
        }
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int index : indices) {
            chain = chain.thenCompose(v -> runTuple(index))
                    .thenAccept(sub -> {
                        parent.addParameterizedResult(sub);
                        context.reporter().onTestDone(module.name(), sub);
                    });
        }
        return chain.thenApply(v -> parent.endParameterized(indices.length));
    }

    private CompletableFuture<TestMethodResult> runTuple(int index) {
        Object[] tuple = test.parameters().get(index);
        String name = test.name() + "[" + index + "]";
        if (test.firstArgIsName() && tuple.length > 0) {
            name = name + " " + tuple[0];
            tuple = Arrays.copyOfRange(tuple, 1, tuple.length);
        }
        return invokeOnce(name, tuple);
    }

    private CompletableFuture<TestMethodResult> invokeOnce(String name, Object[] tuple) {
        if (cancelled) {
            return CompletableFuture.completedFuture(
                    TestMethodResult.skipped(name, FunctionInvoker.CANCELLED_RECORD, test.tags()));
        }
        var result = new TestMethodResult(name);
        result.describe(test);
        FunctionInvoker invoker = context.invoker();
        if (!test.isAsync()) {
            try {
                invoker.invokeTest(test, tuple, module.scope(), logger);
                result.end(Status.PASSED);
            } catch (Throwable t) {
                invoker.conclude(result, t);
            }
            return CompletableFuture.completedFuture(result);
        }
        CompletableFuture<Object> body = invoker.startAsync(test, tuple, module.scope(), logger);
        inFlight = body;
        if (cancelled) {
            body.cancel(false);
        }
        return body.handle((value, error) -> {
            if (error == null) {
                return result.end(Status.PASSED);
            }
            return invoker.conclude(result, error);
        });
    }

    private Result runSetupTest() {
        Fixture fixture = test.setupFixture();
        if (fixture == null) {
            return null;
        }
        Result setup = context.invoker().runFixture(test.name() + "." + fixture.name(), fixture, module.scope(), logger);
        context.reporter().onSetupTestDone(module.name(), test.name(), setup);
        return setup;
    }

    private void runTeardownTest(TestMethodResult result) {
        Fixture fixture = test.teardownFixture();
        if (fixture == null) {
            return;
        }
        Result teardown = context.invoker().runFixture(test.name() + "." + fixture.name(), fixture, module.scope(), logger);
        if (!teardown.passed()) {
            logger.error("Teardown of {} {}: {}", test.fullName(), teardown.getStatus(), teardown.getRecord());
        }
        if (result != null) {
            result.setTeardownResult(teardown);
        }
        context.reporter().onTeardownTestDone(module.name(), test.name(), teardown);
    }

    /** A skipped result for {@code test}, with one skipped variant per selected tuple. */
    static TestMethodResult skippedResult(TestCase test, String record) {
        var result = new TestMethodResult(test.name(), Status.SKIPPED, record);
        result.describe(test);
        if (test.isParameterized()) {
            for (int index : test.selectedIndices()) {
                result.addParameterizedResult(
                        TestMethodResult.skipped(test.name() + "[" + index + "]", record, test.tags()));
            }
        }
        return result.end();
    }
}
