package com.testament.core.engine;

import com.testament.api.IgnoreTestException;
import com.testament.api.SkipTestException;
import com.testament.api.StopRunException;
import com.testament.core.logging.MdcContext;
import com.testament.core.model.Fixture;
import com.testament.core.model.Result;
import com.testament.core.model.Status;
import com.testament.core.model.TestCase;
import com.testament.core.scope.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Calls test and fixture methods reflectively and turns whatever they throw into a result.
 * <ul>
 *   <li>{@link AssertionError}: failed, with the message or the failing frame</li>
 *   <li>{@link SkipTestException}: skipped</li>
 *   <li>{@link CancellationException}: skipped, the run is stopping</li>
 *   <li>{@link IgnoreTestException}, {@link StopRunException}: rethrown</li>
 *   <li>anything else: failed, stack trace at DEBUG</li>
 * </ul>
 */
public class FunctionInvoker {

    private static final Logger log = LoggerFactory.getLogger(FunctionInvoker.class);

    public static final String CANCELLED_RECORD = "Cancelled: stop on fail";
    public static final String EXCEPTION_RECORD = "Encountered an exception: ";

    private final TestParametersProvider parametersProvider;

    public FunctionInvoker() {
        this(TestParametersProvider.NONE);
    }

    public FunctionInvoker(TestParametersProvider parametersProvider) {
        this.parametersProvider = parametersProvider;
    }

    /**
     * Runs a fixture to completion, waiting for it when it returns a completion stage.
     * An ignore request from a fixture is recorded as a skip.
     */
    public Result runFixture(String resultName, Fixture fixture, Scope scope, Logger logger) {
        var result = new Result(resultName);
        MdcContext.setFixture(resultName);
        try {
            Object returned = call(fixture.method(), fixture.target(), null, scope, logger);
            if (returned instanceof CompletionStage<?> stage) {
                stage.toCompletableFuture().join();
            }
            result.end(Status.PASSED);
        } catch (IgnoreTestException e) {
            result.setRecord(e.getMessage());
            result.end(Status.SKIPPED);
        } catch (Throwable t) {
            conclude(result, t);
        } finally {
            MdcContext.clearFixture();
        }
        return result;
    }

    /** Runs a synchronous test body; throws what the body throws. */
    public void invokeTest(TestCase test, Object[] tuple, Scope scope, Logger logger) throws Throwable {
        Object returned = call(test.method(), test.target(), tuple, scope, logger);
        if (returned instanceof CompletionStage<?> stage) {
            stage.toCompletableFuture().join();
        }
    }

    /**
     * Starts an asynchronous test body. A body that throws before returning its stage, or
     * returns {@code null}, yields an already-completed future.
     */
    public CompletableFuture<Object> startAsync(TestCase test, Object[] tuple, Scope scope, Logger logger) {
        try {
            Object returned = call(test.method(), test.target(), tuple, scope, logger);
            if (returned == null) {
                return CompletableFuture.completedFuture(null);
            }
            @SuppressWarnings("unchecked")
            var stage = (CompletionStage<Object>) returned;
            return stage.toCompletableFuture();
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    /**
     * Seals {@code result} from a thrown error.
     *
     * @throws IgnoreTestException if the unit asked to be dropped from the results
     * @throws StopRunException    if the unit asked to stop the run
     */
    public <R extends Result> R conclude(R result, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof IgnoreTestException ignore) {
            throw ignore;
        }
        if (cause instanceof StopRunException stop) {
            throw stop;
        }
        if (cause instanceof AssertionError assertion) {
            result.setRecord(assertionRecord(assertion));
            result.end(Status.FAILED);
        } else if (cause instanceof SkipTestException skip) {
            result.setRecord(skip.getMessage());
            result.end(Status.SKIPPED);
        } else if (cause instanceof CancellationException) {
            result.setRecord(CANCELLED_RECORD);
            result.end(Status.SKIPPED);
        } else {
            result.setRecord(EXCEPTION_RECORD + cause);
            log.debug("{} raised", result.getName(), cause);
            result.end(Status.FAILED);
        }
        return result;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof InvocationTargetException
                || current instanceof CompletionException
                || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private Object call(Method method, Object target, Object[] tuple, Scope scope, Logger logger)
            throws Throwable {
        List<Object> supplied = parametersProvider.parameters(logger, scope);
        Object[] args = ArgumentResolver.resolve(method, tuple, scope, logger, supplied != null ? supplied : List.of());
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause() != null ? e.getCause() : e;
        }
    }

    private static String assertionRecord(AssertionError error) {
        String message = error.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        for (StackTraceElement frame : error.getStackTrace()) {
            String className = frame.getClassName();
            if (!className.startsWith("java.") && !className.startsWith("jdk.")
                    && !className.startsWith("org.junit.") && !className.startsWith("org.opentest4j.")) {
                return "Assertion failed at " + frame;
            }
        }
        return "Assertion failed";
    }
}
