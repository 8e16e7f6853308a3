package com.testament.api;

import com.testament.core.model.TestModuleResult;

/**
 * Unwinds the current module and then the whole suite run.
 * <p>
 * Raised by the engine when stop-on-fail sees the first failure, and may be thrown by test
 * code to end the run early. When the engine raises it, {@link #partialResult()} carries
 * the sealed result of the module that stopped so the suite can still record it.
 */
public class StopRunException extends RuntimeException {

    private final transient TestModuleResult partialResult;

    public StopRunException(String message) {
        this(message, null);
    }

    public StopRunException(String message, TestModuleResult partialResult) {
        super(message);
        this.partialResult = partialResult;
    }

    public TestModuleResult partialResult() {
        return partialResult;
    }
}
