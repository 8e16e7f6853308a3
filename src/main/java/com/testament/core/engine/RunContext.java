package com.testament.core.engine;

import com.testament.core.report.Reporter;

import java.util.concurrent.ExecutorService;

/**
 * What every module and test run of one suite run shares.
 *
 * @param testPool pool for the synchronous tests of parallel-test modules, {@code null}
 *                 when the run has no concurrency
 */
record RunContext(String runId, RunOptions options, Reporter reporter, FunctionInvoker invoker,
                  StopSignal stopSignal, ExecutorService testPool) {

    boolean concurrent() {
        return testPool != null && !options.noConcurrency();
    }
}
