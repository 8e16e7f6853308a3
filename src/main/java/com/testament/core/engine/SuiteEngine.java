package com.testament.core.engine;

import com.testament.core.logging.MdcContext;
import com.testament.core.model.DiscoveredSuite;
import com.testament.core.model.TestSuiteResult;
import com.testament.core.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a discovered suite and returns its sealed result.
 * <p>
 * Each run gets two fixed pools of {@code maxWorkers} threads: one for parallel modules and
 * one for the tests of parallel-test modules. Keeping them apart means a module worker
 * waiting on its tests never holds a thread those tests need. With {@code noConcurrency}
 * no pool is created and everything runs on the calling thread.
 */
@Service
public class SuiteEngine {

    private static final Logger log = LoggerFactory.getLogger(SuiteEngine.class);

    private final FunctionInvoker invoker;

    public SuiteEngine() {
        this(new FunctionInvoker());
    }

    @Autowired
    public SuiteEngine(TestParametersProvider parametersProvider) {
        this(new FunctionInvoker(parametersProvider));
    }

    SuiteEngine(FunctionInvoker invoker) {
        this.invoker = invoker;
    }

    public TestSuiteResult run(String suiteName, DiscoveredSuite suite, RunOptions options, Reporter reporter) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        ExecutorService modulePool = null;
        ExecutorService testPool = null;
        if (!options.noConcurrency()) {
            modulePool = Executors.newFixedThreadPool(options.maxWorkers(), daemonThreads("testament-module-"));
            testPool = Executors.newFixedThreadPool(options.maxWorkers(), daemonThreads("testament-test-"));
        }
        log.info("Running suite {} [{}]: {} modules, {} tests, maxWorkers={}, noConcurrency={}, stopOnFail={}",
                suiteName, runId, suite.allModules().size(), suite.testCount(), options.maxWorkers(),
                options.noConcurrency(), options.stopOnFail());
        try {
            var context = new RunContext(runId, options, reporter, invoker, new StopSignal(), testPool);
            return new SuiteRun(suiteName, suite, context, modulePool).execute();
        } finally {
            if (modulePool != null) {
                modulePool.shutdown();
            }
            if (testPool != null) {
                testPool.shutdown();
            }
            MdcContext.clear();
        }
    }

    static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
