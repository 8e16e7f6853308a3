package com.testament.core.engine;

import java.util.Random;

/**
 * Knobs of one suite run.
 *
 * @param maxWorkers    threads in the module pool, and again in the test pool
 * @param noConcurrency run every module and test one at a time on the calling thread
 * @param stopOnFail    stop the whole run at the first failed result
 * @param seed          seed for shuffling, or {@code null} for a fresh random order
 */
public record RunOptions(int maxWorkers, boolean noConcurrency, boolean stopOnFail, Long seed) {

    public static final int DEFAULT_MAX_WORKERS = 20;

    public RunOptions {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
    }

    public static RunOptions defaults() {
        return new RunOptions(DEFAULT_MAX_WORKERS, false, false, null);
    }

    public RunOptions withStopOnFail(boolean value) {
        return new RunOptions(maxWorkers, noConcurrency, value, seed);
    }

    public RunOptions withNoConcurrency(boolean value) {
        return new RunOptions(maxWorkers, value, stopOnFail, seed);
    }

    public Random random() {
        return seed != null ? new Random(seed) : new Random();
    }
}
