package com.testament.api;

/**
 * How a test module is scheduled relative to its siblings.
 * <p>
 * SEQUENTIAL: runs alone, in discovery order, before the package's parallel modules.
 * PARALLEL: runs concurrently with other parallel modules; its tests run one after another.
 * PARALLEL_TEST: like PARALLEL, and its tests also run concurrently with each other.
 */
public enum RunMode {
    SEQUENTIAL,
    PARALLEL,
    PARALLEL_TEST;

    public boolean isParallel() {
        return this != SEQUENTIAL;
    }
}
