package com.testament.samples.stopsetup;

import com.testament.api.Setup;
import com.testament.api.StopRunException;
import com.testament.api.Teardown;

import java.util.concurrent.atomic.AtomicInteger;

public class PackageFixtures {

    public static final AtomicInteger TEARDOWNS = new AtomicInteger();

    @Setup
    public static void provision() {
        throw new StopRunException("environment is gone");
    }

    @Teardown
    public static void release() {
        TEARDOWNS.incrementAndGet();
    }
}
