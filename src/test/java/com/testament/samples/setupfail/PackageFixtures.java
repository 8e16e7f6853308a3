package com.testament.samples.setupfail;

import com.testament.api.Setup;
import com.testament.api.Teardown;

import java.util.concurrent.atomic.AtomicInteger;

public class PackageFixtures {

    public static final AtomicInteger TEARDOWNS = new AtomicInteger();

    @Setup
    public static void connect() {
        throw new IllegalStateException("database unreachable");
    }

    @Teardown
    public static void disconnect() {
        TEARDOWNS.incrementAndGet();
    }
}
