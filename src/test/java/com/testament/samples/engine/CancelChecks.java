package com.testament.samples.engine;

import com.testament.api.Module;
import com.testament.api.RunMode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.fail;

@Module(runMode = RunMode.PARALLEL_TEST)
public class CancelChecks {

    public void testFailsFast() {
        fail("fails immediately");
    }

    public CompletableFuture<Void> testSlowAsync() {
        return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(5, TimeUnit.SECONDS));
    }
}
