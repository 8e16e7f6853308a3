package com.testament.samples.engine;

import com.testament.api.Module;
import com.testament.api.RunMode;

import static org.junit.jupiter.api.Assertions.fail;

@Module(runMode = RunMode.PARALLEL)
public class FailsLaterChecks {

    public void testFailsAfterAMoment() throws InterruptedException {
        Thread.sleep(100);
        fail("failed while a sibling module was running");
    }
}
