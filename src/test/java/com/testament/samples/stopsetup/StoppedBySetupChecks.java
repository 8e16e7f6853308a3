package com.testament.samples.stopsetup;

import com.testament.api.Module;
import com.testament.api.RunMode;

import static org.junit.jupiter.api.Assertions.fail;

@Module(runMode = RunMode.SEQUENTIAL)
public class StoppedBySetupChecks {

    public void testNeverRuns() {
        fail("package setup stopped the run");
    }
}
