package com.testament.samples.setupfail;

import com.testament.api.Module;
import com.testament.api.RunMode;

@Module(runMode = RunMode.SEQUENTIAL)
public class AlsoSkippedChecks {

    public void testNeverRuns() {
        throw new IllegalStateException("must not run after a failed package setup");
    }
}
