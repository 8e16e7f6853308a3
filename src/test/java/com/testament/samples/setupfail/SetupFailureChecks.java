package com.testament.samples.setupfail;

import com.testament.api.Module;
import com.testament.api.Parameterize;
import com.testament.api.RunMode;

import java.util.List;

@Module(runMode = RunMode.PARALLEL)
public class SetupFailureChecks {

    public static List<Object> values() {
        return List.of(1, 2, 3);
    }

    public void testNeverRuns() {
        throw new IllegalStateException("must not run after a failed package setup");
    }

    @Parameterize("values")
    public void testNeverRunsEither(int value) {
        throw new IllegalStateException("must not run after a failed package setup");
    }
}
