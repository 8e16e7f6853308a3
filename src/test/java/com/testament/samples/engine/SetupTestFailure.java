package com.testament.samples.engine;

import com.testament.api.Module;
import com.testament.api.Parameterize;
import com.testament.api.RunMode;
import com.testament.api.SetupTest;
import com.testament.api.TeardownTest;
import com.testament.samples.fixtures.Journal;

import java.util.List;

@Module(runMode = RunMode.SEQUENTIAL)
public class SetupTestFailure {

    public static List<Integer> sizes() {
        return List.of(1, 2, 3);
    }

    @SetupTest
    public void openSession() {
        throw new IllegalStateException("no session");
    }

    @TeardownTest
    public void closeSession() {
        Journal.add("teardownTest");
    }

    public void testPlain() {
        Journal.add("body");
    }

    @Parameterize("sizes")
    public void testSized(int size) {
        Journal.add("body");
    }
}
