package com.testament.samples.fixtures;

import com.testament.api.Module;
import com.testament.api.RunMode;
import com.testament.core.scope.Scope;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Module(runMode = RunMode.PARALLEL)
public class SecondFixtureModule {

    public void testSeesPackageToken(Scope scope) {
        assertEquals("outer-token", scope.get("token"));
        Journal.add("second.test");
    }
}
