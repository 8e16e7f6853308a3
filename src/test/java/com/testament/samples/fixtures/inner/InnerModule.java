package com.testament.samples.fixtures.inner;

import com.testament.api.Module;
import com.testament.api.RunMode;
import com.testament.core.scope.Scope;
import com.testament.samples.fixtures.Journal;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Module(runMode = RunMode.SEQUENTIAL)
public class InnerModule {

    public void testInheritsAndShadows(Scope scope) {
        assertEquals("outer-token", scope.get("token"));
        assertEquals("inner", scope.get("level"));
        Journal.add("inner.module.test");
    }
}
