package com.testament.samples.selection;

import com.testament.api.Module;
import com.testament.api.RunMode;

@Module(runMode = RunMode.PARALLEL, description = "Three passing tests")
public class RunModule {

    public void testA() {
    }

    public void testB() {
    }

    public void testC() {
    }
}
