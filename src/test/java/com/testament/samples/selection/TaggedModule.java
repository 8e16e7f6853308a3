package com.testament.samples.selection;

import com.testament.api.Module;
import com.testament.api.RunMode;
import com.testament.api.Tags;

@Module(runMode = RunMode.PARALLEL_TEST, tags = "smoke")
public class TaggedModule {

    @Tags("fast")
    public void testFast() {
    }

    @Tags({"slow", "db"})
    public void testSlow() {
    }

    public void testUntagged() {
    }
}
