package com.testament.samples.fixtures.inner;

import com.testament.api.Setup;
import com.testament.core.scope.Scope;
import com.testament.samples.fixtures.Journal;

public class PackageFixtures {

    @Setup
    public void openInner(Scope scope) {
        Journal.add("inner.package.setup");
        scope.set("level", "inner");
    }
}
