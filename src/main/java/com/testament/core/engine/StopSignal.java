package com.testament.core.engine;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Suite-wide stop flag. The first module to raise it owns the stop; everyone else only
 * observes it and stops starting new work.
 */
public final class StopSignal {

    private final AtomicReference<String> origin = new AtomicReference<>();
    private volatile String reason = "";

    /** @return {@code true} if this call raised the signal, {@code false} if it was already raised */
    public boolean raise(String moduleName, String reason) {
        if (origin.compareAndSet(null, moduleName)) {
            this.reason = reason;
            return true;
        }
        return false;
    }

    public boolean isRaised() {
        return origin.get() != null;
    }

    /** Module that raised the signal, or {@code null}. */
    public String origin() {
        return origin.get();
    }

    public String reason() {
        return reason;
    }
}
