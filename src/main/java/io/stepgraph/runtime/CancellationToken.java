package io.stepgraph.runtime;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal. The executor only looks at it between steps.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
