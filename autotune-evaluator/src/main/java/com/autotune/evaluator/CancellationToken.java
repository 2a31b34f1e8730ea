package com.autotune.evaluator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Checked between submissions; never interrupts a running command.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Token that is never cancelled. */
    public static CancellationToken none() {
        return new CancellationToken();
    }
}
