package com.autotune.optimizer;

/**
 * Lifecycle of an optimization run: {@code IDLE -> RUNNING -> SUCCEEDED | INSUFFICIENT_RESULTS | CANCELLED}.
 */
public enum OptimizerStatus {
    IDLE,
    RUNNING,
    /** Enumeration completed with at least one success and an acceptable failure ratio. */
    SUCCEEDED,
    /** Enumeration completed but too many tests failed to trust the optimum. */
    INSUFFICIENT_RESULTS,
    /** Stopped by the cancellation token; the log so far is kept for a later resume. */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == INSUFFICIENT_RESULTS || this == CANCELLED;
    }
}
