package com.autotune.evaluator;

import com.autotune.runlog.TestRecord;

/**
 * One-way progress callbacks. Implementations must not block; they may be called from worker threads.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
    };

    /** After each record is appended to the log, in id order. {@code total} is 0 when unknown. */
    default void onProgress(int completed, long total, TestRecord record) {
    }

    /** Percentage (0..100) of the given phase of test {@code testId}. */
    default void onPhase(int testId, EvaluationPhase phase, int percent) {
    }
}
