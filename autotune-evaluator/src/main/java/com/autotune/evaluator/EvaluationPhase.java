package com.autotune.evaluator;

/** Stage of a single evaluation, reported to {@link ProgressListener#onPhase}. */
public enum EvaluationPhase {
    COMPILE,
    TEST,
    ANALYSIS
}
