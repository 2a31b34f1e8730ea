package com.autotune.config;

import java.time.Duration;
import java.util.List;

/**
 * Resolved execution options after defaults and environment overrides.
 *
 * @param workers         parallel evaluations; 1 runs everything on the calling thread
 * @param commandTimeout  per-command limit; zero for none
 * @param maxFailureRatio largest failures/records ratio for a successful run
 * @param cancelGrace     time in-flight tests get after cancellation before being killed
 * @param evaluator       evaluation strategy name
 * @param optimizer       optimization strategy name
 * @param shell           shell program and arguments commands are passed to
 */
public record ExecutionSettings(int workers, Duration commandTimeout, double maxFailureRatio, Duration cancelGrace,
                                String evaluator, String optimizer, List<String> shell) {

    public static final int DEFAULT_WORKERS = 1;
    public static final double DEFAULT_MAX_FAILURE_RATIO = 0.5;
    public static final Duration DEFAULT_CANCEL_GRACE = Duration.ofSeconds(30);
    public static final String DEFAULT_EVALUATOR = "command";
    public static final String DEFAULT_OPTIMIZER = "exhaustive";
    public static final List<String> DEFAULT_SHELL = List.of("sh", "-c");

    public ExecutionSettings {
        shell = List.copyOf(shell);
    }

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(DEFAULT_WORKERS, Duration.ZERO, DEFAULT_MAX_FAILURE_RATIO, DEFAULT_CANCEL_GRACE,
                DEFAULT_EVALUATOR, DEFAULT_OPTIMIZER, DEFAULT_SHELL);
    }
}
