package com.autotune.runner;

import com.autotune.optimizer.OptimizerStatus;
import com.autotune.runlog.TestRecord;
import com.autotune.vartree.space.Valuation;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Outcome of one tuning session.
 *
 * @param status            terminal optimizer status
 * @param optimum           best valuation; null when none succeeded
 * @param optimumScore      score of {@code optimum}
 * @param testsRun          tests executed in this session, resumed records excluded
 * @param resumedTests      records taken from the resume log
 * @param elapsed           time spent in the optimization run
 * @param additionalTests   importance-sweep tests that were not already in the main log
 * @param additionalElapsed time spent in the importance sweep
 * @param failures          failed records of the main log, in id order
 */
public record RunReport(OptimizerStatus status, Valuation optimum, OptionalDouble optimumScore, int testsRun,
                        int resumedTests, Duration elapsed, int additionalTests, Duration additionalElapsed,
                        List<TestRecord> failures) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIGURATION_ERROR = 1;
    public static final int EXIT_INSUFFICIENT_RESULTS = 2;

    public RunReport {
        failures = List.copyOf(failures);
    }

    /** 0 on success or cancellation, 2 when there were not enough successful tests. */
    public int exitCode() {
        return status == OptimizerStatus.INSUFFICIENT_RESULTS ? EXIT_INSUFFICIENT_RESULTS : EXIT_OK;
    }

    /** {@code 1m5.25s} style. */
    static String formatDuration(Duration d) {
        long millis = d.toMillis();
        long minutes = millis / 60_000;
        double seconds = (millis % 60_000) / 1000.0;
        return String.format(Locale.ROOT, "%dm%.2fs", minutes, seconds);
    }
}
