package com.autotune.optimizer;

import com.autotune.runlog.TestRecord;
import com.autotune.vartree.space.Valuation;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Snapshot of an optimization run.
 *
 * @param direction     comparison used for the best score; null before it is set
 * @param bestValuation best valuation so far; null until a test succeeds
 * @param bestScore     score of {@code bestValuation}; NaN until a test succeeds
 * @param records       log in id order, including seeded records
 * @param failures      failed records in id order
 * @param totalRequired size of the configuration space
 * @param status        lifecycle state
 */
public record OptimizationState(Direction direction, Valuation bestValuation, double bestScore,
                                List<TestRecord> records, List<TestRecord> failures, long totalRequired,
                                OptimizerStatus status) {

    public OptimizationState {
        records = List.copyOf(records);
        failures = List.copyOf(failures);
    }

    public boolean hasOptimum() {
        return bestValuation != null;
    }

    public OptionalDouble optimumScore() {
        return bestValuation != null ? OptionalDouble.of(bestScore) : OptionalDouble.empty();
    }
}
