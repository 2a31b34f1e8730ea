package com.autotune.optimizer;

import com.autotune.evaluator.CancellationToken;
import com.autotune.evaluator.EvaluationStrategy;
import com.autotune.runlog.TestRecord;
import com.autotune.vartree.space.Valuation;

import java.util.List;

/**
 * Search driver over a configuration space. Implementations delegate every evaluation to an
 * {@link EvaluationStrategy} and only track the best result.
 */
public interface OptimizationStrategy {

    /** Must be called before {@link #run}. */
    void setDirection(Direction direction);

    /**
     * Runs the search until the space is exhausted or {@code cancellation} fires.
     * Never throws for failed tests; the outcome is in {@link OptimizationState#status()}.
     *
     * @throws IllegalStateException if no direction is set or a run is already in progress
     */
    OptimizationState run(CancellationToken cancellation);

    OptimizationState getState();

    /** Size of the configuration space, known before any test runs. */
    long testsRequired();

    /** Tests still to run, excluding valuations already in the log. */
    long testsRemaining();

    /**
     * One-variable-at-a-time sweep around {@code optimum}, evaluated by {@code sweepEvaluator}.
     *
     * @return records of the sweep in id order
     */
    List<TestRecord> runImportance(Valuation optimum, EvaluationStrategy sweepEvaluator, CancellationToken cancellation);
}
