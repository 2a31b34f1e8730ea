package com.autotune.evaluator;

import com.autotune.runlog.TestRecord;
import com.autotune.vartree.space.Valuation;

import java.util.List;

/**
 * Turns valuations into test records. Implementations own an {@link EvaluationLog}, never run the
 * same valuation twice and never throw for the failure of a single test.
 */
public interface EvaluationStrategy extends AutoCloseable {

    /**
     * Evaluates {@code valuations}, reusing logged results where possible.
     * Stops submitting new work once {@code cancellation} fires.
     *
     * @return one record per distinct valuation that was evaluated or found, in input order
     */
    List<TestRecord> evaluate(List<Valuation> valuations, CancellationToken cancellation);

    EvaluationLog getLog();

    /** Loads records from a previous run; see {@link EvaluationLog#seed}. */
    default void seed(List<TestRecord> prior) {
        getLog().seed(prior);
    }

    /** Number of valuations worth submitting at once. */
    int parallelism();

    /** Total tests expected, for progress reporting. */
    void planTests(long total);

    /** Forcibly stops running commands; in-flight evaluations are then abandoned. */
    void abort();

    @Override
    void close();
}
