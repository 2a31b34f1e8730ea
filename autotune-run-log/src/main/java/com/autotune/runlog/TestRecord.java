package com.autotune.runlog;

import com.autotune.vartree.space.Valuation;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable record of one evaluated valuation.
 * Raw scores hold one value per surviving test repetition; the aggregate is absent on failure.
 */
public final class TestRecord {

    private final int testId;
    private final Valuation valuation;
    private final List<Double> rawScores;
    private final Double aggregateScore;
    private final Outcome outcome;

    private TestRecord(int testId, Valuation valuation, List<Double> rawScores, Double aggregateScore, Outcome outcome) {
        if (testId < 1) {
            throw new IllegalArgumentException("Test ids start at 1: " + testId);
        }
        this.testId = testId;
        this.valuation = Objects.requireNonNull(valuation, "valuation");
        this.rawScores = rawScores != null ? List.copyOf(rawScores) : List.of();
        this.aggregateScore = aggregateScore;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
    }

    public static TestRecord success(int testId, Valuation valuation, List<Double> rawScores, double aggregateScore) {
        return new TestRecord(testId, valuation, rawScores, aggregateScore, Outcome.success());
    }

    public static TestRecord failure(int testId, Valuation valuation, List<Double> rawScores, String reason) {
        return new TestRecord(testId, valuation, rawScores, null, Outcome.failure(reason));
    }

    public int getTestId() {
        return testId;
    }

    public Valuation getValuation() {
        return valuation;
    }

    public List<Double> getRawScores() {
        return rawScores;
    }

    public OptionalDouble getAggregateScore() {
        return aggregateScore != null ? OptionalDouble.of(aggregateScore) : OptionalDouble.empty();
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    /** Same result under another id, used when a record is copied into a second log. */
    public TestRecord withTestId(int newId) {
        return newId == testId ? this : new TestRecord(newId, valuation, rawScores, aggregateScore, outcome);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TestRecord that = (TestRecord) o;
        return testId == that.testId && valuation.equals(that.valuation) && rawScores.equals(that.rawScores)
                && Objects.equals(aggregateScore, that.aggregateScore) && outcome.equals(that.outcome);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testId, valuation, rawScores, aggregateScore, outcome);
    }

    @Override
    public String toString() {
        return "TestRecord{" + testId + ", " + valuation + ", " + (aggregateScore != null ? aggregateScore : outcome) + "}";
    }
}
