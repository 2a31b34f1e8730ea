package com.autotune.optimizer;

import com.autotune.evaluator.CancellationToken;
import com.autotune.evaluator.EvaluationLog;
import com.autotune.evaluator.EvaluationStrategy;
import com.autotune.runlog.TestRecord;
import com.autotune.vartree.space.ConfigurationSpace;
import com.autotune.vartree.space.Valuation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exhaustive search: every valuation of the space is evaluated once, in enumeration order, in
 * batches of the evaluator's parallelism. Valuations already in the evaluator's log (resume) are
 * skipped. The best score is updated after every successful record in id order; ties keep the
 * earlier valuation.
 */
public final class ExhaustiveOptimizer implements OptimizationStrategy {

    private static final Logger log = LoggerFactory.getLogger(ExhaustiveOptimizer.class);

    /** Default largest share of failed tests for a run to count as succeeded. */
    public static final double DEFAULT_MAX_FAILURE_RATIO = 0.5;

    private final ConfigurationSpace space;
    private final EvaluationStrategy evaluator;
    private final double maxFailureRatio;

    private volatile Direction direction;
    private volatile OptimizerStatus status = OptimizerStatus.IDLE;
    private Valuation bestValuation;
    private double bestScore = Double.NaN;
    private long required = -1;

    public ExhaustiveOptimizer(ConfigurationSpace space, EvaluationStrategy evaluator) {
        this(space, evaluator, DEFAULT_MAX_FAILURE_RATIO);
    }

    /**
     * @param maxFailureRatio largest failures/records ratio, in [0, 1], for {@link OptimizerStatus#SUCCEEDED}
     */
    public ExhaustiveOptimizer(ConfigurationSpace space, EvaluationStrategy evaluator, double maxFailureRatio) {
        if (!(maxFailureRatio >= 0.0 && maxFailureRatio <= 1.0)) {
            throw new IllegalArgumentException("maxFailureRatio must be in [0, 1], got " + maxFailureRatio);
        }
        this.space = Objects.requireNonNull(space, "space");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.maxFailureRatio = maxFailureRatio;
    }

    @Override
    public void setDirection(Direction direction) {
        if (status == OptimizerStatus.RUNNING) {
            throw new IllegalStateException("Cannot change direction while running");
        }
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public Direction getDirection() {
        return direction;
    }

    public EvaluationStrategy getEvaluator() {
        return evaluator;
    }

    @Override
    public long testsRequired() {
        if (required < 0) required = space.count();
        return required;
    }

    @Override
    public long testsRemaining() {
        return Math.max(0, testsRequired() - evaluator.getLog().size());
    }

    @Override
    public OptimizationState run(CancellationToken cancellation) {
        if (direction == null) {
            throw new IllegalStateException("setDirection must be called before run");
        }
        synchronized (this) {
            if (status == OptimizerStatus.RUNNING) {
                throw new IllegalStateException("Optimizer is already running");
            }
            status = OptimizerStatus.RUNNING;
        }
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        EvaluationLog evaluationLog = evaluator.getLog();
        evaluator.planTests(testsRequired());
        log.info("Optimizer run | direction={} | required={} | alreadyLogged={} | workers={}",
                direction, testsRequired(), evaluationLog.size(), evaluator.parallelism());

        for (TestRecord prior : evaluationLog.getRecords()) {
            consider(prior);
        }

        boolean exhausted = true;
        int batchSize = Math.max(1, evaluator.parallelism());
        List<Valuation> batch = new ArrayList<>(batchSize);
        for (Valuation valuation : space.enumerate()) {
            if (token.isCancelled()) {
                exhausted = false;
                break;
            }
            if (evaluationLog.contains(valuation)) continue;
            batch.add(valuation);
            if (batch.size() >= batchSize) {
                exhausted &= submit(batch, token);
                batch.clear();
            }
        }
        if (!batch.isEmpty() && exhausted && !token.isCancelled()) {
            exhausted = submit(batch, token);
        } else if (!batch.isEmpty()) {
            exhausted = false;
        }

        OptimizerStatus terminal = terminalStatus(exhausted, evaluationLog);
        synchronized (this) {
            status = terminal;
        }
        log.info("Optimizer finished | status={} | records={} | failures={} | best={} | score={}",
                terminal, evaluationLog.size(), evaluationLog.failureCount(), bestValuation, bestScore);
        return getState();
    }

    /** Evaluates one batch; false if some valuation got no record (cancelled or abandoned). */
    private boolean submit(List<Valuation> batch, CancellationToken token) {
        List<TestRecord> records = evaluator.evaluate(List.copyOf(batch), token);
        for (TestRecord record : records) {
            consider(record);
        }
        return records.size() == batch.size();
    }

    private synchronized void consider(TestRecord record) {
        if (!record.isSuccess() || record.getAggregateScore().isEmpty()) return;
        double score = record.getAggregateScore().getAsDouble();
        if (bestValuation == null || direction.improves(score, bestScore)) {
            bestValuation = record.getValuation();
            bestScore = score;
            log.debug("New best | testId={} | score={}", record.getTestId(), score);
        }
    }

    private OptimizerStatus terminalStatus(boolean exhausted, EvaluationLog evaluationLog) {
        if (!exhausted) return OptimizerStatus.CANCELLED;
        int records = evaluationLog.size();
        int failures = evaluationLog.failureCount();
        if (bestValuation == null || records == 0) return OptimizerStatus.INSUFFICIENT_RESULTS;
        double ratio = (double) failures / records;
        if (ratio > maxFailureRatio) {
            log.warn("Too many failed tests | failures={} | records={} | maxFailureRatio={}", failures, records, maxFailureRatio);
            return OptimizerStatus.INSUFFICIENT_RESULTS;
        }
        return OptimizerStatus.SUCCEEDED;
    }

    @Override
    public synchronized OptimizationState getState() {
        EvaluationLog evaluationLog = evaluator.getLog();
        return new OptimizationState(direction, bestValuation, bestScore, evaluationLog.getRecords(),
                evaluationLog.getFailures(), testsRequired(), status);
    }

    @Override
    public List<TestRecord> runImportance(Valuation optimum, EvaluationStrategy sweepEvaluator,
                                          CancellationToken cancellation) {
        Objects.requireNonNull(optimum, "optimum");
        Objects.requireNonNull(sweepEvaluator, "sweepEvaluator");
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        List<Valuation> candidates = ImportanceSweep.candidates(space, optimum);
        sweepEvaluator.planTests(candidates.size());
        log.info("Importance sweep | optimum={} | candidates={}", optimum, candidates.size());

        int batchSize = Math.max(1, sweepEvaluator.parallelism());
        for (int from = 0; from < candidates.size() && !token.isCancelled(); from += batchSize) {
            List<Valuation> batch = candidates.subList(from, Math.min(candidates.size(), from + batchSize));
            sweepEvaluator.evaluate(batch, token);
        }
        return sweepEvaluator.getLog().getRecords();
    }
}
