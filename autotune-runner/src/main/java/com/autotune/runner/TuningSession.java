package com.autotune.runner;

import com.autotune.config.ExecutionSettings;
import com.autotune.config.TunerSettings;
import com.autotune.evaluator.CancellationToken;
import com.autotune.evaluator.EvaluationLog;
import com.autotune.evaluator.EvaluationStrategy;
import com.autotune.evaluator.EvaluatorConfig;
import com.autotune.evaluator.TranscriptSink;
import com.autotune.evaluator.process.CommandRunner;
import com.autotune.optimizer.Direction;
import com.autotune.optimizer.OptimizationState;
import com.autotune.optimizer.OptimizationStrategy;
import com.autotune.optimizer.OptimizerStatus;
import com.autotune.runlog.CsvResultLogStore;
import com.autotune.runlog.ResultLog;
import com.autotune.runlog.ResultLogColumns;
import com.autotune.runlog.ResultLogReader;
import com.autotune.runlog.TestRecord;
import com.autotune.strategy.StrategyKind;
import com.autotune.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One tuning session: resume, optimization run, optional importance sweep and summary.
 * <p>
 * The resume log is read before the result log is opened, so both may name the same file. Output
 * that fails to open is reported and the session continues without it. {@link #cancel()} and
 * {@link #abort()} may be called from another thread (the shutdown hook) while {@link #run()} is
 * in progress.
 */
public final class TuningSession {

    private static final Logger log = LoggerFactory.getLogger(TuningSession.class);

    private final TunerSettings settings;
    private final StrategyRegistry registry;
    private final CommandRunner runner;
    private final TranscriptSink console;
    private final CancellationToken token = new CancellationToken();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final List<EvaluationStrategy> active = new CopyOnWriteArrayList<>();

    /**
     * @throws com.autotune.vartree.ConfigurationError if the configured strategies are unknown
     */
    public TuningSession(TunerSettings settings, StrategyRegistry registry, CommandRunner runner,
                         TranscriptSink console) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.console = console != null ? console : TranscriptSink.NONE;
        registry.resolve(StrategyKind.EVALUATOR, settings.getExecution().evaluator());
        registry.resolve(StrategyKind.OPTIMIZER, settings.getExecution().optimizer());
    }

    public TunerSettings getSettings() {
        return settings;
    }

    /** Stops submitting tests; running tests finish (or are aborted later). */
    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /** Destroys running commands of every active evaluator. */
    public void abort() {
        for (EvaluationStrategy evaluator : active) {
            evaluator.abort();
        }
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    /** Waits for {@link #run()} to return; true if it did within {@code timeout}. */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Runs the session to completion or cancellation.
     *
     * @throws com.autotune.vartree.ConfigurationError if the resume log does not fit the current tree
     */
    public RunReport run() {
        try (TranscriptSink transcript = openTranscript()) {
            return run(transcript);
        } finally {
            finished.countDown();
        }
    }

    private RunReport run(TranscriptSink transcript) {
        ExecutionSettings execution = settings.getExecution();
        transcript.line(settings.describe().stripTrailing());
        transcript.blank();

        List<TestRecord> prior = settings.getResume() != null
                ? ResultLogReader.read(settings.getResume(), settings.getSpace())
                : List.of();
        int scoreColumns = ResultLogColumns.scoreColumns(settings.getRepeat().count(), prior);
        ResultLog resultLog = openResultLog(settings.getOutput().log(), scoreColumns, transcript);
        EvaluatorConfig config = EvaluatorConfig.builder()
                .compile(settings.getCompileCommand())
                .test(settings.getTestCommand())
                .clean(settings.getCleanCommand())
                .repeat(settings.getRepeat().count(), settings.getRepeat().aggregator())
                .fomSource(settings.getObjective().getFomSource())
                .workers(execution.workers())
                .commandTimeout(execution.commandTimeout())
                .cancelGrace(execution.cancelGrace())
                .runner(runner)
                .resultLog(resultLog)
                .transcript(transcript)
                .progress(new LoggingProgressListener())
                .build();

        EvaluationStrategy evaluator = registry.createEvaluator(execution.evaluator(), config);
        active.add(evaluator);
        try {
            if (!prior.isEmpty()) {
                evaluator.seed(prior);
                transcript.line("Resumed " + prior.size() + " earlier tests from '" + settings.getResume() + "'");
            }
            OptimizationStrategy optimizer = registry.createOptimizer(execution.optimizer(), settings.getSpace(),
                    evaluator, execution.maxFailureRatio());
            optimizer.setDirection(settings.getObjective().getDirection());

            transcript.line("Number of tests to be run: " + optimizer.testsRequired());
            if (settings.getRepeat().count() > 1) {
                transcript.line("(with " + settings.getRepeat().count() + " repetitions each)");
            }
            transcript.blank();

            long start = System.nanoTime();
            OptimizationState state = optimizer.run(token);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            EvaluationLog evaluationLog = evaluator.getLog();
            int testsRun = evaluationLog.size() - evaluationLog.seededCount();
            log.info("Optimization finished | status={} | testsRun={} | resumed={} | elapsed={}",
                    state.status(), testsRun, evaluationLog.seededCount(), elapsed);

            int additionalTests = 0;
            Duration additionalElapsed = Duration.ZERO;
            boolean sweepRan = false;
            if (state.status() == OptimizerStatus.SUCCEEDED && settings.getOutput().importance() != null
                    && !token.isCancelled()) {
                long sweepStart = System.nanoTime();
                additionalTests = runImportance(optimizer, state, config, evaluator, scoreColumns, transcript);
                additionalElapsed = Duration.ofNanos(System.nanoTime() - sweepStart);
                sweepRan = true;
            }

            RunReport report = new RunReport(state.status(), state.bestValuation(), state.optimumScore(),
                    testsRun, evaluationLog.seededCount(), elapsed, additionalTests, additionalElapsed,
                    evaluationLog.getFailures());
            summarize(report, state.direction(), sweepRan, transcript);
            return report;
        } finally {
            active.remove(evaluator);
            evaluator.close();
            resultLog.close();
        }
    }

    /** Returns the number of sweep tests that were not already in the main log. */
    private int runImportance(OptimizationStrategy optimizer, OptimizationState state, EvaluatorConfig config,
                              EvaluationStrategy evaluator, int scoreColumns, TranscriptSink transcript) {
        ResultLog importanceLog = openResultLog(settings.getOutput().importance(), scoreColumns, transcript);
        EvaluatorConfig sweepConfig = config.toBuilder()
                .resultLog(importanceLog)
                .referenceLog(evaluator.getLog())
                .build();
        EvaluationStrategy sweep = registry.createEvaluator(settings.getExecution().evaluator(), sweepConfig);
        active.add(sweep);
        try {
            transcript.blank();
            transcript.line("Additional tests to check parameter importance:");
            transcript.blank();
            List<TestRecord> records = optimizer.runImportance(state.bestValuation(), sweep, token);
            int additional = 0;
            for (TestRecord record : records) {
                if (!evaluator.getLog().contains(record.getValuation())) additional++;
            }
            if (additional == 0) {
                transcript.line("(None required)");
            }
            log.info("Importance sweep finished | records={} | additional={}", records.size(), additional);
            return additional;
        } finally {
            active.remove(sweep);
            sweep.close();
            importanceLog.close();
        }
    }

    private void summarize(RunReport report, Direction direction, boolean sweepRan, TranscriptSink transcript) {
        transcript.blank();
        switch (report.status()) {
            case SUCCEEDED -> {
                String kind = direction == Direction.MAXIMIZE ? "Maximal" : "Minimal";
                transcript.line(kind + " valuation:");
                transcript.line(report.optimum().describe(", "));
                transcript.line(kind + " score:");
                transcript.line(Double.toString(report.optimumScore().getAsDouble()));
                transcript.line("The system ran " + report.testsRun() + " tests, taking "
                        + RunReport.formatDuration(report.elapsed()) + ".");
                if (report.resumedTests() > 0) {
                    transcript.line("(" + report.resumedTests() + " earlier results were resumed)");
                }
                if (sweepRan) {
                    String time = report.additionalTests() > 0
                            ? ", taking " + RunReport.formatDuration(report.additionalElapsed()) : "";
                    transcript.line("(and " + report.additionalTests() + " additional tests" + time + ")");
                }
            }
            case INSUFFICIENT_RESULTS -> {
                transcript.line("Not enough evaluations could be performed.");
                transcript.line("There were too many failures.");
            }
            case CANCELLED -> transcript.line("Quitting tuner after " + report.testsRun() + " tests.");
            default -> transcript.line("Tuner stopped in state " + report.status());
        }
        printFailures(report.failures(), transcript);
        printOutputs(report, sweepRan, transcript);
    }

    private static void printFailures(List<TestRecord> failures, TranscriptSink transcript) {
        if (failures.isEmpty()) return;
        transcript.blank();
        transcript.line("FAILURES:");
        for (TestRecord failure : failures) {
            transcript.line("    " + failure.getOutcome().getReason());
            transcript.line("    " + failure.getValuation().describe(", "));
            transcript.blank();
        }
    }

    private void printOutputs(RunReport report, boolean sweepRan, TranscriptSink transcript) {
        Path logPath = settings.getOutput().log();
        boolean partial = report.status() == OptimizerStatus.CANCELLED;
        transcript.blank();
        if (logPath != null) {
            transcript.line("A " + (partial ? "partial " : "") + "testing log was saved to '" + logPath + "'");
        }
        if (partial) {
            if (logPath != null) {
                transcript.line("To continue, set \"resume\": \"" + logPath + "\" in the settings file and run again.");
            } else {
                transcript.line("No result log was configured, so this run cannot be resumed.");
            }
        }
        if (sweepRan) {
            transcript.line("Additional data was saved to '" + settings.getOutput().importance() + "'");
        }
        if (settings.getOutput().script() != null) {
            transcript.line("A testing transcript was written to '" + settings.getOutput().script() + "'");
        }
    }

    private TranscriptSink openTranscript() {
        Path script = settings.getOutput().script();
        if (script == null) return console;
        try {
            return TranscriptSink.tee(console, TranscriptSink.toFile(script));
        } catch (UncheckedIOException e) {
            log.warn("Transcript disabled | path={} | error={}", script, e.getMessage());
            console.line("Failed to write a script file: " + script);
            return console;
        }
    }

    /** {@code scoreColumns} is widened past the repeat count when resumed records carry more samples. */
    private ResultLog openResultLog(Path path, int scoreColumns, TranscriptSink transcript) {
        if (path == null) return ResultLog.disabled();
        try {
            return new ResultLog(new CsvResultLogStore(path, settings.getTree().flatten(), scoreColumns));
        } catch (UncheckedIOException e) {
            log.warn("Result log disabled | path={} | error={}", path, e.getMessage());
            transcript.line("Failed to write CSV log file: " + path);
            return ResultLog.disabled();
        }
    }
}
