package com.autotune.evaluator;

import com.autotune.evaluator.process.CommandResult;
import com.autotune.evaluator.process.CommandRunner;
import com.autotune.runlog.TestRecord;
import com.autotune.vartree.space.Valuation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates valuations by running external compile, test and clean commands.
 * <p>
 * One worker runs everything on the calling thread. With more workers each valuation's full
 * compile/test/clean cycle runs on a fixed pool; ids are still assigned at submission and the
 * {@link EvaluationLog} appends in id order. When the cancellation token fires while work is in
 * flight, running tests get the configured grace period, after which their commands are destroyed
 * and their ids abandoned.
 */
public final class CommandEvaluator implements EvaluationStrategy {

    private static final Logger log = LoggerFactory.getLogger(CommandEvaluator.class);

    static final String COMPILE_FAILED = "compile failed";
    static final String NO_VALID_MEASUREMENTS = "no valid measurements";

    private static final long POLL_MILLIS = 100;

    private final EvaluatorConfig config;
    private final EvaluationLog evaluationLog;
    private final CommandRunner runner;
    private final TranscriptSink transcript;
    private final ProgressListener progress;
    private final ExecutorService executor;
    private final AtomicBoolean aborted = new AtomicBoolean();
    private volatile long plannedTests;

    public CommandEvaluator(EvaluatorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.runner = config.getRunner();
        this.transcript = config.getTranscript();
        this.progress = config.getProgress();
        this.evaluationLog = new EvaluationLog(config.getResultLog());
        this.evaluationLog.addListener(this::onAppended);
        this.executor = config.getWorkers() > 1 ? Executors.newFixedThreadPool(config.getWorkers(), workerThreads()) : null;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "autotune-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public EvaluatorConfig getConfig() {
        return config;
    }

    @Override
    public EvaluationLog getLog() {
        return evaluationLog;
    }

    @Override
    public int parallelism() {
        return config.getWorkers();
    }

    @Override
    public void planTests(long total) {
        this.plannedTests = total;
    }

    @Override
    public List<TestRecord> evaluate(List<Valuation> valuations, CancellationToken cancellation) {
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        Map<Valuation, TestRecord> done = new LinkedHashMap<>();
        Map<Valuation, Future<TestRecord>> inFlight = new LinkedHashMap<>();
        List<Valuation> order = new ArrayList<>();

        for (Valuation valuation : valuations) {
            if (done.containsKey(valuation) || inFlight.containsKey(valuation)) continue;
            TestRecord existing = evaluationLog.find(valuation);
            if (existing != null) {
                done.put(valuation, existing);
                order.add(valuation);
                continue;
            }
            TestRecord reused = reuseFromReference(valuation);
            if (reused != null) {
                done.put(valuation, reused);
                order.add(valuation);
                continue;
            }
            if (token.isCancelled() || aborted.get()) {
                log.info("Evaluation stopped before submission | remaining={}", valuations.size() - order.size());
                break;
            }
            int id = evaluationLog.reserveId();
            order.add(valuation);
            if (executor == null) {
                TestRecord record = runAndLog(id, valuation);
                if (record != null) done.put(valuation, record);
            } else {
                inFlight.put(valuation, executor.submit(() -> runAndLog(id, valuation)));
            }
        }
        if (!inFlight.isEmpty()) {
            awaitAll(inFlight, done, token);
        }

        List<TestRecord> results = new ArrayList<>(order.size());
        for (Valuation v : order) {
            TestRecord r = done.get(v);
            if (r != null) results.add(r);
        }
        return results;
    }

    private TestRecord reuseFromReference(Valuation valuation) {
        EvaluationLog reference = config.getReferenceLog();
        if (reference == null) return null;
        TestRecord original = reference.find(valuation);
        if (original == null) return null;
        TestRecord copy = original.withTestId(evaluationLog.reserveId());
        log.debug("Reusing result | testId={} | fromTestId={}", copy.getTestId(), original.getTestId());
        evaluationLog.complete(copy);
        return copy;
    }

    private void awaitAll(Map<Valuation, Future<TestRecord>> inFlight, Map<Valuation, TestRecord> done,
                          CancellationToken token) {
        boolean graceStarted = false;
        long graceDeadline = 0;
        for (Map.Entry<Valuation, Future<TestRecord>> e : inFlight.entrySet()) {
            Future<TestRecord> future = e.getValue();
            while (true) {
                if (token.isCancelled() && !graceStarted) {
                    graceStarted = true;
                    graceDeadline = System.nanoTime() + config.getCancelGrace().toNanos();
                    log.info("Cancellation requested | waitingFor={} | graceSeconds={}",
                            inFlight.size() - done.size(), config.getCancelGrace().toSeconds());
                }
                if (graceStarted && System.nanoTime() - graceDeadline > 0 && !aborted.get()) {
                    abort();
                }
                try {
                    TestRecord record = future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
                    if (record != null) done.put(e.getKey(), record);
                    break;
                } catch (TimeoutException ex) {
                    continue;
                } catch (ExecutionException ex) {
                    log.error("Evaluation task failed | valuation={} | error={}", e.getKey(), ex.getCause(), ex);
                    break;
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    abort();
                    return;
                }
            }
        }
    }

    @Override
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            log.warn("Aborting evaluator; running commands are destroyed and in-flight tests abandoned");
            runner.destroyAll();
        }
    }

    /** Runs one valuation and hands the record to the log, or abandons its id after an abort. */
    private TestRecord runAndLog(int id, Valuation valuation) {
        if (aborted.get()) {
            evaluationLog.abandon(id);
            return null;
        }
        TestRecord record;
        try {
            record = runOne(id, valuation);
        } catch (RuntimeException e) {
            log.error("Evaluation error | testId={} | error={}", id, e.getMessage(), e);
            record = TestRecord.failure(id, valuation, List.of(), "evaluation error: " + e.getMessage());
        } catch (Error e) {
            // later ids must still drain
            evaluationLog.abandon(id);
            throw e;
        }
        if (aborted.get()) {
            evaluationLog.abandon(id);
            return null;
        }
        evaluationLog.complete(record);
        return record;
    }

    TestRecord runOne(int id, Valuation valuation) {
        log.debug("Evaluating | testId={} | valuation={}", id, valuation);
        try {
            if (config.getCompile() != null) {
                progress.onPhase(id, EvaluationPhase.COMPILE, 0);
                CommandResult compiled = runner.run(config.getCompile().render(id, valuation), config.getCommandTimeout());
                progress.onPhase(id, EvaluationPhase.COMPILE, 100);
                if (!compiled.succeeded()) {
                    log.warn("Compile failed | testId={} | reason={}", id, compiled.describeFailure());
                    return TestRecord.failure(id, valuation, List.of(), COMPILE_FAILED);
                }
            }
            List<Double> samples = new ArrayList<>(config.getRepeat());
            String testCommand = config.getTest().render(id, valuation);
            for (int rep = 1; rep <= config.getRepeat(); rep++) {
                if (aborted.get()) break;
                progress.onPhase(id, EvaluationPhase.TEST, (rep - 1) * 100 / config.getRepeat());
                CommandResult result = runner.run(testCommand, config.getCommandTimeout());
                OptionalDouble fom = measure(result);
                if (fom.isPresent()) {
                    samples.add(fom.getAsDouble());
                } else {
                    log.warn("Test repetition discarded | testId={} | repetition={} | reason={}", id, rep,
                            result.succeeded() ? "unparsable output" : result.describeFailure());
                }
            }
            progress.onPhase(id, EvaluationPhase.TEST, 100);
            progress.onPhase(id, EvaluationPhase.ANALYSIS, 0);
            TestRecord record = samples.isEmpty()
                    ? TestRecord.failure(id, valuation, samples, NO_VALID_MEASUREMENTS)
                    : TestRecord.success(id, valuation, samples, config.getAggregator().apply(samples));
            progress.onPhase(id, EvaluationPhase.ANALYSIS, 100);
            return record;
        } finally {
            clean(id, valuation);
        }
    }

    private OptionalDouble measure(CommandResult result) {
        if (!result.succeeded()) return OptionalDouble.empty();
        return config.getFomSource() == FomSource.WALL_CLOCK
                ? OptionalDouble.of(result.elapsedSeconds())
                : FomExtractor.parse(result.output());
    }

    private void clean(int id, Valuation valuation) {
        if (config.getClean() == null) return;
        CommandResult cleaned = runner.run(config.getClean().render(id, valuation), config.getCommandTimeout());
        if (!cleaned.succeeded()) {
            log.warn("Clean failed | testId={} | reason={}", id, cleaned.describeFailure());
        }
    }

    private void onAppended(TestRecord record) {
        transcript.line(describe(record));
        progress.onProgress(evaluationLog.size(), plannedTests, record);
    }

    static String describe(TestRecord record) {
        String result = record.getAggregateScore().isPresent()
                ? Double.toString(record.getAggregateScore().getAsDouble())
                : "FAILED (" + record.getOutcome().getReason() + ")";
        return "Test " + record.getTestId() + ": " + record.getValuation().describe(", ") + " -> " + result;
    }

    @Override
    public void close() {
        if (executor == null) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getCancelGrace().toSeconds() + 1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
