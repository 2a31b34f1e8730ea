package com.autotune.evaluator;

import com.autotune.evaluator.process.CommandResult;
import com.autotune.runlog.TestRecord;
import com.autotune.vartree.space.Valuation;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandEvaluatorTest {

    /** Test command prints the product of the two variables; compile and clean succeed. */
    private static FakeCommandRunner productRunner() {
        return new FakeCommandRunner(cmd -> {
            if (cmd.startsWith("test ")) {
                String[] parts = cmd.split(" ");
                return FakeCommandRunner.ok(Integer.toString(Integer.parseInt(parts[1]) * Integer.parseInt(parts[2])));
            }
            return FakeCommandRunner.ok("");
        });
    }

    private static EvaluatorConfig.Builder config(FakeCommandRunner runner) {
        return EvaluatorConfig.builder()
                .compile("compile %a% %b% %%ID%%")
                .test("test %a% %b%")
                .clean("clean %%ID%%")
                .runner(runner);
    }

    private static Valuation ab(String a, String b) {
        return Valuation.of("a", a, "b", b);
    }

    @Test
    void evaluate_assignsSequentialIdsAndScores() {
        FakeCommandRunner runner = productRunner();
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).build())) {
            List<TestRecord> records = evaluator.evaluate(List.of(ab("2", "3"), ab("4", "5")), CancellationToken.none());

            assertEquals(2, records.size());
            assertEquals(1, records.get(0).getTestId());
            assertEquals(6.0, records.get(0).getAggregateScore().getAsDouble());
            assertEquals(2, records.get(1).getTestId());
            assertEquals(20.0, records.get(1).getAggregateScore().getAsDouble());
            assertEquals(List.of("compile 2 3 1", "test 2 3", "clean 1", "compile 4 5 2", "test 4 5", "clean 2"),
                    runner.commands());
        }
    }

    @Test
    void evaluate_neverRunsTheSameValuationTwice() {
        FakeCommandRunner runner = productRunner();
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).build())) {
            TestRecord first = evaluator.evaluate(List.of(ab("2", "3"), ab("2", "3")), CancellationToken.none()).get(0);
            List<TestRecord> again = evaluator.evaluate(List.of(ab("2", "3")), CancellationToken.none());

            assertEquals(1, runner.count("test "));
            assertEquals(1, evaluator.getLog().size());
            assertSame(first, again.get(0));
        }
    }

    @Test
    void evaluate_compileFailureSkipsTestsButStillCleans() {
        FakeCommandRunner runner = new FakeCommandRunner(cmd ->
                cmd.startsWith("compile") ? FakeCommandRunner.exit(2) : FakeCommandRunner.ok("1"));
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).repeat(3, Aggregator.MIN).build())) {
            TestRecord record = evaluator.evaluate(List.of(ab("1", "1")), CancellationToken.none()).get(0);

            assertFalse(record.isSuccess());
            assertEquals(CommandEvaluator.COMPILE_FAILED, record.getOutcome().getReason());
            assertEquals(0, runner.count("test "));
            assertEquals(1, runner.count("clean "));
            assertEquals(1, evaluator.getLog().failureCount());
        }
    }

    @Test
    void evaluate_discardsOnlyBadRepetitions() {
        AtomicInteger calls = new AtomicInteger();
        FakeCommandRunner runner = new FakeCommandRunner(cmd -> {
            if (!cmd.startsWith("test")) return FakeCommandRunner.ok("");
            return switch (calls.incrementAndGet()) {
                case 1 -> FakeCommandRunner.ok("4.0");
                case 2 -> FakeCommandRunner.ok("no number here");
                case 3 -> FakeCommandRunner.exit(1);
                default -> FakeCommandRunner.ok("2.0");
            };
        });
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).repeat(4, Aggregator.AVG).build())) {
            TestRecord record = evaluator.evaluate(List.of(ab("1", "1")), CancellationToken.none()).get(0);

            assertTrue(record.isSuccess());
            assertEquals(List.of(4.0, 2.0), record.getRawScores());
            assertEquals(3.0, record.getAggregateScore().getAsDouble());
        }
    }

    @Test
    void evaluate_allRepetitionsDiscardedIsFailure() {
        FakeCommandRunner runner = new FakeCommandRunner(cmd -> FakeCommandRunner.ok("garbage"));
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).repeat(2, Aggregator.MED).build())) {
            TestRecord record = evaluator.evaluate(List.of(ab("1", "1")), CancellationToken.none()).get(0);

            assertEquals(CommandEvaluator.NO_VALID_MEASUREMENTS, record.getOutcome().getReason());
            assertFalse(record.getAggregateScore().isPresent());
            assertEquals(2, runner.count("test "));
        }
    }

    @Test
    void evaluate_wallClockScoreUsesElapsedSeconds() {
        FakeCommandRunner runner = new FakeCommandRunner(cmd -> new CommandResult(0, "ignored", Duration.ofMillis(1500), false, null));
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).fomSource(FomSource.WALL_CLOCK).build())) {
            TestRecord record = evaluator.evaluate(List.of(ab("1", "1")), CancellationToken.none()).get(0);

            assertEquals(1.5, record.getAggregateScore().getAsDouble(), 1e-9);
        }
    }

    @Test
    void evaluate_reusesReferenceLogWithoutRunning() {
        FakeCommandRunner runner = productRunner();
        try (CommandEvaluator main = new CommandEvaluator(config(runner).build())) {
            main.evaluate(List.of(ab("2", "3")), CancellationToken.none());
            try (CommandEvaluator sweep = new CommandEvaluator(config(runner).referenceLog(main.getLog()).build())) {
                List<TestRecord> records = sweep.evaluate(List.of(ab("2", "3"), ab("3", "3")), CancellationToken.none());

                assertEquals(2, runner.count("test "));
                assertEquals(1, records.get(0).getTestId());
                assertEquals(6.0, records.get(0).getAggregateScore().getAsDouble());
                assertEquals(9.0, records.get(1).getAggregateScore().getAsDouble());
                assertEquals(2, sweep.getLog().size());
                assertEquals(1, main.getLog().size());
            }
        }
    }

    @Test
    void evaluate_seededValuationsAreNotExecuted() {
        FakeCommandRunner runner = productRunner();
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).build())) {
            evaluator.seed(List.of(TestRecord.success(1, ab("2", "3"), List.of(6.0), 6.0)));

            List<TestRecord> records = evaluator.evaluate(List.of(ab("2", "3"), ab("1", "1")), CancellationToken.none());

            assertEquals(1, runner.count("test "));
            assertEquals(2, records.get(1).getTestId());
        }
    }

    @Test
    void evaluate_parallelWorkersStillLogInIdOrder() {
        FakeCommandRunner runner = new FakeCommandRunner(cmd -> {
            if (cmd.startsWith("test ")) {
                int a = Integer.parseInt(cmd.split(" ")[1]);
                try {
                    Thread.sleep((5 - a) * 40L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return FakeCommandRunner.ok(Integer.toString(a));
            }
            return FakeCommandRunner.ok("");
        });
        List<Integer> order = new ArrayList<>();
        StringWriter transcript = new StringWriter();
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).workers(4)
                .transcript(TranscriptSink.of(transcript))
                .progress(new ProgressListener() {
                    @Override
                    public void onProgress(int completed, long total, TestRecord record) {
                        order.add(record.getTestId());
                    }
                }).build())) {
            evaluator.planTests(4);
            List<TestRecord> records = evaluator.evaluate(
                    List.of(ab("1", "1"), ab("2", "1"), ab("3", "1"), ab("4", "1")), CancellationToken.none());

            assertEquals(4, evaluator.parallelism());
            assertEquals(List.of(1, 2, 3, 4), order);
            for (int i = 0; i < 4; i++) {
                assertEquals(i + 1, records.get(i).getTestId());
                assertEquals(i + 1.0, records.get(i).getAggregateScore().getAsDouble());
            }
            assertTrue(transcript.toString().startsWith("Test 1: a = 1, b = 1 -> 1.0"));
        }
    }

    @Test
    void evaluate_errorInWorkerAbandonsItsIdSoLaterTestsStillLog() {
        FakeCommandRunner runner = new FakeCommandRunner(cmd -> {
            if (cmd.equals("test 1 1")) {
                throw new AssertionError("runner crashed");
            }
            return productRunner().run(cmd, Duration.ZERO);
        });
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).workers(2).build())) {
            List<TestRecord> records = evaluator.evaluate(
                    List.of(ab("1", "1"), ab("2", "3"), ab("3", "3")), CancellationToken.none());

            assertEquals(2, records.size());
            assertEquals(2, evaluator.getLog().size());
            assertEquals(0, evaluator.getLog().pendingCount());
            assertEquals(List.of(2, 3), List.of(records.get(0).getTestId(), records.get(1).getTestId()));
            assertEquals(6.0, records.get(0).getAggregateScore().getAsDouble());
        }
    }

    @Test
    void evaluate_cancelledTokenStopsSubmission() {
        FakeCommandRunner runner = productRunner();
        CancellationToken token = new CancellationToken();
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner)
                .progress(new ProgressListener() {
                    @Override
                    public void onProgress(int completed, long total, TestRecord record) {
                        token.cancel();
                    }
                }).build())) {
            List<TestRecord> records = evaluator.evaluate(List.of(ab("1", "1"), ab("2", "2"), ab("3", "3")), token);

            assertEquals(1, records.size());
            assertEquals(1, runner.count("test "));
        }
    }

    @Test
    void evaluate_graceExpiryAbortsAndAbandonsInFlightTests() throws Exception {
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        FakeCommandRunner runner = new FakeCommandRunner(cmd -> {
            if (cmd.startsWith("test ")) {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return FakeCommandRunner.exit(137);
            }
            return FakeCommandRunner.ok("");
        }) {
            @Override
            public void destroyAll() {
                super.destroyAll();
                release.countDown();
            }
        };
        CancellationToken token = new CancellationToken();
        try (CommandEvaluator evaluator = new CommandEvaluator(config(runner).clean(null).workers(2)
                .cancelGrace(Duration.ofMillis(200)).build())) {
            Thread canceller = new Thread(() -> {
                try {
                    started.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                token.cancel();
            });
            canceller.start();

            List<TestRecord> records = evaluator.evaluate(List.of(ab("1", "1"), ab("2", "2")), token);
            canceller.join();

            assertTrue(records.isEmpty());
            assertEquals(0, evaluator.getLog().size());
            assertEquals(1, runner.destroyCalls);
        }
    }
}
