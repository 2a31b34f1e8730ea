package com.autotune.optimizer;

import com.autotune.evaluator.Aggregator;
import com.autotune.evaluator.CancellationToken;
import com.autotune.evaluator.CommandEvaluator;
import com.autotune.evaluator.EvaluatorConfig;
import com.autotune.evaluator.ProgressListener;
import com.autotune.runlog.TestRecord;
import com.autotune.vartree.space.ConfigurationSpace;
import com.autotune.vartree.space.Valuation;
import com.autotune.vartree.tree.VariableTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExhaustiveOptimizerTest {

    private static final ConfigurationSpace GRID = new ConfigurationSpace(VariableTree.builder()
            .variable("threads", "32", "64")
            .variable("blocks", "16", "32")
            .build());

    /** FOM = threads / blocks. */
    private static ScriptedRunner ratioRunner() {
        return new ScriptedRunner(argv -> Double.toString(Double.parseDouble(argv[1]) / Double.parseDouble(argv[2])));
    }

    private static CommandEvaluator evaluator(ScriptedRunner runner) {
        return evaluator(runner, ProgressListener.NONE);
    }

    private static CommandEvaluator evaluator(ScriptedRunner runner, ProgressListener progress) {
        return new CommandEvaluator(EvaluatorConfig.builder()
                .test("run %threads% %blocks%")
                .repeat(3, Aggregator.MIN)
                .runner(runner)
                .progress(progress)
                .build());
    }

    @Test
    void run_findsMinimumOfThreadsOverBlocks() {
        ScriptedRunner runner = ratioRunner();
        try (CommandEvaluator evaluator = evaluator(runner)) {
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(GRID, evaluator);
            optimizer.setDirection(Direction.MINIMIZE);

            assertEquals(4, optimizer.testsRequired());
            OptimizationState state = optimizer.run(CancellationToken.none());

            assertEquals(OptimizerStatus.SUCCEEDED, state.status());
            assertEquals(Valuation.of("threads", "32", "blocks", "32"), state.bestValuation());
            assertEquals(1.0, state.bestScore());
            assertEquals(4, state.records().size());
            assertEquals(12, runner.executions.get());
            assertEquals(0, optimizer.testsRemaining());
        }
    }

    @Test
    void run_maximizeKeepsFirstOfEqualScores() {
        ScriptedRunner runner = new ScriptedRunner(argv -> "5");
        try (CommandEvaluator evaluator = evaluator(runner)) {
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(GRID, evaluator);
            optimizer.setDirection(Direction.MAXIMIZE);

            OptimizationState state = optimizer.run(CancellationToken.none());

            assertEquals(Valuation.of("threads", "32", "blocks", "16"), state.bestValuation());
        }
    }

    @Test
    void run_requiresDirection() {
        try (CommandEvaluator evaluator = evaluator(ratioRunner())) {
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(GRID, evaluator);

            assertThrows(IllegalStateException.class, () -> optimizer.run(CancellationToken.none()));
            assertEquals(OptimizerStatus.IDLE, optimizer.getState().status());
        }
    }

    @Test
    void run_conditionalSpaceRequiresOnlyActiveBranches() {
        ConfigurationSpace space = new ConfigurationSpace(VariableTree.builder()
                .variable("threads", "32", "64")
                .conditional("blocks", "threads", "64", "16", "32")
                .build());
        ScriptedRunner runner = new ScriptedRunner(argv -> argv[2].startsWith("%") ? argv[1] : argv[2]);
        try (CommandEvaluator evaluator = evaluator(runner)) {
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(space, evaluator);
            optimizer.setDirection(Direction.MINIMIZE);

            OptimizationState state = optimizer.run(CancellationToken.none());

            assertEquals(3, optimizer.testsRequired());
            assertEquals(3, state.records().size());
            assertEquals(Valuation.of("threads", "64", "blocks", "16"), state.bestValuation());
        }
    }

    @Test
    void run_allUnparsableEndsWithInsufficientResults() {
        ScriptedRunner runner = new ScriptedRunner(argv -> "Segmentation fault");
        try (CommandEvaluator evaluator = evaluator(runner)) {
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(GRID, evaluator);
            optimizer.setDirection(Direction.MINIMIZE);

            OptimizationState state = optimizer.run(CancellationToken.none());

            assertEquals(OptimizerStatus.INSUFFICIENT_RESULTS, state.status());
            assertEquals(optimizer.testsRequired(), state.failures().size());
            assertFalse(state.hasOptimum());
            assertNull(state.bestValuation());
        }
    }

    @Test
    void run_tooManyFailuresEndsWithInsufficientResults() {
        ScriptedRunner runner = new ScriptedRunner(argv -> argv[1].equals("32") && argv[2].equals("16") ? "2" : null);
        try (CommandEvaluator evaluator = evaluator(runner)) {
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(GRID, evaluator, 0.5);
            optimizer.setDirection(Direction.MINIMIZE);

            OptimizationState state = optimizer.run(CancellationToken.none());

            assertEquals(OptimizerStatus.INSUFFICIENT_RESULTS, state.status());
            assertEquals(3, state.failures().size());
            assertTrue(state.hasOptimum());
        }
    }

    @Test
    void run_resumedFromCompleteLogExecutesNothing() {
        List<TestRecord> prior;
        Valuation firstBest;
        double firstScore;
        try (CommandEvaluator evaluator = evaluator(ratioRunner())) {
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(GRID, evaluator);
            optimizer.setDirection(Direction.MINIMIZE);
            OptimizationState state = optimizer.run(CancellationToken.none());
            prior = state.records();
            firstBest = state.bestValuation();
            firstScore = state.bestScore();
        }

        ScriptedRunner runner = ratioRunner();
        try (CommandEvaluator evaluator = evaluator(runner)) {
            evaluator.seed(prior);
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(GRID, evaluator);
            optimizer.setDirection(Direction.MINIMIZE);
            assertEquals(0, optimizer.testsRemaining());

            OptimizationState state = optimizer.run(CancellationToken.none());

            assertEquals(0, runner.executions.get());
            assertEquals(firstBest, state.bestValuation());
            assertEquals(firstScore, state.bestScore());
            assertEquals(OptimizerStatus.SUCCEEDED, state.status());
        }
    }

    @Test
    void run_cancellationKeepsPartialLog() {
        CancellationToken token = new CancellationToken();
        ProgressListener cancelAfterTwo = new ProgressListener() {
            @Override
            public void onProgress(int completed, long total, TestRecord record) {
                assertEquals(4, total);
                if (completed == 2) token.cancel();
            }
        };
        try (CommandEvaluator evaluator = evaluator(ratioRunner(), cancelAfterTwo)) {
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(GRID, evaluator);
            optimizer.setDirection(Direction.MINIMIZE);

            OptimizationState state = optimizer.run(token);

            assertEquals(OptimizerStatus.CANCELLED, state.status());
            assertEquals(2, state.records().size());
            assertEquals(2, optimizer.testsRemaining());
        }
    }

    @Test
    void runImportance_onlyExecutesValuationsMissingFromMainLog() {
        ConfigurationSpace space = new ConfigurationSpace(VariableTree.builder()
                .variable("threads", "32", "64", "128")
                .variable("blocks", "16", "32")
                .build());
        Valuation optimum = Valuation.of("threads", "32", "blocks", "32");
        try (CommandEvaluator main = evaluator(ratioRunner())) {
            main.seed(List.of(
                    TestRecord.success(1, optimum, List.of(1.0), 1.0),
                    TestRecord.success(2, Valuation.of("threads", "64", "blocks", "32"), List.of(2.0), 2.0)));
            ExhaustiveOptimizer optimizer = new ExhaustiveOptimizer(space, main);

            ScriptedRunner sweepRunner = ratioRunner();
            try (CommandEvaluator sweep = new CommandEvaluator(EvaluatorConfig.builder()
                    .test("run %threads% %blocks%")
                    .runner(sweepRunner)
                    .referenceLog(main.getLog())
                    .build())) {
                List<TestRecord> records = optimizer.runImportance(optimum, sweep, CancellationToken.none());

                // candidates: threads in {32,64,128} x blocks=32, plus threads=32 x blocks=16 -> 4 distinct, 2 known
                assertEquals(4, records.size());
                assertEquals(2, sweepRunner.executions.get());
                assertEquals(optimum, records.get(0).getValuation());
                assertEquals(2, main.getLog().size());
            }
        }
    }

    @Test
    void importanceCandidates_normalizeWhenParentChanges() {
        ConfigurationSpace space = new ConfigurationSpace(VariableTree.builder()
                .variable("threads", "32", "64")
                .conditional("blocks", "threads", "64", "16", "32")
                .build());

        List<Valuation> candidates = ImportanceSweep.candidates(space, Valuation.of("threads", "64", "blocks", "32"));

        assertEquals(List.of(
                Valuation.of("threads", "32"),
                Valuation.of("threads", "64", "blocks", "32"),
                Valuation.of("threads", "64", "blocks", "16")), candidates);
    }
}
