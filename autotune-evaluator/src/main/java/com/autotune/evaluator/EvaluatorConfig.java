package com.autotune.evaluator;

import com.autotune.evaluator.process.CommandRunner;
import com.autotune.runlog.ResultLog;
import com.autotune.vartree.ConfigurationError;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything an evaluator needs: command templates, repetition and scoring, parallelism, and the
 * sinks it reports to. Immutable; built with {@link #builder()}.
 */
public final class EvaluatorConfig {

    private final CommandTemplate compile;
    private final CommandTemplate test;
    private final CommandTemplate clean;
    private final int repeat;
    private final Aggregator aggregator;
    private final FomSource fomSource;
    private final int workers;
    private final Duration commandTimeout;
    private final Duration cancelGrace;
    private final CommandRunner runner;
    private final ResultLog resultLog;
    private final EvaluationLog referenceLog;
    private final TranscriptSink transcript;
    private final ProgressListener progress;

    private EvaluatorConfig(Builder b) {
        this.compile = b.compile;
        this.test = b.test;
        this.clean = b.clean;
        this.repeat = b.repeat;
        this.aggregator = b.aggregator;
        this.fomSource = b.fomSource;
        this.workers = b.workers;
        this.commandTimeout = b.commandTimeout;
        this.cancelGrace = b.cancelGrace;
        this.runner = b.runner;
        this.resultLog = b.resultLog != null ? b.resultLog : ResultLog.disabled();
        this.referenceLog = b.referenceLog;
        this.transcript = b.transcript != null ? b.transcript : TranscriptSink.NONE;
        this.progress = b.progress != null ? b.progress : ProgressListener.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy of this configuration as a builder, e.g. to derive the importance-sweep evaluator. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.compile = compile;
        b.test = test;
        b.clean = clean;
        b.repeat = repeat;
        b.aggregator = aggregator;
        b.fomSource = fomSource;
        b.workers = workers;
        b.commandTimeout = commandTimeout;
        b.cancelGrace = cancelGrace;
        b.runner = runner;
        b.resultLog = resultLog;
        b.referenceLog = referenceLog;
        b.transcript = transcript;
        b.progress = progress;
        return b;
    }

    /** Optional; null when there is no compile step. */
    public CommandTemplate getCompile() {
        return compile;
    }

    public CommandTemplate getTest() {
        return test;
    }

    /** Optional; null when there is no clean step. */
    public CommandTemplate getClean() {
        return clean;
    }

    public int getRepeat() {
        return repeat;
    }

    public Aggregator getAggregator() {
        return aggregator;
    }

    public FomSource getFomSource() {
        return fomSource;
    }

    public int getWorkers() {
        return workers;
    }

    /** {@link Duration#ZERO} means no timeout. */
    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public Duration getCancelGrace() {
        return cancelGrace;
    }

    public CommandRunner getRunner() {
        return runner;
    }

    public ResultLog getResultLog() {
        return resultLog;
    }

    /** Log of another evaluator whose results are reused; null if none. */
    public EvaluationLog getReferenceLog() {
        return referenceLog;
    }

    public TranscriptSink getTranscript() {
        return transcript;
    }

    public ProgressListener getProgress() {
        return progress;
    }

    public static final class Builder {
        private CommandTemplate compile;
        private CommandTemplate test;
        private CommandTemplate clean;
        private int repeat = 1;
        private Aggregator aggregator = Aggregator.MIN;
        private FomSource fomSource = FomSource.OUTPUT;
        private int workers = 1;
        private Duration commandTimeout = Duration.ZERO;
        private Duration cancelGrace = Duration.ofSeconds(30);
        private CommandRunner runner;
        private ResultLog resultLog;
        private EvaluationLog referenceLog;
        private TranscriptSink transcript;
        private ProgressListener progress;

        private Builder() {
        }

        public Builder compile(String template) {
            this.compile = blankToNull(template);
            return this;
        }

        public Builder test(String template) {
            this.test = blankToNull(template);
            return this;
        }

        public Builder clean(String template) {
            this.clean = blankToNull(template);
            return this;
        }

        public Builder repeat(int repeat, Aggregator aggregator) {
            this.repeat = repeat;
            this.aggregator = aggregator;
            return this;
        }

        public Builder fomSource(FomSource fomSource) {
            this.fomSource = fomSource;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder commandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        public Builder cancelGrace(Duration cancelGrace) {
            this.cancelGrace = cancelGrace;
            return this;
        }

        public Builder runner(CommandRunner runner) {
            this.runner = runner;
            return this;
        }

        public Builder resultLog(ResultLog resultLog) {
            this.resultLog = resultLog;
            return this;
        }

        public Builder referenceLog(EvaluationLog referenceLog) {
            this.referenceLog = referenceLog;
            return this;
        }

        public Builder transcript(TranscriptSink transcript) {
            this.transcript = transcript;
            return this;
        }

        public Builder progress(ProgressListener progress) {
            this.progress = progress;
            return this;
        }

        /**
         * @throws ConfigurationError if the test command, runner, repeat count or aggregator is missing or invalid
         */
        public EvaluatorConfig build() {
            if (test == null) throw new ConfigurationError("A test command is required");
            if (repeat < 1) throw new ConfigurationError("Repeat count must be at least 1, got " + repeat);
            if (aggregator == null) throw new ConfigurationError("An aggregator is required");
            if (workers < 1) throw new ConfigurationError("Worker count must be at least 1, got " + workers);
            Objects.requireNonNull(runner, "runner");
            Objects.requireNonNull(fomSource, "fomSource");
            if (commandTimeout == null || commandTimeout.isNegative()) commandTimeout = Duration.ZERO;
            if (cancelGrace == null || cancelGrace.isNegative()) cancelGrace = Duration.ZERO;
            return new EvaluatorConfig(this);
        }

        private static CommandTemplate blankToNull(String template) {
            return template == null || template.isBlank() ? null : new CommandTemplate(template);
        }
    }
}
