package com.autotune.config;

import com.autotune.vartree.space.ConfigurationSpace;
import com.autotune.vartree.tree.VariableTree;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Validated settings for one tuning session. Produced by {@link SettingsLoader}; every path is
 * absolute or resolved against {@link #getBaseDirectory()}.
 */
public final class TunerSettings {

    private final VariableTree tree;
    private final ConfigurationSpace space;
    private final String compileCommand;
    private final String testCommand;
    private final String cleanCommand;
    private final Objective objective;
    private final Repetition repeat;
    private final OutputSettings output;
    private final Path resume;
    private final ExecutionSettings execution;
    private final Path baseDirectory;

    private TunerSettings(Builder b) {
        this.tree = Objects.requireNonNull(b.tree, "tree");
        this.space = new ConfigurationSpace(tree);
        this.compileCommand = b.compileCommand;
        this.testCommand = Objects.requireNonNull(b.testCommand, "testCommand");
        this.cleanCommand = b.cleanCommand;
        this.objective = b.objective != null ? b.objective : Objective.MIN;
        this.repeat = b.repeat != null ? b.repeat : Repetition.SINGLE;
        this.output = b.output != null ? b.output : OutputSettings.none();
        this.resume = b.resume;
        this.execution = b.execution != null ? b.execution : ExecutionSettings.defaults();
        this.baseDirectory = Objects.requireNonNull(b.baseDirectory, "baseDirectory");
    }

    public static Builder builder() {
        return new Builder();
    }

    public VariableTree getTree() {
        return tree;
    }

    public ConfigurationSpace getSpace() {
        return space;
    }

    /** Null when there is no compile step. */
    public String getCompileCommand() {
        return compileCommand;
    }

    public String getTestCommand() {
        return testCommand;
    }

    /** Null when there is no clean step. */
    public String getCleanCommand() {
        return cleanCommand;
    }

    public Objective getObjective() {
        return objective;
    }

    public Repetition getRepeat() {
        return repeat;
    }

    public OutputSettings getOutput() {
        return output;
    }

    /** Prior result log to resume from, or null. */
    public Path getResume() {
        return resume;
    }

    public ExecutionSettings getExecution() {
        return execution;
    }

    /** Directory of the settings file; commands run here. */
    public Path getBaseDirectory() {
        return baseDirectory;
    }

    /** Multi-line echo of the settings for the transcript. */
    public String describe() {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append("Variables:").append(nl).append(tree.render());
        sb.append("Compile: ").append(orNone(compileCommand)).append(nl);
        sb.append("Test: ").append(testCommand).append(nl);
        sb.append("Clean: ").append(orNone(cleanCommand)).append(nl);
        sb.append("Optimal: ").append(objective.settingsName()).append(nl);
        sb.append("Repeat: ").append(repeat.describe()).append(nl);
        sb.append("Log: ").append(orNone(output.log())).append(nl);
        sb.append("Importance: ").append(orNone(output.importance())).append(nl);
        sb.append("Resume: ").append(orNone(resume)).append(nl);
        sb.append("Workers: ").append(execution.workers()).append(nl);
        return sb.toString();
    }

    private static String orNone(Object value) {
        return value != null ? value.toString() : "(none)";
    }

    public static final class Builder {
        private VariableTree tree;
        private String compileCommand;
        private String testCommand;
        private String cleanCommand;
        private Objective objective;
        private Repetition repeat;
        private OutputSettings output;
        private Path resume;
        private ExecutionSettings execution;
        private Path baseDirectory;

        private Builder() {
        }

        public Builder tree(VariableTree tree) {
            this.tree = tree;
            return this;
        }

        public Builder compileCommand(String compileCommand) {
            this.compileCommand = compileCommand;
            return this;
        }

        public Builder testCommand(String testCommand) {
            this.testCommand = testCommand;
            return this;
        }

        public Builder cleanCommand(String cleanCommand) {
            this.cleanCommand = cleanCommand;
            return this;
        }

        public Builder objective(Objective objective) {
            this.objective = objective;
            return this;
        }

        public Builder repeat(Repetition repeat) {
            this.repeat = repeat;
            return this;
        }

        public Builder output(OutputSettings output) {
            this.output = output;
            return this;
        }

        public Builder resume(Path resume) {
            this.resume = resume;
            return this;
        }

        public Builder execution(ExecutionSettings execution) {
            this.execution = execution;
            return this;
        }

        public Builder baseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        public TunerSettings build() {
            return new TunerSettings(this);
        }
    }
}
