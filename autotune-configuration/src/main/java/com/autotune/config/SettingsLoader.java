package com.autotune.config;

import com.autotune.config.document.CommandsSection;
import com.autotune.config.document.ExecutionSection;
import com.autotune.config.document.OutputSection;
import com.autotune.config.document.SettingsDocument;
import com.autotune.vartree.ConfigurationError;
import com.autotune.vartree.tree.VariableTree;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON settings file into {@link TunerSettings}.
 * <p>
 * Every problem found (tree structure, commands, objective, repeat, execution options) is collected
 * and reported in one {@link ConfigurationError}, before any command runs. Environment overrides are
 * applied after the file's execution section. Relative output and resume paths resolve against the
 * settings file's directory.
 */
public final class SettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private SettingsLoader() {
    }

    /**
     * @throws ConfigurationError if the file is missing, unreadable, malformed or invalid
     */
    public static TunerSettings load(Path settingsFile, TunerEnvironment env) {
        Path file = settingsFile.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationError("Settings file not found: " + file);
        }
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigurationError("Cannot read settings file " + file + ": " + e.getMessage(), e);
        }
        Path baseDir = file.getParent() != null ? file.getParent() : Path.of("").toAbsolutePath();
        TunerSettings settings = parse(json, baseDir, env);
        log.info("Settings loaded | file={} | variables={} | tests={}", file,
                settings.getTree().flatten().size(), settings.getSpace().count());
        return settings;
    }

    /**
     * Parses settings JSON.
     *
     * @param baseDir directory relative paths resolve against and commands run in
     * @param env     overrides; null for none
     */
    public static TunerSettings parse(String json, Path baseDir, TunerEnvironment env) {
        SettingsDocument doc;
        try {
            doc = MAPPER.readValue(json, SettingsDocument.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationError("Malformed settings: " + e.getOriginalMessage(), e);
        }
        if (doc == null) {
            throw new ConfigurationError("Settings file is empty");
        }
        List<String> problems = new ArrayList<>();
        TunerSettings.Builder b = TunerSettings.builder().baseDirectory(baseDir);

        try {
            b.tree(VariableTree.of(doc.getVariables(), doc.getValues()));
        } catch (ConfigurationError e) {
            problems.addAll(e.getProblems());
        }

        CommandsSection commands = doc.getCommands();
        if (isBlank(commands.getTest())) {
            problems.add("No test command given (commands.test)");
        } else {
            b.testCommand(commands.getTest());
        }
        b.compileCommand(blankToNull(commands.getCompile()));
        b.cleanCommand(blankToNull(commands.getClean()));

        try {
            b.objective(Objective.fromName(doc.getOptimal()));
        } catch (ConfigurationError e) {
            problems.addAll(e.getProblems());
        }
        try {
            b.repeat(Repetition.parse(doc.getRepeat()));
        } catch (ConfigurationError e) {
            problems.addAll(e.getProblems());
        }

        OutputSection output = doc.getOutput();
        b.output(new OutputSettings(resolve(baseDir, output.getLog()), resolve(baseDir, output.getImportance()),
                resolve(baseDir, output.getScript())));
        b.resume(resolve(baseDir, doc.getResume()));

        ExecutionSettings execution = (env != null ? env : TunerEnvironment.empty())
                .apply(execution(doc.getExecution()));
        validate(execution, problems);
        b.execution(execution);

        if (!problems.isEmpty()) {
            throw new ConfigurationError(problems);
        }
        return b.build();
    }

    private static ExecutionSettings execution(ExecutionSection section) {
        ExecutionSettings d = ExecutionSettings.defaults();
        return new ExecutionSettings(
                section.getWorkers() != null ? section.getWorkers() : d.workers(),
                section.getCommandTimeoutSeconds() != null
                        ? Duration.ofSeconds(section.getCommandTimeoutSeconds()) : d.commandTimeout(),
                section.getMaxFailureRatio() != null ? section.getMaxFailureRatio() : d.maxFailureRatio(),
                section.getCancelGraceSeconds() != null
                        ? Duration.ofSeconds(section.getCancelGraceSeconds()) : d.cancelGrace(),
                isBlank(section.getEvaluator()) ? d.evaluator() : section.getEvaluator().trim(),
                isBlank(section.getOptimizer()) ? d.optimizer() : section.getOptimizer().trim(),
                section.getShell() != null && !section.getShell().isEmpty() ? section.getShell() : d.shell());
    }

    private static void validate(ExecutionSettings e, List<String> problems) {
        if (e.workers() < 1) {
            problems.add("Option 'execution.workers' must be at least 1, got " + e.workers());
        }
        if (e.commandTimeout().isNegative()) {
            problems.add("Option 'execution.commandTimeoutSeconds' must not be negative");
        }
        if (!(e.maxFailureRatio() >= 0.0 && e.maxFailureRatio() <= 1.0)) {
            problems.add("Option 'execution.maxFailureRatio' must be between 0 and 1, got " + e.maxFailureRatio());
        }
        if (e.cancelGrace().isNegative()) {
            problems.add("Option 'execution.cancelGraceSeconds' must not be negative");
        }
    }

    private static Path resolve(Path baseDir, String path) {
        if (isBlank(path)) return null;
        return baseDir.resolve(path.trim()).normalize();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s;
    }
}
