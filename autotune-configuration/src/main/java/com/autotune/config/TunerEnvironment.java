package com.autotune.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Execution overrides read from environment variables. Unset or unparsable values leave the
 * settings file's value in place.
 * <p>
 * AUTOTUNE_WORKERS, AUTOTUNE_COMMAND_TIMEOUT_SECONDS, AUTOTUNE_MAX_FAILURE_RATIO,
 * AUTOTUNE_CANCEL_GRACE_SECONDS, AUTOTUNE_SHELL (whitespace-separated, e.g. {@code bash -c}).
 */
public final class TunerEnvironment {

    static final String ENV_WORKERS = "AUTOTUNE_WORKERS";
    static final String ENV_COMMAND_TIMEOUT_SECONDS = "AUTOTUNE_COMMAND_TIMEOUT_SECONDS";
    static final String ENV_MAX_FAILURE_RATIO = "AUTOTUNE_MAX_FAILURE_RATIO";
    static final String ENV_CANCEL_GRACE_SECONDS = "AUTOTUNE_CANCEL_GRACE_SECONDS";
    static final String ENV_SHELL = "AUTOTUNE_SHELL";

    private static final TunerEnvironment EMPTY = new TunerEnvironment(Map.of());

    private final Integer workers;
    private final Long commandTimeoutSeconds;
    private final Double maxFailureRatio;
    private final Long cancelGraceSeconds;
    private final List<String> shell;

    private TunerEnvironment(Map<String, String> env) {
        this.workers = parseInt(env.get(ENV_WORKERS));
        this.commandTimeoutSeconds = parseLong(env.get(ENV_COMMAND_TIMEOUT_SECONDS));
        this.maxFailureRatio = parseDouble(env.get(ENV_MAX_FAILURE_RATIO));
        this.cancelGraceSeconds = parseLong(env.get(ENV_CANCEL_GRACE_SECONDS));
        this.shell = parseWords(env.get(ENV_SHELL));
    }

    public static TunerEnvironment fromEnvironment() {
        return new TunerEnvironment(System.getenv());
    }

    public static TunerEnvironment fromMap(Map<String, String> env) {
        return new TunerEnvironment(Objects.requireNonNull(env, "env"));
    }

    /** No overrides. */
    public static TunerEnvironment empty() {
        return EMPTY;
    }

    /** {@code settings} with every override that is set applied on top. */
    public ExecutionSettings apply(ExecutionSettings settings) {
        return new ExecutionSettings(
                workers != null ? workers : settings.workers(),
                commandTimeoutSeconds != null ? Duration.ofSeconds(commandTimeoutSeconds) : settings.commandTimeout(),
                maxFailureRatio != null ? maxFailureRatio : settings.maxFailureRatio(),
                cancelGraceSeconds != null ? Duration.ofSeconds(cancelGraceSeconds) : settings.cancelGrace(),
                settings.evaluator(),
                settings.optimizer(),
                shell != null ? shell : settings.shell());
    }

    private static Integer parseInt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> parseWords(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        List<String> words = new ArrayList<>();
        for (String w : value.trim().split("\\s+")) {
            words.add(w);
        }
        return List.copyOf(words);
    }
}
