package com.autotune.vartree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Thrown when the tuning setup is malformed: variable tree, value domains, commands, scoring
 * options, or a resumed log whose columns do not match the current tree.
 * Always raised before any external command runs.
 */
public final class ConfigurationError extends RuntimeException {

    private final List<String> problems;

    public ConfigurationError(String problem) {
        this(List.of(Objects.requireNonNull(problem, "problem")));
    }

    public ConfigurationError(List<String> problems) {
        super(problems != null && !problems.isEmpty() ? String.join("; ", problems) : "Invalid configuration");
        this.problems = problems != null ? Collections.unmodifiableList(new ArrayList<>(problems)) : List.of();
    }

    public ConfigurationError(String problem, Throwable cause) {
        super(problem, cause);
        this.problems = List.of(problem);
    }

    /** Individual problems found, in the order they were detected. Never empty. */
    public List<String> getProblems() {
        return problems.isEmpty() ? List.of(getMessage()) : problems;
    }
}
