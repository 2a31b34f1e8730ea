package com.autotune.config.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Optional execution tuning; null fields take the loader's defaults. */
public final class ExecutionSection {

    private final Integer workers;
    private final Long commandTimeoutSeconds;
    private final Double maxFailureRatio;
    private final Long cancelGraceSeconds;
    private final String evaluator;
    private final String optimizer;
    private final List<String> shell;

    @JsonCreator
    public ExecutionSection(
            @JsonProperty("workers") Integer workers,
            @JsonProperty("commandTimeoutSeconds") Long commandTimeoutSeconds,
            @JsonProperty("maxFailureRatio") Double maxFailureRatio,
            @JsonProperty("cancelGraceSeconds") Long cancelGraceSeconds,
            @JsonProperty("evaluator") String evaluator,
            @JsonProperty("optimizer") String optimizer,
            @JsonProperty("shell") List<String> shell) {
        this.workers = workers;
        this.commandTimeoutSeconds = commandTimeoutSeconds;
        this.maxFailureRatio = maxFailureRatio;
        this.cancelGraceSeconds = cancelGraceSeconds;
        this.evaluator = evaluator;
        this.optimizer = optimizer;
        this.shell = shell != null ? List.copyOf(shell) : null;
    }

    static ExecutionSection defaults() {
        return new ExecutionSection(null, null, null, null, null, null, null);
    }

    public Integer getWorkers() {
        return workers;
    }

    public Long getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public Double getMaxFailureRatio() {
        return maxFailureRatio;
    }

    public Long getCancelGraceSeconds() {
        return cancelGraceSeconds;
    }

    public String getEvaluator() {
        return evaluator;
    }

    public String getOptimizer() {
        return optimizer;
    }

    public List<String> getShell() {
        return shell;
    }
}
