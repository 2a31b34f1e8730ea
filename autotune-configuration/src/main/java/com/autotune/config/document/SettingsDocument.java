package com.autotune.config.document;

import com.autotune.vartree.tree.VariableNode;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings file as written by the user. Validation and defaulting happen in
 * {@link com.autotune.config.SettingsLoader}; this class only mirrors the JSON.
 *
 * <pre>
 * {
 *   "variables": [ { "name": "threads", "children": [ { "name": "blocks", "activeWhen": "64" } ] } ],
 *   "values": { "threads": ["32", "64"], "blocks": ["16", "32"] },
 *   "commands": { "compile": "make T=%threads% B=%blocks%", "test": "./bench", "clean": "make clean" },
 *   "optimal": "min_time",
 *   "repeat": "3,med",
 *   "output": { "log": "results.csv", "importance": "importance.csv", "script": "transcript.txt" },
 *   "resume": "previous.csv",
 *   "execution": { "workers": 1 }
 * }
 * </pre>
 */
public final class SettingsDocument {

    private final List<VariableNode> variables;
    private final Map<String, List<String>> values;
    private final CommandsSection commands;
    private final String optimal;
    private final JsonNode repeat;
    private final OutputSection output;
    private final String resume;
    private final ExecutionSection execution;

    @JsonCreator
    public SettingsDocument(
            @JsonProperty("variables") List<VariableNode> variables,
            @JsonProperty("values") Map<String, List<String>> values,
            @JsonProperty("commands") CommandsSection commands,
            @JsonProperty("optimal") String optimal,
            @JsonProperty("repeat") JsonNode repeat,
            @JsonProperty("output") OutputSection output,
            @JsonProperty("resume") String resume,
            @JsonProperty("execution") ExecutionSection execution) {
        this.variables = variables != null ? List.copyOf(variables) : List.of();
        this.values = values != null ? new LinkedHashMap<>(values) : Map.of();
        this.commands = commands != null ? commands : new CommandsSection(null, null, null);
        this.optimal = optimal;
        this.repeat = repeat;
        this.output = output != null ? output : new OutputSection(null, null, null);
        this.resume = resume;
        this.execution = execution != null ? execution : ExecutionSection.defaults();
    }

    public List<VariableNode> getVariables() {
        return variables;
    }

    public Map<String, List<String>> getValues() {
        return values;
    }

    public CommandsSection getCommands() {
        return commands;
    }

    /** {@code min}, {@code max}, {@code min_time} or {@code max_time}; null means {@code min}. */
    public String getOptimal() {
        return optimal;
    }

    /** Either {@code "3,med"} / {@code "3"} / {@code 3}, or {@code {"count": 3, "aggregator": "med"}}. */
    public JsonNode getRepeat() {
        return repeat;
    }

    public OutputSection getOutput() {
        return output;
    }

    public String getResume() {
        return resume;
    }

    public ExecutionSection getExecution() {
        return execution;
    }
}
