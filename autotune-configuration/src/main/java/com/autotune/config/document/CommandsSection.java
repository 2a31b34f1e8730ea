package com.autotune.config.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Compile, test and clean command templates. Only {@code test} is required. */
public final class CommandsSection {

    private final String compile;
    private final String test;
    private final String clean;

    @JsonCreator
    public CommandsSection(
            @JsonProperty("compile") String compile,
            @JsonProperty("test") String test,
            @JsonProperty("clean") String clean) {
        this.compile = compile;
        this.test = test;
        this.clean = clean;
    }

    public String getCompile() {
        return compile;
    }

    public String getTest() {
        return test;
    }

    public String getClean() {
        return clean;
    }
}
