package com.autotune.config.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Output paths; each is optional and relative paths resolve against the settings file's directory. */
public final class OutputSection {

    private final String log;
    private final String importance;
    private final String script;

    @JsonCreator
    public OutputSection(
            @JsonProperty("log") String log,
            @JsonProperty("importance") String importance,
            @JsonProperty("script") String script) {
        this.log = log;
        this.importance = importance;
        this.script = script;
    }

    /** Main result log (CSV). */
    public String getLog() {
        return log;
    }

    /** Importance-sweep result log (CSV). */
    public String getImportance() {
        return importance;
    }

    /** Transcript of the session. */
    public String getScript() {
        return script;
    }
}
