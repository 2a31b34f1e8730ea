package com.autotune.config;

import java.nio.file.Path;

/**
 * Resolved output paths; any of them may be null when not configured.
 *
 * @param log        main result log
 * @param importance importance-sweep result log
 * @param script     session transcript
 */
public record OutputSettings(Path log, Path importance, Path script) {

    public static OutputSettings none() {
        return new OutputSettings(null, null, null);
    }
}
