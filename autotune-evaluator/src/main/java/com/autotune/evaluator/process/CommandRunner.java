package com.autotune.evaluator.process;

import java.time.Duration;

/**
 * Runs one shell command to completion. Implementations never throw for command failures; they
 * report them in the {@link CommandResult}.
 */
public interface CommandRunner {

    /**
     * @param command shell command line
     * @param timeout maximum run time; {@link Duration#ZERO} for none
     */
    CommandResult run(String command, Duration timeout);

    /** Forcibly stops every command still running. Used when a cancellation grace period expires. */
    default void destroyAll() {
    }
}
