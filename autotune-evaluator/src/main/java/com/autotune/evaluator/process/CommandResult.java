package com.autotune.evaluator.process;

import java.time.Duration;

/**
 * Outcome of one external command.
 *
 * @param exitCode    process exit code; -1 if the process did not finish normally
 * @param output      captured standard output
 * @param elapsed     wall-clock time from start to exit
 * @param timedOut    true if the command was killed after its timeout
 * @param launchError message if the command could not be started or was interrupted; null otherwise
 */
public record CommandResult(int exitCode, String output, Duration elapsed, boolean timedOut, String launchError) {

    public static CommandResult launchFailure(String message) {
        return new CommandResult(-1, "", Duration.ZERO, false, message);
    }

    public boolean succeeded() {
        return launchError == null && !timedOut && exitCode == 0;
    }

    public double elapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }

    /** Short reason for a failed command, for logs. */
    public String describeFailure() {
        if (launchError != null) return launchError;
        if (timedOut) return "timed out after " + elapsed.toSeconds() + "s";
        return "exit code " + exitCode;
    }
}
