package com.autotune.runner;

import com.autotune.evaluator.TranscriptSink;
import com.autotune.vartree.ConfigurationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Command-line entry point: {@code autotune <settings.json>}.
 * <p>
 * Exit codes: 0 when the optimum was found or the run was cancelled, 1 on a configuration error,
 * 2 when too many tests failed. On Ctrl+C the shutdown hook cancels the session, waits the
 * configured grace period for running tests, then destroys their commands and waits for the
 * summary to be written.
 */
public final class AutotuneApplication {

    private static final Logger log = LoggerFactory.getLogger(AutotuneApplication.class);
    private static final Duration SUMMARY_TIMEOUT = Duration.ofSeconds(10);

    private AutotuneApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out::println, true));
    }

    /**
     * Runs one session and returns the process exit code.
     *
     * @param console            receives the transcript
     * @param installShutdownHook false in tests
     */
    static int run(String[] args, TranscriptSink console, boolean installShutdownHook) {
        if (args.length != 1) {
            console.line("Usage: autotune <settings.json>");
            return RunReport.EXIT_CONFIGURATION_ERROR;
        }
        TuningSession session;
        try {
            session = TunerBootstrap.initialize(Path.of(args[0]), console);
        } catch (ConfigurationError e) {
            reportConfigurationError(e, console);
            return RunReport.EXIT_CONFIGURATION_ERROR;
        }

        Thread hook = null;
        if (installShutdownHook) {
            hook = new Thread(() -> shutdown(session), "autotune-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
        }
        try {
            RunReport report = session.run();
            return report.exitCode();
        } catch (ConfigurationError e) {
            reportConfigurationError(e, console);
            return RunReport.EXIT_CONFIGURATION_ERROR;
        } finally {
            if (hook != null && !session.isCancelled()) {
                Runtime.getRuntime().removeShutdownHook(hook);
            }
        }
    }

    private static void shutdown(TuningSession session) {
        if (session.isFinished()) return;
        Duration grace = session.getSettings().getExecution().cancelGrace();
        log.info("Cancellation requested | graceSeconds={}", grace.toSeconds());
        session.cancel();
        try {
            if (!session.awaitFinished(grace)) {
                log.warn("Grace period elapsed; destroying running commands");
                session.abort();
                if (!session.awaitFinished(SUMMARY_TIMEOUT)) {
                    log.error("Session did not finish after abort");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.abort();
        }
    }

    private static void reportConfigurationError(ConfigurationError e, TranscriptSink console) {
        log.error("Configuration error: {}", e.getMessage());
        console.line("Configuration error:");
        for (String problem : e.getProblems()) {
            console.line("    " + problem);
        }
    }
}
