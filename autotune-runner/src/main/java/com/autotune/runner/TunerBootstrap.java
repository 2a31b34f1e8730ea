package com.autotune.runner;

import com.autotune.config.SettingsLoader;
import com.autotune.config.TunerEnvironment;
import com.autotune.config.TunerSettings;
import com.autotune.evaluator.TranscriptSink;
import com.autotune.evaluator.process.ShellCommandRunner;
import com.autotune.strategy.InternalStrategies;
import com.autotune.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Startup wiring: settings (file plus environment), strategy registry and shell runner.
 * Everything that can be misconfigured fails here, before any command runs.
 */
public final class TunerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TunerBootstrap.class);

    private TunerBootstrap() {
    }

    public static TuningSession initialize(Path settingsFile, TranscriptSink console) {
        return initialize(settingsFile, TunerEnvironment.fromEnvironment(), console);
    }

    /**
     * @throws com.autotune.vartree.ConfigurationError if settings or strategy names are invalid
     */
    public static TuningSession initialize(Path settingsFile, TunerEnvironment env, TranscriptSink console) {
        TunerSettings settings = SettingsLoader.load(settingsFile, env);
        StrategyRegistry registry = InternalStrategies.createRegistry();
        ShellCommandRunner runner = new ShellCommandRunner(settings.getExecution().shell(), settings.getBaseDirectory());
        log.info("Session initialized | settings={} | workDir={} | evaluator={} | optimizer={} | workers={}",
                settingsFile, settings.getBaseDirectory(), settings.getExecution().evaluator(),
                settings.getExecution().optimizer(), settings.getExecution().workers());
        return new TuningSession(settings, registry, runner, console);
    }
}
