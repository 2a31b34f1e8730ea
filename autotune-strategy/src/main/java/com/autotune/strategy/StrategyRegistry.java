package com.autotune.strategy;

import com.autotune.evaluator.EvaluationStrategy;
import com.autotune.evaluator.EvaluatorConfig;
import com.autotune.optimizer.OptimizationStrategy;
import com.autotune.vartree.ConfigurationError;
import com.autotune.vartree.space.ConfigurationSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Strategies by kind and name, resolved once at startup. Names are case-insensitive.
 * Not a singleton: the application builds one and passes it where needed.
 */
public final class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<StrategyKind, Map<String, StrategyProvider>> byKind = new EnumMap<>(StrategyKind.class);

    public StrategyRegistry() {
        for (StrategyKind kind : StrategyKind.values()) {
            byKind.put(kind, new LinkedHashMap<>());
        }
    }

    /**
     * @throws IllegalArgumentException if the name is blank or already registered for the provider's kind
     */
    public synchronized void register(StrategyProvider provider) {
        Objects.requireNonNull(provider, "provider");
        StrategyKind kind = Objects.requireNonNull(provider.getKind(), "kind");
        String name = key(provider.getName());
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Strategy name must be non-blank");
        }
        Map<String, StrategyProvider> byName = byKind.get(kind);
        if (byName.putIfAbsent(name, provider) != null) {
            throw new IllegalArgumentException("Strategy already registered for " + kind + ": " + provider.getName());
        }
        log.debug("Strategy registered | kind={} | name={} | version={}", kind, name, provider.getVersion());
    }

    /**
     * @throws ConfigurationError if no provider of {@code kind} has that name
     */
    public synchronized StrategyProvider resolve(StrategyKind kind, String name) {
        StrategyProvider provider = byKind.get(kind).get(key(name));
        if (provider == null) {
            throw new ConfigurationError("Unknown " + kind.name().toLowerCase(Locale.ROOT) + " strategy '" + name
                    + "' (available: " + names(kind) + ")");
        }
        return provider;
    }

    public EvaluationStrategy createEvaluator(String name, EvaluatorConfig config) {
        return resolve(StrategyKind.EVALUATOR, name).createEvaluator(config);
    }

    public OptimizationStrategy createOptimizer(String name, ConfigurationSpace space, EvaluationStrategy evaluator,
                                                double maxFailureRatio) {
        return resolve(StrategyKind.OPTIMIZER, name).createOptimizer(space, evaluator, maxFailureRatio);
    }

    /** Registered names of {@code kind}, in registration order. */
    public synchronized List<String> names(StrategyKind kind) {
        return new ArrayList<>(byKind.get(kind).keySet());
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
