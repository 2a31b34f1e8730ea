package com.autotune.strategy;

import com.autotune.evaluator.CommandEvaluator;
import com.autotune.evaluator.EvaluationStrategy;
import com.autotune.evaluator.EvaluatorConfig;
import com.autotune.optimizer.ExhaustiveOptimizer;
import com.autotune.optimizer.OptimizationStrategy;
import com.autotune.vartree.space.ConfigurationSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Strategy bootstrap: a {@link StrategyRegistry} with the built-in strategies registered explicitly
 * and any further {@link StrategyProvider}s found on the classpath.
 */
public final class InternalStrategies {

    private static final Logger log = LoggerFactory.getLogger(InternalStrategies.class);

    public static final String COMMAND_EVALUATOR = "command";
    public static final String EXHAUSTIVE_OPTIMIZER = "exhaustive";

    private InternalStrategies() {
    }

    public static StrategyRegistry createRegistry() {
        return createRegistry(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Built-ins are registered first, so a classpath provider reusing a built-in name fails fast.
     * Providers that fail to instantiate are logged and skipped.
     */
    public static StrategyRegistry createRegistry(ClassLoader classLoader) {
        StrategyRegistry registry = new StrategyRegistry();
        registry.register(new CommandEvaluatorProvider());
        registry.register(new ExhaustiveOptimizerProvider());

        int discovered = 0;
        ServiceLoader<StrategyProvider> loader = ServiceLoader.load(StrategyProvider.class, classLoader);
        for (ServiceLoader.Provider<StrategyProvider> candidate : loader.stream().toList()) {
            StrategyProvider provider;
            try {
                provider = candidate.get();
            } catch (ServiceConfigurationError e) {
                log.error("Strategy provider failed to instantiate (skipping): {}", e.getMessage(), e);
                continue;
            }
            if (!provider.isEnabled()) {
                log.info("Strategy provider disabled | name={}", provider.getName());
                continue;
            }
            registry.register(provider);
            discovered++;
        }
        log.info("Strategies: 2 built-in, {} discovered | evaluators={} | optimizers={}", discovered,
                registry.names(StrategyKind.EVALUATOR), registry.names(StrategyKind.OPTIMIZER));
        return registry;
    }

    static final class CommandEvaluatorProvider implements StrategyProvider {
        @Override
        public String getName() {
            return COMMAND_EVALUATOR;
        }

        @Override
        public StrategyKind getKind() {
            return StrategyKind.EVALUATOR;
        }

        @Override
        public EvaluationStrategy createEvaluator(EvaluatorConfig config) {
            return new CommandEvaluator(config);
        }
    }

    static final class ExhaustiveOptimizerProvider implements StrategyProvider {
        @Override
        public String getName() {
            return EXHAUSTIVE_OPTIMIZER;
        }

        @Override
        public StrategyKind getKind() {
            return StrategyKind.OPTIMIZER;
        }

        @Override
        public OptimizationStrategy createOptimizer(ConfigurationSpace space, EvaluationStrategy evaluator,
                                                    double maxFailureRatio) {
            return new ExhaustiveOptimizer(space, evaluator, maxFailureRatio);
        }
    }
}
