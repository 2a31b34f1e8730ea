package com.autotune.strategy;

import com.autotune.evaluator.EvaluationStrategy;
import com.autotune.evaluator.EvaluatorConfig;
import com.autotune.optimizer.OptimizationStrategy;
import com.autotune.vartree.space.ConfigurationSpace;

/**
 * SPI for evaluation and optimization strategies. Implementations on the classpath are discovered
 * via {@link java.util.ServiceLoader} (META-INF/services/com.autotune.strategy.StrategyProvider);
 * built-in strategies are registered explicitly by {@link InternalStrategies}.
 * A provider implements the factory method matching its {@link #getKind()}.
 */
public interface StrategyProvider {

    /** Name used in the settings file, e.g. {@code "command"} or {@code "exhaustive"}. */
    String getName();

    StrategyKind getKind();

    default String getVersion() {
        return "1.0";
    }

    /** Whether this provider should be registered. */
    default boolean isEnabled() {
        return true;
    }

    /**
     * @throws UnsupportedOperationException if this provider is not an {@link StrategyKind#EVALUATOR}
     */
    default EvaluationStrategy createEvaluator(EvaluatorConfig config) {
        throw new UnsupportedOperationException(getName() + " does not create evaluators");
    }

    /**
     * @throws UnsupportedOperationException if this provider is not an {@link StrategyKind#OPTIMIZER}
     */
    default OptimizationStrategy createOptimizer(ConfigurationSpace space, EvaluationStrategy evaluator,
                                                 double maxFailureRatio) {
        throw new UnsupportedOperationException(getName() + " does not create optimizers");
    }
}
