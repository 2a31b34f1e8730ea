package com.autotune.strategy;

/** Capability a {@link StrategyProvider} declares; the registry is keyed by kind and name. */
public enum StrategyKind {
    EVALUATOR,
    OPTIMIZER
}
