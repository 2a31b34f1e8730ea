package com.autotune.optimizer;

/** Whether lower or higher scores are better. */
public enum Direction {
    MINIMIZE,
    MAXIMIZE;

    /** True if {@code candidate} is strictly better than {@code best}; ties never improve. */
    public boolean improves(double candidate, double best) {
        return this == MINIMIZE ? candidate < best : candidate > best;
    }
}
