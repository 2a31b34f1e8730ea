package com.autotune.evaluator;

import com.autotune.vartree.ConfigurationError;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reduces the surviving repetition scores of one test to a single score.
 */
public enum Aggregator {
    MIN,
    MAX,
    /** Median; for an even count the mean of the two central values. */
    MED,
    AVG;

    /**
     * @param samples at least one value
     * @throws IllegalArgumentException if {@code samples} is empty
     */
    public double apply(List<Double> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty sample list");
        }
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) values[i] = samples.get(i);
        return switch (this) {
            case MIN -> Arrays.stream(values).min().getAsDouble();
            case MAX -> Arrays.stream(values).max().getAsDouble();
            case AVG -> Arrays.stream(values).sum() / values.length;
            case MED -> median(values);
        };
    }

    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) return sorted[mid];
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /** Settings name: {@code min}, {@code max}, {@code med} or {@code avg}. */
    public String settingsName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws ConfigurationError for an unknown name
     */
    public static Aggregator fromName(String name) {
        if (name != null) {
            String n = name.trim().toUpperCase(Locale.ROOT);
            for (Aggregator a : values()) {
                if (a.name().equals(n)) return a;
            }
        }
        throw new ConfigurationError("Unknown aggregator '" + name + "' (expected min, max, med or avg)");
    }
}
