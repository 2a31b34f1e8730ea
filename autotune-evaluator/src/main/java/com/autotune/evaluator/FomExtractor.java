package com.autotune.evaluator;

import java.util.OptionalDouble;

/**
 * Reads a custom figure of merit from test output: the last non-blank line, trimmed, as a double.
 */
public final class FomExtractor {

    private FomExtractor() {
    }

    public static OptionalDouble parse(String output) {
        if (output == null) return OptionalDouble.empty();
        String[] lines = output.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].trim();
            if (line.isEmpty()) continue;
            try {
                double value = Double.parseDouble(line);
                return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }
}
