package com.autotune.config;

import com.autotune.evaluator.Aggregator;
import com.autotune.vartree.ConfigurationError;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Number of test repetitions and how their scores are combined.
 *
 * @param count      repetitions, at least 1
 * @param aggregator reduction of the surviving samples
 */
public record Repetition(int count, Aggregator aggregator) {

    public static final Repetition SINGLE = new Repetition(1, Aggregator.MIN);

    public Repetition {
        if (count < 1) {
            throw new ConfigurationError("Option 'repeat' must be at least 1, got " + count);
        }
        if (aggregator == null) {
            throw new ConfigurationError("Option 'repeat' needs an aggregator");
        }
    }

    /**
     * Accepts {@code "3"}, {@code "3,med"}, {@code 3} or {@code {"count": 3, "aggregator": "med"}}.
     * The aggregator defaults to {@code min}; a missing node gives {@link #SINGLE}.
     *
     * @throws ConfigurationError on any other form
     */
    public static Repetition parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return SINGLE;
        if (node.isInt()) return new Repetition(node.asInt(), Aggregator.MIN);
        if (node.isTextual()) return parse(node.asText());
        if (node.isObject()) {
            JsonNode count = node.get("count");
            if (count == null || !count.canConvertToInt() || !count.isIntegralNumber()) {
                throw new ConfigurationError("Option 'repeat.count' must be an integer");
            }
            JsonNode aggregator = node.get("aggregator");
            return new Repetition(count.asInt(),
                    aggregator == null || aggregator.isNull() ? Aggregator.MIN : Aggregator.fromName(aggregator.asText()));
        }
        throw new ConfigurationError("Invalid setting for 'repeat': " + node);
    }

    public static Repetition parse(String text) {
        String[] parts = text.split(",", 2);
        int count;
        try {
            count = Integer.parseInt(parts[0].trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationError("Invalid setting for 'repeat': '" + text
                    + "' (expected a number of repetitions, optionally followed by ',min', ',max', ',med' or ',avg')");
        }
        Aggregator aggregator = parts.length > 1 ? Aggregator.fromName(parts[1]) : Aggregator.MIN;
        return new Repetition(count, aggregator);
    }

    /** Settings form, e.g. {@code 3,med}. */
    public String describe() {
        return count + "," + aggregator.settingsName();
    }
}
