package com.autotune.config;

import com.autotune.evaluator.FomSource;
import com.autotune.optimizer.Direction;
import com.autotune.vartree.ConfigurationError;

import java.util.Locale;

/**
 * The {@code optimal} setting: direction of the search and where the figure of merit comes from.
 * The {@code *_time} forms score a test by its wall-clock duration instead of its output.
 */
public enum Objective {
    MIN(Direction.MINIMIZE, FomSource.OUTPUT),
    MAX(Direction.MAXIMIZE, FomSource.OUTPUT),
    MIN_TIME(Direction.MINIMIZE, FomSource.WALL_CLOCK),
    MAX_TIME(Direction.MAXIMIZE, FomSource.WALL_CLOCK);

    private final Direction direction;
    private final FomSource fomSource;

    Objective(Direction direction, FomSource fomSource) {
        this.direction = direction;
        this.fomSource = fomSource;
    }

    public Direction getDirection() {
        return direction;
    }

    public FomSource getFomSource() {
        return fomSource;
    }

    public String settingsName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param name settings value; null means {@link #MIN}
     * @throws ConfigurationError for anything but min, max, min_time or max_time
     */
    public static Objective fromName(String name) {
        if (name == null) return MIN;
        String n = name.trim().toUpperCase(Locale.ROOT);
        for (Objective o : values()) {
            if (o.name().equals(n)) return o;
        }
        throw new ConfigurationError("Invalid setting for 'optimal': '" + name
                + "' (expected one of: min, max, min_time, max_time)");
    }
}
