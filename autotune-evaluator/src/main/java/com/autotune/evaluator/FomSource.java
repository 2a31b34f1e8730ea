package com.autotune.evaluator;

/** Where the figure of merit of one test repetition comes from. */
public enum FomSource {
    /** Number printed by the test command ({@code min}/{@code max}). */
    OUTPUT,
    /** Wall-clock seconds of the test command ({@code min_time}/{@code max_time}). */
    WALL_CLOCK
}
