package com.autotune.runlog;

import java.util.Objects;

/**
 * Result of one evaluation: success, or failure with a short reason
 * (e.g. {@code "compile failed"}, {@code "no valid measurements"}).
 */
public final class Outcome {

    /** Status cell written for successful rows. */
    public static final String OK = "OK";

    private static final Outcome SUCCESS = new Outcome(null);

    private final String reason;

    private Outcome(String reason) {
        this.reason = reason;
    }

    public static Outcome success() {
        return SUCCESS;
    }

    public static Outcome failure(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return new Outcome(reason);
    }

    public boolean isSuccess() {
        return reason == null;
    }

    /** Failure reason; null on success. */
    public String getReason() {
        return reason;
    }

    /** Value of the status column. */
    public String status() {
        return reason == null ? OK : reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(reason, ((Outcome) o).reason);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(reason);
    }

    @Override
    public String toString() {
        return status();
    }
}
