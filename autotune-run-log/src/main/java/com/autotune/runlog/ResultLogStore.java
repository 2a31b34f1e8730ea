package com.autotune.runlog;

/**
 * Append-only sink for test records, written in id order.
 * {@link ResultLog} wraps all calls in try/catch so a broken log never stops tuning.
 */
public interface ResultLogStore extends AutoCloseable {

    void append(TestRecord record);

    /** Releases the underlying file. Further appends are ignored or fail. */
    @Override
    void close();
}
