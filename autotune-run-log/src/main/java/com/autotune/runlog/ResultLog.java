package com.autotune.runlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fail-safe facade for the result log. All writes delegate to {@link ResultLogStore};
 * any exception from the store is caught, logged, and not rethrown so tuning never fails
 * because of the log file.
 */
public final class ResultLog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResultLog.class);

    private final ResultLogStore store;

    public ResultLog(ResultLogStore store) {
        this.store = store != null ? store : new NoOpResultLogStore();
    }

    public static ResultLog disabled() {
        return new ResultLog(new NoOpResultLogStore());
    }

    public void append(TestRecord record) {
        try {
            store.append(record);
        } catch (Throwable t) {
            log.warn("Result log append failed (testId={}); tuning continues. Error: {}", record.getTestId(), t.getMessage(), t);
        }
    }

    @Override
    public void close() {
        try {
            store.close();
        } catch (Throwable t) {
            log.warn("Result log close failed; some rows may be missing. Error: {}", t.getMessage(), t);
        }
    }
}
