package com.autotune.runlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** No-op store used when no log path is configured or the file could not be opened. */
public final class NoOpResultLogStore implements ResultLogStore {

    private static final Logger log = LoggerFactory.getLogger(NoOpResultLogStore.class);

    @Override
    public void append(TestRecord record) {
        log.debug("Result log (no-op): append | testId={} | status={}", record.getTestId(), record.getOutcome().status());
    }

    @Override
    public void close() {
    }
}
