package com.autotune.runlog;

import com.autotune.vartree.space.Valuation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ResultLogTest {

    @Test
    void append_swallowsStoreFailures() {
        List<Integer> attempts = new ArrayList<>();
        ResultLog resultLog = new ResultLog(new ResultLogStore() {
            @Override
            public void append(TestRecord record) {
                attempts.add(record.getTestId());
                throw new IllegalStateException("disk full");
            }

            @Override
            public void close() {
                throw new IllegalStateException("disk full");
            }
        });

        assertDoesNotThrow(() -> resultLog.append(TestRecord.success(1, Valuation.of("a", "1"), List.of(1.0), 1.0)));
        assertDoesNotThrow(resultLog::close);
        assertEquals(List.of(1), attempts);
    }

    @Test
    void nullStore_fallsBackToNoOp() {
        ResultLog resultLog = new ResultLog(null);

        assertDoesNotThrow(() -> resultLog.append(TestRecord.failure(3, Valuation.empty(), List.of(), "cancelled")));
    }
}
