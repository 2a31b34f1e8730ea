package com.autotune.runlog;

import com.autotune.vartree.space.Valuation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvResultLogStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void append_writesOneFlushedLinePerRecordWithEmptyCellsForInactiveVariables() throws Exception {
        Path file = tempDir.resolve("out/tuning.csv");
        CsvResultLogStore store = new CsvResultLogStore(file, List.of("threads", "blocks"), 2);

        store.append(TestRecord.success(1, Valuation.of("threads", "32"), List.of(1.5, 2.5), 2.0));
        List<String> beforeClose = Files.readAllLines(file);
        store.append(TestRecord.failure(2, Valuation.of("threads", "64", "blocks", "32"), List.of(), "compile failed"));
        store.close();

        assertEquals(List.of("threads,blocks,Score_1,Score_2,Overall,Status", "32,,1.5,2.5,2.0,OK"), beforeClose);
        String failureLine = Files.readAllLines(file).get(2);
        assertTrue(failureLine.startsWith("64,32,,,,"), failureLine);
        assertTrue(failureLine.contains("compile failed"), failureLine);
    }

    @Test
    void open_truncatesExistingFile() throws Exception {
        Path file = tempDir.resolve("tuning.csv");
        Files.writeString(file, "old,content\n1,2\n");

        new CsvResultLogStore(file, List.of("a"), 1).close();

        assertEquals(List.of("a,Score_1,Overall,Status"), Files.readAllLines(file));
    }

    @Test
    void append_keepsLeadingSamplesAndOverallWhenRecordHasMoreSamplesThanColumns() throws Exception {
        Path file = tempDir.resolve("narrow.csv");
        CsvResultLogStore store = new CsvResultLogStore(file, List.of("a"), 1);

        store.append(TestRecord.success(1, Valuation.of("a", "1"), List.of(3.0, 4.0, 5.0), 4.0));
        store.close();

        assertEquals(List.of("a,Score_1,Overall,Status", "1,3.0,4.0,OK"), Files.readAllLines(file));
    }

    @Test
    void scoreColumns_widensToTheLargestSampleCount() {
        List<TestRecord> records = List.of(
                TestRecord.success(1, Valuation.of("a", "1"), List.of(1.0, 2.0, 3.0), 2.0),
                TestRecord.failure(2, Valuation.of("a", "2"), List.of(), "timed out"));

        assertEquals(3, ResultLogColumns.scoreColumns(1, records));
        assertEquals(5, ResultLogColumns.scoreColumns(5, records));
        assertEquals(2, ResultLogColumns.scoreColumns(2, List.of()));
    }

    @Test
    void append_afterCloseFails() {
        CsvResultLogStore store = new CsvResultLogStore(tempDir.resolve("x.csv"), List.of("a"), 1);
        store.close();

        assertThrows(IllegalStateException.class,
                () -> store.append(TestRecord.success(1, Valuation.of("a", "1"), List.of(1.0), 1.0)));
    }
}
