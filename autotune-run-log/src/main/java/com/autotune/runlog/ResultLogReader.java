package com.autotune.runlog;

import com.autotune.vartree.ConfigurationError;
import com.autotune.vartree.space.ConfigurationSpace;
import com.autotune.vartree.space.Valuation;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Reads a previous CSV result log back into records for resuming.
 * <p>
 * The leading columns must be exactly the flattened variable names of the current tree. Any
 * number of {@code Score_i} columns is accepted. Logs without a {@code Status} column treat an
 * empty {@code Overall} as a failure. Rows that are not members of the current space, malformed
 * rows and repeated valuations are skipped with a warning. Records are numbered 1..n in file order.
 */
public final class ResultLogReader {

    private static final Logger log = LoggerFactory.getLogger(ResultLogReader.class);
    private static final CsvMapper MAPPER = new CsvMapper().enable(CsvParser.Feature.WRAP_AS_ARRAY);

    static final String LEGACY_FAILURE = "no valid measurements";

    private ResultLogReader() {
    }

    /**
     * @throws ConfigurationError if the file is missing, empty or its columns do not match the tree
     * @throws UncheckedIOException on read failure
     */
    public static List<TestRecord> read(Path path, ConfigurationSpace space) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationError("Resume log not found: " + path);
        }
        List<String[]> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = MAPPER.readerFor(String[].class).readValues(reader)) {
            while (it.hasNext()) {
                String[] row = it.next();
                if (!isBlank(row)) rows.add(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read resume log " + path, e);
        }
        if (rows.isEmpty()) {
            throw new ConfigurationError("Resume log has no header: " + path);
        }
        Layout layout = Layout.of(rows.get(0), space.getTree().flatten(), path);

        List<TestRecord> records = new ArrayList<>();
        Set<Valuation> seen = new HashSet<>();
        for (int r = 1; r < rows.size(); r++) {
            String[] row = rows.get(r);
            TestRecord record;
            try {
                record = layout.parse(row, records.size() + 1);
            } catch (IllegalArgumentException e) {
                log.warn("Resume log row skipped | path={} | line={} | reason={}", path, r + 1, e.getMessage());
                continue;
            }
            if (!space.contains(record.getValuation())) {
                log.warn("Resume log row is not in the current space, skipped | line={} | valuation={}",
                        r + 1, record.getValuation());
                continue;
            }
            if (!seen.add(record.getValuation())) {
                log.warn("Resume log row repeats an earlier valuation, skipped | line={}", r + 1);
                continue;
            }
            records.add(record);
        }
        log.info("Resume log read | path={} | records={}", path, records.size());
        return records;
    }

    private static boolean isBlank(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.isBlank()) return false;
        }
        return true;
    }

    private static final class Layout {
        private final List<String> variables;
        private final List<Integer> scoreColumns;
        private final int overall;
        private final int status;

        private Layout(List<String> variables, List<Integer> scoreColumns, int overall, int status) {
            this.variables = variables;
            this.scoreColumns = scoreColumns;
            this.overall = overall;
            this.status = status;
        }

        static Layout of(String[] header, List<String> variables, Path path) {
            List<String> names = Arrays.asList(header);
            if (names.size() < variables.size() || !names.subList(0, variables.size()).equals(variables)) {
                throw new ConfigurationError("Resume log " + path + " columns " + names
                        + " do not start with the variables " + variables);
            }
            List<Integer> scores = new ArrayList<>();
            int overall = -1;
            int status = -1;
            for (int i = variables.size(); i < header.length; i++) {
                String name = header[i].trim();
                if (ResultLogColumns.isScoreColumn(name)) {
                    scores.add(i);
                } else if (ResultLogColumns.OVERALL.equals(name)) {
                    overall = i;
                } else if (ResultLogColumns.STATUS.equals(name)) {
                    status = i;
                } else {
                    throw new ConfigurationError("Resume log " + path + " has unexpected column '" + name + "'");
                }
            }
            if (overall < 0) {
                throw new ConfigurationError("Resume log " + path + " has no " + ResultLogColumns.OVERALL + " column");
            }
            return new Layout(variables, scores, overall, status);
        }

        TestRecord parse(String[] row, int testId) {
            LinkedHashMap<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < variables.size(); i++) {
                String cell = cell(row, i);
                if (!cell.isEmpty()) values.put(variables.get(i), cell);
            }
            Valuation valuation = Valuation.of(values);
            List<Double> scores = new ArrayList<>();
            for (int col : scoreColumns) {
                String cell = cell(row, col);
                if (!cell.isEmpty()) scores.add(number(cell));
            }
            String overallCell = cell(row, overall);
            String statusCell = status >= 0 ? cell(row, status) : "";
            if (status >= 0 && !statusCell.isEmpty() && !Outcome.OK.equals(statusCell)) {
                return TestRecord.failure(testId, valuation, scores, statusCell);
            }
            if (overallCell.isEmpty()) {
                return TestRecord.failure(testId, valuation, scores, LEGACY_FAILURE);
            }
            return TestRecord.success(testId, valuation, scores, number(overallCell));
        }

        private static String cell(String[] row, int index) {
            return index < row.length && row[index] != null ? row[index].trim() : "";
        }

        private static double number(String cell) {
            try {
                return Double.parseDouble(cell);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a number: '" + cell + "'");
            }
        }
    }
}
