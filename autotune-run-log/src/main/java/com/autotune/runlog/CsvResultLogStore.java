package com.autotune.runlog;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * CSV result log. The file is truncated and the header written on open; every record becomes
 * one complete, flushed line, so the file is a readable partial log whenever tuning stops.
 * This store is the only writer of its file.
 */
public final class CsvResultLogStore implements ResultLogStore {

    private static final Logger log = LoggerFactory.getLogger(CsvResultLogStore.class);
    private static final CsvMapper MAPPER = new CsvMapper();

    private final Path path;
    private final List<String> variables;
    private final int repeat;
    private final Writer out;
    private final SequenceWriter rows;
    private boolean closed;

    /**
     * @param path      log file; parent directories are created
     * @param variables flattened variable names, in column order
     * @param repeat    number of {@code Score_i} columns; samples beyond it are dropped with a warning
     * @throws UncheckedIOException if the file cannot be opened
     */
    public CsvResultLogStore(Path path, List<String> variables, int repeat) {
        this.path = Objects.requireNonNull(path, "path");
        this.variables = List.copyOf(variables);
        this.repeat = repeat;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            this.out = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            this.rows = MAPPER.writerFor(String[].class).with(CsvSchema.emptySchema()).writeValues(out);
            writeRow(ResultLogColumns.header(this.variables, repeat).toArray(new String[0]));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open result log " + path, e);
        }
        log.info("Result log opened | path={} | columns={}", path, this.variables.size() + repeat + 2);
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void append(TestRecord record) {
        if (closed) {
            throw new IllegalStateException("Result log is closed: " + path);
        }
        try {
            writeRow(toRow(record));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    String[] toRow(TestRecord record) {
        String[] row = new String[variables.size() + repeat + 2];
        int col = 0;
        for (String name : variables) {
            String value = record.getValuation().get(name);
            row[col++] = value != null ? value : "";
        }
        List<Double> scores = record.getRawScores();
        if (scores.size() > repeat) {
            log.warn("Result log drops samples | path={} | testId={} | samples={} | scoreColumns={}",
                    path, record.getTestId(), scores.size(), repeat);
        }
        for (int i = 0; i < repeat; i++) {
            row[col++] = i < scores.size() ? ResultLogColumns.formatScore(scores.get(i)) : "";
        }
        row[col++] = record.getAggregateScore().isPresent()
                ? ResultLogColumns.formatScore(record.getAggregateScore().getAsDouble()) : "";
        row[col] = record.getOutcome().status();
        return row;
    }

    private void writeRow(String[] row) throws IOException {
        rows.write(row);
        rows.flush();
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        try {
            rows.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log.debug("Result log closed | path={}", path);
    }
}
