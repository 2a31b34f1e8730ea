package com.autotune.evaluator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * User-facing transcript of a tuning session (settings, tree, one line per test, summary).
 * Injected wherever lines are produced; there is no process-wide output writer.
 */
public interface TranscriptSink extends AutoCloseable {

    TranscriptSink NONE = new TranscriptSink() {
        @Override
        public void line(String text) {
        }
    };

    void line(String text);

    default void blank() {
        line("");
    }

    @Override
    default void close() {
    }

    /** Sink writing to {@code writer}; each line is flushed. Closing the sink closes the writer. */
    static TranscriptSink of(Writer writer) {
        return new WriterTranscriptSink(writer);
    }

    /**
     * Sink writing to a new file, truncating any previous content.
     *
     * @throws UncheckedIOException if the file cannot be created
     */
    static TranscriptSink toFile(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            return of(Files.newBufferedWriter(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open transcript " + path, e);
        }
    }

    /** Sink that forwards every line to all {@code sinks}. */
    static TranscriptSink tee(TranscriptSink... sinks) {
        List<TranscriptSink> all = List.of(sinks);
        return new TranscriptSink() {
            @Override
            public void line(String text) {
                for (TranscriptSink s : all) s.line(text);
            }

            @Override
            public void close() {
                for (TranscriptSink s : all) s.close();
            }
        };
    }
}
