package com.autotune.evaluator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/** Writer-backed transcript. Write failures are logged once and further lines dropped. */
final class WriterTranscriptSink implements TranscriptSink {

    private static final Logger log = LoggerFactory.getLogger(WriterTranscriptSink.class);

    private final Writer writer;
    private boolean broken;

    WriterTranscriptSink(Writer writer) {
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @Override
    public synchronized void line(String text) {
        if (broken) return;
        try {
            writer.write(text);
            writer.write(System.lineSeparator());
            writer.flush();
        } catch (IOException e) {
            broken = true;
            log.warn("Transcript write failed; further transcript lines are dropped. Error: {}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Transcript close failed. Error: {}", e.getMessage(), e);
        }
    }
}
