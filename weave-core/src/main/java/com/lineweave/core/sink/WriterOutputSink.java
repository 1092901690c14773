package com.lineweave.core.sink;

import com.lineweave.core.PrettyPrintConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * 流式输出到 {@link Writer}，IO 异常包装为 {@link UncheckedIOException}。
 */
public class WriterOutputSink implements OutputSink {
    private final Writer writer;
    private final PrettyPrintConfig config;
    private int pendingBlanks = 0;

    public WriterOutputSink(Writer writer, PrettyPrintConfig config) {
        this.writer = writer;
        this.config = config;
    }

    @Override
    public void text(String text) {
        if (text.isEmpty()) return;
        try {
            for (; pendingBlanks > 0; pendingBlanks--) {
                writer.write(' ');
            }
            writer.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void blanks(int count) {
        pendingBlanks += Math.max(count, 0);
    }

    @Override
    public void newline(int indent) {
        pendingBlanks = 0;
        try {
            writer.write(config.getLineSeparator());
            writer.write(config.getIndentString(Math.max(indent, 0)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void flush() {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
