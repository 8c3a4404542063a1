package dev.chef.io;

import java.io.PrintWriter;

/**
 * Writes served text to a {@link PrintWriter}.
 */
public final class WriterOutputSink implements OutputSink {

    private final PrintWriter writer;

    public WriterOutputSink(PrintWriter writer) {
        this.writer = writer;
    }

    @Override
    public void write(String text) {
        writer.print(text);
    }

    @Override
    public void flush() {
        writer.flush();
    }
}
