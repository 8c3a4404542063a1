package dev.chef.io;

/**
 * Collects served text in memory.
 */
public final class StringOutputSink implements OutputSink {

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public void write(String text) {
        buffer.append(text);
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
