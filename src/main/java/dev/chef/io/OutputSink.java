package dev.chef.io;

/**
 * Receives served text in the order it is served.
 */
public interface OutputSink {

    void write(String text);

    /** Called once when a program finishes, normally or not. */
    default void flush() {}
}
