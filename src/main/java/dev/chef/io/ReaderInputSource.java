package dev.chef.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;

/**
 * Reads whitespace-separated integers from a character stream, one line at a
 * time and only as they are needed.
 */
public final class ReaderInputSource implements InputSource {

    private final BufferedReader reader;
    private final Deque<String> pending = new ArrayDeque<>();

    public ReaderInputSource(Reader reader) {
        this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
    }

    @Override
    public int nextValue() {
        while (pending.isEmpty()) {
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read input", e);
            }
            if (line == null) {
                throw new NoSuchElementException("input exhausted");
            }
            for (String token : line.strip().split("\\s+")) {
                if (!token.isEmpty()) {
                    pending.add(token);
                }
            }
        }
        String token = pending.poll();
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("input '" + token + "' is not an integer", e);
        }
    }
}
