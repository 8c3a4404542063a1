package dev.chef.io;

import java.util.NoSuchElementException;

/**
 * Where "Take ... from the refrigerator" gets its numbers.
 */
public interface InputSource {

    /**
     * Next value, in order.
     *
     * @throws NoSuchElementException if the input is exhausted
     * @throws IllegalArgumentException if the next token is not an integer
     */
    int nextValue();

    /** An input that is always exhausted. */
    static InputSource empty() {
        return () -> {
            throw new NoSuchElementException("no input available");
        };
    }
}
