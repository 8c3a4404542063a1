package dev.chef.io;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Serves a fixed list of values.
 */
public final class ListInputSource implements InputSource {

    private final Iterator<Integer> values;

    public ListInputSource(List<Integer> values) {
        this.values = List.copyOf(values).iterator();
    }

    public static ListInputSource of(Integer... values) {
        return new ListInputSource(List.of(values));
    }

    @Override
    public int nextValue() {
        if (!values.hasNext()) {
            throw new NoSuchElementException("input exhausted");
        }
        return values.next();
    }
}
