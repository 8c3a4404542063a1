package dev.chef.engine;

import dev.chef.model.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * A mixing bowl or baking dish: a stack of values, top last.
 */
public final class ValueStack {

    private final List<Value> values;

    public ValueStack() {
        this.values = new ArrayList<>();
    }

    public boolean isEmpty() { return values.isEmpty(); }

    public int size() { return values.size(); }

    public void push(Value value) {
        values.add(value);
    }

    /**
     * @throws IllegalStateException if the stack is empty
     */
    public Value pop() {
        requireNotEmpty();
        return values.remove(values.size() - 1);
    }

    /**
     * @throws IllegalStateException if the stack is empty
     */
    public Value peek() {
        requireNotEmpty();
        return values.get(values.size() - 1);
    }

    /** Swap the top value for another. */
    public void replaceTop(Value value) {
        requireNotEmpty();
        values.set(values.size() - 1, value);
    }

    /**
     * Move the top value {@code depth} places down; to the bottom if the stack
     * is not that deep.
     */
    public void stir(int depth) {
        Value top = pop();
        int index = values.size() - Math.max(depth, 0);
        values.add(Math.max(index, 0), top);
    }

    public void shuffle(Random random) {
        Collections.shuffle(values, random);
    }

    /** Liquefies the bowl's own cells; ingredients put in earlier keep theirs. */
    public void liquefyAll() {
        values.replaceAll(Value::liquefied);
    }

    public void clear() {
        values.clear();
    }

    /** Put a copy of {@code other}'s contents on top of this stack, keeping their order. */
    public void pourFrom(ValueStack other) {
        values.addAll(other.values);
    }

    /** An independent stack holding copies of this stack's cells. */
    public ValueStack copy() {
        var copy = new ValueStack();
        for (Value value : values) {
            copy.values.add(value.copy());
        }
        return copy;
    }

    /** Contents bottom to top. */
    public List<Value> contents() {
        return List.copyOf(values);
    }

    private void requireNotEmpty() {
        if (values.isEmpty()) {
            throw new IllegalStateException("empty");
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
