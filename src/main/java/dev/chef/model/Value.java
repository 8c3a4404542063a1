package dev.chef.model;

import java.util.Objects;

/**
 * A number held by an ingredient, a mixing bowl or a baking dish, tagged with
 * whether it is served as a character.
 * <p>
 * Putting an ingredient into a bowl shares its current cell, so liquefying the
 * ingredient also liquefies the copies already in bowls. The flag only ever goes
 * from dry to liquid. Anything that computes a new number gets a new cell.
 */
public final class Value {

    private final int number;
    private boolean liquid;

    public Value(int number, boolean liquid) {
        this.number = number;
        this.liquid = liquid;
    }

    public static Value dry(int number) {
        return new Value(number, false);
    }

    public static Value liquid(int number) {
        return new Value(number, true);
    }

    public int number() { return number; }
    public boolean liquid() { return liquid; }

    /** Serve as a character from now on, wherever this cell is held. */
    public void liquefy() {
        this.liquid = true;
    }

    /** A new cell with the same number, served as a character. */
    public Value liquefied() {
        return new Value(number, true);
    }

    /** A new cell with the same liquid flag and a different number. */
    public Value withNumber(int newNumber) {
        return new Value(newNumber, liquid);
    }

    /** A new cell in the same state, unaffected by later changes to this one. */
    public Value copy() {
        return new Value(number, liquid);
    }

    /**
     * Text emitted when this value is served.
     *
     * @throws IllegalArgumentException if a liquid value is not a valid code point
     */
    public String render() {
        if (!liquid) {
            return Integer.toString(number);
        }
        if (!Character.isValidCodePoint(number)) {
            throw new IllegalArgumentException("Not a valid character code: " + number);
        }
        return new String(Character.toChars(number));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value other)) return false;
        return number == other.number && liquid == other.liquid;
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, liquid);
    }

    @Override
    public String toString() {
        return "Value[number=" + number + ", liquid=" + liquid + "]";
    }
}
