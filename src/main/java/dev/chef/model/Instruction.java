package dev.chef.model;

/**
 * A single method step. Exactly one of the forms below.
 * <p>
 * Bowl and dish numbers start at 1. Loop and break targets are indices into the
 * owning recipe's instruction list and stay {@link #UNRESOLVED} until the
 * program is built.
 */
public sealed interface Instruction {

    int UNRESOLVED = -1;

    /** Take an ingredient from the refrigerator: read one input value. */
    record Read(String ingredient) implements Instruction {}

    /** Put an ingredient into a mixing bowl. */
    record Push(String ingredient, int bowl) implements Instruction {}

    /** Fold the top of a mixing bowl into an ingredient. */
    record Pop(int bowl, String ingredient) implements Instruction {}

    /** Combines the top of a bowl with an ingredient, replacing the top. */
    sealed interface Arithmetic extends Instruction {
        String ingredient();

        int bowl();

        int apply(int top, int operand);
    }

    record Add(String ingredient, int bowl) implements Arithmetic {
        @Override
        public int apply(int top, int operand) { return top + operand; }
    }

    record Subtract(String ingredient, int bowl) implements Arithmetic {
        @Override
        public int apply(int top, int operand) { return top - operand; }
    }

    record Multiply(String ingredient, int bowl) implements Arithmetic {
        @Override
        public int apply(int top, int operand) { return top * operand; }
    }

    record Divide(String ingredient, int bowl) implements Arithmetic {
        @Override
        public int apply(int top, int operand) { return top / operand; }
    }

    /** Push the sum of all dry ingredients. */
    record AddDry(int bowl) implements Instruction {}

    record Liquefy(String ingredient) implements Instruction {}

    record LiquefyContents(int bowl) implements Instruction {}

    /** Sink the top of a bowl by a fixed number of places. */
    record Stir(int minutes, int bowl) implements Instruction {}

    /** Sink the top of a bowl by the value of an ingredient. */
    record StirIngredient(String ingredient, int bowl) implements Instruction {}

    /** Shuffle a bowl. */
    record Mix(int bowl) implements Instruction {}

    record ClearStack(int bowl) implements Instruction {}

    /** Pour a mixing bowl's contents on top of a baking dish. */
    record CopyStack(int bowl, int dish) implements Instruction {}

    /**
     * Opens a loop on {@code ingredient}. {@code keyword} is the past form that
     * closes it, derived from {@code verb} when the program is built.
     */
    record LoopStart(String verb, String ingredient, String keyword, int end) implements Instruction {

        public LoopStart(String verb, String ingredient) {
            this(verb, ingredient, null, UNRESOLVED);
        }

        public LoopStart resolved(String closingKeyword, int endIndex) {
            return new LoopStart(verb, ingredient, closingKeyword, endIndex);
        }
    }

    /** Closes a loop, optionally counting {@code ingredient} down by one. */
    record LoopEnd(String verb, String ingredient, String keyword, int start) implements Instruction {

        public LoopEnd(String verb, String ingredient, String keyword) {
            this(verb, ingredient, keyword, UNRESOLVED);
        }

        public LoopEnd resolved(int startIndex) {
            return new LoopEnd(verb, ingredient, keyword, startIndex);
        }
    }

    /** Set aside: leave the innermost enclosing loop. */
    record Break(int loopEnd) implements Instruction {

        public Break() {
            this(UNRESOLVED);
        }

        public Break resolved(int loopEndIndex) {
            return new Break(loopEndIndex);
        }
    }

    /** Serve with another recipe. */
    record Call(String recipe) implements Instruction {}

    /** Refrigerate, optionally for a number of hours. */
    record Return(Integer hours) implements Instruction {}

    /** Serve the first {@code dishes} baking dishes. */
    record PrintStacks(int dishes) implements Instruction {}
}
