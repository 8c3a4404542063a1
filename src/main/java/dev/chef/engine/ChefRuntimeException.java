package dev.chef.engine;

/**
 * A fatal condition while cooking, such as an empty bowl or division by zero.
 */
public class ChefRuntimeException extends ChefException {

    private final String recipeName;
    private final int instructionIndex;

    public ChefRuntimeException(String recipeName, int instructionIndex, String message) {
        super("Recipe '%s', step %d: %s".formatted(recipeName, instructionIndex + 1, message));
        this.recipeName = recipeName;
        this.instructionIndex = instructionIndex;
    }

    public ChefRuntimeException(String recipeName, int instructionIndex, String message, Throwable cause) {
        super("Recipe '%s', step %d: %s".formatted(recipeName, instructionIndex + 1, message), cause);
        this.recipeName = recipeName;
        this.instructionIndex = instructionIndex;
    }

    public String recipeName() { return recipeName; }

    /** Zero-based index of the failing instruction in its recipe. */
    public int instructionIndex() { return instructionIndex; }
}
