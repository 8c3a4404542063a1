package dev.chef.engine;

/**
 * Recipe text that does not follow the grammar. Parsing stops at the first one.
 */
public class ChefSyntaxException extends ChefException {

    private final int lineNumber;

    public ChefSyntaxException(int lineNumber, String message) {
        super("Line %d: %s".formatted(lineNumber, message));
        this.lineNumber = lineNumber;
    }

    public int lineNumber() { return lineNumber; }
}
