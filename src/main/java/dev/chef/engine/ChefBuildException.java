package dev.chef.engine;

/**
 * A program that parses but is structurally inconsistent: unmatched loops,
 * calls to missing recipes and the like.
 */
public class ChefBuildException extends ChefException {

    private final String recipeName;

    /** A problem with the program as a whole rather than one recipe. */
    public ChefBuildException(String message) {
        super(message);
        this.recipeName = null;
    }

    public ChefBuildException(String recipeName, String message) {
        super("Recipe '%s': %s".formatted(recipeName, message));
        this.recipeName = recipeName;
    }

    /** The offending recipe, or null when the problem is not in one recipe. */
    public String recipeName() { return recipeName; }
}
