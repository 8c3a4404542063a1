package dev.chef.engine;

/**
 * Base class of everything that can go wrong reading, building or running a recipe.
 */
public abstract class ChefException extends RuntimeException {

    protected ChefException(String message) {
        super(message);
    }

    protected ChefException(String message, Throwable cause) {
        super(message, cause);
    }
}
