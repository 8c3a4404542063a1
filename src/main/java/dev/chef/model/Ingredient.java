package dev.chef.model;

/**
 * A declared ingredient: the recipe's variable.
 */
public record Ingredient(
    String name,
    Integer initialValue, // nullable, read as 0 when the frame starts
    IngredientKind kind
) {
    public Value initialValueOrZero() {
        return new Value(initialValue == null ? 0 : initialValue, kind.startsLiquid());
    }
}
