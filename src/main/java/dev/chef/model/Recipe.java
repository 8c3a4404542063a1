package dev.chef.model;

import java.util.List;
import java.util.Optional;

/**
 * A recipe is a named procedure: its ingredients are its variables and its
 * method is a list of instructions with loop targets resolved.
 */
public record Recipe(
    String name,
    List<Ingredient> ingredients,
    List<Instruction> instructions
) {
    public Recipe {
        ingredients = List.copyOf(ingredients);
        instructions = List.copyOf(instructions);
    }

    public Optional<Ingredient> ingredient(String ingredientName) {
        return ingredients.stream().filter(i -> i.name().equals(ingredientName)).findFirst();
    }
}
