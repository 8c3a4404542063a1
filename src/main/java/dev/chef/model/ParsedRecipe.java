package dev.chef.model;

import java.util.List;

/**
 * What the parser reads from one recipe, before loops are resolved.
 */
public record ParsedRecipe(
    String title,
    String comment,          // nullable
    List<Ingredient> ingredients,
    Integer cookingTime,     // nullable, minutes
    Integer ovenTemperature, // nullable, degrees Celsius
    Integer gasMark,         // nullable
    List<Instruction> instructions,
    Integer serves,          // nullable
    int lineNumber
) {
    public ParsedRecipe {
        ingredients = List.copyOf(ingredients);
        instructions = List.copyOf(instructions);
    }
}
