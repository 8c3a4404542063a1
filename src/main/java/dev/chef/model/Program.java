package dev.chef.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A built program: every recipe by name, the first one being the main recipe.
 */
public record Program(Map<String, Recipe> recipes, String mainRecipe) {

    public Program {
        recipes = Collections.unmodifiableMap(new LinkedHashMap<>(recipes));
        if (!recipes.containsKey(mainRecipe)) {
            throw new IllegalArgumentException("Main recipe not found: " + mainRecipe);
        }
    }

    public Recipe main() {
        return recipes.get(mainRecipe);
    }

    public Optional<Recipe> recipe(String name) {
        return Optional.ofNullable(recipes.get(name));
    }
}
