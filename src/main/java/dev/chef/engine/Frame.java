package dev.chef.engine;

import dev.chef.model.Ingredient;
import dev.chef.model.IngredientKind;
import dev.chef.model.Recipe;
import dev.chef.model.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Mutable state of one recipe invocation: its bowls, dishes, ingredients and
 * instruction pointer.
 */
public final class Frame {
    private final Recipe recipe;
    private final int depth;
    private final SortedMap<Integer, ValueStack> bowls = new TreeMap<>();
    private final SortedMap<Integer, ValueStack> dishes = new TreeMap<>();
    private final Map<String, Binding> ingredients = new LinkedHashMap<>();
    private int pointer;

    public Frame(Recipe recipe, int depth) {
        this.recipe = recipe;
        this.depth = depth;
        for (Ingredient ingredient : recipe.ingredients()) {
            ingredients.put(ingredient.name(), new Binding(ingredient.kind(), ingredient.initialValueOrZero()));
        }
    }

    public Recipe recipe() { return recipe; }
    public int depth() { return depth; }
    public int pointer() { return pointer; }

    public void jumpTo(int index) { this.pointer = index; }
    public void advance() { this.pointer++; }

    public boolean finished() {
        return pointer >= recipe.instructions().size();
    }

    /** Mixing bowl {@code n}, created empty on first use. */
    public ValueStack bowl(int n) {
        return bowls.computeIfAbsent(n, k -> new ValueStack());
    }

    /** Baking dish {@code n}, created empty on first use. */
    public ValueStack dish(int n) {
        return dishes.computeIfAbsent(n, k -> new ValueStack());
    }

    public SortedMap<Integer, ValueStack> bowls() {
        return Collections.unmodifiableSortedMap(bowls);
    }

    /**
     * @throws IllegalArgumentException if the recipe never declared the ingredient
     */
    public Value valueOf(String ingredient) {
        return binding(ingredient).value;
    }

    public IngredientKind kindOf(String ingredient) {
        return binding(ingredient).kind;
    }

    public void setValue(String ingredient, Value value) {
        binding(ingredient).value = value;
    }

    /** Sum of the numbers held by every dry ingredient. */
    public int dryTotal() {
        int total = 0;
        for (Binding binding : ingredients.values()) {
            if (binding.kind == IngredientKind.DRY) {
                total += binding.value.number();
            }
        }
        return total;
    }

    /** Start with a copy of every bowl {@code caller} has used so far. */
    public void copyBowlsFrom(Frame caller) {
        caller.bowls.forEach((n, bowl) -> bowls.put(n, bowl.copy()));
    }

    /** Overwrite {@code caller}'s bowls with this frame's bowls of the same number. */
    public void copyBowlsInto(Frame caller) {
        bowls.forEach((n, bowl) -> caller.bowls.put(n, bowl.copy()));
    }

    private Binding binding(String ingredient) {
        Binding binding = ingredients.get(ingredient);
        if (binding == null) {
            throw new IllegalArgumentException("unknown ingredient '" + ingredient + "'");
        }
        return binding;
    }

    private static final class Binding {
        final IngredientKind kind;
        Value value;

        Binding(IngredientKind kind, Value value) {
            this.kind = kind;
            this.value = value;
        }
    }
}
