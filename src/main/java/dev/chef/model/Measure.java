package dev.chef.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The measurement units an ingredient line may declare.
 */
public enum Measure {
    G("g", IngredientKind.DRY),
    KG("kg", IngredientKind.DRY),
    PINCH("pinch", IngredientKind.DRY),
    PINCHES("pinches", IngredientKind.DRY),
    ML("ml", IngredientKind.LIQUID),
    L("l", IngredientKind.LIQUID),
    DASH("dash", IngredientKind.LIQUID),
    DASHES("dashes", IngredientKind.LIQUID),
    CUP("cup", IngredientKind.EITHER),
    CUPS("cups", IngredientKind.EITHER),
    TEASPOON("teaspoon", IngredientKind.EITHER),
    TEASPOONS("teaspoons", IngredientKind.EITHER),
    TABLESPOON("tablespoon", IngredientKind.EITHER),
    TABLESPOONS("tablespoons", IngredientKind.EITHER);

    private static final Map<String, Measure> BY_TOKEN = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Measure::token, Function.identity()));

    private final String token;
    private final IngredientKind kind;

    Measure(String token, IngredientKind kind) {
        this.token = token;
        this.kind = kind;
    }

    public String token() { return token; }

    public IngredientKind kind() { return kind; }

    /**
     * Kind of an ingredient measured in this unit. A heaped or level measure is
     * always dry.
     */
    public IngredientKind kind(boolean heapedOrLevel) {
        return heapedOrLevel ? IngredientKind.DRY : kind;
    }

    public static Optional<Measure> fromToken(String token) {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }
}
