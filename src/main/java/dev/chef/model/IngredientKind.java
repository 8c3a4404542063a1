package dev.chef.model;

/**
 * How an ingredient's value is interpreted when served: dry ingredients print as
 * numbers, liquid ones as characters.
 */
public enum IngredientKind {
    DRY,
    LIQUID,
    EITHER;

    /** Whether a freshly read value of this kind starts out liquid. */
    public boolean startsLiquid() {
        return this == LIQUID;
    }
}
